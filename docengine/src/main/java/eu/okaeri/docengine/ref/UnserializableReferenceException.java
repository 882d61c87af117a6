package eu.okaeri.docengine.ref;

import eu.okaeri.docengine.DatabaseException;
import lombok.Getter;

/**
 * Model instance found inside raw data while automatic referencing is disabled.
 */
@Getter
public class UnserializableReferenceException extends DatabaseException {

    private final String field;

    public UnserializableReferenceException(String field, Object value) {
        super("cannot encode object: " + value + " in field '" + field + "', enable AUTOMATIC_REFERENCING to store model instances as references");
        this.field = field;
    }
}
