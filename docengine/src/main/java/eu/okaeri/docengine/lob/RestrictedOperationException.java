package eu.okaeri.docengine.lob;

import eu.okaeri.docengine.DatabaseException;
import lombok.Getter;

/**
 * Bulk update touching a large-object field. Raised before anything is written.
 */
@Getter
public class RestrictedOperationException extends DatabaseException {

    private final String field;

    public RestrictedOperationException(String field) {
        super("Updates on large-object fields are not allowed (field: " + field + ")");
        this.field = field;
    }
}
