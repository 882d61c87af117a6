package eu.okaeri.docengine.filter;

import eu.okaeri.docengine.DatabaseException;
import lombok.Getter;

/**
 * Predicate the document store cannot evaluate. Raised during translation, before any store call.
 */
@Getter
public class UnsupportedQueryException extends DatabaseException {

    private final String field;

    public UnsupportedQueryException(String message, String field) {
        super(message + " (field: " + field + ")");
        this.field = field;
    }
}
