package eu.okaeri.docengine.document;

import eu.okaeri.docengine.DatabaseException;
import lombok.Getter;

/**
 * Primary key value that is not a valid ObjectId.
 */
@Getter
public class InvalidIdentifierException extends DatabaseException {

    private final Object value;

    public InvalidIdentifierException(Object value, String hint) {
        super(message(value, hint));
        this.value = value;
    }

    private static String message(Object value, String hint) {
        String rendered = (value instanceof CharSequence) ? ("'" + value + "'") : String.valueOf(value);
        String message = "AutoField (default primary key) values must be strings representing an ObjectId on MongoDB (got " + rendered + " instead)";
        return ((hint == null) || hint.isEmpty()) ? message : (message + ". " + hint);
    }
}
