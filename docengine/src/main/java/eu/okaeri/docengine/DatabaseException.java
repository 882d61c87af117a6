package eu.okaeri.docengine;

/**
 * Base type of every error raised by the engine before or while talking to the store.
 * Driver-level failures are never wrapped into this type, they propagate unchanged.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
