package eu.okaeri.docengine.lob;

/**
 * Value of a large-object field on one model instance.
 */
public interface LargeObjectField {

    /**
     * Cached or assigned value, fetching the payload on first access of a persisted field.
     * Large text fields read {@code ""} and large file fields read {@code null} when unset.
     */
    Object get();

    /**
     * Assigns {@code byte[]}, {@code String}, {@code InputStream} or {@link LargeObjectFile}; the value is kept
     * as is until saved. An {@link org.bson.types.ObjectId} binds an existing payload when none is bound yet.
     */
    void set(Object value);

    boolean isCached();
}
