package eu.okaeri.docengine.collection;

import eu.okaeri.docengine.DatabaseException;
import lombok.Getter;

/**
 * Write rejected by a unique index of the in-memory backend.
 */
@Getter
public class DuplicateKeyException extends DatabaseException {

    private final String indexName;

    public DuplicateKeyException(String collection, String indexName, Object key) {
        super("E11000 duplicate key error collection: " + collection + " index: " + indexName + " dup key: " + key);
        this.indexName = indexName;
    }
}
