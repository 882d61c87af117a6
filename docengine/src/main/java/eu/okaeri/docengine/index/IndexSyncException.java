package eu.okaeri.docengine.index;

import eu.okaeri.docengine.DatabaseException;
import lombok.Getter;

/**
 * Planned index conflicts with an index that already exists under the same name or keys.
 */
@Getter
public class IndexSyncException extends DatabaseException {

    private final String collection;
    private final String indexName;

    public IndexSyncException(String collection, String indexName, String reason) {
        super("Cannot synchronize index " + indexName + " of " + collection + ": " + reason);
        this.collection = collection;
        this.indexName = indexName;
    }

    public IndexSyncException(String collection, String indexName, Throwable cause) {
        super("Cannot synchronize index " + indexName + " of " + collection + ": " + cause.getMessage(), cause);
        this.collection = collection;
        this.indexName = indexName;
    }
}
