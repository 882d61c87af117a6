package eu.okaeri.docengine.collection;

import eu.okaeri.docengine.index.IndexSpec;
import org.bson.Document;

import java.util.List;
import java.util.Map;

/**
 * Thin collection handle. Write methods receive the resolved write-concern flags of the
 * operation as {@code options}; {@link #update} additionally reads {@code multi}.
 */
public interface DocumentCollection {

    String getName();

    // ==================== WRITE OPERATIONS ====================

    /**
     * Inserts a new document, assigning an {@code _id} when missing.
     *
     * @return the document id
     */
    Object insert(Document document, Map<String, Object> options);

    /**
     * Inserts or replaces the document by its {@code _id}.
     *
     * @return the document id
     */
    Object save(Document document, Map<String, Object> options);

    /**
     * Applies the update document to the first match, or to all matches when {@code multi} is set.
     *
     * @return number of matched documents
     */
    long update(Document filter, Document update, Map<String, Object> options);

    /**
     * @return number of removed documents
     */
    long remove(Document filter, Map<String, Object> options);

    // ==================== READ OPERATIONS ====================

    /**
     * @param sort  sort document or null
     * @param skip  documents to skip, 0 for none
     * @param limit max documents, 0 for no limit
     */
    List<Document> find(Document filter, Document sort, int skip, int limit);

    default List<Document> find(Document filter) {
        return this.find(filter, null, 0, 0);
    }

    long count(Document filter);

    // ==================== INDEXES ====================

    /**
     * Live indexes by name, including the implicit {@code _id_} index.
     */
    Map<String, IndexSpec> indexInformation();

    void createIndex(IndexSpec index);

    void drop();
}
