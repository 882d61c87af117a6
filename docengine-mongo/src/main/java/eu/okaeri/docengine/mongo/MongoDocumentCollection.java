package eu.okaeri.docengine.mongo;

import com.mongodb.MongoCommandException;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.ReplaceOptions;
import eu.okaeri.docengine.collection.DocumentCollection;
import eu.okaeri.docengine.connection.OperationFlags;
import eu.okaeri.docengine.index.IndexDirection;
import eu.okaeri.docengine.index.IndexKey;
import eu.okaeri.docengine.index.IndexSpec;
import lombok.Getter;
import lombok.NonNull;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * {@link DocumentCollection} backed by a driver collection. Write flags become the write concern of each call.
 */
public class MongoDocumentCollection implements DocumentCollection {

    private static final Logger LOGGER = Logger.getLogger(MongoDocumentCollection.class.getSimpleName());
    private static final ReplaceOptions REPLACE_OPTIONS = new ReplaceOptions().upsert(true);

    // IndexOptionsConflict, IndexKeySpecsConflict
    private static final int INDEX_OPTIONS_CONFLICT = 85;
    private static final int INDEX_KEY_SPECS_CONFLICT = 86;

    private final @Getter MongoCollection<Document> mongo;

    public MongoDocumentCollection(@NonNull MongoCollection<Document> mongo) {
        this.mongo = mongo;
    }

    @Override
    public String getName() {
        return this.mongo.getNamespace().getCollectionName();
    }

    private MongoCollection<Document> mongo(Map<String, Object> options) {
        return options.isEmpty() ? this.mongo : this.mongo.withWriteConcern(WriteConcerns.of(options));
    }

    // ==================== WRITE OPERATIONS ====================

    @Override
    public Object insert(@NonNull Document document, @NonNull Map<String, Object> options) {
        this.mongo(options).insertOne(document);
        return document.get("_id");
    }

    @Override
    public Object save(@NonNull Document document, @NonNull Map<String, Object> options) {
        if (document.get("_id") == null) {
            return this.insert(document, options);
        }
        this.mongo(options).replaceOne(Filters.eq("_id", document.get("_id")), document, REPLACE_OPTIONS);
        return document.get("_id");
    }

    @Override
    public long update(@NonNull Document filter, @NonNull Document update, @NonNull Map<String, Object> options) {
        MongoCollection<Document> collection = this.mongo(writeFlags(options));
        return Boolean.TRUE.equals(options.get(OperationFlags.MULTI))
            ? collection.updateMany(filter, update).getMatchedCount()
            : collection.updateOne(filter, update).getMatchedCount();
    }

    @Override
    public long remove(@NonNull Document filter, @NonNull Map<String, Object> options) {
        return this.mongo(options).deleteMany(filter).getDeletedCount();
    }

    // ==================== READ OPERATIONS ====================

    @Override
    public List<Document> find(@NonNull Document filter, Document sort, int skip, int limit) {
        FindIterable<Document> iterable = this.mongo.find(filter);
        if ((sort != null) && !sort.isEmpty()) {
            iterable = iterable.sort(sort);
        }
        if (skip > 0) {
            iterable = iterable.skip(skip);
        }
        if (limit > 0) {
            iterable = iterable.limit(limit);
        }
        return iterable.into(new ArrayList<>());
    }

    @Override
    public long count(@NonNull Document filter) {
        return this.mongo.countDocuments(filter);
    }

    // ==================== INDEXES ====================

    /**
     * Ascending and descending indexes by name. Special indexes (text, hashed, geo) are not reported.
     */
    @Override
    public Map<String, IndexSpec> indexInformation() {
        Map<String, IndexSpec> indexes = new LinkedHashMap<>();
        for (Document index : this.mongo.listIndexes()) {
            String name = index.getString("name");
            Document key = index.get("key", Document.class);
            List<IndexKey> keys = new ArrayList<>();
            for (Map.Entry<String, Object> entry : key.entrySet()) {
                if (!(entry.getValue() instanceof Number)) {
                    keys = null;
                    break;
                }
                keys.add(IndexKey.of(entry.getKey(), IndexDirection.of(((Number) entry.getValue()).intValue())));
            }
            if (keys == null) {
                LOGGER.fine("[" + this.getName() + "] Skipping special index " + name + " " + key.toJson());
                continue;
            }
            indexes.put(name, IndexSpec.named(name, keys, index.getBoolean("unique", false), index.getBoolean("sparse", false)));
        }
        return Collections.unmodifiableMap(indexes);
    }

    @Override
    public void createIndex(@NonNull IndexSpec index) {
        Document keys = new Document();
        for (IndexKey key : index.getKeys()) {
            keys.put(key.getColumn(), key.getDirection().getValue());
        }
        IndexOptions options = new IndexOptions()
            .name(index.getName())
            .unique(index.isUnique())
            .sparse(index.isSparse());
        try {
            this.mongo.createIndex(keys, options);
        } catch (MongoCommandException exception) {
            int code = exception.getErrorCode();
            if ((code == INDEX_OPTIONS_CONFLICT) || (code == INDEX_KEY_SPECS_CONFLICT)) {
                throw new IllegalStateException(exception.getErrorMessage(), exception);
            }
            throw exception;
        }
    }

    @Override
    public void drop() {
        this.mongo.drop();
    }

    private static Map<String, Object> writeFlags(Map<String, Object> options) {
        if (!options.containsKey(OperationFlags.MULTI)) {
            return options;
        }
        Map<String, Object> flags = new LinkedHashMap<>(options);
        flags.remove(OperationFlags.MULTI);
        return flags;
    }

    @Override
    public String toString() {
        return "MongoDocumentCollection(" + this.getName() + ")";
    }
}
