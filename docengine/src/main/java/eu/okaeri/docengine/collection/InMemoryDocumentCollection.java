package eu.okaeri.docengine.collection;

import eu.okaeri.docengine.index.IndexKey;
import eu.okaeri.docengine.index.IndexSpec;
import lombok.Getter;
import lombok.NonNull;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collection kept in memory. Documents are copied on the way in and out so callers never share state
 * with the store. Unique indexes are enforced, sparse ones skip documents missing the key.
 */
public class InMemoryDocumentCollection implements DocumentCollection {

    private static final String ID_INDEX = "_id_";

    private final @Getter String name;
    private final List<Document> documents = new ArrayList<>();
    private final Map<String, IndexSpec> indexes = new LinkedHashMap<>();

    public InMemoryDocumentCollection(@NonNull String name) {
        this.name = name;
        this.indexes.put(ID_INDEX, IndexSpec.named(ID_INDEX, Collections.singletonList(IndexKey.asc("_id")), false, false));
    }

    // ==================== WRITE OPERATIONS ====================

    @Override
    public synchronized Object insert(@NonNull Document document, @NonNull Map<String, Object> options) {
        Document copy = DocumentMatcher.copy(document);
        if (!copy.containsKey("_id")) {
            copy.put("_id", new ObjectId());
            document.put("_id", copy.get("_id"));
        }
        if (this.indexOf(copy.get("_id")) != -1) {
            throw new DuplicateKeyException(this.name, ID_INDEX, copy.get("_id"));
        }
        this.checkUnique(copy, -1);
        this.documents.add(copy);
        return copy.get("_id");
    }

    @Override
    public synchronized Object save(@NonNull Document document, @NonNull Map<String, Object> options) {
        if (!document.containsKey("_id")) {
            return this.insert(document, options);
        }
        int index = this.indexOf(document.get("_id"));
        if (index == -1) {
            return this.insert(document, options);
        }
        Document copy = DocumentMatcher.copy(document);
        this.checkUnique(copy, index);
        this.documents.set(index, copy);
        return copy.get("_id");
    }

    @Override
    public synchronized long update(@NonNull Document filter, @NonNull Document update, @NonNull Map<String, Object> options) {
        boolean multi = Boolean.TRUE.equals(options.get("multi"));
        long matched = 0;
        for (int index = 0; index < this.documents.size(); index++) {
            Document current = this.documents.get(index);
            if (!DocumentMatcher.matches(current, filter)) {
                continue;
            }
            Document updated = DocumentMatcher.copy(current);
            this.apply(updated, update);
            this.checkUnique(updated, index);
            this.documents.set(index, updated);
            matched++;
            if (!multi) {
                break;
            }
        }
        return matched;
    }

    @Override
    public synchronized long remove(@NonNull Document filter, @NonNull Map<String, Object> options) {
        int before = this.documents.size();
        this.documents.removeIf(document -> DocumentMatcher.matches(document, filter));
        return before - this.documents.size();
    }

    // ==================== READ OPERATIONS ====================

    @Override
    public synchronized List<Document> find(@NonNull Document filter, Document sort, int skip, int limit) {
        Stream<Document> stream = this.documents.stream()
            .filter(document -> DocumentMatcher.matches(document, filter));
        if ((sort != null) && !sort.isEmpty()) {
            stream = stream.sorted(this.comparator(sort));
        }
        if (skip > 0) {
            stream = stream.skip(skip);
        }
        if (limit > 0) {
            stream = stream.limit(limit);
        }
        return stream.map(DocumentMatcher::copy).collect(Collectors.toList());
    }

    @Override
    public synchronized long count(@NonNull Document filter) {
        return this.documents.stream()
            .filter(document -> DocumentMatcher.matches(document, filter))
            .count();
    }

    // ==================== INDEXES ====================

    @Override
    public synchronized Map<String, IndexSpec> indexInformation() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(this.indexes));
    }

    @Override
    public synchronized void createIndex(@NonNull IndexSpec index) {
        IndexSpec existing = this.indexes.get(index.getName());
        if (existing != null) {
            if (!existing.isEquivalent(index)) {
                throw new IllegalStateException("Index with name: " + index.getName() + " already exists with different options");
            }
            return;
        }
        if (index.isUnique()) {
            this.checkUnique(index, this.documents);
        }
        this.indexes.put(index.getName(), index);
    }

    @Override
    public synchronized void drop() {
        this.documents.clear();
        this.indexes.keySet().removeIf(name -> !ID_INDEX.equals(name));
    }

    // ==================== HELPERS ====================

    private int indexOf(Object id) {
        for (int index = 0; index < this.documents.size(); index++) {
            if (DocumentMatcher.valueEquals(this.documents.get(index).get("_id"), id)) {
                return index;
            }
        }
        return -1;
    }

    private void checkUnique(Document candidate, int ignoredIndex) {
        for (IndexSpec index : this.indexes.values()) {
            if (!index.isUnique()) {
                continue;
            }
            List<Object> key = this.keyOf(candidate, index);
            if (key == null) {
                continue;
            }
            for (int position = 0; position < this.documents.size(); position++) {
                if ((position != ignoredIndex) && DocumentMatcher.valueEquals(key, this.keyOf(this.documents.get(position), index))) {
                    throw new DuplicateKeyException(this.name, index.getName(), key);
                }
            }
        }
    }

    private void checkUnique(IndexSpec index, List<Document> documents) {
        List<List<Object>> seen = new ArrayList<>();
        for (Document document : documents) {
            List<Object> key = this.keyOf(document, index);
            if (key == null) {
                continue;
            }
            for (List<Object> other : seen) {
                if (DocumentMatcher.valueEquals(key, other)) {
                    throw new DuplicateKeyException(this.name, index.getName(), key);
                }
            }
            seen.add(key);
        }
    }

    /**
     * @return key values of the document, null when a sparse index does not cover it
     */
    private List<Object> keyOf(Document document, IndexSpec index) {
        List<Object> key = new ArrayList<>();
        boolean anyPresent = false;
        for (IndexKey indexKey : index.getKeys()) {
            Object value = this.valueAt(document, indexKey.getColumn());
            anyPresent |= (value != null);
            key.add(value);
        }
        return (index.isSparse() && !anyPresent) ? null : key;
    }

    private Object valueAt(Map<String, Object> document, String path) {
        Object current = document;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
        }
        return current;
    }

    private Comparator<Document> comparator(Document sort) {
        Comparator<Document> comparator = null;
        for (Map.Entry<String, Object> entry : sort.entrySet()) {
            int direction = ((Number) entry.getValue()).intValue();
            Comparator<Document> field = (left, right) -> {
                Integer comparison = DocumentMatcher.compare(this.valueAt(left, entry.getKey()), this.valueAt(right, entry.getKey()));
                if (comparison == null) {
                    // missing values sort first, as null does in the store
                    boolean leftMissing = this.valueAt(left, entry.getKey()) == null;
                    boolean rightMissing = this.valueAt(right, entry.getKey()) == null;
                    comparison = Boolean.compare(!leftMissing, !rightMissing);
                }
                return comparison * direction;
            };
            comparator = (comparator == null) ? field : comparator.thenComparing(field);
        }
        return comparator;
    }

    @SuppressWarnings("unchecked")
    private void apply(Document document, Document update) {
        for (Map.Entry<String, Object> entry : update.entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                throw new IllegalArgumentException("update operator " + entry.getKey() + " requires a document");
            }
            Map<String, Object> fields = (Map<String, Object>) entry.getValue();
            switch (entry.getKey()) {
                case "$set":
                    fields.forEach((path, value) -> this.parentOf(document, path, true).put(this.leafOf(path), DocumentMatcher.copyValue(value)));
                    break;
                case "$unset":
                    fields.keySet().forEach(path -> {
                        Map<String, Object> parent = this.parentOf(document, path, false);
                        if (parent != null) {
                            parent.remove(this.leafOf(path));
                        }
                    });
                    break;
                case "$inc":
                    fields.forEach((path, delta) -> {
                        Map<String, Object> parent = this.parentOf(document, path, true);
                        Object current = parent.get(this.leafOf(path));
                        if ((current != null) && !(current instanceof Number)) {
                            throw new IllegalArgumentException("Cannot apply $inc to a value of non-numeric type at " + path);
                        }
                        parent.put(this.leafOf(path), add((Number) current, (Number) delta));
                    });
                    break;
                default:
                    throw new UnsupportedOperationException("unsupported update operator: " + entry.getKey());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> parentOf(Map<String, Object> document, String path, boolean create) {
        String[] parts = path.split("\\.");
        Map<String, Object> current = document;
        for (int index = 0; index < (parts.length - 1); index++) {
            Object next = current.get(parts[index]);
            if (!(next instanceof Map)) {
                if (!create) {
                    return null;
                }
                next = new Document();
                current.put(parts[index], next);
            }
            current = (Map<String, Object>) next;
        }
        return current;
    }

    private String leafOf(String path) {
        int index = path.lastIndexOf('.');
        return (index == -1) ? path : path.substring(index + 1);
    }

    private static Number add(Number current, Number delta) {
        if (current == null) {
            return delta;
        }
        if ((current instanceof Double) || (delta instanceof Double) || (current instanceof Float) || (delta instanceof Float)) {
            return current.doubleValue() + delta.doubleValue();
        }
        if ((current instanceof Decimal128) || (delta instanceof Decimal128)) {
            return new Decimal128(decimal(current).add(decimal(delta)));
        }
        if ((current instanceof BigDecimal) || (delta instanceof BigDecimal)) {
            return decimal(current).add(decimal(delta));
        }
        if ((current instanceof Long) || (delta instanceof Long)) {
            return current.longValue() + delta.longValue();
        }
        return current.intValue() + delta.intValue();
    }

    private static BigDecimal decimal(Number value) {
        return (value instanceof Decimal128) ? ((Decimal128) value).bigDecimalValue() : new BigDecimal(value.toString());
    }
}
