package eu.okaeri.docengine.fixture;

import eu.okaeri.docengine.collection.CollectionDecorator;
import eu.okaeri.docengine.collection.DocumentCollection;
import eu.okaeri.docengine.index.IndexSpec;
import lombok.Data;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.bson.Document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delegating collection that records every write with the options it was called with.
 * Install through a connection's collection decorator with {@link #decorator(List)}.
 */
@RequiredArgsConstructor
public class RecordingDocumentCollection implements DocumentCollection {

    private final DocumentCollection delegate;
    private final @Getter List<Call> calls;

    public static CollectionDecorator decorator(List<Call> calls) {
        return collection -> new RecordingDocumentCollection(collection, calls);
    }

    @Override
    public String getName() {
        return this.delegate.getName();
    }

    @Override
    public Object insert(Document document, Map<String, Object> options) {
        this.calls.add(new Call("insert", new LinkedHashMap<>(options)));
        return this.delegate.insert(document, options);
    }

    @Override
    public Object save(Document document, Map<String, Object> options) {
        this.calls.add(new Call("save", new LinkedHashMap<>(options)));
        return this.delegate.save(document, options);
    }

    @Override
    public long update(Document filter, Document update, Map<String, Object> options) {
        this.calls.add(new Call("update", new LinkedHashMap<>(options)));
        return this.delegate.update(filter, update, options);
    }

    @Override
    public long remove(Document filter, Map<String, Object> options) {
        this.calls.add(new Call("remove", new LinkedHashMap<>(options)));
        return this.delegate.remove(filter, options);
    }

    @Override
    public List<Document> find(Document filter, Document sort, int skip, int limit) {
        return this.delegate.find(filter, sort, skip, limit);
    }

    @Override
    public long count(Document filter) {
        return this.delegate.count(filter);
    }

    @Override
    public Map<String, IndexSpec> indexInformation() {
        return this.delegate.indexInformation();
    }

    @Override
    public void createIndex(IndexSpec index) {
        this.delegate.createIndex(index);
    }

    @Override
    public void drop() {
        this.delegate.drop();
    }

    public static List<Call> newCallLog() {
        return Collections.synchronizedList(new ArrayList<>());
    }

    @Data
    public static class Call {
        private final String operation;
        private final Map<String, Object> options;
    }
}
