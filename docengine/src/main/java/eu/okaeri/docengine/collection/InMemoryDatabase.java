package eu.okaeri.docengine.collection;

import eu.okaeri.docengine.lob.InMemoryLargeObjectStore;
import lombok.Getter;
import lombok.NonNull;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Collections and large-object payloads of one in-memory database. Connections created over
 * the same instance share its data.
 */
public class InMemoryDatabase {

    private final @Getter String name;
    private final Map<String, InMemoryDocumentCollection> collections = new ConcurrentHashMap<>();
    private final @Getter InMemoryLargeObjectStore largeObjectStore = new InMemoryLargeObjectStore();

    public InMemoryDatabase(@NonNull String name) {
        this.name = name;
    }

    public InMemoryDocumentCollection getCollection(@NonNull String name) {
        return this.collections.computeIfAbsent(name, InMemoryDocumentCollection::new);
    }

    public Set<String> getCollectionNames() {
        return new TreeSet<>(this.collections.keySet());
    }

    public void dropCollection(@NonNull String name) {
        this.collections.remove(name);
    }
}
