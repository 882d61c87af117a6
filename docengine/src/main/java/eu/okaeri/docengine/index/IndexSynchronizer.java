package eu.okaeri.docengine.index;

import eu.okaeri.docengine.collection.DocumentCollection;
import eu.okaeri.docengine.connection.DatabaseConnection;
import eu.okaeri.docengine.model.ModelDescriptor;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Creates the planned indexes of models that are missing from the store. Existing indexes are never
 * dropped or rebuilt, so running it again is a no-op.
 */
@RequiredArgsConstructor
public class IndexSynchronizer {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.platform.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(IndexSynchronizer.class.getSimpleName());

    private final @NonNull DatabaseConnection connection;

    public List<IndexSyncReport> synchronizeAll(@NonNull Collection<ModelDescriptor> models) {
        return models.stream()
            .map(this::synchronize)
            .collect(Collectors.toList());
    }

    /**
     * @throws IndexSyncException when a planned index clashes with an existing one
     */
    public IndexSyncReport synchronize(@NonNull ModelDescriptor model) {

        DocumentCollection collection = this.connection.getCollection(model.getCollection());
        Map<String, IndexSpec> existing = collection.indexInformation();

        List<String> created = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        for (IndexSpec planned : IndexPlanner.plan(model)) {

            IndexSpec current = existing.get(planned.getName());
            if (current != null) {
                if (!current.isEquivalent(planned)) {
                    throw new IndexSyncException(model.getCollection(), planned.getName(), "exists with different keys or options: " + current);
                }
                unchanged.add(planned.getName());
                continue;
            }

            Optional<IndexSpec> sameKeys = existing.values().stream()
                .filter(index -> index.getKeys().equals(planned.getKeys()))
                .findFirst();
            if (sameKeys.isPresent()) {
                if (!sameKeys.get().isEquivalent(planned)) {
                    throw new IndexSyncException(model.getCollection(), planned.getName(),
                        "same keys already indexed as " + sameKeys.get().getName() + " with different options");
                }
                unchanged.add(sameKeys.get().getName());
                continue;
            }

            try {
                collection.createIndex(planned);
            } catch (IllegalStateException exception) {
                throw new IndexSyncException(model.getCollection(), planned.getName(), exception);
            }
            created.add(planned.getName());
            if (DEBUG) {
                LOGGER.info("[" + model.getCollection() + "] Created index " + planned.getName() + " " + planned.getKeys());
            }
        }

        return new IndexSyncReport(model.getCollection(), Collections.unmodifiableList(created), Collections.unmodifiableList(unchanged));
    }
}
