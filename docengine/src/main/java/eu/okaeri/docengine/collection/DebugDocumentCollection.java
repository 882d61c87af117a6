package eu.okaeri.docengine.collection;

import eu.okaeri.docengine.index.IndexSpec;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.bson.Document;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Instrumented collection used in debug configuration. Logs every call with its
 * arguments and duration, then delegates without altering the result.
 */
@RequiredArgsConstructor
public class DebugDocumentCollection implements DocumentCollection {

    private static final Logger LOGGER = Logger.getLogger(DebugDocumentCollection.class.getSimpleName());

    private final @NonNull @Getter DocumentCollection delegate;

    @Override
    public String getName() {
        return this.delegate.getName();
    }

    @Override
    public Object insert(@NonNull Document document, @NonNull Map<String, Object> options) {
        return this.logged("insert", () -> document.toJson() + " " + options, () -> this.delegate.insert(document, options));
    }

    @Override
    public Object save(@NonNull Document document, @NonNull Map<String, Object> options) {
        return this.logged("save", () -> document.toJson() + " " + options, () -> this.delegate.save(document, options));
    }

    @Override
    public long update(@NonNull Document filter, @NonNull Document update, @NonNull Map<String, Object> options) {
        return this.logged("update", () -> filter.toJson() + " " + update.toJson() + " " + options, () -> this.delegate.update(filter, update, options));
    }

    @Override
    public long remove(@NonNull Document filter, @NonNull Map<String, Object> options) {
        return this.logged("remove", () -> filter.toJson() + " " + options, () -> this.delegate.remove(filter, options));
    }

    @Override
    public List<Document> find(@NonNull Document filter, Document sort, int skip, int limit) {
        return this.logged("find", () -> filter.toJson() + ((sort == null) ? "" : (" sort=" + sort.toJson())) + " skip=" + skip + " limit=" + limit,
            () -> this.delegate.find(filter, sort, skip, limit));
    }

    @Override
    public long count(@NonNull Document filter) {
        return this.logged("count", filter::toJson, () -> this.delegate.count(filter));
    }

    @Override
    public Map<String, IndexSpec> indexInformation() {
        return this.logged("index_information", () -> "", this.delegate::indexInformation);
    }

    @Override
    public void createIndex(@NonNull IndexSpec index) {
        this.logged("create_index", index::toString, () -> {
            this.delegate.createIndex(index);
            return null;
        });
    }

    @Override
    public void drop() {
        this.logged("drop", () -> "", () -> {
            this.delegate.drop();
            return null;
        });
    }

    private <T> T logged(String operation, Supplier<String> arguments, Supplier<T> call) {
        long start = System.nanoTime();
        try {
            return call.get();
        } finally {
            if (LOGGER.isLoggable(Level.INFO)) {
                long took = (System.nanoTime() - start) / 1_000_000;
                LOGGER.info("[" + this.delegate.getName() + "] " + operation + " " + arguments.get() + " (" + took + " ms)");
            }
        }
    }
}
