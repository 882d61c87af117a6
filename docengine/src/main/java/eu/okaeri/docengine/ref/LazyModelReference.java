package eu.okaeri.docengine.ref;

import eu.okaeri.docengine.document.ModelInstance;
import eu.okaeri.docengine.model.ModelDescriptor;
import lombok.Getter;
import lombok.NonNull;
import org.bson.Document;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reference to a model instance by (model, primary key), resolved on first access and cached
 * for the lifetime of the reference. Equality never forces resolution: a reference equals every
 * reference or instance with the same model name and id.
 */
public class LazyModelReference {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.platform.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(LazyModelReference.class.getSimpleName());

    public static final String ID_KEY = "_id";
    public static final String COLLECTION_KEY = "_collection";

    private final @Getter ModelDescriptor model;
    private final @Getter Object id;
    private final ReferenceResolver resolver;

    private ModelInstance value;
    private boolean fetched;

    public LazyModelReference(@NonNull ModelDescriptor model, @NonNull Object id, ReferenceResolver resolver) {
        this.model = model;
        this.id = id;
        this.resolver = resolver;
    }

    /**
     * Reference that is already resolved to the instance.
     */
    public static LazyModelReference of(@NonNull ModelInstance instance) {
        if (instance.getId() == null) {
            throw new IllegalArgumentException("cannot reference an unsaved instance of " + instance.getModel().getName());
        }
        LazyModelReference reference = new LazyModelReference(instance.getModel(), instance.getId(), null);
        reference.value = instance;
        reference.fetched = true;
        return reference;
    }

    public boolean isResolved() {
        return this.fetched;
    }

    public Optional<ModelInstance> get() {
        return Optional.ofNullable(this.fetched ? this.value : this.fetch());
    }

    public ModelInstance orThrow() {
        return this.get().orElseThrow(() -> new NoSuchElementException("Reference not found: " + this.model.getCollection() + "/" + this.id));
    }

    /**
     * Value of a field of the referenced instance, resolving it when needed.
     */
    public Object get(@NonNull String field) {
        return this.orThrow().get(field);
    }

    private ModelInstance fetch() {
        if (this.resolver == null) {
            throw new IllegalStateException("reference " + this + " is not bound to a connection");
        }
        long start = System.currentTimeMillis();
        this.value = this.resolver.resolve(this.model, this.id);
        this.fetched = true;
        if (DEBUG) {
            long took = System.currentTimeMillis() - start;
            LOGGER.info("Fetched model reference for " + this.model.getCollection() + " [" + this.id + "]: " + took + " ms");
        }
        return this.value;
    }

    /**
     * Stored form: {@code {_id: <id>, _collection: <collection>}}.
     */
    public Document toDocument() {
        return new Document(ID_KEY, this.id).append(COLLECTION_KEY, this.model.getCollection());
    }

    public static boolean isReferenceDocument(Object value) {
        if (!(value instanceof Map)) {
            return false;
        }
        Map<?, ?> map = (Map<?, ?>) value;
        return (map.size() == 2) && map.containsKey(ID_KEY) && (map.get(COLLECTION_KEY) instanceof String);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other instanceof LazyModelReference) {
            LazyModelReference reference = (LazyModelReference) other;
            return this.model.getName().equals(reference.model.getName()) && this.id.equals(reference.id);
        }
        if (other instanceof ModelInstance) {
            ModelInstance instance = (ModelInstance) other;
            return this.model.getName().equals(instance.getModel().getName()) && this.id.equals(instance.getId());
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.model.getName(), this.id);
    }

    @Override
    public String toString() {
        return "LazyModelReference(" + this.model.getName() + ", " + this.id + (this.fetched ? ", resolved" : "") + ")";
    }
}
