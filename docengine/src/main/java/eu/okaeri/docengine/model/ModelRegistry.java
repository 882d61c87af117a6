package eu.okaeri.docengine.model;

import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered model descriptors by model name. Foreign keys and lazy references resolve their target here.
 */
public final class ModelRegistry {

    private static final ModelRegistry GLOBAL = new ModelRegistry();

    private final Map<String, ModelDescriptor> descriptors = new ConcurrentHashMap<>();

    public static ModelRegistry global() {
        return GLOBAL;
    }

    public ModelDescriptor register(@NonNull ModelDescriptor descriptor) {
        ModelDescriptor existing = this.descriptors.putIfAbsent(descriptor.getName(), descriptor);
        return (existing == null) ? descriptor : existing;
    }

    /**
     * Registers the annotated class, returns the already registered descriptor on repeated calls.
     */
    public ModelDescriptor register(@NonNull Class<?> modelClass) {
        ModelDescriptor existing = this.descriptors.get(ModelDescriptor.nameOf(modelClass));
        if (existing != null) {
            return existing;
        }
        return this.register(ModelDescriptor.of(modelClass));
    }

    public Optional<ModelDescriptor> find(@NonNull String name) {
        return Optional.ofNullable(this.descriptors.get(name));
    }

    public ModelDescriptor get(@NonNull String name) {
        ModelDescriptor descriptor = this.descriptors.get(name);
        if (descriptor == null) {
            throw new IllegalArgumentException("unknown model '" + name + "'");
        }
        return descriptor;
    }

    public Optional<ModelDescriptor> findByCollection(@NonNull String collection) {
        return this.descriptors.values().stream()
            .filter(descriptor -> descriptor.getCollection().equals(collection))
            .findFirst();
    }

    public Collection<ModelDescriptor> all() {
        return Collections.unmodifiableList(new ArrayList<>(this.descriptors.values()));
    }

    public void clear() {
        this.descriptors.clear();
    }
}
