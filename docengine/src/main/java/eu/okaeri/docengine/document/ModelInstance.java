package eu.okaeri.docengine.document;

import eu.okaeri.docengine.lob.LargeObjectField;
import eu.okaeri.docengine.lob.LargeObjectState;
import eu.okaeri.docengine.model.FieldDescriptor;
import eu.okaeri.docengine.model.ModelDescriptor;
import eu.okaeri.docengine.ref.LazyModelReference;
import lombok.Getter;
import lombok.NonNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Record of a model: field values by field name plus the state of its large-object fields.
 * Instances loaded or saved through a {@link ModelManager} are bound to it and can {@link #save()}
 * and {@link #delete()} themselves.
 */
public class ModelInstance {

    private final @Getter ModelDescriptor model;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Map<String, LargeObjectState> largeObjects = new LinkedHashMap<>();
    private @Getter ModelManager manager;

    public ModelInstance(@NonNull ModelDescriptor model) {
        this.model = model;
        for (FieldDescriptor field : model.getLargeObjectFields()) {
            this.largeObjects.put(field.getName(), new LargeObjectState(field, () -> this.requireManager().getLargeObjectStore()));
        }
    }

    public static ModelInstance of(@NonNull ModelDescriptor model, @NonNull Map<String, ?> values) {
        ModelInstance instance = new ModelInstance(model);
        values.forEach(instance::set);
        return instance;
    }

    public Object getId() {
        return this.values.get(this.model.getIdField().getName());
    }

    public boolean isSaved() {
        return this.getId() != null;
    }

    /**
     * Field value, large-object fields are read through their {@link LargeObjectField}.
     */
    public Object get(@NonNull String field) {
        FieldDescriptor descriptor = this.model.field(field);
        if (descriptor.isLargeObject()) {
            return this.largeObjects.get(field).get();
        }
        return this.values.get(field);
    }

    @SuppressWarnings("unchecked")
    public <T> T get(@NonNull String field, @NonNull Class<T> type) {
        Object value = this.get(field);
        if ((value != null) && !type.isInstance(value)) {
            throw new ClassCastException(this.model.getName() + "." + field + " holds " + value.getClass().getName() + ", not " + type.getName());
        }
        return (T) value;
    }

    public ModelInstance set(@NonNull String field, Object value) {
        FieldDescriptor descriptor = this.model.field(field);
        if (descriptor.isLargeObject()) {
            this.largeObjects.get(field).set(value);
        } else {
            this.values.put(field, value);
        }
        return this;
    }

    public LargeObjectState getLargeObject(@NonNull String field) {
        LargeObjectState state = this.largeObjects.get(field);
        if (state == null) {
            throw new IllegalArgumentException(this.model.getName() + "." + field + " is not a large-object field");
        }
        return state;
    }

    /**
     * Values of regular fields, large-object fields are not included.
     */
    public Map<String, Object> getValues() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(this.values));
    }

    public ModelInstance save() {
        this.requireManager().save(this);
        return this;
    }

    public boolean delete() {
        return this.requireManager().delete(this);
    }

    void bind(@NonNull ModelManager manager) {
        this.manager = manager;
    }

    void setId(Object id) {
        this.values.put(this.model.getIdField().getName(), id);
    }

    private ModelManager requireManager() {
        if (this.manager == null) {
            throw new IllegalStateException("instance of " + this.model.getName() + " is not bound to a model manager");
        }
        return this.manager;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if ((this.getId() == null) || (other == null)) {
            return false;
        }
        if (other instanceof LazyModelReference) {
            return other.equals(this);
        }
        if (!(other instanceof ModelInstance)) {
            return false;
        }
        ModelInstance instance = (ModelInstance) other;
        return this.model.getName().equals(instance.model.getName()) && this.getId().equals(instance.getId());
    }

    @Override
    public int hashCode() {
        Object id = this.getId();
        return (id == null) ? System.identityHashCode(this) : Objects.hash(this.model.getName(), id);
    }

    @Override
    public String toString() {
        return this.model.getName() + "(" + this.values + ")";
    }
}
