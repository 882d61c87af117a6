package eu.okaeri.docengine.lob;

import eu.okaeri.docengine.model.FieldDescriptor;
import eu.okaeri.docengine.model.FieldType;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.bson.types.ObjectId;

import java.io.InputStream;
import java.util.function.Supplier;

/**
 * Per-instance state of a large-object field: bound payload id, cached value and pending write flag.
 */
@ToString(of = {"field", "payloadId", "pendingWrite"})
public class LargeObjectState implements LargeObjectField {

    private final @Getter FieldDescriptor field;
    private final Supplier<LargeObjectStore> store;

    private @Getter ObjectId payloadId;
    private @Getter ObjectId replacedPayloadId;
    private Object cached;
    private @Getter boolean pendingWrite;

    public LargeObjectState(@NonNull FieldDescriptor field, @NonNull Supplier<LargeObjectStore> store) {
        if (!field.isLargeObject()) {
            throw new IllegalArgumentException(field.getName() + " is not a large-object field");
        }
        this.field = field;
        this.store = store;
    }

    @Override
    public Object get() {
        if ((this.cached != null) || this.pendingWrite) {
            return (this.cached == null) ? this.emptyValue() : this.cached;
        }
        if (this.payloadId == null) {
            return this.emptyValue();
        }
        LargeObjectFile file = this.store.get().get(this.payloadId);
        this.cached = (this.field.getType() == FieldType.LARGE_TEXT) ? file.asText() : file;
        return this.cached;
    }

    @Override
    public void set(Object value) {
        if ((value instanceof ObjectId) && (this.payloadId == null)) {
            this.bind((ObjectId) value);
            return;
        }
        if ((value != null) && !isPayload(value)) {
            throw new IllegalArgumentException("cannot assign " + value.getClass().getName() + " to large-object field "
                + this.field.getName() + ", expected byte[], String, InputStream or LargeObjectFile");
        }
        if ((value != this.cached) || ((value == null) && (this.payloadId != null))) {
            this.pendingWrite = true;
        }
        this.cached = value;
    }

    @Override
    public boolean isCached() {
        return this.cached != null;
    }

    /**
     * Replaces the cached value without scheduling a write.
     */
    public void setCached(Object value) {
        this.cached = value;
    }

    /**
     * Binds the persisted payload, dropping the cache.
     */
    public void bind(ObjectId payloadId) {
        this.payloadId = payloadId;
        this.replacedPayloadId = null;
        this.cached = null;
        this.pendingWrite = false;
    }

    /**
     * Records a completed write, the assigned value stays cached. The payload referenced by the stored
     * record is remembered as replaced until the record itself is saved.
     */
    public void markWritten(ObjectId payloadId) {
        if (this.replacedPayloadId == null) {
            this.replacedPayloadId = this.payloadId;
        }
        this.payloadId = payloadId;
        this.pendingWrite = false;
    }

    /**
     * Forgets the replaced payload once the record references the current one.
     *
     * @return the replaced payload id, null when nothing was replaced
     */
    ObjectId takeReplaced() {
        ObjectId replaced = this.replacedPayloadId;
        this.replacedPayloadId = null;
        return replaced;
    }

    /**
     * Value to write: the assigned object, null when the field was cleared.
     */
    Object getPendingValue() {
        return this.cached;
    }

    private Object emptyValue() {
        return (this.field.getType() == FieldType.LARGE_TEXT) ? "" : null;
    }

    private static boolean isPayload(Object value) {
        return (value instanceof byte[]) || (value instanceof CharSequence) || (value instanceof InputStream) || (value instanceof LargeObjectFile);
    }
}
