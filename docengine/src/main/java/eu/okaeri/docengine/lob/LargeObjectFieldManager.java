package eu.okaeri.docengine.lob;

import eu.okaeri.docengine.document.ModelInstance;
import eu.okaeri.docengine.model.FieldDescriptor;
import eu.okaeri.docengine.model.ModelDescriptor;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.bson.types.ObjectId;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.logging.Logger;

/**
 * Save and delete hooks of large-object fields.
 * <p>
 * On save a pending value is written as a new payload before the record, the replaced payload is
 * deleted only after the record is stored and only when the field is not versioned. A failure in
 * between leaves an orphaned payload, never a record pointing to a missing one. Payloads of removed
 * records are deleted once the record is gone.
 */
@RequiredArgsConstructor
public class LargeObjectFieldManager {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.platform.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(LargeObjectFieldManager.class.getSimpleName());

    private final @NonNull LargeObjectStore store;

    /**
     * Writes pending payloads of the instance. Must run before the owning document is persisted, the
     * payloads they replace stay in the store until {@link #afterSave(ModelInstance)}.
     */
    public void beforeSave(@NonNull ModelInstance instance) {
        for (FieldDescriptor field : instance.getModel().getLargeObjectFields()) {

            LargeObjectState state = instance.getLargeObject(field.getName());
            if (!state.isPendingWrite()) {
                continue;
            }

            // written by a save whose record never made it to the store
            ObjectId unreferenced = (state.getReplacedPayloadId() == null) ? null : state.getPayloadId();
            Object value = state.getPendingValue();
            ObjectId written = (value == null) ? null : this.store.put(toStream(value), field.getName());
            state.markWritten(written);

            if ((unreferenced != null) && !field.isVersioning()) {
                this.store.delete(unreferenced);
            }
            if (DEBUG) {
                LOGGER.info("[" + instance.getModel().getCollection() + "] " + field.getName() + ": wrote payload " + written);
            }
        }
    }

    /**
     * Deletes payloads replaced by the last {@link #beforeSave(ModelInstance)} unless the field is
     * versioned. Runs once the owning document is persisted.
     */
    public void afterSave(@NonNull ModelInstance instance) {
        for (FieldDescriptor field : instance.getModel().getLargeObjectFields()) {
            ObjectId replaced = instance.getLargeObject(field.getName()).takeReplaced();
            if ((replaced == null) || field.isVersioning()) {
                continue;
            }
            this.store.delete(replaced);
            if (DEBUG) {
                LOGGER.info("[" + instance.getModel().getCollection() + "] " + field.getName() + ": deleted replaced payload " + replaced);
            }
        }
    }

    /**
     * Deletes the current payloads of autodelete fields. Runs after the owning record is removed.
     */
    public void afterDelete(@NonNull ModelInstance instance) {
        for (FieldDescriptor field : instance.getModel().getLargeObjectFields()) {
            ObjectId payloadId = instance.getLargeObject(field.getName()).getPayloadId();
            if ((payloadId != null) && field.isAutodelete()) {
                this.store.delete(payloadId);
            }
        }
    }

    /**
     * Rejects bulk updates touching large-object fields.
     *
     * @param fields updated field names (or dotted paths)
     */
    public static void checkUpdate(@NonNull ModelDescriptor model, @NonNull Collection<String> fields) {
        for (String name : fields) {
            String head = name.contains(".") ? name.substring(0, name.indexOf('.')) : name;
            FieldDescriptor field = model.getField(head)
                .orElseGet(() -> model.getFieldByColumn(head).orElse(null));
            if ((field != null) && field.isLargeObject()) {
                throw new RestrictedOperationException(field.getName());
            }
        }
    }

    private static InputStream toStream(Object value) {
        if (value instanceof InputStream) {
            return (InputStream) value;
        }
        if (value instanceof byte[]) {
            return new ByteArrayInputStream((byte[]) value);
        }
        if (value instanceof CharSequence) {
            return new ByteArrayInputStream(value.toString().getBytes(StandardCharsets.UTF_8));
        }
        if (value instanceof LargeObjectFile) {
            return ((LargeObjectFile) value).openStream();
        }
        throw new IllegalArgumentException("unsupported large-object value: " + value.getClass().getName());
    }
}
