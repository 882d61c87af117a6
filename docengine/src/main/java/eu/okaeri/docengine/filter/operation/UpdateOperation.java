package eu.okaeri.docengine.filter.operation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

/**
 * Single field change of a bulk update. The field is a model field name, optionally followed by
 * a dotted path into raw content ({@code raw.a}).
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UpdateOperation {

    private final UpdateOperationType type;
    private final String field;
    private final Object operand;

    public static UpdateOperation set(@NonNull String field, Object value) {
        return new UpdateOperation(UpdateOperationType.SET, field, value);
    }

    public static UpdateOperation unset(@NonNull String field) {
        return new UpdateOperation(UpdateOperationType.UNSET, field, "");
    }

    /**
     * @param delta kept as given, an int delta stays an int32 in the update document
     */
    public static UpdateOperation increment(@NonNull String field, @NonNull Number delta) {
        return new UpdateOperation(UpdateOperationType.INCREMENT, field, delta);
    }
}
