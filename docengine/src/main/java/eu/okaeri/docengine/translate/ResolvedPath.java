package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.FieldPath;
import eu.okaeri.docengine.model.FieldDescriptor;
import eu.okaeri.docengine.model.FieldType;
import eu.okaeri.docengine.model.ModelDescriptor;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;

/**
 * Field path of a model resolved to its declared field and storage path.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
final class ResolvedPath {

    private final FieldDescriptor field;
    private final String storagePath;
    private final boolean nested;

    /**
     * The head of the path names a field or a storage column. Only raw fields can be addressed below their root.
     */
    static ResolvedPath resolve(@NonNull ModelDescriptor model, @NonNull FieldPath path) {
        String head = path.getHead();
        FieldDescriptor field = model.getField(head)
            .orElseGet(() -> model.getFieldByColumn(head)
                .orElseThrow(() -> new IllegalArgumentException("Cannot resolve keyword '" + head + "' into field of " + model.getName())));
        if (path.isNested() && (field.getType() != FieldType.RAW)) {
            throw new IllegalArgumentException("Cannot address '" + path + "', " + field.getName() + " is not a raw field");
        }
        return new ResolvedPath(field, path.toStoragePath(field.getColumn()), path.isNested());
    }
}
