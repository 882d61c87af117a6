package eu.okaeri.docengine.model;

import eu.okaeri.docengine.index.IndexDirection;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Declared field of a model. Immutable, created with {@link #builder()} or {@link #of(String, FieldType)}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class FieldDescriptor {

    @NonNull
    private final String name;
    @NonNull
    private final FieldType type;
    private final String column;

    private final boolean indexed;
    private final boolean unique;
    private final boolean sparse;
    private final boolean descending;

    /**
     * Name of the referenced model, foreign keys only.
     */
    private final String target;

    private final boolean versioning;
    private final Boolean autodelete;

    public static FieldDescriptor of(@NonNull String name, @NonNull FieldType type) {
        return builder().name(name).type(type).build();
    }

    public static FieldDescriptor foreignKey(@NonNull String name, @NonNull String target) {
        return builder().name(name).type(FieldType.FOREIGN_KEY).target(target).build();
    }

    /**
     * Storage column: explicit column, {@code _id} for the primary key, {@code <name>_id} for foreign keys
     * or the field name.
     */
    public String getColumn() {
        if ((this.column != null) && !this.column.isEmpty()) {
            return this.column;
        }
        if (this.type == FieldType.AUTO_ID) {
            return "_id";
        }
        if (this.type == FieldType.FOREIGN_KEY) {
            return this.name + "_id";
        }
        return this.name;
    }

    public boolean isLargeObject() {
        return this.type.isLargeObject();
    }

    /**
     * Payload deletion follows the owner unless configured, defaults to the opposite of versioning.
     */
    public boolean isAutodelete() {
        return (this.autodelete == null) ? !this.versioning : this.autodelete;
    }

    /**
     * Unique and sparse fields are indexed implicitly.
     */
    public boolean isIndexed() {
        return this.indexed || this.unique || this.sparse || this.descending;
    }

    public IndexDirection getIndexDirection() {
        return this.descending ? IndexDirection.DESCENDING : IndexDirection.ASCENDING;
    }
}
