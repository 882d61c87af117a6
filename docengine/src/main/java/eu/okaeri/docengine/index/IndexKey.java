package eu.okaeri.docengine.index;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

/**
 * Single (column, direction) element of an index key.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IndexKey {

    private final String column;
    private final IndexDirection direction;

    public static IndexKey asc(@NonNull String column) {
        return new IndexKey(column, IndexDirection.ASCENDING);
    }

    public static IndexKey desc(@NonNull String column) {
        return new IndexKey(column, IndexDirection.DESCENDING);
    }

    public static IndexKey of(@NonNull String column, @NonNull IndexDirection direction) {
        return new IndexKey(column, direction);
    }

    /**
     * {@code <column>_1} or {@code <column>_-1}.
     */
    public String getName() {
        return this.column + "_" + this.direction.getValue();
    }
}
