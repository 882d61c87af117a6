package eu.okaeri.docengine.filter;

import eu.okaeri.docengine.FieldPath;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

/**
 * Sort key of a read query. Field names follow the model, {@link #parse(String)} accepts the
 * {@code "-field"} shorthand for descending order.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderBy {

    private static final String DESCENDING_PREFIX = "-";

    private final FieldPath path;
    private final OrderDirection direction;

    public static OrderBy asc(@NonNull String field) {
        return new OrderBy(FieldPath.of(field), OrderDirection.ASC);
    }

    public static OrderBy desc(@NonNull String field) {
        return new OrderBy(FieldPath.of(field), OrderDirection.DESC);
    }

    public static OrderBy parse(@NonNull String expression) {
        return expression.startsWith(DESCENDING_PREFIX)
            ? desc(expression.substring(DESCENDING_PREFIX.length()))
            : asc(expression);
    }

    @Override
    public String toString() {
        return (this.direction == OrderDirection.DESC) ? (DESCENDING_PREFIX + this.path) : this.path.toString();
    }
}
