package eu.okaeri.docengine.filter.condition;

import eu.okaeri.docengine.FieldPath;
import eu.okaeri.docengine.filter.predicate.Predicate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

/**
 * Logical combination of predicates. A condition with a path applies its simple predicates to that
 * field; nested conditions without a path inherit it.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Condition implements Predicate {

    private final LogicalOperator operator;
    private final FieldPath path;
    private final Predicate[] predicates;

    public static Condition and(@NonNull Predicate... predicates) {
        return of(LogicalOperator.AND, null, predicates);
    }

    public static Condition on(@NonNull String path, @NonNull Predicate... predicates) {
        return and(path, predicates);
    }

    public static Condition and(@NonNull String path, @NonNull Predicate... predicates) {
        return and(FieldPath.of(path), predicates);
    }

    public static Condition and(@NonNull FieldPath path, @NonNull Predicate... predicates) {
        return of(LogicalOperator.AND, path, predicates);
    }

    public static Condition or(@NonNull Predicate... predicates) {
        return of(LogicalOperator.OR, null, predicates);
    }

    public static Condition or(@NonNull String path, @NonNull Predicate... predicates) {
        return or(FieldPath.of(path), predicates);
    }

    public static Condition or(@NonNull FieldPath path, @NonNull Predicate... predicates) {
        return of(LogicalOperator.OR, path, predicates);
    }

    private static Condition of(LogicalOperator operator, FieldPath path, Predicate[] predicates) {
        if (predicates.length == 0) throw new IllegalArgumentException("one or more predicate is required");
        return new Condition(operator, path, predicates.clone());
    }

    public Predicate[] getPredicates() {
        return this.predicates.clone();
    }

    public boolean hasPath() {
        return this.path != null;
    }
}
