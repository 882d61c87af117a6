package eu.okaeri.docengine.filter.predicate;

import eu.okaeri.docengine.filter.predicate.collection.InPredicate;
import eu.okaeri.docengine.filter.predicate.collection.NotInPredicate;
import eu.okaeri.docengine.filter.predicate.comparison.GtPredicate;
import eu.okaeri.docengine.filter.predicate.comparison.GtePredicate;
import eu.okaeri.docengine.filter.predicate.comparison.LtPredicate;
import eu.okaeri.docengine.filter.predicate.comparison.LtePredicate;
import eu.okaeri.docengine.filter.predicate.date.DatePart;
import eu.okaeri.docengine.filter.predicate.date.DatePartPredicate;
import eu.okaeri.docengine.filter.predicate.embedded.AttributePredicate;
import eu.okaeri.docengine.filter.predicate.equality.EqPredicate;
import eu.okaeri.docengine.filter.predicate.equality.NePredicate;
import eu.okaeri.docengine.filter.predicate.nullity.IsNullPredicate;
import eu.okaeri.docengine.filter.predicate.nullity.NotNullPredicate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;

/**
 * Predicate comparing a field with a right operand. Operands are raw model values (ids, model
 * instances, dates), the translator encodes them for the field they are applied to.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class SimplePredicate implements Predicate {

    private final Object rightOperand;

    /**
     * {@code field == value}
     */
    public static SimplePredicate eq(@NonNull Object rightOperand) {
        return new EqPredicate(rightOperand);
    }

    /**
     * {@code field != value}
     */
    public static SimplePredicate ne(@NonNull Object rightOperand) {
        return new NePredicate(rightOperand);
    }

    /**
     * {@code field > value}
     */
    public static SimplePredicate gt(@NonNull Object rightOperand) {
        return new GtPredicate(rightOperand);
    }

    /**
     * {@code field >= value}
     */
    public static SimplePredicate gte(@NonNull Object rightOperand) {
        return new GtePredicate(rightOperand);
    }

    /**
     * {@code field < value}
     */
    public static SimplePredicate lt(@NonNull Object rightOperand) {
        return new LtPredicate(rightOperand);
    }

    /**
     * {@code field <= value}
     */
    public static SimplePredicate lte(@NonNull Object rightOperand) {
        return new LtePredicate(rightOperand);
    }

    public static SimplePredicate in(@NonNull Object... values) {
        return new InPredicate(Arrays.asList(values));
    }

    public static SimplePredicate in(@NonNull Collection<?> values) {
        return new InPredicate(new ArrayList<>(values));
    }

    public static SimplePredicate notIn(@NonNull Object... values) {
        return new NotInPredicate(Arrays.asList(values));
    }

    public static SimplePredicate notIn(@NonNull Collection<?> values) {
        return new NotInPredicate(new ArrayList<>(values));
    }

    public static SimplePredicate isNull() {
        return new IsNullPredicate();
    }

    public static SimplePredicate notNull() {
        return new NotNullPredicate();
    }

    /**
     * Matches a sequence of embedded documents containing at least one element with {@code key == value}.
     * The key may be a dotted path inside the element.
     */
    public static SimplePredicate attr(@NonNull String key, Object value) {
        return new AttributePredicate(key, value);
    }

    /**
     * Date component predicates, declared for completeness of the filter API. The document store
     * cannot evaluate them and translation rejects them.
     */
    public static SimplePredicate year(int year) {
        return new DatePartPredicate(DatePart.YEAR, year);
    }

    public static SimplePredicate month(int month) {
        return new DatePartPredicate(DatePart.MONTH, month);
    }

    public static SimplePredicate day(int day) {
        return new DatePartPredicate(DatePart.DAY, day);
    }
}
