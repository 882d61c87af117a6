package eu.okaeri.docengine.filter.predicate.date;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import lombok.Getter;
import lombok.NonNull;

/**
 * Component of a date field equals X, e.g. {@code year(date) == 2011}.
 */
@Getter
public class DatePartPredicate extends SimplePredicate {

    private final DatePart part;

    public DatePartPredicate(@NonNull DatePart part, int value) {
        super(value);
        this.part = part;
    }
}
