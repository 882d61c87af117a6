package eu.okaeri.docengine.filter.predicate.comparison;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import lombok.NonNull;

/**
 * {@code val >= x}
 */
public class GtePredicate extends SimplePredicate {

    public GtePredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }
}
