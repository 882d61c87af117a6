package eu.okaeri.docengine.filter.predicate.comparison;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import lombok.NonNull;

/**
 * {@code val > x}
 */
public class GtPredicate extends SimplePredicate {

    public GtPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }
}
