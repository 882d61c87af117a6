package eu.okaeri.docengine.filter.predicate.comparison;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import lombok.NonNull;

/**
 * {@code val < x}
 */
public class LtPredicate extends SimplePredicate {

    public LtPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }
}
