package eu.okaeri.docengine.filter.predicate.comparison;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import lombok.NonNull;

/**
 * {@code val <= x}
 */
public class LtePredicate extends SimplePredicate {

    public LtePredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }
}
