package eu.okaeri.docengine.filter.predicate.equality;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import lombok.NonNull;

/**
 * {@code val == x}
 */
public class EqPredicate extends SimplePredicate {

    public EqPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }
}
