package eu.okaeri.docengine.filter.predicate.equality;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import lombok.NonNull;

/**
 * {@code val != x}
 */
public class NePredicate extends SimplePredicate {

    public NePredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }
}
