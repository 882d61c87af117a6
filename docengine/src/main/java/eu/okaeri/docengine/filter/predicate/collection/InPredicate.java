package eu.okaeri.docengine.filter.predicate.collection;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;

/**
 * VALUE in collection
 * {@code val in [x, y, z]}
 */
public class InPredicate extends SimplePredicate {

    public InPredicate(@NonNull List<?> values) {
        super(Collections.unmodifiableList(values));
    }

    public List<?> getValues() {
        return (List<?>) this.getRightOperand();
    }
}
