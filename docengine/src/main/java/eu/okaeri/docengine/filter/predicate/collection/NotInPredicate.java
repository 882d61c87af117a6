package eu.okaeri.docengine.filter.predicate.collection;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;

/**
 * VALUE not in collection
 * {@code val not in [x, y, z]}
 */
public class NotInPredicate extends SimplePredicate {

    public NotInPredicate(@NonNull List<?> values) {
        super(Collections.unmodifiableList(values));
    }

    public List<?> getValues() {
        return (List<?>) this.getRightOperand();
    }
}
