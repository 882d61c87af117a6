package eu.okaeri.docengine.filter.predicate.nullity;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;

/**
 * VALUE is present and not null
 */
public class NotNullPredicate extends SimplePredicate {

    public NotNullPredicate() {
        super(null);
    }
}
