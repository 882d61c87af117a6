package eu.okaeri.docengine.filter.predicate.nullity;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;

/**
 * VALUE is null or missing
 */
public class IsNullPredicate extends SimplePredicate {

    public IsNullPredicate() {
        super(null);
    }
}
