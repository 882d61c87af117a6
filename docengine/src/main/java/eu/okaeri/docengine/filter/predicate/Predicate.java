package eu.okaeri.docengine.filter.predicate;

/**
 * Node of a filter tree. Leaves are {@link SimplePredicate}s, inner nodes are conditions.
 */
public interface Predicate {
}
