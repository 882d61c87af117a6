package eu.okaeri.docengine.filter.predicate.embedded;

import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import lombok.Getter;
import lombok.NonNull;

/**
 * Some element of the sequence has {@code element[key] == value}.
 */
@Getter
public class AttributePredicate extends SimplePredicate {

    private final String key;

    public AttributePredicate(@NonNull String key, Object value) {
        super(value);
        if (key.isEmpty()) {
            throw new IllegalArgumentException("attribute key cannot be empty");
        }
        this.key = key;
    }
}
