package eu.okaeri.docengine.filter;

import eu.okaeri.docengine.filter.condition.Condition;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Read query: optional condition, ordering, skip and limit. A limit of 0 returns every match.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class FindFilter {

    private final Condition where;
    private final List<OrderBy> orderBy;
    private final int skip;
    private final int limit;

    public static FindFilterBuilder builder() {
        return new FindFilterBuilder();
    }

    /**
     * Every document matching the condition, in store order.
     */
    public static FindFilter where(Condition where) {
        return builder().where(where).build();
    }

    public boolean hasOrderBy() {
        return !this.orderBy.isEmpty();
    }
}
