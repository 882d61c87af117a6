package eu.okaeri.docengine.filter;

import eu.okaeri.docengine.filter.condition.Condition;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class FindFilterBuilder {

    private final List<OrderBy> orderBy = new ArrayList<>();
    private Condition where;
    private int skip;
    private int limit;

    FindFilterBuilder() {
    }

    public FindFilterBuilder where(Condition where) {
        this.where = where;
        return this;
    }

    public FindFilterBuilder orderBy(@NonNull OrderBy... keys) {
        Collections.addAll(this.orderBy, keys);
        return this;
    }

    /**
     * Sort keys as field names, {@code "-age"} sorts descending.
     */
    public FindFilterBuilder orderBy(@NonNull String... expressions) {
        for (String expression : expressions) {
            this.orderBy.add(OrderBy.parse(expression));
        }
        return this;
    }

    public FindFilterBuilder skip(int skip) {
        if (skip < 0) {
            throw new IllegalArgumentException("skip must not be negative, got " + skip);
        }
        this.skip = skip;
        return this;
    }

    public FindFilterBuilder limit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got " + limit);
        }
        this.limit = limit;
        return this;
    }

    public FindFilter build() {
        return new FindFilter(this.where, Collections.unmodifiableList(new ArrayList<>(this.orderBy)), this.skip, this.limit);
    }
}
