package eu.okaeri.docengine.filter;

import eu.okaeri.docengine.filter.condition.Condition;
import eu.okaeri.docengine.filter.operation.UpdateOperation;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

@NoArgsConstructor
public class UpdateFilterBuilder {

    private final List<UpdateOperation> operations = new ArrayList<>();
    private Condition where;

    public UpdateFilterBuilder where(Condition where) {
        this.where = where;
        return this;
    }

    public UpdateFilterBuilder set(@NonNull String field, Object value) {
        this.operations.add(UpdateOperation.set(field, value));
        return this;
    }

    /**
     * One {@code set} per entry, the equivalent of {@code update(field=value, ...)}.
     */
    public UpdateFilterBuilder set(@NonNull Map<String, ?> values) {
        values.forEach(this::set);
        return this;
    }

    public UpdateFilterBuilder unset(@NonNull String field) {
        this.operations.add(UpdateOperation.unset(field));
        return this;
    }

    public UpdateFilterBuilder increment(@NonNull String field, long delta) {
        this.operations.add(UpdateOperation.increment(field, delta));
        return this;
    }

    public UpdateFilterBuilder increment(@NonNull String field, int delta) {
        this.operations.add(UpdateOperation.increment(field, delta));
        return this;
    }

    public UpdateFilterBuilder increment(@NonNull String field, double delta) {
        this.operations.add(UpdateOperation.increment(field, delta));
        return this;
    }

    public UpdateFilter build() {
        if (this.operations.isEmpty()) {
            throw new IllegalStateException("No update operations specified");
        }
        return new UpdateFilter(this.where, Collections.unmodifiableList(new ArrayList<>(this.operations)));
    }
}
