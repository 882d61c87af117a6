package eu.okaeri.docengine.filter;

import eu.okaeri.docengine.filter.condition.Condition;
import eu.okaeri.docengine.filter.operation.UpdateOperation;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Bulk update: operations applied to every document matching the condition (all documents when absent).
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class UpdateFilter {

    private final Condition where;
    private final List<UpdateOperation> operations;

    public static UpdateFilterBuilder builder() {
        return new UpdateFilterBuilder();
    }

    /**
     * Model fields touched by the operations, without the embedded part of dotted paths.
     */
    public List<String> getFields() {
        return this.operations.stream()
            .map(operation -> {
                String field = operation.getField();
                int separator = field.indexOf('.');
                return (separator == -1) ? field : field.substring(0, separator);
            })
            .distinct()
            .collect(Collectors.toList());
    }
}
