package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.FieldPath;
import eu.okaeri.docengine.filter.operation.UpdateOperation;
import eu.okaeri.docengine.model.FieldType;
import eu.okaeri.docengine.model.ModelDescriptor;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.bson.Document;

import java.util.List;

/**
 * Renders update operations to an update document, grouping them by operator
 * ({@code $set}, {@code $unset}, {@code $inc}) in order of first use.
 */
@RequiredArgsConstructor
public class UpdateRenderer {

    private final @NonNull ModelDescriptor model;
    private final @NonNull FilterRenderer values;

    public Document render(@NonNull List<UpdateOperation> operations) {

        Document update = new Document();
        for (UpdateOperation operation : operations) {

            ResolvedPath resolved = ResolvedPath.resolve(this.model, FieldPath.of(operation.getField()));
            if (resolved.getField().getType() == FieldType.AUTO_ID) {
                throw new IllegalArgumentException("the primary key of " + this.model.getName() + " cannot be updated");
            }

            Object operand = operation.getOperand();
            switch (operation.getType()) {
                case SET:
                    operand = this.values.encode(resolved, operand);
                    break;
                case INCREMENT:
                    FieldType type = resolved.getField().getType();
                    if (!resolved.isNested() && (type != FieldType.INTEGER) && (type != FieldType.DECIMAL)) {
                        throw new IllegalArgumentException("cannot increment " + resolved.getField().getName() + " of type " + type);
                    }
                    break;
                default:
                    break;
            }
            this.section(update, operation.getType().getOperator()).put(resolved.getStoragePath(), operand);
        }

        return update;
    }

    private Document section(Document update, String operator) {
        Document section = update.get(operator, Document.class);
        if (section == null) {
            section = new Document();
            update.put(operator, section);
        }
        return section;
    }
}
