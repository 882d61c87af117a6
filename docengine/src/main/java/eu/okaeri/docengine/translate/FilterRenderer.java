package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.FieldPath;
import eu.okaeri.docengine.document.DocumentSerializer;
import eu.okaeri.docengine.filter.OrderBy;
import eu.okaeri.docengine.filter.UnsupportedQueryException;
import eu.okaeri.docengine.filter.condition.Condition;
import eu.okaeri.docengine.filter.condition.LogicalOperator;
import eu.okaeri.docengine.filter.predicate.Predicate;
import eu.okaeri.docengine.filter.predicate.SimplePredicate;
import eu.okaeri.docengine.filter.predicate.collection.InPredicate;
import eu.okaeri.docengine.filter.predicate.collection.NotInPredicate;
import eu.okaeri.docengine.filter.predicate.comparison.GtPredicate;
import eu.okaeri.docengine.filter.predicate.comparison.GtePredicate;
import eu.okaeri.docengine.filter.predicate.comparison.LtPredicate;
import eu.okaeri.docengine.filter.predicate.comparison.LtePredicate;
import eu.okaeri.docengine.filter.predicate.date.DatePartPredicate;
import eu.okaeri.docengine.filter.predicate.embedded.AttributePredicate;
import eu.okaeri.docengine.filter.predicate.equality.EqPredicate;
import eu.okaeri.docengine.filter.predicate.equality.NePredicate;
import eu.okaeri.docengine.filter.predicate.nullity.IsNullPredicate;
import eu.okaeri.docengine.filter.predicate.nullity.NotNullPredicate;
import eu.okaeri.docengine.model.ModelDescriptor;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders filter trees of a model to query documents.
 * <p>
 * A condition with a single child renders as the child itself, so {@code on("raw", attr("a", 1))} becomes
 * {@code {raw: {$elemMatch: {a: 1}}}}. Operands are encoded for the field they apply to.
 */
@RequiredArgsConstructor
public class FilterRenderer {

    public static final String DATE_PART_UNSUPPORTED = "MongoDB does not support year/month/day queries";

    private final @NonNull ModelDescriptor model;
    private final @NonNull DocumentSerializer serializer;

    public Document render(Condition condition) {
        return (condition == null) ? new Document() : this.renderCondition(condition, null);
    }

    public String renderOperator(@NonNull LogicalOperator operator) {
        if (operator == LogicalOperator.AND) {
            return "$and";
        }
        if (operator == LogicalOperator.OR) {
            return "$or";
        }
        throw new IllegalArgumentException("Unsupported operator: " + operator);
    }

    public String renderOperator(@NonNull SimplePredicate predicate) {

        if (predicate instanceof EqPredicate) {
            return "$eq";
        } else if (predicate instanceof GtePredicate) {
            return "$gte";
        } else if (predicate instanceof GtPredicate) {
            return "$gt";
        } else if (predicate instanceof LtePredicate) {
            return "$lte";
        } else if (predicate instanceof LtPredicate) {
            return "$lt";
        } else if (predicate instanceof NePredicate) {
            return "$ne";
        } else if (predicate instanceof InPredicate) {
            return "$in";
        } else if (predicate instanceof NotInPredicate) {
            return "$nin";
        }

        throw new IllegalArgumentException("cannot render operator " + predicate + " [" + predicate.getClass() + "]");
    }

    private Document renderCondition(Condition condition, FieldPath inheritedPath) {

        FieldPath path = condition.hasPath() ? condition.getPath() : inheritedPath;
        List<Document> rendered = new ArrayList<>();
        for (Predicate predicate : condition.getPredicates()) {
            if (predicate instanceof Condition) {
                rendered.add(this.renderCondition((Condition) predicate, path));
                continue;
            }
            if (path == null) {
                throw new IllegalArgumentException("predicate " + predicate + " requires a field, use Condition.on(field, ...)");
            }
            rendered.add(this.renderPredicate(path, (SimplePredicate) predicate));
        }

        if (rendered.size() == 1) {
            return rendered.get(0);
        }
        return new Document(this.renderOperator(condition.getOperator()), rendered);
    }

    public Document renderPredicate(@NonNull FieldPath path, @NonNull SimplePredicate predicate) {

        ResolvedPath resolved = ResolvedPath.resolve(this.model, path);
        String storagePath = resolved.getStoragePath();

        if (predicate instanceof DatePartPredicate) {
            throw new UnsupportedQueryException(DATE_PART_UNSUPPORTED, resolved.getField().getName());
        }
        if (predicate instanceof IsNullPredicate) {
            return new Document(storagePath, null);
        }
        if (predicate instanceof NotNullPredicate) {
            return new Document(storagePath, new Document("$ne", null));
        }
        if (predicate instanceof AttributePredicate) {
            AttributePredicate attribute = (AttributePredicate) predicate;
            Object value = this.serializer.encodeRaw(resolved.getField().getName(), attribute.getRightOperand());
            return new Document(storagePath, new Document("$elemMatch", new Document(attribute.getKey(), value)));
        }

        Object operand;
        if (predicate instanceof InPredicate) {
            operand = this.encodeAll(resolved, ((InPredicate) predicate).getValues());
        } else if (predicate instanceof NotInPredicate) {
            operand = this.encodeAll(resolved, ((NotInPredicate) predicate).getValues());
        } else {
            operand = this.encode(resolved, predicate.getRightOperand());
        }

        return new Document(storagePath, new Document(this.renderOperator(predicate), operand));
    }

    public Document renderOrderBy(@NonNull List<OrderBy> orderBy) {
        Document sort = new Document();
        for (OrderBy order : orderBy) {
            ResolvedPath resolved = ResolvedPath.resolve(this.model, order.getPath());
            sort.put(resolved.getStoragePath(), order.getDirection().getSortValue());
        }
        return sort;
    }

    private List<Object> encodeAll(ResolvedPath resolved, List<?> values) {
        List<Object> encoded = new ArrayList<>();
        for (Object value : values) {
            encoded.add(this.encode(resolved, value));
        }
        return encoded;
    }

    Object encode(ResolvedPath resolved, Object value) {
        if (resolved.isNested()) {
            return this.serializer.encodeRaw(resolved.getField().getName(), value);
        }
        return this.serializer.encodeField(this.model, resolved.getField(), value);
    }
}
