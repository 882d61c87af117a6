package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.connection.OperationFlags;
import eu.okaeri.docengine.connection.OperationKind;
import eu.okaeri.docengine.document.DocumentSerializer;
import eu.okaeri.docengine.filter.FindFilter;
import eu.okaeri.docengine.filter.UpdateFilter;
import eu.okaeri.docengine.filter.condition.Condition;
import eu.okaeri.docengine.lob.LargeObjectFieldManager;
import eu.okaeri.docengine.model.ModelDescriptor;
import lombok.Getter;
import lombok.NonNull;
import org.bson.Document;

import java.util.Collections;

/**
 * Translates model-level filters into store commands for one model. Write commands carry the
 * write-concern flags of their operation, bulk updates additionally {@code multi: true}.
 * All validation happens here, before anything reaches the store.
 */
public class QueryTranslator {

    private final @Getter ModelDescriptor model;
    private final OperationFlags flags;
    private final FilterRenderer filterRenderer;
    private final UpdateRenderer updateRenderer;

    public QueryTranslator(@NonNull ModelDescriptor model, @NonNull DocumentSerializer serializer, @NonNull OperationFlags flags) {
        this.model = model;
        this.flags = flags;
        this.filterRenderer = new FilterRenderer(model, serializer);
        this.updateRenderer = new UpdateRenderer(model, this.filterRenderer);
    }

    /**
     * Command of the given kind for the condition. Saves and updates carry content and have
     * their own methods.
     */
    public StoreCommand<?> translate(@NonNull QueryKind kind, Condition where) {
        switch (kind) {
            case READ:
                return this.find(FindFilter.where(where));
            case COUNT:
                return this.count(where);
            case DELETE:
                return this.remove(where);
            default:
                throw new IllegalArgumentException(kind + " cannot be translated from a condition alone");
        }
    }

    public Document renderFilter(Condition where) {
        return this.filterRenderer.render(where);
    }

    public FindCommand find(@NonNull FindFilter filter) {
        Document query = this.filterRenderer.render(filter.getWhere());
        Document sort = filter.hasOrderBy() ? this.filterRenderer.renderOrderBy(filter.getOrderBy()) : null;
        return new FindCommand(query, sort, filter.getSkip(), filter.getLimit());
    }

    public CountCommand count(Condition where) {
        return new CountCommand(this.filterRenderer.render(where));
    }

    public SaveCommand save(@NonNull Document document) {
        return new SaveCommand(document, this.flags.get(OperationKind.SAVE));
    }

    /**
     * @throws eu.okaeri.docengine.lob.RestrictedOperationException when a large-object field is updated
     */
    public UpdateCommand update(@NonNull UpdateFilter filter) {
        LargeObjectFieldManager.checkUpdate(this.model, filter.getFields());

        Document query = this.filterRenderer.render(filter.getWhere());
        Document update = this.updateRenderer.render(filter.getOperations());
        return new UpdateCommand(query, update, this.flags.with(OperationKind.UPDATE, Collections.singletonMap(OperationFlags.MULTI, true)));
    }

    public RemoveCommand remove(Condition where) {
        return new RemoveCommand(this.filterRenderer.render(where), this.flags.get(OperationKind.REMOVE));
    }

    public RemoveCommand remove(@NonNull Document filter) {
        return new RemoveCommand(filter, this.flags.get(OperationKind.REMOVE));
    }
}
