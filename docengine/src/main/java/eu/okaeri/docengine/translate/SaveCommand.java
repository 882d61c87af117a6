package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.collection.DocumentCollection;
import lombok.Data;
import lombok.NonNull;
import org.bson.Document;

import java.util.Map;

/**
 * Insert-or-replace of a single document. Never carries {@code multi}.
 */
@Data
public class SaveCommand implements StoreCommand<Object> {

    private final Document document;
    private final Map<String, Object> options;

    @Override
    public QueryKind getKind() {
        return QueryKind.SAVE;
    }

    /**
     * @return id of the saved document
     */
    @Override
    public Object execute(@NonNull DocumentCollection collection) {
        return collection.save(this.document, this.options);
    }
}
