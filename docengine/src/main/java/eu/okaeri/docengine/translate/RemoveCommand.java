package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.collection.DocumentCollection;
import lombok.Data;
import lombok.NonNull;
import org.bson.Document;

import java.util.Map;

@Data
public class RemoveCommand implements StoreCommand<Long> {

    private final Document filter;
    private final Map<String, Object> options;

    @Override
    public QueryKind getKind() {
        return QueryKind.DELETE;
    }

    @Override
    public Long execute(@NonNull DocumentCollection collection) {
        return collection.remove(this.filter, this.options);
    }
}
