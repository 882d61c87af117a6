package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.collection.DocumentCollection;
import lombok.Data;
import lombok.NonNull;
import org.bson.Document;

@Data
public class CountCommand implements StoreCommand<Long> {

    private final Document filter;

    @Override
    public QueryKind getKind() {
        return QueryKind.COUNT;
    }

    @Override
    public Long execute(@NonNull DocumentCollection collection) {
        return collection.count(this.filter);
    }
}
