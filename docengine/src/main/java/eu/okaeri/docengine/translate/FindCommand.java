package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.collection.DocumentCollection;
import lombok.Data;
import lombok.NonNull;
import org.bson.Document;

import java.util.List;

@Data
public class FindCommand implements StoreCommand<List<Document>> {

    private final Document filter;
    private final Document sort;
    private final int skip;
    private final int limit;

    @Override
    public QueryKind getKind() {
        return QueryKind.READ;
    }

    @Override
    public List<Document> execute(@NonNull DocumentCollection collection) {
        return collection.find(this.filter, this.sort, this.skip, this.limit);
    }
}
