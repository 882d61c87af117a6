package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.collection.DocumentCollection;
import eu.okaeri.docengine.connection.OperationFlags;
import lombok.Data;
import lombok.NonNull;
import org.bson.Document;

import java.util.Map;

@Data
public class UpdateCommand implements StoreCommand<Long> {

    private final Document filter;
    private final Document update;
    private final Map<String, Object> options;

    @Override
    public QueryKind getKind() {
        return QueryKind.UPDATE_MULTI;
    }

    public boolean isMulti() {
        return Boolean.TRUE.equals(this.options.get(OperationFlags.MULTI));
    }

    /**
     * @return number of matched documents
     */
    @Override
    public Long execute(@NonNull DocumentCollection collection) {
        return collection.update(this.filter, this.update, this.options);
    }
}
