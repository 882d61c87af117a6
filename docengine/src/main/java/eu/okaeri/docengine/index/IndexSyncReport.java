package eu.okaeri.docengine.index;

import lombok.Data;

import java.util.List;

@Data
public class IndexSyncReport {

    private final String collection;
    private final List<String> created;
    private final List<String> unchanged;

    public boolean hasChanges() {
        return !this.created.isEmpty();
    }
}
