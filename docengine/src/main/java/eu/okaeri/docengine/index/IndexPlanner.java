package eu.okaeri.docengine.index;

import eu.okaeri.docengine.model.FieldDescriptor;
import eu.okaeri.docengine.model.FieldType;
import eu.okaeri.docengine.model.ModelDescriptor;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Target indexes of a model.
 * <p>
 * Every indexed field gets a single-key index on its column, foreign keys are always indexed.
 * Declared compound indexes name their columns directly. The primary key is covered by the
 * store's own {@code _id_} index and never planned.
 */
public final class IndexPlanner {

    private IndexPlanner() {
    }

    public static List<IndexSpec> plan(@NonNull ModelDescriptor model) {

        Map<String, IndexSpec> planned = new LinkedHashMap<>();
        for (FieldDescriptor field : model.getFieldList()) {
            if ((field.getType() == FieldType.AUTO_ID) || !(field.isIndexed() || (field.getType() == FieldType.FOREIGN_KEY))) {
                continue;
            }
            IndexKey key = IndexKey.of(field.getColumn(), field.getIndexDirection());
            IndexSpec spec = IndexSpec.of(Collections.singletonList(key), field.isUnique(), field.isSparse());
            planned.put(spec.getName(), spec);
        }

        for (IndexSpec compound : model.getCompoundIndexes()) {
            IndexSpec previous = planned.putIfAbsent(compound.getName(), compound);
            if ((previous != null) && !previous.isEquivalent(compound)) {
                throw new IndexSyncException(model.getCollection(), compound.getName(),
                    "declared twice with different options: " + previous + " and " + compound);
            }
        }

        return Collections.unmodifiableList(new ArrayList<>(planned.values()));
    }
}
