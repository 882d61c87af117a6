package eu.okaeri.docengine.index;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Index definition: ordered keys plus options. Used both for planned indexes and for
 * indexes reported by the store, the latter keep the name the store gave them.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class IndexSpec {

    private final String name;
    private final List<IndexKey> keys;
    private final boolean unique;
    private final boolean sparse;

    public static IndexSpec of(@NonNull IndexKey... keys) {
        return of(Arrays.asList(keys), false, false);
    }

    public static IndexSpec of(@NonNull List<IndexKey> keys, boolean unique, boolean sparse) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("index requires at least one key");
        }
        return new IndexSpec(nameOf(keys), Collections.unmodifiableList(keys), unique, sparse);
    }

    public static IndexSpec named(@NonNull String name, @NonNull List<IndexKey> keys, boolean unique, boolean sparse) {
        return new IndexSpec(name, Collections.unmodifiableList(keys), unique, sparse);
    }

    /**
     * Per-key names joined with {@code _} in declaration order, e.g. {@code a_1_b_-1}.
     */
    public static String nameOf(@NonNull List<IndexKey> keys) {
        return keys.stream()
            .map(IndexKey::getName)
            .collect(Collectors.joining("_"));
    }

    public IndexSpec unique(boolean unique) {
        return new IndexSpec(this.name, this.keys, unique, this.sparse);
    }

    public IndexSpec sparse(boolean sparse) {
        return new IndexSpec(this.name, this.keys, this.unique, sparse);
    }

    public boolean isCompound() {
        return this.keys.size() > 1;
    }

    /**
     * Same keys and options, the name is not compared.
     */
    public boolean isEquivalent(@NonNull IndexSpec other) {
        return this.keys.equals(other.keys) && (this.unique == other.unique) && (this.sparse == other.sparse);
    }
}
