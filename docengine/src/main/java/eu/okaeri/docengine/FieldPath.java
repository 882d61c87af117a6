package eu.okaeri.docengine;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Dotted path into a model document, e.g. {@code raw} or {@code raw.a}.
 * The first element always names a model field; the rest addresses embedded content.
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldPath {

    public static final String SEPARATOR = ".";

    private final String value;

    public static FieldPath of(@NonNull String path) {
        if (path.isEmpty() || path.startsWith(SEPARATOR) || path.endsWith(SEPARATOR)) {
            throw new IllegalArgumentException("invalid field path: '" + path + "'");
        }
        return new FieldPath(path);
    }

    public String getHead() {
        int index = this.value.indexOf(SEPARATOR);
        return (index == -1) ? this.value : this.value.substring(0, index);
    }

    public String getTail() {
        int index = this.value.indexOf(SEPARATOR);
        return (index == -1) ? "" : this.value.substring(index + 1);
    }

    public boolean isNested() {
        return this.value.contains(SEPARATOR);
    }

    /**
     * Replaces the model field name with its storage column, keeping the embedded part.
     */
    public String toStoragePath(@NonNull String column) {
        return this.isNested() ? (column + SEPARATOR + this.getTail()) : column;
    }

    @Override
    public String toString() {
        return this.value;
    }
}
