package eu.okaeri.docengine.connection;

import lombok.Getter;
import lombok.NonNull;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Write operations that can carry their own write-concern flags.
 */
@Getter
public enum OperationKind {

    SAVE("save"),
    UPDATE("update"),
    REMOVE("remove", "delete");

    private final String name;
    private final List<String> configKeys;

    OperationKind(String name, String... aliases) {
        this.name = name;
        String[] keys = Arrays.copyOf(aliases, aliases.length + 1);
        keys[aliases.length] = name;
        this.configKeys = Arrays.asList(keys);
    }

    /**
     * Resolves a key of the {@code OPERATIONS} option, {@code delete} and {@code remove} both map to {@link #REMOVE}.
     */
    public static Optional<OperationKind> byConfigKey(@NonNull String key) {
        return Arrays.stream(values())
            .filter(kind -> kind.configKeys.contains(key))
            .findFirst();
    }
}
