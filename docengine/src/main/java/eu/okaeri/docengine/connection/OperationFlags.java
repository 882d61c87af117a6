package eu.okaeri.docengine.connection;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Write-concern flags per {@link OperationKind}, resolved once per connection.
 * <p>
 * Resolution rules for the {@code OPERATIONS} option:
 * <ul>
 *   <li>a flat map (no operation keys, no nested maps) applies to every operation</li>
 *   <li>a keyed map ({@code save}, {@code update}, {@code delete}/{@code remove}) applies per operation,
 *   missing operations get no flags and unknown keys are ignored</li>
 *   <li>legacy {@code SAFE_INSERTS} and {@code WAIT_FOR_SLAVES} seed {@code save.safe} and {@code save.w}
 *   without overriding explicit entries</li>
 * </ul>
 */
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class OperationFlags {

    private static final Logger LOGGER = Logger.getLogger(OperationFlags.class.getSimpleName());

    public static final String SAFE = "safe";
    public static final String W = "w";
    public static final String WTIMEOUT = "wtimeout";
    public static final String FSYNC = "fsync";
    public static final String JOURNAL = "j";
    public static final String MULTI = "multi";

    private final Map<OperationKind, Map<String, Object>> flags;

    public static OperationFlags empty() {
        Map<OperationKind, Map<String, Object>> flags = new EnumMap<>(OperationKind.class);
        for (OperationKind kind : OperationKind.values()) {
            flags.put(kind, Collections.emptyMap());
        }
        return new OperationFlags(flags);
    }

    @SuppressWarnings("unchecked")
    public static OperationFlags resolve(@NonNull ConnectionSettings settings) {

        Map<String, Object> configured = settings.getOperations();
        Map<OperationKind, Map<String, Object>> resolved = new EnumMap<>(OperationKind.class);
        for (OperationKind kind : OperationKind.values()) {
            resolved.put(kind, new LinkedHashMap<>());
        }

        if (isKeyed(configured)) {
            for (Map.Entry<String, Object> entry : configured.entrySet()) {
                OperationKind kind = OperationKind.byConfigKey(entry.getKey()).orElse(null);
                if (kind == null) {
                    LOGGER.warning("Ignoring write flags for unsupported operation '" + entry.getKey() + "' (supported: save, update, delete)");
                    continue;
                }
                if (!(entry.getValue() instanceof Map)) {
                    throw new IllegalArgumentException("OPERATIONS['" + entry.getKey() + "'] must be a map of flags, got " + entry.getValue());
                }
                resolved.get(kind).putAll((Map<String, Object>) entry.getValue());
            }
        } else {
            resolved.values().forEach(flags -> flags.putAll(configured));
        }

        Map<String, Object> save = resolved.get(OperationKind.SAVE);
        applyLegacy(settings, ConnectionSettings.SAFE_INSERTS, SAFE, save);
        applyLegacy(settings, ConnectionSettings.WAIT_FOR_SLAVES, W, save);

        resolved.replaceAll((kind, flags) -> Collections.unmodifiableMap(flags));
        return new OperationFlags(resolved);
    }

    private static boolean isKeyed(Map<String, Object> configured) {
        return configured.keySet().stream().anyMatch(key -> OperationKind.byConfigKey(key).isPresent())
            || configured.values().stream().anyMatch(value -> value instanceof Map);
    }

    private static void applyLegacy(ConnectionSettings settings, String option, String flag, Map<String, Object> save) {
        Object value = settings.getLegacyFlag(option);
        if (value == null) {
            return;
        }
        LOGGER.warning("The " + option + " setting is deprecated, use OPTIONS['OPERATIONS']['save']['" + flag + "'] instead");
        save.putIfAbsent(flag, value);
    }

    /**
     * @return unmodifiable flags for the operation, never null
     */
    public Map<String, Object> get(@NonNull OperationKind kind) {
        return this.flags.get(kind);
    }

    /**
     * Flags of the operation with additional command options on top, e.g. {@code multi} for bulk updates.
     */
    public Map<String, Object> with(@NonNull OperationKind kind, @NonNull Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(this.get(kind));
        merged.putAll(extra);
        return Collections.unmodifiableMap(merged);
    }
}
