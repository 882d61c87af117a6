package eu.okaeri.docengine.connection;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;
import org.bson.Document;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Connection settings of a single database alias.
 * <p>
 * Mirrors the classic settings dictionary: {@code NAME}, {@code HOST}, {@code PORT}, {@code USER},
 * {@code PASSWORD}, {@code OPTIONS} and the legacy top-level flags. Use {@link #fromMap(Map)} to
 * parse such a dictionary or the builder for typed construction.
 */
@Getter
@ToString(exclude = "password")
@Builder(toBuilder = true)
public class ConnectionSettings {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.platform.debug", "false"));

    public static final String DEFAULT_ALIAS = "default";

    public static final String SLAVE_OKAY = "SLAVE_OKAY";
    public static final String NETWORK_TIMEOUT = "NETWORK_TIMEOUT";
    public static final String TZ_AWARE = "TZ_AWARE";
    public static final String DOCUMENT_CLASS = "DOCUMENT_CLASS";
    public static final String OPERATIONS = "OPERATIONS";
    public static final String CONNECT_TIMEOUT = "CONNECT_TIMEOUT";
    public static final String REPLICA_SET = "REPLICA_SET";
    public static final String AUTOMATIC_REFERENCING = "AUTOMATIC_REFERENCING";

    public static final String SAFE_INSERTS = "SAFE_INSERTS";
    public static final String WAIT_FOR_SLAVES = "WAIT_FOR_SLAVES";

    @Builder.Default
    private final String alias = DEFAULT_ALIAS;
    @Builder.Default
    private final String host = "localhost";
    @Builder.Default
    private final int port = 27017;
    @NonNull
    private final String name;
    private final String user;
    private final String password;
    @Builder.Default
    private final boolean debug = DEBUG;

    @Singular
    private final Map<String, Object> options;
    @Singular
    private final Map<String, Object> legacyFlags;

    /**
     * Parses a settings dictionary. Unknown top-level keys are ignored.
     */
    @SuppressWarnings("unchecked")
    public static ConnectionSettings fromMap(@NonNull Map<String, ?> settings) {

        Object name = settings.get("NAME");
        if (name == null) {
            throw new IllegalArgumentException("NAME is required in database settings");
        }

        ConnectionSettingsBuilder builder = builder().name(String.valueOf(name));
        if (settings.get("ALIAS") != null) {
            builder.alias(String.valueOf(settings.get("ALIAS")));
        }
        if (settings.get("HOST") != null && !String.valueOf(settings.get("HOST")).isEmpty()) {
            builder.host(String.valueOf(settings.get("HOST")));
        }
        if (settings.get("PORT") != null && !String.valueOf(settings.get("PORT")).isEmpty()) {
            builder.port(Integer.parseInt(String.valueOf(settings.get("PORT"))));
        }
        if (settings.get("USER") != null) {
            builder.user(String.valueOf(settings.get("USER")));
        }
        if (settings.get("PASSWORD") != null) {
            builder.password(String.valueOf(settings.get("PASSWORD")));
        }
        if (settings.get("DEBUG") != null) {
            builder.debug(Boolean.parseBoolean(String.valueOf(settings.get("DEBUG"))));
        }

        Object options = settings.get("OPTIONS");
        if (options instanceof Map) {
            builder.options((Map<String, Object>) options);
        } else if (options != null) {
            throw new IllegalArgumentException("OPTIONS must be a map, got " + options);
        }

        for (String legacy : new String[]{SAFE_INSERTS, WAIT_FOR_SLAVES}) {
            if (settings.containsKey(legacy)) {
                builder.legacyFlag(legacy, settings.get(legacy));
            }
        }

        return builder.build();
    }

    /**
     * Copy of these settings with top-level keys and options replaced, the
     * equivalent of {@code dict(settings, **overrides)}.
     */
    @SuppressWarnings("unchecked")
    public ConnectionSettings with(@NonNull Map<String, ?> overrides) {
        Map<String, Object> merged = this.toMap();
        merged.putAll(overrides);
        return fromMap(merged);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("ALIAS", this.alias);
        map.put("NAME", this.name);
        map.put("HOST", this.host);
        map.put("PORT", this.port);
        if (this.user != null) map.put("USER", this.user);
        if (this.password != null) map.put("PASSWORD", this.password);
        map.put("DEBUG", this.debug);
        map.put("OPTIONS", new LinkedHashMap<>(this.options));
        map.putAll(this.legacyFlags);
        return map;
    }

    public boolean isSlaveOkay() {
        return this.booleanOption(SLAVE_OKAY);
    }

    public boolean isTzAware() {
        return this.booleanOption(TZ_AWARE);
    }

    public boolean isAutomaticReferencing() {
        return this.booleanOption(AUTOMATIC_REFERENCING);
    }

    public Optional<Duration> getNetworkTimeout() {
        return this.durationOption(NETWORK_TIMEOUT);
    }

    public Optional<Duration> getConnectTimeout() {
        return this.durationOption(CONNECT_TIMEOUT);
    }

    public Optional<String> getReplicaSet() {
        return Optional.ofNullable(this.options.get(REPLICA_SET)).map(String::valueOf);
    }

    @SuppressWarnings("unchecked")
    public Class<? extends Map<String, Object>> getDocumentClass() {
        Object value = this.options.get(DOCUMENT_CLASS);
        if (value == null) {
            return Document.class;
        }
        Class<?> type;
        if (value instanceof Class) {
            type = (Class<?>) value;
        } else {
            try {
                type = Class.forName(String.valueOf(value));
            } catch (ClassNotFoundException exception) {
                throw new IllegalArgumentException("DOCUMENT_CLASS " + value + " cannot be loaded", exception);
            }
        }
        if (!Map.class.isAssignableFrom(type)) {
            throw new IllegalArgumentException("DOCUMENT_CLASS must implement java.util.Map, got " + type.getName());
        }
        return (Class<? extends Map<String, Object>>) type;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getOperations() {
        Object operations = this.options.get(OPERATIONS);
        if (operations == null) {
            return Collections.emptyMap();
        }
        if (!(operations instanceof Map)) {
            throw new IllegalArgumentException("OPTIONS['OPERATIONS'] must be a map, got " + operations);
        }
        return (Map<String, Object>) operations;
    }

    /**
     * Legacy flags are accepted on the top level and inside {@code OPTIONS}, the top level wins.
     */
    public Object getLegacyFlag(@NonNull String name) {
        Object value = this.legacyFlags.get(name);
        return (value != null) ? value : this.options.get(name);
    }

    private boolean booleanOption(String name) {
        Object value = this.options.get(name);
        return (value instanceof Boolean) ? (Boolean) value : ((value != null) && Boolean.parseBoolean(String.valueOf(value)));
    }

    private Optional<Duration> durationOption(String name) {
        Object value = this.options.get(name);
        if (value == null) {
            return Optional.empty();
        }
        double seconds = (value instanceof Number) ? ((Number) value).doubleValue() : Double.parseDouble(String.valueOf(value));
        return Optional.of(Duration.ofMillis((long) (seconds * 1000)));
    }
}
