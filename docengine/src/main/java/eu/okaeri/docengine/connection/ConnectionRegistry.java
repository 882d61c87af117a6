package eu.okaeri.docengine.connection;

import eu.okaeri.docengine.DatabaseException;
import lombok.NonNull;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Process-wide registry of active connections keyed by alias.
 * <p>
 * At most one connection is active per alias. {@link #activate(String, DatabaseConnection)} swaps a
 * connection in for the duration of a try-with-resources block and restores the previous one on exit.
 */
public final class ConnectionRegistry {

    private static final Logger LOGGER = Logger.getLogger(ConnectionRegistry.class.getSimpleName());
    private static final ConnectionRegistry GLOBAL = new ConnectionRegistry();

    private final Map<String, DatabaseConnection> connections = new ConcurrentHashMap<>();

    public static ConnectionRegistry global() {
        return GLOBAL;
    }

    /**
     * Registers the connection under its settings alias, replacing any previous one.
     *
     * @return the replaced connection or null
     */
    public DatabaseConnection register(@NonNull DatabaseConnection connection) {
        return this.register(connection.getAlias(), connection);
    }

    public DatabaseConnection register(@NonNull String alias, @NonNull DatabaseConnection connection) {
        return this.connections.put(alias, connection);
    }

    public Optional<DatabaseConnection> find(@NonNull String alias) {
        return Optional.ofNullable(this.connections.get(alias));
    }

    public DatabaseConnection get(@NonNull String alias) {
        DatabaseConnection connection = this.connections.get(alias);
        if (connection == null) {
            throw new DatabaseException("No connection registered under alias '" + alias + "'");
        }
        return connection;
    }

    public DatabaseConnection unregister(@NonNull String alias) {
        return this.connections.remove(alias);
    }

    public ConnectionScope activate(@NonNull DatabaseConnection connection) {
        return this.activate(connection.getAlias(), connection);
    }

    /**
     * Makes the connection active under the alias until the returned scope is closed.
     */
    public ConnectionScope activate(@NonNull String alias, @NonNull DatabaseConnection connection) {
        DatabaseConnection previous = this.connections.put(alias, connection);
        return new ConnectionScope(this, alias, connection, previous);
    }

    void restore(@NonNull String alias, DatabaseConnection previous) {
        if (previous == null) {
            this.connections.remove(alias);
        } else {
            this.connections.put(alias, previous);
        }
    }

    /**
     * Closes and forgets every registered connection.
     */
    public void closeAll() {
        for (Map.Entry<String, DatabaseConnection> entry : this.connections.entrySet()) {
            try {
                entry.getValue().close();
            } catch (RuntimeException exception) {
                LOGGER.warning("Failed to close connection '" + entry.getKey() + "': " + exception.getMessage());
            }
        }
        this.connections.clear();
    }
}
