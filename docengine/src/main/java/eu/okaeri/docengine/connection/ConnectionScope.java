package eu.okaeri.docengine.connection;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Scoped activation of a connection, see {@link ConnectionRegistry#activate(String, DatabaseConnection)}.
 * Closing the scope always restores the previously active connection, even if closing the scoped one fails.
 */
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public final class ConnectionScope implements AutoCloseable {

    private final @NonNull ConnectionRegistry registry;
    private final @NonNull @Getter String alias;
    private final @NonNull @Getter DatabaseConnection connection;
    private final @Getter DatabaseConnection previous;

    private boolean closeConnection;
    private boolean closed;

    /**
     * Also disconnects the scoped connection when the scope is closed.
     */
    public ConnectionScope closingConnection() {
        this.closeConnection = true;
        return this;
    }

    @Override
    public void close() {
        if (this.closed) {
            return;
        }
        this.closed = true;
        try {
            if (this.closeConnection) {
                this.connection.close();
            }
        } finally {
            this.registry.restore(this.alias, this.previous);
        }
    }
}
