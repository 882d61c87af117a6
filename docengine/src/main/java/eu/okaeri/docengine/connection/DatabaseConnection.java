package eu.okaeri.docengine.connection;

import eu.okaeri.docengine.collection.DocumentCollection;
import eu.okaeri.docengine.lob.LargeObjectStore;

import java.io.Closeable;

/**
 * A live connection to a document database.
 * <p>
 * Backends implement this interface directly: the in-memory backend lives in the core module,
 * the driver-backed one in {@code docengine-mongo}.
 */
public interface DatabaseConnection extends Closeable {

    ConnectionSettings getSettings();

    /**
     * Write-concern flags resolved from the settings when the connection was created.
     */
    OperationFlags getOperationFlags();

    /**
     * Collection handle for the given collection name. Instrumented when the settings are in debug mode.
     *
     * @param name collection name
     * @return collection handle
     */
    DocumentCollection getCollection(String name);

    /**
     * Store for payloads of large-object fields.
     */
    LargeObjectStore getLargeObjectStore();

    boolean isConnected();

    default String getAlias() {
        return this.getSettings().getAlias();
    }

    @Override
    void close();
}
