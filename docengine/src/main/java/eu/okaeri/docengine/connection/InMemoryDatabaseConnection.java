package eu.okaeri.docengine.connection;

import eu.okaeri.docengine.collection.CollectionDecorator;
import eu.okaeri.docengine.collection.DebugDocumentCollection;
import eu.okaeri.docengine.collection.DocumentCollection;
import eu.okaeri.docengine.collection.InMemoryDatabase;
import eu.okaeri.docengine.lob.LargeObjectStore;
import lombok.Getter;
import lombok.NonNull;

import java.util.logging.Logger;

/**
 * Connection to an {@link InMemoryDatabase}. Used for tests and embedded use, behaves like the driver-backed
 * connection for everything the engine issues.
 */
public class InMemoryDatabaseConnection implements DatabaseConnection {

    private static final Logger LOGGER = Logger.getLogger(InMemoryDatabaseConnection.class.getSimpleName());

    private final @Getter ConnectionSettings settings;
    private final @Getter OperationFlags operationFlags;
    private final @Getter InMemoryDatabase database;
    private final CollectionDecorator decorator;
    private volatile boolean connected = true;

    public InMemoryDatabaseConnection(@NonNull ConnectionSettings settings) {
        this(settings, new InMemoryDatabase(settings.getName()));
    }

    public InMemoryDatabaseConnection(@NonNull ConnectionSettings settings, @NonNull InMemoryDatabase database) {
        this(settings, database, CollectionDecorator.NONE);
    }

    /**
     * @param decorator applied to every collection handle, after the debug instrumentation
     */
    public InMemoryDatabaseConnection(@NonNull ConnectionSettings settings, @NonNull InMemoryDatabase database, @NonNull CollectionDecorator decorator) {
        this.settings = settings;
        this.operationFlags = OperationFlags.resolve(settings);
        this.database = database;
        this.decorator = decorator;
        if (settings.isDebug()) {
            LOGGER.info("Using in-memory database '" + database.getName() + "' for alias '" + settings.getAlias() + "' with " + this.operationFlags);
        }
    }

    @Override
    public DocumentCollection getCollection(@NonNull String name) {
        this.checkConnected();
        DocumentCollection collection = this.database.getCollection(name);
        if (this.settings.isDebug()) {
            collection = new DebugDocumentCollection(collection);
        }
        return this.decorator.decorate(collection);
    }

    @Override
    public LargeObjectStore getLargeObjectStore() {
        this.checkConnected();
        return this.database.getLargeObjectStore();
    }

    @Override
    public boolean isConnected() {
        return this.connected;
    }

    @Override
    public void close() {
        this.connected = false;
    }

    private void checkConnected() {
        if (!this.connected) {
            throw new IllegalStateException("connection '" + this.settings.getAlias() + "' is closed");
        }
    }
}
