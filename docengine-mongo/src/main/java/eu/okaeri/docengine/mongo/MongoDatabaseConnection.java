package eu.okaeri.docengine.mongo;

import com.mongodb.MongoSecurityException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.gridfs.GridFSBuckets;
import eu.okaeri.docengine.collection.CollectionDecorator;
import eu.okaeri.docengine.collection.DebugDocumentCollection;
import eu.okaeri.docengine.collection.DocumentCollection;
import eu.okaeri.docengine.connection.ConnectionSettings;
import eu.okaeri.docengine.connection.DatabaseConnection;
import eu.okaeri.docengine.connection.OperationFlags;
import eu.okaeri.docengine.lob.LargeObjectStore;
import eu.okaeri.docengine.util.ConnectionRetry;
import lombok.Getter;
import lombok.NonNull;
import org.bson.Document;

import java.util.logging.Logger;

/**
 * Connection to a MongoDB database through the synchronous driver.
 * <p>
 * The database is pinged until it answers or {@code CONNECT_TIMEOUT} passes, rejected credentials
 * fail at once. A client created by the connection is closed with it, a client passed in stays open.
 */
public class MongoDatabaseConnection implements DatabaseConnection {

    private static final Logger LOGGER = Logger.getLogger(MongoDatabaseConnection.class.getSimpleName());

    private final @Getter ConnectionSettings settings;
    private final @Getter OperationFlags operationFlags;
    private final @Getter MongoClient client;
    private final @Getter MongoDatabase database;
    private final CollectionDecorator decorator;
    private final boolean ownsClient;
    private volatile GridFsLargeObjectStore largeObjectStore;
    private volatile boolean connected;

    public MongoDatabaseConnection(@NonNull ConnectionSettings settings) {
        this(settings, MongoClients.create(MongoClientSettingsFactory.create(settings)), CollectionDecorator.NONE, true);
    }

    public MongoDatabaseConnection(@NonNull ConnectionSettings settings, @NonNull CollectionDecorator decorator) {
        this(settings, MongoClients.create(MongoClientSettingsFactory.create(settings)), decorator, true);
    }

    public MongoDatabaseConnection(@NonNull ConnectionSettings settings, @NonNull MongoClient client) {
        this(settings, client, CollectionDecorator.NONE, false);
    }

    public MongoDatabaseConnection(@NonNull ConnectionSettings settings, @NonNull MongoClient client, @NonNull CollectionDecorator decorator) {
        this(settings, client, decorator, false);
    }

    private MongoDatabaseConnection(ConnectionSettings settings, MongoClient client, CollectionDecorator decorator, boolean ownsClient) {
        this.settings = settings;
        this.operationFlags = OperationFlags.resolve(settings);
        this.client = client;
        this.decorator = decorator;
        this.ownsClient = ownsClient;
        try {
            this.database = this.connect();
        } catch (RuntimeException exception) {
            if (ownsClient) {
                client.close();
            }
            throw exception;
        }
        this.connected = true;
        if (settings.isDebug()) {
            LOGGER.info("Connected '" + settings.getAlias() + "' to " + settings.getHost() + ":" + settings.getPort()
                + "/" + settings.getName() + " with " + this.operationFlags);
        }
    }

    private MongoDatabase connect() {
        return ConnectionRetry.of(this.settings)
            .connector(() -> {
                MongoDatabase database = this.client.getDatabase(this.settings.getName());
                database.runCommand(new Document("ping", 1));
                return database;
            })
            .retryIf(exception -> !(exception instanceof MongoSecurityException))
            .connect();
    }

    @Override
    public DocumentCollection getCollection(@NonNull String name) {
        this.checkConnected();
        DocumentCollection collection = new MongoDocumentCollection(this.database.getCollection(name));
        if (this.settings.isDebug()) {
            collection = new DebugDocumentCollection(collection);
        }
        return this.decorator.decorate(collection);
    }

    @Override
    public LargeObjectStore getLargeObjectStore() {
        this.checkConnected();
        GridFsLargeObjectStore store = this.largeObjectStore;
        if (store == null) {
            synchronized (this) {
                if (this.largeObjectStore == null) {
                    this.largeObjectStore = new GridFsLargeObjectStore(GridFSBuckets.create(this.database));
                }
                store = this.largeObjectStore;
            }
        }
        return store;
    }

    @Override
    public boolean isConnected() {
        return this.connected;
    }

    @Override
    public void close() {
        if (!this.connected) {
            return;
        }
        this.connected = false;
        if (this.ownsClient) {
            this.client.close();
        }
    }

    private void checkConnected() {
        if (!this.connected) {
            throw new IllegalStateException("connection '" + this.settings.getAlias() + "' is closed");
        }
    }
}
