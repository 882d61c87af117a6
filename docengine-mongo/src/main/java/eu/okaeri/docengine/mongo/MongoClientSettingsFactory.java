package eu.okaeri.docengine.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ReadPreference;
import com.mongodb.ServerAddress;
import eu.okaeri.docengine.connection.ConnectionSettings;
import lombok.NonNull;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Driver client settings of a connection: {@code SLAVE_OKAY} reads from secondaries,
 * {@code NETWORK_TIMEOUT} bounds socket reads and {@code CONNECT_TIMEOUT} socket connects.
 */
public final class MongoClientSettingsFactory {

    private MongoClientSettingsFactory() {
    }

    public static MongoClientSettings create(@NonNull ConnectionSettings settings) {
        return builder(settings).build();
    }

    public static MongoClientSettings.Builder builder(@NonNull ConnectionSettings settings) {

        MongoClientSettings.Builder builder = MongoClientSettings.builder()
            .applicationName("okaeri-docengine")
            .applyToClusterSettings(cluster -> {
                cluster.hosts(Collections.singletonList(new ServerAddress(settings.getHost(), settings.getPort())));
                settings.getReplicaSet().ifPresent(cluster::requiredReplicaSetName);
            });

        if (settings.isSlaveOkay()) {
            builder.readPreference(ReadPreference.secondaryPreferred());
        }

        Optional<Duration> networkTimeout = settings.getNetworkTimeout();
        Optional<Duration> connectTimeout = settings.getConnectTimeout();
        builder.applyToSocketSettings(socket -> {
            networkTimeout.ifPresent(timeout -> socket.readTimeout((int) timeout.toMillis(), TimeUnit.MILLISECONDS));
            connectTimeout.ifPresent(timeout -> socket.connectTimeout((int) timeout.toMillis(), TimeUnit.MILLISECONDS));
        });

        if ((settings.getUser() != null) && !settings.getUser().isEmpty()) {
            char[] password = (settings.getPassword() == null) ? new char[0] : settings.getPassword().toCharArray();
            builder.credential(MongoCredential.createCredential(settings.getUser(), settings.getName(), password));
        }

        return builder;
    }
}
