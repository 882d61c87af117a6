package eu.okaeri.docengine.mongo.cli;

import eu.okaeri.docengine.collection.InMemoryDatabase;
import eu.okaeri.docengine.connection.ConnectionSettings;
import eu.okaeri.docengine.connection.InMemoryDatabaseConnection;
import eu.okaeri.docengine.index.IndexKey;
import eu.okaeri.docengine.index.IndexSpec;
import eu.okaeri.docengine.model.annotation.Model;
import eu.okaeri.docengine.model.annotation.ModelField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SyncIndexesCommandTest {

    @Model
    public static class Account {
        @ModelField(unique = true)
        private String email;
        @ModelField(index = true)
        private String name;
        private int logins;
    }

    @Model
    public static class Session {
        @ModelField(references = Account.class)
        private Object account;
        @ModelField(descending = true)
        private LocalDateTime started;
        @ModelField(sparse = true)
        private String token;
    }

    private InMemoryDatabase database;
    private List<ConnectionSettings> connections;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        this.database = new InMemoryDatabase("shop");
        this.connections = new ArrayList<>();
        this.out = new StringWriter();
        this.err = new StringWriter();
    }

    private int run(String... args) {
        SyncIndexesCommand command = new SyncIndexesCommand(settings -> {
            this.connections.add(settings);
            return new InMemoryDatabaseConnection(settings, this.database);
        });
        return new CommandLine(command)
            .setOut(new PrintWriter(this.out))
            .setErr(new PrintWriter(this.err))
            .execute(args);
    }

    private List<String> outputLines() {
        return Arrays.stream(this.out.toString().split("\\R"))
            .filter(line -> !line.isEmpty())
            .collect(Collectors.toList());
    }

    @Test
    void creates_missing_indexes_and_prints_them() {
        int exitCode = this.run("-d", "shop", Account.class.getName(), Session.class.getName());

        assertThat(exitCode).isZero();
        assertThat(this.outputLines()).containsExactlyInAnyOrder(
            "account: email_1",
            "account: name_1",
            "session: account_id_1",
            "session: started_-1",
            "session: token_1");
        assertThat(this.database.getCollection("account").indexInformation()).containsKeys("_id_", "email_1", "name_1");
        assertThat(this.err.toString()).isEmpty();
    }

    @Test
    void second_run_creates_nothing() {
        assertThat(this.run("-d", "shop", Account.class.getName())).isZero();
        this.out.getBuffer().setLength(0);

        assertThat(this.run("-d", "shop", Account.class.getName())).isZero();
        assertThat(this.outputLines()).isEmpty();
    }

    @Test
    void connection_settings_come_from_options() {
        this.run("--host", "db.example.com", "-p", "27018", "-d", "shop", "-u", "admin", "--password", "secret",
            "-o", "SLAVE_OKAY=true", "-o", "CONNECT_TIMEOUT=2.5", Account.class.getName());

        assertThat(this.connections).hasSize(1);
        ConnectionSettings settings = this.connections.get(0);
        assertThat(settings.getHost()).isEqualTo("db.example.com");
        assertThat(settings.getPort()).isEqualTo(27018);
        assertThat(settings.getName()).isEqualTo("shop");
        assertThat(settings.getUser()).isEqualTo("admin");
        assertThat(settings.getPassword()).isEqualTo("secret");
        assertThat(settings.isSlaveOkay()).isTrue();
        assertThat(settings.getConnectTimeout()).hasValueSatisfying(timeout -> assertThat(timeout.toMillis()).isEqualTo(2500));
    }

    @Test
    void conflicting_index_fails_with_exit_code_one() {
        this.database.getCollection("account").createIndex(IndexSpec.of(IndexKey.asc("email")));

        int exitCode = this.run("-d", "shop", Account.class.getName());

        assertThat(exitCode).isEqualTo(1);
        assertThat(this.err.toString())
            .startsWith("sync-indexes: ")
            .contains("email_1")
            .contains("account");
    }

    @Test
    void unknown_model_class_fails_with_exit_code_one() {
        int exitCode = this.run("-d", "shop", "com.example.Missing");

        assertThat(exitCode).isEqualTo(1);
        assertThat(this.err.toString()).contains("model class not found: com.example.Missing");
        assertThat(this.connections).isEmpty();
    }

    @Test
    void missing_database_is_a_usage_error() {
        int exitCode = this.run(Account.class.getName());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(this.err.toString()).contains("--database");
    }
}
