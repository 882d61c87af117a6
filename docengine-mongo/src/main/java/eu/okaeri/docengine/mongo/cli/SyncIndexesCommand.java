package eu.okaeri.docengine.mongo.cli;

import eu.okaeri.docengine.DatabaseException;
import eu.okaeri.docengine.connection.ConnectionSettings;
import eu.okaeri.docengine.connection.DatabaseConnection;
import eu.okaeri.docengine.index.IndexSyncReport;
import eu.okaeri.docengine.index.IndexSynchronizer;
import eu.okaeri.docengine.model.ModelDescriptor;
import eu.okaeri.docengine.model.ModelRegistry;
import eu.okaeri.docengine.mongo.MongoDatabaseConnection;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Creates missing indexes of annotated model classes.
 * <p>
 * Prints one {@code <collection>: <index>} line per created index and exits with 0, or prints the
 * failure and exits with 1.
 */
@CommandLine.Command(name = "sync-indexes", mixinStandardHelpOptions = true,
    description = "Creates the declared indexes of the given model classes that are missing from the database")
public class SyncIndexesCommand implements Callable<Integer> {

    @CommandLine.Option(names = {"-H", "--host"}, description = "database host", defaultValue = "localhost")
    private String host;

    @CommandLine.Option(names = {"-p", "--port"}, description = "database port", defaultValue = "27017")
    private int port;

    @CommandLine.Option(names = {"-d", "--database"}, description = "database name", required = true)
    private String database;

    @CommandLine.Option(names = {"-u", "--user"}, description = "user name")
    private String user;

    @CommandLine.Option(names = "--password", description = "password")
    private String password;

    @CommandLine.Option(names = {"-o", "--option"}, description = "connection option, e.g. CONNECT_TIMEOUT=10")
    private Map<String, String> options = new LinkedHashMap<>();

    @CommandLine.Parameters(arity = "1..*", paramLabel = "MODEL", description = "fully qualified names of @Model classes")
    private List<String> modelClasses = new ArrayList<>();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final Function<ConnectionSettings, DatabaseConnection> connectionFactory;

    public SyncIndexesCommand() {
        this(MongoDatabaseConnection::new);
    }

    public SyncIndexesCommand(Function<ConnectionSettings, DatabaseConnection> connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new SyncIndexesCommand()).execute(args));
    }

    @Override
    public Integer call() {

        PrintWriter out = this.spec.commandLine().getOut();
        PrintWriter err = this.spec.commandLine().getErr();

        try {
            ModelRegistry registry = new ModelRegistry();
            List<ModelDescriptor> models = new ArrayList<>();
            for (String className : this.modelClasses) {
                models.add(registry.register(Class.forName(className, true, Thread.currentThread().getContextClassLoader())));
            }

            try (DatabaseConnection connection = this.connectionFactory.apply(this.settings())) {
                for (IndexSyncReport report : new IndexSynchronizer(connection).synchronizeAll(models)) {
                    for (String index : report.getCreated()) {
                        out.println(report.getCollection() + ": " + index);
                    }
                }
            }
        } catch (ClassNotFoundException exception) {
            err.println("sync-indexes: model class not found: " + exception.getMessage());
            return 1;
        } catch (DatabaseException | IllegalArgumentException exception) {
            err.println("sync-indexes: " + exception.getMessage());
            return 1;
        } catch (RuntimeException exception) {
            err.println("sync-indexes: " + exception.getClass().getSimpleName() + ": " + exception.getMessage());
            return 1;
        }

        out.flush();
        return 0;
    }

    private ConnectionSettings settings() {
        ConnectionSettings.ConnectionSettingsBuilder builder = ConnectionSettings.builder()
            .host(this.host)
            .port(this.port)
            .name(this.database)
            .user(this.user)
            .password(this.password);
        this.options.forEach(builder::option);
        return builder.build();
    }
}
