package eu.okaeri.docengine.document;

import eu.okaeri.docengine.collection.InMemoryDatabase;
import eu.okaeri.docengine.connection.ConnectionRegistry;
import eu.okaeri.docengine.connection.ConnectionScope;
import eu.okaeri.docengine.connection.ConnectionSettings;
import eu.okaeri.docengine.connection.DatabaseConnection;
import eu.okaeri.docengine.connection.InMemoryDatabaseConnection;
import eu.okaeri.docengine.filter.FindFilter;
import eu.okaeri.docengine.filter.OrderBy;
import eu.okaeri.docengine.fixture.RecordingDocumentCollection;
import eu.okaeri.docengine.fixture.TestModels;
import eu.okaeri.docengine.model.ModelDescriptor;
import eu.okaeri.docengine.model.ModelRegistry;
import eu.okaeri.docengine.ref.LazyModelReference;
import eu.okaeri.docengine.ref.UnserializableReferenceException;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static eu.okaeri.docengine.filter.condition.Condition.on;
import static eu.okaeri.docengine.filter.predicate.SimplePredicate.*;
import static eu.okaeri.docengine.fixture.Maps.map;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelManagerTest {

    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        this.registry = new ModelRegistry();
    }

    private static DatabaseConnection connection(Map<String, Object> options) {
        ConnectionSettings.ConnectionSettingsBuilder builder = ConnectionSettings.builder().name("test");
        options.forEach(builder::option);
        return new InMemoryDatabaseConnection(builder.build());
    }

    private ModelManager manager(ModelDescriptor model, DatabaseConnection connection) {
        return new ModelManager(model, () -> connection, this.registry);
    }

    private static List<Object> names(List<ModelInstance> instances) {
        return instances.stream().map(instance -> instance.get("name")).collect(Collectors.toList());
    }

    @Test
    void create_filter_and_get() {
        ModelManager people = this.manager(TestModels.person(), connection(map()));
        people.create(map("name", "Alice", "age", 30));
        people.create(map("name", "Bob", "age", 25, "nickname", "Bobby"));

        assertThat(names(people.filter(on("age", gt(26))))).containsExactly("Alice");
        assertThat(people.get(on("nickname", eq("Bobby"))).get("name")).isEqualTo("Bob");
        assertThat(names(people.find(FindFilter.builder().orderBy(OrderBy.asc("age")).build()))).containsExactly("Bob", "Alice");
        assertThat(names(people.find(FindFilter.builder().orderBy(OrderBy.asc("age")).skip(1).limit(1).build()))).containsExactly("Alice");
        assertThat(people.count()).isEqualTo(2);
        assertThat(people.count(on("age", lt(26)))).isEqualTo(1);
    }

    @Test
    void save_assigns_id_and_replaces_on_second_save() {
        ModelManager people = this.manager(TestModels.person(), connection(map()));

        ModelInstance alice = people.newInstance().set("name", "Alice");
        alice.save();
        assertThat(alice.getId()).isInstanceOf(ObjectId.class);
        assertThat(alice.isSaved()).isTrue();

        alice.set("age", 31).save();
        assertThat(people.count()).isEqualTo(1);
        assertThat(people.get(alice.getId()).get("age")).isEqualTo(31);
        assertThat(people.get(((ObjectId) alice.getId()).toHexString())).isEqualTo(alice);
    }

    @Test
    void values_round_trip_by_type() {
        ModelManager people = this.manager(TestModels.person(), connection(map()));
        LocalDateTime born = LocalDateTime.of(1990, 5, 17, 12, 30, 15);

        ModelInstance saved = people.create(map("name", "Alice", "age", 30, "balance", new BigDecimal("10.50"), "born", born, "active", true));
        ModelInstance loaded = people.get(saved.getId());

        assertThat(loaded.get("age")).isEqualTo(30);
        assertThat(loaded.get("balance", BigDecimal.class)).isEqualByComparingTo("10.5");
        assertThat(loaded.get("born")).isEqualTo(born);
        assertThat(loaded.get("active")).isEqualTo(true);
        assertThat(loaded.get("nickname")).isNull();
    }

    @Test
    void tz_aware_connection_reads_utc_datetimes() {
        ModelManager people = this.manager(TestModels.person(), connection(map(ConnectionSettings.TZ_AWARE, true)));
        LocalDateTime born = LocalDateTime.of(2001, 1, 2, 3, 4, 5);

        ModelInstance saved = people.create(map("name", "Alice", "born", born));

        assertThat(people.get(saved.getId()).get("born")).isEqualTo(ZonedDateTime.of(born, ZoneOffset.UTC));
    }

    @Test
    void raw_values_round_trip() {
        ModelManager raw = this.manager(TestModels.raw(), connection(map()));
        raw.create(map("raw", Collections.singletonList("foo")));
        raw.create(map("raw", map("bar", "buzz")));
        raw.create(map("raw", Arrays.asList(map("a", 1), map("a", 2))));

        assertThat(raw.get(on("raw", eq("foo"))).get("raw")).isEqualTo(Collections.singletonList("foo"));
        assertThat(raw.get(on("raw.bar", eq("buzz"))).get("raw")).isEqualTo(map("bar", "buzz"));
        assertThat(raw.get(on("raw", attr("a", 2))).get("raw")).isEqualTo(Arrays.asList(map("a", 1), map("a", 2)));
        assertThat(raw.filter(on("raw", attr("a", 3)))).isEmpty();
    }

    @Test
    void attribute_match_ignores_other_keys_of_the_element() {
        ModelManager raw = this.manager(TestModels.raw(), connection(map()));
        ModelInstance first = raw.create(map("raw", Collections.singletonList(map("a", 1, "b", 2))));
        ModelInstance second = raw.create(map("raw", Collections.singletonList(map("a", 1, "b", 3))));

        assertThat(raw.filter(on("raw", attr("a", 1)))).containsExactlyInAnyOrder(first, second);
        assertThat(raw.filter(on("raw", attr("b", 2)))).containsExactly(first);
        assertThat(raw.filter(on("raw", attr("b", 3)))).containsExactly(second);
    }

    @Test
    void document_class_applies_to_raw_results() {
        ModelManager people = this.manager(TestModels.person(), connection(map(ConnectionSettings.DOCUMENT_CLASS, TreeMap.class)));
        people.create(map("name", "Alice", "nickname", "Al"));

        List<Map<String, Object>> documents = people.findRaw(FindFilter.where(null));

        assertThat(documents).hasSize(1);
        assertThat(documents.get(0)).isInstanceOf(TreeMap.class).containsEntry("nick", "Al").containsKey("_id");
    }

    @Test
    void invalid_identifier_is_rejected() {
        ModelManager raw = this.manager(TestModels.raw(), connection(map()));

        assertThatThrownBy(() -> raw.create(map("id", "helloworldwhatsup")))
            .isInstanceOf(InvalidIdentifierException.class)
            .hasMessage("AutoField (default primary key) values must be strings representing an ObjectId on MongoDB (got 'helloworldwhatsup' instead)");
    }

    @Test
    void invalid_identifier_carries_model_hint() {
        ModelManager sites = this.manager(TestModels.site(), connection(map()));

        assertThatThrownBy(() -> sites.get("5"))
            .isInstanceOf(InvalidIdentifierException.class)
            .hasMessageEndingWith(". " + TestModels.SITE_HINT);
    }

    @Test
    void get_requires_exactly_one_match() {
        ModelManager people = this.manager(TestModels.person(), connection(map()));
        people.create(map("name", "Alice", "age", 30));
        people.create(map("name", "Bob", "age", 30));

        assertThatThrownBy(() -> people.get(on("age", eq(30))))
            .isInstanceOf(MultipleObjectsReturnedException.class)
            .hasMessageContaining("Person");
        assertThatThrownBy(() -> people.get(on("age", eq(99))))
            .isInstanceOf(ObjectNotFoundException.class)
            .hasMessage("Person matching query does not exist.");
        assertThatThrownBy(() -> people.get(new ObjectId()))
            .isInstanceOf(ObjectNotFoundException.class);
        assertThat(people.find(new ObjectId())).isEmpty();
    }

    @Test
    void update_touches_every_match() {
        ModelManager people = this.manager(TestModels.person(), connection(map()));
        people.create(map("name", "Alice", "age", 30));
        people.create(map("name", "Bob", "age", 25));
        people.create(map("name", "Carol", "age", 40));

        assertThat(people.update(on("age", lt(35)), map("active", true))).isEqualTo(2);
        assertThat(people.count(on("active", eq(true)))).isEqualTo(2);

        assertThat(people.update(map("nickname", "x"))).isEqualTo(3);
        assertThat(people.count(on("nickname", eq("x")))).isEqualTo(3);
    }

    @Test
    void delete_instance_and_condition() {
        ModelManager people = this.manager(TestModels.person(), connection(map()));
        ModelInstance alice = people.create(map("name", "Alice", "age", 30));
        people.create(map("name", "Bob", "age", 25));
        people.create(map("name", "Carol", "age", 40));

        assertThat(alice.delete()).isTrue();
        assertThat(alice.delete()).isFalse();
        assertThat(alice.getId()).isNotNull();
        assertThat(people.newInstance().delete()).isFalse();

        assertThat(people.delete(on("age", lt(30)))).isEqualTo(1);
        assertThat(names(people.all())).containsExactly("Carol");
        assertThat(people.deleteAll()).isEqualTo(1);
        assertThat(people.count()).isZero();
    }

    @Test
    void manager_rejects_foreign_instances_and_unbound_instances() {
        ModelManager people = this.manager(TestModels.person(), connection(map()));
        ModelInstance blog = new ModelInstance(TestModels.blog());

        assertThatThrownBy(() -> people.save(blog)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(blog::save).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void foreign_key_requires_saved_target() {
        DatabaseConnection connection = connection(map());
        ModelManager blogs = this.manager(TestModels.blog(), connection);
        ModelManager posts = this.manager(TestModels.post(), connection);

        ModelInstance unsaved = blogs.newInstance().set("title", "draft");

        assertThatThrownBy(() -> posts.create(map("title", "hello", "blog", unsaved)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("save() prohibited to prevent data loss due to unsaved related object 'blog'");
    }

    @Test
    void foreign_key_loads_as_lazy_reference() {
        DatabaseConnection connection = connection(map());
        ModelManager blogs = this.manager(TestModels.blog(), connection);
        ModelManager posts = this.manager(TestModels.post(), connection);

        ModelInstance blog = blogs.create(map("title", "news"));
        ModelInstance post = posts.create(map("title", "hello", "blog", blog));

        Object reference = posts.get(post.getId()).get("blog");
        assertThat(reference).isInstanceOf(LazyModelReference.class);
        LazyModelReference lazy = (LazyModelReference) reference;
        assertThat(lazy.isResolved()).isFalse();
        assertThat(lazy).isEqualTo(blog);
        assertThat(lazy.isResolved()).isFalse();
        assertThat(lazy.get("title")).isEqualTo("news");
        assertThat(lazy.isResolved()).isTrue();

        assertThat(posts.filter(on("blog", eq(blog)))).containsExactly(post);
        assertThat(posts.filter(on("blog", eq(blog.getId())))).hasSize(1);
    }

    @Test
    void model_instances_in_raw_values_need_automatic_referencing() {
        DatabaseConnection connection = connection(map());
        ModelManager blogs = this.manager(TestModels.blog(), connection);
        ModelManager raw = this.manager(TestModels.raw(), connection);
        ModelInstance blog = blogs.create(map("title", "news"));

        assertThatThrownBy(() -> raw.create(map("raw", Collections.singletonList(blog))))
            .isInstanceOf(UnserializableReferenceException.class)
            .hasMessageContaining("AUTOMATIC_REFERENCING");
        assertThat(raw.count()).isZero();
    }

    @Test
    void automatic_referencing_saves_and_resolves_references() {
        DatabaseConnection connection = connection(map(ConnectionSettings.AUTOMATIC_REFERENCING, true));
        ModelManager blogs = this.manager(TestModels.blog(), connection);
        ModelManager raw = this.manager(TestModels.raw(), connection);

        ModelInstance blog = blogs.newInstance().set("title", "news");
        ModelInstance saved = raw.create(map("raw", Collections.singletonList(blog)));

        assertThat(blog.isSaved()).isTrue();
        assertThat(blogs.count()).isEqualTo(1);

        List<?> loaded = (List<?>) raw.get(saved.getId()).get("raw");
        assertThat(loaded).hasSize(1);
        LazyModelReference reference = (LazyModelReference) loaded.get(0);
        assertThat(reference.isResolved()).isFalse();
        assertThat(reference).isEqualTo(blog);
        assertThat(reference.orThrow().get("title")).isEqualTo("news");
        assertThat(reference.isResolved()).isTrue();
    }

    @Test
    void write_flags_reach_the_collection() {
        List<RecordingDocumentCollection.Call> calls = RecordingDocumentCollection.newCallLog();
        DatabaseConnection connection = new InMemoryDatabaseConnection(ConnectionSettings.builder().name("test").build(),
            new InMemoryDatabase("test"), RecordingDocumentCollection.decorator(calls));
        ModelManager people = this.manager(TestModels.person(), connection);

        people.create(map("name", "Alice"));
        people.update(map("age", 3));
        people.deleteAll();

        assertThat(calls).containsExactly(
            new RecordingDocumentCollection.Call("save", map()),
            new RecordingDocumentCollection.Call("update", map("multi", true)),
            new RecordingDocumentCollection.Call("remove", map()));
    }

    @Test
    void flat_write_flags_apply_to_every_operation() {
        List<RecordingDocumentCollection.Call> calls = RecordingDocumentCollection.newCallLog();
        ConnectionSettings settings = ConnectionSettings.builder()
            .name("test")
            .option(ConnectionSettings.OPERATIONS, map("safe", true, "w", true))
            .build();
        DatabaseConnection connection = new InMemoryDatabaseConnection(settings, new InMemoryDatabase("test"), RecordingDocumentCollection.decorator(calls));
        ModelManager people = this.manager(TestModels.person(), connection);

        ModelInstance alice = people.create(map("name", "Alice"));
        people.update(on("name", eq("Alice")), map("age", 3));
        alice.delete();

        assertThat(calls).containsExactly(
            new RecordingDocumentCollection.Call("save", map("safe", true, "w", true)),
            new RecordingDocumentCollection.Call("update", map("safe", true, "w", true, "multi", true)),
            new RecordingDocumentCollection.Call("remove", map("safe", true, "w", true)));
    }

    @Test
    void alias_manager_follows_activated_connection() {
        String alias = "model-manager-test";
        DatabaseConnection first = new InMemoryDatabaseConnection(ConnectionSettings.builder().alias(alias).name("first").build());
        DatabaseConnection second = new InMemoryDatabaseConnection(ConnectionSettings.builder().alias(alias).name("second").build());
        ModelManager people = ModelManager.of(TestModels.person(), alias);

        try (ConnectionScope ignored = ConnectionRegistry.global().activate(first)) {
            people.create(map("name", "Alice"));
            try (ConnectionScope nested = ConnectionRegistry.global().activate(second).closingConnection()) {
                assertThat(people.count()).isZero();
                people.create(map("name", "Bob"));
                assertThat(people.count()).isEqualTo(1);
            }
            assertThat(names(people.all())).containsExactly("Alice");
            assertThat(second.isConnected()).isFalse();
        }

        assertThat(ConnectionRegistry.global().find(alias)).isEmpty();
    }
}
