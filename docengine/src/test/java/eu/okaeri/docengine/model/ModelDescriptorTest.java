package eu.okaeri.docengine.model;

import eu.okaeri.docengine.fixture.AnnotatedModels;
import eu.okaeri.docengine.fixture.TestModels;
import eu.okaeri.docengine.index.IndexKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelDescriptorTest {

    @Test
    void builder_adds_default_primary_key_first() {
        ModelDescriptor model = TestModels.person();

        assertThat(model.getFieldList()).first().extracting(FieldDescriptor::getName).isEqualTo("id");
        assertThat(model.getIdField().getColumn()).isEqualTo("_id");
        assertThat(model.getCollection()).isEqualTo("person");
    }

    @Test
    void collection_defaults_to_snake_case_of_model_name() {
        assertThat(TestModels.raw().getCollection()).isEqualTo("raw_model");
        assertThat(TestModels.site().getCollection()).isEqualTo("django_site");
    }

    @Test
    void columns_follow_field_type() {
        ModelDescriptor post = TestModels.post();

        assertThat(post.field("blog").getColumn()).isEqualTo("blog_id");
        assertThat(post.field("title").getColumn()).isEqualTo("title");
        assertThat(TestModels.person().field("nickname").getColumn()).isEqualTo("nick");
        assertThat(TestModels.person().getFieldByColumn("nick")).hasValueSatisfying(field -> assertThat(field.getName()).isEqualTo("nickname"));
    }

    @Test
    void autodelete_defaults_to_opposite_of_versioning() {
        ModelDescriptor model = TestModels.gridFs();

        assertThat(model.field("gridfile").isAutodelete()).isTrue();
        assertThat(model.field("gridfileVersioned").isAutodelete()).isFalse();
        assertThat(model.field("gridfileNodelete").isAutodelete()).isFalse();
        assertThat(model.getLargeObjectFields()).hasSize(4);
    }

    @Test
    void build_rejects_two_primary_keys() {
        assertThatThrownBy(() -> ModelDescriptor.builder("Broken")
            .field("first", FieldType.AUTO_ID)
            .field("second", FieldType.AUTO_ID)
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("more than one primary key");
    }

    @Test
    void build_rejects_duplicate_columns() {
        assertThatThrownBy(() -> ModelDescriptor.builder("Broken")
            .field("a", FieldType.TEXT)
            .field(FieldDescriptor.builder().name("b").type(FieldType.TEXT).column("a").build())
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("column 'a'");
    }

    @Test
    void build_rejects_foreign_key_without_target() {
        assertThatThrownBy(() -> ModelDescriptor.builder("Broken")
            .field(FieldDescriptor.builder().name("owner").type(FieldType.FOREIGN_KEY).build())
            .build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("without a target");
    }

    @Test
    void field_throws_for_unknown_name() {
        assertThatThrownBy(() -> TestModels.raw().field("missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void of_reads_annotated_class() {
        ModelDescriptor book = ModelDescriptor.of(AnnotatedModels.Book.class);

        assertThat(book.getName()).isEqualTo("Book");
        assertThat(book.getCollection()).isEqualTo("books");
        assertThat(book.getFields()).containsOnlyKeys("id", "title", "published", "price", "pages", "tags", "author", "cover", "text", "extra");

        assertThat(book.field("title").getType()).isEqualTo(FieldType.TEXT);
        assertThat(book.field("title").isUnique()).isTrue();
        assertThat(book.field("published").getType()).isEqualTo(FieldType.DATE);
        assertThat(book.field("published").getColumn()).isEqualTo("pub");
        assertThat(book.field("published").isDescending()).isTrue();
        assertThat(book.field("price").getType()).isEqualTo(FieldType.DECIMAL);
        assertThat(book.field("pages").getType()).isEqualTo(FieldType.INTEGER);
        assertThat(book.field("tags").getType()).isEqualTo(FieldType.RAW);
        assertThat(book.field("extra").getType()).isEqualTo(FieldType.RAW);
        assertThat(book.field("author").getType()).isEqualTo(FieldType.FOREIGN_KEY);
        assertThat(book.field("author").getTarget()).isEqualTo("Author");
        assertThat(book.field("cover").getType()).isEqualTo(FieldType.LARGE_FILE);
        assertThat(book.field("text").getType()).isEqualTo(FieldType.LARGE_TEXT);
        assertThat(book.field("text").isVersioning()).isTrue();
        assertThat(book.field("text").isAutodelete()).isFalse();

        assertThat(book.getCompoundIndexes()).hasSize(1);
        assertThat(book.getCompoundIndexes().get(0).getKeys()).containsExactly(IndexKey.asc("title"), IndexKey.desc("pub"));
        assertThat(book.getCompoundIndexes().get(0).getName()).isEqualTo("title_1_pub_-1");
    }

    @Test
    void registry_returns_registered_descriptor_on_repeated_registration() {
        ModelRegistry registry = new ModelRegistry();
        ModelDescriptor first = registry.register(AnnotatedModels.Author.class);
        ModelDescriptor second = registry.register(AnnotatedModels.Author.class);

        assertThat(second).isSameAs(first);
        assertThat(registry.findByCollection("author")).containsSame(first);
        assertThat(first.getFields()).containsOnlyKeys("id", "name");
        assertThatThrownBy(() -> registry.get("Unknown")).isInstanceOf(IllegalArgumentException.class);
    }
}
