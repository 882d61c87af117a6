package eu.okaeri.docengine.translate;

import eu.okaeri.docengine.connection.ConnectionSettings;
import eu.okaeri.docengine.document.DocumentSerializer;
import eu.okaeri.docengine.model.FieldType;
import eu.okaeri.docengine.model.ModelDescriptor;
import eu.okaeri.docengine.model.ModelRegistry;
import org.bson.Document;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import static eu.okaeri.docengine.filter.condition.Condition.and;
import static eu.okaeri.docengine.filter.condition.Condition.or;
import static eu.okaeri.docengine.filter.predicate.SimplePredicate.*;
import static org.assertj.core.api.Assertions.assertThat;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class FilterRenderingTest {

    private FilterRenderer renderer;

    @BeforeAll
    public void prepare() {
        ModelDescriptor model = ModelDescriptor.builder("Measurement")
            .field("age", FieldType.INTEGER)
            .field("distance", FieldType.INTEGER)
            .field("thing", FieldType.INTEGER)
            .field("name", FieldType.TEXT)
            .build();
        ConnectionSettings settings = ConnectionSettings.builder().name("test").build();
        this.renderer = new FilterRenderer(model, new DocumentSerializer(settings, new ModelRegistry(), null));
    }

    @Test
    public void test_condition_0() {
        Document condition = this.renderer.render(and("age", eq(55))); // age equal to 55
        assertThat(condition).isEqualTo(Document.parse("{age: {$eq: 55}}"));
    }

    @Test
    public void test_condition_1() {
        Document condition = this.renderer.render(and("distance", gte(100), lte(1000))); // distance between 100 and 1000
        assertThat(condition).isEqualTo(Document.parse("{$and: [{distance: {$gte: 100}}, {distance: {$lte: 1000}}]}"));
    }

    @Test
    public void test_condition_2() {
        Document condition = this.renderer.render(or(
            and("distance", gte(100), lte(1000)),
            and("age", eq(55))
        ));
        assertThat(condition).isEqualTo(Document.parse("{$or: [{$and: [{distance: {$gte: 100}}, {distance: {$lte: 1000}}]}, {age: {$eq: 55}}]}"));
    }

    @Test
    public void test_condition_3() {
        Document condition = this.renderer.render(or(
            and("distance", gte(100), lte(1000)),
            and(
                and("age", eq(55)),
                and("thing", gt(123), lt(999))
            )
        ));
        assertThat(condition).isEqualTo(Document.parse("{$or: ["
            + "{$and: [{distance: {$gte: 100}}, {distance: {$lte: 1000}}]}, "
            + "{$and: [{age: {$eq: 55}}, {$and: [{thing: {$gt: 123}}, {thing: {$lt: 999}}]}]}"
            + "]}"));
    }

    @Test
    public void test_condition_4() {
        Document condition = this.renderer.render(and("name", or(eq("a"), eq("b")))); // nested condition inherits the field
        assertThat(condition).isEqualTo(Document.parse("{$or: [{name: {$eq: 'a'}}, {name: {$eq: 'b'}}]}"));
    }

    @Test
    public void test_condition_5() {
        Document condition = this.renderer.render(and("name", ne("a"), in("b", "c"), notIn("d")));
        assertThat(condition).isEqualTo(Document.parse("{$and: [{name: {$ne: 'a'}}, {name: {$in: ['b', 'c']}}, {name: {$nin: ['d']}}]}"));
    }

    @Test
    public void test_condition_6() {
        assertThat(this.renderer.render(and("name", isNull()))).isEqualTo(Document.parse("{name: null}"));
        assertThat(this.renderer.render(and("name", notNull()))).isEqualTo(Document.parse("{name: {$ne: null}}"));
    }

    @Test
    public void test_condition_empty() {
        assertThat(this.renderer.render(null)).isEqualTo(new Document());
    }
}
