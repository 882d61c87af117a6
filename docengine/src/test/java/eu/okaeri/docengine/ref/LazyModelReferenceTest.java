package eu.okaeri.docengine.ref;

import eu.okaeri.docengine.document.ModelInstance;
import eu.okaeri.docengine.fixture.TestModels;
import eu.okaeri.docengine.model.ModelDescriptor;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static eu.okaeri.docengine.fixture.Maps.map;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LazyModelReferenceTest {

    private static final ModelDescriptor BLOG = TestModels.blog();

    private static ReferenceResolver resolving(ModelInstance target, AtomicInteger lookups) {
        return new ReferenceResolver() {
            @Override
            public ModelInstance resolve(ModelDescriptor model, Object id) {
                lookups.incrementAndGet();
                return id.equals(target.getId()) ? target : null;
            }

            @Override
            public Object persist(ModelInstance instance) {
                throw new UnsupportedOperationException();
            }
        };
    }

    @Test
    void unsaved_instance_cannot_be_referenced() {
        assertThatThrownBy(() -> LazyModelReference.of(new ModelInstance(BLOG)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("unsaved instance of Blog");
    }

    @Test
    void reference_of_instance_is_resolved() {
        ModelInstance blog = ModelInstance.of(BLOG, map("id", new ObjectId(), "title", "Diary"));

        LazyModelReference reference = LazyModelReference.of(blog);

        assertThat(reference.isResolved()).isTrue();
        assertThat(reference.orThrow()).isSameAs(blog);
        assertThat(reference.get("title")).isEqualTo("Diary");
    }

    @Test
    void equality_does_not_resolve() {
        ObjectId id = new ObjectId();
        ModelInstance blog = ModelInstance.of(BLOG, map("id", id, "title", "Diary"));
        AtomicInteger lookups = new AtomicInteger();

        LazyModelReference first = new LazyModelReference(BLOG, id, resolving(blog, lookups));
        LazyModelReference second = new LazyModelReference(BLOG, id, resolving(blog, lookups));

        assertThat(first).isEqualTo(second);
        assertThat(first).hasSameHashCodeAs(second);
        assertThat(first.equals(blog)).isTrue();
        assertThat(blog.equals(first)).isTrue();
        assertThat(first).isNotEqualTo(new LazyModelReference(BLOG, new ObjectId(), null));
        assertThat(first).isNotEqualTo(new LazyModelReference(TestModels.person(), id, null));
        assertThat(first.isResolved()).isFalse();
        assertThat(lookups.get()).isZero();
    }

    @Test
    void resolves_once_and_caches() {
        ObjectId id = new ObjectId();
        ModelInstance blog = ModelInstance.of(BLOG, map("id", id, "title", "Diary"));
        AtomicInteger lookups = new AtomicInteger();
        LazyModelReference reference = new LazyModelReference(BLOG, id, resolving(blog, lookups));

        assertThat(reference.get("title")).isEqualTo("Diary");
        assertThat(reference.get()).containsSame(blog);
        assertThat(reference.isResolved()).isTrue();
        assertThat(lookups.get()).isEqualTo(1);
    }

    @Test
    void missing_record_resolves_empty() {
        ModelInstance blog = ModelInstance.of(BLOG, map("id", new ObjectId()));
        AtomicInteger lookups = new AtomicInteger();
        LazyModelReference reference = new LazyModelReference(BLOG, new ObjectId(), resolving(blog, lookups));

        assertThat(reference.get()).isEmpty();
        assertThatThrownBy(reference::orThrow)
            .isInstanceOf(NoSuchElementException.class)
            .hasMessageContaining("blog/");
        assertThat(lookups.get()).isEqualTo(1);
    }

    @Test
    void unbound_reference_cannot_resolve() {
        LazyModelReference reference = new LazyModelReference(BLOG, new ObjectId(), null);

        assertThatThrownBy(reference::get)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not bound to a connection");
    }

    @Test
    void stored_form() {
        ObjectId id = new ObjectId();
        Document document = new LazyModelReference(BLOG, id, null).toDocument();

        assertThat(document).isEqualTo(new Document("_id", id).append("_collection", "blog"));
        assertThat(LazyModelReference.isReferenceDocument(document)).isTrue();
        assertThat(LazyModelReference.isReferenceDocument(new Document("_id", id))).isFalse();
        assertThat(LazyModelReference.isReferenceDocument(new Document("_id", id).append("_collection", 1))).isFalse();
        assertThat(LazyModelReference.isReferenceDocument("blog")).isFalse();
    }
}
