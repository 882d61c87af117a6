package eu.okaeri.docengine.fixture;

import eu.okaeri.docengine.model.FieldType;
import eu.okaeri.docengine.model.annotation.CompoundIndex;
import eu.okaeri.docengine.model.annotation.IndexField;
import eu.okaeri.docengine.model.annotation.LargeObject;
import eu.okaeri.docengine.model.annotation.Model;
import eu.okaeri.docengine.model.annotation.ModelField;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public final class AnnotatedModels {

    private AnnotatedModels() {
    }

    @Model(name = "Author")
    public static class Author {
        @ModelField(index = true)
        private String name;
        private transient String cached;
    }

    @Model(name = "Book", collection = "books", indexes = {
        @CompoundIndex({@IndexField("title"), @IndexField(value = "pub", descending = true)})
    })
    public static class Book {
        @ModelField(unique = true)
        private String title;
        @ModelField(column = "pub", descending = true)
        private LocalDateTime published;
        private BigDecimal price;
        private int pages;
        private List<String> tags;
        @ModelField(references = Author.class)
        private Object author;
        @LargeObject
        private byte[] cover;
        @LargeObject(versioning = true)
        private String text;
        @ModelField(type = FieldType.RAW)
        private Object extra;
        private static final String IGNORED = "static";
    }
}
