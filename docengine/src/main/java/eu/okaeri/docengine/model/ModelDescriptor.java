package eu.okaeri.docengine.model;

import eu.okaeri.docengine.index.IndexDirection;
import eu.okaeri.docengine.index.IndexKey;
import eu.okaeri.docengine.index.IndexSpec;
import eu.okaeri.docengine.model.annotation.CompoundIndex;
import eu.okaeri.docengine.model.annotation.IndexField;
import eu.okaeri.docengine.model.annotation.LargeObject;
import eu.okaeri.docengine.model.annotation.Model;
import eu.okaeri.docengine.model.annotation.ModelField;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Schema of a model: collection, ordered fields and declared compound indexes.
 * Immutable after construction. Every descriptor has exactly one {@link FieldType#AUTO_ID} field,
 * an {@code id} field is added when none is declared.
 */
@Getter
@ToString(of = {"name", "collection"})
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ModelDescriptor {

    public static final String DEFAULT_ID_FIELD = "id";

    private final String name;
    private final String collection;
    private final Map<String, FieldDescriptor> fields;
    /**
     * Compound indexes, keys name storage columns in declaration order.
     */
    private final List<IndexSpec> compoundIndexes;
    private final String identifierHint;
    private final Class<?> modelClass;

    public static Builder builder(@NonNull String name) {
        return new Builder(name);
    }

    /**
     * Reads the descriptor of a {@link Model} annotated class.
     */
    public static ModelDescriptor of(@NonNull Class<?> clazz) {

        Model model = clazz.getAnnotation(Model.class);
        if (model == null) {
            throw new IllegalArgumentException(clazz + " is not annotated with @Model");
        }

        Builder builder = builder(nameOf(clazz)).modelClass(clazz);
        if (!model.collection().isEmpty()) {
            builder.collection(model.collection());
        }
        if (!model.identifierHint().isEmpty()) {
            builder.identifierHint(model.identifierHint());
        }

        for (Field field : declaredFields(clazz)) {
            builder.field(describe(field));
        }

        for (CompoundIndex index : model.indexes()) {
            List<IndexKey> keys = Arrays.stream(index.value())
                .map(ModelDescriptor::keyOf)
                .collect(Collectors.toList());
            builder.compoundIndex(keys, index.unique(), index.sparse());
        }

        return builder.build();
    }

    /**
     * Model name of an annotated class: {@link Model#name()} or the simple class name.
     */
    public static String nameOf(@NonNull Class<?> clazz) {
        Model model = clazz.getAnnotation(Model.class);
        return ((model != null) && !model.name().isEmpty()) ? model.name() : clazz.getSimpleName();
    }

    private static List<Field> declaredFields(Class<?> clazz) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> current = clazz; (current != null) && (current != Object.class); current = current.getSuperclass()) {
            hierarchy.add(0, current);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> type : hierarchy) {
            for (Field field : type.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers) || field.isSynthetic()) {
                    continue;
                }
                fields.add(field);
            }
        }
        return fields;
    }

    private static FieldDescriptor describe(Field field) {

        ModelField modelField = field.getAnnotation(ModelField.class);
        LargeObject largeObject = field.getAnnotation(LargeObject.class);
        FieldDescriptor.FieldDescriptorBuilder builder = FieldDescriptor.builder().name(field.getName());

        FieldType type = (modelField == null) ? FieldType.AUTO : modelField.type();
        if (modelField != null) {
            builder.column(modelField.column().isEmpty() ? null : modelField.column())
                .indexed(modelField.index())
                .unique(modelField.unique())
                .sparse(modelField.sparse())
                .descending(modelField.descending());
            if (modelField.references() != void.class) {
                type = FieldType.FOREIGN_KEY;
                builder.target(nameOf(modelField.references()));
            }
        }

        if (largeObject != null) {
            if (type == FieldType.AUTO) {
                type = (field.getType() == String.class) ? FieldType.LARGE_TEXT : FieldType.LARGE_FILE;
            }
            if (!type.isLargeObject()) {
                throw new IllegalArgumentException("@LargeObject field " + field.getName() + " cannot be of type " + type);
            }
            builder.versioning(largeObject.versioning());
            switch (largeObject.autodelete()) {
                case ALWAYS:
                    builder.autodelete(true);
                    break;
                case NEVER:
                    builder.autodelete(false);
                    break;
                default:
                    break;
            }
        }

        if (type == FieldType.AUTO) {
            type = FieldType.infer(field.getType());
        }
        return builder.type(type).build();
    }

    private static IndexKey keyOf(IndexField field) {
        return IndexKey.of(field.value(), field.descending() ? IndexDirection.DESCENDING : IndexDirection.ASCENDING);
    }

    public Optional<FieldDescriptor> getField(@NonNull String name) {
        return Optional.ofNullable(this.fields.get(name));
    }

    /**
     * @throws IllegalArgumentException for unknown fields
     */
    public FieldDescriptor field(@NonNull String name) {
        FieldDescriptor field = this.fields.get(name);
        if (field == null) {
            throw new IllegalArgumentException(this.name + " has no field named '" + name + "'");
        }
        return field;
    }

    public Optional<FieldDescriptor> getFieldByColumn(@NonNull String column) {
        return this.fields.values().stream()
            .filter(field -> field.getColumn().equals(column))
            .findFirst();
    }

    public FieldDescriptor getIdField() {
        return this.fields.values().stream()
            .filter(field -> field.getType() == FieldType.AUTO_ID)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(this.name + " has no primary key"));
    }

    public List<FieldDescriptor> getLargeObjectFields() {
        return this.fields.values().stream()
            .filter(FieldDescriptor::isLargeObject)
            .collect(Collectors.toList());
    }

    public Collection<FieldDescriptor> getFieldList() {
        return this.fields.values();
    }

    public static final class Builder {

        private final String name;
        private String collection;
        private final Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
        private final List<IndexSpec> compoundIndexes = new ArrayList<>();
        private String identifierHint;
        private Class<?> modelClass;

        private Builder(String name) {
            if (name.isEmpty()) {
                throw new IllegalArgumentException("model name cannot be empty");
            }
            this.name = name;
        }

        public Builder collection(@NonNull String collection) {
            this.collection = collection;
            return this;
        }

        public Builder field(@NonNull FieldDescriptor field) {
            if (this.fields.containsKey(field.getName())) {
                throw new IllegalArgumentException(this.name + " already declares field '" + field.getName() + "'");
            }
            this.fields.put(field.getName(), field);
            return this;
        }

        public Builder field(@NonNull String name, @NonNull FieldType type) {
            return this.field(FieldDescriptor.of(name, type));
        }

        public Builder compoundIndex(@NonNull IndexKey... keys) {
            return this.compoundIndex(Arrays.asList(keys), false, false);
        }

        public Builder compoundIndex(@NonNull List<IndexKey> keys, boolean unique, boolean sparse) {
            this.compoundIndexes.add(IndexSpec.of(new ArrayList<>(keys), unique, sparse));
            return this;
        }

        public Builder identifierHint(String identifierHint) {
            this.identifierHint = identifierHint;
            return this;
        }

        public Builder modelClass(Class<?> modelClass) {
            this.modelClass = modelClass;
            return this;
        }

        public ModelDescriptor build() {

            Map<String, FieldDescriptor> fields = new LinkedHashMap<>();
            long ids = this.fields.values().stream().filter(field -> field.getType() == FieldType.AUTO_ID).count();
            if (ids > 1) {
                throw new IllegalArgumentException(this.name + " declares more than one primary key");
            }
            if (ids == 0) {
                if (this.fields.containsKey(DEFAULT_ID_FIELD)) {
                    throw new IllegalArgumentException(this.name + " declares field 'id' which is not a primary key");
                }
                fields.put(DEFAULT_ID_FIELD, FieldDescriptor.of(DEFAULT_ID_FIELD, FieldType.AUTO_ID));
            }
            fields.putAll(this.fields);

            Set<String> columns = new HashSet<>();
            for (FieldDescriptor field : fields.values()) {
                if (field.getType() == FieldType.AUTO) {
                    throw new IllegalArgumentException(this.name + "." + field.getName() + " has no resolved type");
                }
                if ((field.getType() == FieldType.FOREIGN_KEY) && ((field.getTarget() == null) || field.getTarget().isEmpty())) {
                    throw new IllegalArgumentException(this.name + "." + field.getName() + " is a foreign key without a target model");
                }
                if (!columns.add(field.getColumn())) {
                    throw new IllegalArgumentException(this.name + " maps more than one field to column '" + field.getColumn() + "'");
                }
            }

            String collection = (this.collection == null) ? snakeCase(this.name) : this.collection;
            return new ModelDescriptor(this.name, collection, Collections.unmodifiableMap(fields),
                Collections.unmodifiableList(new ArrayList<>(this.compoundIndexes)), this.identifierHint, this.modelClass);
        }

        private static String snakeCase(String name) {
            StringBuilder out = new StringBuilder();
            for (int i = 0; i < name.length(); i++) {
                char c = name.charAt(i);
                if (Character.isUpperCase(c)) {
                    if (i > 0) {
                        out.append('_');
                    }
                    out.append(Character.toLowerCase(c));
                } else {
                    out.append(c);
                }
            }
            return out.toString();
        }
    }
}
