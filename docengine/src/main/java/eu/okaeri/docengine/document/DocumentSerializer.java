package eu.okaeri.docengine.document;

import eu.okaeri.docengine.connection.ConnectionSettings;
import eu.okaeri.docengine.lob.LargeObjectState;
import eu.okaeri.docengine.model.FieldDescriptor;
import eu.okaeri.docengine.model.FieldType;
import eu.okaeri.docengine.model.ModelDescriptor;
import eu.okaeri.docengine.model.ModelRegistry;
import eu.okaeri.docengine.ref.LazyModelReference;
import eu.okaeri.docengine.ref.ReferenceResolver;
import eu.okaeri.docengine.ref.UnserializableReferenceException;
import lombok.Getter;
import lombok.NonNull;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts model instances to stored documents and back.
 * <p>
 * Dates are stored as UTC {@link Date}s and read back as {@link LocalDateTime}, or as UTC
 * {@link ZonedDateTime} when the connection is {@code TZ_AWARE}. Decimals are stored as
 * {@link Decimal128}. Model instances inside raw values are stored as references only when
 * automatic referencing is enabled.
 */
public class DocumentSerializer {

    private final @Getter ConnectionSettings settings;
    private final ModelRegistry registry;
    private final ReferenceResolver resolver;

    public DocumentSerializer(@NonNull ConnectionSettings settings, @NonNull ModelRegistry registry, ReferenceResolver resolver) {
        this.settings = settings;
        this.registry = registry;
        this.resolver = resolver;
    }

    // ==================== ENCODING ====================

    /**
     * Stored form of the instance. Large-object columns hold the bound payload ids, so pending
     * payloads must have been written before. The id is only included once assigned.
     */
    public Document encode(@NonNull ModelInstance instance) {

        Document document = new Document();
        for (FieldDescriptor field : instance.getModel().getFieldList()) {

            if (field.isLargeObject()) {
                LargeObjectState state = instance.getLargeObject(field.getName());
                document.put(field.getColumn(), state.getPayloadId());
                continue;
            }

            Object value = instance.getValues().get(field.getName());
            if ((field.getType() == FieldType.AUTO_ID) && (value == null)) {
                continue;
            }
            document.put(field.getColumn(), this.encodeField(instance.getModel(), field, value));
        }

        return document;
    }

    /**
     * Stored form of a single field value, also used for query operands.
     */
    public Object encodeField(@NonNull ModelDescriptor model, @NonNull FieldDescriptor field, Object value) {

        if (value == null) {
            return null;
        }

        switch (field.getType()) {
            case AUTO_ID:
                return ObjectIds.toObjectId(value, model);
            case FOREIGN_KEY:
                return this.encodeForeignKey(field, value);
            case TEXT:
                return (value instanceof CharSequence) ? value.toString() : String.valueOf(value);
            case INTEGER:
                return encodeInteger(field, value);
            case DECIMAL:
                return encodeDecimal(field, value);
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                if ((value instanceof String) && ("true".equalsIgnoreCase((String) value) || "false".equalsIgnoreCase((String) value))) {
                    return Boolean.parseBoolean((String) value);
                }
                throw new IllegalArgumentException(field.getName() + " expects a boolean, got " + value);
            case DATE:
                Date date = encodeDate(value);
                if (date == null) {
                    throw new IllegalArgumentException(field.getName() + " expects a date, got " + value.getClass().getName());
                }
                return date;
            case RAW:
                return this.encodeRaw(field.getName(), value);
            case LARGE_FILE:
            case LARGE_TEXT:
                if (value instanceof ObjectId) {
                    return value;
                }
                throw new IllegalArgumentException(field.getName() + " is a large-object field, only payload ids can be stored");
            default:
                throw new IllegalArgumentException("unsupported field type " + field.getType() + " of " + field.getName());
        }
    }

    /**
     * Stored form of arbitrary content: maps become documents, collections and arrays become lists.
     *
     * @param fieldName field the value belongs to, reported in errors
     */
    @SuppressWarnings("unchecked")
    public Object encodeRaw(@NonNull String fieldName, Object value) {

        if ((value == null) || (value instanceof String) || (value instanceof Boolean) || (value instanceof ObjectId)
            || (value instanceof byte[]) || (value instanceof Decimal128)) {
            return value;
        }
        if ((value instanceof Integer) || (value instanceof Long) || (value instanceof Double)) {
            return value;
        }
        if ((value instanceof Short) || (value instanceof Byte)) {
            return ((Number) value).intValue();
        }
        if (value instanceof Float) {
            return ((Float) value).doubleValue();
        }
        if (value instanceof BigDecimal) {
            return new Decimal128((BigDecimal) value);
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).longValueExact();
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }

        Date date = encodeDate(value);
        if (date != null) {
            return date;
        }

        if (value instanceof LazyModelReference) {
            return ((LazyModelReference) value).toDocument();
        }
        if (value instanceof ModelInstance) {
            return this.encodeReference(fieldName, (ModelInstance) value);
        }

        if (value instanceof Map) {
            Document document = new Document();
            ((Map<Object, Object>) value).forEach((key, element) -> document.put(String.valueOf(key), this.encodeRaw(fieldName, element)));
            return document;
        }
        if (value instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object element : (Collection<Object>) value) {
                list.add(this.encodeRaw(fieldName, element));
            }
            return list;
        }
        if (value instanceof Object[]) {
            return this.encodeRaw(fieldName, Arrays.asList((Object[]) value));
        }

        throw new UnserializableReferenceException(fieldName, value);
    }

    private Object encodeReference(String fieldName, ModelInstance instance) {
        if (!this.settings.isAutomaticReferencing()) {
            throw new UnserializableReferenceException(fieldName, instance);
        }
        if (!instance.isSaved()) {
            if (this.resolver == null) {
                throw new IllegalStateException("cannot save referenced " + instance + " without a connection");
            }
            this.resolver.persist(instance);
        }
        return LazyModelReference.of(instance).toDocument();
    }

    private Object encodeForeignKey(FieldDescriptor field, Object value) {
        ModelDescriptor target = this.registry.get(field.getTarget());
        if (value instanceof ModelInstance) {
            ModelInstance instance = (ModelInstance) value;
            if (!instance.isSaved()) {
                throw new IllegalArgumentException("save() prohibited to prevent data loss due to unsaved related object '" + field.getName() + "'");
            }
            return ObjectIds.toObjectId(instance.getId(), target);
        }
        if (value instanceof LazyModelReference) {
            return ObjectIds.toObjectId(((LazyModelReference) value).getId(), target);
        }
        return ObjectIds.toObjectId(value, target);
    }

    private static Object encodeInteger(FieldDescriptor field, Object value) {
        if ((value instanceof Integer) || (value instanceof Long)) {
            return value;
        }
        if ((value instanceof Short) || (value instanceof Byte)) {
            return ((Number) value).intValue();
        }
        if (value instanceof BigInteger) {
            return ((BigInteger) value).longValueExact();
        }
        if (value instanceof CharSequence) {
            try {
                return Long.parseLong(value.toString());
            } catch (NumberFormatException exception) {
                throw new IllegalArgumentException(field.getName() + " expects an integer, got '" + value + "'", exception);
            }
        }
        throw new IllegalArgumentException(field.getName() + " expects an integer, got " + value.getClass().getName());
    }

    private static Object encodeDecimal(FieldDescriptor field, Object value) {
        if (value instanceof BigDecimal) {
            return new Decimal128((BigDecimal) value);
        }
        if ((value instanceof Double) || (value instanceof Decimal128)) {
            return value;
        }
        if (value instanceof Number) {
            return new Decimal128(new BigDecimal(value.toString()));
        }
        if (value instanceof CharSequence) {
            try {
                return new Decimal128(new BigDecimal(value.toString()));
            } catch (NumberFormatException exception) {
                throw new IllegalArgumentException(field.getName() + " expects a decimal, got '" + value + "'", exception);
            }
        }
        throw new IllegalArgumentException(field.getName() + " expects a decimal, got " + value.getClass().getName());
    }

    /**
     * @return UTC date or null when the value is not a date
     */
    private static Date encodeDate(Object value) {
        if (value instanceof Date) {
            return (Date) value;
        }
        if (value instanceof Instant) {
            return Date.from((Instant) value);
        }
        if (value instanceof LocalDateTime) {
            return Date.from(((LocalDateTime) value).toInstant(ZoneOffset.UTC));
        }
        if (value instanceof LocalDate) {
            return Date.from(((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC));
        }
        if (value instanceof ZonedDateTime) {
            return Date.from(((ZonedDateTime) value).toInstant());
        }
        if (value instanceof OffsetDateTime) {
            return Date.from(((OffsetDateTime) value).toInstant());
        }
        return null;
    }

    // ==================== DECODING ====================

    /**
     * Instance of the model from a stored document. Columns without a declared field are ignored.
     */
    public ModelInstance decode(@NonNull ModelDescriptor model, @NonNull Map<String, Object> document) {

        ModelInstance instance = new ModelInstance(model);
        for (FieldDescriptor field : model.getFieldList()) {

            Object stored = document.get(field.getColumn());
            if (field.isLargeObject()) {
                if (stored instanceof ObjectId) {
                    instance.getLargeObject(field.getName()).bind((ObjectId) stored);
                }
                continue;
            }

            if (!document.containsKey(field.getColumn())) {
                continue;
            }
            instance.set(field.getName(), this.decodeField(field, stored));
        }

        return instance;
    }

    public Object decodeField(@NonNull FieldDescriptor field, Object stored) {

        if (stored == null) {
            return null;
        }

        switch (field.getType()) {
            case FOREIGN_KEY:
                return new LazyModelReference(this.registry.get(field.getTarget()), stored, this.resolver);
            case DECIMAL:
                return (stored instanceof Decimal128) ? ((Decimal128) stored).bigDecimalValue() : stored;
            case DATE:
                return (stored instanceof Date) ? this.decodeDate((Date) stored) : stored;
            case RAW:
                return this.decodeRaw(stored);
            default:
                return stored;
        }
    }

    /**
     * Plain Java form of stored content: documents become {@link LinkedHashMap}s, reference documents
     * of registered models become {@link LazyModelReference}s when automatic referencing is enabled.
     */
    @SuppressWarnings("unchecked")
    public Object decodeRaw(Object stored) {

        if (stored instanceof Map) {
            Map<String, Object> map = (Map<String, Object>) stored;
            if (this.settings.isAutomaticReferencing() && LazyModelReference.isReferenceDocument(map)) {
                ModelDescriptor target = this.registry.findByCollection((String) map.get(LazyModelReference.COLLECTION_KEY)).orElse(null);
                if (target != null) {
                    return new LazyModelReference(target, map.get(LazyModelReference.ID_KEY), this.resolver);
                }
            }
            Map<String, Object> decoded = new LinkedHashMap<>();
            map.forEach((key, value) -> decoded.put(key, this.decodeRaw(value)));
            return decoded;
        }
        if (stored instanceof List) {
            List<Object> decoded = new ArrayList<>();
            for (Object element : (List<Object>) stored) {
                decoded.add(this.decodeRaw(element));
            }
            return decoded;
        }
        if (stored instanceof Decimal128) {
            return ((Decimal128) stored).bigDecimalValue();
        }
        if (stored instanceof Date) {
            return this.decodeDate((Date) stored);
        }
        return stored;
    }

    private Object decodeDate(Date date) {
        Instant instant = date.toInstant();
        return this.settings.isTzAware()
            ? ZonedDateTime.ofInstant(instant, ZoneOffset.UTC)
            : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }
}
