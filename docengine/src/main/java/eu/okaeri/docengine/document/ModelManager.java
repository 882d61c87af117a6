package eu.okaeri.docengine.document;

import eu.okaeri.docengine.DatabaseException;
import eu.okaeri.docengine.collection.DocumentCollection;
import eu.okaeri.docengine.connection.ConnectionRegistry;
import eu.okaeri.docengine.connection.ConnectionSettings;
import eu.okaeri.docengine.connection.DatabaseConnection;
import eu.okaeri.docengine.filter.FindFilter;
import eu.okaeri.docengine.filter.UpdateFilter;
import eu.okaeri.docengine.filter.condition.Condition;
import eu.okaeri.docengine.lob.LargeObjectFieldManager;
import eu.okaeri.docengine.lob.LargeObjectStore;
import eu.okaeri.docengine.model.ModelDescriptor;
import eu.okaeri.docengine.model.ModelRegistry;
import eu.okaeri.docengine.ref.ReferenceResolver;
import eu.okaeri.docengine.translate.QueryTranslator;
import lombok.Getter;
import lombok.NonNull;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static eu.okaeri.docengine.filter.predicate.SimplePredicate.eq;

/**
 * Model-level operations for one model on one connection. Every operation goes through the
 * {@link QueryTranslator}, large-object fields are handled before the owning document is written
 * or removed.
 * <p>
 * The connection is looked up on each call, so a manager created for an alias follows
 * {@link ConnectionRegistry#activate(String, DatabaseConnection)} scopes.
 */
public class ModelManager {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.platform.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(ModelManager.class.getSimpleName());

    private final @Getter ModelDescriptor model;
    private final Supplier<DatabaseConnection> connection;
    private final @Getter ModelRegistry registry;

    public ModelManager(@NonNull ModelDescriptor model, @NonNull Supplier<DatabaseConnection> connection, @NonNull ModelRegistry registry) {
        registry.register(model);
        this.model = model;
        this.connection = connection;
        this.registry = registry;
    }

    public static ModelManager of(@NonNull ModelDescriptor model) {
        return of(model, ConnectionSettings.DEFAULT_ALIAS);
    }

    public static ModelManager of(@NonNull Class<?> modelClass) {
        return of(ModelRegistry.global().register(modelClass));
    }

    /**
     * Manager using whatever connection is registered under the alias at call time.
     */
    public static ModelManager of(@NonNull ModelDescriptor model, @NonNull String alias) {
        return new ModelManager(model, () -> ConnectionRegistry.global().get(alias), ModelRegistry.global());
    }

    public static ModelManager of(@NonNull ModelDescriptor model, @NonNull DatabaseConnection connection) {
        return new ModelManager(model, () -> connection, ModelRegistry.global());
    }

    public DatabaseConnection getConnection() {
        return this.connection.get();
    }

    public DocumentCollection getCollection() {
        return this.getConnection().getCollection(this.model.getCollection());
    }

    public LargeObjectStore getLargeObjectStore() {
        return this.getConnection().getLargeObjectStore();
    }

    public DocumentSerializer getSerializer() {
        return new DocumentSerializer(this.getConnection().getSettings(), this.registry, new ManagerReferenceResolver());
    }

    public QueryTranslator getTranslator() {
        return new QueryTranslator(this.model, this.getSerializer(), this.getConnection().getOperationFlags());
    }

    // ==================== WRITE OPERATIONS ====================

    /**
     * Empty instance bound to this manager.
     */
    public ModelInstance newInstance() {
        ModelInstance instance = new ModelInstance(this.model);
        instance.bind(this);
        return instance;
    }

    public ModelInstance create(@NonNull Map<String, ?> values) {
        ModelInstance instance = this.newInstance();
        values.forEach(instance::set);
        return this.save(instance);
    }

    /**
     * Inserts or replaces the instance. Pending large-object payloads are written first, the
     * payloads they replace are deleted once the record is stored. The assigned id is set on the instance.
     */
    public ModelInstance save(@NonNull ModelInstance instance) {

        this.checkModel(instance);
        DatabaseConnection connection = this.getConnection();

        LargeObjectFieldManager largeObjects = new LargeObjectFieldManager(connection.getLargeObjectStore());
        largeObjects.beforeSave(instance);
        Document document = this.getSerializer().encode(instance);
        Object id = this.getTranslator().save(document).execute(connection.getCollection(this.model.getCollection()));

        instance.setId(id);
        instance.bind(this);
        largeObjects.afterSave(instance);
        return instance;
    }

    /**
     * Equivalent of {@code update(field=value, ...)} on every record.
     */
    public long update(@NonNull Map<String, ?> values) {
        return this.update(null, values);
    }

    public long update(Condition where, @NonNull Map<String, ?> values) {
        return this.update(UpdateFilter.builder().where(where).set(values).build());
    }

    /**
     * @return number of matched records
     * @throws eu.okaeri.docengine.lob.RestrictedOperationException when a large-object field is updated
     */
    public long update(@NonNull UpdateFilter filter) {
        return this.getTranslator().update(filter).execute(this.getCollection());
    }

    /**
     * Removes the record of the instance, the id stays on the instance.
     *
     * @return false when the instance was never saved or its record is already gone
     */
    public boolean delete(@NonNull ModelInstance instance) {

        this.checkModel(instance);
        if (!instance.isSaved()) {
            return false;
        }

        DatabaseConnection connection = this.getConnection();
        ObjectId id = ObjectIds.toObjectId(instance.getId(), this.model);
        boolean removed = this.getTranslator().remove(new Document("_id", id)).execute(connection.getCollection(this.model.getCollection())) > 0;

        if (removed) {
            new LargeObjectFieldManager(connection.getLargeObjectStore()).afterDelete(instance);
        }
        return removed;
    }

    /**
     * Removes every matching record. Records of models with large-object fields are loaded first so
     * their payloads can be handled.
     *
     * @return number of removed records
     */
    public long delete(Condition where) {

        QueryTranslator translator = this.getTranslator();
        DocumentCollection collection = this.getCollection();
        if (this.model.getLargeObjectFields().isEmpty()) {
            return translator.remove(where).execute(collection);
        }

        List<ModelInstance> instances = this.filter(where);
        if (instances.isEmpty()) {
            return 0;
        }

        List<Object> ids = instances.stream().map(ModelInstance::getId).collect(Collectors.toList());
        long removed = translator.remove(new Document("_id", new Document("$in", ids))).execute(collection);

        LargeObjectFieldManager largeObjects = new LargeObjectFieldManager(this.getLargeObjectStore());
        instances.forEach(largeObjects::afterDelete);
        if (DEBUG) {
            LOGGER.info("[" + this.model.getCollection() + "] deleted " + removed + " records with large-object fields");
        }
        return removed;
    }

    public long deleteAll() {
        return this.delete((Condition) null);
    }

    // ==================== READ OPERATIONS ====================

    public Optional<ModelInstance> find(@NonNull Object id) {
        List<ModelInstance> instances = this.find(FindFilter.builder()
            .where(this.byId(id))
            .limit(1)
            .build());
        return instances.isEmpty() ? Optional.empty() : Optional.of(instances.get(0));
    }

    /**
     * @throws ObjectNotFoundException when no record has the id
     */
    public ModelInstance get(@NonNull Object id) {
        return this.get(this.byId(id));
    }

    /**
     * Exactly one matching record.
     *
     * @throws ObjectNotFoundException         when nothing matches
     * @throws MultipleObjectsReturnedException when more than one record matches
     */
    public ModelInstance get(Condition where) {
        List<ModelInstance> instances = this.find(FindFilter.builder().where(where).limit(2).build());
        if (instances.isEmpty()) {
            throw new ObjectNotFoundException(this.model.getName());
        }
        if (instances.size() > 1) {
            throw new MultipleObjectsReturnedException(this.model.getName());
        }
        return instances.get(0);
    }

    public List<ModelInstance> all() {
        return this.filter(null);
    }

    public List<ModelInstance> filter(Condition where) {
        return this.find(FindFilter.where(where));
    }

    public List<ModelInstance> find(@NonNull FindFilter filter) {
        DocumentSerializer serializer = this.getSerializer();
        List<Document> documents = new QueryTranslator(this.model, serializer, this.getConnection().getOperationFlags())
            .find(filter)
            .execute(this.getCollection());
        return documents.stream()
            .map(document -> {
                ModelInstance instance = serializer.decode(this.model, document);
                instance.bind(this);
                return instance;
            })
            .collect(Collectors.toList());
    }

    /**
     * Matching records as stored, in the map type configured by {@code DOCUMENT_CLASS}.
     */
    public List<Map<String, Object>> findRaw(@NonNull FindFilter filter) {
        Class<? extends Map<String, Object>> documentClass = this.getConnection().getSettings().getDocumentClass();
        return this.getTranslator().find(filter).execute(this.getCollection()).stream()
            .map(document -> toDocumentClass(documentClass, document))
            .collect(Collectors.toList());
    }

    public long count() {
        return this.count(null);
    }

    public long count(Condition where) {
        return this.getTranslator().count(where).execute(this.getCollection());
    }

    // ==================== HELPERS ====================

    private Condition byId(Object id) {
        return Condition.on(this.model.getIdField().getName(), eq(ObjectIds.toObjectId(id, this.model)));
    }

    private void checkModel(ModelInstance instance) {
        if (!instance.getModel().getName().equals(this.model.getName())) {
            throw new IllegalArgumentException("instance of " + instance.getModel().getName() + " cannot be handled by the manager of " + this.model.getName());
        }
    }

    private ModelManager sibling(ModelDescriptor model) {
        return model.getName().equals(this.model.getName()) ? this : new ModelManager(model, this.connection, this.registry);
    }

    private static Map<String, Object> toDocumentClass(Class<? extends Map<String, Object>> documentClass, Document document) {
        if (documentClass.isInstance(document)) {
            return document;
        }
        try {
            Map<String, Object> map = documentClass.getDeclaredConstructor().newInstance();
            map.putAll(document);
            return map;
        } catch (ReflectiveOperationException exception) {
            throw new DatabaseException("Cannot create document of type " + documentClass.getName(), exception);
        }
    }

    private class ManagerReferenceResolver implements ReferenceResolver {

        @Override
        public ModelInstance resolve(@NonNull ModelDescriptor model, @NonNull Object id) {
            return ModelManager.this.sibling(model).find(id).orElse(null);
        }

        @Override
        public Object persist(@NonNull ModelInstance instance) {
            return ModelManager.this.sibling(instance.getModel()).save(instance).getId();
        }
    }

    @Override
    public String toString() {
        return "ModelManager(" + this.model.getName() + ")";
    }
}
