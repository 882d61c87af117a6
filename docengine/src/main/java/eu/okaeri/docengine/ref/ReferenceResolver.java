package eu.okaeri.docengine.ref;

import eu.okaeri.docengine.document.ModelInstance;
import eu.okaeri.docengine.model.ModelDescriptor;

/**
 * Loads and persists referenced model instances on behalf of the serializer.
 */
public interface ReferenceResolver {

    /**
     * @return the instance or null when no record has the id
     */
    ModelInstance resolve(ModelDescriptor model, Object id);

    /**
     * Saves an instance that is referenced before it has an id.
     *
     * @return the assigned id
     */
    Object persist(ModelInstance instance);
}
