package eu.okaeri.docengine.document;

import eu.okaeri.docengine.model.ModelDescriptor;
import lombok.NonNull;
import org.bson.types.ObjectId;

public final class ObjectIds {

    private ObjectIds() {
    }

    /**
     * Converts a primary key value of the model to an {@link ObjectId}.
     *
     * @throws InvalidIdentifierException unless the value is an ObjectId or its 24 hex character form
     */
    public static ObjectId toObjectId(Object value, @NonNull ModelDescriptor model) {
        if (value instanceof ObjectId) {
            return (ObjectId) value;
        }
        if ((value instanceof CharSequence) && ObjectId.isValid(value.toString())) {
            return new ObjectId(value.toString());
        }
        throw new InvalidIdentifierException(value, model.getIdentifierHint());
    }

    public static boolean isValid(Object value) {
        return (value instanceof ObjectId) || ((value instanceof CharSequence) && ObjectId.isValid(value.toString()));
    }
}
