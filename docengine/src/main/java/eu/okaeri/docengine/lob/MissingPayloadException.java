package eu.okaeri.docengine.lob;

import eu.okaeri.docengine.DatabaseException;
import lombok.Getter;
import org.bson.types.ObjectId;

@Getter
public class MissingPayloadException extends DatabaseException {

    private final ObjectId payloadId;

    public MissingPayloadException(ObjectId payloadId) {
        super("no large-object payload found for id " + payloadId);
        this.payloadId = payloadId;
    }
}
