package eu.okaeri.docengine.lob;

import lombok.NonNull;
import org.bson.types.ObjectId;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * External storage of large-object payloads, addressed by {@link ObjectId}.
 */
public interface LargeObjectStore {

    /**
     * Reads the stream from its current position to the end and stores it as a new payload.
     * The stream is not closed.
     *
     * @return id of the new payload
     */
    ObjectId put(InputStream content, String filename);

    default ObjectId put(@NonNull byte[] content, String filename) {
        return this.put(new ByteArrayInputStream(content), filename);
    }

    /**
     * @throws MissingPayloadException when no payload has the id
     */
    LargeObjectFile get(ObjectId id);

    /**
     * Deletes the payload, deleting a missing payload is a no-op.
     */
    void delete(ObjectId id);

    boolean exists(ObjectId id);
}
