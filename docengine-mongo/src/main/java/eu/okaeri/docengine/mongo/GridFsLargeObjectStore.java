package eu.okaeri.docengine.mongo;

import com.mongodb.MongoGridFSException;
import com.mongodb.client.gridfs.GridFSBucket;
import com.mongodb.client.gridfs.model.GridFSFile;
import com.mongodb.client.model.Filters;
import eu.okaeri.docengine.lob.LargeObjectFile;
import eu.okaeri.docengine.lob.LargeObjectStore;
import eu.okaeri.docengine.lob.MissingPayloadException;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.bson.types.ObjectId;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;

/**
 * Large-object payloads stored as GridFS files.
 */
@RequiredArgsConstructor
public class GridFsLargeObjectStore implements LargeObjectStore {

    private final @Getter @NonNull GridFSBucket bucket;

    @Override
    public ObjectId put(@NonNull InputStream content, String filename) {
        return this.bucket.uploadFromStream((filename == null) ? "" : filename, content);
    }

    @Override
    public LargeObjectFile get(@NonNull ObjectId id) {
        GridFSFile file = this.find(id);
        if (file == null) {
            throw new MissingPayloadException(id);
        }
        ByteArrayOutputStream content = new ByteArrayOutputStream((int) Math.min(file.getLength(), Integer.MAX_VALUE));
        this.bucket.downloadToStream(id, content);
        return LargeObjectFile.of(id, file.getFilename(), file.getUploadDate(), content.toByteArray());
    }

    @Override
    public void delete(@NonNull ObjectId id) {
        if (this.find(id) == null) {
            return;
        }
        try {
            this.bucket.delete(id);
        } catch (MongoGridFSException exception) {
            // removed concurrently
            if (this.find(id) != null) {
                throw exception;
            }
        }
    }

    @Override
    public boolean exists(@NonNull ObjectId id) {
        return this.find(id) != null;
    }

    private GridFSFile find(ObjectId id) {
        return this.bucket.find(Filters.eq("_id", id)).first();
    }
}
