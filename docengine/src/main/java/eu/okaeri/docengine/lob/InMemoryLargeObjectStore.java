package eu.okaeri.docengine.lob;

import lombok.NonNull;
import org.bson.types.ObjectId;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Date;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryLargeObjectStore implements LargeObjectStore {

    private final Map<ObjectId, LargeObjectFile> files = new ConcurrentHashMap<>();

    @Override
    public ObjectId put(@NonNull InputStream content, String filename) {
        ObjectId id = new ObjectId();
        this.files.put(id, LargeObjectFile.of(id, filename, new Date(), readAll(content)));
        return id;
    }

    @Override
    public LargeObjectFile get(@NonNull ObjectId id) {
        LargeObjectFile file = this.files.get(id);
        if (file == null) {
            throw new MissingPayloadException(id);
        }
        return file;
    }

    @Override
    public void delete(@NonNull ObjectId id) {
        this.files.remove(id);
    }

    @Override
    public boolean exists(@NonNull ObjectId id) {
        return this.files.containsKey(id);
    }

    public int size() {
        return this.files.size();
    }

    static byte[] readAll(InputStream content) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[8192];
        try {
            int read;
            while ((read = content.read(chunk)) != -1) {
                buffer.write(chunk, 0, read);
            }
        } catch (IOException exception) {
            throw new UncheckedIOException("failed to read large-object payload", exception);
        }
        return buffer.toByteArray();
    }
}
