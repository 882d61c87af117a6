package eu.okaeri.docengine.lob;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;
import org.bson.types.ObjectId;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Materialized payload read from a {@link LargeObjectStore}.
 */
@Getter
@ToString(exclude = "content")
@EqualsAndHashCode(of = "id")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LargeObjectFile {

    private final ObjectId id;
    private final String filename;
    private final Date uploadDate;
    @Getter(AccessLevel.NONE)
    private final byte[] content;

    public static LargeObjectFile of(@NonNull ObjectId id, String filename, @NonNull Date uploadDate, @NonNull byte[] content) {
        return new LargeObjectFile(id, filename, uploadDate, content);
    }

    public long getLength() {
        return this.content.length;
    }

    public byte[] getBytes() {
        return this.content.clone();
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(this.content);
    }

    public String asText() {
        return new String(this.content, StandardCharsets.UTF_8);
    }
}
