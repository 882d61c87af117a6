package eu.okaeri.docengine.mongo;

import com.mongodb.WriteConcern;
import eu.okaeri.docengine.connection.OperationFlags;
import lombok.NonNull;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Driver write concern of a command's write flags.
 * <p>
 * {@code safe: false} without {@code w} is unacknowledged, everything else is acknowledged.
 * {@code w} takes a node count or a tag such as {@code majority}, a boolean {@code w} means acknowledged
 * by the primary or not at all. {@code wtimeout} is in milliseconds.
 * {@code fsync} and {@code j} both request a journaled write, which is what the server does for fsync.
 */
public final class WriteConcerns {

    private WriteConcerns() {
    }

    public static WriteConcern of(@NonNull Map<String, Object> flags) {

        Object w = flags.get(OperationFlags.W);
        Object safe = flags.get(OperationFlags.SAFE);
        if ((w == null) && (safe != null) && !isTrue(safe)) {
            return WriteConcern.UNACKNOWLEDGED;
        }

        if (Boolean.FALSE.equals(w)) {
            return WriteConcern.UNACKNOWLEDGED;
        }

        WriteConcern concern = WriteConcern.ACKNOWLEDGED;
        if (Boolean.TRUE.equals(w)) {
            concern = concern.withW(1);
        } else if (w instanceof Number) {
            concern = concern.withW(((Number) w).intValue());
        } else if (w != null) {
            String value = String.valueOf(w);
            concern = isInteger(value) ? concern.withW(Integer.parseInt(value)) : concern.withW(value);
        }

        Object wtimeout = flags.get(OperationFlags.WTIMEOUT);
        if (wtimeout != null) {
            long millis = (wtimeout instanceof Number) ? ((Number) wtimeout).longValue() : Long.parseLong(String.valueOf(wtimeout));
            concern = concern.withWTimeout(millis, TimeUnit.MILLISECONDS);
        }

        if (isTrue(flags.get(OperationFlags.JOURNAL)) || isTrue(flags.get(OperationFlags.FSYNC))) {
            concern = concern.withJournal(true);
        }

        return concern;
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue() != 0;
        }
        return (value != null) && Boolean.parseBoolean(String.valueOf(value));
    }

    private static boolean isInteger(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
