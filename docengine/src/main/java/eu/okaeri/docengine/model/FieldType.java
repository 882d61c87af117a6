package eu.okaeri.docengine.model;

import eu.okaeri.docengine.lob.LargeObjectFile;
import lombok.NonNull;

import java.io.InputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Date;
import java.util.Map;

public enum FieldType {

    /**
     * Resolve from the declared Java type, annotations only.
     */
    AUTO,
    AUTO_ID,
    TEXT,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    RAW,
    FOREIGN_KEY,
    LARGE_FILE,
    LARGE_TEXT;

    public boolean isLargeObject() {
        return (this == LARGE_FILE) || (this == LARGE_TEXT);
    }

    public static FieldType infer(@NonNull Class<?> type) {

        if ((type == String.class) || (type == char.class) || (type == Character.class)) {
            return TEXT;
        }
        if ((type == int.class) || (type == long.class) || (type == short.class) || (type == byte.class)
            || (type == Integer.class) || (type == Long.class) || (type == Short.class) || (type == Byte.class)
            || (type == BigInteger.class)) {
            return INTEGER;
        }
        if ((type == double.class) || (type == float.class) || (type == Double.class) || (type == Float.class) || (type == BigDecimal.class)) {
            return DECIMAL;
        }
        if ((type == boolean.class) || (type == Boolean.class)) {
            return BOOLEAN;
        }
        if (Date.class.isAssignableFrom(type) || (type == LocalDateTime.class) || (type == LocalDate.class) || (type == ZonedDateTime.class)) {
            return DATE;
        }
        if ((type == byte[].class) || (type == LargeObjectFile.class) || InputStream.class.isAssignableFrom(type)) {
            return LARGE_FILE;
        }
        if ((type == Object.class) || Collection.class.isAssignableFrom(type) || Map.class.isAssignableFrom(type)) {
            return RAW;
        }

        throw new IllegalArgumentException("cannot infer field type of " + type.getName() + ", declare it explicitly");
    }
}
