package eu.okaeri.docengine.fixture;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Maps {

    private Maps() {
    }

    /**
     * Ordered map from alternating keys and values.
     */
    public static Map<String, Object> map(Object... keysAndValues) {
        if ((keysAndValues.length % 2) != 0) {
            throw new IllegalArgumentException("odd number of arguments");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }
}
