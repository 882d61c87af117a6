package eu.okaeri.docengine.index;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum IndexDirection {

    ASCENDING(1),
    DESCENDING(-1);

    private final int value;

    public static IndexDirection of(int value) {
        if (value == 1) return ASCENDING;
        if (value == -1) return DESCENDING;
        throw new IllegalArgumentException("unsupported index direction: " + value);
    }
}
