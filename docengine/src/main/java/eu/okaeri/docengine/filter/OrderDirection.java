package eu.okaeri.docengine.filter;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum OrderDirection {

    ASC(1),
    DESC(-1);

    /**
     * Value of the field in a sort document.
     */
    private final int sortValue;
}
