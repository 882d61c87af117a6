package eu.okaeri.docengine.filter.operation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum UpdateOperationType {

    SET("$set"),
    UNSET("$unset"),
    INCREMENT("$inc");

    private final String operator;
}
