package eu.okaeri.docengine.filter.condition;

public enum LogicalOperator {
    AND,
    OR
}
