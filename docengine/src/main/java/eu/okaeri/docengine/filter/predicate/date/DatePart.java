package eu.okaeri.docengine.filter.predicate.date;

public enum DatePart {
    YEAR,
    MONTH,
    DAY
}
