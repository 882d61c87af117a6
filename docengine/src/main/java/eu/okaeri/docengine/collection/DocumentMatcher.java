package eu.okaeri.docengine.collection;

import lombok.NonNull;
import org.bson.Document;
import org.bson.types.Decimal128;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates query documents against stored documents for the in-memory backend.
 * Supports the operators the query translator emits: {@code $and}, {@code $or}, {@code $eq}, {@code $ne},
 * {@code $gt}, {@code $gte}, {@code $lt}, {@code $lte}, {@code $in}, {@code $nin}, {@code $exists}
 * and {@code $elemMatch}, with array traversal on dotted paths.
 */
final class DocumentMatcher {

    private DocumentMatcher() {
    }

    static boolean matches(@NonNull Map<String, Object> document, @NonNull Map<String, Object> filter) {

        for (Map.Entry<String, Object> criteria : filter.entrySet()) {
            String key = criteria.getKey();

            if ("$and".equals(key)) {
                for (Map<String, Object> clause : clauses(key, criteria.getValue())) {
                    if (!matches(document, clause)) {
                        return false;
                    }
                }
                continue;
            }

            if ("$or".equals(key)) {
                boolean any = false;
                for (Map<String, Object> clause : clauses(key, criteria.getValue())) {
                    if (matches(document, clause)) {
                        any = true;
                        break;
                    }
                }
                if (!any) {
                    return false;
                }
                continue;
            }

            if (key.startsWith("$")) {
                throw new UnsupportedOperationException("unsupported top-level operator: " + key);
            }

            List<Object> values = new ArrayList<>();
            collect(document, key.split("\\."), 0, values);
            if (!matchesField(values, criteria.getValue())) {
                return false;
            }
        }

        return true;
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> clauses(String operator, Object value) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException(operator + " requires a list of documents");
        }
        List<Map<String, Object>> clauses = new ArrayList<>();
        for (Object clause : (List<Object>) value) {
            if (!(clause instanceof Map)) {
                throw new IllegalArgumentException(operator + " requires a list of documents");
            }
            clauses.add((Map<String, Object>) clause);
        }
        return clauses;
    }

    private static void collect(Object current, String[] segments, int index, List<Object> values) {
        if (index == segments.length) {
            values.add(current);
            return;
        }
        if (current instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) current;
            if (map.containsKey(segments[index])) {
                collect(map.get(segments[index]), segments, index + 1, values);
            }
            return;
        }
        if (current instanceof List) {
            for (Object element : (List<?>) current) {
                collect(element, segments, index, values);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static boolean matchesField(List<Object> values, Object expected) {
        if (isOperatorDocument(expected)) {
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) expected).entrySet()) {
                if (!matchesOperator(values, entry.getKey(), entry.getValue())) {
                    return false;
                }
            }
            return true;
        }
        return matchesEq(values, expected);
    }

    @SuppressWarnings("unchecked")
    private static boolean matchesOperator(List<Object> values, String operator, Object operand) {
        switch (operator) {
            case "$eq":
                return matchesEq(values, operand);
            case "$ne":
                return !matchesEq(values, operand);
            case "$gt":
                return anyComparison(values, operand, comparison -> comparison > 0);
            case "$gte":
                return anyComparison(values, operand, comparison -> comparison >= 0);
            case "$lt":
                return anyComparison(values, operand, comparison -> comparison < 0);
            case "$lte":
                return anyComparison(values, operand, comparison -> comparison <= 0);
            case "$in":
                return operandList(operator, operand).stream().anyMatch(candidate -> matchesEq(values, candidate));
            case "$nin":
                return operandList(operator, operand).stream().noneMatch(candidate -> matchesEq(values, candidate));
            case "$exists":
                return Boolean.TRUE.equals(operand) != values.isEmpty();
            case "$elemMatch":
                if (!(operand instanceof Map)) {
                    throw new IllegalArgumentException("$elemMatch requires a document");
                }
                return matchesElement(values, (Map<String, Object>) operand);
            default:
                throw new UnsupportedOperationException("unsupported query operator: " + operator);
        }
    }

    @SuppressWarnings("unchecked")
    private static boolean matchesElement(List<Object> values, Map<String, Object> criteria) {
        for (Object value : values) {
            if (!(value instanceof List)) {
                continue;
            }
            for (Object element : (List<Object>) value) {
                if (isOperatorDocument(criteria)) {
                    if (matchesField(Collections.singletonList(element), criteria)) {
                        return true;
                    }
                } else if ((element instanceof Map) && matches((Map<String, Object>) element, criteria)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean matchesEq(List<Object> values, Object expected) {
        if (values.isEmpty()) {
            return expected == null;
        }
        for (Object actual : values) {
            if (valueEquals(actual, expected)) {
                return true;
            }
            if ((actual instanceof List) && !(expected instanceof List)) {
                for (Object element : (List<?>) actual) {
                    if (valueEquals(element, expected)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private static boolean anyComparison(List<Object> values, Object expected, ComparisonCheck check) {
        for (Object actual : values) {
            Collection<?> candidates = (actual instanceof List) ? (List<?>) actual : Collections.singletonList(actual);
            for (Object candidate : candidates) {
                Integer comparison = compare(candidate, expected);
                if ((comparison != null) && check.test(comparison)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<?> operandList(String operator, Object operand) {
        if (!(operand instanceof List)) {
            throw new IllegalArgumentException(operator + " requires a list");
        }
        return (List<?>) operand;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static Integer compare(Object left, Object right) {
        if ((left == null) || (right == null)) {
            return null;
        }
        if ((left instanceof Number) && (right instanceof Number)) {
            return toBigDecimal((Number) left).compareTo(toBigDecimal((Number) right));
        }
        if ((left instanceof Date) && (right instanceof Date)) {
            return ((Date) left).compareTo((Date) right);
        }
        if (left.getClass().equals(right.getClass()) && (left instanceof Comparable)) {
            return ((Comparable) left).compareTo(right);
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    static boolean valueEquals(Object left, Object right) {
        if ((left instanceof Number) && (right instanceof Number)) {
            return compare(left, right) == 0;
        }
        if ((left instanceof Map) && (right instanceof Map)) {
            Map<String, Object> leftMap = (Map<String, Object>) left;
            Map<String, Object> rightMap = (Map<String, Object>) right;
            if (leftMap.size() != rightMap.size()) {
                return false;
            }
            for (Map.Entry<String, Object> entry : leftMap.entrySet()) {
                if (!rightMap.containsKey(entry.getKey()) || !valueEquals(entry.getValue(), rightMap.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if ((left instanceof List) && (right instanceof List)) {
            List<?> leftList = (List<?>) left;
            List<?> rightList = (List<?>) right;
            if (leftList.size() != rightList.size()) {
                return false;
            }
            Iterator<?> rightIterator = rightList.iterator();
            for (Object element : leftList) {
                if (!valueEquals(element, rightIterator.next())) {
                    return false;
                }
            }
            return true;
        }
        return Objects.deepEquals(left, right);
    }

    private static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Decimal128) {
            return ((Decimal128) value).bigDecimalValue();
        }
        if ((value instanceof Double) || (value instanceof Float)) {
            return new BigDecimal(value.toString());
        }
        return BigDecimal.valueOf(value.longValue());
    }

    private static boolean isOperatorDocument(Object value) {
        if (!(value instanceof Map) || ((Map<?, ?>) value).isEmpty()) {
            return false;
        }
        for (Object key : ((Map<?, ?>) value).keySet()) {
            if (!(key instanceof String) || !((String) key).startsWith("$")) {
                return false;
            }
        }
        return true;
    }

    static Document copy(Map<String, Object> source) {
        Document copy = new Document();
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            copy.put(entry.getKey(), copyValue(entry.getValue()));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    static Object copyValue(Object value) {
        if (value instanceof Map) {
            return copy((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        if (value instanceof Date) {
            return new Date(((Date) value).getTime());
        }
        return value;
    }

    @FunctionalInterface
    private interface ComparisonCheck {
        boolean test(int comparison);
    }
}
