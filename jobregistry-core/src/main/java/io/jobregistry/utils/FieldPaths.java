package io.jobregistry.utils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dotted-path access into nested field maps, e.g. {@code data.customer.id}.
 * <p>
 * Matching rules:
 * <ul>
 *   <li>Each dot descends one level into a nested {@link Map}.</li>
 *   <li>A {@code null} expectation matches a missing field as well as an explicit null.</li>
 *   <li>Numbers compare by numeric value, so {@code 10} equals {@code 10L} and {@code 10.0},
 *       at any depth.</li>
 *   <li>Maps compare by content (whole sub-document equality, key order ignored); lists compare
 *       element by element.</li>
 * </ul>
 */
public final class FieldPaths {

    private static final Object MISSING = new Object();

    private FieldPaths() {
    }

    /**
     * @return the value at {@code path}, or {@code null} when any segment is absent
     */
    public static Object resolve(Map<String, ?> root, String path) {
        Object value = walk(root, path);
        return value == MISSING ? null : value;
    }

    public static boolean isPresent(Map<String, ?> root, String path) {
        return walk(root, path) != MISSING;
    }

    public static boolean matchesEquals(Map<String, ?> root, String path, Object expected) {
        Object actual = walk(root, path);
        if (actual == MISSING) {
            return expected == null;
        }
        return valuesEqual(actual, expected);
    }

    /**
     * {@code actual <= bound}. Values of incomparable kinds never match.
     */
    public static boolean matchesAtMost(Map<String, ?> root, String path, Object bound) {
        Object actual = walk(root, path);
        if (actual == MISSING || actual == null || bound == null) {
            return false;
        }
        Integer cmp = compare(actual, bound);
        return cmp != null && cmp <= 0;
    }

    public static boolean valuesEqual(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return toBigDecimal(na).compareTo(toBigDecimal(nb)) == 0;
        }
        if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
            if (ma.size() != mb.size()) {
                return false;
            }
            for (Map.Entry<?, ?> e : ma.entrySet()) {
                if (!mb.containsKey(e.getKey()) || !valuesEqual(e.getValue(), mb.get(e.getKey()))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size()) {
                return false;
            }
            Iterator<?> ia = la.iterator();
            Iterator<?> ib = lb.iterator();
            while (ia.hasNext()) {
                if (!valuesEqual(ia.next(), ib.next())) {
                    return false;
                }
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    /**
     * Unmodifiable deep copy of a field map. Nested maps and lists are copied too; null values
     * are kept.
     */
    public static Map<String, Object> immutableCopy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, immutableValue(v)));
        return Collections.unmodifiableMap(copy);
    }

    @SuppressWarnings("unchecked")
    private static Object immutableValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), immutableValue(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(immutableValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Integer compare(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            return toBigDecimal(na).compareTo(toBigDecimal(nb));
        }
        if (a instanceof Comparable ca && a.getClass().isInstance(b)) {
            return ca.compareTo(b);
        }
        return null;
    }

    private static Object walk(Map<String, ?> root, String path) {
        Objects.requireNonNull(path, "path must not be null");
        Object current = root;
        for (String segment : path.split("\\.", -1)) {
            if (!(current instanceof Map<?, ?> map) || !map.containsKey(segment)) {
                return MISSING;
            }
            current = map.get(segment);
        }
        return current;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        return new BigDecimal(n.toString());
    }
}
