package com.bayesai.server.bn.factor;

import java.util.Comparator;
import java.util.List;

/**
 * Total order over domain values and row keys, used to make tables
 * diff-friendly. Values are ranked by kind first (numbers, booleans, strings,
 * everything else). Numbers compare by numeric value, then type name. Other
 * values of one type use their natural order, or their string form when they
 * are not comparable.
 */
public final class ValueOrdering {

    public static final Comparator<Object> VALUES = ValueOrdering::compareValues;

    public static final Comparator<List<Object>> KEYS = ValueOrdering::compareKeys;

    private ValueOrdering() {
    }

    private static int rank(Object value) {
        if (value instanceof Number) {
            return 0;
        }
        if (value instanceof Boolean) {
            return 1;
        }
        if (value instanceof String) {
            return 2;
        }
        return 3;
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    static int compareValues(Object a, Object b) {
        if (a == b) {
            return 0;
        }
        int byRank = Integer.compare(rank(a), rank(b));
        if (byRank != 0) {
            return byRank;
        }
        if (a instanceof Number) {
            int byValue = Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
            if (byValue != 0) {
                return byValue;
            }
        }
        int byType = a.getClass().getName().compareTo(b.getClass().getName());
        if (byType != 0) {
            return byType;
        }
        if (a instanceof Comparable) {
            return ((Comparable) a).compareTo(b);
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    static int compareKeys(List<Object> a, List<Object> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = compareValues(a.get(i), b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
