package com.agentmesh.core.learning;

import java.util.Collection;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Deterministic string keys for learning states.
 * <p>
 * Keys are sorted. Numbers, booleans, strings, characters and enums are encoded by value;
 * collections, maps and arrays by {@code len:N}; null as {@code null}; anything else by its simple
 * type name. Entries are joined as {@code key=value} with {@code |}.
 */
public final class StateKeys {

    private StateKeys() {}

    public static String of(Map<String, ?> state) {
        if (state == null || state.isEmpty()) {
            return "";
        }
        var joiner = new StringJoiner("|");
        new TreeMap<String, Object>(state).forEach((key, value) -> joiner.add(key + "=" + encode(value)));
        return joiner.toString();
    }

    static String encode(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Number || value instanceof Boolean
                || value instanceof CharSequence || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof Collection<?> c) {
            return "len:" + c.size();
        }
        if (value instanceof Map<?, ?> m) {
            return "len:" + m.size();
        }
        int length = arrayLength(value);
        return length >= 0 ? "len:" + length : value.getClass().getSimpleName();
    }

    /** Length of an object or primitive array, or -1 for anything else. */
    private static int arrayLength(Object value) {
        if (value instanceof Object[] a) return a.length;
        if (value instanceof int[] a) return a.length;
        if (value instanceof long[] a) return a.length;
        if (value instanceof double[] a) return a.length;
        if (value instanceof float[] a) return a.length;
        if (value instanceof boolean[] a) return a.length;
        if (value instanceof byte[] a) return a.length;
        if (value instanceof short[] a) return a.length;
        if (value instanceof char[] a) return a.length;
        return -1;
    }
}
