/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.multilog.log;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable set of structured key/value fields attached to a log call.
 * <p>
 * Keys are kept in lexicographic order. Merging never mutates either operand:
 * <pre>
 * Fields base = Fields.of("user", "alice");
 * Fields merged = base.merge(Fields.of("user", "bob", "id", 7)); // user=bob, id=7
 * </pre>
 */
public final class Fields implements Iterable<Map.Entry<String, Object>> {

    public static final Fields EMPTY = new Fields(new TreeMap<>());

    private final Map<String, Object> values;

    private Fields(TreeMap<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Fields of(String key, Object value) {
        TreeMap<String, Object> map = new TreeMap<>();
        map.put(requireKey(key), value);
        return new Fields(map);
    }

    /**
     * Build from alternating key / value arguments.
     */
    public static Fields of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("expected key / value pairs, got " + keyValues.length + " arguments");
        }
        TreeMap<String, Object> map = new TreeMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String key)) {
                throw new IllegalArgumentException("field key at position " + i + " is not a string: " + keyValues[i]);
            }
            map.put(requireKey(key), keyValues[i + 1]);
        }
        return map.isEmpty() ? EMPTY : new Fields(map);
    }

    public static Fields of(Map<String, ?> map) {
        if (map == null || map.isEmpty()) {
            return EMPTY;
        }
        TreeMap<String, Object> copy = new TreeMap<>();
        map.forEach((k, v) -> copy.put(requireKey(k), v));
        return new Fields(copy);
    }

    private static String requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("field key must not be empty");
        }
        return key;
    }

    /**
     * Union of both sets, keys of {@code additional} win on collision.
     * Returns an operand unchanged when the other one is empty.
     */
    public Fields merge(Fields additional) {
        if (additional == null || additional.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return additional;
        }
        TreeMap<String, Object> map = new TreeMap<>(values);
        map.putAll(additional.values);
        return new Fields(map);
    }

    public Fields with(String key, Object value) {
        return merge(of(key, value));
    }

    public Fields without(String key) {
        if (!values.containsKey(key)) {
            return this;
        }
        TreeMap<String, Object> map = new TreeMap<>(values);
        map.remove(key);
        return map.isEmpty() ? EMPTY : new Fields(map);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<String> keys() {
        return values.keySet();
    }

    @Override
    public Iterator<Map.Entry<String, Object>> iterator() {
        return values.entrySet().iterator();
    }

    /**
     * Render as {@code key=value } pairs in key order, each followed by one space.
     * Values containing whitespace are double-quoted.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String value = stringify(entry.getValue());
            if (containsWhitespace(value)) {
                value = '"' + value + '"';
            }
            sb.append(entry.getKey()).append('=').append(value).append(' ');
        }
        return sb.toString();
    }

    public static String stringify(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Object[] array) {
            return Arrays.deepToString(array);
        }
        if (value.getClass().isArray()) {
            // primitive arrays
            return Arrays.deepToString(new Object[]{value}).replaceAll("^\\[|]$", "");
        }
        return value.toString();
    }

    static boolean containsWhitespace(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Fields other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

}
