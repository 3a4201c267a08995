/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Astrolabe.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.astrolabe.wcs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of FITS style header keywords.
 * <p>
 * Keys are compared exactly as supplied; no case folding is applied. Values are numbers, strings or booleans. Numbers
 * are held as {@code Double}. Engines keep their own snapshot and never write back to the caller's map.
 *
 * @author hal.hildebrand
 */
public final class Metadata {

    private static final Metadata EMPTY = new Metadata(Map.of());

    private final Map<String, Object> entries;

    private Metadata(Map<String, Object> entries) {
        this.entries = entries;
    }

    public static Metadata empty() {
        return EMPTY;
    }

    /**
     * Copy the given keyword map into a snapshot.
     *
     * @throws IllegalArgumentException if a key is null or a value is not a number, string or boolean
     */
    public static Metadata of(Map<String, ?> keywords) {
        if (keywords == null) {
            throw new IllegalArgumentException("Metadata keywords cannot be null");
        }
        var copy = new LinkedHashMap<String, Object>();
        for (var entry : keywords.entrySet()) {
            copy.put(checkKey(entry.getKey()), checkValue(entry.getKey(), entry.getValue()));
        }
        return new Metadata(Collections.unmodifiableMap(copy));
    }

    /**
     * Alternating key/value pairs, convenient for small headers.
     */
    public static Metadata of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Metadata requires key/value pairs");
        }
        var map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (!(keyValues[i] instanceof String key)) {
                throw new IllegalArgumentException("Metadata key must be a string: " + keyValues[i]);
            }
            map.put(key, keyValues[i + 1]);
        }
        return of(map);
    }

    private static String checkKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Metadata key cannot be null");
        }
        return key;
    }

    private static Object checkValue(String key, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        throw new IllegalArgumentException(
        "Metadata value for " + key + " must be a number, string or boolean: " + value);
    }

    /**
     * A new snapshot with one keyword added or replaced.
     */
    public Metadata with(String key, Object value) {
        var copy = new LinkedHashMap<>(entries);
        copy.put(checkKey(key), checkValue(key, value));
        return new Metadata(Collections.unmodifiableMap(copy));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * String form of a keyword. Non string values are rendered with {@code toString()}.
     */
    public Optional<String> getString(String key) {
        return get(key).map(Object::toString);
    }

    /**
     * Numeric value of a required keyword. Strings holding a number are parsed.
     *
     * @throws WcsLoadException if the keyword is missing or not numeric
     */
    public double getDouble(String key) throws WcsLoadException {
        var value = entries.get(key);
        if (value == null) {
            throw new WcsLoadException("Missing keyword " + key);
        }
        if (value instanceof Double number) {
            return number;
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new WcsLoadException("Keyword " + key + " is not numeric: '" + text + "'", e);
            }
        }
        throw new WcsLoadException("Keyword " + key + " is not numeric: " + value);
    }

    public Set<String> keys() {
        return entries.keySet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Read only view of all keywords.
     */
    public Map<String, Object> asMap() {
        return entries;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Metadata other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Metadata" + entries;
    }
}
