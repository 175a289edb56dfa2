/*
 * Store.java
 * Copyright (C) 2026 Chris Burdess
 *
 * This file is part of cachedb, a minimal RESP key-value cache server.
 *
 * cachedb is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * cachedb is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with cachedb.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.cachedb.store;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import org.bluezoo.util.ByteString;

/**
 * The in-memory key-value store.
 *
 * <p>Keys and values are binary-safe byte strings. Writing an existing
 * key replaces its value. No iteration order is defined.
 *
 * <p>This class is not thread-safe. A store is owned by a single
 * selector loop and is only ever accessed from that loop's thread.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class Store {

    private final Map<ByteString, ByteString> map = new HashMap<ByteString, ByteString>();

    /**
     * Returns the value stored under the given key.
     *
     * @param key the key
     * @return the value, or null if the key is absent
     */
    public ByteString get(ByteString key) {
        return map.get(key);
    }

    /**
     * Stores a value, replacing any existing value for the key.
     *
     * @param key the key
     * @param value the value
     */
    public void set(ByteString key, ByteString value) {
        if (key == null || value == null) {
            throw new NullPointerException();
        }
        map.put(key, value);
    }

    /**
     * Returns the number of keys.
     *
     * @return the store size
     */
    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    /**
     * Returns an iterator over every key/value pair, in no particular
     * order. The iterator is read-only and must not be held across a
     * modification of the store.
     *
     * @return the entries
     */
    public Iterator<Map.Entry<ByteString, ByteString>> entries() {
        return Collections.unmodifiableMap(map).entrySet().iterator();
    }

    /**
     * Replaces the entire contents of this store with those of another.
     *
     * @param other the store to copy from
     */
    public void replaceWith(Store other) {
        map.clear();
        map.putAll(other.map);
    }

}
