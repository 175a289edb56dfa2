/*
 * StoreTest.java
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

import org.junit.Before;
import org.junit.Test;
import java.util.Iterator;
import java.util.Map;

import org.bluezoo.util.ByteString;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link Store}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class StoreTest {

    private Store store;

    @Before
    public void setUp() {
        store = new Store();
    }

    @Test
    public void testGetAbsent() {
        assertNull(store.get(ByteString.of("missing")));
        assertTrue(store.isEmpty());
    }

    @Test
    public void testSetReplaces() {
        store.set(ByteString.of("k"), ByteString.of("1"));
        store.set(ByteString.of("k"), ByteString.of("2"));

        assertEquals(1, store.size());
        assertEquals(ByteString.of("2"), store.get(ByteString.of("k")));
    }

    @Test
    public void testEmptyKeyAndValue() {
        store.set(ByteString.EMPTY, ByteString.EMPTY);

        assertEquals(ByteString.EMPTY, store.get(ByteString.EMPTY));
    }

    @Test
    public void testEntries() {
        store.set(ByteString.of("a"), ByteString.of("1"));
        store.set(ByteString.of("b"), ByteString.of("2"));

        int count = 0;
        Iterator<Map.Entry<ByteString, ByteString>> i = store.entries();
        while (i.hasNext()) {
            Map.Entry<ByteString, ByteString> entry = i.next();
            assertEquals(entry.getValue(), store.get(entry.getKey()));
            count++;
        }
        assertEquals(2, count);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testEntriesReadOnly() {
        store.set(ByteString.of("a"), ByteString.of("1"));
        Iterator<Map.Entry<ByteString, ByteString>> i = store.entries();
        i.next();
        i.remove();
    }

    @Test
    public void testReplaceWith() {
        store.set(ByteString.of("old"), ByteString.of("x"));
        Store other = new Store();
        other.set(ByteString.of("new"), ByteString.of("y"));

        store.replaceWith(other);

        assertEquals(1, store.size());
        assertNull(store.get(ByteString.of("old")));
        assertEquals(ByteString.of("y"), store.get(ByteString.of("new")));
    }

    @Test(expected = NullPointerException.class)
    public void testSetNullValue() {
        store.set(ByteString.of("k"), null);
    }

}
