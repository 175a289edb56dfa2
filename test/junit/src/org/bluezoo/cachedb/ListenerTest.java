/*
 * ListenerTest.java
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

package org.bluezoo.cachedb;

import org.junit.Test;
import java.net.InetAddress;
import java.util.Set;

import org.bluezoo.cachedb.server.RESPListener;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link Listener} configuration.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ListenerTest {

    @Test
    public void testParseDuration() {
        assertEquals(250L, Listener.parseDuration("250ms"));
        assertEquals(30000L, Listener.parseDuration("30s"));
        assertEquals(300000L, Listener.parseDuration("5m"));
        assertEquals(3600000L, Listener.parseDuration("1h"));
        assertEquals(1500L, Listener.parseDuration("1500"));
        assertEquals(60000L, Listener.parseDuration(" 1M "));
    }

    @Test
    public void testParseDurationInvalid() {
        assertEquals(0L, Listener.parseDuration(null));
        assertEquals(0L, Listener.parseDuration(""));
        assertEquals(0L, Listener.parseDuration("soon"));
    }

    @Test
    public void testDefaultPort() {
        RESPListener listener = new RESPListener();

        assertEquals(6379, listener.getPort());
        listener.setPort(7000);
        assertEquals(7000, listener.getPort());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidPort() {
        new RESPListener().setPort(65536);
    }

    @Test
    public void testDefaultAddressesIsWildcard() {
        assertTrue(new RESPListener().getAddresses().isEmpty());
    }

    @Test
    public void testSetAddresses() throws Exception {
        RESPListener listener = new RESPListener();
        listener.setAddresses("127.0.0.1, ::1");

        Set<InetAddress> addresses = listener.getAddresses();
        assertEquals(2, addresses.size());
        assertTrue(addresses.contains(InetAddress.getByName("127.0.0.1")));
        assertTrue(addresses.contains(InetAddress.getByName("::1")));
    }

    @Test
    public void testIdleTimeout() {
        RESPListener listener = new RESPListener();

        assertEquals(Listener.DEFAULT_IDLE_TIMEOUT_MS, listener.getIdleTimeoutMs());
        listener.setIdleTimeout("45s");
        assertEquals(45000L, listener.getIdleTimeoutMs());
    }

    @Test
    public void testSnapshotManagerSharesStore() {
        RESPListener listener = new RESPListener();

        assertSame(listener.getStore(), listener.getSnapshotManager().getStore());
    }

}
