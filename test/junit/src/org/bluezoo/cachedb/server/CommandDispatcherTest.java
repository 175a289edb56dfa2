/*
 * CommandDispatcherTest.java
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

package org.bluezoo.cachedb.server;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.bluezoo.cachedb.resp.RESPValue;
import org.bluezoo.cachedb.store.SnapshotManager;
import org.bluezoo.cachedb.store.Store;
import org.bluezoo.util.ByteString;

import static org.bluezoo.cachedb.server.CommandTest.tokens;
import static org.junit.Assert.*;

/**
 * Unit tests for {@link CommandDispatcher}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CommandDispatcherTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Store store;
    private SnapshotManager snapshotManager;
    private CommandDispatcher dispatcher;

    @Before
    public void setUp() throws IOException {
        store = new Store();
        snapshotManager = new SnapshotManager(store);
        snapshotManager.setDirectory(folder.getRoot().toPath());
        dispatcher = new CommandDispatcher(store, snapshotManager);
    }

    private RESPValue dispatch(String... words) {
        return dispatcher.dispatch(Command.parse(tokens(words)));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // PING
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testPing() {
        RESPValue reply = dispatch("PING");

        assertTrue(reply.isSimpleString());
        assertEquals("PONG", reply.asString());
    }

    @Test
    public void testPingEcho() {
        RESPValue reply = dispatch("PING", "hello");

        assertTrue(reply.isBulkString());
        assertEquals("hello", reply.asString());
    }

    @Test
    public void testPingTooManyArgs() {
        RESPValue reply = dispatch("PING", "a", "b");

        assertTrue(reply.isError());
        assertEquals("ERR wrong number of arguments for 'ping' command", reply.asString());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // SET / GET
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testSetThenGet() {
        assertEquals(RESPValue.OK, dispatch("SET", "k", "v"));

        RESPValue reply = dispatch("GET", "k");
        assertTrue(reply.isBulkString());
        assertEquals("v", reply.asString());
    }

    @Test
    public void testSetOverwrites() {
        dispatch("SET", "k", "1");
        dispatch("set", "k", "2");

        assertEquals("2", dispatch("GET", "k").asString());
        assertEquals(1, store.size());
    }

    @Test
    public void testGetMissing() {
        assertTrue(dispatch("GET", "nope").isNull());
    }

    @Test
    public void testSetCopiesArguments() {
        List<byte[]> tokens = tokens("SET", "k", "v");
        dispatcher.dispatch(Command.parse(tokens));
        tokens.get(2)[0] = 'x';

        assertEquals(ByteString.of("v"), store.get(ByteString.of("k")));
    }

    @Test
    public void testSetWrongArity() {
        RESPValue reply = dispatch("SET", "k");

        assertEquals("ERR wrong number of arguments for 'set' command", reply.asString());
        assertTrue(store.isEmpty());
    }

    @Test
    public void testSetExtraArgumentKeepsValue() {
        dispatch("SET", "k", "1");

        RESPValue reply = dispatch("SET", "k", "v", "extra");

        assertTrue(reply.isError());
        assertEquals("ERR wrong number of arguments for 'set' command", reply.asString());
        assertEquals("1", dispatch("GET", "k").asString());
        assertEquals(1, store.size());
    }

    @Test
    public void testGetWrongArity() {
        assertEquals("ERR wrong number of arguments for 'get' command",
                dispatch("GET").asString());
        assertEquals("ERR wrong number of arguments for 'get' command",
                dispatch("GET", "a", "b").asString());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // BACKUP
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testBackup() throws IOException {
        dispatch("SET", "k", "v");

        RESPValue reply = dispatch("BACKUP");

        assertTrue(reply.isSimpleString());
        assertEquals("OK backup saved", reply.asString());
        Path latest = snapshotManager.latestSnapshot();
        assertNotNull(latest);
        assertTrue(Files.exists(latest));
    }

    @Test
    public void testBackupEmptyStore() throws IOException {
        assertEquals("OK backup saved", dispatch("BACKUP").asString());
        assertNotNull(snapshotManager.latestSnapshot());
    }

    @Test
    public void testBackupFailure() {
        snapshotManager.setDirectory(folder.getRoot().toPath().resolve("missing"));
        dispatch("SET", "k", "v");

        RESPValue reply = dispatch("BACKUP");

        assertTrue(reply.isError());
        assertTrue(reply.asString(), reply.asString().startsWith("ERR backup failed: "));
        assertEquals("v", dispatch("GET", "k").asString());
    }

    @Test
    public void testBackupWrongArity() {
        assertEquals("ERR wrong number of arguments for 'backup' command",
                dispatch("BACKUP", "now").asString());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Others
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testDbsize() {
        assertEquals(0L, dispatch("DBSIZE").asLong());
        dispatch("SET", "a", "1");
        dispatch("SET", "b", "2");
        assertEquals(2L, dispatch("DBSIZE").asLong());
    }

    @Test
    public void testQuit() {
        assertEquals(RESPValue.OK, dispatch("QUIT"));
    }

    @Test
    public void testUnknownCommand() {
        RESPValue reply = dispatch("FOO", "bar");

        assertTrue(reply.isError());
        assertEquals("ERR unknown command 'FOO'", reply.asString());
    }

    @Test
    public void testEmptyCommand() {
        RESPValue reply = dispatcher.dispatch(Command.parse(tokens()));

        assertTrue(reply.isError());
        assertEquals("ERR empty command", reply.asString());
    }

}
