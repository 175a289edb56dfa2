/*
 * SnapshotManagerTest.java
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
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.bluezoo.util.ByteString;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link SnapshotManager}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SnapshotManagerTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Store store;
    private TestSnapshotManager manager;
    private Path dir;

    /**
     * Snapshot manager with a controllable clock.
     */
    static class TestSnapshotManager extends SnapshotManager {

        long uptime;
        LocalDateTime time = LocalDateTime.of(2026, 1, 2, 3, 4, 5);

        TestSnapshotManager(Store store) {
            super(store);
        }

        @Override
        protected long uptimeMillis() {
            return uptime;
        }

        @Override
        protected LocalDateTime now() {
            return time;
        }

    }

    @Before
    public void setUp() throws IOException {
        dir = folder.newFolder("snapshots").toPath();
        store = new Store();
        manager = new TestSnapshotManager(store);
        manager.setDirectory(dir);
    }

    private void put(String key, String value) {
        store.set(ByteString.of(key), ByteString.of(value));
    }

    private List<Path> listFiles() throws IOException {
        List<Path> files = new ArrayList<Path>();
        DirectoryStream<Path> stream = Files.newDirectoryStream(dir);
        try {
            for (Path path : stream) {
                files.add(path);
            }
        } finally {
            stream.close();
        }
        return files;
    }

    private Path writeFile(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.write(path, content.getBytes(StandardCharsets.UTF_8));
        return path;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Saving
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testSaveFormat() throws IOException {
        put("a", "1");
        put("bb", "22");

        Path path = manager.save();

        String content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        assertTrue(content.equals("2\n1\na\n1\n1\n2\nbb\n2\n22\n")
                || content.equals("2\n2\nbb\n2\n22\n1\na\n1\n1\n"));
    }

    @Test
    public void testSaveEmptyStore() throws IOException {
        Path path = manager.save();

        assertEquals("0\n", new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    @Test
    public void testPrefixWithSeparatorRejected() {
        try {
            manager.setPrefix("bad/prefix-");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals(SnapshotManager.DEFAULT_PREFIX, manager.getPrefix());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSuffixWithNulRejected() {
        manager.setSuffix(".snap\0shot");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSuffixWithBackslashRejected() {
        manager.setSuffix("\\x.snapshot");
    }

    @Test
    public void testAutoBackupAfterRejectedPrefix() throws IOException {
        try {
            manager.setPrefix("bad/prefix-");
        } catch (IllegalArgumentException e) {
            // the previous prefix stays in effect
        }
        manager.setIntervalMs(10L);
        put("k", "v");
        manager.uptime = 100L;

        assertTrue(manager.checkAutoBackup());
        assertEquals(1, listFiles().size());
    }

    @Test
    public void testSaveName() throws IOException {
        Path path = manager.save();

        String name = path.getFileName().toString();
        assertTrue(name, name.matches("cachedb-20260102-030405-[0-9]+\\.snapshot"));
        assertEquals(dir, path.getParent());
    }

    @Test
    public void testSaveCustomPrefixAndSuffix() throws IOException {
        manager.setPrefix("dump-");
        manager.setSuffix(".db");

        String name = manager.save().getFileName().toString();

        assertTrue(name, name.startsWith("dump-20260102-030405-"));
        assertTrue(name, name.endsWith(".db"));
    }

    @Test
    public void testSavesNeverOverwrite() throws IOException {
        put("k", "first");
        Path first = manager.save();
        put("k", "second");
        Path second = manager.save();

        assertFalse(first.equals(second));
        assertEquals(2, listFiles().size());
        assertEquals(ByteString.of("first"), manager.load(first).get(ByteString.of("k")));
        assertEquals(ByteString.of("second"), manager.load(second).get(ByteString.of("k")));
    }

    @Test
    public void testNoTemporaryFilesRemain() throws IOException {
        put("k", "v");
        manager.save();

        List<Path> files = listFiles();
        assertEquals(1, files.size());
        assertTrue(files.get(0).getFileName().toString().endsWith(".snapshot"));
    }

    @Test
    public void testSaveToMissingDirectory() throws IOException {
        manager.setDirectory(dir.resolve("missing"));
        put("k", "v");
        try {
            manager.save();
            fail("Expected SnapshotException");
        } catch (SnapshotException e) {
            assertTrue(e.getMessage(), e.getMessage().startsWith("no such file or directory"));
        }
        assertEquals(1, store.size());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Loading
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testRoundTripBinary() throws IOException {
        byte[] key = { 0, '\n', (byte) 0xff };
        byte[] value = { '\n', '\n', '\r' };
        store.set(ByteString.wrap(key), ByteString.wrap(value));
        store.set(ByteString.EMPTY, ByteString.of("empty key"));

        Store loaded = manager.load(manager.save());

        assertEquals(2, loaded.size());
        assertEquals(ByteString.wrap(value), loaded.get(ByteString.wrap(key)));
        assertEquals(ByteString.of("empty key"), loaded.get(ByteString.EMPTY));
    }

    @Test
    public void testLoadWellFormed() throws IOException {
        Path path = writeFile("manual.snapshot", "1\n3\nkey\n5\nvalue\n");

        Store loaded = manager.load(path);

        assertEquals(ByteString.of("value"), loaded.get(ByteString.of("key")));
    }

    @Test(expected = SnapshotException.class)
    public void testLoadTruncated() throws IOException {
        manager.load(writeFile("t.snapshot", "1\n3\nkey\n5\nval"));
    }

    @Test(expected = SnapshotException.class)
    public void testLoadMissingPairs() throws IOException {
        manager.load(writeFile("t.snapshot", "2\n1\na\n1\n1\n"));
    }

    @Test
    public void testLoadHugeLength() throws IOException {
        Path path = writeFile("t.snapshot", "1\n2147483647\nab\n1\nc\n");
        try {
            manager.load(path);
            fail("Expected SnapshotException");
        } catch (SnapshotException e) {
            assertTrue(e.getMessage(), e.getMessage().contains("truncated"));
        }
    }

    @Test(expected = SnapshotException.class)
    public void testLoadHugeCount() throws IOException {
        manager.load(writeFile("t.snapshot", "2147483647\n1\na\n1\nb\n"));
    }

    @Test(expected = SnapshotException.class)
    public void testLoadBadNumber() throws IOException {
        manager.load(writeFile("t.snapshot", "x\n"));
    }

    @Test(expected = SnapshotException.class)
    public void testLoadMissingNewline() throws IOException {
        manager.load(writeFile("t.snapshot", "1\n1\nab\n1\nc\n"));
    }

    @Test(expected = SnapshotException.class)
    public void testLoadTrailingData() throws IOException {
        manager.load(writeFile("t.snapshot", "0\nextra"));
    }

    @Test(expected = SnapshotException.class)
    public void testLoadEmptyFile() throws IOException {
        manager.load(writeFile("t.snapshot", ""));
    }

    @Test(expected = SnapshotException.class)
    public void testLoadMissingFile() throws IOException {
        manager.load(dir.resolve("nothing.snapshot"));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Restoring
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testLatestSnapshot() throws IOException {
        writeFile("cachedb-20260101-235959-50.snapshot", "0\n");
        writeFile("cachedb-20260102-000000-9.snapshot", "0\n");
        Path latest = writeFile("cachedb-20260102-000000-10.snapshot", "0\n");
        writeFile("cachedb-junk.snapshot", "0\n");
        writeFile("cachedb-2026010x-000000-99.snapshot", "0\n");
        writeFile("other.txt", "0\n");

        assertEquals(latest, manager.latestSnapshot());
    }

    @Test
    public void testLatestSnapshotNone() throws IOException {
        writeFile("other.txt", "0\n");

        assertNull(manager.latestSnapshot());
        assertNull(manager.restoreLatest());
    }

    @Test
    public void testLatestSnapshotMissingDirectory() throws IOException {
        manager.setDirectory(dir.resolve("missing"));

        assertNull(manager.latestSnapshot());
    }

    @Test
    public void testRestoreLatest() throws IOException {
        put("a", "1");
        manager.save();
        manager.time = manager.time.plusSeconds(1);
        put("b", "2");
        Path newest = manager.save();

        Store target = new Store();
        target.set(ByteString.of("stale"), ByteString.of("x"));
        SnapshotManager restorer = new SnapshotManager(target);
        restorer.setDirectory(dir);

        assertEquals(newest, restorer.restoreLatest());
        assertEquals(2, target.size());
        assertNull(target.get(ByteString.of("stale")));
        assertEquals(ByteString.of("2"), target.get(ByteString.of("b")));
    }

    @Test
    public void testRestoreCorruptLeavesStoreUnchanged() throws IOException {
        writeFile("cachedb-20260102-000000-1.snapshot", "3\n1\na\n");
        put("keep", "me");

        try {
            manager.restoreLatest();
            fail("Expected SnapshotException");
        } catch (SnapshotException e) {
            // expected
        }
        assertEquals(1, store.size());
        assertEquals(ByteString.of("me"), store.get(ByteString.of("keep")));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Automatic snapshots
    // ─────────────────────────────────────────────────────────────────────────

    @Test
    public void testAutoBackupSkipsEmptyStore() throws IOException {
        manager.setIntervalMs(1000L);
        manager.uptime = 5000L;

        assertFalse(manager.checkAutoBackup());
        assertTrue(listFiles().isEmpty());
    }

    @Test
    public void testAutoBackupAfterInterval() throws IOException {
        manager.setIntervalMs(1000L);
        put("k", "v");

        manager.uptime = 1000L;
        assertFalse(manager.checkAutoBackup());
        manager.uptime = 1001L;
        assertTrue(manager.checkAutoBackup());
        assertEquals(1, listFiles().size());

        manager.uptime = 1500L;
        assertFalse(manager.checkAutoBackup());
        manager.uptime = 2002L;
        assertTrue(manager.checkAutoBackup());
        assertEquals(2, listFiles().size());
    }

    @Test
    public void testExplicitSaveResetsInterval() throws IOException {
        manager.setIntervalMs(1000L);
        put("k", "v");
        manager.uptime = 900L;
        manager.save();

        manager.uptime = 1500L;
        assertFalse(manager.checkAutoBackup());
        assertEquals(1, listFiles().size());
    }

    @Test
    public void testAutoBackupDisabled() throws IOException {
        manager.setIntervalMs(0L);
        put("k", "v");
        manager.uptime = Long.MAX_VALUE / 2;

        assertFalse(manager.checkAutoBackup());
        assertTrue(listFiles().isEmpty());
    }

    @Test
    public void testAutoBackupFailureIsNotFatal() {
        manager.setDirectory(dir.resolve("missing"));
        manager.setIntervalMs(10L);
        put("k", "v");
        manager.uptime = 100L;

        assertFalse(manager.checkAutoBackup());
    }

    @Test
    public void testSetInterval() {
        manager.setInterval("30s");
        assertEquals(30000L, manager.getIntervalMs());
        manager.setInterval("5m");
        assertEquals(300000L, manager.getIntervalMs());
    }

}
