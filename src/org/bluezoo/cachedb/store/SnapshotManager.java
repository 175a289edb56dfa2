/*
 * SnapshotManager.java
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

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.text.MessageFormat;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.cachedb.Listener;
import org.bluezoo.util.ByteString;

/**
 * Writes the store to snapshot files and reads them back.
 *
 * <p>A snapshot file is newline-delimited. The first line is the number
 * of pairs; each pair then occupies four lines:
 * <pre>
 * 2
 * 1
 * a
 * 1
 * 1
 * 2
 * bb
 * 2
 * 22
 * </pre>
 * The key and value lines are raw bytes of exactly the declared length,
 * so they may themselves contain newlines.
 *
 * <p>Snapshots are named {@code <prefix><yyyyMMdd-HHmmss>-<seq><suffix>}.
 * The sequence number is unique within the process, and an existing
 * file is never overwritten. Each snapshot is first written to a
 * temporary file in the same directory, flushed to disk, and then
 * renamed into place, so a reader never observes a partial snapshot.
 *
 * <p>Automatic snapshots are checked for, never scheduled: the session
 * calls {@link #checkAutoBackup()} after each command it dispatches, and
 * a snapshot is taken when more than the configured interval of uptime
 * has passed since the last successful one. An idle server therefore
 * never takes automatic snapshots.
 *
 * <p>This class is not thread-safe. It is used from the selector loop
 * thread that owns the store.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SnapshotManager {

    private static final Logger LOGGER = Logger.getLogger(SnapshotManager.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.cachedb.store.L10N");

    /** Default filename prefix. */
    public static final String DEFAULT_PREFIX = "cachedb-";

    /** Default filename suffix. */
    public static final String DEFAULT_SUFFIX = ".snapshot";

    /** Default automatic snapshot interval, 5 minutes. */
    public static final long DEFAULT_INTERVAL_MS = 5L * 60L * 1000L;

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final int TIMESTAMP_LENGTH = 15;

    private static final AtomicLong SEQUENCE = new AtomicLong(0);

    private final Store store;

    private Path directory = Paths.get(System.getProperty("user.dir"));
    private String prefix = DEFAULT_PREFIX;
    private String suffix = DEFAULT_SUFFIX;
    private long intervalMs = DEFAULT_INTERVAL_MS;
    private boolean loadOnStart;

    private long lastSaveTime;

    /**
     * Creates a snapshot manager for the given store.
     *
     * @param store the store to snapshot
     */
    public SnapshotManager(Store store) {
        this.store = store;
        this.lastSaveTime = uptimeMillis();
    }

    // -- Configuration --

    public Store getStore() {
        return store;
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Sets the directory snapshots are written to and read from.
     * The default is the process working directory.
     *
     * @param directory the snapshot directory
     */
    public void setDirectory(Path directory) {
        this.directory = directory;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Sets the snapshot filename prefix.
     *
     * @param prefix the prefix
     * @throws IllegalArgumentException if the prefix contains a path
     *         separator or NUL
     */
    public void setPrefix(String prefix) {
        this.prefix = checkNamePart(prefix);
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * Sets the snapshot filename suffix.
     *
     * @param suffix the suffix
     * @throws IllegalArgumentException if the suffix contains a path
     *         separator or NUL
     */
    public void setSuffix(String suffix) {
        this.suffix = checkNamePart(suffix);
    }

    private static String checkNamePart(String part) {
        if (part == null) {
            throw new NullPointerException();
        }
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c == '/' || c == '\\' || c == '\0') {
                String msg = MessageFormat.format(L10N.getString("err.invalid_name_part"), part);
                throw new IllegalArgumentException(msg);
            }
        }
        return part;
    }

    public long getIntervalMs() {
        return intervalMs;
    }

    /**
     * Sets the automatic snapshot interval in milliseconds.
     * Zero or negative disables automatic snapshots.
     *
     * @param intervalMs the interval
     */
    public void setIntervalMs(long intervalMs) {
        this.intervalMs = intervalMs;
    }

    /**
     * Sets the automatic snapshot interval as a duration string,
     * e.g. "30s", "5m", "1h".
     *
     * @param interval the interval
     * @see Listener#parseDuration(String)
     */
    public void setInterval(String interval) {
        setIntervalMs(Listener.parseDuration(interval));
    }

    public boolean isLoadOnStart() {
        return loadOnStart;
    }

    /**
     * Sets whether the most recent snapshot is loaded into the store
     * when the server starts.
     *
     * @param loadOnStart true to restore at startup
     */
    public void setLoadOnStart(boolean loadOnStart) {
        this.loadOnStart = loadOnStart;
    }

    // -- Saving --

    /**
     * Writes the store to a new snapshot file.
     *
     * <p>On failure the temporary file is removed and the store is left
     * unchanged.
     *
     * @return the path of the snapshot written
     * @throws SnapshotException if the snapshot could not be written
     */
    public Path save() throws SnapshotException {
        Path tempPath = null;
        try {
            tempPath = Files.createTempFile(directory, prefix, ".tmp");
            int count = write(tempPath);
            Path target = nextSnapshotPath();
            try {
                Files.move(tempPath, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                // Plain move refuses to replace an existing target
                Files.move(tempPath, target);
            }
            tempPath = null;
            lastSaveTime = uptimeMillis();
            if (LOGGER.isLoggable(Level.INFO)) {
                String msg = MessageFormat.format(L10N.getString("info.snapshot_saved"),
                        target, count);
                LOGGER.info(msg);
            }
            return target;
        } catch (IOException e) {
            String msg = MessageFormat.format(L10N.getString("err.snapshot_save"),
                    directory, describe(e));
            LOGGER.log(Level.WARNING, msg, e);
            throw new SnapshotException(describe(e), e);
        } catch (IllegalArgumentException e) {
            // Includes InvalidPathException from an unusable name
            String msg = MessageFormat.format(L10N.getString("err.snapshot_save"),
                    directory, e.getMessage());
            LOGGER.log(Level.WARNING, msg, e);
            throw new SnapshotException(String.valueOf(e.getMessage()), e);
        } finally {
            if (tempPath != null) {
                deleteQuietly(tempPath);
            }
        }
    }

    /**
     * Takes a snapshot if one is due.
     *
     * <p>A snapshot is due when automatic snapshots are enabled, the
     * store is not empty, and more than the configured interval of
     * uptime has passed since the last successful snapshot. Failures
     * are logged and otherwise ignored.
     *
     * @return true if a snapshot was written
     */
    public boolean checkAutoBackup() {
        if (intervalMs <= 0L || store.isEmpty()) {
            return false;
        }
        long elapsed = uptimeMillis() - lastSaveTime;
        if (elapsed <= intervalMs) {
            return false;
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            String msg = MessageFormat.format(L10N.getString("log.auto_backup_due"), elapsed);
            LOGGER.fine(msg);
        }
        try {
            save();
            return true;
        } catch (SnapshotException e) {
            // Already logged by save; retry at the next command
            return false;
        }
    }

    /**
     * Returns the monotonic clock used to measure the snapshot interval.
     *
     * @return process uptime in milliseconds
     */
    protected long uptimeMillis() {
        return System.nanoTime() / 1000000L;
    }

    /**
     * Returns the local time used to name snapshot files.
     *
     * @return the current local date-time
     */
    protected LocalDateTime now() {
        return LocalDateTime.now();
    }

    private int write(Path path) throws IOException {
        FileOutputStream fileOut = new FileOutputStream(path.toFile());
        int count = 0;
        try {
            OutputStream out = new BufferedOutputStream(fileOut);
            writeNumber(out, store.size());
            Iterator<Map.Entry<ByteString, ByteString>> i = store.entries();
            while (i.hasNext()) {
                Map.Entry<ByteString, ByteString> entry = i.next();
                writeField(out, entry.getKey());
                writeField(out, entry.getValue());
                count++;
            }
            out.flush();
            fileOut.getChannel().force(true);
        } finally {
            fileOut.close();
        }
        return count;
    }

    private static void writeField(OutputStream out, ByteString field) throws IOException {
        writeNumber(out, field.length());
        field.writeTo(out);
        out.write('\n');
    }

    private static void writeNumber(OutputStream out, int n) throws IOException {
        out.write(Integer.toString(n).getBytes(StandardCharsets.US_ASCII));
        out.write('\n');
    }

    private Path nextSnapshotPath() {
        String timestamp = now().format(TIMESTAMP_FORMAT);
        Path path;
        do {
            long seq = SEQUENCE.incrementAndGet();
            path = directory.resolve(prefix + timestamp + "-" + seq + suffix);
        } while (Files.exists(path));
        return path;
    }

    // -- Loading --

    /**
     * Reads a snapshot file into a new store.
     *
     * @param path the snapshot file
     * @return a store holding the snapshot contents
     * @throws SnapshotException if the file cannot be read or is corrupt
     */
    public Store load(Path path) throws SnapshotException {
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new SnapshotException(describe(e), e);
        }
        SnapshotReader reader = new SnapshotReader(path, data);
        Store result = new Store();
        int count = reader.readNumber();
        for (int i = 0; i < count; i++) {
            ByteString key = reader.readField();
            ByteString value = reader.readField();
            result.set(key, value);
        }
        reader.end();
        return result;
    }

    /**
     * Returns the most recent snapshot in the snapshot directory.
     *
     * <p>Snapshots are ordered by the timestamp in their name, then by
     * sequence number. Files that do not follow the naming scheme are
     * ignored.
     *
     * @return the newest snapshot, or null if there is none
     * @throws SnapshotException if the directory cannot be listed
     */
    public Path latestSnapshot() throws SnapshotException {
        Path latest = null;
        String latestTimestamp = null;
        long latestSeq = -1L;
        try {
            DirectoryStream<Path> stream = Files.newDirectoryStream(directory);
            try {
                for (Path path : stream) {
                    String name = path.getFileName().toString();
                    if (!name.startsWith(prefix) || !name.endsWith(suffix)) {
                        continue;
                    }
                    String stem = name.substring(prefix.length(), name.length() - suffix.length());
                    if (stem.length() < TIMESTAMP_LENGTH + 2 || stem.charAt(TIMESTAMP_LENGTH) != '-') {
                        continue;
                    }
                    String timestamp = stem.substring(0, TIMESTAMP_LENGTH);
                    long seq;
                    try {
                        seq = Long.parseLong(stem.substring(TIMESTAMP_LENGTH + 1));
                    } catch (NumberFormatException e) {
                        continue;
                    }
                    if (!isTimestamp(timestamp) || seq < 0L) {
                        continue;
                    }
                    int cmp = (latestTimestamp == null) ? 1 : timestamp.compareTo(latestTimestamp);
                    if (cmp > 0 || (cmp == 0 && seq > latestSeq)) {
                        latest = path;
                        latestTimestamp = timestamp;
                        latestSeq = seq;
                    }
                }
            } finally {
                stream.close();
            }
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new SnapshotException(describe(e), e);
        }
        return latest;
    }

    /**
     * Replaces the store contents with the most recent snapshot.
     *
     * <p>The snapshot is parsed completely before the store is touched,
     * so a corrupt snapshot leaves the store as it was.
     *
     * @return the snapshot restored, or null if there was none
     * @throws SnapshotException if the snapshot cannot be read
     */
    public Path restoreLatest() throws SnapshotException {
        Path latest = latestSnapshot();
        if (latest == null) {
            LOGGER.info(L10N.getString("info.no_snapshot"));
            return null;
        }
        Store loaded = load(latest);
        store.replaceWith(loaded);
        lastSaveTime = uptimeMillis();
        if (LOGGER.isLoggable(Level.INFO)) {
            String msg = MessageFormat.format(L10N.getString("info.snapshot_restored"),
                    latest, loaded.size());
            LOGGER.info(msg);
        }
        return latest;
    }

    private static boolean isTimestamp(String s) {
        for (int i = 0; i < TIMESTAMP_LENGTH; i++) {
            char c = s.charAt(i);
            if (i == 8) {
                if (c != '-') {
                    return false;
                }
            } else if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private static String describe(IOException e) {
        String message = e.getMessage();
        if (message == null) {
            return e.getClass().getSimpleName();
        }
        if (e instanceof NoSuchFileException) {
            return MessageFormat.format(L10N.getString("err.no_such_file"), message);
        }
        return message;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String msg = MessageFormat.format(L10N.getString("log.temp_delete_failed"), path);
                LOGGER.log(Level.FINE, msg, e);
            }
        }
    }

    /**
     * Cursor over the bytes of a snapshot file.
     */
    private static class SnapshotReader {

        private static final int MAX_DIGITS = 10;

        private final Path path;
        private final byte[] data;
        private int pos;

        SnapshotReader(Path path, byte[] data) {
            this.path = path;
            this.data = data;
        }

        int readNumber() throws SnapshotException {
            int start = pos;
            long n = 0L;
            while (pos < data.length && data[pos] != '\n') {
                byte b = data[pos];
                if (b < '0' || b > '9' || pos - start >= MAX_DIGITS) {
                    throw corrupt("err.snapshot_bad_number", start);
                }
                n = n * 10L + (b - '0');
                pos++;
            }
            if (pos == start || pos >= data.length || n > Integer.MAX_VALUE) {
                throw corrupt("err.snapshot_bad_number", start);
            }
            pos++; // LF
            return (int) n;
        }

        ByteString readField() throws SnapshotException {
            int length = readNumber();
            if (length > data.length - pos - 1) {
                throw corrupt("err.snapshot_truncated", pos);
            }
            byte[] field = new byte[length];
            System.arraycopy(data, pos, field, 0, length);
            pos += length;
            if (data[pos] != '\n') {
                throw corrupt("err.snapshot_missing_newline", pos);
            }
            pos++;
            return ByteString.wrap(field);
        }

        void end() throws SnapshotException {
            if (pos != data.length) {
                throw corrupt("err.snapshot_trailing_data", pos);
            }
        }

        private SnapshotException corrupt(String key, int offset) {
            String msg = MessageFormat.format(L10N.getString(key), path, offset);
            return new SnapshotException(msg);
        }

    }

}
