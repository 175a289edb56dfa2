/*
 * RESPDecoder.java
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

package org.bluezoo.cachedb.resp;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;

/**
 * Decodes RESP wire format to values.
 *
 * <p>This is a push parser: it works directly on the caller's buffer,
 * which must be in read mode. Each call to {@link #decode} consumes at
 * most one complete value. If the buffer holds only part of a value,
 * null is returned and the buffer position is left where it was, so the
 * caller can compact the buffer, read more data and try again.
 *
 * <h4>Usage Pattern</h4>
 * <pre>{@code
 * RESPDecoder decoder = new RESPDecoder();
 *
 * // In receive callback, with netIn flipped for reading:
 * RESPValue value;
 * while ((value = decoder.decode(netIn)) != null) {
 *     List<byte[]> tokens = Request.tokens(value);
 *     ...
 * }
 * // leftover bytes remain in netIn
 * }</pre>
 *
 * <p>The decoder never trusts a declared length beyond the bytes actually
 * present, and rejects lengths and counts outside its configured bounds.
 * A decoder holds no per-stream state, so one instance may be shared by
 * every connection on a selector loop.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RESPDecoder {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.cachedb.resp.L10N");

    private static final Charset UTF_8 = StandardCharsets.UTF_8;

    /** Default maximum bulk string payload, 512 MiB. */
    public static final int DEFAULT_MAX_BULK_LENGTH = 512 * 1024 * 1024;

    /** Default maximum number of array elements. */
    public static final int DEFAULT_MAX_ARRAY_COUNT = 1024 * 1024;

    /** Maximum length of a header or simple line, excluding CRLF. */
    public static final int MAX_INLINE_LENGTH = 65536;

    private static final int MAX_DEPTH = 32;
    private static final int MAX_INITIAL_CAPACITY = 64;

    private final int maxBulkLength;
    private final int maxArrayCount;

    /**
     * Creates a new RESP decoder with the default bounds.
     */
    public RESPDecoder() {
        this(DEFAULT_MAX_BULK_LENGTH, DEFAULT_MAX_ARRAY_COUNT);
    }

    /**
     * Creates a new RESP decoder with the specified bounds.
     *
     * @param maxBulkLength the largest bulk string length accepted
     * @param maxArrayCount the largest array element count accepted
     */
    public RESPDecoder(int maxBulkLength, int maxArrayCount) {
        if (maxBulkLength < 0 || maxArrayCount < 0) {
            throw new IllegalArgumentException("bounds must be non-negative");
        }
        this.maxBulkLength = maxBulkLength;
        this.maxArrayCount = maxArrayCount;
    }

    /**
     * Attempts to decode the next complete RESP value from the buffer.
     *
     * <p>If a complete value is available it is returned and the buffer
     * position is advanced past it. If the data is incomplete, returns
     * null and the buffer position is unchanged.
     *
     * @param buffer the inbound data, in read mode
     * @return the next decoded value, or null if incomplete
     * @throws RESPException if the data is malformed
     */
    public RESPValue decode(ByteBuffer buffer) throws RESPException {
        if (!buffer.hasRemaining()) {
            return null;
        }
        int start = buffer.position();
        RESPValue result = tryParse(buffer, 0);
        if (result == null) {
            buffer.position(start);
        }
        return result;
    }

    /**
     * Attempts to parse a RESP value from the current buffer position.
     * Returns null if incomplete.
     */
    private RESPValue tryParse(ByteBuffer buffer, int depth) throws RESPException {
        if (!buffer.hasRemaining()) {
            return null;
        }
        RESPType type = RESPType.fromMarker(buffer.get());
        switch (type) {
            case SIMPLE_STRING:
                return parseSimpleString(buffer);
            case ERROR:
                return parseError(buffer);
            case INTEGER:
                return parseInteger(buffer);
            case BULK_STRING:
                return parseBulkString(buffer);
            case ARRAY:
                return parseArray(buffer, depth);
            default:
                String msg = MessageFormat.format(L10N.getString("err.unknown_type"), type);
                throw new RESPException(msg);
        }
    }

    private RESPValue parseSimpleString(ByteBuffer buffer) throws RESPException {
        String line = readLine(buffer);
        if (line == null) {
            return null;
        }
        return RESPValue.simpleString(line);
    }

    private RESPValue parseError(ByteBuffer buffer) throws RESPException {
        String line = readLine(buffer);
        if (line == null) {
            return null;
        }
        return RESPValue.error(line);
    }

    private RESPValue parseInteger(ByteBuffer buffer) throws RESPException {
        String line = readLine(buffer);
        if (line == null) {
            return null;
        }
        try {
            return RESPValue.integer(parseNumber(line));
        } catch (NumberFormatException e) {
            String msg = MessageFormat.format(L10N.getString("err.invalid_integer"), line);
            throw new RESPException(msg, e);
        }
    }

    /**
     * Parses a bulk string ($length\r\ndata\r\n).
     */
    private RESPValue parseBulkString(ByteBuffer buffer) throws RESPException {
        String lengthLine = readLine(buffer);
        if (lengthLine == null) {
            return null;
        }
        long length;
        try {
            length = parseNumber(lengthLine);
        } catch (NumberFormatException e) {
            String msg = MessageFormat.format(L10N.getString("err.invalid_bulk_string_length"), lengthLine);
            throw new RESPException(msg, e);
        }
        if (length == -1L) {
            return RESPValue.nullValue();
        }
        if (length < -1L || length > maxBulkLength) {
            String msg = MessageFormat.format(L10N.getString("err.bulk_string_length_out_of_range"),
                    lengthLine);
            throw new RESPException(msg);
        }
        int len = (int) length;
        // Payload plus trailing CRLF must be present before anything is copied
        if (buffer.remaining() < len + 2) {
            return null;
        }
        byte[] data = new byte[len];
        buffer.get(data);
        byte cr = buffer.get();
        byte lf = buffer.get();
        if (cr != '\r' || lf != '\n') {
            throw new RESPException(L10N.getString("err.no_crlf_after_bulk_string"));
        }
        return RESPValue.bulkString(data);
    }

    /**
     * Parses an array (*count\r\n...).
     */
    private RESPValue parseArray(ByteBuffer buffer, int depth) throws RESPException {
        if (depth >= MAX_DEPTH) {
            throw new RESPException(L10N.getString("err.nesting_too_deep"));
        }
        String countLine = readLine(buffer);
        if (countLine == null) {
            return null;
        }
        long count;
        try {
            count = parseNumber(countLine);
        } catch (NumberFormatException e) {
            String msg = MessageFormat.format(L10N.getString("err.invalid_array_count"), countLine);
            throw new RESPException(msg, e);
        }
        if (count == -1L) {
            return RESPValue.nullValue();
        }
        if (count < -1L || count > maxArrayCount) {
            String msg = MessageFormat.format(L10N.getString("err.array_count_out_of_range"), countLine);
            throw new RESPException(msg);
        }
        int n = (int) count;
        List<RESPValue> elements = new ArrayList<RESPValue>(Math.min(n, MAX_INITIAL_CAPACITY));
        for (int i = 0; i < n; i++) {
            RESPValue element = tryParse(buffer, depth + 1);
            if (element == null) {
                return null; // Incomplete
            }
            elements.add(element);
        }
        return RESPValue.array(elements);
    }

    /**
     * Reads a line terminated by CRLF.
     * Returns null if incomplete.
     */
    private String readLine(ByteBuffer buffer) throws RESPException {
        int start = buffer.position();
        int limit = buffer.limit();
        for (int i = start; i < limit - 1; i++) {
            if (buffer.get(i) == '\r' && buffer.get(i + 1) == '\n') {
                int length = i - start;
                if (length > MAX_INLINE_LENGTH) {
                    String msg = MessageFormat.format(L10N.getString("err.line_too_long"), length);
                    throw new RESPException(msg);
                }
                byte[] lineBytes = new byte[length];
                buffer.get(lineBytes);
                buffer.get(); // CR
                buffer.get(); // LF
                return new String(lineBytes, UTF_8);
            }
        }
        // No terminator yet; refuse to wait forever for an oversized line
        int pending = limit - start;
        if (pending > MAX_INLINE_LENGTH + 1) {
            String msg = MessageFormat.format(L10N.getString("err.line_too_long"), pending);
            throw new RESPException(msg);
        }
        return null;
    }

    /**
     * Strict decimal parse: optional leading minus, then digits only.
     */
    private static long parseNumber(String s) {
        int len = s.length();
        if (len == 0 || len > 20) {
            throw new NumberFormatException(s);
        }
        int i = (s.charAt(0) == '-') ? 1 : 0;
        if (i == len) {
            throw new NumberFormatException(s);
        }
        for (int j = i; j < len; j++) {
            char c = s.charAt(j);
            if (c < '0' || c > '9') {
                throw new NumberFormatException(s);
            }
        }
        return Long.parseLong(s);
    }

    /**
     * Renders a byte for inclusion in an error message.
     */
    static String printable(byte b) {
        int c = b & 0xff;
        if (c >= 0x20 && c < 0x7f) {
            return "'" + (char) c + "'";
        }
        return String.format("0x%02x", c);
    }

}
