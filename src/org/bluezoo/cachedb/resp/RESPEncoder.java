/*
 * RESPEncoder.java
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
import java.util.List;

/**
 * Encodes RESP values and commands to wire format.
 *
 * <p>Replies are encoded with {@link #encode(RESPValue)}. Requests, as
 * sent by a client, are arrays of bulk strings and are built with the
 * {@code encodeCommand} methods.
 *
 * <p>This class is thread-safe. Each encoding operation creates a new
 * buffer, returned flipped and ready for writing to a channel.
 *
 * <h4>Usage Example</h4>
 * <pre>{@code
 * RESPEncoder encoder = new RESPEncoder();
 *
 * // Reply
 * ByteBuffer pong = encoder.encode(RESPValue.PONG);        // +PONG\r\n
 *
 * // Request
 * ByteBuffer set = encoder.encodeCommand("SET", "key", "value");
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RESPEncoder {

    private static final Charset UTF_8 = StandardCharsets.UTF_8;
    private static final byte[] CRLF = new byte[] { '\r', '\n' };

    /**
     * Creates a new RESP encoder.
     */
    public RESPEncoder() {
    }

    /**
     * Encodes a value to wire format.
     *
     * <p>Line breaks inside simple strings and errors are replaced by
     * spaces so that the value always occupies exactly one line.
     *
     * @param value the value to encode
     * @return a ByteBuffer containing the encoded value
     */
    public ByteBuffer encode(RESPValue value) {
        ByteBuffer buffer = ByteBuffer.allocate(encodedSize(value));
        write(buffer, value);
        buffer.flip();
        return buffer;
    }

    /**
     * Encodes a command with string arguments.
     *
     * <p>All arguments are encoded as bulk strings using UTF-8.
     *
     * @param command the command name
     * @param args the command arguments
     * @return a ByteBuffer containing the encoded command
     */
    public ByteBuffer encodeCommand(String command, String... args) {
        byte[][] parts = new byte[1 + args.length][];
        parts[0] = command.getBytes(UTF_8);
        for (int i = 0; i < args.length; i++) {
            parts[i + 1] = args[i].getBytes(UTF_8);
        }
        return encodeArray(parts);
    }

    /**
     * Encodes a command with byte array arguments.
     *
     * <p>Use this method when sending binary data.
     *
     * @param command the command name
     * @param args the command arguments as byte arrays
     * @return a ByteBuffer containing the encoded command
     */
    public ByteBuffer encodeCommand(String command, byte[][] args) {
        byte[][] parts = new byte[1 + args.length][];
        parts[0] = command.getBytes(UTF_8);
        System.arraycopy(args, 0, parts, 1, args.length);
        return encodeArray(parts);
    }

    /**
     * Encodes an array of bulk strings.
     */
    private ByteBuffer encodeArray(byte[][] parts) {
        String countStr = Integer.toString(parts.length);
        int size = 1 + countStr.length() + 2; // *count\r\n
        for (byte[] part : parts) {
            size += bulkSize(part);
        }
        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.put((byte) '*');
        buffer.put(countStr.getBytes(UTF_8));
        buffer.put(CRLF);
        for (byte[] part : parts) {
            writeBulk(buffer, part);
        }
        buffer.flip();
        return buffer;
    }

    private int encodedSize(RESPValue value) {
        if (value.isNull()) {
            return 5; // $-1\r\n
        }
        switch (value.getType()) {
            case SIMPLE_STRING:
            case ERROR:
                return 1 + value.asBytes().length + 2;
            case INTEGER:
                return 1 + Long.toString(value.asLong()).length() + 2;
            case BULK_STRING:
                return bulkSize(value.asBytes());
            case ARRAY:
                List<RESPValue> elements = value.asArray();
                int size = 1 + Integer.toString(elements.size()).length() + 2;
                for (RESPValue element : elements) {
                    size += encodedSize(element);
                }
                return size;
            default:
                throw new IllegalArgumentException(String.valueOf(value.getType()));
        }
    }

    private static int bulkSize(byte[] data) {
        return 1 + Integer.toString(data.length).length() + 2 + data.length + 2;
    }

    private void write(ByteBuffer buffer, RESPValue value) {
        if (value.isNull()) {
            buffer.put((byte) '$');
            buffer.put((byte) '-');
            buffer.put((byte) '1');
            buffer.put(CRLF);
            return;
        }
        RESPType type = value.getType();
        switch (type) {
            case SIMPLE_STRING:
            case ERROR:
                buffer.put(type.getMarker());
                writeLine(buffer, value.asBytes());
                break;
            case INTEGER:
                buffer.put(type.getMarker());
                buffer.put(Long.toString(value.asLong()).getBytes(UTF_8));
                buffer.put(CRLF);
                break;
            case BULK_STRING:
                writeBulk(buffer, value.asBytes());
                break;
            case ARRAY:
                List<RESPValue> elements = value.asArray();
                buffer.put(type.getMarker());
                buffer.put(Integer.toString(elements.size()).getBytes(UTF_8));
                buffer.put(CRLF);
                for (RESPValue element : elements) {
                    write(buffer, element);
                }
                break;
            default:
                throw new IllegalArgumentException(String.valueOf(type));
        }
    }

    private static void writeLine(ByteBuffer buffer, byte[] line) {
        for (int i = 0; i < line.length; i++) {
            byte b = line[i];
            buffer.put((b == '\r' || b == '\n') ? (byte) ' ' : b);
        }
        buffer.put(CRLF);
    }

    private static void writeBulk(ByteBuffer buffer, byte[] data) {
        buffer.put((byte) '$');
        buffer.put(Integer.toString(data.length).getBytes(UTF_8));
        buffer.put(CRLF);
        buffer.put(data);
        buffer.put(CRLF);
    }

}
