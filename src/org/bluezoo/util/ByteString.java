/*
 * ByteString.java
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

package org.bluezoo.util;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * An immutable, binary-safe sequence of bytes.
 *
 * <p>Byte strings are equal by content, so they can be used as map keys
 * where a raw {@code byte[]} cannot.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ByteString {

    /** The empty byte string. */
    public static final ByteString EMPTY = new ByteString(new byte[0]);

    private final byte[] bytes;
    private int hash; // 0 until computed

    private ByteString(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Returns a byte string holding a copy of the given bytes.
     *
     * @param bytes the bytes to copy
     * @return the byte string
     */
    public static ByteString copyOf(byte[] bytes) {
        return new ByteString(bytes.clone());
    }

    /**
     * Returns a byte string backed by the given array.
     * The caller must not modify the array afterwards.
     *
     * @param bytes the bytes
     * @return the byte string
     */
    public static ByteString wrap(byte[] bytes) {
        if (bytes == null) {
            throw new NullPointerException("bytes");
        }
        return new ByteString(bytes);
    }

    /**
     * Returns the UTF-8 encoding of the given text as a byte string.
     *
     * @param text the text
     * @return the byte string
     */
    public static ByteString of(String text) {
        return new ByteString(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Returns the number of bytes.
     *
     * @return the length
     */
    public int length() {
        return bytes.length;
    }

    /**
     * Returns a copy of the bytes.
     *
     * @return a new array
     */
    public byte[] toByteArray() {
        return bytes.clone();
    }

    /**
     * Writes the bytes to the given stream.
     *
     * @param out the output stream
     * @throws IOException if the stream cannot be written
     */
    public void writeTo(OutputStream out) throws IOException {
        out.write(bytes);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ByteString)) {
            return false;
        }
        return ByteArrays.equals(bytes, ((ByteString) other).bytes);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0 && bytes.length > 0) {
            h = ByteArrays.hashCode(bytes);
            hash = h;
        }
        return h;
    }

    /**
     * Returns the bytes decoded as UTF-8, with malformed input replaced.
     */
    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

}
