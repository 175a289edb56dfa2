/*
 * ByteArrays.java
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

/**
 * Utility methods for byte array operations.
 *
 * <h4>Thread Safety</h4>
 * <p>All methods in this class are stateless and thread-safe.</p>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class ByteArrays {

    // Prevent instantiation
    private ByteArrays() {
    }

    /**
     * Compares two byte arrays for equality.
     *
     * <p>This method returns {@code false} as soon as a mismatch is found.</p>
     *
     * @param b1 the first byte array
     * @param b2 the second byte array
     * @return {@code true} if both arrays are non-null, have the same length,
     *         and contain identical bytes; {@code false} otherwise
     */
    public static boolean equals(byte[] b1, byte[] b2) {
        if (b1 == null || b2 == null || b1.length != b2.length) {
            return false;
        }
        for (int i = 0; i < b1.length; i++) {
            if (b1[i] != b2[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Computes a content hash of a byte array, consistent with
     * {@link #equals(byte[], byte[])}.
     *
     * @param b the byte array
     * @return the hash code, 0 for null
     */
    public static int hashCode(byte[] b) {
        if (b == null) {
            return 0;
        }
        int h = 1;
        for (int i = 0; i < b.length; i++) {
            h = 31 * h + b[i];
        }
        return h;
    }

}
