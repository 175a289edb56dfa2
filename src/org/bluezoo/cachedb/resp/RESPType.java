/*
 * RESPType.java
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

import java.text.MessageFormat;

/**
 * RESP data types understood by the server.
 *
 * <p>Each type is identified on the wire by a single-byte marker.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum RESPType {

    /**
     * Status line, marker '+'.
     * Short non-binary replies such as "OK" or "PONG".
     */
    SIMPLE_STRING('+'),

    /**
     * Error line, marker '-'.
     * By convention the first word is the error class, e.g. "ERR".
     */
    ERROR('-'),

    /**
     * Integer, marker ':'.
     * A signed 64-bit integer.
     */
    INTEGER(':'),

    /**
     * Bulk string, marker '$'.
     * A binary-safe, length-prefixed byte string.
     * The null bulk string is "$-1\r\n".
     */
    BULK_STRING('$'),

    /**
     * Array, marker '*'.
     * Requests are always arrays of bulk strings.
     */
    ARRAY('*');

    private final byte marker;

    RESPType(char marker) {
        this.marker = (byte) marker;
    }

    /**
     * Returns the wire marker byte for this type.
     *
     * @return the marker byte
     */
    public byte getMarker() {
        return marker;
    }

    /**
     * Returns the RESP type for the given marker byte.
     *
     * @param marker the marker byte
     * @return the corresponding RESP type
     * @throws RESPException if the marker is not recognized
     */
    public static RESPType fromMarker(byte marker) throws RESPException {
        switch (marker) {
            case '+':
                return SIMPLE_STRING;
            case '-':
                return ERROR;
            case ':':
                return INTEGER;
            case '$':
                return BULK_STRING;
            case '*':
                return ARRAY;
            default:
                String msg = MessageFormat.format(RESPDecoder.L10N.getString("err.unknown_type"),
                        RESPDecoder.printable(marker));
                throw new RESPException(msg);
        }
    }

}
