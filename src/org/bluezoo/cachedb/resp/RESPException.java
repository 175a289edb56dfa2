/*
 * RESPException.java
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

/**
 * Exception thrown when an inbound frame cannot be decoded.
 *
 * <p>The message is suitable for returning to the client after the
 * "Protocol error:" prefix. Once this has been thrown the stream can no
 * longer be resynchronised and the connection should be closed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RESPException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates a new RESP exception with the specified message.
     *
     * @param message the error message
     */
    public RESPException(String message) {
        super(message);
    }

    /**
     * Creates a new RESP exception with the specified message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public RESPException(String message, Throwable cause) {
        super(message, cause);
    }

}
