/*
 * ProtocolHandler.java
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

import java.nio.ByteBuffer;

/**
 * Callback interface for protocol handlers.
 *
 * <p>A protocol implementation implements this interface to receive
 * events from an {@link Endpoint}.
 *
 * <p>All methods are called on the Endpoint's SelectorLoop thread. They
 * must not perform blocking network operations.
 *
 * <p>The lifecycle for a server-side handler is:
 * <ol>
 * <li>{@link #connected(Endpoint)} -- endpoint is ready for traffic</li>
 * <li>{@link #receive(ByteBuffer)} -- called for each chunk of data</li>
 * <li>{@link #sendComplete()} -- all queued output has been written</li>
 * <li>{@link #disconnected()} -- the connection is closed</li>
 * </ol>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see Endpoint
 */
public interface ProtocolHandler {

    /**
     * Called when application data is received from the peer.
     *
     * <p>The buffer is in read mode (position at data start, limit at data
     * end). The handler should consume as much data as it can. After this
     * method returns, any unconsumed data (between the buffer's position and
     * limit) will be preserved for the next call.
     *
     * @param data the application data received
     */
    void receive(ByteBuffer data);

    /**
     * Called when the endpoint is established and ready for protocol traffic.
     *
     * <p>The endpoint reference passed here should be stored by the handler
     * for sending data and querying connection state.
     *
     * @param endpoint the endpoint that is now connected
     */
    void connected(Endpoint endpoint);

    /**
     * Called when everything passed to {@link Endpoint#send} has been
     * written to the socket.
     */
    void sendComplete();

    /**
     * Called once when the connection has been closed, by either side.
     *
     * <p>After this method returns, the endpoint is no longer usable.
     * Protocol handlers should perform any cleanup here.
     */
    void disconnected();

    /**
     * Called when an I/O error occurs on the endpoint.
     * The endpoint is closed after this call.
     *
     * @param cause the exception that caused the error
     */
    void error(Exception cause);

}
