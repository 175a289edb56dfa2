/*
 * Endpoint.java
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

import java.net.SocketAddress;
import java.nio.ByteBuffer;

/**
 * Connection interface presented to protocol handlers.
 *
 * <p>An Endpoint represents one accepted client connection. Protocol
 * handlers use it to send data, close the connection and schedule
 * timers, without touching the underlying channel.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see ProtocolHandler
 */
public interface Endpoint {

    // -- Data I/O --

    /**
     * Queues data to be sent to the remote peer.
     * The data is copied; the caller may reuse the buffer.
     *
     * @param data the data to send
     */
    void send(ByteBuffer data);

    // -- Lifecycle --

    /**
     * Returns whether this endpoint is open and capable of I/O.
     *
     * @return true if the endpoint is open
     */
    boolean isOpen();

    /**
     * Returns whether this endpoint is in the process of closing.
     *
     * @return true if close has been initiated but not yet completed
     */
    boolean isClosing();

    /**
     * Returns whether output queued by {@link #send} has reached the
     * limit for this endpoint. While it has, no further input is read
     * and the handler should stop consuming buffered requests; it is
     * presented with the remaining input again once the queue drains.
     *
     * @return true if the send queue is full
     */
    boolean isSendQueueFull();

    /**
     * Closes this endpoint gracefully.
     * No further data is read. Data already queued by {@link #send} is
     * written before the connection is closed.
     */
    void close();

    // -- Identity --

    SocketAddress getLocalAddress();

    SocketAddress getRemoteAddress();

    // -- Infrastructure --

    /**
     * Returns the SelectorLoop that this endpoint is registered with.
     * All I/O for this endpoint occurs on this loop's thread.
     *
     * @return the selector loop
     */
    SelectorLoop getSelectorLoop();

    /**
     * Schedules a callback to be executed after the specified delay.
     * The callback runs on this endpoint's SelectorLoop thread,
     * making it safe to perform I/O operations.
     *
     * @param delayMs delay in milliseconds before the callback executes
     * @param callback the callback to execute
     * @return a handle that can be used to cancel the timer
     */
    TimerHandle scheduleTimer(long delayMs, Runnable callback);

}
