/*
 * TCPEndpoint.java
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

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.text.MessageFormat;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TCP implementation of {@link Endpoint}.
 *
 * <p>This class holds the socket channel and the inbound and outbound
 * byte buffers for one connection, and delegates all application
 * events to the {@link ProtocolHandler} provided at construction time.
 * Protocol handlers never subclass this class.
 *
 * <p>Inbound data accumulates in {@code netIn} until the handler
 * consumes it, so a request split across several reads is presented to
 * the handler whole once its last byte arrives. The inbound buffer grows
 * on demand up to a configured maximum; a client that exceeds it is
 * disconnected.
 *
 * <p>Outbound data is queued in {@code netOut}. Once the queue reaches
 * its configured maximum, reading from the channel is suspended and the
 * handler is expected to stop consuming input; both resume when the
 * queue has been written out completely.
 *
 * <p>All I/O occurs on the assigned SelectorLoop thread.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see Endpoint
 * @see ProtocolHandler
 */
public class TCPEndpoint implements Endpoint {

    private static final Logger LOGGER = Logger.getLogger(TCPEndpoint.class.getName());

    private static final int DEFAULT_BUFFER_SIZE = 8192;

    // -- Transport state --

    private final ProtocolHandler handler;
    private final int maxNetInSize;
    private final int maxNetOutSize;
    SocketChannel channel;
    private SelectionKey key;
    private SelectorLoop selectorLoop;

    // -- Network I/O buffers --

    ByteBuffer netIn;
    ByteBuffer netOut;
    boolean closeRequested;
    boolean readPaused;

    // -- Lifecycle --

    private boolean closing;
    private boolean closed;

    /**
     * Creates a TCPEndpoint.
     *
     * @param handler the protocol handler
     * @param maxNetInSize the largest inbound buffer allowed, or 0 for
     *        no limit
     * @param maxNetOutSize the amount of queued output at which reading
     *        is suspended, or 0 for no limit
     */
    public TCPEndpoint(ProtocolHandler handler, int maxNetInSize, int maxNetOutSize) {
        if (handler == null) {
            throw new NullPointerException("handler");
        }
        this.handler = handler;
        this.maxNetInSize = maxNetInSize;
        this.maxNetOutSize = maxNetOutSize;
    }

    // -- Initialization (called by Listener) --

    void setChannel(SocketChannel channel) {
        this.channel = channel;
    }

    /**
     * Initialises the endpoint after the channel has been set.
     */
    void init() throws IOException {
        int bufferSize = DEFAULT_BUFFER_SIZE;
        if (channel != null) {
            Socket socket = channel.socket();
            socket.setTcpNoDelay(true);
        }
        if (maxNetInSize > 0) {
            bufferSize = Math.min(bufferSize, maxNetInSize);
        }
        netIn = ByteBuffer.allocate(bufferSize);
        netOut = ByteBuffer.allocate(DEFAULT_BUFFER_SIZE);
    }

    // -- Endpoint implementation --

    @Override
    public void send(ByteBuffer data) {
        if (closed || (channel != null && !channel.isOpen())) {
            if (LOGGER.isLoggable(Level.FINE)) {
                String message = CacheDB.L10N.getString("err.channel_closed");
                message = MessageFormat.format(message, getRemoteAddress());
                LOGGER.fine(message);
            }
            return;
        }
        appendToNetOut(data);
    }

    @Override
    public boolean isOpen() {
        return !closed && !closing && (channel == null || channel.isOpen());
    }

    @Override
    public boolean isClosing() {
        return closing;
    }

    @Override
    public boolean isSendQueueFull() {
        return maxNetOutSize > 0 && netOut.position() >= maxNetOutSize;
    }

    @Override
    public void close() {
        if (closing || closed) {
            return;
        }
        closing = true;
        closeRequested = true;
        if (key != null && key.isValid()) {
            key.interestOps(key.interestOps() & ~SelectionKey.OP_READ);
        }
        if (selectorLoop != null) {
            selectorLoop.requestWrite(this);
        }
    }

    @Override
    public SocketAddress getLocalAddress() {
        if (channel == null) {
            return new InetSocketAddress("localhost", 0);
        }
        return channel.socket().getLocalSocketAddress();
    }

    @Override
    public SocketAddress getRemoteAddress() {
        if (channel == null) {
            return new InetSocketAddress("unknown", 0);
        }
        return channel.socket().getRemoteSocketAddress();
    }

    @Override
    public SelectorLoop getSelectorLoop() {
        return selectorLoop;
    }

    @Override
    public TimerHandle scheduleTimer(long delayMs, Runnable callback) {
        if (selectorLoop == null) {
            throw new IllegalStateException("Endpoint is not registered");
        }
        return selectorLoop.scheduleTimer(delayMs, callback);
    }

    // -- Package-private methods called by SelectorLoop --

    SelectionKey getSelectionKey() {
        return key;
    }

    void setSelectionKey(SelectionKey key) {
        this.key = key;
    }

    void setSelectorLoop(SelectorLoop loop) {
        this.selectorLoop = loop;
        if (loop != null && netOut != null && netOut.position() > 0) {
            loop.requestWrite(this);
        }
    }

    ByteBuffer getNetOut() {
        return netOut;
    }

    /**
     * Called by SelectorLoop after copying data into netIn and flipping it.
     */
    final void processInbound() {
        if (LOGGER.isLoggable(Level.FINEST)) {
            String message = CacheDB.L10N.getString("info.received_buffered");
            message = MessageFormat.format(message, netIn.remaining(), getRemoteAddress());
            LOGGER.finest(message);
        }
        try {
            handler.receive(netIn);
        } finally {
            netIn.compact();
        }
    }

    /**
     * Appends data to the netIn buffer, growing if necessary.
     *
     * @throws BufferOverflowException if the buffer would exceed its
     *         maximum size
     */
    final void appendToNetIn(ByteBuffer data) {
        int needed = data.remaining();
        int available = netIn.remaining();
        if (needed > available) {
            int required = netIn.position() + needed;
            if (maxNetInSize > 0 && required > maxNetInSize) {
                throw new BufferOverflowException();
            }
            int newSize = required + DEFAULT_BUFFER_SIZE;
            if (maxNetInSize > 0 && newSize > maxNetInSize) {
                newSize = maxNetInSize;
            }
            ByteBuffer newBuf = ByteBuffer.allocate(newSize);
            netIn.flip();
            newBuf.put(netIn);
            netIn = newBuf;
        }
        netIn.put(data);
    }

    final void appendToNetOut(ByteBuffer data) {
        int needed = data.remaining();
        int available = netOut.remaining();
        if (needed > available) {
            int newSize = netOut.position() + needed + DEFAULT_BUFFER_SIZE;
            ByteBuffer newBuf = ByteBuffer.allocate(newSize);
            netOut.flip();
            newBuf.put(netOut);
            netOut = newBuf;
        }
        netOut.put(data);
        if (!readPaused && isSendQueueFull()) {
            pauseRead();
        }
        if (selectorLoop != null) {
            selectorLoop.requestWrite(this);
        }
    }

    private void pauseRead() {
        readPaused = true;
        if (key != null && key.isValid()) {
            key.interestOps(key.interestOps() & ~SelectionKey.OP_READ);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = CacheDB.L10N.getString("info.read_paused");
            message = MessageFormat.format(message, getRemoteAddress(), netOut.position());
            LOGGER.fine(message);
        }
    }

    private void resumeRead() {
        readPaused = false;
        if (closing) {
            return;
        }
        if (key != null && key.isValid()) {
            key.interestOps(key.interestOps() | SelectionKey.OP_READ);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = CacheDB.L10N.getString("info.read_resumed");
            message = MessageFormat.format(message, getRemoteAddress());
            LOGGER.fine(message);
        }
        if (netIn.position() > 0) {
            // Requests left unconsumed while the queue was full
            netIn.flip();
            processInbound();
        }
    }

    /**
     * Called by SelectorLoop once the endpoint is registered.
     */
    void connected() {
        handler.connected(this);
    }

    /**
     * Called by SelectorLoop when netOut has been completely written.
     */
    void sendComplete() {
        if (readPaused) {
            resumeRead();
        }
        handler.sendComplete();
    }

    void handleEOF() {
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = CacheDB.L10N.getString("info.peer_closed");
            message = MessageFormat.format(message, getRemoteAddress());
            LOGGER.fine(message);
        }
        doClose();
    }

    void handleReadError(IOException e) {
        handleIOError(e, "err.read");
    }

    void handleWriteError(IOException e) {
        handleIOError(e, "err.write");
    }

    void handleOverflow() {
        if (LOGGER.isLoggable(Level.WARNING)) {
            String message = CacheDB.L10N.getString("err.net_in_overflow");
            message = MessageFormat.format(message, getRemoteAddress(), maxNetInSize);
            LOGGER.warning(message);
        }
        doClose();
    }

    private void handleIOError(IOException e, String messageKey) {
        try {
            String msg = e.getMessage();
            if (msg != null && (msg.contains("reset") || msg.contains("Broken pipe"))) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String message = CacheDB.L10N.getString("info.connection_lost");
                    message = MessageFormat.format(message, getRemoteAddress());
                    LOGGER.fine(message);
                }
            } else if (LOGGER.isLoggable(Level.WARNING)) {
                String message = CacheDB.L10N.getString(messageKey);
                message = MessageFormat.format(message, getRemoteAddress());
                LOGGER.log(Level.WARNING, message, e);
            }
            handler.error(e);
        } finally {
            doClose();
        }
    }

    /**
     * Closes the channel and notifies the handler. Only the first call
     * has any effect.
     */
    void doClose() {
        if (closed) {
            return;
        }
        closed = true;
        closing = true;
        if (key != null) {
            key.cancel();
        }
        try {
            if (channel != null) {
                channel.close();
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, e.getMessage(), e);
        }
        try {
            handler.disconnected();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.disconnected_handler"), e);
        }
    }

}
