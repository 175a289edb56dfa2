/*
 * SelectorLoop.java
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
import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker selector loop for handling I/O events.
 *
 * <p>Handles OP_READ and OP_WRITE events for accepted TCP connections.
 * Every connection, and everything its protocol handler touches, is
 * driven from this loop's single thread. Work submitted from other
 * threads (new connections and fired timers) is queued and picked
 * up on the next pass of the loop.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class SelectorLoop implements Runnable {

    private static final Logger LOGGER = Logger.getLogger(SelectorLoop.class.getName());

    static final int READ_BUFFER_SIZE = 4096;

    private final ScheduledTimer timer;
    private Thread thread;
    private volatile Selector selector;
    private volatile boolean active;

    // Reusable read buffer
    private final ByteBuffer readBuffer;

    // Queue for registrations (cross-thread, from AcceptSelectorLoop)
    private final ConcurrentLinkedQueue<PendingRegistration> pendingRegistrations;

    // Queue for timer callbacks (cross-thread, from ScheduledTimer)
    private final ConcurrentLinkedQueue<ScheduledTimer.TimerEntry> pendingTimers;

    /**
     * Creates a new SelectorLoop.
     *
     * @param timer the timer used by {@link #scheduleTimer}
     */
    SelectorLoop(ScheduledTimer timer) {
        this.timer = timer;
        this.readBuffer = ByteBuffer.allocate(READ_BUFFER_SIZE);
        this.pendingRegistrations = new ConcurrentLinkedQueue<PendingRegistration>();
        this.pendingTimers = new ConcurrentLinkedQueue<ScheduledTimer.TimerEntry>();
    }

    /**
     * Starts this SelectorLoop.
     * The selector is opened before this method returns, so
     * registrations made afterwards are never missed.
     *
     * @throws IOException if the selector cannot be opened
     */
    public void start() throws IOException {
        if (thread != null && thread.isAlive()) {
            return; // Already running
        }
        selector = Selector.open();
        active = true;
        thread = new Thread(this, "SelectorLoop");
        thread.start();
    }

    @Override
    public void run() {
        try {
            while (active) {
                try {
                    processPendingRegistrations();
                    processPendingTimers();

                    selector.select(100);

                    Set<SelectionKey> keys = selector.selectedKeys();
                    for (Iterator<SelectionKey> i = keys.iterator(); i.hasNext(); ) {
                        SelectionKey key = i.next();
                        i.remove();

                        if (!key.isValid()) {
                            continue;
                        }

                        TCPEndpoint endpoint = (TCPEndpoint) key.attachment();

                        if (key.isReadable()) {
                            doRead(key, endpoint);
                        }

                        if (key.isValid() && key.isWritable()) {
                            doWrite(key, endpoint);
                        }
                    }
                } catch (CancelledKeyException e) {
                    // Key was cancelled, continue
                } catch (IOException e) {
                    LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.selector_loop"), e);
                }
            }
        } finally {
            closeAll();
        }
    }

    /**
     * Closes every registered connection and the selector.
     */
    private void closeAll() {
        List<TCPEndpoint> endpoints = new ArrayList<TCPEndpoint>();
        for (SelectionKey key : selector.keys()) {
            Object attachment = key.attachment();
            if (attachment instanceof TCPEndpoint) {
                endpoints.add((TCPEndpoint) attachment);
            }
        }
        for (TCPEndpoint endpoint : endpoints) {
            endpoint.doClose();
        }
        PendingRegistration reg;
        while ((reg = pendingRegistrations.poll()) != null) {
            reg.endpoint.doClose();
        }
        try {
            selector.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.close_selector"), e);
        }
    }

    private void processPendingRegistrations() {
        PendingRegistration reg;
        while ((reg = pendingRegistrations.poll()) != null) {
            try {
                SelectionKey key = reg.channel.register(selector, SelectionKey.OP_READ);
                key.attach(reg.endpoint);
                reg.endpoint.setSelectionKey(key);
                reg.endpoint.setSelectorLoop(this);
                reg.endpoint.connected();
            } catch (ClosedChannelException e) {
                // Channel was closed before we could register
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(CacheDB.L10N.getString("info.closed_before_registration"));
                }
            }
        }
    }

    private void processPendingTimers() {
        ScheduledTimer.TimerEntry entry;
        while ((entry = pendingTimers.poll()) != null) {
            if (!entry.cancelled) {
                try {
                    entry.callback.run();
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.timer_callback"), e);
                }
            }
        }
    }

    /**
     * Called by ScheduledTimer when a timer fires.
     * Adds the timer entry to the pending queue and wakes up the selector.
     */
    void dispatchTimer(ScheduledTimer.TimerEntry entry) {
        pendingTimers.offer(entry);
        wakeup();
    }

    /**
     * Schedules a callback to run on this loop's thread after a delay.
     *
     * @param delayMs delay in milliseconds
     * @param callback the callback to execute
     * @return a handle that can be used to cancel the timer
     */
    TimerHandle scheduleTimer(long delayMs, Runnable callback) {
        return timer.schedule(this, delayMs, callback);
    }

    // -- I/O --

    private void doRead(SelectionKey key, TCPEndpoint endpoint) {
        SocketChannel sc = (SocketChannel) key.channel();
        readBuffer.clear();
        try {
            int len = sc.read(readBuffer);
            if (len == -1) {
                endpoint.handleEOF();
            } else if (len > 0) {
                readBuffer.flip();

                if (LOGGER.isLoggable(Level.FINEST)) {
                    Object sa = sc.socket().getRemoteSocketAddress();
                    String message = CacheDB.L10N.getString("info.received");
                    message = MessageFormat.format(message, len, sa);
                    LOGGER.finest(message);
                }

                try {
                    endpoint.appendToNetIn(readBuffer);
                } catch (BufferOverflowException e) {
                    endpoint.handleOverflow();
                    return;
                }
                endpoint.netIn.flip();
                try {
                    endpoint.processInbound();
                } catch (RuntimeException e) {
                    // A failing handler costs its own connection only
                    LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.handler"), e);
                    endpoint.doClose();
                }
            }
        } catch (IOException e) {
            endpoint.handleReadError(e);
        }
    }

    private void doWrite(SelectionKey key, TCPEndpoint endpoint) {
        SocketChannel sc = (SocketChannel) key.channel();
        ByteBuffer netOut = endpoint.getNetOut();
        try {
            netOut.flip();
            if (netOut.hasRemaining()) {
                int len = sc.write(netOut);

                if (LOGGER.isLoggable(Level.FINEST)) {
                    Object sa = sc.socket().getRemoteSocketAddress();
                    String message = CacheDB.L10N.getString("info.sent");
                    message = MessageFormat.format(message, len, sa);
                    LOGGER.finest(message);
                }

                if (netOut.hasRemaining()) {
                    netOut.compact();
                    return;
                }
            }
            netOut.clear();

            if (endpoint.closeRequested) {
                endpoint.doClose();
                return;
            }

            key.interestOps(key.interestOps() & ~SelectionKey.OP_WRITE);
            try {
                endpoint.sendComplete();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.handler"), e);
                endpoint.doClose();
            }
        } catch (IOException e) {
            endpoint.handleWriteError(e);
        }
    }

    // -- Registration methods --

    /**
     * Registers a TCPEndpoint with this SelectorLoop.
     * Thread-safe.
     *
     * @param channel the socket channel
     * @param endpoint the TCPEndpoint
     */
    void register(SocketChannel channel, TCPEndpoint endpoint) {
        pendingRegistrations.add(new PendingRegistration(channel, endpoint));
        wakeup();
    }

    /**
     * Requests OP_WRITE interest for a TCPEndpoint.
     * Must be called on this loop's thread.
     *
     * @param endpoint the endpoint with pending data
     */
    void requestWrite(TCPEndpoint endpoint) {
        SelectionKey key = endpoint.getSelectionKey();
        if (key != null && key.isValid()) {
            key.interestOps(key.interestOps() | SelectionKey.OP_WRITE);
        }
    }

    private void wakeup() {
        Selector s = selector;
        if (s != null) {
            s.wakeup();
        }
    }

    /**
     * Shuts down this SelectorLoop. Open connections are closed.
     */
    public void shutdown() {
        active = false;
        wakeup();
    }

    /**
     * Waits for this SelectorLoop's thread to terminate.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void join() throws InterruptedException {
        if (thread != null) {
            thread.join();
        }
    }

    private static class PendingRegistration {
        final SocketChannel channel;
        final TCPEndpoint endpoint;

        PendingRegistration(SocketChannel channel, TCPEndpoint endpoint) {
            this.channel = channel;
            this.endpoint = endpoint;
        }
    }

}
