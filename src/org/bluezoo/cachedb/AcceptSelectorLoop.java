/*
 * AcceptSelectorLoop.java
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
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Selector loop dedicated to accepting new connections.
 * Handles OP_ACCEPT events for all ServerSocketChannels and hands off
 * new connections to the worker SelectorLoop.
 *
 * <p>This thread never touches connection or store state: an accepted
 * channel is wrapped in a fresh endpoint and queued for registration on
 * the worker loop, which does everything else.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class AcceptSelectorLoop extends Thread {

    private static final Logger LOGGER = Logger.getLogger(AcceptSelectorLoop.class.getName());

    private final SelectorLoop workerLoop;
    private volatile Selector selector;
    private volatile boolean active;
    private final ConcurrentLinkedQueue<PendingRegistration> pendingRegistrations;

    AcceptSelectorLoop(SelectorLoop workerLoop) {
        super("AcceptSelectorLoop");
        this.workerLoop = workerLoop;
        this.pendingRegistrations = new ConcurrentLinkedQueue<>();
    }

    @Override
    public synchronized void start() {
        try {
            selector = Selector.open();
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, CacheDB.L10N.getString("err.accept_loop_init"), e);
            return;
        }
        active = true;
        super.start();
    }

    @Override
    public void run() {
        try {
            while (active) {
                try {
                    processPendingRegistrations();

                    selector.select();

                    Set<SelectionKey> keys = selector.selectedKeys();
                    for (Iterator<SelectionKey> i = keys.iterator(); i.hasNext(); ) {
                        SelectionKey key = i.next();
                        i.remove();

                        if (!key.isValid()) {
                            continue;
                        }

                        if (key.isAcceptable()) {
                            accept(key);
                        }
                    }
                } catch (CancelledKeyException e) {
                    // Key was cancelled, continue
                } catch (IOException e) {
                    LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.accept_loop"), e);
                }
            }
        } finally {
            try {
                selector.close();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.close_selector"), e);
            }
        }
    }

    /**
     * Pre-bound server channel waiting to be registered with the selector.
     */
    private static class PendingRegistration {
        final Listener listener;
        final ServerSocketChannel channel;

        PendingRegistration(Listener listener, ServerSocketChannel channel) {
            this.listener = listener;
            this.channel = channel;
        }
    }

    /**
     * Binds server channels for a listener and queues them for
     * registration with this loop's selector.
     *
     * <p>Binding happens on the calling thread, so that a port already in
     * use is reported to the caller rather than only logged. One channel
     * is bound per configured address, or a single wildcard channel if
     * none is configured.
     *
     * @param listener the listener to bind
     * @throws IOException if any channel cannot be bound; channels
     *         already bound for this listener are closed
     */
    public void bind(Listener listener) throws IOException {
        Collection<InetAddress> addresses = listener.getAddresses();
        int port = listener.getPort();
        List<InetSocketAddress> socketAddresses = new ArrayList<InetSocketAddress>();
        if (addresses.isEmpty()) {
            socketAddresses.add(new InetSocketAddress(port));
        } else {
            for (InetAddress address : addresses) {
                socketAddresses.add(new InetSocketAddress(address, port));
            }
        }

        List<ServerSocketChannel> bound = new ArrayList<ServerSocketChannel>();
        try {
            for (InetSocketAddress socketAddress : socketAddresses) {
                ServerSocketChannel ssc = ServerSocketChannel.open();
                bound.add(ssc);
                ssc.configureBlocking(false);
                ServerSocket ss = ssc.socket();
                ss.setReuseAddress(true);

                long t1 = System.currentTimeMillis();
                ss.bind(socketAddress);
                long t2 = System.currentTimeMillis();

                if (LOGGER.isLoggable(Level.INFO)) {
                    String message = CacheDB.L10N.getString("info.bound_listener");
                    message = MessageFormat.format(message, listener.getDescription(),
                            Integer.toString(port), socketAddress.getAddress().getHostAddress(), (t2 - t1));
                    LOGGER.info(message);
                }
            }
        } catch (IOException e) {
            for (ServerSocketChannel ssc : bound) {
                try {
                    ssc.close();
                } catch (IOException closeEx) {
                    e.addSuppressed(closeEx);
                }
            }
            throw e;
        }

        for (ServerSocketChannel ssc : bound) {
            listener.addServerChannel(ssc);
            pendingRegistrations.add(new PendingRegistration(listener, ssc));
        }
        Selector s = selector;
        if (s != null) {
            s.wakeup();
        }
    }

    /**
     * Processes pending registrations on the selector thread.
     */
    private void processPendingRegistrations() {
        PendingRegistration pending;
        while ((pending = pendingRegistrations.poll()) != null) {
            try {
                SelectionKey key = pending.channel.register(selector, SelectionKey.OP_ACCEPT);
                key.attach(pending.listener);
            } catch (IOException e) {
                String message = MessageFormat.format(CacheDB.L10N.getString("err.register_listener"),
                        pending.listener.getDescription());
                LOGGER.log(Level.SEVERE, message, e);
            }
        }
    }

    private void accept(SelectionKey key) {
        ServerSocketChannel ssc = (ServerSocketChannel) key.channel();
        Listener listener = (Listener) key.attachment();

        // Process all pending connections to avoid selector thrashing
        SocketChannel sc;
        try {
            while ((sc = ssc.accept()) != null) {
                try {
                    sc.configureBlocking(false);

                    // Create endpoint (key will be assigned by worker loop)
                    TCPEndpoint endpoint = listener.newEndpoint(sc);

                    // Hand off to worker loop for registration
                    workerLoop.register(sc, endpoint);

                    if (LOGGER.isLoggable(Level.FINEST)) {
                        String message = CacheDB.L10N.getString("info.accepted");
                        message = MessageFormat.format(message, sc.getRemoteAddress());
                        LOGGER.finest(message);
                    }
                } catch (IOException e) {
                    try {
                        sc.close();
                    } catch (IOException closeEx) {
                        e.addSuppressed(closeEx);
                    }
                    LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.accepted_connection"), e);
                }
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.accept"), e);
        }
    }

    void shutdown() {
        active = false;
        Selector s = selector;
        if (s != null) {
            s.wakeup();
        }
    }

}
