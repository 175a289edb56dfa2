/*
 * CacheDB.java
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

import java.io.File;
import java.io.IOException;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.cachedb.server.RESPListener;

/**
 * Lifecycle manager for the cachedb server.
 *
 * <p>Runs one AcceptSelectorLoop thread, which accepts connections for
 * every listener, and exactly one worker SelectorLoop thread, which
 * serves every connection. Because the store is only touched by
 * commands running on that worker thread, it needs no locking.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CacheDB {

    public static final String VERSION = "1.0";

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.cachedb.L10N");
    static final Logger LOGGER = Logger.getLogger(CacheDB.class.getName());

    private final Collection<Listener> listeners;
    private final AcceptSelectorLoop acceptLoop;
    private final SelectorLoop workerLoop;
    private final ScheduledTimer scheduledTimer;

    /**
     * Creates a server for a single listener.
     *
     * @param listener the listener
     */
    public CacheDB(Listener listener) {
        this(Collections.singletonList(listener));
    }

    /**
     * Creates a server for the given listeners.
     *
     * @param listeners the listeners to serve
     */
    public CacheDB(Collection<? extends Listener> listeners) {
        this.listeners = new ArrayList<Listener>(listeners);
        this.scheduledTimer = new ScheduledTimer();
        this.workerLoop = new SelectorLoop(scheduledTimer);
        this.acceptLoop = new AcceptSelectorLoop(workerLoop);
    }

    /**
     * Returns the listeners managed by this server.
     */
    public Collection<Listener> getListeners() {
        return Collections.unmodifiableCollection(listeners);
    }

    /**
     * Starts the server.
     * This starts the timer and the worker loop, starts each listener and
     * binds its port, and then starts accepting connections.
     *
     * @throws IOException if a listener port cannot be bound
     */
    public void start() throws IOException {
        long t1 = System.currentTimeMillis();

        scheduledTimer.start();
        workerLoop.start();

        try {
            for (Listener listener : listeners) {
                listener.start();
                acceptLoop.bind(listener);
            }
        } catch (IOException e) {
            shutdown();
            throw e;
        }

        acceptLoop.start();

        long t2 = System.currentTimeMillis();
        if (LOGGER.isLoggable(Level.INFO)) {
            String message = L10N.getString("info.started");
            message = MessageFormat.format(message, VERSION, (t2 - t1));
            LOGGER.info(message);
        }
    }

    /**
     * Shuts down the server. Listening sockets and open connections are
     * closed; the store is not snapshotted.
     */
    public void shutdown() {
        LOGGER.info(L10N.getString("info.closing_listeners"));

        // Stop accepting new connections
        acceptLoop.shutdown();

        for (Listener listener : listeners) {
            listener.stop();
            listener.closeServerChannels();
        }

        workerLoop.shutdown();
        scheduledTimer.shutdown();
    }

    /**
     * Waits for the server threads to terminate.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void join() throws InterruptedException {
        acceptLoop.join();
        workerLoop.join();
    }

    private class ShutdownHook extends Thread {
        @Override
        public void run() {
            shutdown();
        }
    }

    /**
     * Returns the configuration file to use: the first argument if given,
     * otherwise ~/.cachedbrc, otherwise /etc/cachedbrc.
     *
     * @param args the command-line arguments
     * @return the configuration file, or null if none exists
     */
    static File findConfigurationFile(String[] args) {
        List<File> candidates = new ArrayList<File>();
        if (args.length > 0) {
            candidates.add(new File(args[0]));
        }
        candidates.add(new File(System.getProperty("user.home") + File.separator + ".cachedbrc"));
        candidates.add(new File("/etc/cachedbrc"));
        for (File candidate : candidates) {
            if (candidate.isFile()) {
                return candidate;
            }
        }
        return null;
    }

    // -- Main entry point --

    public static void main(String[] args) {
        File cachedbrc = findConfigurationFile(args);
        if (args.length > 0 && !new File(args[0]).isFile()) {
            String message = MessageFormat.format(L10N.getString("err.config_not_found"), args[0]);
            LOGGER.severe(message);
            System.exit(1);
            return;
        }

        RESPListener listener;
        if (cachedbrc == null) {
            LOGGER.info(L10N.getString("info.default_configuration"));
            listener = new RESPListener();
        } else {
            try {
                long t1 = System.currentTimeMillis();
                listener = new ConfigurationParser().parse(cachedbrc);
                long t2 = System.currentTimeMillis();
                if (LOGGER.isLoggable(Level.FINE)) {
                    String message = L10N.getString("info.read_configuration");
                    message = MessageFormat.format(message, cachedbrc, (t2 - t1));
                    LOGGER.fine(message);
                }
            } catch (Exception e) {
                String message = MessageFormat.format(L10N.getString("err.parse_configuration"), cachedbrc);
                LOGGER.log(Level.SEVERE, message, e);
                System.exit(2);
                return;
            }
        }

        CacheDB cachedb = new CacheDB(listener);
        try {
            cachedb.start();
        } catch (IOException e) {
            String message = MessageFormat.format(L10N.getString("err.start"),
                    Integer.toString(listener.getPort()));
            LOGGER.log(Level.SEVERE, message, e);
            System.exit(3);
            return;
        }
        Runtime.getRuntime().addShutdownHook(cachedb.new ShutdownHook());

        try {
            cachedb.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        LOGGER.info(L10N.getString("info.end_loop"));
    }

}
