/*
 * RESPListener.java
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

package org.bluezoo.cachedb.server;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.cachedb.Listener;
import org.bluezoo.cachedb.ProtocolHandler;
import org.bluezoo.cachedb.store.SnapshotException;
import org.bluezoo.cachedb.store.SnapshotManager;
import org.bluezoo.cachedb.store.Store;

/**
 * Listener for RESP clients.
 *
 * <p>The listener owns the store, its snapshot manager and the command
 * dispatcher. Every connection it accepts gets its own
 * {@link RESPProtocolHandler}, and all of them share that one store.
 *
 * <h4>Configuration</h4>
 * <pre>{@code
 * <listener port="6379" addresses="127.0.0.1" idle-timeout="5m"/>
 * <snapshot directory="/var/lib/cachedb" interval="5m" load-on-start="true"/>
 * }</pre>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RESPListener extends Listener {

    private static final Logger LOGGER = Logger.getLogger(RESPListener.class.getName());

    /** The standard RESP port. */
    public static final int DEFAULT_PORT = 6379;

    private final Store store;
    private final SnapshotManager snapshotManager;
    private final CommandDispatcher dispatcher;

    public RESPListener() {
        this(new Store());
    }

    /**
     * Creates a listener serving the given store.
     *
     * @param store the store
     */
    public RESPListener(Store store) {
        this.store = store;
        this.snapshotManager = new SnapshotManager(store);
        this.dispatcher = new CommandDispatcher(store, snapshotManager);
    }

    public Store getStore() {
        return store;
    }

    /**
     * Returns the snapshot manager, for configuration.
     *
     * @return the snapshot manager
     */
    public SnapshotManager getSnapshotManager() {
        return snapshotManager;
    }

    @Override
    protected int getDefaultPort() {
        return DEFAULT_PORT;
    }

    @Override
    public String getDescription() {
        return "resp";
    }

    @Override
    protected ProtocolHandler createHandler() {
        return new RESPProtocolHandler(dispatcher, getIdleTimeoutMs());
    }

    /**
     * Restores the latest snapshot if configured to. A snapshot that
     * cannot be read is logged and the server starts with an empty store.
     */
    @Override
    public void start() {
        super.start();
        if (snapshotManager.isLoadOnStart()) {
            try {
                snapshotManager.restoreLatest();
            } catch (SnapshotException e) {
                LOGGER.log(Level.WARNING, CommandDispatcher.L10N.getString("err.restore_failed"), e);
            }
        }
    }

}
