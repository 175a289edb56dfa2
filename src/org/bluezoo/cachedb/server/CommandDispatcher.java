/*
 * CommandDispatcher.java
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

import java.text.MessageFormat;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.cachedb.resp.RESPValue;
import org.bluezoo.cachedb.store.SnapshotException;
import org.bluezoo.cachedb.store.SnapshotManager;
import org.bluezoo.cachedb.store.Store;
import org.bluezoo.util.ByteString;

/**
 * Executes commands against the store and produces replies.
 *
 * <p>Dispatch is synchronous. BACKUP writes its snapshot before
 * returning, so the selector loop, and with it every connection, waits
 * for the disk. Argument count errors and unknown commands produce error
 * replies and never modify the store.
 *
 * <p>This class is not thread-safe; it runs on the selector loop that
 * owns the store.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CommandDispatcher {

    private static final Logger LOGGER = Logger.getLogger(CommandDispatcher.class.getName());
    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.cachedb.server.L10N");

    static final RESPValue EMPTY_COMMAND = RESPValue.error("ERR empty command");
    static final RESPValue BACKUP_SAVED = RESPValue.simpleString("OK backup saved");

    private final Store store;
    private final SnapshotManager snapshotManager;

    public CommandDispatcher(Store store, SnapshotManager snapshotManager) {
        this.store = store;
        this.snapshotManager = snapshotManager;
    }

    public Store getStore() {
        return store;
    }

    public SnapshotManager getSnapshotManager() {
        return snapshotManager;
    }

    /**
     * Executes a command.
     *
     * @param command the command
     * @return the reply to send to the client
     */
    public RESPValue dispatch(Command command) {
        if (LOGGER.isLoggable(Level.FINEST)) {
            String message = MessageFormat.format(L10N.getString("log.dispatch"), command);
            LOGGER.finest(message);
        }
        switch (command.getType()) {
            case EMPTY:
                return EMPTY_COMMAND;
            case PING:
                return ping(command);
            case SET:
                return set(command);
            case GET:
                return get(command);
            case BACKUP:
                return backup(command);
            case DBSIZE:
                return dbsize(command);
            case QUIT:
                return quit(command);
            default:
                return unknownCommand(command);
        }
    }

    private RESPValue ping(Command command) {
        switch (command.getArgCount()) {
            case 0:
                return RESPValue.PONG;
            case 1:
                return RESPValue.bulkString(command.getArg(0));
            default:
                return wrongArity(command);
        }
    }

    private RESPValue set(Command command) {
        if (command.getArgCount() != 2) {
            return wrongArity(command);
        }
        store.set(ByteString.copyOf(command.getArg(0)), ByteString.copyOf(command.getArg(1)));
        return RESPValue.OK;
    }

    private RESPValue get(Command command) {
        if (command.getArgCount() != 1) {
            return wrongArity(command);
        }
        ByteString value = store.get(ByteString.wrap(command.getArg(0)));
        if (value == null) {
            return RESPValue.nullValue();
        }
        return RESPValue.bulkString(value.toByteArray());
    }

    private RESPValue backup(Command command) {
        if (command.getArgCount() != 0) {
            return wrongArity(command);
        }
        try {
            snapshotManager.save();
            return BACKUP_SAVED;
        } catch (SnapshotException e) {
            return RESPValue.error("ERR backup failed: " + e.getMessage());
        }
    }

    private RESPValue dbsize(Command command) {
        if (command.getArgCount() != 0) {
            return wrongArity(command);
        }
        return RESPValue.integer(store.size());
    }

    private RESPValue quit(Command command) {
        if (command.getArgCount() != 0) {
            return wrongArity(command);
        }
        return RESPValue.OK;
    }

    private RESPValue unknownCommand(Command command) {
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = MessageFormat.format(L10N.getString("log.unknown_command"), command.getName());
            LOGGER.fine(message);
        }
        return RESPValue.error("ERR unknown command '" + command.getName() + "'");
    }

    private RESPValue wrongArity(Command command) {
        return RESPValue.error("ERR wrong number of arguments for '"
                + command.getType().commandName() + "' command");
    }

}
