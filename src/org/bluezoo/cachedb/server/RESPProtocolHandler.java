/*
 * RESPProtocolHandler.java
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

import java.nio.ByteBuffer;
import java.text.MessageFormat;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.cachedb.Endpoint;
import org.bluezoo.cachedb.ProtocolHandler;
import org.bluezoo.cachedb.TimerHandle;
import org.bluezoo.cachedb.resp.RESPDecoder;
import org.bluezoo.cachedb.resp.RESPEncoder;
import org.bluezoo.cachedb.resp.RESPException;
import org.bluezoo.cachedb.resp.RESPValue;
import org.bluezoo.cachedb.resp.Request;

/**
 * Server-side RESP session for one client connection.
 *
 * <p>Each call to {@link #receive(ByteBuffer)} decodes and executes every
 * complete request in the buffer, in order, queueing one reply per
 * request. A trailing partial request is left in the buffer; the
 * endpoint keeps it and presents it again, extended, when more data
 * arrives.
 *
 * <p>A request that cannot be decoded gets a protocol error reply, after
 * which the connection is closed: the byte stream cannot be resynchronised.
 * A connection that stays silent for longer than the idle timeout is
 * closed.
 *
 * <p>After each executed command the snapshot manager is asked whether
 * an automatic snapshot is due.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class RESPProtocolHandler implements ProtocolHandler {

    private static final Logger LOGGER = Logger.getLogger(RESPProtocolHandler.class.getName());
    private static final ResourceBundle L10N = CommandDispatcher.L10N;

    static final String INTERNAL_ERROR = "ERR internal error";
    static final String PROTOCOL_ERROR = "ERR Protocol error: ";

    /**
     * Session states.
     */
    public enum SessionState {
        /** Waiting for request bytes. */
        READING,
        /** Executing a request. */
        DISPATCHING,
        /** Replies queued and not yet fully written. */
        WRITING,
        /** Connection closed. */
        CLOSED
    }

    private final CommandDispatcher dispatcher;
    private final long idleTimeoutMs;
    private final RESPDecoder decoder;
    private final RESPEncoder encoder;

    private Endpoint endpoint;
    private SessionState state = SessionState.READING;
    private long lastActivityTime;
    private TimerHandle idleTimer;

    /**
     * Creates a session.
     *
     * @param dispatcher the dispatcher that executes commands
     * @param idleTimeoutMs idle timeout in milliseconds, 0 to disable
     */
    public RESPProtocolHandler(CommandDispatcher dispatcher, long idleTimeoutMs) {
        this.dispatcher = dispatcher;
        this.idleTimeoutMs = idleTimeoutMs;
        this.decoder = new RESPDecoder();
        this.encoder = new RESPEncoder();
    }

    public SessionState getState() {
        return state;
    }

    // -- ProtocolHandler --

    @Override
    public void connected(Endpoint endpoint) {
        this.endpoint = endpoint;
        this.lastActivityTime = System.currentTimeMillis();
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = MessageFormat.format(L10N.getString("log.connected"), endpoint.getRemoteAddress());
            LOGGER.fine(message);
        }
        if (idleTimeoutMs > 0) {
            idleTimer = endpoint.scheduleTimer(idleTimeoutMs, new IdleCheck());
        }
    }

    @Override
    public void receive(ByteBuffer data) {
        if (state == SessionState.CLOSED || endpoint.isClosing()) {
            // Nothing more is read from a closing connection
            data.position(data.limit());
            return;
        }
        lastActivityTime = System.currentTimeMillis();
        while (true) {
            if (endpoint.isSendQueueFull()) {
                break; // resumed once the queued replies are written
            }
            List<byte[]> tokens;
            try {
                RESPValue frame = decoder.decode(data);
                if (frame == null) {
                    break; // partial request stays in the buffer
                }
                tokens = Request.tokens(frame);
            } catch (RESPException e) {
                protocolError(e);
                data.position(data.limit());
                return;
            }

            state = SessionState.DISPATCHING;
            Command command = Command.parse(tokens);
            RESPValue reply;
            try {
                reply = dispatcher.dispatch(command);
            } catch (RuntimeException e) {
                String message = MessageFormat.format(L10N.getString("err.dispatch"), command);
                LOGGER.log(Level.WARNING, message, e);
                reply = RESPValue.error(INTERNAL_ERROR);
            }

            state = SessionState.WRITING;
            endpoint.send(encoder.encode(reply));

            if (command.getType() == Command.Type.QUIT && !reply.isError()) {
                endpoint.close();
                data.position(data.limit());
                return;
            }
            dispatcher.getSnapshotManager().checkAutoBackup();
        }
    }

    @Override
    public void sendComplete() {
        if (state == SessionState.WRITING) {
            state = SessionState.READING;
        }
    }

    @Override
    public void disconnected() {
        state = SessionState.CLOSED;
        if (idleTimer != null) {
            idleTimer.cancel();
            idleTimer = null;
        }
        if (LOGGER.isLoggable(Level.FINE) && endpoint != null) {
            String message = MessageFormat.format(L10N.getString("log.disconnected"), endpoint.getRemoteAddress());
            LOGGER.fine(message);
        }
    }

    @Override
    public void error(Exception cause) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, L10N.getString("log.connection_error"), cause);
        }
    }

    // -- Internals --

    private void protocolError(RESPException e) {
        if (LOGGER.isLoggable(Level.FINE)) {
            String message = MessageFormat.format(L10N.getString("log.protocol_error"),
                    endpoint.getRemoteAddress(), e.getMessage());
            LOGGER.fine(message);
        }
        state = SessionState.WRITING;
        endpoint.send(encoder.encode(RESPValue.error(PROTOCOL_ERROR + e.getMessage())));
        endpoint.close();
    }

    /**
     * Closes the connection once it has been idle for the timeout,
     * otherwise checks again when the timeout would next expire.
     */
    private class IdleCheck implements Runnable {

        @Override
        public void run() {
            if (state == SessionState.CLOSED || endpoint.isClosing()) {
                return;
            }
            long idle = System.currentTimeMillis() - lastActivityTime;
            if (idle >= idleTimeoutMs) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    String message = MessageFormat.format(L10N.getString("log.idle_timeout"),
                            endpoint.getRemoteAddress(), idle);
                    LOGGER.fine(message);
                }
                idleTimer = null;
                endpoint.close();
            } else {
                idleTimer = endpoint.scheduleTimer(idleTimeoutMs - idle, this);
            }
        }

    }

}
