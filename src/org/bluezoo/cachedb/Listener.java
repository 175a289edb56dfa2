/*
 * Listener.java
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
import java.net.UnknownHostException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.StringTokenizer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base class for TCP listeners that accept connections on a port.
 *
 * <p>Holds the configuration shared by every listener: port, bind
 * addresses, idle timeout and inbound buffer limit. Setters follow the
 * bean convention so that the {@link ConfigurationParser} can inject
 * attribute values from the configuration file.
 *
 * <p>Subclasses supply the protocol via {@link #createHandler()}; the
 * {@link AcceptSelectorLoop} calls {@link #newEndpoint(SocketChannel)}
 * for each accepted connection.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public abstract class Listener {

    private static final Logger LOGGER = Logger.getLogger(Listener.class.getName());

    /** Default maximum network input buffer size: 1 MB */
    public static final int DEFAULT_MAX_NET_IN_SIZE = 1024 * 1024;

    /** Default output queued before reading is suspended: 1 MB */
    public static final int DEFAULT_MAX_NET_OUT_SIZE = 1024 * 1024;

    /** Default connection idle timeout: 5 minutes */
    public static final long DEFAULT_IDLE_TIMEOUT_MS = 5 * 60 * 1000;

    // ── Listener identity ──

    private String name;

    // ── Configuration ──

    private int port = -1;
    private Set<InetAddress> addresses = null;
    private long idleTimeoutMs = DEFAULT_IDLE_TIMEOUT_MS;
    private int maxNetInSize = DEFAULT_MAX_NET_IN_SIZE;
    private int maxNetOutSize = DEFAULT_MAX_NET_OUT_SIZE;

    // ── Server channel management ──

    private List<ServerSocketChannel> serverChannels = new ArrayList<ServerSocketChannel>();

    protected Listener() {
    }

    // ═══════════════════════════════════════════════════════════════════
    // Configuration
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Returns the name of this listener, used in log messages.
     *
     * @return the name, or null if not set
     */
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * Returns the port for this listener. If none has been configured,
     * the protocol's default port is returned.
     *
     * @return the port number
     */
    public int getPort() {
        return (port > 0) ? port : getDefaultPort();
    }

    public void setPort(int port) {
        if (port < 0 || port > 65535) {
            String message = MessageFormat.format(CacheDB.L10N.getString("err.invalid_port"),
                    Integer.toString(port));
            throw new IllegalArgumentException(message);
        }
        this.port = port;
    }

    /**
     * Sets the addresses to listen on, as a comma or space separated list
     * of host names or IP addresses. Unresolvable entries are logged and
     * skipped.
     *
     * @param value the address list
     */
    public void setAddresses(String value) {
        if (value != null && !value.isEmpty()) {
            addresses = new LinkedHashSet<InetAddress>();
            StringTokenizer st = new StringTokenizer(value, ", ");
            while (st.hasMoreTokens()) {
                String token = st.nextToken().trim();
                if (!token.isEmpty()) {
                    try {
                        addresses.add(InetAddress.getByName(token));
                    } catch (UnknownHostException e) {
                        LOGGER.warning(MessageFormat.format(
                                CacheDB.L10N.getString("err.unknown_host"), token));
                    }
                }
            }
        }
    }

    /**
     * Returns the addresses this listener should bind to.
     * An empty set means the wildcard address, i.e. every local address.
     *
     * @return the set of addresses
     */
    public Set<InetAddress> getAddresses() {
        if (addresses == null) {
            return Collections.emptySet();
        }
        return addresses;
    }

    public long getIdleTimeoutMs() {
        return idleTimeoutMs;
    }

    /**
     * Sets the idle timeout in milliseconds. A connection that sends
     * nothing for this long is closed. Zero disables the timeout.
     *
     * @param idleTimeoutMs the idle timeout
     */
    public void setIdleTimeoutMs(long idleTimeoutMs) {
        this.idleTimeoutMs = idleTimeoutMs;
    }

    public void setIdleTimeout(String timeout) {
        this.idleTimeoutMs = parseDuration(timeout);
    }

    public int getMaxNetInSize() {
        return maxNetInSize;
    }

    /**
     * Sets the largest amount of unprocessed input buffered for one
     * connection. A client exceeding it is disconnected.
     *
     * @param size the limit in bytes, or 0 for no limit
     */
    public void setMaxNetInSize(int size) {
        this.maxNetInSize = size;
    }

    public int getMaxNetOutSize() {
        return maxNetOutSize;
    }

    /**
     * Sets the amount of output queued for one connection at which the
     * server stops reading further requests from it until the queue has
     * been written.
     *
     * @param size the limit in bytes, or 0 for no limit
     */
    public void setMaxNetOutSize(int size) {
        this.maxNetOutSize = size;
    }

    // ═══════════════════════════════════════════════════════════════════
    // Abstract methods for protocol subclasses
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Returns the port used when none has been configured.
     *
     * @return the default port
     */
    protected abstract int getDefaultPort();

    /**
     * Returns a short description of this listener's protocol
     * (e.g. "resp").
     *
     * @return the description
     */
    public abstract String getDescription();

    /**
     * Creates a ProtocolHandler for a newly accepted TCP connection.
     *
     * @return a new protocol handler
     */
    protected abstract ProtocolHandler createHandler();

    // ═══════════════════════════════════════════════════════════════════
    // Lifecycle
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Starts this listener. Called before its channels are bound.
     */
    public void start() {
        // Subclasses can override
    }

    /**
     * Stops this listener.
     */
    public void stop() {
        // Subclasses can override
    }

    // ═══════════════════════════════════════════════════════════════════
    // Accept path
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Creates a TCPEndpoint for a newly accepted socket channel and
     * wires it to a ProtocolHandler from {@link #createHandler()}.
     *
     * @param sc the accepted socket channel
     * @return the TCPEndpoint
     * @throws IOException if an I/O error occurs
     */
    public TCPEndpoint newEndpoint(SocketChannel sc) throws IOException {
        ProtocolHandler handler = createHandler();
        TCPEndpoint endpoint = new TCPEndpoint(handler, maxNetInSize, maxNetOutSize);
        endpoint.setChannel(sc);
        endpoint.init();
        return endpoint;
    }

    void addServerChannel(ServerSocketChannel ssc) {
        serverChannels.add(ssc);
    }

    /**
     * Closes all server channels.
     */
    public void closeServerChannels() {
        for (Iterator<ServerSocketChannel> it = serverChannels.iterator(); it.hasNext(); ) {
            ServerSocketChannel ssc = it.next();
            try {
                ssc.close();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, CacheDB.L10N.getString("err.close_server_channel"), e);
            }
        }
        serverChannels.clear();
    }

    // ═══════════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Parses a duration string with optional time unit suffix.
     * A bare number is taken as milliseconds.
     *
     * @param duration the duration string (e.g., "30s", "5m", "1h",
     *                 "5000ms")
     * @return the duration in milliseconds, or 0 if empty or invalid
     */
    public static long parseDuration(String duration) {
        if (duration == null || duration.isEmpty()) {
            return 0;
        }
        duration = duration.trim().toLowerCase();

        long multiplier = 1;
        String numPart = duration;

        if (duration.endsWith("ms")) {
            numPart = duration.substring(0, duration.length() - 2);
            multiplier = 1;
        } else if (duration.endsWith("s")) {
            numPart = duration.substring(0, duration.length() - 1);
            multiplier = 1000;
        } else if (duration.endsWith("m")) {
            numPart = duration.substring(0, duration.length() - 1);
            multiplier = 60 * 1000;
        } else if (duration.endsWith("h")) {
            numPart = duration.substring(0, duration.length() - 1);
            multiplier = 60 * 60 * 1000;
        }

        try {
            return Long.parseLong(numPart.trim()) * multiplier;
        } catch (NumberFormatException e) {
            LOGGER.warning(MessageFormat.format(
                    CacheDB.L10N.getString("err.invalid_duration"), duration));
            return 0;
        }
    }

}
