/*
 * package-info.java
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

/**
 * cachedb server framework.
 *
 * <p>This package contains the event-driven transport that every
 * connection runs on, and the server's lifecycle and configuration.
 *
 * <h2>Threading</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.cachedb.AcceptSelectorLoop} binds each
 *       {@link org.bluezoo.cachedb.Listener} and accepts connections</li>
 *   <li>a single {@link org.bluezoo.cachedb.SelectorLoop} performs all
 *       connection I/O and runs every command</li>
 *   <li>a timer thread schedules callbacks, which are run on the
 *       selector loop</li>
 * </ul>
 *
 * <p>Because every command runs on one thread, the data it touches needs
 * no locking.
 *
 * <h2>Connections</h2>
 *
 * <p>Protocol logic implements {@link org.bluezoo.cachedb.ProtocolHandler}
 * and talks to its connection only through
 * {@link org.bluezoo.cachedb.Endpoint}. Inbound bytes that do not yet
 * form a complete request stay buffered in the endpoint until more data
 * arrives.
 *
 * <h2>Configuration</h2>
 *
 * <p>{@link org.bluezoo.cachedb.CacheDB#main} reads an XML configuration
 * file with {@link org.bluezoo.cachedb.ConfigurationParser}: the path
 * given as the first argument, else {@code ~/.cachedbrc}, else
 * {@code /etc/cachedbrc}. Without one, a listener on port 6379 with
 * default settings is started.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.cachedb;
