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
 * RESP (REdis Serialization Protocol) codec.
 *
 * <p>This package decodes client request frames and encodes server
 * replies for the RESP2 subset spoken by cachedb.
 *
 * <h2>RESP Data Types</h2>
 *
 * <table border="1" cellpadding="5">
 *   <caption>RESP Data Types</caption>
 *   <tr><th>Marker</th><th>Type</th><th>Example</th></tr>
 *   <tr><td>{@code +}</td><td>Simple String</td><td>{@code +OK\r\n}</td></tr>
 *   <tr><td>{@code -}</td><td>Error</td><td>{@code -ERR unknown command 'FOO'\r\n}</td></tr>
 *   <tr><td>{@code :}</td><td>Integer</td><td>{@code :2\r\n}</td></tr>
 *   <tr><td>{@code $}</td><td>Bulk String</td><td>{@code $2\r\nhi\r\n}</td></tr>
 *   <tr><td>{@code *}</td><td>Array</td><td>{@code *2\r\n$3\r\nGET\r\n$1\r\nx\r\n}</td></tr>
 * </table>
 *
 * <p>The null bulk string is {@code $-1\r\n}; the null array,
 * {@code *-1\r\n}, is accepted by the decoder but is not a valid request.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link org.bluezoo.cachedb.resp.RESPDecoder} - push parser over an inbound buffer</li>
 *   <li>{@link org.bluezoo.cachedb.resp.RESPEncoder} - encodes replies and commands</li>
 *   <li>{@link org.bluezoo.cachedb.resp.RESPValue} - a decoded or constructed value</li>
 *   <li>{@link org.bluezoo.cachedb.resp.Request} - turns a frame into request tokens</li>
 *   <li>{@link org.bluezoo.cachedb.resp.RESPException} - malformed frame</li>
 * </ul>
 *
 * <h2>Streaming Decoding</h2>
 *
 * <p>The decoder works on the caller's buffer. If a complete value
 * cannot be parsed from the available data, {@code decode()} returns null
 * and leaves the buffer untouched, so the partial frame stays buffered
 * until more bytes arrive.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
package org.bluezoo.cachedb.resp;
