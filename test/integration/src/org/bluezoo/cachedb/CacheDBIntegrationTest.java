/*
 * CacheDBIntegrationTest.java
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

import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.nio.file.Path;

import org.bluezoo.cachedb.resp.RESPDecoder;
import org.bluezoo.cachedb.resp.RESPEncoder;
import org.bluezoo.cachedb.resp.RESPException;
import org.bluezoo.cachedb.resp.RESPValue;
import org.bluezoo.cachedb.server.RESPListener;

import static org.junit.Assert.*;

/**
 * End-to-end tests running a real server on a loopback port.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CacheDBIntegrationTest {

    private static final int SOCKET_TIMEOUT = 5000;

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path snapshotDir;
    private CacheDB server;
    private int port;

    @Before
    public void setUp() throws IOException {
        snapshotDir = folder.newFolder("snapshots").toPath();
    }

    @After
    public void tearDown() throws InterruptedException {
        if (server != null) {
            server.shutdown();
            server.join();
            server = null;
        }
    }

    private static int findFreePort() throws IOException {
        ServerSocket socket = new ServerSocket(0);
        try {
            return socket.getLocalPort();
        } finally {
            socket.close();
        }
    }

    private RESPListener newListener(boolean loadOnStart) throws IOException {
        RESPListener listener = new RESPListener();
        listener.setPort(port);
        listener.setAddresses("127.0.0.1");
        listener.getSnapshotManager().setDirectory(snapshotDir);
        listener.getSnapshotManager().setLoadOnStart(loadOnStart);
        return listener;
    }

    private void startServer(boolean loadOnStart) throws IOException {
        server = new CacheDB(newListener(loadOnStart));
        server.start();
    }

    /**
     * Blocking RESP client over a plain socket.
     */
    static class Client {

        private final Socket socket;
        private final OutputStream out;
        private final InputStream in;
        private final RESPEncoder encoder = new RESPEncoder();
        private final RESPDecoder decoder = new RESPDecoder();
        private ByteBuffer buffer = ByteBuffer.allocate(4096);

        Client(int port) throws IOException {
            socket = new Socket(InetAddress.getByName("127.0.0.1"), port);
            socket.setSoTimeout(SOCKET_TIMEOUT);
            out = socket.getOutputStream();
            in = socket.getInputStream();
            buffer.flip();
        }

        void sendRaw(byte[] data) throws IOException {
            out.write(data);
            out.flush();
        }

        RESPValue call(String command, String... args) throws IOException, RESPException {
            ByteBuffer request = encoder.encodeCommand(command, args);
            byte[] bytes = new byte[request.remaining()];
            request.get(bytes);
            sendRaw(bytes);
            return readReply();
        }

        RESPValue readReply() throws IOException, RESPException {
            while (true) {
                RESPValue reply = decoder.decode(buffer);
                if (reply != null) {
                    return reply;
                }
                byte[] chunk = new byte[4096];
                int len = in.read(chunk);
                if (len == -1) {
                    return null;
                }
                buffer.compact();
                if (buffer.remaining() < len) {
                    ByteBuffer larger = ByteBuffer.allocate(buffer.capacity() * 2 + len);
                    buffer.flip();
                    larger.put(buffer);
                    buffer = larger;
                }
                buffer.put(chunk, 0, len);
                buffer.flip();
            }
        }

        void close() throws IOException {
            socket.close();
        }

    }

    @Test
    public void testPingSetGet() throws Exception {
        port = findFreePort();
        startServer(false);

        Client client = new Client(port);
        try {
            assertEquals("PONG", client.call("PING").asString());
            assertEquals("OK", client.call("SET", "greeting", "hello").asString());
            assertEquals("hello", client.call("GET", "greeting").asString());
            assertTrue(client.call("GET", "missing").isNull());
            assertEquals(1L, client.call("DBSIZE").asLong());
        } finally {
            client.close();
        }
    }

    @Test
    public void testStoreSharedBetweenConnections() throws Exception {
        port = findFreePort();
        startServer(false);

        Client first = new Client(port);
        Client second = new Client(port);
        try {
            assertEquals("OK", first.call("SET", "shared", "yes").asString());
            assertEquals("yes", second.call("GET", "shared").asString());
        } finally {
            first.close();
            second.close();
        }
    }

    @Test
    public void testPipelining() throws Exception {
        port = findFreePort();
        startServer(false);

        Client client = new Client(port);
        try {
            client.sendRaw(("*3\r\n$3\r\nSET\r\n$1\r\na\r\n$1\r\n1\r\n"
                    + "*2\r\n$3\r\nGET\r\n$1\r\na\r\n"
                    + "*1\r\n$4\r\nPING\r\n").getBytes("US-ASCII"));

            assertEquals("OK", client.readReply().asString());
            assertEquals("1", client.readReply().asString());
            assertEquals("PONG", client.readReply().asString());
        } finally {
            client.close();
        }
    }

    @Test
    public void testProtocolErrorClosesConnection() throws Exception {
        port = findFreePort();
        startServer(false);

        Client client = new Client(port);
        try {
            client.sendRaw("PING\r\n".getBytes("US-ASCII"));

            RESPValue reply = client.readReply();
            assertTrue(reply.isError());
            assertTrue(reply.asString().startsWith("ERR Protocol error"));
            assertNull(client.readReply());
        } finally {
            client.close();
        }
    }

    @Test
    public void testQuit() throws Exception {
        port = findFreePort();
        startServer(false);

        Client client = new Client(port);
        try {
            assertEquals("OK", client.call("QUIT").asString());
            assertNull(client.readReply());
        } finally {
            client.close();
        }
    }

    @Test
    public void testBackupAndRestore() throws Exception {
        port = findFreePort();
        startServer(false);

        Client client = new Client(port);
        try {
            assertEquals("OK", client.call("SET", "k", "persisted").asString());
            assertEquals("OK backup saved", client.call("BACKUP").asString());
        } finally {
            client.close();
        }
        server.shutdown();
        server.join();

        port = findFreePort();
        startServer(true);
        client = new Client(port);
        try {
            assertEquals("persisted", client.call("GET", "k").asString());
        } finally {
            client.close();
        }
    }

    @Test
    public void testPortInUse() throws Exception {
        ServerSocket blocker = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"));
        try {
            port = blocker.getLocalPort();
            CacheDB failing = new CacheDB(newListener(false));
            try {
                failing.start();
                fail("Expected IOException");
            } catch (IOException e) {
                // expected
            }
            failing.join();
        } finally {
            blocker.close();
        }
    }

}
