/*
 * CommandTest.java
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

import org.junit.Test;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * Unit tests for {@link Command}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CommandTest {

    static List<byte[]> tokens(String... words) {
        List<byte[]> tokens = new ArrayList<byte[]>();
        for (String word : words) {
            tokens.add(word.getBytes(StandardCharsets.UTF_8));
        }
        return tokens;
    }

    @Test
    public void testParse() {
        Command command = Command.parse(tokens("SET", "k", "v"));

        assertEquals(Command.Type.SET, command.getType());
        assertEquals("SET", command.getName());
        assertEquals(2, command.getArgCount());
        assertArrayEquals("k".getBytes(StandardCharsets.UTF_8), command.getArg(0));
        assertArrayEquals("v".getBytes(StandardCharsets.UTF_8), command.getArg(1));
    }

    @Test
    public void testCaseInsensitive() {
        assertEquals(Command.Type.PING, Command.parse(tokens("ping")).getType());
        assertEquals(Command.Type.GET, Command.parse(tokens("gEt", "k")).getType());
        assertEquals(Command.Type.BACKUP, Command.parse(tokens("Backup")).getType());
    }

    @Test
    public void testUnknownKeepsName() {
        Command command = Command.parse(tokens("FLUSHALL"));

        assertEquals(Command.Type.UNKNOWN, command.getType());
        assertEquals("FLUSHALL", command.getName());
    }

    @Test
    public void testEmpty() {
        Command command = Command.parse(Collections.<byte[]>emptyList());

        assertEquals(Command.Type.EMPTY, command.getType());
        assertEquals(0, command.getArgCount());
    }

    @Test
    public void testPseudoTypesNotMatchedByName() {
        assertEquals(Command.Type.UNKNOWN, Command.parse(tokens("UNKNOWN")).getType());
        assertEquals(Command.Type.UNKNOWN, Command.parse(tokens("empty")).getType());
    }

    @Test
    public void testCommandName() {
        assertEquals("set", Command.Type.SET.commandName());
    }

}
