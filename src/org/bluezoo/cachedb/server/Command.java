/*
 * Command.java
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

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A parsed client command.
 *
 * <p>The first request token names the command; the remaining tokens
 * are its arguments. Command names are matched case-insensitively.
 * Argument counts are not checked here: that is the dispatcher's job,
 * so that an arity error can name the command.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Command {

    /**
     * Command types.
     */
    public enum Type {

        /** A request with no tokens at all. */
        EMPTY,

        PING,
        SET,
        GET,
        BACKUP,
        DBSIZE,
        QUIT,

        /** Any name not listed above. */
        UNKNOWN;

        /**
         * Returns the name used for this command in error replies.
         *
         * @return the lower-case command name
         */
        public String commandName() {
            return name().toLowerCase(Locale.ROOT);
        }

    }

    private static final Map<String, Type> TYPES;
    static {
        Map<String, Type> map = new HashMap<String, Type>();
        for (Type type : Type.values()) {
            if (type != Type.EMPTY && type != Type.UNKNOWN) {
                map.put(type.name(), type);
            }
        }
        TYPES = Collections.unmodifiableMap(map);
    }

    private final Type type;
    private final String name;
    private final List<byte[]> args;

    private Command(Type type, String name, List<byte[]> args) {
        this.type = type;
        this.name = name;
        this.args = args;
    }

    /**
     * Builds a command from request tokens.
     *
     * @param tokens the request tokens, possibly empty
     * @return the command, never null
     */
    public static Command parse(List<byte[]> tokens) {
        if (tokens.isEmpty()) {
            return new Command(Type.EMPTY, "", Collections.<byte[]>emptyList());
        }
        String name = new String(tokens.get(0), StandardCharsets.UTF_8);
        Type type = TYPES.get(name.toUpperCase(Locale.ROOT));
        if (type == null) {
            type = Type.UNKNOWN;
        }
        return new Command(type, name, tokens.subList(1, tokens.size()));
    }

    public Type getType() {
        return type;
    }

    /**
     * Returns the command name exactly as the client sent it.
     *
     * @return the name, empty for an empty command
     */
    public String getName() {
        return name;
    }

    public int getArgCount() {
        return args.size();
    }

    /**
     * Returns an argument.
     *
     * @param index the zero-based argument index
     * @return the argument bytes
     */
    public byte[] getArg(int index) {
        return args.get(index);
    }

    @Override
    public String toString() {
        return type + "(" + name + ", " + args.size() + " args)";
    }

}
