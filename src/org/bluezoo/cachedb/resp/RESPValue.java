/*
 * RESPValue.java
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

package org.bluezoo.cachedb.resp;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A RESP value, either decoded from a request or built as a reply.
 *
 * <p>A value is one of simple string, error, integer, bulk string or
 * array. The null bulk string and the null array are both represented by
 * the single instance returned by {@link #nullValue()}.
 *
 * <p>Common replies are available as constants so that the dispatcher
 * does not allocate for them.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RESPValue {

    private static final Charset UTF_8 = StandardCharsets.UTF_8;

    private static final RESPValue NULL = new RESPValue(null, null);

    /** The {@code +OK} status reply. */
    public static final RESPValue OK = simpleString("OK");

    /** The {@code +PONG} status reply. */
    public static final RESPValue PONG = simpleString("PONG");

    private final RESPType type;
    private final Object value;

    private RESPValue(RESPType type, Object value) {
        this.type = type;
        this.value = value;
    }

    // -- Factory methods --

    /**
     * Returns the null value singleton.
     *
     * @return the null RESP value
     */
    public static RESPValue nullValue() {
        return NULL;
    }

    /**
     * Creates a simple string value.
     *
     * @param value the string value
     * @return the RESP value
     */
    public static RESPValue simpleString(String value) {
        if (value == null) {
            throw new NullPointerException("value");
        }
        return new RESPValue(RESPType.SIMPLE_STRING, value);
    }

    /**
     * Creates an error value.
     *
     * @param message the error message, including its class prefix
     * @return the RESP value
     */
    public static RESPValue error(String message) {
        if (message == null) {
            throw new NullPointerException("message");
        }
        return new RESPValue(RESPType.ERROR, message);
    }

    /**
     * Creates an integer value.
     *
     * @param value the integer value
     * @return the RESP value
     */
    public static RESPValue integer(long value) {
        return new RESPValue(RESPType.INTEGER, Long.valueOf(value));
    }

    /**
     * Creates a bulk string value.
     * The array is not copied.
     *
     * @param value the byte array value
     * @return the RESP value
     */
    public static RESPValue bulkString(byte[] value) {
        if (value == null) {
            return NULL;
        }
        return new RESPValue(RESPType.BULK_STRING, value);
    }

    /**
     * Creates a bulk string value from UTF-8 text.
     *
     * @param value the text
     * @return the RESP value
     */
    public static RESPValue bulkString(String value) {
        if (value == null) {
            return NULL;
        }
        return new RESPValue(RESPType.BULK_STRING, value.getBytes(UTF_8));
    }

    /**
     * Creates an array value.
     *
     * @param elements the array elements
     * @return the RESP value
     */
    public static RESPValue array(List<RESPValue> elements) {
        if (elements == null) {
            return NULL;
        }
        return new RESPValue(RESPType.ARRAY, Collections.unmodifiableList(elements));
    }

    // -- Type checking --

    /**
     * Returns the RESP type of this value.
     *
     * @return the type, or null if this is the null value
     */
    public RESPType getType() {
        return type;
    }

    public boolean isNull() {
        return type == null;
    }

    public boolean isSimpleString() {
        return type == RESPType.SIMPLE_STRING;
    }

    public boolean isError() {
        return type == RESPType.ERROR;
    }

    public boolean isInteger() {
        return type == RESPType.INTEGER;
    }

    public boolean isBulkString() {
        return type == RESPType.BULK_STRING;
    }

    public boolean isArray() {
        return type == RESPType.ARRAY;
    }

    // -- Value access --

    /**
     * Returns this value as a string.
     *
     * <p>For simple strings and errors, returns the string directly.
     * For bulk strings, decodes as UTF-8.
     * For integers, returns the decimal representation.
     * For arrays and null, returns null.
     *
     * @return the string value, or null
     */
    public String asString() {
        if (type == null) {
            return null;
        }
        switch (type) {
            case SIMPLE_STRING:
            case ERROR:
                return (String) value;
            case BULK_STRING:
                return new String((byte[]) value, UTF_8);
            case INTEGER:
                return value.toString();
            default:
                return null;
        }
    }

    /**
     * Returns this value as a long integer.
     *
     * @return the integer value
     * @throws IllegalStateException if this is not an integer
     */
    public long asLong() {
        if (type != RESPType.INTEGER) {
            throw new IllegalStateException("Not an integer value");
        }
        return ((Long) value).longValue();
    }

    /**
     * Returns this value as a byte array.
     *
     * <p>For bulk strings, returns the raw bytes.
     * For simple strings and errors, encodes as UTF-8.
     *
     * @return the byte array, or null if null or array type
     */
    public byte[] asBytes() {
        if (type == null) {
            return null;
        }
        switch (type) {
            case BULK_STRING:
                return (byte[]) value;
            case SIMPLE_STRING:
            case ERROR:
                return ((String) value).getBytes(UTF_8);
            case INTEGER:
                return value.toString().getBytes(UTF_8);
            default:
                return null;
        }
    }

    /**
     * Returns this value as a list of RESP values.
     *
     * @return the array elements, or null if not an array
     */
    @SuppressWarnings("unchecked")
    public List<RESPValue> asArray() {
        if (type != RESPType.ARRAY) {
            return null;
        }
        return (List<RESPValue>) value;
    }

    // -- Object methods --

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RESPValue)) {
            return false;
        }
        RESPValue o = (RESPValue) other;
        if (type != o.type) {
            return false;
        }
        if (type == null) {
            return true;
        }
        if (type == RESPType.BULK_STRING) {
            return Arrays.equals((byte[]) value, (byte[]) o.value);
        }
        return value.equals(o.value);
    }

    @Override
    public int hashCode() {
        if (type == null) {
            return 0;
        }
        int h = type.hashCode() * 31;
        if (type == RESPType.BULK_STRING) {
            return h + Arrays.hashCode((byte[]) value);
        }
        return h + value.hashCode();
    }

    @Override
    public String toString() {
        if (type == null) {
            return "null";
        }
        switch (type) {
            case SIMPLE_STRING:
                return "+" + value;
            case ERROR:
                return "-" + value;
            case INTEGER:
                return ":" + value;
            case BULK_STRING:
                byte[] bytes = (byte[]) value;
                return "$" + bytes.length + ":" + new String(bytes, UTF_8);
            case ARRAY:
                return "*" + asArray().size();
            default:
                return "unknown";
        }
    }

}
