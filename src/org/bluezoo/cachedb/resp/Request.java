/*
 * Request.java
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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts decoded frames into request tokens.
 *
 * <p>A client request is an array of non-null bulk strings. The tokens
 * are the raw bytes of each element, in order.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Request {

    private Request() {
    }

    /**
     * Returns the ordered tokens of a request frame.
     *
     * <p>A well-formed empty array yields an empty list, which is not the
     * same thing as a malformed frame.
     *
     * @param frame a decoded frame
     * @return the tokens
     * @throws RESPException if the frame is not an array of bulk strings
     */
    public static List<byte[]> tokens(RESPValue frame) throws RESPException {
        if (!frame.isArray()) {
            String msg = MessageFormat.format(RESPDecoder.L10N.getString("err.request_not_array"),
                    frame.isNull() ? "null" : frame.getType());
            throw new RESPException(msg);
        }
        List<RESPValue> elements = frame.asArray();
        if (elements.isEmpty()) {
            return Collections.emptyList();
        }
        List<byte[]> tokens = new ArrayList<byte[]>(elements.size());
        for (RESPValue element : elements) {
            if (!element.isBulkString()) {
                String msg = MessageFormat.format(RESPDecoder.L10N.getString("err.request_element_not_bulk"),
                        element.isNull() ? "null" : element.getType());
                throw new RESPException(msg);
            }
            tokens.add(element.asBytes());
        }
        return tokens;
    }

}
