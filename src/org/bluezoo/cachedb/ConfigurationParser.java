/*
 * ConfigurationParser.java
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

import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.cachedb.server.RESPListener;

/**
 * SAX-based parser for the cachedbrc configuration file.
 *
 * <p>The file has the form:
 * <pre>{@code
 * <cachedb>
 *   <listener port="6379" addresses="127.0.0.1" idle-timeout="5m"
 *             max-net-in-size="1048576" max-net-out-size="1048576"/>
 *   <snapshot directory="/var/lib/cachedb" prefix="cachedb-"
 *             suffix=".snapshot" interval="5m" load-on-start="true"/>
 * </cachedb>
 * }</pre>
 *
 * <p>Each attribute is injected through the bean setter of the same name,
 * with hyphenated names converted to camel case: {@code idle-timeout}
 * calls {@code setIdleTimeout}. The {@code listener} element configures
 * the {@link RESPListener}, the {@code snapshot} element its
 * {@link org.bluezoo.cachedb.store.SnapshotManager}. Either element may
 * be omitted, in which case the defaults apply.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class ConfigurationParser extends DefaultHandler {

    private static final Logger LOGGER = Logger.getLogger(ConfigurationParser.class.getName());

    private Locator locator;
    private RESPListener listener;
    private Set<String> seen;
    private int depth;

    /**
     * Parse a configuration file.
     *
     * @param file the configuration file
     * @return the configured listener
     * @throws SAXException if the file is not a valid configuration
     * @throws IOException if the file cannot be read
     */
    public RESPListener parse(File file) throws SAXException, IOException {
        InputStream in = new BufferedInputStream(new FileInputStream(file));
        try {
            InputSource source = new InputSource(in);
            source.setSystemId(file.toURI().toString());
            RESPListener result = parse(source);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Parsed configuration file: " + file);
            }
            return result;
        } finally {
            in.close();
        }
    }

    /**
     * Parse a configuration document.
     *
     * @param source the document source
     * @return the configured listener
     * @throws SAXException if the document is not a valid configuration
     * @throws IOException if the document cannot be read
     */
    public RESPListener parse(InputSource source) throws SAXException, IOException {
        listener = null;
        seen = new HashSet<String>();
        depth = 0;
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(true);
            SAXParser parser = factory.newSAXParser();
            parser.parse(source, this);
        } catch (ParserConfigurationException e) {
            throw new SAXException("Failed to create configuration parser", e);
        }
        return getListener();
    }

    private RESPListener getListener() {
        if (listener == null) {
            listener = new RESPListener();
        }
        return listener;
    }

    @Override
    public void setDocumentLocator(Locator locator) {
        this.locator = locator;
    }

    @Override
    public void startElement(String uri, String localName, String qName,
                             Attributes atts) throws SAXException {
        String name = localName != null && !localName.isEmpty() ? localName : qName;
        depth++;

        if (depth == 1) {
            if (!"cachedb".equals(name)) {
                String message = MessageFormat.format(CacheDB.L10N.getString("err.root_element"), name);
                throw new SAXParseException(message, locator);
            }
        } else if (depth == 2 && ("listener".equals(name) || "snapshot".equals(name))) {
            if (!seen.add(name)) {
                String message = MessageFormat.format(CacheDB.L10N.getString("err.duplicate_element"),
                        name, lineNumber());
                throw new SAXParseException(message, locator);
            }
            Object target = "listener".equals(name)
                    ? getListener()
                    : getListener().getSnapshotManager();
            for (int i = 0; i < atts.getLength(); i++) {
                String attName = atts.getLocalName(i);
                if (attName == null || attName.isEmpty()) {
                    attName = atts.getQName(i);
                }
                injectProperty(target, name, attName, atts.getValue(i));
            }
        } else {
            String message = MessageFormat.format(CacheDB.L10N.getString("err.unknown_element"),
                    name, lineNumber());
            LOGGER.warning(message);
        }
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
        depth--;
    }

    /**
     * Calls the setter for an attribute on the target.
     */
    private void injectProperty(Object target, String element, String attName, String value)
            throws SAXException {
        String methodName = toCamelCase("set-" + attName);
        Method setter = findSetter(target.getClass(), methodName);
        if (setter == null) {
            String message = MessageFormat.format(CacheDB.L10N.getString("err.unknown_attribute"),
                    attName, element, lineNumber());
            LOGGER.warning(message);
            return;
        }
        try {
            Object converted = convertValue(value, setter.getParameterTypes()[0]);
            setter.invoke(target, converted);
            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest("Injected property " + attName + " on " +
                        target.getClass().getSimpleName());
            }
        } catch (IllegalArgumentException e) {
            throw invalidAttribute(attName, value, e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            Exception ex = (cause instanceof Exception) ? (Exception) cause : e;
            throw invalidAttribute(attName, value, ex);
        } catch (IllegalAccessException e) {
            throw invalidAttribute(attName, value, e);
        }
    }

    private SAXParseException invalidAttribute(String attName, String value, Exception cause) {
        String message = MessageFormat.format(CacheDB.L10N.getString("err.invalid_attribute"),
                attName, value, lineNumber());
        return new SAXParseException(message, locator, cause);
    }

    private String lineNumber() {
        return (locator != null) ? Integer.toString(locator.getLineNumber()) : "?";
    }

    static String toCamelCase(String name) {
        // Convert "set-idle-timeout" to "setIdleTimeout"
        int hyphenIndex = name.indexOf('-');
        while (hyphenIndex != -1 && hyphenIndex < name.length() - 1) {
            name = name.substring(0, hyphenIndex) +
                   Character.toUpperCase(name.charAt(hyphenIndex + 1)) +
                   name.substring(hyphenIndex + 2);
            hyphenIndex = name.indexOf('-');
        }
        return name;
    }

    /**
     * Finds a single-argument public setter, preferring one that takes a
     * String.
     */
    private Method findSetter(Class<?> clazz, String methodName) {
        Method found = null;
        for (Method method : clazz.getMethods()) {
            if (method.getName().equals(methodName) && method.getParameterCount() == 1) {
                Class<?> paramType = method.getParameterTypes()[0];
                if (paramType == String.class) {
                    return method;
                }
                if (canConvert(paramType)) {
                    found = method;
                }
            }
        }
        return found;
    }

    private static boolean canConvert(Class<?> targetType) {
        return targetType == int.class || targetType == Integer.class
                || targetType == long.class || targetType == Long.class
                || targetType == boolean.class || targetType == Boolean.class
                || targetType == Path.class;
    }

    /**
     * Converts an attribute value to the setter's parameter type.
     *
     * @throws IllegalArgumentException if the value cannot be converted
     */
    private static Object convertValue(String str, Class<?> targetType) {
        str = str.trim();
        if (targetType == String.class) {
            return str;
        }
        if (targetType == int.class || targetType == Integer.class) {
            return Integer.valueOf(Integer.parseInt(str));
        }
        if (targetType == long.class || targetType == Long.class) {
            return Long.valueOf(Long.parseLong(str));
        }
        if (targetType == boolean.class || targetType == Boolean.class) {
            if ("true".equalsIgnoreCase(str) || "yes".equalsIgnoreCase(str)) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(str) || "no".equalsIgnoreCase(str)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException(str);
        }
        if (targetType == Path.class) {
            return Paths.get(str);
        }
        throw new IllegalArgumentException(targetType.getName());
    }

}
