/*
 * Copyright (c) "Neo4j"
 * Neo4j Sweden AB [https://neo4j.com]
 *
 * This file is part of Neo4j.
 *
 * Neo4j is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package org.bitscan.util;

import java.util.Objects;

/**
 * Feature toggles configure behaviour that is fixed for the lifetime of a running system, such as additional
 * argument checking on hot cursor paths.
 * <p>
 * Toggles are passed to the JVM through {@linkplain System#getProperty(String) system properties} named after the
 * class that owns them, and are expected to be read once into a {@code static final} field of that class.
 * <p>
 * All lookups return the default value if the system property is not assigned, or if its value cannot be
 * interpreted as a value of the expected type.
 */
public final class FeatureToggles {
    private FeatureToggles() {
        throw new AssertionError("no instances");
    }

    /**
     * Get the value of a {@code boolean} system property named {@code <canonical class name>.<name>}.
     *
     * @param location the class that owns the flag.
     * @param name the local name of the flag.
     * @param defaultValue the value used if the system property is not assigned.
     * @return the parsed value of the system property, or the default value.
     */
    public static boolean flag(Class<?> location, String name, boolean defaultValue) {
        return parseBoolean(System.getProperty(name(location, name)), defaultValue);
    }

    /**
     * Assign a toggle, mostly from tests that load the owning class afterwards.
     */
    public static void set(Class<?> location, String name, Object value) {
        System.setProperty(name(location, name), Objects.toString(value));
    }

    public static void clear(Class<?> location, String name) {
        System.clearProperty(name(location, name));
    }

    private static String name(Class<?> location, String name) {
        return location.getCanonicalName() + "." + name;
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        return defaultValue ? !"false".equalsIgnoreCase(value) : "true".equalsIgnoreCase(value);
    }
}
