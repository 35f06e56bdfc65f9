/*
 * Copyright (C) 2021 Vaticle
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 *
 */

package com.vaticle.typematch.common.config;

import com.vaticle.typematch.common.parameters.Options;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Keys of the properties in the file {@code typematch.properties}.
 *
 * @param <T> the type of the values of the key
 */
public class ConfigKey<T> {

    /**
     * Describes how to read and write the value of a property.
     *
     * @param <T> The type of the property value
     */
    public interface KeyParser<T> {

        T read(String string);

        default String write(T value) {
            return value.toString();
        }
    }

    public static final KeyParser<String> STRING = string -> string;
    public static final KeyParser<Integer> INT = Integer::parseInt;
    public static final KeyParser<Long> LONG = Long::parseLong;
    public static final KeyParser<Boolean> BOOL = ConfigKey::parseBoolean;
    public static final KeyParser<Path> PATH = Paths::get;
    public static final KeyParser<Options.Backend> BACKEND = string -> Options.Backend.valueOf(string.trim().toUpperCase(Locale.ROOT));

    public static final ConfigKey<Options.Backend> SOLVER_BACKEND = key("solver.backend", BACKEND);
    public static final ConfigKey<String> SOLVER_BINARY = key("solver.binary");
    public static final ConfigKey<String> SOLVER_EMBEDDED_ID = key("solver.embedded-id");
    public static final ConfigKey<Path> SOLVER_TMP_DIR = key("solver.tmp-dir", PATH);
    public static final ConfigKey<Long> SOLVER_TIMEOUT_MILLIS = key("solver.timeout-ms", LONG);
    public static final ConfigKey<Boolean> SOLVER_INITIAL_POLARITY = key("solver.initial-polarity", BOOL);
    public static final ConfigKey<Boolean> MATCHER_TRANSITIVITY = key("matcher.transitivity", BOOL);
    public static final ConfigKey<Integer> MATCHER_MAX_ITERATIONS = key("matcher.max-iterations", INT);
    public static final ConfigKey<Integer> MATCHER_MAX_TYPES = key("matcher.max-types", INT);

    private final String name;
    private final KeyParser<T> parser;

    public ConfigKey(String name, KeyParser<T> parser) {
        this.name = name;
        this.parser = parser;
    }

    public String name() {
        return name;
    }

    public KeyParser<T> parser() {
        return parser;
    }

    public final String valueToString(T value) {
        return parser.write(value);
    }

    public static ConfigKey<String> key(String name) {
        return key(name, STRING);
    }

    public static <T> ConfigKey<T> key(String name, KeyParser<T> parser) {
        return new ConfigKey<>(name, parser);
    }

    private static Boolean parseBoolean(String string) {
        String value = string.trim().toLowerCase(Locale.ROOT);
        if (value.equals("true")) return true;
        else if (value.equals("false")) return false;
        else throw new IllegalArgumentException(string);
    }

    @Override
    public String toString() {
        return name;
    }
}
