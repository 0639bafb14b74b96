/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.common.config;

import com.vaticle.huctlp.common.exception.HUCTLpException;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Config.CONFIG_VALUE_UNEXPECTED;

/**
 * Class for keys of properties in the file {@code huctlp.properties}.
 *
 * @param <T> the type of the values of the key
 */
public class ConfigKey<T> {

    /**
     * Describes how to read and write a property value.
     *
     * @param <T> The type of the property value
     */
    public interface KeyParser<T> {

        T read(String string);

        default String write(T value) {
            return value.toString();
        }
    }

    public static final KeyParser<Integer> INT = Integer::parseInt;
    public static final KeyParser<Boolean> BOOL = string -> {
        if (string.equalsIgnoreCase("true")) return true;
        else if (string.equalsIgnoreCase("false")) return false;
        else throw new IllegalArgumentException(string);
    };

    public static final ConfigKey<Boolean> RESOLVER_ONLY_FLAGGED = key("resolver.only-flagged", BOOL);
    public static final ConfigKey<Integer> RESOLVER_PARALLELISM = key("resolver.parallelism", INT);
    public static final ConfigKey<Boolean> NORMALISER_ENABLED = key("normaliser.enabled", BOOL);

    /**
     * The name of the key, how it looks in the properties file
     */
    private final String name;

    private final KeyParser<T> parser;

    public ConfigKey(String name, KeyParser<T> parser) {
        this.name = name;
        this.parser = parser;
    }

    public String name() {
        return name;
    }

    public T parse(String value) {
        try {
            return parser.read(value.trim());
        } catch (IllegalArgumentException e) {
            throw HUCTLpException.of(CONFIG_VALUE_UNEXPECTED, e, name, value);
        }
    }

    /**
     * Convert the value of the property into a string to store in a properties file
     */
    public final String valueToString(T value) {
        return parser.write(value);
    }

    /**
     * Create a key with the given parser
     */
    public static <T> ConfigKey<T> key(String name, KeyParser<T> parser) {
        return new ConfigKey<>(name, parser);
    }

    @Override
    public String toString() {
        return name;
    }
}
