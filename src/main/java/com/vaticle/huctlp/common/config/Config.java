/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.common.config;

import com.vaticle.huctlp.common.exception.HUCTLpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

import static com.vaticle.huctlp.common.exception.ErrorMessage.Config.CONFIG_FILE_NOT_FOUND;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Config.CONFIG_KEY_MISSING;

/**
 * Settings of the resolver and normaliser. The defaults are read from {@code huctlp.properties} on the
 * classpath, and are overridden by the file named by the {@code huctlp.conf} system property, if any.
 */
public class Config {

    private static final Logger LOG = LoggerFactory.getLogger(Config.class);

    public static final String DEFAULT_CONFIG_RESOURCE = "huctlp.properties";
    public static final String CONFIG_FILE_PROPERTY = "huctlp.conf";

    private static Config defaultConfig = null;

    private final Properties prop;

    private Config(Properties prop) {
        this.prop = prop;
    }

    public static synchronized Config create() {
        if (defaultConfig == null) {
            Config config = readDefaults();
            String override = System.getProperty(CONFIG_FILE_PROPERTY);
            if (override != null) config = config.overriddenBy(read(Paths.get(override)));
            defaultConfig = config;
        }
        return defaultConfig;
    }

    public static Config readDefaults() {
        try (InputStream inputStream = Config.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (inputStream == null) throw HUCTLpException.of(CONFIG_FILE_NOT_FOUND, DEFAULT_CONFIG_RESOURCE);
            return read(inputStream, DEFAULT_CONFIG_RESOURCE);
        } catch (IOException e) {
            LOG.error("Could not load properties from classpath resource {}", DEFAULT_CONFIG_RESOURCE, e);
            throw HUCTLpException.of(CONFIG_FILE_NOT_FOUND, e, DEFAULT_CONFIG_RESOURCE);
        }
    }

    public static Config read(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return read(inputStream, path.toString());
        } catch (IOException e) {
            LOG.error("Could not load properties from {}", path, e);
            throw HUCTLpException.of(CONFIG_FILE_NOT_FOUND, e, path);
        }
    }

    private static Config read(InputStream inputStream, String location) throws IOException {
        Properties prop = new Properties();
        prop.load(inputStream);
        LOG.debug("Loaded {} properties from {}", prop.size(), location);
        return of(prop);
    }

    public static Config of(Properties properties) {
        Properties localProps = new Properties();
        properties.forEach((key, value) -> localProps.setProperty((String) key, (String) value));
        return new Config(localProps);
    }

    /**
     * @return a new config holding the properties of this one, with every property of {@code other} taking precedence
     */
    public Config overriddenBy(Config other) {
        Properties merged = new Properties();
        merged.putAll(prop);
        merged.putAll(other.prop);
        return new Config(merged);
    }

    public <T> Config with(ConfigKey<T> key, T value) {
        Properties copy = new Properties();
        copy.putAll(prop);
        copy.setProperty(key.name(), key.valueToString(value));
        return new Config(copy);
    }

    public <T> T getProperty(ConfigKey<T> key) {
        String value = prop.getProperty(key.name());
        if (value == null) throw HUCTLpException.of(CONFIG_KEY_MISSING, key.name());
        return key.parse(value);
    }
}
