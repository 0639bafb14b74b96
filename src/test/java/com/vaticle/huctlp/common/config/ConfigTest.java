/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.vaticle.huctlp.common.config;

import com.vaticle.huctlp.common.exception.HUCTLpException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static com.vaticle.huctlp.common.config.ConfigKey.NORMALISER_ENABLED;
import static com.vaticle.huctlp.common.config.ConfigKey.RESOLVER_ONLY_FLAGGED;
import static com.vaticle.huctlp.common.config.ConfigKey.RESOLVER_PARALLELISM;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Config.CONFIG_FILE_NOT_FOUND;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Config.CONFIG_KEY_MISSING;
import static com.vaticle.huctlp.common.exception.ErrorMessage.Config.CONFIG_VALUE_UNEXPECTED;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertFalse;
import static junit.framework.TestCase.assertTrue;
import static org.junit.Assert.fail;

public class ConfigTest {

    @Rule
    public final TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void test_defaults_are_read_from_the_classpath() {
        Config config = Config.readDefaults();
        assertFalse(config.getProperty(RESOLVER_ONLY_FLAGGED));
        assertEquals(1, (int) config.getProperty(RESOLVER_PARALLELISM));
        assertFalse(config.getProperty(NORMALISER_ENABLED));
    }

    @Test
    public void test_file_overrides_defaults() throws IOException {
        Path file = folder.newFile("override.properties").toPath();
        Files.write(file, "resolver.parallelism = 4\nnormaliser.enabled=TRUE\n".getBytes(StandardCharsets.UTF_8));

        Config config = Config.readDefaults().overriddenBy(Config.read(file));

        assertEquals(4, (int) config.getProperty(RESOLVER_PARALLELISM));
        assertTrue(config.getProperty(NORMALISER_ENABLED));
        assertFalse(config.getProperty(RESOLVER_ONLY_FLAGGED));
    }

    @Test
    public void test_with_returns_a_modified_copy() {
        Config defaults = Config.readDefaults();
        Config modified = defaults.with(RESOLVER_ONLY_FLAGGED, true);

        assertTrue(modified.getProperty(RESOLVER_ONLY_FLAGGED));
        assertFalse(defaults.getProperty(RESOLVER_ONLY_FLAGGED));
    }

    @Test
    public void test_missing_file_throws() {
        try {
            Config.read(folder.getRoot().toPath().resolve("missing.properties"));
            fail();
        } catch (HUCTLpException e) {
            assertEquals(CONFIG_FILE_NOT_FOUND.code(), e.errorMessage().code());
        }
    }

    @Test
    public void test_missing_key_throws() {
        try {
            Config.of(new Properties()).getProperty(RESOLVER_PARALLELISM);
            fail();
        } catch (HUCTLpException e) {
            assertEquals(CONFIG_KEY_MISSING.code(), e.errorMessage().code());
            assertEquals(CONFIG_KEY_MISSING.message("resolver.parallelism"), e.getMessage());
        }
    }

    @Test
    public void test_unexpected_values_throw() {
        Properties properties = new Properties();
        properties.setProperty("resolver.parallelism", "many");
        properties.setProperty("normaliser.enabled", "yes");
        Config config = Config.of(properties);
        try {
            config.getProperty(RESOLVER_PARALLELISM);
            fail();
        } catch (HUCTLpException e) {
            assertEquals(CONFIG_VALUE_UNEXPECTED.code(), e.errorMessage().code());
        }
        try {
            config.getProperty(NORMALISER_ENABLED);
            fail();
        } catch (HUCTLpException e) {
            assertEquals(CONFIG_VALUE_UNEXPECTED.message("normaliser.enabled", "yes"), e.getMessage());
        }
    }
}
