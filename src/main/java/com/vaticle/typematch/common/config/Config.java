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

import com.vaticle.typematch.common.exception.TypeMatchException;
import com.vaticle.typematch.common.parameters.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;

import static com.vaticle.typematch.common.exception.ErrorMessage.Config.CONFIG_FILE_NOT_FOUND;
import static com.vaticle.typematch.common.exception.ErrorMessage.Config.CONFIG_KEY_MISSING;
import static com.vaticle.typematch.common.exception.ErrorMessage.Config.CONFIG_VALUE_UNEXPECTED;

/**
 * Reads the TypeMatch properties file and turns it into {@link Options}. Keys that are absent
 * leave the corresponding option at its default.
 */
public class Config {

    private static final Logger LOG = LoggerFactory.getLogger(Config.class);

    public static final Path DEFAULT_CONFIG_FILE = Paths.get("typematch.properties");

    private final Properties prop;

    private Config(Properties prop) {
        this.prop = prop;
    }

    /**
     * Reads the file named by the {@code typematch.conf} system property, or {@code typematch.properties}
     * in the working directory. A missing default file yields an empty configuration.
     */
    public static Config create() {
        String pathString = SystemProperty.CONFIGURATION_FILE.value();
        if (pathString != null) return read(Paths.get(pathString));
        else if (Files.isReadable(DEFAULT_CONFIG_FILE)) return read(DEFAULT_CONFIG_FILE);
        else {
            LOG.debug("No configuration file found at '{}', using defaults", DEFAULT_CONFIG_FILE.toAbsolutePath());
            return of(new Properties());
        }
    }

    public static Config read(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return read(inputStream);
        } catch (IOException e) {
            throw TypeMatchException.of(CONFIG_FILE_NOT_FOUND, path);
        }
    }

    public static Config read(InputStream inputStream) {
        Properties prop = new Properties();
        try {
            prop.load(inputStream);
        } catch (IOException e) {
            throw TypeMatchException.of(CONFIG_FILE_NOT_FOUND, inputStream);
        }
        return of(prop);
    }

    public static Config of(Properties properties) {
        Properties localProps = new Properties();
        properties.forEach((key, value) -> localProps.setProperty((String) key, (String) value));
        return new Config(localProps);
    }

    public Properties properties() {
        return prop;
    }

    public <T> void setProperty(ConfigKey<T> key, T value) {
        prop.setProperty(key.name(), key.valueToString(value));
    }

    public <T> T getProperty(ConfigKey<T> key) {
        return findProperty(key).orElseThrow(() -> TypeMatchException.of(CONFIG_KEY_MISSING, key.name()));
    }

    public <T> Optional<T> findProperty(ConfigKey<T> key) {
        String value = prop.getProperty(key.name());
        if (value == null) return Optional.empty();
        try {
            return Optional.of(key.parser().read(value));
        } catch (RuntimeException e) {
            throw TypeMatchException.of(CONFIG_VALUE_UNEXPECTED, key.name(), value);
        }
    }

    public Options toOptions() {
        Options options = new Options();
        findProperty(ConfigKey.SOLVER_BACKEND).ifPresent(options::backend);
        findProperty(ConfigKey.SOLVER_BINARY).ifPresent(options::solverBinary);
        findProperty(ConfigKey.SOLVER_EMBEDDED_ID).ifPresent(options::embeddedSolverId);
        findProperty(ConfigKey.SOLVER_TMP_DIR).ifPresent(options::tmpDir);
        findProperty(ConfigKey.SOLVER_TIMEOUT_MILLIS).ifPresent(options::solverTimeoutMillis);
        findProperty(ConfigKey.SOLVER_INITIAL_POLARITY).ifPresent(options::initialPolarity);
        findProperty(ConfigKey.MATCHER_TRANSITIVITY).ifPresent(options::transitivity);
        findProperty(ConfigKey.MATCHER_MAX_ITERATIONS).ifPresent(options::maxIterations);
        findProperty(ConfigKey.MATCHER_MAX_TYPES).ifPresent(options::maxTypes);
        LOG.debug("Loaded {}", options);
        return options;
    }
}
