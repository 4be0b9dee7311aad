/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */


package dev.nishisan.watcher.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Holds the active {@link WatcherConfig} and swaps it atomically on reload.
 * <p>
 * Readers always see a complete snapshot. A reload that fails leaves the
 * previous snapshot in force and rethrows the failure.
 */
public class ConfigProvider implements Supplier<WatcherConfig> {

    private static final Logger logger = LoggerFactory.getLogger(ConfigProvider.class);

    private final Path configFile;
    private final Function<String, String> envProvider;
    private final AtomicReference<WatcherConfig> current = new AtomicReference<>();

    private ConfigProvider(Path configFile, Function<String, String> envProvider, WatcherConfig initial) {
        this.configFile = configFile;
        this.envProvider = envProvider;
        this.current.set(initial);
    }

    /**
     * Loads {@code configFile} using the process environment for placeholders.
     */
    public static ConfigProvider fromFile(Path configFile) throws IOException {
        return fromFile(configFile, System::getenv);
    }

    /**
     * Loads {@code configFile}, failing fast when it is invalid.
     *
     * @throws IOException            if the file cannot be read
     * @throws WatcherConfigException if the configuration is invalid
     */
    public static ConfigProvider fromFile(Path configFile, Function<String, String> envProvider)
            throws IOException {
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(envProvider, "envProvider");
        WatcherConfig initial = WatcherConfigLoader.loadDomain(configFile, envProvider);
        logger.info("Loaded watcher configuration from {}", configFile);
        return new ConfigProvider(configFile, envProvider, initial);
    }

    /**
     * Wraps a fixed snapshot. {@link #reload()} is not supported on such a provider.
     */
    public static ConfigProvider of(WatcherConfig config) {
        return new ConfigProvider(null, null, Objects.requireNonNull(config, "config"));
    }

    public WatcherConfig current() {
        return current.get();
    }

    @Override
    public WatcherConfig get() {
        return current();
    }

    /**
     * Re-reads the backing file and publishes the new snapshot.
     *
     * @return the snapshot now in force
     * @throws IOException            if the file cannot be read
     * @throws WatcherConfigException if the new content is invalid
     */
    public WatcherConfig reload() throws IOException {
        if (configFile == null) {
            throw new IllegalStateException("Provider is not backed by a file");
        }
        WatcherConfig reloaded;
        try {
            reloaded = WatcherConfigLoader.loadDomain(configFile, envProvider);
        } catch (IOException | WatcherConfigException e) {
            logger.warn("Reload of {} failed, keeping previous configuration: {}", configFile, e.getMessage());
            throw e;
        }
        current.set(reloaded);
        logger.info("Reloaded watcher configuration from {}", configFile);
        return reloaded;
    }

    /**
     * Replaces the snapshot directly.
     */
    public void update(WatcherConfig config) {
        current.set(Objects.requireNonNull(config, "config"));
    }
}
