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


package dev.nishisan.watcher;

import dev.nishisan.watcher.config.ConfigProvider;
import dev.nishisan.watcher.engine.AlertBatchListener;
import dev.nishisan.watcher.engine.AlertEngine;
import dev.nishisan.watcher.notify.AlertMessageFormatter;
import dev.nishisan.watcher.notify.EmailAlertNotifier;
import dev.nishisan.watcher.notify.MailTransport;
import dev.nishisan.watcher.notify.NotificationDispatcher;
import dev.nishisan.watcher.source.MetricsSource;
import jakarta.mail.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Ready-to-run watcher: loads the YAML configuration, drives an
 * {@link AlertEngine} on its own scheduler thread and delivers alerts by
 * e-mail.
 *
 * <pre>{@code
 * try (ContainerWatcher watcher = ContainerWatcher.create(Path.of("alerts.yml"), source)) {
 *     watcher.start();
 *     ...
 * }
 * }</pre>
 */
public class ContainerWatcher implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(ContainerWatcher.class);

    private final ConfigProvider configProvider;
    private final ScheduledExecutorService scheduler;
    private final AlertEngine engine;

    private ContainerWatcher(ConfigProvider configProvider, MetricsSource source, MailTransport transport,
            Clock clock) {
        this.configProvider = configProvider;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "container-watcher-tick");
            t.setDaemon(true);
            return t;
        });
        this.engine = AlertEngine.builder(configProvider, source, scheduler)
                .clock(clock)
                .build();
        EmailAlertNotifier notifier = new EmailAlertNotifier(configProvider,
                new AlertMessageFormatter(ZoneId.systemDefault()), transport);
        engine.addListener(new NotificationDispatcher(notifier, configProvider));
    }

    /**
     * Creates a watcher that sends mail through the real SMTP transport.
     *
     * @throws IOException if the configuration file cannot be read
     */
    public static ContainerWatcher create(Path configFile, MetricsSource source) throws IOException {
        return create(ConfigProvider.fromFile(configFile), source, Transport::send, Clock.systemUTC());
    }

    public static ContainerWatcher create(ConfigProvider configProvider, MetricsSource source,
            MailTransport transport, Clock clock) {
        return new ContainerWatcher(Objects.requireNonNull(configProvider, "configProvider"),
                Objects.requireNonNull(source, "source"),
                Objects.requireNonNull(transport, "transport"),
                Objects.requireNonNull(clock, "clock"));
    }

    public void start() {
        engine.start();
    }

    /**
     * Re-reads the configuration file. On failure the running configuration
     * stays in place.
     */
    public void reloadConfig() throws IOException {
        configProvider.reload();
    }

    public void addListener(AlertBatchListener listener) {
        engine.addListener(listener);
    }

    public AlertEngine engine() {
        return engine;
    }

    public ConfigProvider configProvider() {
        return configProvider;
    }

    @Override
    public void close() {
        engine.close();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("Container watcher closed");
    }
}
