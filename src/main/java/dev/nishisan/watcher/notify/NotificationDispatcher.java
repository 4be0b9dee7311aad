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


package dev.nishisan.watcher.notify;

import dev.nishisan.watcher.alert.AlertBatch;
import dev.nishisan.watcher.alert.AlertEvent;
import dev.nishisan.watcher.config.WatcherConfig;
import dev.nishisan.watcher.engine.AlertBatchListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Routes each notifiable batch to an {@link AlertNotifier}: one message for
 * the critical and warning alerts, then one message per recovery when
 * recovery mail is enabled. Every delivery failure is logged on its own and
 * does not stop the remaining deliveries.
 */
public class NotificationDispatcher implements AlertBatchListener {

    private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final AlertNotifier notifier;
    private final Supplier<WatcherConfig> configSupplier;

    public NotificationDispatcher(AlertNotifier notifier, Supplier<WatcherConfig> configSupplier) {
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.configSupplier = Objects.requireNonNull(configSupplier, "configSupplier");
    }

    @Override
    public void onBatch(AlertBatch batch) {
        if (batch.hasAlerts()) {
            try {
                notifier.send(batch);
            } catch (NotificationException e) {
                logger.warn("Failed to deliver alert batch of {} alerts", batch.totalCount(), e);
            }
        }
        if (!batch.hasRecovery()) {
            return;
        }
        if (!configSupplier.get().recoveryEmailEnabled()) {
            logger.debug("Recovery notifications disabled, dropping {} recoveries", batch.recoveryAlerts().size());
            return;
        }
        for (AlertEvent recovery : batch.recoveryAlerts()) {
            try {
                notifier.sendRecovery(recovery);
            } catch (NotificationException e) {
                logger.warn("Failed to deliver recovery of {}", recovery.containerName(), e);
            }
        }
    }
}
