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

/**
 * Delivery channel for alerts.
 */
public interface AlertNotifier {

    /**
     * Delivers the critical and warning alerts of a batch as one message.
     *
     * @param batch a batch with at least one actionable alert
     * @throws NotificationException if delivery fails
     */
    void send(AlertBatch batch) throws NotificationException;

    /**
     * Delivers a single recovery alert.
     *
     * @param recovery an {@code AlertKind.RECOVERY} event
     * @throws NotificationException if delivery fails
     */
    void sendRecovery(AlertEvent recovery) throws NotificationException;
}
