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

import java.util.List;
import java.util.Objects;

/**
 * SMTP connection and addressing settings.
 *
 * @param host       SMTP server host
 * @param port       SMTP server port
 * @param sender     sender address, also used as the login user
 * @param password   login password
 * @param recipients recipient addresses
 * @param useTls     whether to upgrade the connection with STARTTLS
 */
public record SmtpSettings(String host, int port, String sender, String password, List<String> recipients,
        boolean useTls) {

    public SmtpSettings {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(sender, "sender");
        recipients = List.copyOf(recipients);
    }

    @Override
    public String toString() {
        return "SmtpSettings[host=" + host + ", port=" + port + ", sender=" + sender
                + ", recipients=" + recipients + ", useTls=" + useTls + "]";
    }
}
