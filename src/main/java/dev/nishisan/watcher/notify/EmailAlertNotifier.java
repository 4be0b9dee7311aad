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
import dev.nishisan.watcher.config.SmtpSettings;
import dev.nishisan.watcher.config.WatcherConfig;
import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Supplier;

/**
 * Sends alerts as plain-text e-mail over SMTP.
 * <p>
 * SMTP settings are read from the configuration snapshot current at send
 * time, so a reload takes effect on the next message.
 */
public class EmailAlertNotifier implements AlertNotifier {

    private static final Logger logger = LoggerFactory.getLogger(EmailAlertNotifier.class);

    private final Supplier<WatcherConfig> configSupplier;
    private final AlertMessageFormatter formatter;
    private final MailTransport transport;

    public EmailAlertNotifier(Supplier<WatcherConfig> configSupplier) {
        this(configSupplier, new AlertMessageFormatter(), Transport::send);
    }

    public EmailAlertNotifier(Supplier<WatcherConfig> configSupplier, AlertMessageFormatter formatter,
            MailTransport transport) {
        this.configSupplier = Objects.requireNonNull(configSupplier, "configSupplier");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    @Override
    public void send(AlertBatch batch) throws NotificationException {
        if (!batch.hasAlerts()) {
            return;
        }
        WatcherConfig config = configSupplier.get();
        String subject = formatter.batchSubject(batch);
        String body = formatter.batchBody(batch, config.baseUrl());
        deliver(config, subject, body);
        logger.info("Alert email sent: {}", subject);
    }

    @Override
    public void sendRecovery(AlertEvent recovery) throws NotificationException {
        WatcherConfig config = configSupplier.get();
        String subject = formatter.recoverySubject(recovery);
        String body = formatter.recoveryBody(recovery, config.baseUrl());
        deliver(config, subject, body);
        logger.info("Recovery email sent: {}", subject);
    }

    private void deliver(WatcherConfig config, String subject, String body) throws NotificationException {
        SmtpSettings smtp = config.smtp()
                .orElseThrow(() -> new NotificationException("E-mail delivery is not configured"));
        try {
            MimeMessage message = createMessage(smtp, subject, body);
            transport.send(message);
        } catch (MessagingException e) {
            throw new NotificationException("Failed to send email '" + subject + "' via " + smtp.host() + ":"
                    + smtp.port(), e);
        }
    }

    /**
     * Builds the message and its SMTP session.
     */
    MimeMessage createMessage(SmtpSettings smtp, String subject, String body) throws MessagingException {
        Session session = Session.getInstance(sessionProperties(smtp), new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(smtp.sender(), smtp.password());
            }
        });
        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(smtp.sender()));
        for (String recipient : smtp.recipients()) {
            message.addRecipient(Message.RecipientType.TO, new InternetAddress(recipient));
        }
        message.setSubject(subject, StandardCharsets.UTF_8.name());
        message.setText(body, StandardCharsets.UTF_8.name());
        message.setSentDate(new Date());
        return message;
    }

    static Properties sessionProperties(SmtpSettings smtp) {
        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", smtp.host());
        props.put("mail.smtp.port", String.valueOf(smtp.port()));
        props.put("mail.smtp.auth", "true");
        props.put("mail.smtp.starttls.enable", String.valueOf(smtp.useTls()));
        props.put("mail.smtp.starttls.required", String.valueOf(smtp.useTls()));
        return props;
    }
}
