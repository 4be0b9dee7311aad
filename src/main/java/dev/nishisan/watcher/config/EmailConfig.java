package dev.nishisan.watcher.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * SMTP delivery settings, deserialized from the {@code email} section.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmailConfig implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    private boolean enabled = true;

    @JsonProperty("smtp_server")
    private String smtpServer;

    @JsonProperty("smtp_port")
    private Integer smtpPort;

    @JsonProperty("use_tls")
    private boolean useTls = true;

    @JsonProperty("sender_email")
    private String senderEmail;

    @JsonProperty("sender_password")
    private String senderPassword;

    @JsonProperty("recipient_emails")
    private List<String> recipientEmails;

    public EmailConfig() {
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSmtpServer() {
        return smtpServer;
    }

    public void setSmtpServer(String smtpServer) {
        this.smtpServer = smtpServer;
    }

    public Integer getSmtpPort() {
        return smtpPort;
    }

    public void setSmtpPort(Integer smtpPort) {
        this.smtpPort = smtpPort;
    }

    public boolean isUseTls() {
        return useTls;
    }

    public void setUseTls(boolean useTls) {
        this.useTls = useTls;
    }

    public String getSenderEmail() {
        return senderEmail;
    }

    public void setSenderEmail(String senderEmail) {
        this.senderEmail = senderEmail;
    }

    public String getSenderPassword() {
        return senderPassword;
    }

    public void setSenderPassword(String senderPassword) {
        this.senderPassword = senderPassword;
    }

    public List<String> getRecipientEmails() {
        return recipientEmails;
    }

    public void setRecipientEmails(List<String> recipientEmails) {
        this.recipientEmails = recipientEmails;
    }
}
