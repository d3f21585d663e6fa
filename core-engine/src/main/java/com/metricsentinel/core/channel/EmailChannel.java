package com.metricsentinel.core.channel;

import com.metricsentinel.core.model.NotificationPayload;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * E-mail channel over SMTP (Jakarta Mail).
 *
 * <p>
 * The destination is a comma separated list of recipients. Malformed or
 * rejected recipients are permanent failures; connection and server errors
 * are transient.
 * </p>
 *
 * @since 1.0.0
 */
public class EmailChannel implements NotificationChannel {

    private static final Logger LOG = LoggerFactory.getLogger(EmailChannel.class);

    public static final String NAME = "email";

    /**
     * Hands a finished message to the mail system.
     */
    @FunctionalInterface
    public interface MailTransport {
        void send(Message message) throws MessagingException;
    }

    private final Session session;
    private final InternetAddress from;
    private final MailTransport transport;

    public EmailChannel(Session session, String from, MailTransport transport) {
        this.session = Objects.requireNonNull(session, "session must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        try {
            this.from = new InternetAddress(Objects.requireNonNull(from, "from must not be null"), true);
        } catch (AddressException e) {
            throw new IllegalArgumentException("Invalid sender address: " + from, e);
        }
    }

    /**
     * @param smtpHost SMTP relay host
     * @param smtpPort SMTP relay port
     * @param from     sender address
     */
    public static EmailChannel smtp(String smtpHost, int smtpPort, String from) {
        Properties props = new Properties();
        props.put("mail.smtp.host", smtpHost);
        props.put("mail.smtp.port", String.valueOf(smtpPort));
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "10000");
        return new EmailChannel(Session.getInstance(props), from, Transport::send);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public SendResult send(String destination, NotificationPayload payload) {
        Address[] recipients;
        try {
            recipients = InternetAddress.parse(Objects.requireNonNull(destination, "destination"), true);
            if (recipients.length == 0) {
                return SendResult.permanentFailure("No recipients in destination");
            }
        } catch (AddressException | NullPointerException e) {
            return SendResult.permanentFailure("Invalid recipients '" + destination + "': " + e.getMessage());
        }

        try {
            MimeMessage message = new MimeMessage(session);
            message.setFrom(from);
            message.setRecipients(Message.RecipientType.TO, recipients);
            message.setSubject(payload.getTitle(), StandardCharsets.UTF_8.name());
            message.setText(renderBody(payload), StandardCharsets.UTF_8.name());
            Instant created = payload.getCreatedAt() != null ? payload.getCreatedAt() : Instant.now();
            message.setSentDate(Date.from(created));
            transport.send(message);
            return SendResult.success();
        } catch (SendFailedException e) {
            Address[] invalid = e.getInvalidAddresses();
            if (invalid != null && invalid.length > 0) {
                LOG.error("Mail rejected for {} recipient(s): {}", invalid.length, e.getMessage());
                return SendResult.permanentFailure("Rejected recipients: " + e.getMessage());
            }
            return SendResult.transientFailure("Send failed: " + e.getMessage());
        } catch (MessagingException e) {
            LOG.warn("Mail transport error: {}", e.getMessage());
            return SendResult.transientFailure("Mail transport error: " + e.getMessage());
        }
    }

    static String renderBody(NotificationPayload payload) {
        StringBuilder body = new StringBuilder();
        body.append(payload.getMessage() != null ? payload.getMessage() : payload.getTitle()).append("\n\n");
        if (payload.getEntityId() != null) {
            body.append("Entity: ").append(payload.getEntityId()).append('\n');
        }
        if (payload.getMetric() != null) {
            body.append("Metric: ").append(payload.getMetric()).append('\n');
        }
        body.append("Severity: ").append(payload.getSeverity()).append('\n');
        if (payload.getMetrics() != null) {
            for (Map.Entry<String, Object> e : payload.getMetrics().entrySet()) {
                body.append(e.getKey()).append(": ").append(e.getValue()).append('\n');
            }
        }
        return body.toString();
    }
}
