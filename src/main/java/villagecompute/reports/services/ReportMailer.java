/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.services;

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.jboss.logging.Logger;

import jakarta.activation.DataHandler;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.util.ByteArrayDataSource;
import villagecompute.reports.api.types.RecipientsType;
import villagecompute.reports.api.types.SmtpConfigType;

/**
 * Delivers report PDFs through each tenant's own SMTP server.
 *
 * <p>
 * <b>Transport security:</b>
 * <ul>
 * <li>port 465 uses implicit TLS</li>
 * <li>any other port uses STARTTLS when {@code use_tls} is set (the default)</li>
 * <li>{@code skip_tls_verify} trusts any server certificate</li>
 * </ul>
 * Authentication is used only when a username is configured.
 */
@ApplicationScoped
public class ReportMailer {

    private static final Logger LOG = Logger.getLogger(ReportMailer.class);

    static final int IMPLICIT_TLS_PORT = 465;
    static final String TIMEOUT_MILLIS = "30000";

    /**
     * Sends one message with the PDF attached to all to/cc/bcc recipients.
     *
     * @throws MessagingException
     *             on address, connection, authentication or delivery failure
     */
    public void sendReport(SmtpConfigType smtp, RecipientsType recipients, String subject, String body,
            byte[] attachment, String filename) throws MessagingException {
        if (recipients == null || recipients.isEmpty()) {
            throw new MessagingException("no recipients configured");
        }
        Session session = Session.getInstance(sessionProperties(smtp));

        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(smtp.from()));
        message.setRecipients(Message.RecipientType.TO, toAddresses(recipients.to()));
        message.setRecipients(Message.RecipientType.CC, toAddresses(recipients.cc()));
        message.setRecipients(Message.RecipientType.BCC, toAddresses(recipients.bcc()));
        message.setSubject(subject, "UTF-8");

        MimeBodyPart text = new MimeBodyPart();
        text.setText(body, "UTF-8");

        MimeBodyPart pdf = new MimeBodyPart();
        pdf.setDataHandler(new DataHandler(new ByteArrayDataSource(attachment, "application/pdf")));
        pdf.setFileName(filename);

        MimeMultipart multipart = new MimeMultipart();
        multipart.addBodyPart(text);
        multipart.addBodyPart(pdf);
        message.setContent(multipart);

        if (hasCredentials(smtp)) {
            Transport.send(message, smtp.username(), smtp.password());
        } else {
            Transport.send(message);
        }
        LOG.infof("Sent report %s (%d bytes) via %s:%d to %d recipients", filename, attachment.length, smtp.host(),
                smtp.effectivePort(), recipients.all().size());
    }

    /**
     * Opens and closes an SMTP connection to verify host, port, TLS and credentials.
     *
     * @throws MessagingException
     *             if the server cannot be reached or rejects the credentials
     */
    public void testConnection(SmtpConfigType smtp) throws MessagingException {
        Session session = Session.getInstance(sessionProperties(smtp));
        try (Transport transport = session.getTransport("smtp")) {
            if (hasCredentials(smtp)) {
                transport.connect(smtp.host(), smtp.effectivePort(), smtp.username(), smtp.password());
            } else {
                transport.connect(smtp.host(), smtp.effectivePort(), null, null);
            }
            LOG.infof("SMTP connection test succeeded for %s:%d", smtp.host(), smtp.effectivePort());
        }
    }

    Properties sessionProperties(SmtpConfigType smtp) {
        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", smtp.host());
        props.put("mail.smtp.port", String.valueOf(smtp.effectivePort()));
        props.put("mail.smtp.auth", String.valueOf(hasCredentials(smtp)));
        props.put("mail.smtp.connectiontimeout", TIMEOUT_MILLIS);
        props.put("mail.smtp.timeout", TIMEOUT_MILLIS);
        props.put("mail.smtp.writetimeout", TIMEOUT_MILLIS);
        if (smtp.effectivePort() == IMPLICIT_TLS_PORT) {
            props.put("mail.smtp.ssl.enable", "true");
        } else if (smtp.tlsEnabled()) {
            props.put("mail.smtp.starttls.enable", "true");
        }
        if (smtp.tlsVerificationSkipped()) {
            props.put("mail.smtp.ssl.trust", "*");
            props.put("mail.smtp.ssl.checkserveridentity", "false");
        }
        return props;
    }

    private static boolean hasCredentials(SmtpConfigType smtp) {
        return smtp.username() != null && !smtp.username().isBlank();
    }

    private static InternetAddress[] toAddresses(List<String> emails) throws AddressException {
        List<InternetAddress> addresses = new ArrayList<>(emails.size());
        for (String email : emails) {
            if (email != null && !email.isBlank()) {
                addresses.add(new InternetAddress(email.trim(), true));
            }
        }
        return addresses.toArray(new InternetAddress[0]);
    }
}
