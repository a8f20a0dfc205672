package villagecompute.reports.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Properties;

import org.junit.jupiter.api.Test;

import villagecompute.reports.api.types.SmtpConfigType;

/**
 * Unit tests for SMTP session setup in {@link ReportMailer}.
 */
class ReportMailerTest {

    private final ReportMailer mailer = new ReportMailer();

    @Test
    void testStartTlsOnSubmissionPort() {
        Properties props = mailer.sessionProperties(
                new SmtpConfigType("smtp.example.com", null, "reports", "secret", "r@example.com", null, null));

        assertEquals("587", props.getProperty("mail.smtp.port"));
        assertEquals("true", props.getProperty("mail.smtp.auth"));
        assertEquals("true", props.getProperty("mail.smtp.starttls.enable"));
        assertNull(props.getProperty("mail.smtp.ssl.enable"));
        assertNull(props.getProperty("mail.smtp.ssl.trust"));
    }

    @Test
    void testImplicitTlsOnPort465() {
        Properties props = mailer.sessionProperties(
                new SmtpConfigType("smtp.example.com", 465, null, null, "r@example.com", true, true));

        assertEquals("true", props.getProperty("mail.smtp.ssl.enable"));
        assertEquals("false", props.getProperty("mail.smtp.auth"));
        assertEquals("*", props.getProperty("mail.smtp.ssl.trust"));
    }

    @Test
    void testPlainWhenTlsDisabled() {
        Properties props = mailer.sessionProperties(
                new SmtpConfigType("localhost", 25, null, null, "r@example.com", false, false));

        assertNull(props.getProperty("mail.smtp.starttls.enable"));
        assertEquals("30000", props.getProperty("mail.smtp.timeout"));
    }
}
