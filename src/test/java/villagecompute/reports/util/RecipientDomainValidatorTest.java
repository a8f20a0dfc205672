package villagecompute.reports.util;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import villagecompute.reports.api.types.RecipientsType;
import villagecompute.reports.exceptions.ValidationException;

/**
 * Unit tests for {@link RecipientDomainValidator}.
 */
class RecipientDomainValidatorTest {

    @Test
    void testEmptyWhitelistAllowsEverything() {
        RecipientsType recipients = new RecipientsType(List.of("a@anywhere.org"), null, null);

        assertDoesNotThrow(() -> RecipientDomainValidator.validate(recipients, List.of()));
    }

    @Test
    void testExactDomainMatchIsCaseInsensitive() {
        assertTrue(RecipientDomainValidator.isAllowed("example.com", List.of("Example.COM")));
        assertFalse(RecipientDomainValidator.isAllowed("mail.example.com", List.of("example.com")));
    }

    @Test
    void testWildcardMatchesBaseAndSubdomains() {
        List<String> allowed = List.of("*.example.com");

        assertTrue(RecipientDomainValidator.isAllowed("example.com", allowed));
        assertTrue(RecipientDomainValidator.isAllowed("eu.mail.example.com", allowed));
        assertFalse(RecipientDomainValidator.isAllowed("badexample.com", allowed));
    }

    @Test
    void testCcAndBccAreChecked() {
        RecipientsType recipients = new RecipientsType(List.of("ops@example.com"), List.of(),
                List.of("leak@competitor.io"));

        ValidationException e = assertThrows(ValidationException.class,
                () -> RecipientDomainValidator.validate(recipients, List.of("example.com")));
        assertEquals("email domain 'competitor.io' is not in the allowed domains list", e.getMessage());
    }

    @Test
    void testMalformedAddressRejected() {
        RecipientsType recipients = new RecipientsType(List.of("ops.example.com"), null, null);

        ValidationException e = assertThrows(ValidationException.class,
                () -> RecipientDomainValidator.validate(recipients, List.of("example.com")));
        assertEquals("invalid email address format: ops.example.com", e.getMessage());
    }

    @Test
    void testValidateCount() {
        RecipientsType recipients = new RecipientsType(List.of("a@x.com", "b@x.com"), List.of("c@x.com"), null);

        assertThrows(ValidationException.class, () -> RecipientDomainValidator.validateCount(recipients, 2));
        assertDoesNotThrow(() -> RecipientDomainValidator.validateCount(recipients, 3));
        assertDoesNotThrow(() -> RecipientDomainValidator.validateCount(recipients, 0));
    }
}
