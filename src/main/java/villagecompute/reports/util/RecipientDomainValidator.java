package villagecompute.reports.util;

import java.util.List;
import java.util.Locale;

import villagecompute.reports.api.types.RecipientsType;
import villagecompute.reports.exceptions.ValidationException;

/**
 * Checks report recipients against a tenant's domain whitelist.
 *
 * <p>
 * <b>Whitelist entries:</b>
 * <ul>
 * <li>{@code example.com} - matches exactly {@code example.com}</li>
 * <li>{@code *.example.com} - matches {@code example.com} and any subdomain at any depth</li>
 * </ul>
 * Matching is case-insensitive. An empty whitelist allows every domain.
 *
 * <pre>
 * RecipientDomainValidator.validate(schedule.recipients, limits.allowedDomains());
 * </pre>
 */
public final class RecipientDomainValidator {

    private RecipientDomainValidator() {
    }

    /**
     * @throws ValidationException
     *             on the first malformed address or the first address whose domain is not whitelisted
     */
    public static void validate(RecipientsType recipients, List<String> allowedDomains) {
        if (recipients == null || allowedDomains == null || allowedDomains.isEmpty()) {
            return;
        }
        for (String raw : recipients.all()) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String email = raw.trim();
            String domain = domainOf(email);
            if (!isAllowed(domain, allowedDomains)) {
                throw new ValidationException("email domain '" + domain + "' is not in the allowed domains list");
            }
        }
    }

    /**
     * Validates recipient count against a tenant limit; non-positive limits disable the check.
     */
    public static void validateCount(RecipientsType recipients, Integer maxRecipients) {
        if (recipients == null || maxRecipients == null || maxRecipients <= 0) {
            return;
        }
        long count = recipients.all().stream().filter(r -> r != null && !r.isBlank()).count();
        if (count > maxRecipients) {
            throw new ValidationException(
                    "too many recipients: " + count + " (maximum " + maxRecipients + ")");
        }
    }

    static String domainOf(String email) {
        String[] parts = email.split("@", -1);
        if (parts.length != 2 || parts[0].isEmpty() || parts[1].isEmpty()) {
            throw new ValidationException("invalid email address format: " + email);
        }
        return parts[1].toLowerCase(Locale.ROOT);
    }

    static boolean isAllowed(String domain, List<String> allowedDomains) {
        for (String entry : allowedDomains) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            String allowed = entry.trim().toLowerCase(Locale.ROOT);
            if (allowed.startsWith("*.")) {
                String base = allowed.substring(2);
                if (domain.equals(base) || domain.endsWith("." + base)) {
                    return true;
                }
            } else if (domain.equals(allowed)) {
                return true;
            }
        }
        return false;
    }
}
