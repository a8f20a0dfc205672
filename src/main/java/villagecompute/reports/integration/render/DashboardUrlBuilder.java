package villagecompute.reports.integration.render;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import villagecompute.reports.api.types.DashboardVariableType;
import villagecompute.reports.data.models.ReportSchedule;

/**
 * Builds the kiosk-mode dashboard URL a renderer navigates to.
 *
 * <p>
 * Format: {@code <base>/d/<uid>?from=..&kiosk=1&theme=light&to=..&tz=..&var-<name>=..}. Any sub-path of the base URL
 * is preserved, query keys are sorted, and repeated variable names keep every value in their original order.
 */
public final class DashboardUrlBuilder {

    private DashboardUrlBuilder() {
    }

    public static String build(String baseUrl, ReportSchedule schedule) {
        URI base = validateBaseUrl(baseUrl);

        String basePath = base.getRawPath() == null ? "" : base.getRawPath();
        while (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }

        Map<String, List<String>> query = new TreeMap<>();
        put(query, "from", schedule.rangeFrom);
        put(query, "to", schedule.rangeTo);
        put(query, "kiosk", "1");
        put(query, "theme", "light");
        if (schedule.timezone != null && !schedule.timezone.isBlank()) {
            put(query, "tz", schedule.timezone);
        }
        if (schedule.variables != null) {
            for (DashboardVariableType variable : schedule.variables) {
                put(query, "var-" + variable.name(), variable.value());
            }
        }

        StringBuilder url = new StringBuilder();
        url.append(base.getScheme()).append("://").append(base.getRawAuthority()).append(basePath).append("/d/")
                .append(encode(schedule.dashboardUid));
        char separator = '?';
        for (Map.Entry<String, List<String>> entry : query.entrySet()) {
            for (String value : entry.getValue()) {
                url.append(separator).append(encode(entry.getKey())).append('=').append(encode(value));
                separator = '&';
            }
        }
        return url.toString();
    }

    /**
     * Parses a dashboard host URL.
     *
     * @throws IllegalArgumentException
     *             if the URL is blank, malformed or not absolute
     */
    public static URI validateBaseUrl(String baseUrl) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("dashboard base URL is not configured");
        }
        URI base;
        try {
            base = URI.create(baseUrl.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid dashboard base URL: " + baseUrl, e);
        }
        if (base.getScheme() == null || base.getHost() == null) {
            throw new IllegalArgumentException("dashboard base URL must be absolute: " + baseUrl);
        }
        return base;
    }

    private static void put(Map<String, List<String>> query, String key, String value) {
        query.computeIfAbsent(key, k -> new ArrayList<>()).add(value == null ? "" : value);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
