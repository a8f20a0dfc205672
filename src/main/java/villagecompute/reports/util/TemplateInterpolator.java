package villagecompute.reports.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import villagecompute.reports.data.models.ReportSchedule;

/**
 * Expands {@code {{name}}} placeholders in report email subjects and bodies.
 *
 * <p>
 * <b>Supported variables:</b>
 * <ul>
 * <li>{@code {{schedule.name}}}</li>
 * <li>{@code {{dashboard.title}}}</li>
 * <li>{@code {{timerange}}} - {@code "<from> to <to>"}</li>
 * <li>{@code {{run.started_at}}} - RFC 1123 time in UTC</li>
 * </ul>
 * Unknown placeholders are left as written.
 */
public final class TemplateInterpolator {

    public static final String DEFAULT_SUBJECT = "Report: {{schedule.name}}";

    public static final String DEFAULT_BODY = "Please find attached the {{dashboard.title}} report for {{timerange}}.";

    private static final DateTimeFormatter RFC_1123 = DateTimeFormatter
            .ofPattern("EEE, dd MMM yyyy HH:mm:ss zzz", Locale.ENGLISH).withZone(ZoneId.of("UTC"));

    private TemplateInterpolator() {
    }

    public static Map<String, String> variablesFor(ReportSchedule schedule, Instant runStartedAt) {
        Map<String, String> vars = new LinkedHashMap<>();
        vars.put("schedule.name", nullToEmpty(schedule.name));
        vars.put("dashboard.title", nullToEmpty(schedule.dashboardTitle));
        vars.put("timerange", nullToEmpty(schedule.rangeFrom) + " to " + nullToEmpty(schedule.rangeTo));
        vars.put("run.started_at", runStartedAt == null ? "" : RFC_1123.format(runStartedAt));
        return vars;
    }

    public static String interpolate(String template, Map<String, String> vars) {
        if (template == null || template.isEmpty()) {
            return "";
        }
        String result = template;
        for (Map.Entry<String, String> entry : vars.entrySet()) {
            result = result.replace("{{" + entry.getKey() + "}}", entry.getValue());
        }
        return result;
    }

    public static String subject(ReportSchedule schedule, Map<String, String> vars) {
        return interpolate(isBlank(schedule.emailSubject) ? DEFAULT_SUBJECT : schedule.emailSubject, vars);
    }

    public static String body(ReportSchedule schedule, Map<String, String> vars) {
        return interpolate(isBlank(schedule.emailBody) ? DEFAULT_BODY : schedule.emailBody, vars);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
