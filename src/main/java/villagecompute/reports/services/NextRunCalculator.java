/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.reports.services;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import jakarta.enterprise.context.ApplicationScoped;
import villagecompute.reports.data.models.ReportSchedule;
import villagecompute.reports.exceptions.ValidationException;

/**
 * Computes when a schedule should fire next.
 *
 * <p>
 * Evaluation steps:
 * <ol>
 * <li>load the schedule's IANA zone, falling back to UTC (logged) when unknown</li>
 * <li>take the current instant in that zone</li>
 * <li>resolve the effective 5-field UNIX expression ({@code cronExpr}, else derived from {@code intervalType})</li>
 * <li>find the first matching wall-clock time strictly after now, honoring DST transitions</li>
 * <li>return it as a UTC instant truncated to whole seconds</li>
 * </ol>
 * An expression that cannot be parsed yields now plus one hour so the schedule keeps being retried.
 *
 * <p>
 * The standard descriptors {@code @yearly}, {@code @annually}, {@code @monthly}, {@code @weekly}, {@code @daily},
 * {@code @midnight} and {@code @hourly} are accepted as aliases.
 */
@ApplicationScoped
public class NextRunCalculator {

    private static final Logger LOG = Logger.getLogger(NextRunCalculator.class);

    public static final String DAILY_CRON = "0 0 * * *";
    public static final String WEEKLY_CRON = "0 0 * * 1";
    public static final String MONTHLY_CRON = "0 0 1 * *";

    static final Duration PARSE_FAILURE_DELAY = Duration.ofHours(1);

    private static final Map<String, String> DESCRIPTORS = Map.of("@yearly", "0 0 1 1 *", "@annually", "0 0 1 1 *",
            "@monthly", MONTHLY_CRON, "@weekly", "0 0 * * 0", "@daily", DAILY_CRON, "@midnight", DAILY_CRON, "@hourly",
            "0 * * * *");

    private static final CronParser PARSER = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    Clock clock = Clock.systemUTC();

    public Instant calculateNextRun(ReportSchedule schedule) {
        return calculateNextRun(schedule.cronExpr, schedule.intervalType, schedule.timezone);
    }

    /**
     * @param cronExpr
     *            explicit expression, may be blank
     * @param intervalType
     *            {@code daily}, {@code weekly}, {@code monthly} or {@code cron}; used when {@code cronExpr} is blank
     * @param timezone
     *            IANA zone name
     * @return next fire time in UTC, never in the past
     */
    public Instant calculateNextRun(String cronExpr, String intervalType, String timezone) {
        ZoneId zone = resolveZone(timezone);
        ZonedDateTime now = ZonedDateTime.ofInstant(clock.instant(), zone);
        String expression = effectiveCronExpression(cronExpr, intervalType);

        Optional<ZonedDateTime> next;
        try {
            next = ExecutionTime.forCron(parse(expression)).nextExecution(now);
        } catch (IllegalArgumentException e) {
            LOG.warnf("Cannot parse cron expression '%s', retrying in %s: %s", expression, PARSE_FAILURE_DELAY,
                    e.getMessage());
            return now.toInstant().plus(PARSE_FAILURE_DELAY).truncatedTo(ChronoUnit.SECONDS);
        }

        if (next.isEmpty()) {
            LOG.warnf("Cron expression '%s' has no upcoming execution, retrying in %s", expression,
                    PARSE_FAILURE_DELAY);
            return now.toInstant().plus(PARSE_FAILURE_DELAY).truncatedTo(ChronoUnit.SECONDS);
        }
        return next.get().withZoneSameInstant(ZoneOffset.UTC).toInstant().truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Returns {@code cronExpr} when present, otherwise the expression implied by {@code intervalType}. Unknown interval
     * types run daily.
     */
    public static String effectiveCronExpression(String cronExpr, String intervalType) {
        if (cronExpr != null && !cronExpr.isBlank()) {
            return cronExpr.trim();
        }
        String interval = intervalType == null ? "" : intervalType.trim().toLowerCase(Locale.ROOT);
        return switch (interval) {
            case ReportSchedule.INTERVAL_WEEKLY -> WEEKLY_CRON;
            case ReportSchedule.INTERVAL_MONTHLY -> MONTHLY_CRON;
            case ReportSchedule.INTERVAL_DAILY -> DAILY_CRON;
            default -> {
                LOG.debugf("Unknown interval type '%s', defaulting to daily", intervalType);
                yield DAILY_CRON;
            }
        };
    }

    /**
     * Loads an IANA zone, or UTC when the name is blank or unknown.
     */
    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            LOG.warnf("Invalid timezone '%s', using UTC: %s", timezone, e.getMessage());
            return ZoneOffset.UTC;
        }
    }

    /**
     * Rejects blank or unparseable expressions.
     *
     * @throws ValidationException
     *             describing the problem
     */
    public static void validateCronExpression(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) {
            throw new ValidationException("cron expression cannot be empty");
        }
        try {
            parse(cronExpr.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid cron expression: " + e.getMessage(), e);
        }
    }

    private static Cron parse(String expression) {
        String normalized = DESCRIPTORS.getOrDefault(expression.toLowerCase(Locale.ROOT), expression);
        return PARSER.parse(normalized).validate();
    }
}
