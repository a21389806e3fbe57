package com.jobgrid.scheduling;

import com.jobgrid.JobValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Five-field crontab ({@code minute hour day-of-month month day-of-week}) evaluated in a time zone.
 * Day of week counts from 0 = Sunday. Only {@code *}, {@code ,}, {@code -}, {@code /}, numbers and
 * month or weekday names are accepted.
 */
public final class CrontabSchedule implements JobSchedule {

    private static final Pattern NUMERIC_FIELD = Pattern.compile("[0-9*,/\\-]+");
    private static final Pattern NAMED_FIELD = Pattern.compile("[0-9A-Za-z*,/\\-]+");
    private static final Pattern NAME = Pattern.compile("[A-Za-z]+");
    private static final Set<String> MONTH_NAMES = Set.of(
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec");
    private static final Set<String> DAY_NAMES = Set.of("sun", "mon", "tue", "wed", "thu", "fri", "sat");

    private final String minute;
    private final String hour;
    private final String dayOfMonth;
    private final String monthOfYear;
    private final String dayOfWeek;
    private final ZoneId zone;
    private final CronExpression cron;

    private CrontabSchedule(String minute, String hour, String dayOfMonth, String monthOfYear, String dayOfWeek,
            ZoneId zone) {
        this.minute = minute;
        this.hour = hour;
        this.dayOfMonth = dayOfMonth;
        this.monthOfYear = monthOfYear;
        this.dayOfWeek = dayOfWeek;
        this.zone = zone;
        String expression = expression();
        try {
            this.cron = CronExpression.parse("0 " + expression);
        } catch (IllegalArgumentException e) {
            throw new JobValidationException("crontab", "Invalid crontab '" + expression + "': " + e.getMessage(), e);
        }
    }

    public static CrontabSchedule of(String minute, String hour, String dayOfMonth, String monthOfYear,
            String dayOfWeek, ZoneId zone) {
        return new CrontabSchedule(minute, hour, dayOfMonth, monthOfYear, dayOfWeek, zone);
    }

    /**
     * Parses a five-field crontab.
     *
     * @throws JobValidationException if the crontab is malformed
     */
    public static CrontabSchedule parse(String crontab, ZoneId zone) {
        if (crontab == null || crontab.isBlank()) {
            throw new JobValidationException("crontab", "Please enter a valid crontab.");
        }
        String[] fields = crontab.trim().split("\\s+");
        if (fields.length != 5) {
            throw new JobValidationException("crontab",
                    "Crontab '" + crontab + "' must have 5 fields (minute hour day-of-month month day-of-week), got "
                            + fields.length);
        }
        validateField(fields[0], "minute", null);
        validateField(fields[1], "hour", null);
        validateField(fields[2], "day of month", null);
        validateField(fields[3], "month", MONTH_NAMES);
        validateField(fields[4], "day of week", DAY_NAMES);
        return new CrontabSchedule(fields[0], fields[1], fields[2], fields[3], fields[4], zone);
    }

    private static void validateField(String value, String fieldName, Set<String> names) {
        Pattern allowed = names == null ? NUMERIC_FIELD : NAMED_FIELD;
        if (!allowed.matcher(value).matches()) {
            throw new JobValidationException("crontab", "Unsupported " + fieldName + " field '" + value + "'");
        }
        if (names == null) {
            return;
        }
        Matcher matcher = NAME.matcher(value);
        while (matcher.find()) {
            if (!names.contains(matcher.group().toLowerCase(Locale.ROOT))) {
                throw new JobValidationException("crontab", "Unsupported " + fieldName + " field '" + value + "'");
            }
        }
    }

    @Override
    public OffsetDateTime nextFireTime(OffsetDateTime after) {
        ZonedDateTime from = after == null ? ZonedDateTime.now(zone) : after.atZoneSameInstant(zone);
        ZonedDateTime next = cron.next(from);
        return next == null ? null : next.toOffsetDateTime();
    }

    /**
     * The five-field form of this schedule.
     */
    public String expression() {
        return String.join(" ", minute, hour, dayOfMonth, monthOfYear, dayOfWeek);
    }

    public String getMinute() {
        return minute;
    }

    public String getHour() {
        return hour;
    }

    public String getDayOfMonth() {
        return dayOfMonth;
    }

    public String getMonthOfYear() {
        return monthOfYear;
    }

    public String getDayOfWeek() {
        return dayOfWeek;
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public String toString() {
        return expression() + " (" + zone + ")";
    }
}
