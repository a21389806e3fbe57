package com.jobgrid.scheduling;

import com.jobgrid.JobValidationException;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CrontabScheduleTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void shouldFireAtNextMatchingMinute() {
        CrontabSchedule schedule = CrontabSchedule.parse("0 2 * * *", UTC);

        assertEquals(OffsetDateTime.parse("2024-01-02T02:00:00Z"),
                schedule.nextFireTime(OffsetDateTime.parse("2024-01-01T03:00:00Z")));
    }

    @Test
    void shouldSupportStepsAndRanges() {
        CrontabSchedule schedule = CrontabSchedule.parse("*/15 8-17 * * *", UTC);

        assertEquals(OffsetDateTime.parse("2024-01-01T10:15:00Z"),
                schedule.nextFireTime(OffsetDateTime.parse("2024-01-01T10:07:00Z")));
        assertEquals(OffsetDateTime.parse("2024-01-02T08:00:00Z"),
                schedule.nextFireTime(OffsetDateTime.parse("2024-01-01T17:45:00Z")));
    }

    @Test
    void shouldTreatZeroAsSunday() {
        CrontabSchedule schedule = CrontabSchedule.parse("0 12 * * 0", UTC);

        // 2024-01-08 is a Monday
        assertEquals(OffsetDateTime.parse("2024-01-14T12:00:00Z"),
                schedule.nextFireTime(OffsetDateTime.parse("2024-01-08T00:00:00Z")));
    }

    @Test
    void shouldAcceptWeekdayAndMonthNames() {
        CrontabSchedule schedule = CrontabSchedule.parse("30 9 * jan mon-fri", UTC);

        // 2024-01-06 is a Saturday
        assertEquals(OffsetDateTime.parse("2024-01-08T09:30:00Z"),
                schedule.nextFireTime(OffsetDateTime.parse("2024-01-06T00:00:00Z")));
    }

    @Test
    void shouldEvaluateInScheduleTimeZone() {
        CrontabSchedule schedule = CrontabSchedule.parse("0 9 * * *", ZoneId.of("Europe/Berlin"));

        OffsetDateTime next = schedule.nextFireTime(OffsetDateTime.parse("2024-01-01T00:00:00Z"));

        assertThat(next).isEqualTo(OffsetDateTime.parse("2024-01-01T09:00:00+01:00"));
        assertThat(next.isEqual(OffsetDateTime.parse("2024-01-01T08:00:00Z"))).isTrue();
    }

    @Test
    void shouldRejectOutOfRangeMinute() {
        JobValidationException exception = assertThrows(JobValidationException.class,
                () -> CrontabSchedule.parse("61 * * * *", UTC));
        assertEquals("crontab", exception.getField());
    }

    @Test
    void shouldRejectWrongFieldCount() {
        assertThrows(JobValidationException.class, () -> CrontabSchedule.parse("* * * *", UTC));
        assertThrows(JobValidationException.class, () -> CrontabSchedule.parse("0 * * * * *", UTC));
        assertThrows(JobValidationException.class, () -> CrontabSchedule.parse("  ", UTC));
    }

    @Test
    void shouldRejectUnsupportedSyntax() {
        assertThrows(JobValidationException.class, () -> CrontabSchedule.parse("0 0 L * *", UTC));
        assertThrows(JobValidationException.class, () -> CrontabSchedule.parse("0 0 ? * *", UTC));
        assertThrows(JobValidationException.class, () -> CrontabSchedule.parse("0 0 * * funday", UTC));
        assertThrows(JobValidationException.class, () -> CrontabSchedule.parse("0 mon * * *", UTC));
    }

    @Test
    void shouldExposeFiveFieldExpression() {
        CrontabSchedule schedule = CrontabSchedule.of("5", "4", "*", "*", "1", UTC);

        assertEquals("5 4 * * 1", schedule.expression());
        assertEquals("1", schedule.getDayOfWeek());
    }
}
