package com.appmonitor.collector.scheduler;

import com.appmonitor.collector.model.ScheduleFrequency;
import com.appmonitor.collector.model.TaskSchedule;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleMatcherTest {

    @Test
    void testWeeklyScheduleMatchesOncePerWeek() {
        // Given: Wednesday (weekday 2) at 03:30
        TaskSchedule schedule = schedule(ScheduleFrequency.WEEKLY, 3, 30);
        schedule.setWeekday(2);
        LocalDateTime start = LocalDateTime.of(2024, 5, 6, 0, 0); // a Monday

        // When
        int matches = 0;
        LocalDateTime matchedAt = null;
        for (LocalDateTime t = start; t.isBefore(start.plusWeeks(1)); t = t.plusMinutes(1)) {
            if (ScheduleMatcher.matches(schedule, t)) {
                matches++;
                matchedAt = t;
            }
        }

        // Then
        assertEquals(1, matches);
        assertEquals(DayOfWeek.WEDNESDAY, matchedAt.getDayOfWeek());
        assertEquals(3, matchedAt.getHour());
        assertEquals(30, matchedAt.getMinute());
    }

    @Test
    void testDailyMatchesHourAndMinuteOnly() {
        TaskSchedule schedule = schedule(ScheduleFrequency.DAILY, 9, 0);
        assertTrue(ScheduleMatcher.matches(schedule, LocalDateTime.of(2024, 5, 6, 9, 0)));
        assertTrue(ScheduleMatcher.matches(schedule, LocalDateTime.of(2024, 5, 12, 9, 0)));
        assertFalse(ScheduleMatcher.matches(schedule, LocalDateTime.of(2024, 5, 6, 9, 1)));
    }

    @Test
    void testMonthlyDefaultsToFirstDay() {
        TaskSchedule schedule = schedule(ScheduleFrequency.MONTHLY, 6, 15);
        assertTrue(ScheduleMatcher.matches(schedule, LocalDateTime.of(2024, 6, 1, 6, 15)));
        assertFalse(ScheduleMatcher.matches(schedule, LocalDateTime.of(2024, 6, 2, 6, 15)));

        schedule.setDayOfMonth(15);
        assertTrue(ScheduleMatcher.matches(schedule, LocalDateTime.of(2024, 6, 15, 6, 15)));
    }

    @Test
    void testWeeklyWithoutWeekdayMeansMonday() {
        TaskSchedule schedule = schedule(ScheduleFrequency.WEEKLY, 8, 0);
        assertTrue(ScheduleMatcher.matches(schedule, LocalDateTime.of(2024, 5, 6, 8, 0)));
        assertFalse(ScheduleMatcher.matches(schedule, LocalDateTime.of(2024, 5, 7, 8, 0)));
    }

    private static TaskSchedule schedule(ScheduleFrequency frequency, int hour, int minute) {
        return TaskSchedule.builder()
                .id(1L)
                .name("test")
                .frequency(frequency)
                .hour(hour)
                .minute(minute)
                .active(true)
                .build();
    }
}
