package com.toolstock.notifier.hours;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

import static org.assertj.core.api.Assertions.*;

class BusinessHoursOracleTest {

    private static final ReplyTemplates TEMPLATES =
            new ReplyTemplates("H:{holidayName}|{nextBusinessDay}", "W:{nextBusinessDay}", "O");

    private static BusinessHoursConfig.Builder office() {
        final BusinessHoursConfig.Builder b = BusinessHoursConfig.builder().templates(TEMPLATES);
        for (final DayOfWeek day : DayOfWeek.values()) {
            if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                b.window(day, new OpeningWindow(LocalTime.of(8, 0), LocalTime.of(16, 0)));
            }
        }
        return b;
    }

    private final BusinessHoursOracle oracle = new BusinessHoursOracle(office()
            .holiday(LocalDate.of(2025, 1, 6), "Epifanía del Señor")
            .exceptionalClosure(LocalDate.of(2025, 12, 24), "Cierre por Nochebuena")
            .build());

    // Madrid is UTC+1 in January

    // ── isBusinessHours ──────────────────────────────────────────────────────

    @Test
    void weekdayWithinWindow_isOpen() {
        assertThat(oracle.isBusinessHours(Instant.parse("2025-01-15T07:00:00Z")).isOpen()).isTrue();
        assertThat(oracle.isBusinessHours(Instant.parse("2025-01-15T14:59:59Z")).isOpen()).isTrue();
    }

    @Test
    void beforeStart_isBeforeHours() {
        final var result = oracle.isBusinessHours(Instant.parse("2025-01-15T06:59:00Z"));

        assertThat(result.isOpen()).isFalse();
        assertThat(result.getReason()).isEqualTo(ClosedReason.BEFORE_HOURS);
    }

    @Test
    void windowEnd_isExclusive() {
        final var result = oracle.isBusinessHours(Instant.parse("2025-01-15T15:00:00Z"));

        assertThat(result.isOpen()).isFalse();
        assertThat(result.getReason()).isEqualTo(ClosedReason.AFTER_HOURS);
    }

    @Test
    void weekend_hasNoSchedule() {
        assertThat(oracle.isBusinessHours(Instant.parse("2025-01-18T10:00:00Z")).getReason())
                .isEqualTo(ClosedReason.NO_SCHEDULE);
    }

    @Test
    void holiday_isClosedAllDay_withItsName() {
        final var result = oracle.isBusinessHours(Instant.parse("2025-01-06T10:00:00Z"));

        assertThat(result.getReason()).isEqualTo(ClosedReason.HOLIDAY);
        assertThat(result.getHolidayName()).isEqualTo("Epifanía del Señor");
    }

    @Test
    void exceptionalClosure_isReportedAsHoliday() {
        final var result = oracle.isBusinessHours(Instant.parse("2025-12-24T10:00:00Z"));

        assertThat(result.getReason()).isEqualTo(ClosedReason.HOLIDAY);
        assertThat(result.getHolidayName()).isEqualTo("Cierre por Nochebuena");
    }

    @Test
    void localDateDecides_notUtcDate() {
        // 23:30 UTC on Sunday 5 January is already the holiday in Madrid
        assertThat(oracle.isBusinessHours(Instant.parse("2025-01-05T23:30:00Z")).getReason())
                .isEqualTo(ClosedReason.HOLIDAY);
    }

    // ── getNextBusinessDay ───────────────────────────────────────────────────

    @Test
    void nextBusinessDay_isTomorrowMidweek() {
        final var next = oracle.getNextBusinessDay(Instant.parse("2025-01-15T17:00:00Z"));

        assertThat(next.getDate()).isEqualTo(LocalDate.of(2025, 1, 16));
        assertThat(next.getDaysUntil()).isEqualTo(1);
        assertThat(next.getLabel()).contains("16 de enero de 2025");
    }

    @Test
    void nextBusinessDay_skipsWeekendAndHoliday() {
        // Friday 3 January → Saturday, Sunday, Monday 6 (holiday) → Tuesday 7
        final var next = oracle.getNextBusinessDay(Instant.parse("2025-01-03T17:00:00Z"));

        assertThat(next.getDate()).isEqualTo(LocalDate.of(2025, 1, 7));
        assertThat(next.getDaysUntil()).isEqualTo(4);
        assertThat(next.getLabel()).startsWith("martes");
    }

    @Test
    void nextBusinessDay_withoutAnyOpenDay_stopsAfterThirtyDays() {
        final var closed = new BusinessHoursOracle(BusinessHoursConfig.builder().build());

        final var next = closed.getNextBusinessDay(Instant.parse("2025-01-15T10:00:00Z"));

        assertThat(next.getDate()).isEqualTo(LocalDate.of(2025, 2, 15));
        assertThat(next.getDaysUntil()).isEqualTo(BusinessHoursOracle.MAX_SCAN_DAYS);
    }

    // ── getAutoReplyMessage ──────────────────────────────────────────────────

    @Test
    void openHours_haveNoReply() {
        assertThat(oracle.getAutoReplyMessage(Instant.parse("2025-01-15T10:00:00Z"))).isEmpty();
    }

    @Test
    void weekdayEvening_usesOutOfHoursTemplate() {
        assertThat(oracle.getAutoReplyMessage(Instant.parse("2025-01-15T17:00:00Z"))).contains("O");
    }

    @Test
    void holiday_usesHolidayTemplate_withNameAndNextDay() {
        final var reply = oracle.getAutoReplyMessage(Instant.parse("2025-01-06T10:00:00Z"));

        assertThat(reply).isPresent();
        assertThat(reply.get()).startsWith("H:Epifanía del Señor|martes").contains("7 de enero de 2025");
    }

    @Test
    void fridayEvening_isMoreThanOneDayAway_andUsesHolidayTemplate() {
        final var reply = oracle.getAutoReplyMessage(Instant.parse("2025-01-17T17:00:00Z"));

        assertThat(reply).isPresent();
        assertThat(reply.get()).startsWith("H:" + BusinessHoursConfig.DEFAULT_CLOSURE_NAME + "|lunes");
    }

    @Test
    void sunday_withMondayNext_usesWeekendTemplate() {
        final var reply = oracle.getAutoReplyMessage(Instant.parse("2025-01-19T10:00:00Z"));

        assertThat(reply).isPresent();
        assertThat(reply.get()).startsWith("W:lunes").contains("20 de enero de 2025");
    }

    @Test
    void defaultConfig_opensMondayToFridayInMadrid() {
        final var defaults = new BusinessHoursOracle(BusinessHoursConfig.defaults());

        assertThat(defaults.isBusinessHours(Instant.parse("2025-01-15T07:00:00Z")).isOpen()).isTrue();
        assertThat(defaults.isBusinessHours(Instant.parse("2025-01-18T10:00:00Z")).isOpen()).isFalse();
        assertThat(defaults.getAutoReplyMessage(Instant.parse("2025-01-15T17:00:00Z")))
                .contains(ReplyTemplates.defaults().getOutOfHours());
    }
}
