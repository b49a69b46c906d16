package com.toolstock.notifier.hours;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.Optional;

/**
 * Pure open/closed decisions over one {@link BusinessHoursConfig}.
 *
 * <p>Stateless apart from the config it wraps; a calendar reload produces a
 * new oracle rather than mutating this one.
 */
public final class BusinessHoursOracle {

    static final int MAX_SCAN_DAYS = 30;

    private final BusinessHoursConfig config;
    private final DateTimeFormatter   longDate;

    public BusinessHoursOracle(final BusinessHoursConfig config) {
        this.config   = config;
        this.longDate = DateTimeFormatter.ofLocalizedDate(FormatStyle.FULL).withLocale(config.getLocale());
    }

    public BusinessHoursResult isBusinessHours(final Instant now) {
        final ZonedDateTime local = now.atZone(config.getTimezone());
        final LocalDate date = local.toLocalDate();

        final Optional<String> closure = config.closureOn(date);
        if (closure.isPresent()) {
            return BusinessHoursResult.holiday(closure.get());
        }

        final Optional<OpeningWindow> window = config.windowFor(local.getDayOfWeek());
        if (window.isEmpty()) {
            return BusinessHoursResult.closed(ClosedReason.NO_SCHEDULE);
        }
        if (window.get().contains(local.toLocalTime())) {
            return BusinessHoursResult.open();
        }
        return BusinessHoursResult.closed(
                window.get().isBefore(local.toLocalTime()) ? ClosedReason.BEFORE_HOURS : ClosedReason.AFTER_HOURS);
    }

    /**
     * First day after {@code from} (in the configured zone) that is not closed
     * and has an opening window. Scans at most {@value #MAX_SCAN_DAYS} days; if
     * none qualifies, the day after the scan window is returned with
     * {@code daysUntil = 30}.
     */
    public NextBusinessDay getNextBusinessDay(final Instant from) {
        LocalDate candidate = from.atZone(config.getTimezone()).toLocalDate().plusDays(1);
        for (int checked = 0; checked < MAX_SCAN_DAYS; checked++) {
            if (config.closureOn(candidate).isEmpty()
                    && config.windowFor(candidate.getDayOfWeek()).isPresent()) {
                return new NextBusinessDay(candidate, longDate.format(candidate), checked + 1);
            }
            candidate = candidate.plusDays(1);
        }
        return new NextBusinessDay(candidate, longDate.format(candidate), MAX_SCAN_DAYS);
    }

    /**
     * The closed-hours reply for {@code now}, or empty while open.
     *
     * <ul>
     *   <li>holiday template: closed for a holiday, or the next business day is more than one day away</li>
     *   <li>weekend/extended template: a day without schedule, or more than two days away</li>
     *   <li>out-of-hours template otherwise</li>
     * </ul>
     */
    public Optional<String> getAutoReplyMessage(final Instant now) {
        final BusinessHoursResult status = isBusinessHours(now);
        if (status.isOpen()) {
            return Optional.empty();
        }

        final NextBusinessDay next = getNextBusinessDay(now);
        final ReplyTemplates templates = config.getTemplates();
        final String template;
        if (status.getReason() == ClosedReason.HOLIDAY || next.getDaysUntil() > 1) {
            template = templates.getHoliday();
        } else if (status.getReason() == ClosedReason.NO_SCHEDULE || next.getDaysUntil() > 2) {
            template = templates.getWeekendOrExtended();
        } else {
            template = templates.getOutOfHours();
        }

        final String holidayName = status.getHolidayName() != null
                ? status.getHolidayName()
                : config.getDefaultClosureName();
        return Optional.of(template
                .replace(ReplyTemplates.HOLIDAY_PLACEHOLDER, holidayName)
                .replace(ReplyTemplates.NEXT_DAY_PLACEHOLDER, next.getLabel()));
    }

    public BusinessHoursConfig getConfig() {
        return config;
    }
}
