package com.toolstock.notifier.hours;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/** Opening hours of one weekday, {@code [start, end)} at minute resolution. */
public final class OpeningWindow {

    private final LocalTime start;
    private final LocalTime end;

    public OpeningWindow(final LocalTime start, final LocalTime end) {
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("end must be after start: " + start + "-" + end);
        }
        this.start = start.truncatedTo(ChronoUnit.MINUTES);
        this.end   = end.truncatedTo(ChronoUnit.MINUTES);
    }

    /** Parses {@code "HH:MM"} pairs as found in the calendar file. */
    public static OpeningWindow parse(final String start, final String end) {
        return new OpeningWindow(LocalTime.parse(start), LocalTime.parse(end));
    }

    public boolean contains(final LocalTime time) {
        final LocalTime t = time.truncatedTo(ChronoUnit.MINUTES);
        return !t.isBefore(start) && t.isBefore(end);
    }

    public boolean isBefore(final LocalTime time) {
        return time.truncatedTo(ChronoUnit.MINUTES).isBefore(start);
    }

    public LocalTime getStart() { return start; }
    public LocalTime getEnd()   { return end; }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
