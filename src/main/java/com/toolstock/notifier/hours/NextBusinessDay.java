package com.toolstock.notifier.hours;

import java.time.LocalDate;

/** The first upcoming day with an opening window, and how many days away it is. */
public final class NextBusinessDay {

    private final LocalDate date;
    private final String    label;
    private final int       daysUntil;

    public NextBusinessDay(final LocalDate date, final String label, final int daysUntil) {
        this.date      = date;
        this.label     = label;
        this.daysUntil = daysUntil;
    }

    public LocalDate getDate()      { return date; }
    /** Long localized form, e.g. {@code lunes, 20 de enero de 2025}. */
    public String    getLabel()     { return label; }
    public int       getDaysUntil() { return daysUntil; }

    @Override
    public String toString() {
        return date + " (+" + daysUntil + "d)";
    }
}
