package com.toolstock.notifier.hours;

import java.util.Objects;

/**
 * The three closed-hours reply texts. Placeholders: {@code {holidayName}} and
 * {@code {nextBusinessDay}}.
 */
public final class ReplyTemplates {

    static final String HOLIDAY_PLACEHOLDER  = "{holidayName}";
    static final String NEXT_DAY_PLACEHOLDER = "{nextBusinessDay}";

    private final String holiday;
    private final String weekendOrExtended;
    private final String outOfHours;

    public ReplyTemplates(final String holiday, final String weekendOrExtended, final String outOfHours) {
        this.holiday           = Objects.requireNonNull(holiday, "holiday");
        this.weekendOrExtended = Objects.requireNonNull(weekendOrExtended, "weekendOrExtended");
        this.outOfHours        = Objects.requireNonNull(outOfHours, "outOfHours");
    }

    public static ReplyTemplates defaults() {
        return new ReplyTemplates(
                "¡Hola! Hoy estamos cerrados por {holidayName}. "
                        + "Te atenderemos el {nextBusinessDay}. ¡Gracias por tu paciencia!",
                "¡Hola! Estamos fuera del horario de atención. "
                        + "Volveremos el {nextBusinessDay} y responderemos tu mensaje lo antes posible.",
                "¡Hola! Nuestro horario de atención es de lunes a viernes de 08:00 a 16:00. "
                        + "Responderemos tu mensaje en cuanto volvamos.");
    }

    public String getHoliday()           { return holiday; }
    public String getWeekendOrExtended() { return weekendOrExtended; }
    public String getOutOfHours()        { return outOfHours; }
}
