package com.toolstock.notifier.hours;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable business calendar: timezone, weekly opening windows, dated
 * closures and the closed-hours reply templates.
 *
 * <p>Holidays and exceptional closures both close the whole day. When a date
 * appears in both tables the holiday name wins.
 */
public final class BusinessHoursConfig {

    public static final String DEFAULT_CLOSURE_NAME = "Día festivo";

    private final ZoneId                          timezone;
    private final Locale                          locale;
    private final Map<DayOfWeek, OpeningWindow>   weeklySchedule;
    private final Map<LocalDate, String>          holidays;
    private final Map<LocalDate, String>          exceptionalClosures;
    private final ReplyTemplates                  templates;
    private final String                          defaultClosureName;

    private BusinessHoursConfig(final Builder b) {
        this.timezone            = b.timezone;
        this.locale              = b.locale;
        this.weeklySchedule      = Collections.unmodifiableMap(new EnumMap<>(b.weeklySchedule));
        this.holidays            = Collections.unmodifiableMap(new HashMap<>(b.holidays));
        this.exceptionalClosures = Collections.unmodifiableMap(new HashMap<>(b.exceptionalClosures));
        this.templates           = b.templates;
        this.defaultClosureName  = b.defaultClosureName;
    }

    /** Europe/Madrid, Monday to Friday 08:00-16:00, no closures, built-in Spanish texts. */
    public static BusinessHoursConfig defaults() {
        final Builder b = builder();
        final OpeningWindow office = new OpeningWindow(LocalTime.of(8, 0), LocalTime.of(16, 0));
        for (final DayOfWeek day : DayOfWeek.values()) {
            if (day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY) {
                b.window(day, office);
            }
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ZoneId getTimezone() { return timezone; }
    public Locale getLocale()   { return locale; }

    public Optional<OpeningWindow> windowFor(final DayOfWeek day) {
        return Optional.ofNullable(weeklySchedule.get(day));
    }

    /** Name of the holiday or closure on {@code date}, if the whole day is closed. */
    public Optional<String> closureOn(final LocalDate date) {
        final String holiday = holidays.get(date);
        if (holiday != null) {
            return Optional.of(holiday);
        }
        return Optional.ofNullable(exceptionalClosures.get(date));
    }

    public Map<DayOfWeek, OpeningWindow> getWeeklySchedule()      { return weeklySchedule; }
    public Map<LocalDate, String>        getHolidays()            { return holidays; }
    public Map<LocalDate, String>        getExceptionalClosures() { return exceptionalClosures; }
    public ReplyTemplates                getTemplates()           { return templates; }
    public String                        getDefaultClosureName()  { return defaultClosureName; }

    public static final class Builder {

        private ZoneId                        timezone           = ZoneId.of("Europe/Madrid");
        private Locale                        locale             = Locale.forLanguageTag("es-ES");
        private final Map<DayOfWeek, OpeningWindow> weeklySchedule = new EnumMap<>(DayOfWeek.class);
        private final Map<LocalDate, String>  holidays           = new HashMap<>();
        private final Map<LocalDate, String>  exceptionalClosures = new HashMap<>();
        private ReplyTemplates                templates          = ReplyTemplates.defaults();
        private String                        defaultClosureName = DEFAULT_CLOSURE_NAME;

        private Builder() {}

        public Builder timezone(final ZoneId zone)          { this.timezone = zone; return this; }
        public Builder locale(final Locale loc)             { this.locale = loc; return this; }
        public Builder templates(final ReplyTemplates t)    { this.templates = t; return this; }
        public Builder defaultClosureName(final String n)   { this.defaultClosureName = n; return this; }

        public Builder window(final DayOfWeek day, final OpeningWindow window) {
            weeklySchedule.put(day, window);
            return this;
        }

        public Builder holiday(final LocalDate date, final String name) {
            holidays.put(date, name);
            return this;
        }

        public Builder exceptionalClosure(final LocalDate date, final String name) {
            exceptionalClosures.put(date, name);
            return this;
        }

        public BusinessHoursConfig build() {
            return new BusinessHoursConfig(this);
        }
    }
}
