package com.toolstock.notifier.hours;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the business-hours JSON file:
 *
 * <pre>{@code
 * {
 *   "timezone": "Europe/Madrid",
 *   "locale": "es-ES",
 *   "defaultClosureName": "Día festivo",
 *   "regularHours": { "monday": {"start": "08:00", "end": "16:00"}, ..., "sunday": null },
 *   "holidays": { "2025": [ {"date": "2025-01-06", "name": "Reyes"} ] },
 *   "exceptionalClosures": [ {"date": "2025-08-14", "name": "Inventario"} ],
 *   "autoReplyMessages": { "holiday": "...", "weekendOrExtended": "...", "outOfHours": "..." }
 * }
 * }</pre>
 *
 * The same object may also be wrapped in a top-level {@code businessHours} field.
 * Missing reply texts fall back to the built-in ones.
 */
public final class BusinessHoursLoader {

    private final ObjectMapper mapper = new ObjectMapper();

    public BusinessHoursConfig load(final Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(mapper.readTree(in));
        }
    }

    public BusinessHoursConfig parse(final String json) throws IOException {
        return parse(mapper.readTree(json));
    }

    BusinessHoursConfig parse(final JsonNode document) {
        final JsonNode root = document.has("businessHours") ? document.get("businessHours") : document;
        final BusinessHoursConfig.Builder b = BusinessHoursConfig.builder();

        if (root.hasNonNull("timezone")) {
            b.timezone(ZoneId.of(root.get("timezone").asText()));
        }
        if (root.hasNonNull("locale")) {
            b.locale(Locale.forLanguageTag(root.get("locale").asText()));
        }
        if (root.hasNonNull("defaultClosureName")) {
            b.defaultClosureName(root.get("defaultClosureName").asText());
        }

        final JsonNode hours = root.path("regularHours");
        if (!hours.isObject()) {
            throw new IllegalArgumentException("business hours: regularHours missing");
        }
        for (final DayOfWeek day : DayOfWeek.values()) {
            final JsonNode window = hours.path(day.name().toLowerCase(Locale.ROOT));
            if (window.isObject()) {
                b.window(day, OpeningWindow.parse(
                        window.path("start").asText(), window.path("end").asText()));
            }
        }

        // holidays are grouped by year; the year key itself is informational
        final Iterator<Map.Entry<String, JsonNode>> years = root.path("holidays").fields();
        while (years.hasNext()) {
            for (final JsonNode holiday : years.next().getValue()) {
                b.holiday(LocalDate.parse(holiday.path("date").asText()), holiday.path("name").asText(""));
            }
        }
        for (final JsonNode closure : root.path("exceptionalClosures")) {
            b.exceptionalClosure(LocalDate.parse(closure.path("date").asText()), closure.path("name").asText(""));
        }

        final ReplyTemplates defaults = ReplyTemplates.defaults();
        final JsonNode messages = root.path("autoReplyMessages");
        b.templates(new ReplyTemplates(
                messages.path("holiday").asText(defaults.getHoliday()),
                messages.path("weekendOrExtended").asText(defaults.getWeekendOrExtended()),
                messages.path("outOfHours").asText(defaults.getOutOfHours())));

        return b.build();
    }
}
