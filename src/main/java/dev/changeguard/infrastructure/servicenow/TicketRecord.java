package dev.changeguard.infrastructure.servicenow;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One row of a platform table. Field values arrive as plain strings, as
 * {@code {"value": ..., "display_value": ...}} pairs, or occasionally as JSON booleans and numbers;
 * the accessors normalise all of them.
 */
public record TicketRecord(Map<String, Object> fields) {

    private static final DateTimeFormatter PLATFORM_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public TicketRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static TicketRecord of(Map<String, Object> fields) {
        return new TicketRecord(fields);
    }

    /** Trimmed text value, or null when absent or blank. */
    public String text(String name) {
        Object raw = fields.get(name);
        if (raw instanceof Map<?, ?> pair) {
            Object display = pair.get("display_value");
            raw = display != null && !display.toString().isBlank() ? display : pair.get("value");
        }
        if (raw == null) return null;
        String s = raw.toString().trim();
        return s.isEmpty() ? null : s;
    }

    public boolean has(String name) {
        return text(name) != null;
    }

    public boolean flag(String name) {
        Object raw = fields.get(name);
        if (raw instanceof Boolean b) return b;
        String s = text(name);
        return s != null && (s.equalsIgnoreCase("true") || s.equals("1") || s.equalsIgnoreCase("yes"));
    }

    public Optional<Double> number(String name) {
        String s = text(name);
        if (s == null) return Optional.empty();
        try {
            return Optional.of(Double.parseDouble(s.replace(",", "")));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Platform timestamps are UTC "yyyy-MM-dd HH:mm:ss"; ISO-8601 instants are accepted too. */
    public Optional<Instant> instant(String name) {
        String s = text(name);
        if (s == null) return Optional.empty();
        try {
            return Optional.of(LocalDateTime.parse(s, PLATFORM_DATE_TIME).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            try {
                return Optional.of(Instant.parse(s));
            } catch (DateTimeParseException ignored) {
                return Optional.empty();
            }
        }
    }

    /** Comma separated list value. */
    public List<String> list(String name) {
        String s = text(name);
        if (s == null) return List.of();
        return Arrays.stream(s.split(","))
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .toList();
    }
}
