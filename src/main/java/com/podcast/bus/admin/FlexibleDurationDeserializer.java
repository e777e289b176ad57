package com.podcast.bus.admin;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Jackson {@link JsonDeserializer} for {@link Duration} that accepts operator-friendly input.
 *
 * <h2>Accepted examples</h2>
 * <pre>
 * "PT5M"   -> 5 minutes
 * "pt30s"  -> 30 seconds
 * "250ms"  -> 250 milliseconds
 * "90s"    -> 90 seconds
 * "5m"     -> 5 minutes
 * "1h"     -> 1 hour
 * "2d"     -> 2 days
 * 60000    -> 60000 milliseconds
 * null, "" -> null (the endpoint applies its own default)
 * </pre>
 *
 * Anything else is rejected as a bad request instead of being silently replaced by a default: an idle
 * threshold that is quietly wrong lets an operator steal entries from a live consumer.
 */
public final class FlexibleDurationDeserializer extends JsonDeserializer<Duration> {

    private static final Pattern SHORTHAND = Pattern.compile("^(\\d+)(ms|s|m|h|d)$", Pattern.CASE_INSENSITIVE);

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            long millis = node.asLong();
            if (millis < 0) {
                return (Duration) ctxt.handleWeirdNumberValue(Duration.class, millis, "duration must not be negative");
            }
            return Duration.ofMillis(millis);
        }

        String s = node.asText("").trim();
        if (s.isEmpty()) {
            return null;
        }

        Duration parsed = parse(s);
        if (parsed == null || parsed.isNegative()) {
            return (Duration) ctxt.handleWeirdStringValue(Duration.class, s,
                    "expected ISO-8601 (PT5M) or <number><ms|s|m|h|d>");
        }
        return parsed;
    }

    static Duration parse(String s) {
        Matcher m = SHORTHAND.matcher(s);
        if (m.matches()) {
            long n = Long.parseLong(m.group(1));
            return switch (m.group(2).toLowerCase(Locale.ROOT)) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                default -> Duration.ofDays(n);
            };
        }
        try {
            return Duration.parse(s.toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
