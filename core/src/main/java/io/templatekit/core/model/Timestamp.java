package io.templatekit.core.model;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * A point in time with the UTC offset it was recorded in. Displays as {@code yyyy-MM-dd
 * HH:mm:ss.SSS xxx} in that offset.
 *
 * @param epochMillis milliseconds since the Unix epoch
 * @param tzOffsetMinutes offset from UTC in minutes
 */
public record Timestamp(long epochMillis, int tzOffsetMinutes) {

    private static final DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS xxx");

    public Timestamp {
        if (Math.abs(tzOffsetMinutes) > 18 * 60) {
            throw new IllegalArgumentException("tzOffsetMinutes out of range: " + tzOffsetMinutes);
        }
    }

    public static Timestamp of(Instant instant, ZoneOffset offset) {
        return new Timestamp(instant.toEpochMilli(), offset.getTotalSeconds() / 60);
    }

    public Instant instant() {
        return Instant.ofEpochMilli(epochMillis);
    }

    public ZoneOffset offset() {
        return ZoneOffset.ofTotalSeconds(tzOffsetMinutes * 60);
    }

    /**
     * Rough English description of this timestamp relative to {@code now}, e.g. {@code "5 minutes
     * ago"} or {@code "in a day"}.
     */
    public String formatRelativeTo(Instant now) {
        Duration delta = Duration.between(instant(), now);
        boolean future = delta.isNegative();
        long seconds = delta.abs().getSeconds();
        if (seconds < 1) {
            return "now";
        }
        String amount;
        long minutes = seconds / 60;
        long hours = minutes / 60;
        long days = hours / 24;
        if (seconds < 60) {
            amount = units(seconds, "second");
        } else if (minutes < 45) {
            amount = units(minutes, "minute");
        } else if (hours < 24) {
            amount = units(Math.max(1, hours), "hour");
        } else if (days < 30) {
            amount = units(days, "day");
        } else if (days < 365) {
            amount = units(days / 30, "month");
        } else {
            amount = units(days / 365, "year");
        }
        return future ? "in " + amount : amount + " ago";
    }

    private static String units(long count, String unit) {
        if (count == 1) {
            return (unit.equals("hour") ? "an " : "a ") + unit;
        }
        return count + " " + unit + "s";
    }

    @Override
    public String toString() {
        return instant().atOffset(offset()).format(DISPLAY_FORMAT);
    }
}
