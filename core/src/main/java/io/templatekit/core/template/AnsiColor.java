package io.templatekit.core.template;

import java.util.Locale;
import java.util.Optional;

/** The 16 standard ANSI foreground colors. */
public enum AnsiColor {
    BLACK(30),
    RED(31),
    GREEN(32),
    YELLOW(33),
    BLUE(34),
    MAGENTA(35),
    CYAN(36),
    WHITE(37),
    BRIGHT_BLACK(90),
    BRIGHT_RED(91),
    BRIGHT_GREEN(92),
    BRIGHT_YELLOW(93),
    BRIGHT_BLUE(94),
    BRIGHT_MAGENTA(95),
    BRIGHT_CYAN(96),
    BRIGHT_WHITE(97);

    private final int code;

    AnsiColor(int code) {
        this.code = code;
    }

    /** SGR parameter, e.g. {@code 34} for blue. */
    public int code() {
        return code;
    }

    /**
     * Parses a color name such as {@code "blue"} or {@code "bright green"}.
     *
     * @return the color, or empty if the name is not recognised
     */
    public static Optional<AnsiColor> parse(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replaceAll("\\s+", "_");
        for (AnsiColor color : values()) {
            if (color.name().equals(normalized)) {
                return Optional.of(color);
            }
        }
        return Optional.empty();
    }
}
