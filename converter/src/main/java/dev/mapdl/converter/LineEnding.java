package dev.mapdl.converter;

import java.util.Locale;

/**
 * Line terminator used to split script text and to join the generated program.
 */
public enum LineEnding {
    LF("\n"),
    CRLF("\r\n");

    private final String separator;

    LineEnding(String separator) {
        this.separator = separator;
    }

    public String separator() {
        return separator;
    }

    /** The terminator of the running platform. */
    public static LineEnding system() {
        return "\r\n".equals(System.lineSeparator()) ? CRLF : LF;
    }

    /**
     * Accepts either the enum name ({@code LF}, {@code CRLF}) or the literal
     * terminator text.
     */
    public static LineEnding fromText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("line ending must not be null");
        }
        for (LineEnding ending : values()) {
            if (ending.separator.equals(text)) {
                return ending;
            }
        }
        String name = text.trim().toUpperCase(Locale.ROOT);
        for (LineEnding ending : values()) {
            if (ending.name().equals(name)) {
                return ending;
            }
        }
        throw new IllegalArgumentException("Line ending must be either \"\\n\" or \"\\r\\n\", got '" + text + "'");
    }
}
