package dev.mapdl.converter;

/**
 * Fatal translation error. Carries the offending source line so callers can
 * report it verbatim.
 */
public class TranslationException extends RuntimeException {

    private final int lineNumber;
    private final String sourceLine;

    public TranslationException(String message, int lineNumber, String sourceLine) {
        this(message, lineNumber, sourceLine, null);
    }

    public TranslationException(String message, int lineNumber, String sourceLine, Throwable cause) {
        super(format(message, lineNumber, sourceLine), cause);
        this.lineNumber = lineNumber;
        this.sourceLine = sourceLine == null ? "" : sourceLine;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String sourceLine() {
        return sourceLine;
    }

    private static String format(String message, int lineNumber, String sourceLine) {
        if (lineNumber <= 0) {
            return message;
        }
        return message + " (line " + lineNumber + ": " + (sourceLine == null ? "" : sourceLine.strip()) + ")";
    }
}
