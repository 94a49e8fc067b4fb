package dev.mapdl.converter;

import java.util.Objects;

/**
 * Non-fatal finding reported alongside a successful translation.
 */
public final class TranslationWarning {

    public enum Kind {
        SUSPICIOUS_PASSTHROUGH,
        UNBALANCED_BLOCK,
        UNBALANCED_FUNCTION,
        UNBALANCED_WINDOW
    }

    private final Kind kind;
    private final int lineNumber;
    private final String sourceLine;
    private final String message;

    TranslationWarning(Kind kind, int lineNumber, String sourceLine, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.lineNumber = lineNumber;
        this.sourceLine = sourceLine == null ? "" : sourceLine;
        this.message = Objects.requireNonNull(message, "message");
    }

    public Kind kind() {
        return kind;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String sourceLine() {
        return sourceLine;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return kind + " at line " + lineNumber + ": " + message;
    }
}
