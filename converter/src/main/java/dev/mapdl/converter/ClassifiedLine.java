package dev.mapdl.converter;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One script line after lexical classification. Instances live for a single
 * translation step.
 */
public final class ClassifiedLine {

    private final LineKind kind;
    private final int lineNumber;
    private final String raw;
    private final String code;
    private final String bareCode;
    private final String comment;
    private final List<String> fields;

    ClassifiedLine(LineKind kind,
                   int lineNumber,
                   String raw,
                   String code,
                   String bareCode,
                   String comment,
                   List<String> fields) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.lineNumber = lineNumber;
        this.raw = raw == null ? "" : raw;
        this.code = code == null ? "" : code;
        this.bareCode = bareCode == null ? "" : bareCode;
        this.comment = comment == null ? "" : comment;
        this.fields = List.copyOf(fields);
    }

    public LineKind kind() {
        return kind;
    }

    public int lineNumber() {
        return lineNumber;
    }

    /** The line exactly as read from the script. */
    public String raw() {
        return raw;
    }

    /** Stripped, quote-normalized text before any comment marker. */
    public String code() {
        return code;
    }

    /** Comment payload without the marker, trimmed; empty when there is none. */
    public String comment() {
        return comment;
    }

    public boolean hasComment() {
        return !comment.isEmpty();
    }

    /** Comma separated fields of {@link #code()}, each trimmed. */
    public List<String> fields() {
        return fields;
    }

    public String field(int index) {
        if (index < 0 || index >= fields.size()) {
            return "";
        }
        return fields.get(index);
    }

    public List<String> arguments() {
        if (fields.size() <= 1) {
            return List.of();
        }
        return fields.subList(1, fields.size());
    }

    /** Upper-cased first field. */
    public String command() {
        return field(0).toUpperCase(Locale.ROOT);
    }

    /** Upper-cased first field cut to the four significant characters. */
    public String token() {
        String command = command();
        return command.length() > 4 ? command.substring(0, 4) : command;
    }

    public boolean isFormatLine() {
        return code.startsWith("(");
    }

    /** True when a {@code *IF} keyword appears outside quoted literals. */
    public boolean mentionsConditional() {
        return bareCode.toUpperCase(Locale.ROOT).contains("*IF");
    }

    public boolean isAssignment() {
        return field(0).contains("=");
    }

    ClassifiedLine withKind(LineKind newKind) {
        if (newKind == kind) {
            return this;
        }
        return new ClassifiedLine(newKind, lineNumber, raw, code, bareCode, comment, fields);
    }

    @Override
    public String toString() {
        return lineNumber + ":" + kind + ":" + code;
    }
}
