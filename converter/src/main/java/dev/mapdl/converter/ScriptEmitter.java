package dev.mapdl.converter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Append-only buffer of generated Python lines. Indentation changes only
 * through {@link #enterScope()} and {@link #exitScope()}.
 */
final class ScriptEmitter {

    static final String INDENT_UNIT = "    ";

    private static final Pattern NUMBER = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Set<String> PYTHON_KEYWORDS = Set.of(
        "and", "as", "assert", "async", "await", "break", "class", "continue", "def", "del",
        "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
        "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while",
        "with", "yield"
    );

    private final List<String> lines = new ArrayList<>();
    private int depth;

    void emitStatement(String statement) {
        emitStatement(statement, "");
    }

    void emitStatement(String statement, String comment) {
        StringBuilder line = new StringBuilder();
        indent(line, depth);
        line.append(statement);
        if (comment != null && !comment.isEmpty()) {
            line.append("  # ").append(comment);
        }
        lines.add(line.toString());
    }

    /** Appends a line verbatim, without indentation. */
    void emitVerbatim(String line) {
        lines.add(line);
    }

    void emitComment(String payload) {
        StringBuilder line = new StringBuilder();
        indent(line, depth);
        line.append('#');
        if (payload != null && !payload.isEmpty()) {
            line.append(' ').append(payload);
        }
        lines.add(line.toString());
    }

    void emitBlank() {
        lines.add("");
    }

    void enterScope() {
        depth++;
    }

    void exitScope() {
        if (depth == 0) {
            throw new IllegalStateException("scope exit below indentation zero");
        }
        depth--;
    }

    int depth() {
        return depth;
    }

    String indentation() {
        StringBuilder prefix = new StringBuilder();
        indent(prefix, depth);
        return prefix.toString();
    }

    int size() {
        return lines.size();
    }

    String lastLine() {
        return lines.isEmpty() ? "" : lines.get(lines.size() - 1);
    }

    String removeLast() {
        if (lines.isEmpty()) {
            throw new IllegalStateException("nothing emitted yet");
        }
        return lines.remove(lines.size() - 1);
    }

    List<String> lines() {
        return Collections.unmodifiableList(new ArrayList<>(lines));
    }

    static String call(String target, List<String> arguments) {
        StringBuilder call = new StringBuilder(target).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                call.append(", ");
            }
            call.append(arguments.get(i));
        }
        return call.append(')').toString();
    }

    static String stringLiteral(String text) {
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    static boolean isNumber(String text) {
        return NUMBER.matcher(text).matches();
    }

    /** Renders a command field as a Python argument, unquoting APDL literals. */
    static String argument(String field) {
        String value = field.strip();
        if (isNumber(value)) {
            return value;
        }
        if (value.length() >= 2 && value.startsWith("'") && value.endsWith("'")) {
            value = value.substring(1, value.length() - 1);
        }
        return stringLiteral(value);
    }

    static String toPythonIdentifier(String name) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            if (Character.isLetterOrDigit(ch) || ch == '_') {
                result.append(Character.toLowerCase(ch));
            } else {
                result.append('_');
            }
        }
        if (result.length() == 0 || Character.isDigit(result.charAt(0))) {
            result.insert(0, '_');
        }
        if (PYTHON_KEYWORDS.contains(result.toString())) {
            result.append('_');
        }
        return result.toString();
    }

    static String truncate(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() <= 60) {
            return text;
        }
        return text.substring(0, 57) + "...";
    }

    private static void indent(StringBuilder line, int level) {
        for (int i = 0; i < level; i++) {
            line.append(INDENT_UNIT);
        }
    }
}
