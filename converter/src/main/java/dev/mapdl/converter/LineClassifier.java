package dev.mapdl.converter;

import dev.mapdl.antlr.ApdlLineBaseVisitor;
import dev.mapdl.antlr.ApdlLineLexer;
import dev.mapdl.antlr.ApdlLineParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a raw script line into fields and comment using the generated
 * {@code ApdlLine} parser. Stateless; the only context it takes is whether a
 * data block is active.
 */
final class LineClassifier {

    private static final char COMMENT_MARKER = '!';

    ClassifiedLine classify(String rawLine, int lineNumber, boolean inBlock) {
        String raw = rawLine == null ? "" : rawLine;
        String text = normalize(raw);
        if (text.isEmpty()) {
            return new ClassifiedLine(LineKind.BLANK, lineNumber, raw, "", "", "", List.of());
        }

        ApdlLineLexer lexer = new ApdlLineLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        ApdlLineParser parser = new ApdlLineParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        ApdlLineParser.LineContext tree = parser.line();

        String code = text;
        String comment = "";
        TerminalNode commentNode = tree.COMMENT();
        if (commentNode != null) {
            int start = commentNode.getSymbol().getStartIndex();
            code = text.substring(0, start).strip();
            comment = commentNode.getText().substring(1).strip();
        }

        if (code.isEmpty()) {
            if (text.charAt(0) == COMMENT_MARKER) {
                return new ClassifiedLine(LineKind.COMMENT_ONLY, lineNumber, raw, "", "", comment, List.of());
            }
            return new ClassifiedLine(LineKind.BLANK, lineNumber, raw, "", "", "", List.of());
        }

        FieldCollector collector = new FieldCollector();
        collector.visit(tree);

        LineKind kind;
        if (inBlock) {
            kind = LineKind.BLOCK_DATA;
        } else if (!collector.fields.isEmpty() && collector.fields.get(0).contains("=")) {
            kind = LineKind.ASSIGNMENT;
        } else if (commentNode != null) {
            kind = LineKind.INLINE_COMMENT;
        } else {
            kind = LineKind.COMMAND;
        }
        return new ClassifiedLine(kind, lineNumber, raw, code, collector.bare.toString(), comment, collector.fields);
    }

    /** Strips surrounding whitespace and folds double quotes into single quotes. */
    static String normalize(String raw) {
        return raw.strip().replace('"', '\'');
    }

    private static final class FieldCollector extends ApdlLineBaseVisitor<Void> {
        final List<String> fields = new ArrayList<>();
        final StringBuilder bare = new StringBuilder();

        @Override
        public Void visitField(ApdlLineParser.FieldContext ctx) {
            if (!fields.isEmpty()) {
                bare.append(',');
            }
            fields.add(ctx.getText().strip());
            return super.visitField(ctx);
        }

        @Override
        public Void visitFieldPart(ApdlLineParser.FieldPartContext ctx) {
            if (ctx.TEXT() != null) {
                bare.append(ctx.TEXT().getText());
            } else if (ctx.APOSTROPHE() != null) {
                bare.append(ctx.APOSTROPHE().getText());
            }
            return null;
        }
    }
}
