package dev.mapdl.converter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts an APDL command script into a PyMAPDL program, one line at a time.
 * <p>
 * Each line is classified, matched against the {@link CommandCatalog} and
 * emitted either as a structured method call on the facade object or as a
 * {@code run("...")} passthrough. Loops, conditionals, redirections and data
 * blocks are kept as opaque commands inside a {@code with mapdl.non_interactive:}
 * window so the solver receives them together.
 * <p>
 * Instances only hold configuration and can be reused; every run works on its
 * own {@link TranslatorState}.
 */
public final class ScriptTranslator {

    private static final Logger log = LoggerFactory.getLogger(ScriptTranslator.class);

    private static final class Call {
        final String target;
        final List<String> args;

        Call(String target, List<String> args) {
            this.target = target;
            this.args = args;
        }

        String render() {
            return ScriptEmitter.call(target, args);
        }
    }

    static final int MACRO_ARGUMENTS = 18;

    private static final Pattern MACRO_ARGUMENT = Pattern.compile("\\bARG(1[0-8]|[1-9])\\b", Pattern.CASE_INSENSITIVE);

    private static final String MUTED_NOTE = "It is not recommended to use '/NOPR' in a normal PyMAPDL session.";

    private final TranslatorOptions options;
    private final DriverFacade facade;
    private final LineClassifier classifier = new LineClassifier();

    public ScriptTranslator() {
        this(TranslatorOptions.defaults());
    }

    public ScriptTranslator(TranslatorOptions options) {
        this(options, DriverFacade.bundled(options.objectName()));
    }

    public ScriptTranslator(TranslatorOptions options, DriverFacade facade) {
        this.options = Objects.requireNonNull(options, "options");
        this.facade = Objects.requireNonNull(facade, "facade");
    }

    public TranslatorOptions options() {
        return options;
    }

    public TranslationResult translateFile(Path source) throws IOException {
        Objects.requireNonNull(source, "source");
        List<String> lines = Files.readAllLines(source, StandardCharsets.UTF_8);
        log.debug("Read {} lines from {}", lines.size(), source);
        return translate(lines);
    }

    /** Translates a whole script held in one string; both LF and CRLF are accepted. */
    public TranslationResult translate(String script) {
        Objects.requireNonNull(script, "script");
        return translate(Arrays.asList(script.split("\\r?\\n", -1)));
    }

    public TranslationResult translate(List<String> script) {
        Objects.requireNonNull(script, "script");
        TranslatorState state = newState();
        for (int i = 0; i < script.size(); i++) {
            step(state, script.get(i), i + 1);
        }
        return finish(state);
    }

    /** Fresh state with the program preamble already emitted. */
    public TranslatorState newState() {
        TranslatorState state = new TranslatorState();
        ScriptEmitter out = state.emitter;
        out.emitStatement("\"\"\"Script generated by mapdl-converter version "
            + TranslatorOptions.converterVersion() + "\"\"\"");
        out.emitStatement("from ansys.mapdl.core import launch_mapdl");
        List<String> launchArgs = new ArrayList<>();
        if (options.execFile() != null && !options.execFile().isBlank()) {
            launchArgs.add(ScriptEmitter.stringLiteral(options.execFile()));
        }
        launchArgs.add("loglevel=" + ScriptEmitter.stringLiteral(options.logLevel()));
        out.emitStatement(options.objectName() + " = " + ScriptEmitter.call("launch_mapdl", launchArgs));
        state.preambleEnd = out.size();
        return state;
    }

    public void step(TranslatorState state, String rawLine, int lineNumber) {
        ClassifiedLine line = classifier.classify(rawLine, lineNumber, state.inBlock);
        state.lineNumber = lineNumber;
        state.sourceLine = line.raw();
        step(state, line);
    }

    void step(TranslatorState state, ClassifiedLine line) {
        if (advanceBlock(state, line)) {
            return;
        }
        switch (line.kind()) {
            case BLANK:
                return;
            case COMMENT_ONLY:
                state.emitter.emitComment(line.comment());
                return;
            case ASSIGNMENT:
                storeRunCommand(state, line.code(), line.comment());
                return;
            default:
                break;
        }

        CommandCategory category = CommandCatalog.categoryOf(line.command());
        if (category == CommandCategory.NORMAL && line.mentionsConditional()) {
            category = CommandCategory.CONTROL_CONDITIONAL;
        }
        if (log.isTraceEnabled()) {
            log.trace("{} -> {}", refine(line, category), category);
        }

        switch (category) {
            case CONTROL_LOOP:
                startNonInteractive(state);
                storeRunCommand(state, line.code(), line.comment());
                return;
            case CONTROL_LOOP_END:
            case CONTROL_CONDITIONAL_END:
                storeRunCommand(state, line.code(), line.comment());
                endNonInteractive(state);
                return;
            case CONTROL_CONDITIONAL:
                startNonInteractive(state);
                storeRunCommand(state, line.code(), line.comment());
                if (!opensConditionalBlock(line)) {
                    endNonInteractive(state);
                }
                return;
            case CONTROL_BRANCH:
                if (!state.nonInteractive()) {
                    warn(state, TranslationWarning.Kind.SUSPICIOUS_PASSTHROUGH,
                        line.command() + " outside of an *IF block. The previous line is: " + state.emitter.lastLine().strip());
                }
                storeRunCommand(state, line.code(), line.comment());
                return;
            case OUTPUT_REDIRECT:
                if (redirectsToFile(line)) {
                    startNonInteractive(state);
                    storeRunCommand(state, line.code(), line.comment());
                } else {
                    restoreOutput(state, line);
                }
                return;
            case OUTPUT_CLOSE:
                restoreOutput(state, line);
                return;
            case FUNCTION_OPEN:
                openFunction(state, line);
                return;
            case FUNCTION_CLOSE:
                closeFunction(state, line);
                return;
            case FUNCTION_CALL:
                callFunction(state, line);
                return;
            case REPEAT:
                repeatPrevious(state, line);
                return;
            case VERIFY:
                storeRunCommand(state, "FINISH", "");
                storeRunCommand(state, line.code(), line.comment());
                storeRunCommand(state, "/PREP7", "");
                return;
            case TITLE:
                storeTitle(state, line);
                return;
            case QUERY:
                if (state.nonInteractive() || !options.useFunctionNames()) {
                    storeRunCommand(state, line.code(), line.comment());
                } else {
                    storeCommand(state, "get", line.arguments(), line.comment(), line.code());
                }
                return;
            case MUTED:
                storeRunCommand(state, line.code(), MUTED_NOTE, true);
                return;
            case RAW:
            case BLOCK_END:
                storeRunCommand(state, line.code(), line.comment());
                return;
            case FORBIDDEN:
                if (!state.nonInteractive()) {
                    throw new TranslationException("Command " + line.command()
                        + " cannot be translated outside a non-interactive window", line.lineNumber(), line.raw());
                }
                storeRunCommand(state, line.code(), line.comment());
                return;
            default:
                break;
        }

        if (line.isFormatLine()) {
            storeFormatLine(state, line);
            return;
        }

        switch (category) {
            case BLOCK_FIXED:
            case BLOCK_COUNTED:
                openBlock(state, line, category);
                return;
            case BATCHED_WRITE:
                startNonInteractive(state);
                storeRunCommand(state, line.code(), line.comment());
                return;
            default:
                break;
        }

        String method = options.useFunctionNames() ? facade.methodFor(line.command()).orElse(null) : null;
        if (method != null) {
            storeCommand(state, method, line.arguments(), line.comment(), line.code());
        } else {
            storeRunCommand(state, line.code(), line.comment());
        }
    }

    /** Closes whatever is still open and appends the exit call. */
    public TranslationResult finish(TranslatorState state) {
        if (state.inBlock) {
            unbalanced(state, TranslationWarning.Kind.UNBALANCED_BLOCK,
                "Script ended inside " + state.blockCommand + " block");
            endBlock(state);
        }
        while (state.inFunction()) {
            unbalanced(state, TranslationWarning.Kind.UNBALANCED_FUNCTION,
                "Script ended inside macro " + state.functions.peek().name + " without *END");
            endFunction(state);
        }
        if (state.nonInteractive()) {
            unbalanced(state, TranslationWarning.Kind.UNBALANCED_WINDOW,
                "Script ended with " + state.nonInteractiveDepth + " non-interactive request(s) still open");
            while (state.nonInteractive()) {
                endNonInteractive(state);
            }
        }
        if (options.autoExit()) {
            state.emitter.emitStatement(options.objectName() + ".exit()");
        }
        return new TranslationResult(state.emitter.lines(), state.warnings, options.lineEnding(),
            state.windowsOpened, state.windowsClosed);
    }

    private boolean advanceBlock(TranslatorState state, ClassifiedLine line) {
        if (!state.inBlock) {
            return false;
        }
        state.blockCount++;
        switch (line.kind()) {
            case BLANK:
                break;
            case COMMENT_ONLY:
                state.emitter.emitComment(line.comment());
                break;
            default:
                storeRunCommand(state, line.code(), line.comment());
                break;
        }
        if (state.blockKind == BlockKind.COUNTED) {
            if (state.blockCountTarget > 0 && state.blockCount >= state.blockCountTarget) {
                endBlock(state);
            }
        } else if (line.kind() != LineKind.COMMENT_ONLY && CommandCatalog.isBlockTerminator(line)) {
            endBlock(state);
        }
        return true;
    }

    private void openBlock(TranslatorState state, ClassifiedLine line, CommandCategory category) {
        int target = 0;
        if (category == CommandCategory.BLOCK_COUNTED) {
            String count = line.field(CommandCatalog.COMPONENT_COUNT_FIELD);
            try {
                target = CommandCatalog.countedBlockLines(Integer.parseInt(count));
            } catch (IllegalArgumentException e) {
                throw new TranslationException("Malformed " + line.command() + " item count '" + count + "'",
                    line.lineNumber(), line.raw(), e);
            }
        }
        startNonInteractive(state);
        storeRunCommand(state, line.code(), line.comment());
        state.inBlock = true;
        state.blockKind = CommandCatalog.blockKind(line.command());
        state.blockCommand = line.command();
        state.blockCount = 1;
        state.blockCountTarget = target;
        log.debug("Line {}: {} block opened, target {}", line.lineNumber(), state.blockCommand, target);
    }

    private void endBlock(TranslatorState state) {
        log.debug("Line {}: {} block closed after {} line(s)", state.lineNumber, state.blockCommand, state.blockCount);
        state.resetBlock();
        endNonInteractive(state);
    }

    private void startNonInteractive(TranslatorState state) {
        state.nonInteractiveDepth++;
        if (state.nonInteractiveDepth > 1) {
            return;
        }
        state.emitter.emitStatement("with " + options.objectName() + ".non_interactive:");
        state.emitter.enterScope();
        state.windowsOpened++;
        log.debug("Line {}: non-interactive window opened", state.lineNumber);
    }

    private void endNonInteractive(TranslatorState state) {
        if (state.nonInteractiveDepth <= state.windowFloor()) {
            log.debug("Line {}: ignoring window close at depth {}", state.lineNumber, state.nonInteractiveDepth);
            return;
        }
        state.nonInteractiveDepth--;
        if (state.nonInteractiveDepth == 0) {
            state.emitter.exitScope();
            state.windowsClosed++;
            log.debug("Line {}: non-interactive window closed", state.lineNumber);
        }
    }

    private boolean opensConditionalBlock(ClassifiedLine line) {
        for (String field : line.fields()) {
            if ("THEN".equalsIgnoreCase(field)) {
                return true;
            }
        }
        return false;
    }

    private boolean redirectsToFile(ClassifiedLine line) {
        if (line.token().startsWith("*CF")) {
            return true;
        }
        String target = line.field(1).toUpperCase(Locale.ROOT);
        return !target.isEmpty() && !"TERM".equals(target);
    }

    private void restoreOutput(TranslatorState state, ClassifiedLine line) {
        endNonInteractive(state);
        storeRunCommand(state, line.code(), line.comment());
        storeRunCommand(state, "/GOPR", "");
    }

    private void storeFormatLine(TranslatorState state, ClassifiedLine line) {
        if (!state.nonInteractive()) {
            warn(state, TranslationWarning.Kind.SUSPICIOUS_PASSTHROUGH,
                "Possible invalid line " + line.code() + ": it requires a *VWRITE beforehand. The previous line is: "
                    + state.emitter.lastLine().strip());
        }
        storeRunCommand(state, line.code(), line.comment());
        endNonInteractive(state);
    }

    private void repeatPrevious(TranslatorState state, ClassifiedLine line) {
        if (state.nonInteractive()) {
            storeRunCommand(state, line.code(), line.comment());
            return;
        }
        boolean movable = state.emitter.size() > state.preambleEnd
            && isMovableStatement(state.emitter.lastLine(), state.emitter.indentation());
        String previous = movable ? state.emitter.removeLast() : null;
        startNonInteractive(state);
        if (previous != null) {
            state.emitter.emitVerbatim(ScriptEmitter.INDENT_UNIT + previous);
        }
        storeRunCommand(state, line.code(), line.comment());
        endNonInteractive(state);
    }

    /** Plain statement at exactly {@code indentation}; blanks, comments and block headers never qualify. */
    private static boolean isMovableStatement(String previous, String indentation) {
        String statement = previous.stripLeading();
        if (statement.isEmpty() || statement.startsWith("#") || statement.endsWith(":")) {
            return false;
        }
        return previous.length() - statement.length() == indentation.length();
    }

    private void openFunction(TranslatorState state, ClassifiedLine line) {
        String name = line.field(1);
        if (!options.macrosAsFunctions() || name.isEmpty()) {
            startNonInteractive(state);
            storeRunCommand(state, line.code(), line.comment());
            return;
        }
        String functionName = ScriptEmitter.toPythonIdentifier(name);
        state.functionNames.add(functionName);
        ScriptEmitter out = state.emitter;
        out.emitBlank();
        out.emitBlank();
        String continuation = out.indentation() + " ".repeat(functionName.length() + 5);
        int perLine = MACRO_ARGUMENTS / 3;
        out.emitStatement("def " + functionName + "(" + macroParameters(1, perLine) + ",", line.comment());
        out.emitVerbatim(continuation + macroParameters(perLine + 1, 2 * perLine) + ",");
        out.emitVerbatim(continuation + macroParameters(2 * perLine + 1, MACRO_ARGUMENTS) + "):");
        out.enterScope();
        state.functions.push(new TranslatorState.FunctionFrame(functionName, state.nonInteractiveDepth, out.size()));
        log.debug("Line {}: macro {} translated as function", line.lineNumber(), functionName);
    }

    private static String macroParameters(int from, int to) {
        StringBuilder params = new StringBuilder();
        for (int i = from; i <= to; i++) {
            if (i > from) {
                params.append(", ");
            }
            params.append("ARG").append(i).append("=''");
        }
        return params.toString();
    }

    private void closeFunction(TranslatorState state, ClassifiedLine line) {
        if (state.inFunction()) {
            endFunction(state);
            return;
        }
        storeRunCommand(state, line.code(), line.comment());
        endNonInteractive(state);
    }

    private void endFunction(TranslatorState state) {
        TranslatorState.FunctionFrame frame = state.functions.peek();
        while (state.nonInteractiveDepth > frame.windowDepth) {
            endNonInteractive(state);
        }
        if (state.emitter.size() == frame.bodyStart) {
            state.emitter.emitStatement("pass");
        }
        state.functions.pop();
        state.emitter.exitScope();
        state.emitter.emitBlank();
        state.emitter.emitBlank();
    }

    private void callFunction(TranslatorState state, ClassifiedLine line) {
        String name = ScriptEmitter.toPythonIdentifier(line.field(1));
        if (!options.macrosAsFunctions() || !state.functionNames.contains(name)) {
            storeRunCommand(state, line.code(), line.comment());
            return;
        }
        List<String> fields = line.fields();
        List<String> args = new ArrayList<>();
        for (String field : fields.subList(Math.min(2, fields.size()), fields.size())) {
            args.add(parameter(state, field));
        }
        state.emitter.emitStatement(new Call(name, args).render(), line.comment());
    }

    private void storeTitle(TranslatorState state, ClassifiedLine line) {
        if (!options.useFunctionNames()) {
            storeRunCommand(state, line.code(), line.comment());
            return;
        }
        String code = line.code();
        int comma = code.indexOf(',');
        String title = comma < 0 ? "" : code.substring(comma + 1).strip();
        storeCommand(state, "title", List.of(title), line.comment(), code);
    }

    /**
     * Emits {@code mapdl.method(args)}. Inside a macro a parameter that embeds
     * an {@code ARGn} reference cannot be expressed as a literal, so the whole
     * line falls back to a formatted passthrough.
     */
    private void storeCommand(TranslatorState state, String method, List<String> parameters, String comment, String source) {
        List<String> args = new ArrayList<>();
        for (String parameter : parameters) {
            String value = parameter.strip();
            if (state.inFunction() && !isMacroArgument(value) && MACRO_ARGUMENT.matcher(value).find()) {
                storeRunCommand(state, source, comment);
                return;
            }
            args.add(parameter(state, value));
        }
        state.emitter.emitStatement(new Call(options.objectName() + "." + method, args).render(), comment);
    }

    private String parameter(TranslatorState state, String field) {
        String value = field.strip();
        if (state.inFunction() && isMacroArgument(value)) {
            return value.toUpperCase(Locale.ROOT);
        }
        return ScriptEmitter.argument(value);
    }

    private static boolean isMacroArgument(String value) {
        Matcher matcher = MACRO_ARGUMENT.matcher(value);
        return matcher.matches();
    }

    private void storeRunCommand(TranslatorState state, String command, String comment) {
        storeRunCommand(state, command, comment, false);
    }

    /**
     * Emits a {@code run("...")} passthrough. Inside a macro every
     * {@code ARGn} reference is substituted through {@code str.format}.
     */
    private void storeRunCommand(TranslatorState state, String command, String comment, boolean underscored) {
        String runner = options.objectName() + (underscored ? "._run" : ".run");
        if (state.inFunction() && MACRO_ARGUMENT.matcher(command).find()) {
            String template = ScriptEmitter.stringLiteral(command.replace("{", "{{").replace("}", "}}"));
            Map<String, Integer> slots = new LinkedHashMap<>();
            Matcher matcher = MACRO_ARGUMENT.matcher(template);
            StringBuffer formatted = new StringBuffer();
            while (matcher.find()) {
                String arg = matcher.group().toUpperCase(Locale.ROOT);
                Integer slot = slots.computeIfAbsent(arg, key -> slots.size());
                matcher.appendReplacement(formatted, Matcher.quoteReplacement("{" + slot + "}"));
            }
            matcher.appendTail(formatted);
            String call = runner + "(" + formatted + ".format(" + String.join(", ", slots.keySet()) + "))";
            state.emitter.emitStatement(call, comment);
            return;
        }
        state.emitter.emitStatement(runner + "(" + ScriptEmitter.stringLiteral(command) + ")", comment);
    }

    private ClassifiedLine refine(ClassifiedLine line, CommandCategory category) {
        switch (category) {
            case CONTROL_LOOP:
            case CONTROL_LOOP_END:
            case CONTROL_CONDITIONAL:
            case CONTROL_BRANCH:
            case CONTROL_CONDITIONAL_END:
                return line.withKind(LineKind.CONTROL);
            default:
                return line;
        }
    }

    private void warn(TranslatorState state, TranslationWarning.Kind kind, String message) {
        TranslationWarning warning = new TranslationWarning(kind, state.lineNumber, state.sourceLine, message);
        state.warnings.add(warning);
        log.warn("Line {}: {}", state.lineNumber, ScriptEmitter.truncate(message));
    }

    private void unbalanced(TranslatorState state, TranslationWarning.Kind kind, String message) {
        if (options.strict()) {
            throw new TranslationException(message, state.lineNumber, state.sourceLine);
        }
        warn(state, kind, message);
    }
}
