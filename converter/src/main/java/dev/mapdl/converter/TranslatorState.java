package dev.mapdl.converter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of one translation run. Created by
 * {@link ScriptTranslator#newState()} and advanced one line at a time; not
 * safe for use from more than one thread.
 */
public final class TranslatorState {

    static final class FunctionFrame {
        final String name;
        final int windowDepth;
        final int bodyStart;

        FunctionFrame(String name, int windowDepth, int bodyStart) {
            this.name = name;
            this.windowDepth = windowDepth;
            this.bodyStart = bodyStart;
        }
    }

    final ScriptEmitter emitter = new ScriptEmitter();
    final Deque<FunctionFrame> functions = new ArrayDeque<>();
    final Set<String> functionNames = new LinkedHashSet<>();
    final List<TranslationWarning> warnings = new ArrayList<>();

    int nonInteractiveDepth;
    int windowsOpened;
    int windowsClosed;

    boolean inBlock;
    BlockKind blockKind = BlockKind.NONE;
    String blockCommand;
    int blockCount;
    int blockCountTarget;

    int preambleEnd;
    int lineNumber;
    String sourceLine = "";

    TranslatorState() {
    }

    public int nonInteractiveDepth() {
        return nonInteractiveDepth;
    }

    public boolean nonInteractive() {
        return nonInteractiveDepth > 0;
    }

    public boolean inBlock() {
        return inBlock;
    }

    public BlockKind blockKind() {
        return blockKind;
    }

    public int blockCount() {
        return blockCount;
    }

    public int blockCountTarget() {
        return blockCountTarget;
    }

    public boolean inFunction() {
        return !functions.isEmpty();
    }

    public int functionDepth() {
        return functions.size();
    }

    public Set<String> functionNames() {
        return Collections.unmodifiableSet(functionNames);
    }

    public String indentation() {
        return emitter.indentation();
    }

    public List<String> output() {
        return emitter.lines();
    }

    public List<TranslationWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    /** Lowest window depth a close request may reach from the current function body. */
    int windowFloor() {
        FunctionFrame frame = functions.peek();
        return frame == null ? 0 : frame.windowDepth;
    }

    void resetBlock() {
        inBlock = false;
        blockKind = BlockKind.NONE;
        blockCommand = null;
        blockCount = 0;
        blockCountTarget = 0;
    }
}
