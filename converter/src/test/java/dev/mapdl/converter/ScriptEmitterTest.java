package dev.mapdl.converter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScriptEmitterTest {

    @Test
    void indentsByScope() {
        ScriptEmitter emitter = new ScriptEmitter();
        emitter.emitStatement("with mapdl.non_interactive:");
        emitter.enterScope();
        emitter.emitStatement("mapdl.run(\"*DO,I,1,2\")", "loop");
        emitter.emitComment("inside");
        emitter.exitScope();
        emitter.emitComment("");
        emitter.emitBlank();

        assertEquals(List.of(
            "with mapdl.non_interactive:",
            "    mapdl.run(\"*DO,I,1,2\")  # loop",
            "    # inside",
            "#",
            ""
        ), emitter.lines());
        assertEquals(0, emitter.depth());
    }

    @Test
    void refusesToExitBelowZero() {
        ScriptEmitter emitter = new ScriptEmitter();

        assertThrows(IllegalStateException.class, emitter::exitScope);
    }

    @Test
    void removesLastLine() {
        ScriptEmitter emitter = new ScriptEmitter();
        emitter.emitStatement("a");
        emitter.emitStatement("b");

        assertEquals("b", emitter.removeLast());
        assertEquals("a", emitter.lastLine());
        assertEquals(1, emitter.size());
    }

    @Test
    void rendersArguments() {
        assertEquals("1", ScriptEmitter.argument(" 1 "));
        assertEquals("-2.5E-3", ScriptEmitter.argument("-2.5E-3"));
        assertEquals(".5", ScriptEmitter.argument(".5"));
        assertEquals("\"inf\"", ScriptEmitter.argument("inf"));
        assertEquals("\"BEAM188\"", ScriptEmitter.argument("'BEAM188'"));
        assertEquals("\"\"", ScriptEmitter.argument(""));
        assertEquals("\"C:\\\\work\\\\model\"", ScriptEmitter.argument("C:\\work\\model"));
    }

    @Test
    void recognizesNumbers() {
        assertTrue(ScriptEmitter.isNumber("10"));
        assertTrue(ScriptEmitter.isNumber("+1.e5"));
        assertFalse(ScriptEmitter.isNumber("1_000"));
        assertFalse(ScriptEmitter.isNumber("ALL"));
    }

    @Test
    void rendersCalls() {
        assertEquals("mapdl.finish()", ScriptEmitter.call("mapdl.finish", List.of()));
        assertEquals("mapdl.k(1, \"X\")", ScriptEmitter.call("mapdl.k", List.of("1", "\"X\"")));
    }

    @Test
    void buildsPythonIdentifiers() {
        assertEquals("my_mac", ScriptEmitter.toPythonIdentifier("My-Mac"));
        assertEquals("_1abc", ScriptEmitter.toPythonIdentifier("1abc"));
        assertEquals("def_", ScriptEmitter.toPythonIdentifier("def"));
        assertEquals("_", ScriptEmitter.toPythonIdentifier(""));
    }

    @Test
    void truncatesLongText() {
        String text = "x".repeat(80);

        assertEquals(60, ScriptEmitter.truncate(text).length());
        assertTrue(ScriptEmitter.truncate(text).endsWith("..."));
        assertEquals("short", ScriptEmitter.truncate("short"));
    }
}
