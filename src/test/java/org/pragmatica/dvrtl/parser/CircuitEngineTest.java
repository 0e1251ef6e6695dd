package org.pragmatica.dvrtl.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pragmatica.dvrtl.error.CircuitError;
import org.pragmatica.dvrtl.error.CircuitException;
import org.pragmatica.dvrtl.tree.CstPrinter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CircuitEngineTest {

    private final Parser parser = CircuitEngine.create(ParserConfig.DEFAULT);

    @Test
    void parse_validSource_returnsCircuit() {
        var circuit = parser.parse("A -> 0, A xor b\nassert A eq A");

        assertEquals("A -> 0, xor A b\nassert eq A A\n", circuit.serialize());
    }

    @Test
    void parseTree_returnsUntransformedTree() {
        var tree = parser.parseTree("x = foo(0, 1)");

        assertEquals("start\n  bind\n    x\n    call\n      foo\n      list_of_expr\n        0\n        1\n",
                     CstPrinter.pretty(tree));
    }

    @Test
    void transform_acceptsTreeFromParseTree() {
        var tree = parser.parseTree("B -> 0, B");

        assertEquals("B -> 0, B\n", parser.transform(tree).serialize());
        assertEquals("B -> 0, B\n", parser.transform(tree).serialize());
    }

    @Test
    void parseFile_readsSource(@TempDir Path dir) throws IOException {
        var file = dir.resolve("mini.dv");
        Files.writeString(file, "B -> 0, B\n");

        assertEquals("B -> 0, B\n", parser.parseFile(file).serialize());
    }

    @Test
    void parseFile_missingFile_throwsIOException(@TempDir Path dir) {
        assertThrows(IOException.class, () -> parser.parseFile(dir.resolve("absent.dv")));
    }

    @Test
    void parse_inputOverLimit_failsWithInputTooLarge() {
        var small = CircuitEngine.create(new ParserConfig(true, 8, 16));

        var exception = assertThrows(CircuitException.class, () -> small.parse("A -> 0, A xor b"));

        var error = assertInstanceOf(CircuitError.InputTooLarge.class, exception.error());
        assertEquals(15, error.size());
        assertEquals(8, error.limit());
    }

    @Test
    void config_rejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig(true, 0, 16));
        assertThrows(IllegalArgumentException.class, () -> new ParserConfig(true, 64, 0));
    }

    // === Nesting ===

    @Test
    void parseWithDiagnostics_deeplyParenthesized_reportsNestingTooDeep() {
        var source = "x = " + "(".repeat(5000) + "a" + ")".repeat(5000);

        var outcome = parser.parseWithDiagnostics(source);

        assertFalse(outcome.isSuccess());
        assertEquals("E0004", outcome.diagnostics().get(0).code());
    }

    @Test
    void parseWithDiagnostics_deepPrefixChain_reportsNestingTooDeep() {
        var outcome = parser.parseWithDiagnostics("x = " + "xor a ".repeat(5000) + "b");

        assertFalse(outcome.isSuccess());
        assertEquals("E0004", outcome.diagnostics().get(0).code());
    }

    @Test
    void parseWithDiagnostics_longInfixChain_reportsNestingTooDeep() {
        var outcome = parser.parseWithDiagnostics("x = " + "a xor ".repeat(5000) + "b");

        assertFalse(outcome.isSuccess());
        assertEquals("E0004", outcome.diagnostics().get(0).code());
    }

    @Test
    void parseWithDiagnostics_deepArithmetic_reportsNestingTooDeep() {
        var outcome = parser.parseWithDiagnostics("assert " + "not ".repeat(5000) + "a");

        assertFalse(outcome.isSuccess());
        assertEquals("E0004", outcome.diagnostics().get(0).code());
    }

    @Test
    void parse_nestingWithinLimit_succeeds() {
        var circuit = parser.parse("x = " + "(".repeat(100) + "a xor b" + ")".repeat(100));

        assertEquals("x = xor a b\n", circuit.serialize());
    }

    @Test
    void parse_nestingOverConfiguredLimit_failsWithNestingTooDeep() {
        var shallow = CircuitEngine.create(new ParserConfig(true, 1_000, 4));

        var exception = assertThrows(CircuitException.class, () -> shallow.parse("x = ((((a))))"));

        var error = assertInstanceOf(CircuitError.NestingTooDeep.class, exception.error());
        assertEquals(4, error.limit());
    }

    // === Diagnostics ===

    @Test
    void parseWithDiagnostics_validSource_succeeds() {
        var outcome = parser.parseWithDiagnostics("B -> 0, B");

        assertTrue(outcome.isSuccess());
        assertFalse(outcome.hasErrors());
        assertEquals("", outcome.formatDiagnostics());
    }

    @Test
    void parseWithDiagnostics_arityMismatch_reportsDiagnostic() {
        var source = "add2 = mod(a, b){ a xor b }\nx = add2(0)";

        var outcome = parser.parseWithDiagnostics(source);

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.circuit().isEmpty());
        assertEquals(1, outcome.diagnostics().size());
        assertTrue(outcome.hasErrors());

        var expected = """
            error[E0103]: Module 'add2' expects 2 argument(s) but got 1 at 2:5
              --> input:2:5
              |
            2 | x = add2(0)
              |     ^^^^^^^ wrong number of arguments
              |
              = help: add2 is declared with 2 parameter(s)

            """;
        assertEquals(expected, outcome.formatDiagnostics());
    }

    @Test
    void parseWithDiagnostics_syntaxError_pointsAtToken() {
        var outcome = parser.parseWithDiagnostics("A -> 0, A )");

        var diagnostic = outcome.diagnostics().get(0);
        assertEquals("E0001", diagnostic.code());
        assertEquals(11, diagnostic.span().start().column());
        assertTrue(outcome.formatDiagnostics("bad.dv").contains("--> bad.dv:1:11"));
    }
}
