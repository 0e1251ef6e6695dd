package org.pragmatica.dvrtl.error;

import org.pragmatica.dvrtl.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A circuit error rendered for humans, Rust style: the offending lines are quoted and the span
 * of the error is underlined.
 *
 * <p>Example output:
 * <pre>
 * error[E0103]: Module 'add2' expects 2 argument(s) but got 1 at 2:5
 *   --> adder.dv:2:5
 *   |
 * 2 | x = add2(0)
 *   |     ^^^^^^^ wrong number of arguments
 *   |
 *   = help: add2 is declared with 2 parameter(s)
 * </pre>
 *
 * @param code    error code, e.g. "E0001"
 * @param message primary error message
 * @param span    source span the underline covers
 * @param label   text printed after the underline
 * @param notes   trailing notes and help
 */
public record Diagnostic(
    String code,
    String message,
    SourceSpan span,
    Optional<String> label,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(code, message, span, Optional.empty(), List.of());
    }

    /**
     * Build the diagnostic for a circuit error, with a label and a hint matching its kind.
     */
    public static Diagnostic of(CircuitError error) {
        var diagnostic = error(error.code(), error.message(), error.span());
        if (error instanceof CircuitError.UnexpectedInput unexpected) {
            return diagnostic.withLabel("expected " + unexpected.expected());
        }
        if (error instanceof CircuitError.UnexpectedEof eof) {
            return diagnostic.withLabel("expected " + eof.expected());
        }
        if (error instanceof CircuitError.InputTooLarge) {
            return diagnostic.withHelp("raise maxInputSize in the parser configuration");
        }
        if (error instanceof CircuitError.NestingTooDeep) {
            return diagnostic.withLabel("nesting limit reached here")
                             .withHelp("split the expression into named bindings or raise maxDepth");
        }
        if (error instanceof CircuitError.DuplicateDefinition duplicate) {
            return diagnostic.withLabel("'" + duplicate.name() + "' redefined here")
                             .withHelp("every register, binding and parameter name must be unique within its scope");
        }
        if (error instanceof CircuitError.UnknownModule unknown) {
            return diagnostic.withLabel("not a module")
                             .withHelp("bind a module first, e.g. " + unknown.name() + " = mod(a){ out a }");
        }
        if (error instanceof CircuitError.ArityMismatch arity) {
            return diagnostic.withLabel("wrong number of arguments")
                             .withHelp(arity.name() + " is declared with " + arity.expected() + " parameter(s)");
        }
        if (error instanceof CircuitError.MissingOutput) {
            return diagnostic.withLabel("module body ends without output")
                             .withHelp("only an anonymous top-level module may omit 'out'");
        }
        if (error instanceof CircuitError.MisplacedResult) {
            return diagnostic.withLabel("'res' not allowed here");
        }
        return diagnostic.withNote("the parse tree does not match the circuit grammar");
    }

    public Diagnostic withLabel(String text) {
        return new Diagnostic(code, message, span, Optional.of(text), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, span, label, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Render against the source text the span points into.
     * Every quoted line is underlined; the label follows the last underline.
     */
    public String format(String source, String filename) {
        var lines = source.split("\n", -1);
        var start = span.start();
        int firstLine = Math.max(1, start.line());
        int lastLine = Math.min(Math.max(firstLine, span.end().line()), lines.length);
        int gutterWidth = String.valueOf(lastLine).length();
        var gutter = " ".repeat(gutterWidth + 1);

        var sb = new StringBuilder();
        sb.append("error[").append(code).append("]: ").append(message).append("\n");
        sb.append("  --> ").append(filename).append(":")
          .append(start.line()).append(":").append(start.column()).append("\n");
        sb.append(gutter).append("|\n");

        for (int lineNum = firstLine; lineNum <= lastLine; lineNum++) {
            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum)).append(" | ").append(lineContent).append("\n");
            sb.append(gutter).append("| ").append(underline(lineNum, lineContent));
            if (lineNum == lastLine) {
                label.ifPresent(text -> sb.append(" ").append(text));
            }
            sb.append("\n");
        }

        sb.append(gutter).append("|\n");
        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    private String underline(int lineNum, String lineContent) {
        int startCol = span.start().line() == lineNum ? span.start().column() : 1;
        int endCol = span.end().line() == lineNum ? span.end().column() : lineContent.length() + 1;
        return " ".repeat(Math.max(0, startCol - 1)) + "^".repeat(Math.max(1, endCol - startCol));
    }
}
