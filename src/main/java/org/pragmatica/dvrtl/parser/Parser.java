package org.pragmatica.dvrtl.parser;

import org.pragmatica.dvrtl.ast.Circuit;
import org.pragmatica.dvrtl.error.CircuitException;
import org.pragmatica.dvrtl.tree.CstNode;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Parser interface - turns circuit source text into a {@link Circuit}.
 *
 * <p>Implementations keep no state between calls; every call runs an independent pass.
 */
public interface Parser {

    /**
     * Parse input into its parse tree without transforming it.
     *
     * @throws CircuitException on a syntax error
     */
    CstNode parseTree(String input);

    /**
     * Parse and transform input into a circuit.
     *
     * @throws CircuitException on a syntax or well-formedness error
     */
    Circuit parse(String input);

    /**
     * Transform an already built parse tree into a circuit.
     *
     * @throws CircuitException on a well-formedness error
     */
    Circuit transform(CstNode tree);

    /**
     * Read a source file (UTF-8) and parse it.
     *
     * @throws IOException if the file cannot be read
     * @throws CircuitException on a syntax or well-formedness error
     */
    Circuit parseFile(Path path) throws IOException;

    /**
     * Parse input and report failure as diagnostics instead of throwing.
     */
    ParseOutcome parseWithDiagnostics(String input);
}
