package org.pragmatica.dvrtl.parser;

import org.pragmatica.dvrtl.ast.Circuit;
import org.pragmatica.dvrtl.error.CircuitError;
import org.pragmatica.dvrtl.error.CircuitException;
import org.pragmatica.dvrtl.grammar.CircuitGrammar;
import org.pragmatica.dvrtl.transform.TreeTransformer;
import org.pragmatica.dvrtl.tree.CstNode;
import org.pragmatica.dvrtl.tree.SourceLocation;
import org.pragmatica.dvrtl.tree.SourceSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Default {@link Parser}: the hand-written grammar followed by a fresh {@link TreeTransformer} per call.
 */
public final class CircuitEngine implements Parser {
    private static final Logger log = LoggerFactory.getLogger(CircuitEngine.class);

    private final ParserConfig config;

    private CircuitEngine(ParserConfig config) {
        this.config = config;
    }

    public static CircuitEngine create(ParserConfig config) {
        return new CircuitEngine(config);
    }

    public ParserConfig config() {
        return config;
    }

    @Override
    public CstNode parseTree(String input) {
        if (input.length() > config.maxInputSize()) {
            throw new CircuitException(new CircuitError.InputTooLarge(SourceSpan.at(SourceLocation.START),
                                                                      input.length(),
                                                                      config.maxInputSize()));
        }
        return CircuitGrammar.parse(input, config.maxDepth());
    }

    @Override
    public Circuit parse(String input) {
        return transform(parseTree(input));
    }

    @Override
    public Circuit transform(CstNode tree) {
        return TreeTransformer.create(config.forwardReferences(), config.maxDepth())
                              .transform(tree);
    }

    @Override
    public Circuit parseFile(Path path) throws IOException {
        log.debug("Parsing file {}", path);
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    @Override
    public ParseOutcome parseWithDiagnostics(String input) {
        try {
            return ParseOutcome.success(parse(input), input);
        } catch (CircuitException e) {
            log.debug("Parse failed: {}", e.getMessage());
            return ParseOutcome.failure(e.toDiagnostic(), input);
        }
    }
}
