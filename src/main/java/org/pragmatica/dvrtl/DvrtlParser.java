package org.pragmatica.dvrtl;

import org.pragmatica.dvrtl.parser.CircuitEngine;
import org.pragmatica.dvrtl.parser.Parser;
import org.pragmatica.dvrtl.parser.ParserConfig;

/**
 * Entry point for creating circuit parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = DvrtlParser.create();
 *
 * var circuit = parser.parse("""
 *     A -> 0, A xor b
 *     assert A eq A
 *     """);
 * System.out.print(circuit.serialize());
 * }</pre>
 */
public final class DvrtlParser {
    private DvrtlParser() {}

    /**
     * Create a parser with the default configuration.
     */
    public static Parser create() {
        return create(ParserConfig.DEFAULT);
    }

    /**
     * Create a parser with custom configuration.
     */
    public static Parser create(ParserConfig config) {
        return CircuitEngine.create(config);
    }

    /**
     * Create a builder for parser configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean forwardReferences = ParserConfig.DEFAULT.forwardReferences();
        private int maxInputSize = ParserConfig.DEFAULT.maxInputSize();
        private int maxDepth = ParserConfig.DEFAULT.maxDepth();

        private Builder() {}

        public Builder forwardReferences(boolean enabled) {
            this.forwardReferences = enabled;
            return this;
        }

        public Builder maxInputSize(int size) {
            this.maxInputSize = size;
            return this;
        }

        public Builder maxDepth(int depth) {
            this.maxDepth = depth;
            return this;
        }

        public Parser build() {
            return create(new ParserConfig(forwardReferences, maxInputSize, maxDepth));
        }
    }
}
