package org.pragmatica.dvrtl.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.dvrtl.DvrtlParser;
import org.pragmatica.dvrtl.error.CircuitError;
import org.pragmatica.dvrtl.error.CircuitException;

import static org.junit.jupiter.api.Assertions.*;

class DvrtlParserTest {

    private static final String CALL_BEFORE_DEFINITION = """
        x = inv(1)
        inv = mod(a){ out a xor 1 }
        """;

    @Test
    void create_usesDefaultConfig() {
        var parser = assertInstanceOf(CircuitEngine.class, DvrtlParser.create());

        assertEquals(ParserConfig.DEFAULT, parser.config());
    }

    @Test
    void create_defaultConfig_allowsCallBeforeDefinition() {
        var circuit = DvrtlParser.create().parse(CALL_BEFORE_DEFINITION);

        assertEquals("x = inv(1)\ninv = mod(a){ out xor a 1 }\n", circuit.serialize());
    }

    @Test
    void builder_withoutForwardReferences_requiresDefinitionBeforeUse() {
        var parser = DvrtlParser.builder()
                                .forwardReferences(false)
                                .build();

        var exception = assertThrows(CircuitException.class, () -> parser.parse(CALL_BEFORE_DEFINITION));

        assertInstanceOf(CircuitError.UnknownModule.class, exception.error());
    }

    @Test
    void builder_setsLimits() {
        var parser = assertInstanceOf(CircuitEngine.class, DvrtlParser.builder()
                                                                      .maxInputSize(64)
                                                                      .maxDepth(32)
                                                                      .build());

        assertEquals(new ParserConfig(true, 64, 32), parser.config());
    }
}
