package org.pragmatica.dvrtl.ast;

/**
 * Outcome of evaluating a verification statement: the run either continues or fails.
 */
public enum Order implements SyntaxNode {
    SKIP("skip"),
    FAIL("fail");

    private final String keyword;

    Order(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String serialize() {
        return keyword;
    }
}
