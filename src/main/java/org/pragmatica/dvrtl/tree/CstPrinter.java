package org.pragmatica.dvrtl.tree;

/**
 * Renders a parse tree as an indented outline, one node per line. Terminals print their text,
 * other nodes their production label.
 *
 * <pre>
 * start
 *   reg
 *     A
 *     0
 *     A
 * </pre>
 */
public final class CstPrinter {
    private static final String INDENT = "  ";

    private CstPrinter() {}

    public static String pretty(CstNode node) {
        var sb = new StringBuilder();
        print(node, 0, sb);
        return sb.toString();
    }

    private static void print(CstNode node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth));
        if (node instanceof CstNode.Terminal terminal) {
            sb.append(terminal.text())
              .append('\n');
            return;
        }
        var nonTerminal = (CstNode.NonTerminal) node;
        sb.append(nonTerminal.rule())
          .append('\n');
        for (var child : nonTerminal.children()) {
            print(child, depth + 1, sb);
        }
    }
}
