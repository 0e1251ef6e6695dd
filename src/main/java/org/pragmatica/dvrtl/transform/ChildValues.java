package org.pragmatica.dvrtl.transform;

import org.pragmatica.dvrtl.ast.Arith;
import org.pragmatica.dvrtl.ast.Expr;
import org.pragmatica.dvrtl.ast.Symbol;
import org.pragmatica.dvrtl.error.CircuitError;
import org.pragmatica.dvrtl.error.CircuitException;
import org.pragmatica.dvrtl.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Transformed children of a parse tree node, passed to its {@link Production}.
 *
 * <p>Typed access coerces between syntactic levels: a {@link Symbol} read as an {@link Expr}
 * becomes a reference, and an expression read as an {@link Arith} is lifted into a term.
 */
final class ChildValues {
    private final String rule;
    private final SourceSpan span;
    private final List<Object> values;

    private ChildValues(String rule, SourceSpan span, List<Object> values) {
        this.rule = rule;
        this.span = span;
        this.values = values;
    }

    static ChildValues of(String rule, SourceSpan span, List<Object> values) {
        return new ChildValues(rule, span, List.copyOf(values));
    }

    SourceSpan span() {
        return span;
    }

    int size() {
        return values.size();
    }

    List<Object> values() {
        return values;
    }

    /**
     * Child value at the index, converted to the requested type.
     *
     * @throws CircuitException with {@link CircuitError.MalformedTree} if there is no such child or it has another kind
     */
    <T> T get(int index, Class<T> type) {
        if (index < 0 || index >= values.size()) {
            throw malformed("expected a " + describe(type) + " at position " + index + " but found "
                            + values.size() + " child(ren)");
        }
        var value = values.get(index);
        return coerce(value, type).orElseThrow(() -> malformed("expected a " + describe(type) + " at position "
                                                               + index + " but found "
                                                               + describe(value.getClass())));
    }

    /**
     * Whether the child at the index can be read as the requested type.
     */
    boolean is(int index, Class<?> type) {
        return index >= 0 && index < values.size() && coerce(values.get(index), type).isPresent();
    }

    /**
     * All children from the index on, converted to the requested type.
     */
    <T> List<T> from(int index, Class<T> type) {
        var result = new ArrayList<T>();
        for (int i = index; i < values.size(); i++) {
            result.add(get(i, type));
        }
        return result;
    }

    <T> List<T> all(Class<T> type) {
        return from(0, type);
    }

    /**
     * Require exactly the given number of children.
     */
    ChildValues expect(int count) {
        if (values.size() != count) {
            throw malformed("expected " + count + " child(ren) but found " + values.size());
        }
        return this;
    }

    CircuitException malformed(String reason) {
        return new CircuitException(new CircuitError.MalformedTree(span, rule, reason));
    }

    private static <T> Optional<T> coerce(Object value, Class<T> type) {
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        if (value instanceof Symbol symbol && (type == Expr.class || type == Arith.class)) {
            return coerce(new Expr.Ref(symbol), type);
        }
        if (value instanceof Expr expr && type == Arith.class) {
            return Optional.of(type.cast(Arith.of(expr)));
        }
        return Optional.empty();
    }

    private static String describe(Class<?> type) {
        return type.getSimpleName();
    }

    @Override
    public String toString() {
        return "ChildValues{rule='" + rule + "', values=" + values + "}";
    }
}
