package org.pragmatica.dvrtl.ast;

/**
 * A name paired with the arena slot of the statement that introduced it.
 *
 * <p>Two symbols are equal iff their names are equal; the slot does not take part in identity.
 * Free names and module parameters carry {@link #UNBOUND}.
 *
 * @param name  the textual name
 * @param owner index into {@link Circuit#definitions()}, or {@link #UNBOUND}
 */
public record Symbol(String name, int owner) implements SyntaxNode {
    public static final int UNBOUND = -1;

    public static Symbol unbound(String name) {
        return new Symbol(name, UNBOUND);
    }

    public boolean isBound() {
        return owner != UNBOUND;
    }

    @Override
    public String serialize() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Symbol other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
