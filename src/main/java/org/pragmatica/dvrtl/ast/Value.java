package org.pragmatica.dvrtl.ast;

/**
 * Bit value: the leaf terminals of the expression language.
 */
public enum Value implements Expr {
    ZERO,
    ONE;

    public int toInt() {
        return this == ONE ? 1 : 0;
    }

    public boolean isSet() {
        return this == ONE;
    }

    public static Value of(boolean bit) {
        return bit ? ONE : ZERO;
    }

    public static Value of(int bit) {
        if (bit != 0 && bit != 1) {
            throw new IllegalArgumentException("Not a bit: " + bit);
        }
        return of(bit == 1);
    }

    @Override
    public String serialize() {
        return String.valueOf(toInt());
    }
}
