package org.vain.astnode;

/**
 * Binding strength of expression levels, lowest first.
 * A function literal binds weakest because its expression body extends as far
 * to the right as possible.
 */
public final class Precedence {
    public static final int FUNCTION = 0;
    public static final int TERNARY = 1;
    public static final int OR = 2;
    public static final int AND = 3;
    public static final int COMPARISON = 4;
    public static final int ADDITIVE = 5;
    public static final int MULTIPLICATIVE = 6;
    public static final int UNARY = 7;
    public static final int POSTFIX = 8;
    public static final int ATOM = 9;

    private Precedence() {
    }
}
