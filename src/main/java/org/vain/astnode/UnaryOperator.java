package org.vain.astnode;

/**
 * The closed set of prefix operators.
 */
public enum UnaryOperator {
    NOT("!"),
    MINUS("-"),
    PLUS("+");

    public final String text;

    UnaryOperator(String text) {
        this.text = text;
    }

    public static UnaryOperator fromText(String text) {
        for (UnaryOperator op : values()) {
            if (op.text.equals(text)) {
                return op;
            }
        }
        return null;
    }
}
