package org.vain.astnode;

import java.util.HashMap;
import java.util.Map;

/**
 * The closed set of binary operators.
 * The source text is also what the Vim and s-expression outputs print.
 */
public enum BinaryOperator {
    OR("||", Precedence.OR),
    AND("&&", Precedence.AND),

    EQUAL("==", Precedence.COMPARISON),
    EQUAL_CI("==?", Precedence.COMPARISON),
    NOT_EQUAL("!=", Precedence.COMPARISON),
    NOT_EQUAL_CI("!=?", Precedence.COMPARISON),
    GREATER(">", Precedence.COMPARISON),
    GREATER_CI(">?", Precedence.COMPARISON),
    GREATER_EQUAL(">=", Precedence.COMPARISON),
    GREATER_EQUAL_CI(">=?", Precedence.COMPARISON),
    SMALLER("<", Precedence.COMPARISON),
    SMALLER_CI("<?", Precedence.COMPARISON),
    SMALLER_EQUAL("<=", Precedence.COMPARISON),
    SMALLER_EQUAL_CI("<=?", Precedence.COMPARISON),
    MATCH("=~", Precedence.COMPARISON),
    MATCH_CI("=~?", Precedence.COMPARISON),
    NO_MATCH("!~", Precedence.COMPARISON),
    NO_MATCH_CI("!~?", Precedence.COMPARISON),
    IS("is", Precedence.COMPARISON),
    IS_CI("is?", Precedence.COMPARISON),
    IS_NOT("isnot", Precedence.COMPARISON),
    IS_NOT_CI("isnot?", Precedence.COMPARISON),

    ADD("+", Precedence.ADDITIVE),
    SUBTRACT("-", Precedence.ADDITIVE),
    MULTIPLY("*", Precedence.MULTIPLICATIVE),
    DIVIDE("/", Precedence.MULTIPLICATIVE),
    REMAINDER("%", Precedence.MULTIPLICATIVE);

    private static final Map<String, BinaryOperator> BY_TEXT = new HashMap<>();

    static {
        for (BinaryOperator op : values()) {
            BY_TEXT.put(op.text, op);
        }
    }

    public final String text;
    public final int precedence;

    BinaryOperator(String text, int precedence) {
        this.text = text;
        this.precedence = precedence;
    }

    public boolean isComparison() {
        return precedence == Precedence.COMPARISON;
    }

    /**
     * Looks up an operator by its source text.
     *
     * @return the operator, or null if the text is not a binary operator
     */
    public static BinaryOperator fromText(String text) {
        return BY_TEXT.get(text);
    }
}
