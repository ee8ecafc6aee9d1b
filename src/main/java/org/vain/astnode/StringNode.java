package org.vain.astnode;

import org.vain.astvisitor.Visitor;
import org.vain.parser.StringLiteral;

/**
 * The StringNode class represents a string literal.
 * <p>
 * {@code literal} is the source text including its quotes; {@link #evaluate()}
 * decodes it.
 */
public class StringNode extends AbstractNode {
    public final String literal;

    public StringNode(String literal, Position position) {
        this.literal = literal;
        this.position = position;
    }

    /**
     * Returns the decoded value of the literal.
     *
     * @throws IllegalArgumentException if the literal is malformed
     */
    public String evaluate() {
        return StringLiteral.eval(literal);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
