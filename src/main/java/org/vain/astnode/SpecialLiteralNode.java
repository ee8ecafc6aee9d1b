package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * {@code true}, {@code false}, {@code null} or {@code none}.
 */
public class SpecialLiteralNode extends AbstractNode {
    public final SpecialLiteral literal;

    public SpecialLiteralNode(SpecialLiteral literal, Position position) {
        this.literal = literal;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
