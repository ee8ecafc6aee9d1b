package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * An integer literal, kept as its source text ({@code 42}, {@code 0x2A}).
 */
public class IntNode extends AbstractNode {
    public final String value;

    public IntNode(String value, Position position) {
        this.value = value;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
