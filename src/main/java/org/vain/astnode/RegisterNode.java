package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * A register reference such as {@code @a}. An empty name is the unnamed register.
 */
public class RegisterNode extends AbstractNode {
    public static final String SIGIL = "@";

    /**
     * The name without the leading {@code @}.
     */
    public final String name;

    public RegisterNode(String name, Position position) {
        this.name = name;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
