package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * An environment variable reference such as {@code $HOME}.
 */
public class EnvNode extends AbstractNode {
    public static final String SIGIL = "$";

    /**
     * The name without the leading {@code $}.
     */
    public final String name;

    public EnvNode(String name, Position position) {
        this.name = name;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
