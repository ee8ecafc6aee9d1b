package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * An editor option reference such as {@code &tabstop} or {@code &l:shiftwidth}.
 */
public class OptionNode extends AbstractNode {
    public static final String SIGIL = "&";

    /**
     * The name without the leading {@code &}.
     */
    public final String name;

    public OptionNode(String name, Position position) {
        this.name = name;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
