package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * A function argument: {@code name: Type}, {@code name = default} or a bare {@code name}.
 */
public class ArgumentNode extends AbstractNode {
    public String name;
    public final String type;
    public Node defaultValue;

    public ArgumentNode(String name, String type, Node defaultValue, Position position) {
        this.name = name;
        this.type = type;
        this.defaultValue = defaultValue;
        this.position = position;
    }

    @Override
    public boolean isExpression() {
        return false;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
