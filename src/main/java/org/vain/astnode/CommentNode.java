package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * A line comment. {@code text} includes the leading {@code #}.
 */
public class CommentNode extends AbstractNode {
    public final String text;

    public CommentNode(String text, Position position) {
        this.text = text;
        this.position = position;
    }

    /**
     * Returns the comment body without the leading {@code #}.
     */
    public String content() {
        return text.startsWith("#") ? text.substring(1) : text;
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
