package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * An error travelling down the pipeline in place of a tree.
 * <p>
 * The message is already formatted as {@code path:line:col: message}. Stages
 * forward an ErrorNode unchanged; the output writer reports it and discards
 * the file's output.
 */
public class ErrorNode extends AbstractNode {
    public final String message;

    public ErrorNode(String message, Position position) {
        this.message = message;
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
