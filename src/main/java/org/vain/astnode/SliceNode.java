package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * {@code left[from : to]}. Either bound may be null when omitted.
 */
public class SliceNode extends AbstractNode {
    public Node left;
    public Node from;
    public Node to;

    public SliceNode(Node left, Node from, Node to, Position position) {
        this.left = left;
        this.from = from;
        this.to = to;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
