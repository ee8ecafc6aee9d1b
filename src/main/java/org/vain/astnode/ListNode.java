package org.vain.astnode;

import org.vain.astvisitor.Visitor;

import java.util.List;

/**
 * The ListNode class represents a list literal {@code [a, b]}, and also the
 * target list of a destructuring declaration or assignment.
 */
public class ListNode extends AbstractNode {
    /**
     * The list of child nodes contained in this ListNode.
     */
    public final List<Node> elements;

    public ListNode(List<Node> elements, Position position) {
        this.elements = elements;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
