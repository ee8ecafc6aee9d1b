package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * The IdentifierNode class represents a node in the abstract syntax tree (AST) that holds
 * an identifier name. This class implements the Node interface, allowing it to be visited
 * by a Visitor.
 */
public class IdentifierNode extends AbstractNode {
    /**
     * The identifier name represented by this node.
     * Rewriting passes rename identifiers in place.
     */
    public String name;

    /**
     * Constructs a new IdentifierNode with the specified identifier name.
     *
     * @param name     the identifier name to be stored in this node
     * @param position the source position of the identifier
     */
    public IdentifierNode(String name, Position position) {
        this.name = name;
        this.position = position;
    }

    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
