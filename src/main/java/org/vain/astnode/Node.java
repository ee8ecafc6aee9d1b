package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * The Node interface represents a node in the abstract syntax tree (AST).
 * Every node can be visited, carries an optional source position and knows
 * whether it stands in expression position.
 */
public interface Node {
    /**
     * Accepts a visitor that performs some operation on this node.
     *
     * @param visitor the visitor that will perform the operation on this node
     */
    void accept(Visitor visitor);

    /**
     * Returns the source position of this node, or null for synthesized nodes.
     */
    Position getPosition();

    void setPosition(Position position);

    /**
     * Returns true if the node is an expression, false if it is a statement.
     */
    boolean isExpression();

    /**
     * The id assigned by the tree walker when numbering was requested, or -1.
     */
    int getId();

    void setId(int id);

    /**
     * Unwraps transparent decorators such as {@link TypedNode}.
     *
     * @return the concrete node variant
     */
    default Node terminalNode() {
        return this;
    }
}
