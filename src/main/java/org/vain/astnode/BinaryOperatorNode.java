package org.vain.astnode;

import org.vain.astvisitor.Visitor;

/**
 * The BinaryOperatorNode class represents a node in the abstract syntax tree (AST) that holds
 * a binary operator and its two operands.
 */
public class BinaryOperatorNode extends AbstractNode {
    /**
     * The binary operator.
     */
    public final BinaryOperator operator;

    /**
     * The left operand.
     */
    public Node left;

    /**
     * The right operand.
     */
    public Node right;

    /**
     * Constructs a new BinaryOperatorNode.
     *
     * @param operator the binary operator
     * @param left     the left operand
     * @param right    the right operand
     * @param position the position of the operator token
     */
    public BinaryOperatorNode(BinaryOperator operator, Node left, Node right, Position position) {
        this.operator = operator;
        this.left = left;
        this.right = right;
        this.position = position;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
