package org.vain.astnode;

import org.vain.astvisitor.PrintVisitor;

/**
 * Abstract base class for AST nodes that includes the source position of the
 * node. The position is used for providing error messages that point to the
 * exact location in the source code.
 * <p>
 * It also provides deep toString() formatting using PrintVisitor
 */
public abstract class AbstractNode implements Node {
    public Position position;

    // Pre-order number inside one analysis run, -1 when not numbered
    public int id = -1;

    @Override
    public Position getPosition() {
        return position;
    }

    @Override
    public void setPosition(Position position) {
        this.position = position;
    }

    @Override
    public boolean isExpression() {
        return true;
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public void setId(int id) {
        this.id = id;
    }

    /**
     * Returns a string representation of the syntax tree.
     *
     * @return a string representation of the syntax tree
     */
    @Override
    public String toString() {
        PrintVisitor printVisitor = new PrintVisitor();
        this.accept(printVisitor);
        return printVisitor.getResult();
    }
}
