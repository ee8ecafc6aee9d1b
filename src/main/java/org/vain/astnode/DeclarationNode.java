package org.vain.astnode;

import org.vain.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The DeclarationNode class represents {@code const} and {@code let} statements.
 * <p>
 * The left side is either a single {@link IdentifierNode} or a {@link ListNode}
 * of identifiers for destructuring. {@code let x: Type} has a type and no right side.
 */
public class DeclarationNode extends AbstractNode {
    public final boolean isConst;
    public Node left;
    public final String type;
    public Node right;

    /**
     * True if one of the declared names is the discard name {@code _}.
     */
    public boolean hasUnderscore;

    public DeclarationNode(boolean isConst, Node left, String type, Node right,
                           boolean hasUnderscore, Position position) {
        this.isConst = isConst;
        this.left = left;
        this.type = type;
        this.right = right;
        this.hasUnderscore = hasUnderscore;
        this.position = position;
    }

    /**
     * Returns the identifiers this statement declares, in source order.
     */
    public List<IdentifierNode> declaredIdentifiers() {
        return identifiersOf(left);
    }

    /**
     * Returns the identifiers of a target that is a single identifier or a list.
     * Other list elements, such as subscripts in an assignment, are left out.
     */
    public static List<IdentifierNode> identifiersOf(Node target) {
        List<IdentifierNode> result = new ArrayList<>();
        Node lhs = target.terminalNode();
        if (lhs instanceof IdentifierNode) {
            result.add((IdentifierNode) lhs);
        } else if (lhs instanceof ListNode) {
            for (Node element : ((ListNode) lhs).elements) {
                Node id = element.terminalNode();
                if (id instanceof IdentifierNode) {
                    result.add((IdentifierNode) id);
                }
            }
        }
        return result;
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
