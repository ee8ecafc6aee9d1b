package org.vain.analysis;

import org.vain.astnode.*;
import org.vain.astvisitor.TreeWalker;

/**
 * Attaches a {@link TypedNode} to every node and removes them again.
 * <p>
 * Only literals get a concrete type for now; everything else is {@link VainType#UNKNOWN}.
 */
public final class TypeInference {

    private TypeInference() {
    }

    public static Node infer(Node root) {
        return TreeWalker.walk(root, (control, node) -> {
            if (node instanceof TypedNode) {
                return node;
            }
            return new TypedNode(node, typeOf(node));
        });
    }

    public static Node unwrap(Node root) {
        return TreeWalker.walk(root, (control, node) -> node.terminalNode());
    }

    static VainType typeOf(Node node) {
        if (node instanceof IntNode) {
            return VainType.INT;
        }
        if (node instanceof FloatNode) {
            return VainType.FLOAT;
        }
        if (node instanceof StringNode) {
            return VainType.STRING;
        }
        if (node instanceof ListNode) {
            return VainType.LIST;
        }
        if (node instanceof DictionaryNode) {
            return VainType.DICT;
        }
        if (node instanceof FunctionNode && node.isExpression()) {
            return VainType.FUNC;
        }
        if (node instanceof SpecialLiteralNode) {
            SpecialLiteral literal = ((SpecialLiteralNode) node).literal;
            return literal == SpecialLiteral.TRUE || literal == SpecialLiteral.FALSE ? VainType.BOOL : VainType.NONE;
        }
        return VainType.UNKNOWN;
    }
}
