package org.vain.analysis;

import org.vain.astnode.*;
import org.vain.astvisitor.TreeWalker;
import org.vain.astvisitor.WalkControl;
import org.vain.astvisitor.WalkVisitor;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renames identifiers so that the output never contains a name starting with
 * a single underscore.
 * <p>
 * A name such as {@code _foo} becomes {@code __foo}, everywhere. A discarded
 * {@code _} in a declaration or loop target becomes {@code _unused0},
 * {@code _unused1}, ... numbered per function body, or per file at the top level.
 * Since every real name that starts with an underscore gets a second one, the
 * generated names cannot collide with user names.
 */
public final class UnderscoreConverter {

    private UnderscoreConverter() {
    }

    public static Node convert(Node root) {
        return TreeWalker.walk(root, new Scope());
    }

    static String escape(String name) {
        return name.length() > 1 && name.startsWith("_") ? "_" + name : name;
    }

    /**
     * Renames within one function body. Nested functions get a Scope of their own.
     */
    private static final class Scope implements WalkVisitor {
        private final Set<Integer> discardIds = new HashSet<>();
        private final Set<Integer> memberIds = new HashSet<>();
        private int counter;

        @Override
        public Node visit(WalkControl control, Node node) {
            Node terminal = node.terminalNode();
            if (terminal instanceof FunctionNode) {
                convertFunction((FunctionNode) terminal);
                control.skipChildren();
            } else if (terminal instanceof DeclarationNode) {
                markDiscards(((DeclarationNode) terminal).left);
            } else if (terminal instanceof ForNode) {
                markDiscards(((ForNode) terminal).left);
            } else if (terminal instanceof DotNode) {
                memberIds.add(((DotNode) terminal).right.getId());
            } else if (terminal instanceof ArgumentNode) {
                ArgumentNode argument = (ArgumentNode) terminal;
                argument.name = argument.name.equals("_") ? nextName() : escape(argument.name);
            } else if (terminal instanceof IdentifierNode) {
                IdentifierNode id = (IdentifierNode) terminal;
                if (discardIds.contains(id.getId())) {
                    id.name = nextName();
                } else if (!memberIds.contains(id.getId())) {
                    id.name = escape(id.name);
                }
            }
            return node;
        }

        private void markDiscards(Node target) {
            for (IdentifierNode id : DeclarationNode.identifiersOf(target)) {
                if (id.name.equals("_")) {
                    discardIds.add(id.getId());
                }
            }
        }

        private String nextName() {
            return "_unused" + counter++;
        }

        private static void convertFunction(FunctionNode function) {
            if (function.name != null) {
                function.name = escape(function.name);
            }
            Scope inner = new Scope();
            walkAll(function.arguments, inner);
            walkAll(function.body, inner);
        }

        private static void walkAll(List<Node> nodes, Scope scope) {
            for (int i = 0; i < nodes.size(); i++) {
                nodes.set(i, TreeWalker.walk(nodes.get(i), scope));
            }
        }
    }
}
