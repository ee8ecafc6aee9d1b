package org.vain.astvisitor;

import org.vain.astnode.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Generic pre-order walk over the AST with in-place rewriting.
 * <p>
 * Several visitors can share one traversal. Each keeps its own skip state: a
 * visitor that skipped a node is not called for that node's descendants, and
 * the descendants are not traversed at all once every visitor has skipped.
 * <p>
 * Children are always taken from the terminal node of whatever the visitors
 * left in the slot, so a visitor may wrap a node and its children are still walked.
 *
 * <pre>
 *   Node root = TreeWalker.walk(tree, (control, node) -&gt; {
 *       if (node.terminalNode() instanceof FunctionNode) control.skipChildren();
 *       return node;
 *   });
 * </pre>
 */
public class TreeWalker {
    private final List<WalkVisitor> visitors;
    private final List<Integer> route = new ArrayList<>();
    private final WalkControl control = new WalkControl(route);
    private boolean numbering;
    private int nextId;

    public TreeWalker(List<WalkVisitor> visitors) {
        this.visitors = visitors;
    }

    public TreeWalker(WalkVisitor... visitors) {
        this(Arrays.asList(visitors));
    }

    public static Node walk(Node root, WalkVisitor visitor) {
        return new TreeWalker(visitor).walk(root);
    }

    /**
     * Assigns {@link Node#getId()} in pre-order, starting from 0, during the next walks.
     */
    public TreeWalker withNumbering() {
        this.numbering = true;
        this.nextId = 0;
        return this;
    }

    public Node walk(Node root) {
        boolean[] active = new boolean[visitors.size()];
        Arrays.fill(active, true);
        route.clear();
        return walkNode(root, active);
    }

    private Node walkNode(Node node, boolean[] active) {
        if (node == null) {
            return null;
        }
        int id = numbering ? nextId++ : -1;
        if (numbering) {
            node.setId(id);
        }

        boolean[] childActive = active;
        boolean anyActive = false;
        for (int i = 0; i < visitors.size(); i++) {
            if (!active[i]) {
                continue;
            }
            control.reset();
            Node replacement = visitors.get(i).visit(control, node);
            if (replacement != null && replacement != node) {
                node = replacement;
                if (numbering) {
                    node.setId(id);
                }
            }
            if (control.skipped()) {
                if (childActive == active) {
                    childActive = active.clone();
                }
                childActive[i] = false;
            } else {
                anyActive = true;
            }
        }

        if (anyActive) {
            node.terminalNode().accept(new ChildWalker(childActive));
        }
        return node;
    }

    /**
     * Walks the child slots of one node, writing replacements back.
     */
    private class ChildWalker implements Visitor {
        private final boolean[] active;
        private int slot;

        ChildWalker(boolean[] active) {
            this.active = active;
        }

        private Node child(Node node) {
            route.add(slot++);
            try {
                return walkNode(node, active);
            } finally {
                route.remove(route.size() - 1);
            }
        }

        private void children(List<Node> nodes) {
            if (nodes == null) {
                slot++;
                return;
            }
            for (int i = 0; i < nodes.size(); i++) {
                nodes.set(i, child(nodes.get(i)));
            }
        }

        @Override
        public void visit(TopLevelNode node) {
            children(node.body);
        }

        @Override
        public void visit(CommentNode node) {
        }

        @Override
        public void visit(ImportNode node) {
        }

        @Override
        public void visit(FunctionNode node) {
            children(node.arguments);
            children(node.body);
        }

        @Override
        public void visit(ArgumentNode node) {
            node.defaultValue = child(node.defaultValue);
        }

        @Override
        public void visit(ReturnNode node) {
            node.value = child(node.value);
        }

        @Override
        public void visit(DeclarationNode node) {
            node.left = child(node.left);
            node.right = child(node.right);
        }

        @Override
        public void visit(AssignNode node) {
            node.left = child(node.left);
            node.right = child(node.right);
        }

        @Override
        public void visit(IfNode node) {
            node.condition = child(node.condition);
            children(node.body);
            children(node.elseBody);
        }

        @Override
        public void visit(WhileNode node) {
            node.condition = child(node.condition);
            children(node.body);
        }

        @Override
        public void visit(ForNode node) {
            node.left = child(node.left);
            node.right = child(node.right);
            children(node.body);
        }

        @Override
        public void visit(TernaryNode node) {
            node.condition = child(node.condition);
            node.trueExpr = child(node.trueExpr);
            node.falseExpr = child(node.falseExpr);
        }

        @Override
        public void visit(BinaryOperatorNode node) {
            node.left = child(node.left);
            node.right = child(node.right);
        }

        @Override
        public void visit(UnaryOperatorNode node) {
            node.operand = child(node.operand);
        }

        @Override
        public void visit(SliceNode node) {
            node.left = child(node.left);
            node.from = child(node.from);
            node.to = child(node.to);
        }

        @Override
        public void visit(CallNode node) {
            node.callee = child(node.callee);
            children(node.arguments);
        }

        @Override
        public void visit(SubscriptNode node) {
            node.left = child(node.left);
            node.index = child(node.index);
        }

        @Override
        public void visit(DotNode node) {
            node.left = child(node.left);
            node.right = child(node.right);
        }

        @Override
        public void visit(IdentifierNode node) {
        }

        @Override
        public void visit(IntNode node) {
        }

        @Override
        public void visit(FloatNode node) {
        }

        @Override
        public void visit(StringNode node) {
        }

        @Override
        public void visit(ListNode node) {
            children(node.elements);
        }

        @Override
        public void visit(DictionaryNode node) {
            for (DictionaryNode.Entry entry : node.entries) {
                entry.key = child(entry.key);
                entry.value = child(entry.value);
            }
        }

        @Override
        public void visit(OptionNode node) {
        }

        @Override
        public void visit(EnvNode node) {
        }

        @Override
        public void visit(RegisterNode node) {
        }

        @Override
        public void visit(SpecialLiteralNode node) {
        }

        @Override
        public void visit(ErrorNode node) {
        }
    }
}
