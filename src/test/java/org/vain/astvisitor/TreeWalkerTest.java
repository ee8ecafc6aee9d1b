package org.vain.astvisitor;

import org.junit.jupiter.api.Test;
import org.vain.astnode.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.vain.TestUtil.parseOk;

public class TreeWalkerTest {

    @Test
    public void testPreOrderNumbering() {
        TopLevelNode unit = parseOk("const x = 1 + 2");
        List<String> order = new ArrayList<>();
        new TreeWalker((control, node) -> {
            order.add(node.getId() + ":" + node.terminalNode().getClass().getSimpleName());
            return node;
        }).withNumbering().walk(unit);

        assertEquals(List.of(
                "0:TopLevelNode",
                "1:DeclarationNode",
                "2:IdentifierNode",
                "3:BinaryOperatorNode",
                "4:IntNode",
                "5:IntNode"), order);
    }

    @Test
    public void testRoutes() {
        TopLevelNode unit = parseOk("x\nconst y = f(1, 2)");
        List<List<Integer>> routes = new ArrayList<>();
        TreeWalker.walk(unit, (control, node) -> {
            if (node instanceof IntNode) {
                routes.add(control.route());
            }
            return node;
        });
        // declaration is statement 1, its right side is slot 1, call arguments follow the callee
        assertEquals(List.of(List.of(1, 1, 1), List.of(1, 1, 2)), routes);
    }

    @Test
    public void testSkipChildren() {
        TopLevelNode unit = parseOk("func f(a) {\n  return a\n}\nconst b = 1");
        List<String> seen = new ArrayList<>();
        TreeWalker.walk(unit, (control, node) -> {
            if (node instanceof FunctionNode) {
                control.skipChildren();
            }
            if (node instanceof IdentifierNode) {
                seen.add(((IdentifierNode) node).name);
            }
            return node;
        });
        assertEquals(List.of("b"), seen);
    }

    @Test
    public void testSkipIsPerVisitor() {
        TopLevelNode unit = parseOk("func f(a) {\n  return a\n}");
        List<String> skipping = new ArrayList<>();
        List<String> descending = new ArrayList<>();
        new TreeWalker(
                (control, node) -> {
                    if (node instanceof FunctionNode) {
                        control.skipChildren();
                    }
                    skipping.add(node.getClass().getSimpleName());
                    return node;
                },
                (control, node) -> {
                    descending.add(node.getClass().getSimpleName());
                    return node;
                }).walk(unit);

        assertEquals(List.of("TopLevelNode", "FunctionNode"), skipping);
        assertTrue(descending.contains("ReturnNode"));
        assertTrue(descending.contains("IdentifierNode"));
    }

    @Test
    public void testReplaceInPlace() {
        TopLevelNode unit = parseOk("const x = a + a");
        TreeWalker.walk(unit, (control, node) -> {
            if (node instanceof IdentifierNode && ((IdentifierNode) node).name.equals("a")) {
                return new IntNode("7", node.getPosition());
            }
            return node;
        });
        BinaryOperatorNode sum = (BinaryOperatorNode) ((DeclarationNode) unit.body.get(0)).right;
        assertEquals("7", ((IntNode) sum.left).value);
        assertEquals("7", ((IntNode) sum.right).value);
        assertEquals("x", ((IdentifierNode) ((DeclarationNode) unit.body.get(0)).left).name);
    }

    @Test
    public void testWrappedNodeChildrenAreWalked() {
        TopLevelNode unit = parseOk("const x = [a]");
        List<String> names = new ArrayList<>();
        TreeWalker.walk(unit, (control, node) -> {
            if (node instanceof ListNode) {
                return new TypedNode(node, VainType.LIST);
            }
            if (node instanceof IdentifierNode) {
                names.add(((IdentifierNode) node).name);
            }
            return node;
        });
        DeclarationNode declaration = (DeclarationNode) unit.body.get(0);
        assertInstanceOf(TypedNode.class, declaration.right);
        assertEquals(List.of("x", "a"), names);
    }

    @Test
    public void testIsInside() {
        TopLevelNode unit = parseOk("const x = 1\nconst y = [2, 3]");
        List<String> inside = new ArrayList<>();
        TreeWalker.walk(unit, (control, node) -> {
            if (node instanceof IntNode && control.isInside(List.of(1))) {
                inside.add(((IntNode) node).value);
            }
            return node;
        });
        assertEquals(List.of("2", "3"), inside);
    }
}
