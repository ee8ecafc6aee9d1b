package org.vain.astvisitor;

import org.junit.jupiter.api.Test;
import org.vain.astnode.*;

import static org.junit.jupiter.api.Assertions.*;
import static org.vain.TestUtil.parseOk;

public class CloneVisitorTest {

    private static final String SOURCE = String.join("\n",
            "# sample",
            "import 'vital' as V",
            "func <dict> f(a, b = 1): Int {",
            "  if a > b {",
            "    return a",
            "  } else {",
            "    return [b, {k: @r}][0]",
            "  }",
            "}",
            "let x: String",
            "for [i, j] in g(&tabstop, $HOME) {",
            "  x = x == '' ? true : l[1:]",
            "}");

    @Test
    public void testCloneIsDeep() {
        TopLevelNode original = parseOk("const x = f(y)");
        TopLevelNode copy = (TopLevelNode) CloneVisitor.clone(original);

        assertNotSame(original, copy);
        assertNotSame(original.body, copy.body);
        DeclarationNode copied = (DeclarationNode) copy.body.get(0);
        ((IdentifierNode) copied.left).name = "renamed";
        ((IdentifierNode) ((CallNode) copied.right).arguments.get(0)).name = "z";

        DeclarationNode kept = (DeclarationNode) original.body.get(0);
        assertEquals("x", ((IdentifierNode) kept.left).name);
        assertEquals("y", ((IdentifierNode) ((CallNode) kept.right).arguments.get(0)).name);
        assertSame(kept.getPosition(), copied.getPosition());
    }

    @Test
    public void testCloneKeepsIds() {
        TopLevelNode original = parseOk("const x = 1");
        new TreeWalker((control, node) -> node).withNumbering().walk(original);
        TopLevelNode copy = (TopLevelNode) CloneVisitor.clone(original);
        assertEquals(1, copy.body.get(0).getId());
        assertEquals(2, ((DeclarationNode) copy.body.get(0)).left.getId());
    }

    @Test
    public void testCloneDumpsIdentically() {
        TopLevelNode original = parseOk(SOURCE);
        Node copy = CloneVisitor.clone(original);

        PrintVisitor before = new PrintVisitor();
        original.accept(before);
        PrintVisitor after = new PrintVisitor();
        copy.accept(after);
        assertEquals(before.getResult(), after.getResult());
        assertFalse(after.getResult().isEmpty());
    }

    @Test
    public void testCloneNull() {
        assertNull(CloneVisitor.clone(null));
        assertNull(CloneVisitor.cloneList(null));
    }
}
