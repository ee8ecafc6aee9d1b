package org.vain.analysis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.params.provider.MethodSource;
import org.vain.TestUtil;
import org.vain.astnode.*;
import org.vain.astvisitor.PrintVisitor;
import org.vain.astvisitor.TreeWalker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.vain.TestUtil.analyzeOk;
import static org.vain.TestUtil.diagnostics;

public class AnalyzerTest {

    private static List<String> names(Node target) {
        List<String> names = new ArrayList<>();
        for (IdentifierNode id : DeclarationNode.identifiersOf(target)) {
            names.add(id.name);
        }
        return names;
    }

    @Test
    public void testDuplicateDeclaration() {
        assertEquals(List.of("test.vain:2:7: duplicate declaration of variable \"x\" (duplicate-declaration)"),
                diagnostics("const x = 1\nconst x = 2"));
    }

    @Test
    public void testDuplicateFunction() {
        List<String> messages = diagnostics("func f() {\n}\nfunc f() {\n}");
        assertEquals(List.of("test.vain:3:1: duplicate declaration of function \"f\" (duplicate-declaration)"), messages);
    }

    @Test
    public void testDuplicateArgument() {
        assertEquals(List.of("test.vain:1:11: duplicate argument \"a\" (duplicate-declaration)"),
                diagnostics("func f(a, a) {\n}"));
    }

    @Test
    public void testShadowingInNestedBlockIsAllowed() {
        analyzeOk("const x = 1\nif x {\n  const x = 2\n}");
    }

    @Test
    public void testToplevelReturn() {
        assertEquals(List.of("test.vain:1:1: return statement at top level (toplevel-return)"),
                diagnostics("return 1"));
        assertEquals(List.of("test.vain:2:3: return statement at top level (toplevel-return)"),
                diagnostics("if true {\n  return\n}"));
        analyzeOk("func f() {\n  if true {\n    return 1\n  }\n}");
    }

    @Test
    public void testUndeclaredVariable() {
        assertEquals(List.of("test.vain:1:11: undeclared variable \"y\" (undeclared-variable)"),
                diagnostics("const x = y"));
    }

    @Test
    public void testDeclarationSeesOnlyEarlierNames() {
        assertEquals(List.of("test.vain:1:11: undeclared variable \"x\" (undeclared-variable)"),
                diagnostics("const x = x"));
    }

    @Test
    public void testCalleesAndMembersAreNotReferences() {
        analyzeOk("const d = {}\ncall(d.member)\nlen(d)");
        assertEquals(List.of("test.vain:1:5: undeclared variable \"x\" (undeclared-variable)"),
                diagnostics("len(x)"));
    }

    @Test
    public void testRecursion() {
        analyzeOk("func fact(n) {\n  const self = fact\n  return n < 2 ? 1 : n * self(n - 1)\n}");
    }

    @Test
    public void testFunctionsSeeTopLevel() {
        analyzeOk("const base = 10\nfunc add(n) {\n  return base + n\n}");
    }

    @Test
    public void testOnlyClosuresCaptureLocals() {
        String plain = "func f() {\n  const a = 1\n  const g = func() {\n    return a\n  }\n}";
        assertEquals(List.of("test.vain:4:12: undeclared variable \"a\" (undeclared-variable)"), diagnostics(plain));

        analyzeOk("func f() {\n  const a = 1\n  const g = func <closure> () {\n    return a\n  }\n}");
        analyzeOk("func f() {\n  const a = 1\n  const g = func(x) x + a\n}");
    }

    @Test
    public void testLoopVariables() {
        analyzeOk("for [k, v] in items({}) {\n  echo(k, v)\n}");
        assertEquals(List.of("test.vain:4:6: undeclared variable \"k\" (undeclared-variable)"),
                diagnostics("for [k, v] in items({}) {\n  echo(k, v)\n}\necho(k)"));
    }

    @Test
    public void testAssignmentToConst() {
        assertEquals(List.of("test.vain:2:1: cannot assign to const variable \"x\" (assignment-to-const-variable)"),
                diagnostics("const x = 1\nx = 2"));
        analyzeOk("let x = 1\nx = 2");
        analyzeOk("const d = {}\nd.key = 2");
    }

    @Test
    public void testUnderscoreReference() {
        assertEquals(List.of("test.vain:2:11: cannot reference underscore variable \"_\" (underscore-variable-reference)"),
                diagnostics("const [a, _] = [1, 2]\nconst b = _"));
    }

    @Test
    public void testDiagnosticsAreOrdered() {
        assertEquals(List.of(
                "test.vain:1:11: undeclared variable \"b\" (undeclared-variable)",
                "test.vain:2:1: return statement at top level (toplevel-return)",
                "test.vain:3:11: undeclared variable \"d\" (undeclared-variable)"),
                diagnostics("const a = b\nreturn\nconst c = d"));
    }

    @Test
    public void testDisabledRule() {
        AnalyzerConfiguration config = AnalyzerConfiguration.defaults().with(Rule.UNDECLARED_VARIABLE, false);
        assertEquals(List.of(), diagnostics("const x = y", config));
        assertEquals(1, diagnostics("const x = y\nconst x = 1", config).size());
    }

    @Test
    public void testDiscardedNames() {
        TopLevelNode unit = analyzeOk("const [a, _, b] = [1, 2, 3]\nfor [_, v] in [] {\n}");
        assertEquals(List.of("a", "_unused0", "b"), names(((DeclarationNode) unit.body.get(0)).left));
        assertEquals(List.of("_unused1", "v"), names(((ForNode) unit.body.get(1)).left));
    }

    @Test
    public void testDiscardCounterRestartsPerFunction() {
        TopLevelNode unit = analyzeOk("const [_] = [1]\nfunc f(_) {\n  const [_, x] = [1, 2]\n}");
        assertEquals(List.of("_unused0"), names(((DeclarationNode) unit.body.get(0)).left));
        FunctionNode function = (FunctionNode) unit.body.get(1);
        assertEquals("_unused0", ((ArgumentNode) function.arguments.get(0)).name);
        assertEquals(List.of("_unused1", "x"), names(((DeclarationNode) function.body.get(0)).left));
    }

    @Test
    public void testLeadingUnderscoreIsDoubled() {
        TopLevelNode unit = analyzeOk("const _foo = 1\nconst bar = _foo + 1\nconst d = {}\nconst e = d._x");
        assertEquals(List.of("__foo"), names(((DeclarationNode) unit.body.get(0)).left));
        BinaryOperatorNode sum = (BinaryOperatorNode) ((DeclarationNode) unit.body.get(1)).right;
        assertEquals("__foo", ((IdentifierNode) sum.left).name);
        DotNode dot = (DotNode) ((DeclarationNode) unit.body.get(3)).right;
        assertEquals("_x", ((IdentifierNode) dot.right).name);
    }

    @Test
    public void testConversionCanBeDisabled() {
        AnalyzerConfiguration config = AnalyzerConfiguration.defaults().with(Rule.CONVERT_UNDERSCORE_VARIABLE, false);
        List<Node> result = TestUtil.analyze("const [_, _foo] = [1, 2]", config);
        assertEquals(1, result.size());
        DeclarationNode declaration = (DeclarationNode) ((TopLevelNode) result.get(0)).body.get(0);
        assertEquals(List.of("_", "_foo"), names(declaration.left));
    }

    @Test
    public void testParserTreeIsUntouched() {
        TopLevelNode parsed = TestUtil.parseOk("const [_, _foo] = [1, 2]");
        PrintVisitor before = new PrintVisitor();
        parsed.accept(before);
        new Analyzer(TestUtil.context(), AnalyzerConfiguration.defaults()).analyze(parsed);
        PrintVisitor after = new PrintVisitor();
        parsed.accept(after);
        assertEquals(before.getResult(), after.getResult());
    }

    @Test
    public void testNoTypeWrappersRemain() {
        TopLevelNode unit = analyzeOk("const f = func(x) [x, {a: 1.5}]\nconst s = f(1)[0]");
        TreeWalker.walk(unit, (control, node) -> {
            assertFalse(node instanceof TypedNode, "wrapper left at " + control.route());
            return node;
        });
    }

    @Test
    public void testErrorNodePassesThrough() {
        Node error = TestUtil.parse("const = 1");
        List<Node> result = new Analyzer(TestUtil.context(), AnalyzerConfiguration.defaults()).analyze(error);
        assertEquals(List.of(error), result);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "const [_, _, _a, a] = [1, 2, 3, 4]\nconst __a = 5",
            "func _f(_, __f, _) {\n  const [_, _g] = [1, 2]\n}\nconst ___f = 1",
            "for [_, _i] in [] {\n  const [_, _j] = [1, 2]\n}",
    })
    public void testConvertedNamesAreUnique(String source) {
        TopLevelNode unit = analyzeOk(source);
        List<String> declared = new ArrayList<>();
        TreeWalker.walk(unit, (control, node) -> {
            Node terminal = node.terminalNode();
            if (terminal instanceof DeclarationNode) {
                declared.addAll(names(((DeclarationNode) terminal).left));
            } else if (terminal instanceof ForNode) {
                declared.addAll(names(((ForNode) terminal).left));
            } else if (terminal instanceof ArgumentNode) {
                declared.add(((ArgumentNode) terminal).name);
            } else if (terminal instanceof FunctionNode && ((FunctionNode) terminal).name != null) {
                declared.add(((FunctionNode) terminal).name);
            }
            return node;
        });
        Set<String> unique = new HashSet<>(declared);
        assertEquals(declared.size(), unique.size(), () -> "names collide: " + declared);
        for (String name : declared) {
            assertFalse(name.startsWith("_") && !name.startsWith("__") && !name.startsWith("_unused"),
                    () -> "single underscore name left: " + name);
        }
    }

    static List<Long> seeds() {
        List<Long> seeds = new ArrayList<>();
        for (long seed = 1; seed <= 25; seed++) {
            seeds.add(seed);
        }
        return seeds;
    }

    /**
     * Random nested blocks of declarations and references. A reference must be
     * reported exactly when no enclosing block declared the name before it.
     */
    @ParameterizedTest
    @MethodSource("seeds")
    public void testRandomBlockScopes(long seed) {
        Random random = new Random(seed);
        StringBuilder source = new StringBuilder();
        List<String> expected = new ArrayList<>();
        Deque<Set<String>> frames = new ArrayDeque<>();
        frames.push(new HashSet<>());
        generateBlock(random, 0, frames, source, expected, new int[]{0});
        assertEquals(expected, diagnostics(source.toString()), source::toString);
    }

    private static void generateBlock(Random random, int depth, Deque<Set<String>> frames,
                                      StringBuilder source, List<String> expected, int[] line) {
        String indent = "  ".repeat(depth);
        int count = 1 + random.nextInt(5);
        for (int i = 0; i < count; i++) {
            String name = "v" + random.nextInt(6);
            int choice = random.nextInt(depth < 3 ? 3 : 2);
            line[0]++;
            if (choice == 0 && !frames.peek().contains(name)) {
                source.append(indent).append("let ").append(name).append(" = 1\n");
                frames.peek().add(name);
            } else if (choice == 2) {
                source.append(indent).append("if true {\n");
                frames.push(new HashSet<>());
                generateBlock(random, depth + 1, frames, source, expected, line);
                frames.pop();
                line[0]++;
                source.append(indent).append("}\n");
            } else {
                source.append(indent).append("echo(").append(name).append(")\n");
                boolean visible = frames.stream().anyMatch(frame -> frame.contains(name));
                if (!visible) {
                    expected.add("test.vain:" + line[0] + ":" + (indent.length() + 6)
                            + ": undeclared variable \"" + name + "\" (undeclared-variable)");
                }
            }
        }
    }
}
