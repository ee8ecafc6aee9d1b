package org.vain.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.vain.TestUtil;
import org.vain.astnode.*;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PrettyPrintGeneratorTest {

    private static String pretty(String source) {
        return TestUtil.render(new PrettyPrintGenerator(TestUtil.context()), TestUtil.parseOk(source));
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', quoteCharacter = '"', value = {
            "const   x=1+2*3;          const x = 1 + 2 * 3",
            "(1 + 2) * 3;              (1 + 2) * 3",
            "1 + (2 * 3);              1 + 2 * 3",
            "1 - (2 - 3);              1 - (2 - 3)",
            "(1 - 2) - 3;              1 - 2 - 3",
            "a ? b : (c ? d : e);      a ? b : c ? d : e",
            "(a ? b : c) ? d : e;      (a ? b : c) ? d : e",
            "(a == b) == c;            (a == b) == c",
            "a ==? b && !(c || d);     a ==? b && !(c || d)",
            "-(a + b);                 -(a + b)",
            "(f)(1)[2:].k;             f(1)[2:].k",
            "l[ : 2];                  l[:2]",
            "{a:1,'b c':2};            {a: 1, 'b c': 2}",
            "[1,[2,  3]];              [1, [2, 3]]",
            "map(xs,func(x)x*2);       map(xs, func(x) x * 2)",
            "(func(x) x);              (func(x) x)",
            "@a+&ts+$HOME;             @a + &ts + $HOME",
            "let  n :  Int;            let n: Int",
            "const [a,b]=xs;           const [a, b] = xs",
            "d.k=1;                    d.k = 1",
            "import 'p'as P;           import 'p' as P",
            "from 'p' import a as b,c; from 'p' import a as b, c",
    })
    public void testCanonicalForm(String source, String expected) {
        assertEquals(expected + "\n", pretty(source));
    }

    @Test
    public void testFunctions() {
        assertEquals("func <dict, range> f(a: Int, b = 1): String {\n  return a\n}\n",
                pretty("func <dict,range> f(a:Int,b=1):String {\nreturn a\n}"));
        assertEquals("func inc(x) x + 1\n", pretty("func inc(x)   x+1"));
        assertEquals("func f() {\n  const g = func() {\n    return 1\n  }\n}\n",
                pretty("func f() {\nconst g = func() {\nreturn 1\n}\n}"));
    }

    @Test
    public void testBlocks() {
        assertEquals("if a {\n} else if b {\n  c\n} else {\n  d\n}\n",
                pretty("if a {\n} else if b {\nc\n}   else {\n d\n}"));
        assertEquals("while a < 3 {\n  a = a + 1\n}\n", pretty("while a<3 {\na=a+1 }"));
        assertEquals("for [k, v] in items(d) {\n}\n", pretty("for [k,v] in items(d) {}"));
    }

    @Test
    public void testComments() {
        assertEquals("# head\nx\n# trailing\n", pretty("# head\n\n\nx   # trailing"));
    }

    @Test
    public void testCommentsInsideBracketsAreDropped() {
        assertEquals("# kept\nconst xs = [1, 2]\nf(1, {a: 2})\n",
                pretty("# kept\nconst xs = [\n  1, # one\n  2\n]\nf(1, # arg\n  {a: 2 # value\n})"));
    }

    @Test
    public void testStringsAreKeptVerbatim() {
        assertEquals("const s = \"a\\tb\" + 'it''s'\n", pretty("const s = \"a\\tb\" + 'it''s'"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "const x = 1\nlet y: String\nfunc <closure> f(a, b = [1, {k: 2}]) {\n  if a {\n    return b[0:a]\n  }\n}\n",
            "for [i, _] in range(10) {\n  while i > 0 && !done(i) {\n    i = i - 1 # down\n  }\n}\n",
            "const f = func(x) x ? -x : (x == 0 ? 1 : 2)\nconst g = func named(): Int {\n  return 1\n}\n",
            "echo(@\", $HOME, &g:ts, -(1 - 2))\n",
    })
    public void testIdempotent(String source) {
        String once = pretty(source);
        assertEquals(once, pretty(once));
    }

    @Test
    public void testStatementsRenderOneChunkEach() {
        TopLevelNode unit = TestUtil.parseOk("x\n\ny\nz");
        Iterator<TextChunk> chunks = new PrettyPrintGenerator(TestUtil.context()).render(unit);
        List<String> texts = new ArrayList<>();
        chunks.forEachRemaining(chunk -> texts.add(chunk.getText()));
        assertEquals(List.of("x\n", "y\n", "z\n"), texts);
    }

    @Test
    public void testErrorStopsRendering() {
        Position position = new Position(0, 2, 0);
        List<Node> body = new ArrayList<>();
        body.add(new IdentifierNode("a", new Position(0, 1, 0)));
        body.add(new ErrorNode("test.vain:2:1: boom", position));
        body.add(new IdentifierNode("b", new Position(0, 3, 0)));
        Iterator<TextChunk> chunks = new PrettyPrintGenerator(TestUtil.context()).render(new TopLevelNode(body, position));

        assertEquals("a\n", chunks.next().getText());
        TextChunk error = chunks.next();
        assertTrue(error.isError());
        assertEquals("test.vain:2:1: boom", error.getError());
        assertFalse(chunks.hasNext());
    }

    @Test
    public void testOutputPath() {
        assertEquals(Paths.get("d", "a.vain.pretty"),
                new PrettyPrintGenerator(TestUtil.context()).outputPath(Paths.get("d", "a.vain")));
    }
}
