package org.vain.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.vain.TestUtil;

import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class SexpDumpGeneratorTest {

    private static String sexp(String source) {
        return TestUtil.render(new SexpDumpGenerator(TestUtil.context()), TestUtil.parseOk(source));
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', quoteCharacter = '`', value = {
            "const x = 1 + 2 * 3;       (const 'x (+ 1 (* 2 3)))",
            "let n: Int;                (let 'n : Int)",
            "const [a, b] = xs;         (const ('a 'b) 'xs)",
            "x = 1;                     (= 'x 1)",
            "a ? b : c;                 (?: 'a 'b 'c)",
            "!a;                        (! 'a)",
            "a ==? b;                   (==? 'a 'b)",
            "l[1:];                     (slice 'l 1 null)",
            "l[:];                      (slice 'l null null)",
            "l[0];                      (subscript 'l 0)",
            "d.k;                       (dot 'd 'k)",
            "f();                       (call 'f)",
            "f([1], {a: 2});            (call 'f (list 1) (dict (\"a\" 2)))",
            "&ts;                       (option \"ts\")",
            "$HOME;                     (env \"HOME\")",
            "@a;                        (reg \"a\")",
            "true;                      true",
            "1.5;                       1.5",
            "'it''s';                   \"it's\"",
            "\"a\\tb\";                 \"a\\tb\"",
            "# note;                    (# \" note\")",
            "import 'vital' as V;       (import (\"vital\" 'V))",
            "from 'p' import a as b, c; (import (\"p\") ((a b) (c)))",
    })
    public void testForms(String source, String expected) {
        assertEquals(expected + "\n", sexp(source));
    }

    @Test
    public void testFunctions() {
        assertEquals("(func (dict) f ((a : Int) (b = 1) (c)) \"String\" ((return 'a)))\n",
                sexp("func <dict> f(a: Int, b = 1, c): String {\n  return a\n}"));
        assertEquals("(const 'f (func () null ((x)) \"\" 'x))\n", sexp("const f = func(x) x"));
        assertEquals("(func () g () \"\" ((return)))\n", sexp("func g() {\n  return\n}"));
    }

    @Test
    public void testBlocks() {
        assertEquals("(if 'a ('b) ())\n", sexp("if a {\n  b\n} else {\n}"));
        assertEquals("(if 'a ())\n", sexp("if a {\n}"));
        assertEquals("(while 'a ((= 'a (- 'a 1))))\n", sexp("while a {\n  a = a - 1\n}"));
        assertEquals("(for 'x 'xs ((return)))\n", sexp("for x in xs {\n  return\n}"));
    }

    @Test
    public void testOneLinePerStatement() {
        assertEquals("(# \" c\")\n'a\n(call 'b)\n", sexp("# c\na\n\nb()"));
    }

    @Test
    public void testJsonQuote() {
        assertEquals("\"a\\\"b\\\\c\\nd\\u0001\"", SexpDumpGenerator.jsonQuote("a\"b\\c\nd\u0001"));
        assertEquals("\"é\"", SexpDumpGenerator.jsonQuote("é"));
    }

    @Test
    public void testOutputPath() {
        assertEquals(Paths.get("a.vain.sexp"), new SexpDumpGenerator(TestUtil.context()).outputPath(Paths.get("a.vain")));
    }
}
