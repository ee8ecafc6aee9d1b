package org.vain;

import org.vain.analysis.Analyzer;
import org.vain.analysis.AnalyzerConfiguration;
import org.vain.astnode.ErrorNode;
import org.vain.astnode.Node;
import org.vain.astnode.TopLevelNode;
import org.vain.codegen.EmitterContext;
import org.vain.codegen.Generator;
import org.vain.codegen.TextChunk;
import org.vain.lexer.Lexer;
import org.vain.parser.Parser;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Shortcuts shared by the compiler tests. Every source is compiled as "test.vain".
 */
public final class TestUtil {

    public static final String FILE_NAME = "test.vain";

    private TestUtil() {
    }

    public static EmitterContext context() {
        return new EmitterContext(FILE_NAME, new ArgumentParser.CompilerOptions());
    }

    /**
     * Parses a source, returning the unit or its error node.
     */
    public static Node parse(String source) {
        return new Parser(context(), new Lexer(FILE_NAME, source).tokenize()).parse();
    }

    /**
     * Parses a source that must be valid.
     */
    public static TopLevelNode parseOk(String source) {
        Node unit = parse(source);
        if (unit instanceof ErrorNode) {
            fail("unexpected parse error: " + ((ErrorNode) unit).message);
        }
        return (TopLevelNode) unit;
    }

    public static List<Node> analyze(String source, AnalyzerConfiguration config) {
        return new Analyzer(context(), config).analyze(parseOk(source));
    }

    /**
     * Messages of the error nodes produced for a source, in order.
     */
    public static List<String> diagnostics(String source) {
        return diagnostics(source, AnalyzerConfiguration.defaults());
    }

    public static List<String> diagnostics(String source, AnalyzerConfiguration config) {
        List<String> messages = new ArrayList<>();
        for (Node node : analyze(source, config)) {
            if (node instanceof ErrorNode) {
                messages.add(((ErrorNode) node).message);
            }
        }
        return messages;
    }

    /**
     * Analyzes a source that must be free of diagnostics.
     */
    public static TopLevelNode analyzeOk(String source) {
        List<Node> result = analyze(source, AnalyzerConfiguration.defaults());
        assertEquals(1, result.size(), () -> "unexpected diagnostics: " + result);
        assertFalse(result.get(0) instanceof ErrorNode, () -> ((ErrorNode) result.get(0)).message);
        return (TopLevelNode) result.get(0);
    }

    /**
     * Concatenates the text chunks of a rendering that must succeed.
     */
    public static String render(Generator generator, Node unit) {
        StringBuilder text = new StringBuilder();
        Iterator<TextChunk> chunks = generator.render(unit);
        while (chunks.hasNext()) {
            TextChunk chunk = chunks.next();
            if (chunk.isError()) {
                fail("unexpected render error: " + chunk.getError());
            }
            text.append(chunk.getText());
        }
        return text.toString();
    }
}
