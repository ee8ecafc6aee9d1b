package org.vain.analysis;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyzerConfigurationTest {

    @Test
    public void testDefaultsEnableEverything() {
        AnalyzerConfiguration config = AnalyzerConfiguration.defaults();
        for (String rule : Rule.ALL) {
            assertTrue(config.isEnabled(rule), rule);
        }
        assertFalse(config.isEnabled("no-such-rule"));
    }

    @Test
    public void testParseDisablesRules() {
        AnalyzerConfiguration config = AnalyzerConfiguration.parse(
                "rules:\n  undeclared-variable: false\n  toplevel-return: true\n");
        assertFalse(config.isEnabled(Rule.UNDECLARED_VARIABLE));
        assertTrue(config.isEnabled(Rule.TOPLEVEL_RETURN));
        assertTrue(config.isEnabled(Rule.DUPLICATE_DECLARATION));
    }

    @Test
    public void testEmptyDocuments() {
        assertEquals(AnalyzerConfiguration.defaults().getRules(), AnalyzerConfiguration.parse("").getRules());
        assertEquals(AnalyzerConfiguration.defaults().getRules(), AnalyzerConfiguration.parse("other: 1\n").getRules());
    }

    @Test
    public void testUnknownRule() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> AnalyzerConfiguration.parse("rules:\n  no-such-rule: false\n"));
        assertEquals("unknown rule \"no-such-rule\"", e.getMessage());
    }

    @Test
    public void testNonBooleanValue() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> AnalyzerConfiguration.parse("rules:\n  toplevel-return: maybe\n"));
        assertEquals("invalid configuration: rule \"toplevel-return\" must be true or false", e.getMessage());
    }

    @Test
    public void testMalformedDocuments() {
        assertThrows(IllegalArgumentException.class, () -> AnalyzerConfiguration.parse("- a\n- b\n"));
        assertThrows(IllegalArgumentException.class, () -> AnalyzerConfiguration.parse("rules: [a]\n"));
        assertThrows(IllegalArgumentException.class, () -> AnalyzerConfiguration.parse("rules: {a: [\n"));
    }

    @Test
    public void testWithDoesNotChangeOriginal() {
        AnalyzerConfiguration defaults = AnalyzerConfiguration.defaults();
        AnalyzerConfiguration changed = defaults.with(Rule.TOPLEVEL_RETURN, false);
        assertTrue(defaults.isEnabled(Rule.TOPLEVEL_RETURN));
        assertFalse(changed.isEnabled(Rule.TOPLEVEL_RETURN));
        assertThrows(IllegalArgumentException.class, () -> defaults.with("bogus", true));
    }

    @Test
    public void testLoadFromResource() throws Exception {
        Path file = Path.of(getClass().getClassLoader().getResource("analyzer.yaml").toURI());
        AnalyzerConfiguration config = AnalyzerConfiguration.load(file);
        assertFalse(config.isEnabled(Rule.UNDECLARED_VARIABLE));
        assertTrue(config.isEnabled(Rule.TOPLEVEL_RETURN));
    }

    @Test
    public void testLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve(".vain.yaml");
        Files.write(file, "rules:\n  convert-underscore-variable: false\n".getBytes(StandardCharsets.UTF_8));
        assertFalse(AnalyzerConfiguration.load(file).isEnabled(Rule.CONVERT_UNDERSCORE_VARIABLE));
    }
}
