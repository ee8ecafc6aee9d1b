package org.vain.analysis;

import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;
import org.snakeyaml.engine.v2.schema.CoreSchema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Which analyzer rules are enabled. Built once at startup and handed to every
 * {@link Analyzer}; it is not changed afterwards.
 * <p>
 * All rules are enabled by default. A YAML file can switch rules off:
 * <pre>
 * rules:
 *   undeclared-variable: false
 * </pre>
 */
public class AnalyzerConfiguration {
    private final Map<String, Boolean> rules;

    private AnalyzerConfiguration(Map<String, Boolean> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static AnalyzerConfiguration defaults() {
        return new AnalyzerConfiguration(defaultRules());
    }

    private static Map<String, Boolean> defaultRules() {
        Map<String, Boolean> rules = new LinkedHashMap<>();
        for (String rule : Rule.ALL) {
            rules.put(rule, Boolean.TRUE);
        }
        return rules;
    }

    /**
     * Returns a copy with one rule switched on or off.
     *
     * @throws IllegalArgumentException if the rule does not exist
     */
    public AnalyzerConfiguration with(String rule, boolean enabled) {
        checkRule(rule);
        Map<String, Boolean> copy = new LinkedHashMap<>(rules);
        copy.put(rule, enabled);
        return new AnalyzerConfiguration(copy);
    }

    public boolean isEnabled(String rule) {
        return rules.getOrDefault(rule, Boolean.FALSE);
    }

    public Map<String, Boolean> getRules() {
        return rules;
    }

    public static AnalyzerConfiguration load(Path path) throws IOException {
        return parse(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    /**
     * Reads a configuration from YAML text. Rules not mentioned keep their default.
     *
     * @throws IllegalArgumentException if the document is malformed or names an unknown rule
     */
    public static AnalyzerConfiguration parse(String yaml) {
        LoadSettings settings = LoadSettings.builder()
                .setSchema(new CoreSchema())
                .build();
        Object document;
        try {
            document = new Load(settings).loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("invalid configuration: " + e.getMessage(), e);
        }
        Map<String, Boolean> rules = defaultRules();
        if (document == null) {
            return new AnalyzerConfiguration(rules);
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("invalid configuration: expected a mapping at the top level");
        }
        Object section = ((Map<?, ?>) document).get("rules");
        if (section == null) {
            return new AnalyzerConfiguration(rules);
        }
        if (!(section instanceof Map)) {
            throw new IllegalArgumentException("invalid configuration: \"rules\" must be a mapping");
        }
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) section).entrySet()) {
            String rule = String.valueOf(entry.getKey());
            checkRule(rule);
            if (!(entry.getValue() instanceof Boolean)) {
                throw new IllegalArgumentException("invalid configuration: rule \"" + rule + "\" must be true or false");
            }
            rules.put(rule, (Boolean) entry.getValue());
        }
        return new AnalyzerConfiguration(rules);
    }

    private static void checkRule(String rule) {
        if (!Arrays.asList(Rule.ALL).contains(rule)) {
            throw new IllegalArgumentException("unknown rule \"" + rule + "\"");
        }
    }

    @Override
    public String toString() {
        return "AnalyzerConfiguration" + rules;
    }
}
