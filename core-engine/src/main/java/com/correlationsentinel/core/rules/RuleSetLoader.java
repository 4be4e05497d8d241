package com.correlationsentinel.core.rules;

import com.correlationsentinel.core.model.RuleDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a correlation rule set from YAML into validated
 * {@link RuleDefinition}s, ready for a {@link RuleCatalog}.
 *
 * <h3>Format</h3>
 *
 * <pre>
 * rules:
 *   - id: brute-force
 *     name: Brute Force Attack
 *     type: attack_chain
 *     windowSeconds: 600
 *     minEventCount: 3
 *     minConfidence: 0.8
 *     requiredEventTypes: [AuthenticationFailure, AuthenticationSuccess]
 * </pre>
 *
 * <h3>Validation</h3>
 * <p>
 * The document is parsed with SnakeYAML's {@link SafeConstructor} and each
 * entry is bound field by field. Unknown keys, values of the wrong kind,
 * unknown correlation or event types and repeated ids are all collected,
 * each tagged with the entry's position ({@code rules[2] (lateral): ...}),
 * and reported together in one {@link IllegalStateException}.
 * </p>
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_RULES_PATH}, when it names an
 * existing file</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class RuleSetLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSetLoader.class);

    /** Environment variable naming a rules file that replaces the bundled set. */
    public static final String ENV_RULES_PATH = "RULES_CONFIG_PATH";

    /** Rules shipped with the engine. */
    public static final String DEFAULT_RESOURCE = "correlation-rules.yml";

    private static final String RULES_KEY = "rules";

    private static final Set<String> RULE_KEYS = Set.of(
            "id", "name", "description", "type", "windowSeconds",
            "minEventCount", "minConfidence", "requiredEventTypes", "enabled");

    private RuleSetLoader() {
        // utility class — not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the file named by {@value #ENV_RULES_PATH}, or the bundled rules.
     *
     * @throws IllegalStateException if the rule set is invalid
     */
    public static List<RuleDefinition> load() {
        String envPath = System.getenv(ENV_RULES_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading correlation rules from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading correlation rules from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path YAML file on the file system; must not be {@code null}
     * @return validated rules in file order
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading fails or the rule set is invalid
     */
    public static List<RuleDefinition> fromFile(String path) {
        Objects.requireNonNull(path, "Rules file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parse(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Rules file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read rules file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return validated rules in file order
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading fails or the rule set is invalid
     */
    public static List<RuleDefinition> fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = RuleSetLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parse(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * Parse and validate a rule set.
     *
     * @param in     YAML document
     * @param source name used in log and error messages
     * @return validated, unmodifiable rules in document order; empty when the
     *         document defines none
     * @throws IllegalStateException if the YAML is malformed or any rule is invalid
     */
    public static List<RuleDefinition> parse(InputStream in, String source) {
        Objects.requireNonNull(in, "input must not be null");
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Object document;
        try {
            document = new Yaml(new SafeConstructor(options)).load(in);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed rules YAML in " + source + ": " + e.getMessage(), e);
        }

        List<String> errors = new ArrayList<>();
        List<?> entries = ruleEntries(document, errors);
        if (entries.isEmpty() && errors.isEmpty()) {
            LOG.warn("No correlation rules defined in {}", source);
            return List.of();
        }

        List<RuleDefinition> rules = new ArrayList<>(entries.size());
        Map<String, Integer> seenIds = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            String position = "rules[" + i + "]";
            RuleDefinition rule = bind(entries.get(i), position, errors);
            if (rule != null) {
                RuleCatalog.collectProblems(i, rule, seenIds, errors);
                rules.add(rule);
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid correlation rules in " + source
                    + ":\n  - " + String.join("\n  - ", errors));
        }
        LOG.info("Loaded {} correlation rule(s) from {}", rules.size(), source);
        return List.copyOf(rules);
    }

    // ---------------------------------------------------------------
    // Binding
    // ---------------------------------------------------------------

    private static List<?> ruleEntries(Object document, List<String> errors) {
        if (document == null) {
            return List.of();
        }
        if (!(document instanceof Map<?, ?> root)) {
            errors.add("document must be a mapping with a '" + RULES_KEY + "' list");
            return List.of();
        }
        for (Object key : root.keySet()) {
            if (!RULES_KEY.equals(key)) {
                errors.add("unknown top-level key '" + key + "'");
            }
        }
        Object rules = root.get(RULES_KEY);
        if (rules == null) {
            return List.of();
        }
        if (!(rules instanceof List<?> list)) {
            errors.add("'" + RULES_KEY + "' must be a list");
            return List.of();
        }
        return list;
    }

    /**
     * @return the bound rule, or {@code null} when the entry has binding
     *         errors (already added to {@code errors})
     */
    private static RuleDefinition bind(Object entry, String position, List<String> errors) {
        if (!(entry instanceof Map<?, ?> fields)) {
            errors.add(position + ": expected a mapping, got " + kind(entry));
            return null;
        }
        String label = fields.get("id") instanceof String id ? position + " (" + id + ")" : position;
        int before = errors.size();
        RuleDefinition rule = new RuleDefinition();

        for (Map.Entry<?, ?> field : fields.entrySet()) {
            Object key = field.getKey();
            Object value = field.getValue();
            if (!(key instanceof String name) || !RULE_KEYS.contains(name)) {
                errors.add(label + ": unknown key '" + key + "'");
                continue;
            }
            if (value == null) {
                continue;
            }
            switch (name) {
                case "id" -> rule.setId(text(value, name, label, errors));
                case "name" -> rule.setName(text(value, name, label, errors));
                case "description" -> rule.setDescription(text(value, name, label, errors));
                case "type" -> rule.setType(text(value, name, label, errors));
                case "windowSeconds" -> {
                    if (isWhole(value)) {
                        rule.setWindowSeconds(((Number) value).longValue());
                    } else {
                        errors.add(label + ": 'windowSeconds' must be a whole number of seconds, got " + kind(value));
                    }
                }
                case "minEventCount" -> {
                    if (value instanceof Integer count) {
                        rule.setMinEventCount(count);
                    } else {
                        errors.add(label + ": 'minEventCount' must be an integer, got " + kind(value));
                    }
                }
                case "minConfidence" -> {
                    if (value instanceof Number number) {
                        rule.setMinConfidence(number.doubleValue());
                    } else {
                        errors.add(label + ": 'minConfidence' must be a number, got " + kind(value));
                    }
                }
                case "requiredEventTypes" -> rule.setRequiredEventTypes(eventTypes(value, label, errors));
                case "enabled" -> {
                    if (value instanceof Boolean enabled) {
                        rule.setEnabled(enabled);
                    } else {
                        errors.add(label + ": 'enabled' must be true or false, got " + kind(value));
                    }
                }
                default -> throw new IllegalStateException("Unhandled rule key: " + name);
            }
        }
        return errors.size() == before ? rule : null;
    }

    private static String text(Object value, String key, String label, List<String> errors) {
        if (value instanceof String s) {
            return s;
        }
        errors.add(label + ": '" + key + "' must be a string, got " + kind(value));
        return null;
    }

    private static List<String> eventTypes(Object value, String label, List<String> errors) {
        if (!(value instanceof List<?> list)) {
            errors.add(label + ": 'requiredEventTypes' must be a list, got " + kind(value));
            return List.of();
        }
        List<String> names = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof String s) {
                names.add(s);
            } else {
                errors.add(label + ": 'requiredEventTypes' entries must be strings, got " + kind(item));
            }
        }
        return names;
    }

    private static boolean isWhole(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof BigInteger;
    }

    private static String kind(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof Map) {
            return "a mapping";
        }
        if (value instanceof List) {
            return "a list";
        }
        return "'" + value + "'";
    }
}
