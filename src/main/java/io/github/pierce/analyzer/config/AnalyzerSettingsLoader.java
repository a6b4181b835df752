package io.github.pierce.analyzer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Builds {@link AnalyzerSettings} from a classpath properties file, a classpath YAML
 * file or environment variables. Keys that are absent keep their defaults.
 *
 * <p>Property keys (YAML uses the same names nested under {@code analyzer}):
 * <pre>
 * analyzer.limits.max-bytes            analyzer.csv.delimiter
 * analyzer.limits.max-rows             analyzer.csv.quote
 * analyzer.limits.max-columns          analyzer.inference.trim-whitespace
 * analyzer.limits.preview-size         analyzer.inference.malformed-rows   (exclude | reject)
 * analyzer.limits.sample-values        analyzer.inference.boolean-tokens   (true:false,yes:no)
 * analyzer.limits.allowed-extensions   analyzer.inference.date-patterns    (yyyy-MM-dd|dd.MM.yyyy)
 * </pre>
 * Environment variables use the key upper-cased with dots and dashes replaced by
 * underscores, e.g. {@code ANALYZER_LIMITS_MAX_ROWS}.</p>
 */
public final class AnalyzerSettingsLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerSettingsLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "tabular-analyzer.properties";

    static final String MAX_BYTES = "analyzer.limits.max-bytes";
    static final String MAX_ROWS = "analyzer.limits.max-rows";
    static final String MAX_COLUMNS = "analyzer.limits.max-columns";
    static final String PREVIEW_SIZE = "analyzer.limits.preview-size";
    static final String SAMPLE_VALUES = "analyzer.limits.sample-values";
    static final String ALLOWED_EXTENSIONS = "analyzer.limits.allowed-extensions";
    static final String DELIMITER = "analyzer.csv.delimiter";
    static final String QUOTE = "analyzer.csv.quote";
    static final String TRIM_WHITESPACE = "analyzer.inference.trim-whitespace";
    static final String MALFORMED_ROWS = "analyzer.inference.malformed-rows";
    static final String BOOLEAN_TOKENS = "analyzer.inference.boolean-tokens";
    static final String DATE_PATTERNS = "analyzer.inference.date-patterns";

    private static final List<String> KEYS = List.of(MAX_BYTES, MAX_ROWS, MAX_COLUMNS, PREVIEW_SIZE,
            SAMPLE_VALUES, ALLOWED_EXTENSIONS, DELIMITER, QUOTE, TRIM_WHITESPACE, MALFORMED_ROWS,
            BOOLEAN_TOKENS, DATE_PATTERNS);

    private AnalyzerSettingsLoader() {
    }

    /**
     * Loads settings from the default properties file on the classpath.
     */
    public static AnalyzerSettings fromDefaultProperties() throws IOException {
        return fromProperties(DEFAULT_CONFIG_FILE);
    }

    /**
     * Loads settings from a properties file on the classpath.
     */
    public static AnalyzerSettings fromProperties(String resource) throws IOException {
        Properties props = new Properties();
        try (InputStream is = open(resource)) {
            props.load(is);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            values.put(name, props.getProperty(name));
        }
        return fromMap(values);
    }

    /**
     * Loads settings from a YAML file on the classpath.
     */
    public static AnalyzerSettings fromYaml(String resource) throws IOException {
        Object document;
        try (InputStream is = open(resource)) {
            document = new Yaml().load(is);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        if (document instanceof Map<?, ?> map) {
            flatten("", map, values);
        } else if (document != null) {
            throw new IOException("Expected a mapping at the top of " + resource);
        }
        return fromMap(values);
    }

    /**
     * Loads settings from the process environment.
     */
    public static AnalyzerSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Loads settings from the given environment variables.
     */
    public static AnalyzerSettings fromEnvironment(Map<String, String> environment) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String key : KEYS) {
            String value = environment.get(environmentName(key));
            if (value != null) {
                values.put(key, value);
            }
        }
        return fromMap(values);
    }

    static String environmentName(String key) {
        return key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    /**
     * Builds settings from flat keys. Values may be strings, numbers, booleans or lists.
     *
     * @throws IllegalArgumentException if a value cannot be interpreted
     */
    public static AnalyzerSettings fromMap(Map<String, Object> values) {
        AnalysisLimits.Builder limits = AnalysisLimits.builder();
        InferenceConfig.Builder inference = InferenceConfig.builder();

        for (Map.Entry<String, Object> entry : values.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case MAX_BYTES -> limits.maxBytes(toLong(key, value));
                case MAX_ROWS -> limits.maxRows(toInt(key, value));
                case MAX_COLUMNS -> limits.maxColumns(toInt(key, value));
                case PREVIEW_SIZE -> limits.previewSize(toInt(key, value));
                case SAMPLE_VALUES -> limits.sampleValueCount(toInt(key, value));
                case ALLOWED_EXTENSIONS -> limits.allowedExtensions(new LinkedHashSet<>(toList(value, ",")));
                case DELIMITER -> inference.delimiter(toChar(key, value));
                case QUOTE -> inference.quoteChar(toChar(key, value));
                case TRIM_WHITESPACE -> inference.trimWhitespace(Boolean.parseBoolean(value.toString().trim()));
                case MALFORMED_ROWS -> inference.malformedRowPolicy(toPolicy(key, value));
                case BOOLEAN_TOKENS -> inference.booleanTokens(toBooleanTokens(key, value));
                case DATE_PATTERNS -> inference.datePatterns(toList(value, "\\|"));
                default -> LOG.warn("Ignoring unknown analyzer setting '{}'", key);
            }
        }
        AnalyzerSettings settings = new AnalyzerSettings(limits.build(), inference.build());
        LOG.debug("Loaded {}", settings);
        return settings;
    }

    private static InputStream open(String resource) throws IOException {
        InputStream is = AnalyzerSettingsLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IOException("Configuration file not found on classpath: " + resource);
        }
        return is;
    }

    private static void flatten(String prefix, Map<?, ?> map, Map<String, Object> out) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            if (entry.getValue() instanceof Map<?, ?> nested) {
                flatten(key, nested, out);
            } else {
                out.put(key, entry.getValue());
            }
        }
    }

    private static long toLong(String key, Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim().replace("_", ""));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' must be a whole number: " + value, e);
        }
    }

    private static int toInt(String key, Object value) {
        long number = toLong(key, value);
        if (number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Setting '" + key + "' must be at most "
                    + Integer.MAX_VALUE + ": " + value);
        }
        return (int) number;
    }

    private static char toChar(String key, Object value) {
        String str = value.toString();
        if ("\\t".equals(str) || "tab".equalsIgnoreCase(str)) {
            return '\t';
        }
        if (str.length() != 1) {
            throw new IllegalArgumentException("Setting '" + key + "' must be a single character: '" + str + "'");
        }
        return str.charAt(0);
    }

    private static InferenceConfig.MalformedRowPolicy toPolicy(String key, Object value) {
        String name = value.toString().trim().toUpperCase(Locale.ROOT);
        try {
            return InferenceConfig.MalformedRowPolicy.valueOf(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Setting '" + key + "' must be one of "
                    + Arrays.toString(InferenceConfig.MalformedRowPolicy.values()) + ": " + value, e);
        }
    }

    private static List<String> toList(Object value, String separatorRegex) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).map(String::trim).collect(Collectors.toList());
        }
        return Arrays.stream(value.toString().split(separatorRegex))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static List<InferenceConfig.BooleanTokenPair> toBooleanTokens(String key, Object value) {
        List<InferenceConfig.BooleanTokenPair> pairs = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof List<?> pair && pair.size() == 2) {
                    pairs.add(new InferenceConfig.BooleanTokenPair(String.valueOf(pair.get(0)), String.valueOf(pair.get(1))));
                } else {
                    pairs.add(toPair(key, String.valueOf(item)));
                }
            }
            return pairs;
        }
        for (String token : toList(value, ",")) {
            pairs.add(toPair(key, token));
        }
        return pairs;
    }

    private static InferenceConfig.BooleanTokenPair toPair(String key, String token) {
        String[] parts = token.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Setting '" + key + "' expects true:false pairs but got '" + token + "'");
        }
        return new InferenceConfig.BooleanTokenPair(parts[0], parts[1]);
    }
}
