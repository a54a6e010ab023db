package de.mirkosertic.ftsquery.config;

import de.mirkosertic.ftsquery.CachingFtsQuery;
import de.mirkosertic.ftsquery.ConditionTransformer;
import de.mirkosertic.ftsquery.DefaultConjunction;
import de.mirkosertic.ftsquery.FtsQuery;
import de.mirkosertic.ftsquery.FtsQuerySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Externalized configuration for the full-text search condition transformer.
 * Loads configuration from YAML files and system properties.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties ({@code -Dftsquery.default-conjunction=OR})
 * 2. User config file (~/.ftsquery/config.yaml)
 * 3. Application defaults (fts-query.yaml in classpath)
 * <p>
 * Invalid values are logged and ignored, keeping the value from the previous source.
 */
public class FtsQueryConfig {

    private static final Logger logger = LoggerFactory.getLogger(FtsQueryConfig.class);

    private static final String CONFIG_DIR = ".ftsquery";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "fts-query.yaml";
    private static final String ROOT_KEY = "fts-query";
    static final String PROPERTY_PREFIX = "ftsquery.";

    static final String ADD_STANDARD_STOP_WORDS = "add-standard-stop-words";
    static final String ADDITIONAL_STOP_WORDS = "additional-stop-words";
    static final String DEFAULT_CONJUNCTION = "default-conjunction";
    static final String USE_INFLECTIONAL_SEARCH = "use-inflectional-search";
    static final String USE_TRAILING_WILDCARD = "use-trailing-wildcard-for-all-words";
    static final String TREAT_NEAR_AS_OPERATOR = "treat-near-as-operator";
    static final String ENABLED_PUNCTUATION = "enabled-punctuation";
    static final String DISABLED_PUNCTUATION = "disabled-punctuation";
    static final String CACHE_MAXIMUM_SIZE = "cache.maximum-size";

    private boolean addStandardStopWords = false;
    private List<String> additionalStopWords = new ArrayList<>();
    private DefaultConjunction defaultConjunction = DefaultConjunction.AND;
    private boolean useInflectionalSearch = true;
    private boolean useTrailingWildcardForAllWords = false;
    private boolean treatNearAsOperator = true;
    private String enabledPunctuation = "";
    private String disabledPunctuation = "";
    private long cacheMaximumSize = 0;

    private FtsQueryConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static FtsQueryConfig load() {
        return load(getUserConfigPath(), System.getProperties());
    }

    /**
     * Load configuration using the given user config file and property overrides.
     *
     * @param userConfigPath the user config file, ignored if it does not exist
     * @param properties     overrides with keys of the form {@code ftsquery.<key>}
     */
    public static FtsQueryConfig load(final Path userConfigPath, final Properties properties) {
        final FtsQueryConfig config = new FtsQueryConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromFile(userConfigPath);

        // Step 3: Apply system properties (highest priority)
        config.applyPropertyOverrides(properties);

        logger.info("Configuration loaded: defaultConjunction={}, inflectional={}, standardStopWords={}, cacheSize={}",
                config.defaultConjunction, config.useInflectionalSearch, config.addStandardStopWords,
                config.cacheMaximumSize);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException | YAMLException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path configPath) {
        if (Files.exists(configPath)) {
            try (final InputStream is = Files.newInputStream(configPath)) {
                applyYaml(is);
                logger.debug("Loaded user config from: {}", configPath);
            } catch (final IOException | YAMLException e) {
                logger.warn("Failed to load user config from: {}", configPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYaml(final InputStream is) {
        final Yaml yaml = new Yaml();
        final Object loaded = yaml.load(is);
        if (!(loaded instanceof Map)) {
            return;
        }
        final Object section = ((Map<String, Object>) loaded).get(ROOT_KEY);
        if (section instanceof Map) {
            applyYamlConfig((Map<String, Object>) section);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        if (config.containsKey(ADD_STANDARD_STOP_WORDS)) {
            applyBoolean(ADD_STANDARD_STOP_WORDS, config.get(ADD_STANDARD_STOP_WORDS));
        }
        if (config.containsKey(ADDITIONAL_STOP_WORDS)) {
            final Object words = config.get(ADDITIONAL_STOP_WORDS);
            if (words instanceof List) {
                final List<String> stopWords = new ArrayList<>();
                for (final Object word : (List<Object>) words) {
                    if (word != null) {
                        stopWords.add(word.toString());
                    }
                }
                this.additionalStopWords = stopWords;
            } else if (words != null) {
                logger.warn("Ignoring {}: expected a list but got {}", ADDITIONAL_STOP_WORDS, words);
            }
        }
        if (config.containsKey(DEFAULT_CONJUNCTION)) {
            applyDefaultConjunction(config.get(DEFAULT_CONJUNCTION));
        }
        if (config.containsKey(USE_INFLECTIONAL_SEARCH)) {
            applyBoolean(USE_INFLECTIONAL_SEARCH, config.get(USE_INFLECTIONAL_SEARCH));
        }
        if (config.containsKey(USE_TRAILING_WILDCARD)) {
            applyBoolean(USE_TRAILING_WILDCARD, config.get(USE_TRAILING_WILDCARD));
        }
        if (config.containsKey(TREAT_NEAR_AS_OPERATOR)) {
            applyBoolean(TREAT_NEAR_AS_OPERATOR, config.get(TREAT_NEAR_AS_OPERATOR));
        }
        if (config.containsKey(ENABLED_PUNCTUATION)) {
            final Object value = config.get(ENABLED_PUNCTUATION);
            this.enabledPunctuation = value == null ? "" : value.toString();
        }
        if (config.containsKey(DISABLED_PUNCTUATION)) {
            final Object value = config.get(DISABLED_PUNCTUATION);
            this.disabledPunctuation = value == null ? "" : value.toString();
        }
        final Object cacheConfig = config.get("cache");
        if (cacheConfig instanceof Map && ((Map<String, Object>) cacheConfig).containsKey("maximum-size")) {
            applyCacheMaximumSize(((Map<String, Object>) cacheConfig).get("maximum-size"));
        }
    }

    private void applyPropertyOverrides(final Properties properties) {
        for (final String key : List.of(ADD_STANDARD_STOP_WORDS, USE_INFLECTIONAL_SEARCH,
                USE_TRAILING_WILDCARD, TREAT_NEAR_AS_OPERATOR)) {
            final String value = properties.getProperty(PROPERTY_PREFIX + key);
            if (value != null && !value.trim().isEmpty()) {
                applyBoolean(key, value.trim());
            }
        }

        final String stopWords = properties.getProperty(PROPERTY_PREFIX + ADDITIONAL_STOP_WORDS);
        if (stopWords != null && !stopWords.trim().isEmpty()) {
            this.additionalStopWords = new ArrayList<>();
            for (final String word : stopWords.split(",")) {
                final String trimmed = word.trim();
                if (!trimmed.isEmpty()) {
                    this.additionalStopWords.add(trimmed);
                }
            }
            logger.info("Additional stop words from system properties: {}", this.additionalStopWords);
        }

        final String conjunction = properties.getProperty(PROPERTY_PREFIX + DEFAULT_CONJUNCTION);
        if (conjunction != null && !conjunction.trim().isEmpty()) {
            applyDefaultConjunction(conjunction);
        }

        final String enabled = properties.getProperty(PROPERTY_PREFIX + ENABLED_PUNCTUATION);
        if (enabled != null) {
            this.enabledPunctuation = enabled;
        }
        final String disabled = properties.getProperty(PROPERTY_PREFIX + DISABLED_PUNCTUATION);
        if (disabled != null) {
            this.disabledPunctuation = disabled;
        }

        final String cacheSize = properties.getProperty(PROPERTY_PREFIX + CACHE_MAXIMUM_SIZE);
        if (cacheSize != null && !cacheSize.trim().isEmpty()) {
            applyCacheMaximumSize(cacheSize.trim());
        }
    }

    private void applyBoolean(final String key, final Object value) {
        final Boolean parsed;
        if (value instanceof Boolean) {
            parsed = (Boolean) value;
        } else if (value != null && ("true".equalsIgnoreCase(value.toString()) || "false".equalsIgnoreCase(value.toString()))) {
            parsed = Boolean.parseBoolean(value.toString());
        } else {
            logger.warn("Ignoring {}: expected true or false but got {}", key, value);
            return;
        }

        switch (key) {
            case ADD_STANDARD_STOP_WORDS -> this.addStandardStopWords = parsed;
            case USE_INFLECTIONAL_SEARCH -> this.useInflectionalSearch = parsed;
            case USE_TRAILING_WILDCARD -> this.useTrailingWildcardForAllWords = parsed;
            case TREAT_NEAR_AS_OPERATOR -> this.treatNearAsOperator = parsed;
            default -> throw new IllegalArgumentException("Unknown boolean option: " + key);
        }
    }

    private void applyDefaultConjunction(final Object value) {
        if (value == null) {
            logger.warn("Ignoring {}: no value", DEFAULT_CONJUNCTION);
            return;
        }
        try {
            this.defaultConjunction = DefaultConjunction.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            logger.warn("Ignoring {}: expected AND or OR but got {}", DEFAULT_CONJUNCTION, value);
        }
    }

    private void applyCacheMaximumSize(final Object value) {
        if (value instanceof Number) {
            this.cacheMaximumSize = ((Number) value).longValue();
            return;
        }
        try {
            this.cacheMaximumSize = Long.parseLong(String.valueOf(value).trim());
        } catch (final NumberFormatException e) {
            logger.warn("Ignoring {}: expected a number but got {}", CACHE_MAXIMUM_SIZE, value);
        }
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    /**
     * Builds the transformer settings described by this configuration.
     */
    public FtsQuerySettings toSettings() {
        return FtsQuerySettings.builder()
                .addStandardStopWords(addStandardStopWords)
                .additionalStopWords(additionalStopWords)
                .defaultConjunction(defaultConjunction)
                .useInflectionalSearch(useInflectionalSearch)
                .useTrailingWildcardForAllWords(useTrailingWildcardForAllWords)
                .treatNearAsOperator(treatNearAsOperator)
                .enabledPunctuation(enabledPunctuation.toCharArray())
                .disabledPunctuation(disabledPunctuation.toCharArray())
                .build();
    }

    /**
     * Creates a transformer for this configuration, wrapped in a cache when
     * {@code cache.maximum-size} is positive.
     */
    public ConditionTransformer createTransformer() {
        final FtsQuery query = new FtsQuery(toSettings());
        if (cacheMaximumSize > 0) {
            return new CachingFtsQuery(query, cacheMaximumSize);
        }
        return query;
    }

    // Getters
    public boolean isAddStandardStopWords() {
        return addStandardStopWords;
    }

    public List<String> getAdditionalStopWords() {
        return additionalStopWords;
    }

    public DefaultConjunction getDefaultConjunction() {
        return defaultConjunction;
    }

    public boolean isUseInflectionalSearch() {
        return useInflectionalSearch;
    }

    public boolean isUseTrailingWildcardForAllWords() {
        return useTrailingWildcardForAllWords;
    }

    public boolean isTreatNearAsOperator() {
        return treatNearAsOperator;
    }

    public String getEnabledPunctuation() {
        return enabledPunctuation;
    }

    public String getDisabledPunctuation() {
        return disabledPunctuation;
    }

    public long getCacheMaximumSize() {
        return cacheMaximumSize;
    }
}
