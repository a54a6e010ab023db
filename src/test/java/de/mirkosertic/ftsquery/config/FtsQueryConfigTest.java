package de.mirkosertic.ftsquery.config;

import de.mirkosertic.ftsquery.CachingFtsQuery;
import de.mirkosertic.ftsquery.ConditionTransformer;
import de.mirkosertic.ftsquery.DefaultConjunction;
import de.mirkosertic.ftsquery.FtsQuery;
import de.mirkosertic.ftsquery.FtsQuerySettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link FtsQueryConfig}.
 */
@DisplayName("FtsQueryConfig Tests")
class FtsQueryConfigTest {

    @TempDir
    Path tempDir;

    private Path writeConfig(final String yaml) throws IOException {
        final Path file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("Classpath defaults should apply when no user file exists")
    void testDefaults() {
        final FtsQueryConfig config = FtsQueryConfig.load(tempDir.resolve("missing.yaml"), new Properties());

        assertThat(config.isAddStandardStopWords()).isFalse();
        assertThat(config.getAdditionalStopWords()).isEmpty();
        assertThat(config.getDefaultConjunction()).isEqualTo(DefaultConjunction.AND);
        assertThat(config.isUseInflectionalSearch()).isTrue();
        assertThat(config.isUseTrailingWildcardForAllWords()).isFalse();
        assertThat(config.isTreatNearAsOperator()).isTrue();
        assertThat(config.getEnabledPunctuation()).isEmpty();
        assertThat(config.getDisabledPunctuation()).isEmpty();
        assertThat(config.getCacheMaximumSize()).isEqualTo(0);
        assertThat(config.toSettings().getPunctuation()).isEqualTo(FtsQuerySettings.DEFAULT_PUNCTUATION);
    }

    @Test
    @DisplayName("User config file should override classpath defaults")
    void testUserFileOverrides() throws IOException {
        final Path file = writeConfig("""
                fts-query:
                  add-standard-stop-words: true
                  additional-stop-words:
                    - foo
                    - bar
                  default-conjunction: OR
                  use-inflectional-search: false
                  use-trailing-wildcard-for-all-words: true
                  treat-near-as-operator: false
                  disabled-punctuation: "-"
                  cache:
                    maximum-size: 500
                """);

        final FtsQueryConfig config = FtsQueryConfig.load(file, new Properties());

        assertThat(config.isAddStandardStopWords()).isTrue();
        assertThat(config.getAdditionalStopWords()).containsExactly("foo", "bar");
        assertThat(config.getDefaultConjunction()).isEqualTo(DefaultConjunction.OR);
        assertThat(config.isUseInflectionalSearch()).isFalse();
        assertThat(config.isUseTrailingWildcardForAllWords()).isTrue();
        assertThat(config.isTreatNearAsOperator()).isFalse();
        assertThat(config.getDisabledPunctuation()).isEqualTo("-");
        assertThat(config.getCacheMaximumSize()).isEqualTo(500);
        assertThat(config.toSettings().getPunctuation()).doesNotContain("-");
    }

    @Test
    @DisplayName("Properties should override the user config file")
    void testPropertiesOverrideFile() throws IOException {
        final Path file = writeConfig("""
                fts-query:
                  default-conjunction: OR
                  additional-stop-words: [foo]
                """);
        final Properties properties = new Properties();
        properties.setProperty("ftsquery.default-conjunction", "and");
        properties.setProperty("ftsquery.additional-stop-words", " alpha, beta ,,gamma ");
        properties.setProperty("ftsquery.use-inflectional-search", "FALSE");
        properties.setProperty("ftsquery.cache.maximum-size", "42");

        final FtsQueryConfig config = FtsQueryConfig.load(file, properties);

        assertThat(config.getDefaultConjunction()).isEqualTo(DefaultConjunction.AND);
        assertThat(config.getAdditionalStopWords()).containsExactly("alpha", "beta", "gamma");
        assertThat(config.isUseInflectionalSearch()).isFalse();
        assertThat(config.getCacheMaximumSize()).isEqualTo(42);
    }

    @Test
    @DisplayName("Invalid values should be ignored")
    void testInvalidValuesIgnored() throws IOException {
        final Path file = writeConfig("""
                fts-query:
                  default-conjunction: XOR
                  use-inflectional-search: maybe
                  additional-stop-words: notalist
                  cache:
                    maximum-size: lots
                """);
        final Properties properties = new Properties();
        properties.setProperty("ftsquery.treat-near-as-operator", "sometimes");

        final FtsQueryConfig config = FtsQueryConfig.load(file, properties);

        assertThat(config.getDefaultConjunction()).isEqualTo(DefaultConjunction.AND);
        assertThat(config.isUseInflectionalSearch()).isTrue();
        assertThat(config.getAdditionalStopWords()).isEmpty();
        assertThat(config.getCacheMaximumSize()).isEqualTo(0);
        assertThat(config.isTreatNearAsOperator()).isTrue();
    }

    @Test
    @DisplayName("Malformed YAML should fall back to the defaults")
    void testMalformedYaml() throws IOException {
        final Path file = writeConfig("fts-query: [unclosed\n  : :");

        final FtsQueryConfig config = FtsQueryConfig.load(file, new Properties());

        assertThat(config.getDefaultConjunction()).isEqualTo(DefaultConjunction.AND);
        assertThat(config.isUseInflectionalSearch()).isTrue();
    }

    @Test
    @DisplayName("Transformer should be cached only when a cache size is configured")
    void testCreateTransformer() {
        final ConditionTransformer plain = FtsQueryConfig.load(tempDir.resolve("missing.yaml"), new Properties())
                .createTransformer();
        assertThat(plain).isInstanceOf(FtsQuery.class);

        final Properties properties = new Properties();
        properties.setProperty("ftsquery.cache.maximum-size", "100");
        properties.setProperty("ftsquery.default-conjunction", "OR");
        final ConditionTransformer cached = FtsQueryConfig.load(tempDir.resolve("missing.yaml"), properties)
                .createTransformer();

        assertThat(cached).isInstanceOf(CachingFtsQuery.class);
        assertThat(((CachingFtsQuery) cached).getDelegate()).isInstanceOf(FtsQuery.class);
        assertThat(cached.transform("abc def"))
                .isEqualTo("FORMSOF(INFLECTIONAL, abc) OR FORMSOF(INFLECTIONAL, def)");
    }

    @Test
    @DisplayName("Configured stop words should reach the transformer")
    void testStopWordsReachTransformer() throws IOException {
        final Path file = writeConfig("""
                fts-query:
                  additional-stop-words: [foo]
                """);

        final ConditionTransformer transformer = FtsQueryConfig.load(file, new Properties()).createTransformer();

        assertThat(transformer.transform("foo bar")).isEqualTo("FORMSOF(INFLECTIONAL, bar)");
    }

    @Test
    @DisplayName("User config path should live in the home directory")
    void testUserConfigPath() {
        assertThat(FtsQueryConfig.getUserConfigPath().toString()).endsWith("config.yaml");
        assertThat(FtsQueryConfig.getUserConfigPath().getParent().getFileName().toString()).isEqualTo(".ftsquery");
    }
}
