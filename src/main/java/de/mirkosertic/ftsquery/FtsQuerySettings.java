package de.mirkosertic.ftsquery;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable options controlling how {@link FtsQuery} interprets search phrases.
 *
 * <p>Instances are created with {@link #builder()}:</p>
 * <pre>
 * FtsQuerySettings settings = FtsQuerySettings.builder()
 *         .defaultConjunction(DefaultConjunction.OR)
 *         .useTrailingWildcardForAllWords(true)
 *         .disabledPunctuation('-')
 *         .build();
 * </pre>
 */
public final class FtsQuerySettings {

    /**
     * Characters not allowed in unquoted search terms unless overridden.
     */
    public static final String DEFAULT_PUNCTUATION = "~\"'`!@#$%^&*()-+=[]{}\\|;:,.<>?/";

    private static final FtsQuerySettings DEFAULTS = builder().build();

    private final boolean addStandardStopWords;
    private final List<String> additionalStopWords;
    private final DefaultConjunction defaultConjunction;
    private final boolean useInflectionalSearch;
    private final boolean useTrailingWildcardForAllWords;
    private final boolean treatNearAsOperator;
    private final String enabledPunctuation;
    private final String disabledPunctuation;
    private final String punctuation;

    private FtsQuerySettings(final Builder builder) {
        this.addStandardStopWords = builder.addStandardStopWords;
        this.additionalStopWords = List.copyOf(builder.additionalStopWords);
        this.defaultConjunction = builder.defaultConjunction;
        this.useInflectionalSearch = builder.useInflectionalSearch;
        this.useTrailingWildcardForAllWords = builder.useTrailingWildcardForAllWords;
        this.treatNearAsOperator = builder.treatNearAsOperator;
        this.enabledPunctuation = builder.enabledPunctuation.toString();
        this.disabledPunctuation = builder.disabledPunctuation.toString();
        this.punctuation = resolvePunctuation(enabledPunctuation, disabledPunctuation);
    }

    private static String resolvePunctuation(final String enabled, final String disabled) {
        final String base = enabled.isEmpty() ? DEFAULT_PUNCTUATION : enabled;
        final StringBuilder result = new StringBuilder(base.length());
        for (int i = 0; i < base.length(); i++) {
            final char ch = base.charAt(i);
            if (disabled.indexOf(ch) < 0 && result.indexOf(String.valueOf(ch)) < 0) {
                result.append(ch);
            }
        }
        return result.toString();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the settings with every option at its default value.
     */
    public static FtsQuerySettings defaults() {
        return DEFAULTS;
    }

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

    /**
     * Returns the active punctuation characters: the enabled set (or the default set
     * when none was enabled) minus the disabled characters.
     */
    public String getPunctuation() {
        return punctuation;
    }

    @Override
    public String toString() {
        return "FtsQuerySettings[addStandardStopWords=" + addStandardStopWords
                + ", additionalStopWords=" + additionalStopWords.size()
                + ", defaultConjunction=" + defaultConjunction
                + ", useInflectionalSearch=" + useInflectionalSearch
                + ", useTrailingWildcardForAllWords=" + useTrailingWildcardForAllWords
                + ", treatNearAsOperator=" + treatNearAsOperator
                + ", punctuation=" + punctuation + "]";
    }

    /**
     * Builder for {@link FtsQuerySettings}.
     */
    public static final class Builder {

        private boolean addStandardStopWords = false;
        private final List<String> additionalStopWords = new ArrayList<>();
        private DefaultConjunction defaultConjunction = DefaultConjunction.AND;
        private boolean useInflectionalSearch = true;
        private boolean useTrailingWildcardForAllWords = false;
        private boolean treatNearAsOperator = true;
        private final StringBuilder enabledPunctuation = new StringBuilder();
        private final StringBuilder disabledPunctuation = new StringBuilder();

        private Builder() {
        }

        /**
         * If true, the standard list of SQL Server stop words is added to the stop word list.
         */
        public Builder addStandardStopWords(final boolean addStandardStopWords) {
            this.addStandardStopWords = addStandardStopWords;
            return this;
        }

        public Builder additionalStopWords(final String... stopWords) {
            return additionalStopWords(Arrays.asList(stopWords));
        }

        public Builder additionalStopWords(final Collection<String> stopWords) {
            for (final String stopWord : stopWords) {
                additionalStopWords.add(Objects.requireNonNull(stopWord, "stopWord"));
            }
            return this;
        }

        public Builder defaultConjunction(final DefaultConjunction defaultConjunction) {
            this.defaultConjunction = Objects.requireNonNull(defaultConjunction, "defaultConjunction");
            return this;
        }

        /**
         * Selects inflectional search (all tenses, plurals and possessives of a word) as the
         * default term form. When false, terms are matched literally.
         */
        public Builder useInflectionalSearch(final boolean useInflectionalSearch) {
            this.useInflectionalSearch = useInflectionalSearch;
            return this;
        }

        /**
         * Appends a trailing wildcard to every plain word so it matches by prefix.
         */
        public Builder useTrailingWildcardForAllWords(final boolean useTrailingWildcardForAllWords) {
            this.useTrailingWildcardForAllWords = useTrailingWildcardForAllWords;
            return this;
        }

        public Builder treatNearAsOperator(final boolean treatNearAsOperator) {
            this.treatNearAsOperator = treatNearAsOperator;
            return this;
        }

        /**
         * Replaces the default punctuation set with the given characters.
         */
        public Builder enabledPunctuation(final char... chars) {
            enabledPunctuation.append(Objects.requireNonNull(chars, "chars"));
            return this;
        }

        /**
         * Removes the given characters from the active punctuation set.
         */
        public Builder disabledPunctuation(final char... chars) {
            disabledPunctuation.append(Objects.requireNonNull(chars, "chars"));
            return this;
        }

        public FtsQuerySettings build() {
            return new FtsQuerySettings(this);
        }
    }
}
