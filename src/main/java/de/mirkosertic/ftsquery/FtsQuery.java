package de.mirkosertic.ftsquery;

import de.mirkosertic.ftsquery.parser.SearchPhraseParser;
import de.mirkosertic.ftsquery.tree.ConditionSerializer;
import de.mirkosertic.ftsquery.tree.ExpressionTreeFixup;
import de.mirkosertic.ftsquery.tree.Node;
import de.mirkosertic.ftsquery.util.TextCleaner;
import org.apache.lucene.analysis.CharArraySet;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Converts user-friendly search phrases to SQL Server full-text search conditions.
 *
 * <p>Supports a Google-like syntax. No exceptions are thrown for badly formed input;
 * the transformer simply constructs the best condition it can and returns an empty
 * string if no valid condition is possible.</p>
 *
 * <h2>Examples</h2>
 * <pre>
 * abc                     FORMSOF(INFLECTIONAL, abc)
 * ~abc                    FORMSOF(THESAURUS, abc)
 * "abc"                   "abc"
 * +abc                    "abc"
 * "abc" near "def"        "abc" NEAR "def"
 * abc*                    "abc*"
 * -abc def                FORMSOF(INFLECTIONAL, def) AND NOT FORMSOF(INFLECTIONAL, abc)
 * abc def                 FORMSOF(INFLECTIONAL, abc) AND FORMSOF(INFLECTIONAL, def)
 * &lt;+abc +def&gt;             "abc" NEAR "def"
 * abc and (def or ghi)    FORMSOF(INFLECTIONAL, abc) AND (FORMSOF(INFLECTIONAL, def) OR FORMSOF(INFLECTIONAL, ghi))
 * </pre>
 *
 * <h2>Thread safety</h2>
 * {@link #transform(String)} keeps no per-call state and may be called concurrently,
 * provided the set returned by {@link #getStopWords()} is not modified at the same time.
 */
public class FtsQuery implements ConditionTransformer {

    private static final Logger logger = LoggerFactory.getLogger(FtsQuery.class);

    private final FtsQuerySettings settings;
    private final CharArraySet stopWords;
    private final SearchPhraseParser parser;

    /**
     * Creates a transformer with default settings and an empty stop word list.
     */
    public FtsQuery() {
        this(FtsQuerySettings.defaults());
    }

    /**
     * Creates a transformer with default settings.
     *
     * @param addStandardStopWords if true, the standard stop words are added to the stop word list
     */
    public FtsQuery(final boolean addStandardStopWords) {
        this(FtsQuerySettings.builder().addStandardStopWords(addStandardStopWords).build());
    }

    /**
     * Creates a transformer with the given settings.
     *
     * @param settings settings used to change the default behavior
     */
    public FtsQuery(final FtsQuerySettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");

        this.stopWords = new CharArraySet(16, true);
        if (settings.isAddStandardStopWords()) {
            stopWords.addAll(StandardStopWords.get());
        }
        for (final String stopWord : settings.getAdditionalStopWords()) {
            final String trimmed = stopWord.trim();
            if (!trimmed.isEmpty()) {
                stopWords.add(trimmed);
            }
        }

        this.parser = new SearchPhraseParser(settings, this::isStopWord);
        logger.debug("Created transformer with {} and {} stop words", settings, stopWords.size());
    }

    /**
     * Converts a search phrase to a valid SQL Server full-text search condition, suitable
     * for constructs like {@code CONTAINS} or {@code CONTAINSTABLE}.
     *
     * @param query the phrase to convert, may be {@code null}
     * @return a valid condition, or an empty string if no valid condition was possible
     */
    @Override
    public String transform(@Nullable final String query) {
        final String cleaned = TextCleaner.clean(query);
        Node node = parser.parse(cleaned, settings.getDefaultConjunction().toConjunction());
        node = ExpressionTreeFixup.fixUp(node, true);
        final String condition = ConditionSerializer.render(node);
        logger.debug("Transformed '{}' to '{}'", query, condition);
        return condition;
    }

    /**
     * Returns the stop words. These words are not included in the resulting condition.
     *
     * <p>The returned set is live and case-insensitive; additions and removals affect
     * subsequent calls to {@link #transform(String)}. Callers modifying it while other
     * threads transform queries must synchronize externally.</p>
     */
    public CharArraySet getStopWords() {
        return stopWords;
    }

    /**
     * Determines if the given word has been identified as a stop word.
     *
     * @param word the word to test
     * @return true if the word is a stop word (case-insensitive)
     */
    public boolean isStopWord(final CharSequence word) {
        return stopWords.contains(word);
    }

    public FtsQuerySettings getSettings() {
        return settings;
    }
}
