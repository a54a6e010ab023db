package de.mirkosertic.ftsquery;

import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.WordlistLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Standard list of words SQL Server does not index (the English system stoplist).
 *
 * <p>The list is loaded once from the classpath resource {@value #STOP_WORDS_FILE}.
 * Falls back to an empty list if the resource is missing or unreadable.</p>
 */
public final class StandardStopWords {

    private static final Logger logger = LoggerFactory.getLogger(StandardStopWords.class);

    static final String STOP_WORDS_FILE = "fts-standard-stopwords.txt";
    private static final String COMMENT = "#";

    private static final CharArraySet stopWords;

    static {
        CharArraySet loaded = CharArraySet.EMPTY_SET;
        try (final InputStream input = StandardStopWords.class.getClassLoader().getResourceAsStream(STOP_WORDS_FILE)) {
            if (input != null) {
                try (final Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8)) {
                    loaded = CharArraySet.unmodifiableSet(
                            new CharArraySet(WordlistLoader.getWordSet(reader, COMMENT), true));
                }
                logger.debug("Loaded {} standard stop words", loaded.size());
            } else {
                logger.warn("Standard stop word list {} not found on classpath", STOP_WORDS_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load standard stop word list {}", STOP_WORDS_FILE, e);
        }
        stopWords = loaded;
    }

    private StandardStopWords() {
        // Prevent instantiation
    }

    /**
     * Returns the standard stop words as an unmodifiable, case-insensitive set.
     */
    public static CharArraySet get() {
        return stopWords;
    }
}
