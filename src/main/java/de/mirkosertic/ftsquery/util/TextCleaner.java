package de.mirkosertic.ftsquery.util;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Removes characters from search input that users cannot see but that would end up
 * inside search terms.
 *
 * <p>Text pasted from word processors or web pages often carries zero-width joiners,
 * byte order marks, non-breaking spaces or replacement characters left by a failed
 * decoding. A term with an embedded zero-width space never matches the indexed word.</p>
 */
public final class TextCleaner {

    /**
     * C0 controls other than TAB, LF and CR, DEL and C1 controls other than NEL, zero-width
     * space, non-joiner and joiner (U+200B-U+200D), byte order mark (U+FEFF) and
     * replacement character (U+FFFD).
     */
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F-\\x84\\x86-\\x9F\\u200B-\\u200D\\uFEFF\\uFFFD]");

    /**
     * Space, line and paragraph separators other than the plain space (U+00A0, U+2007,
     * U+2028, U+2029, ...) and NEL (U+0085). {@link Character#isWhitespace(char)} does not
     * treat the non-breaking ones or NEL as whitespace.
     */
    private static final Pattern UNICODE_SPACES = Pattern.compile("[\\p{Zs}\\p{Zl}\\p{Zp}\\x85&&[^ ]]");

    private TextCleaner() {
    }

    /**
     * Cleans search input. Whitespace is kept as typed apart from mapping Unicode
     * spaces to a plain space, so quoted phrases keep their spacing.
     *
     * @param text the text to clean, may be {@code null}
     * @return the cleaned text, or {@code null} if the input was {@code null}
     */
    public static @Nullable String clean(@Nullable final String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        final String visible = INVISIBLE_CHARS.matcher(text).replaceAll("");
        return UNICODE_SPACES.matcher(visible).replaceAll(" ");
    }
}
