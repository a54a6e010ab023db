package de.mirkosertic.ftsquery.parser;

import org.jspecify.annotations.Nullable;

import java.util.function.IntPredicate;

/**
 * Positional view over a string being parsed.
 *
 * <p>All operations are total: reading past the end returns {@link #NULL_CHAR} and
 * moving past the end clamps the position to the text length.</p>
 */
public final class TextCursor {

    /**
     * Returned when a character beyond the end of the text is requested.
     */
    public static final char NULL_CHAR = '\0';

    private final String text;
    private int index;

    /**
     * Creates a cursor positioned at the start of the given text.
     *
     * @param text the text to parse, {@code null} is treated as empty
     */
    public TextCursor(@Nullable final String text) {
        this.text = text == null ? "" : text;
        this.index = 0;
    }

    public String getText() {
        return text;
    }

    public int getIndex() {
        return index;
    }

    public boolean isEndOfText() {
        return index >= text.length();
    }

    /**
     * Returns the character at the current position, or {@link #NULL_CHAR} at the end of the text.
     */
    public char peek() {
        return peek(0);
    }

    /**
     * Returns the character the given number of positions beyond the current one,
     * or {@link #NULL_CHAR} if that position is outside the text.
     *
     * @param ahead the number of characters to look ahead
     * @return the character at the requested position
     */
    public char peek(final int ahead) {
        final int pos = index + ahead;
        return pos >= 0 && pos < text.length() ? text.charAt(pos) : NULL_CHAR;
    }

    public void advance() {
        advance(1);
    }

    /**
     * Moves the position ahead, never past the end of the text.
     *
     * @param ahead the number of characters to move
     */
    public void advance(final int ahead) {
        if (ahead > 0) {
            index += Math.min(text.length() - index, ahead);
        }
    }

    public void skipWhitespace() {
        skipWhile(Character::isWhitespace);
    }

    /**
     * Moves ahead while the predicate accepts the current character.
     *
     * @param predicate returns true for characters that should be skipped
     */
    public void skipWhile(final IntPredicate predicate) {
        while (!isEndOfText() && predicate.test(peek())) {
            advance();
        }
    }

    /**
     * Moves ahead while the predicate accepts the current character and returns
     * the characters that were skipped.
     *
     * @param predicate returns true for characters that should be consumed
     * @return the consumed span, possibly empty
     */
    public String parseWhile(final IntPredicate predicate) {
        final int start = index;
        skipWhile(predicate);
        return extract(start, index);
    }

    /**
     * Extracts a substring of the text, clamped to valid bounds.
     *
     * @param start position of the first character
     * @param end   position after the last character
     * @return the extracted text
     */
    public String extract(final int start, final int end) {
        final int from = Math.max(0, Math.min(start, text.length()));
        final int to = Math.max(from, Math.min(end, text.length()));
        return text.substring(from, to);
    }
}
