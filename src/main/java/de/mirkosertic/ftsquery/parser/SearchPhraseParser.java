package de.mirkosertic.ftsquery.parser;

import de.mirkosertic.ftsquery.FtsQuerySettings;
import de.mirkosertic.ftsquery.tree.Conjunction;
import de.mirkosertic.ftsquery.tree.InternalNode;
import de.mirkosertic.ftsquery.tree.Node;
import de.mirkosertic.ftsquery.tree.TermForm;
import de.mirkosertic.ftsquery.tree.TerminalNode;
import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Tolerant recursive-descent parser turning a Google-style search phrase into an
 * expression tree.
 *
 * <p>The parser never fails. Unknown punctuation separates terms, unterminated quotes
 * and blocks extend to the end of the text, and terms that cannot contribute to the
 * condition (empty or stop words) are skipped.</p>
 *
 * <h2>Syntax</h2>
 * <pre>
 * abc                     inflectional forms of abc
 * ~abc                    thesaurus variations of abc
 * "abc" or 'abc'          exact term abc
 * +abc                    exact term abc
 * abc*                    words starting with abc
 * -abc, NOT abc           exclude abc
 * abc OR def              either term
 * abc AND def, abc def    both terms
 * "abc" NEAR "def"        abc near def
 * &lt;+abc +def&gt;             abc near def
 * abc and (def or ghi)    parenthesized group
 * </pre>
 *
 * <p>Terms are folded left to right: each new term becomes the right child of a new
 * internal node whose left child is everything parsed so far. The result is not yet
 * valid SQL Server syntax; see {@link de.mirkosertic.ftsquery.tree.ExpressionTreeFixup}.</p>
 */
public class SearchPhraseParser {

    private final String punctuation;
    private final boolean useInflectionalSearch;
    private final boolean useTrailingWildcardForAllWords;
    private final boolean treatNearAsOperator;
    private final Predicate<CharSequence> stopWordFilter;

    /**
     * Creates a parser for the given settings.
     *
     * @param settings       the settings controlling punctuation and term forms
     * @param stopWordFilter returns true for terms that must be dropped
     */
    public SearchPhraseParser(final FtsQuerySettings settings, final Predicate<CharSequence> stopWordFilter) {
        Objects.requireNonNull(settings, "settings");
        this.punctuation = settings.getPunctuation();
        this.useInflectionalSearch = settings.isUseInflectionalSearch();
        this.useTrailingWildcardForAllWords = settings.isUseTrailingWildcardForAllWords();
        this.treatNearAsOperator = settings.isTreatNearAsOperator();
        this.stopWordFilter = Objects.requireNonNull(stopWordFilter, "stopWordFilter");
    }

    /**
     * Parses a query segment into an expression tree.
     *
     * @param query              the text to parse, may be {@code null}
     * @param defaultConjunction the conjunction used between terms without an explicit operator
     * @return the root of the tree, or {@code null} if no term was found
     */
    public @Nullable Node parse(@Nullable final String query, final Conjunction defaultConjunction) {
        final TextCursor cursor = new TextCursor(query);

        Conjunction conjunction = defaultConjunction;
        TermForm termForm = defaultTermForm();
        boolean termExclude = false;
        boolean resetState = true;
        Node root = null;

        while (!cursor.isEndOfText()) {
            if (resetState) {
                conjunction = defaultConjunction;
                termForm = defaultTermForm();
                termExclude = false;
                resetState = false;
            }

            cursor.skipWhitespace();
            if (cursor.isEndOfText()) {
                break;
            }

            final char ch = cursor.peek();
            if (isPunctuation(ch)) {
                switch (ch) {
                    case '"', '\'' -> {
                        termForm = TermForm.LITERAL;
                        cursor.advance();
                        final String quoted = cursor.parseWhile(c -> c != ch);
                        root = addTerm(root, quoted, termForm, termExclude, conjunction);
                        resetState = true;
                    }
                    case '(' -> {
                        final String block = extractBlock(cursor, '(', ')');
                        root = addNode(root, parse(block, defaultConjunction), conjunction, true);
                        resetState = true;
                    }
                    case '<' -> {
                        final String block = extractBlock(cursor, '<', '>');
                        root = addNode(root, parse(block, Conjunction.NEAR), conjunction, false);
                        resetState = true;
                    }
                    case '-' -> termExclude = true;
                    case '+' -> termForm = TermForm.LITERAL;
                    case '~' -> termForm = TermForm.THESAURUS;
                    default -> {
                        // Other punctuation only separates terms
                    }
                }
                cursor.advance();
                continue;
            }

            String term = cursor.parseWhile(c -> !isPunctuation((char) c) && !Character.isWhitespace(c));

            // Allow trailing wildcard
            if (cursor.peek() == '*') {
                cursor.advance();
                root = addTerm(root, term + '*', TermForm.LITERAL, termExclude, conjunction);
                resetState = true;
                continue;
            }

            if (term.equalsIgnoreCase("AND")) {
                conjunction = Conjunction.AND;
            } else if (term.equalsIgnoreCase("OR")) {
                conjunction = Conjunction.OR;
            } else if (treatNearAsOperator && term.equalsIgnoreCase("NEAR")) {
                conjunction = Conjunction.NEAR;
            } else if (term.equalsIgnoreCase("NOT")) {
                termExclude = true;
            } else if (useTrailingWildcardForAllWords) {
                term += '*';
                root = addTerm(root, term, TermForm.LITERAL, termExclude, conjunction);
                resetState = true;
            } else {
                root = addTerm(root, term, termForm, termExclude, conjunction);
                resetState = true;
            }
        }
        return root;
    }

    private TermForm defaultTermForm() {
        return useInflectionalSearch ? TermForm.INFLECTIONAL : TermForm.LITERAL;
    }

    private boolean isPunctuation(final char ch) {
        return ch != TextCursor.NULL_CHAR && punctuation.indexOf(ch) >= 0;
    }

    /**
     * Creates a terminal node for the term and adds it to the tree. Empty terms and
     * stop words leave the tree unchanged.
     */
    private @Nullable Node addTerm(@Nullable final Node root, final String term, final TermForm termForm,
                                   final boolean termExclude, final Conjunction conjunction) {
        // strip() removes the same whitespace TerminalNode rejects as blank
        final String stripped = term.strip();
        if (stripped.isEmpty() || stopWordFilter.test(stripped)) {
            return root;
        }
        return addNode(root, new TerminalNode(stripped, termForm, termExclude), conjunction, false);
    }

    /**
     * Adds a node to the tree, joining it to the current root with the given conjunction.
     *
     * @param root        the current root, or {@code null}
     * @param node        the node to add, or {@code null} to leave the tree unchanged
     * @param conjunction the conjunction joining the node to the current tree
     * @param group       whether the node came from a parenthesized block
     * @return the new root
     */
    static @Nullable Node addNode(@Nullable final Node root, @Nullable final Node node,
                                  final Conjunction conjunction, final boolean group) {
        if (node == null) {
            return root;
        }
        final Node added = node.withGrouped(group);
        if (root == null) {
            return added;
        }
        return new InternalNode(root, added, conjunction);
    }

    /**
     * Extracts a block of text delimited by the given open and close characters. The
     * cursor must be positioned at the open character. Delimiters inside quoted text are
     * not counted. On return the cursor is positioned at the matching close character,
     * or at the end of the text if there is none.
     *
     * @param cursor    the cursor positioned at the open delimiter
     * @param openChar  start-of-block delimiter
     * @param closeChar end-of-block delimiter
     * @return the text between the delimiters
     */
    static String extractBlock(final TextCursor cursor, final char openChar, final char closeChar) {
        int depth = 1;

        cursor.advance();
        final int start = cursor.getIndex();
        while (!cursor.isEndOfText()) {
            final char ch = cursor.peek();
            if (ch == openChar) {
                depth++;
            } else if (ch == closeChar) {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (ch == '"' || ch == '\'') {
                cursor.advance();
                cursor.skipWhile(c -> c != ch);
            }
            cursor.advance();
        }
        return cursor.extract(start, cursor.getIndex());
    }
}
