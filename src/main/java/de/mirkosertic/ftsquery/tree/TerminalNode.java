package de.mirkosertic.ftsquery.tree;

import java.util.Objects;

/**
 * Leaf node holding a single word or quoted phrase.
 *
 * @param term    the literal term text, never blank
 * @param form    the search mode for the term
 * @param exclude whether the term is negated
 * @param grouped whether the term was wrapped in parentheses
 */
public record TerminalNode(String term, TermForm form, boolean exclude, boolean grouped) implements Node {

    public TerminalNode {
        Objects.requireNonNull(term, "term");
        Objects.requireNonNull(form, "form");
        if (term.isBlank()) {
            throw new IllegalArgumentException("term must not be blank");
        }
    }

    public TerminalNode(final String term, final TermForm form, final boolean exclude) {
        this(term, form, exclude, false);
    }

    @Override
    public TerminalNode withGrouped(final boolean grouped) {
        if (grouped == this.grouped) {
            return this;
        }
        return new TerminalNode(term, form, exclude, grouped);
    }
}
