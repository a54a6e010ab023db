package de.mirkosertic.ftsquery.tree;

/**
 * Combinator joining two subexpressions of a full-text condition.
 */
public enum Conjunction {
    AND("AND"),
    OR("OR"),
    NEAR("NEAR");

    private final String keyword;

    Conjunction(final String keyword) {
        this.keyword = keyword;
    }

    /**
     * Returns the upper-case keyword used in the serialized condition.
     */
    public String keyword() {
        return keyword;
    }
}
