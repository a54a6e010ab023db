package de.mirkosertic.ftsquery.tree;

/**
 * Search mode applied to a single term.
 */
public enum TermForm {

    /**
     * Matches all inflected forms of the term (tenses, plurals, possessives).
     */
    INFLECTIONAL,

    /**
     * Matches thesaurus expansions of the term.
     */
    THESAURUS,

    /**
     * Matches the term exactly, optionally as a prefix when it ends with {@code *}.
     */
    LITERAL
}
