package de.mirkosertic.ftsquery;

import de.mirkosertic.ftsquery.tree.Conjunction;

/**
 * Conjunction assumed between two terms when the user typed no operator.
 */
public enum DefaultConjunction {
    AND(Conjunction.AND),
    OR(Conjunction.OR);

    private final Conjunction conjunction;

    DefaultConjunction(final Conjunction conjunction) {
        this.conjunction = conjunction;
    }

    public Conjunction toConjunction() {
        return conjunction;
    }
}
