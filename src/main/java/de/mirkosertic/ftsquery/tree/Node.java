package de.mirkosertic.ftsquery.tree;

/**
 * Node of a parsed search expression tree.
 *
 * <p>The hierarchy is closed: a node is either a {@link TerminalNode} holding a single
 * term or an {@link InternalNode} joining two subtrees. An absent tree (no valid
 * condition) is represented by {@code null}.</p>
 */
public sealed interface Node permits TerminalNode, InternalNode {

    /**
     * Whether this subtree is negated. For an internal node this is only meaningful
     * after fixup, where it means that both children are excluded.
     */
    boolean exclude();

    /**
     * Whether the user wrapped this subtree in parentheses.
     */
    boolean grouped();

    /**
     * Returns a copy of this node carrying the given grouping flag.
     *
     * @param grouped the new grouping flag
     * @return this node if the flag is unchanged, otherwise a copy
     */
    Node withGrouped(boolean grouped);
}
