package de.mirkosertic.ftsquery.tree;

import java.util.Objects;

/**
 * Non-leaf node joining two subtrees with a conjunction.
 *
 * <p>Both children are mandatory. The fixup pass expresses an eliminated child by
 * collapsing or dropping the internal node, so a half-built node cannot exist.</p>
 *
 * @param left        the left operand
 * @param right       the right operand
 * @param conjunction the combinator joining both operands
 * @param exclude     whether both operands are excluded (computed during fixup)
 * @param grouped     whether the subtree was wrapped in parentheses
 */
public record InternalNode(Node left, Node right, Conjunction conjunction, boolean exclude, boolean grouped)
        implements Node {

    public InternalNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(conjunction, "conjunction");
    }

    public InternalNode(final Node left, final Node right, final Conjunction conjunction) {
        this(left, right, conjunction, false, false);
    }

    @Override
    public InternalNode withGrouped(final boolean grouped) {
        if (grouped == this.grouped) {
            return this;
        }
        return new InternalNode(left, right, conjunction, exclude, grouped);
    }
}
