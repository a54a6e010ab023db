package de.mirkosertic.ftsquery.tree;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs the parts of an expression tree that would produce an invalid SQL Server
 * full-text condition.
 *
 * <p>A syntactically well-formed tree may still describe a condition that SQL Server
 * refuses to run. The fixup traverses the tree bottom-up and corrects the problem
 * shapes as follows:</p>
 *
 * <pre>
 * NOT term1 AND term2        operands swapped
 * NOT term1                  expression discarded
 * NOT term1 AND NOT term2    discarded if grouped or root; otherwise kept so that
 *                            the enclosing conjunction can still make it valid
 * term1 OR NOT term2         reduced to NOT term2, then discarded if grouped or root
 * NOT term1 OR term2         reduced to term2
 * term1 NEAR NOT term2       NEAR changed to AND
 * </pre>
 *
 * <h2>NEAR</h2>
 * NEAR is only valid between two literal terminal nodes. Any other operand
 * (a subexpression, an inflectional or thesaurus term) demotes the conjunction to AND.
 *
 * <h2>OR</h2>
 * An operand that is absent or excluded has no valid OR form. Whichever side is
 * invalid, the left operand is dropped and the node collapses to the right one. An
 * excluded right operand therefore survives as a plain exclusion: it is discarded at
 * the root or in a group, and otherwise narrows the enclosing conjunction.
 *
 * <p>The pass is idempotent: applying it to its own output returns an equal tree.</p>
 */
public final class ExpressionTreeFixup {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTreeFixup.class);

    private ExpressionTreeFixup() {
    }

    /**
     * Fixes up a whole tree.
     *
     * @param root the root of the tree, or {@code null}
     * @return the repaired tree, or {@code null} if no valid condition remains
     */
    public static @Nullable Node fixUp(@Nullable final Node root) {
        return fixUp(root, true);
    }

    /**
     * Fixes up the subtree rooted at the given node.
     *
     * @param node   the subtree to repair, or {@code null}
     * @param isRoot whether the node is the root of the whole tree
     * @return the repaired subtree, or {@code null} if it was eliminated
     */
    public static @Nullable Node fixUp(@Nullable final Node node, final boolean isRoot) {
        if (node == null) {
            return null;
        }

        Node result = node;
        if (node instanceof InternalNode internalNode) {
            result = fixUpInternal(internalNode);
            if (result == null) {
                return null;
            }
        }

        // Eliminate expression group if it contains only exclude expressions
        if ((result.grouped() || isRoot) && result.exclude()) {
            logger.debug("Discarding excluded {} expression", isRoot ? "root" : "grouped");
            return null;
        }
        return result;
    }

    private static @Nullable Node fixUpInternal(final InternalNode node) {
        Node left = fixUp(node.left(), false);
        Node right = fixUp(node.right(), false);
        Conjunction conjunction = node.conjunction();

        if (conjunction == Conjunction.NEAR) {
            if (isInvalidWithNear(left) || isInvalidWithNear(right)) {
                logger.debug("Demoting NEAR to AND");
                conjunction = Conjunction.AND;
            }
        } else if (conjunction == Conjunction.OR) {
            if (isInvalidWithOr(left) || isInvalidWithOr(right)) {
                logger.debug("Dropping left operand of disjunction with invalid operand");
                left = null;
            }
        }

        if (left == null && right == null) {
            return null;
        }
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }

        final boolean exclude = left.exclude() && right.exclude();
        // An excluded operand must never lead
        if (!exclude && left.exclude()) {
            final Node temp = left;
            left = right;
            right = temp;
        }
        return new InternalNode(left, right, conjunction, exclude, node.grouped());
    }

    /**
     * Determines if the given node is invalid on either side of a NEAR conjunction.
     * Only literal terminal nodes are allowed.
     *
     * @param node the operand to test
     * @return {@code true} if the operand cannot be used with NEAR
     */
    static boolean isInvalidWithNear(@Nullable final Node node) {
        return !(node instanceof TerminalNode terminalNode) || terminalNode.form() != TermForm.LITERAL;
    }

    /**
     * Determines if the given node is invalid on either side of an OR conjunction.
     *
     * @param node the operand to test
     * @return {@code true} if the operand is absent or excluded
     */
    static boolean isInvalidWithOr(@Nullable final Node node) {
        return node == null || node.exclude();
    }
}
