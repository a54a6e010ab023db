package de.mirkosertic.ftsquery.tree;

import org.jspecify.annotations.Nullable;

/**
 * Renders an expression tree as SQL Server full-text search condition text.
 *
 * <pre>
 * INFLECTIONAL term   FORMSOF(INFLECTIONAL, term)
 * THESAURUS term      FORMSOF(THESAURUS, term)
 * LITERAL term        "term"
 * excluded term       NOT ...
 * internal node       left CONJUNCTION right, parenthesized when grouped
 * </pre>
 */
public final class ConditionSerializer {

    private ConditionSerializer() {
    }

    /**
     * Renders the given tree.
     *
     * @param node the tree to render, or {@code null}
     * @return the condition text, or an empty string for an absent tree
     */
    public static String render(@Nullable final Node node) {
        if (node == null) {
            return "";
        }
        final StringBuilder builder = new StringBuilder();
        appendNode(builder, node);
        return builder.toString();
    }

    private static void appendNode(final StringBuilder builder, final Node node) {
        if (node instanceof TerminalNode terminalNode) {
            appendTerminal(builder, terminalNode);
        } else if (node instanceof InternalNode internalNode) {
            appendInternal(builder, internalNode);
        } else {
            throw new IllegalStateException("Unexpected node type: " + node.getClass().getName());
        }
    }

    private static void appendTerminal(final StringBuilder builder, final TerminalNode node) {
        if (node.exclude()) {
            builder.append("NOT ");
        }
        switch (node.form()) {
            case INFLECTIONAL -> builder.append("FORMSOF(INFLECTIONAL, ").append(node.term()).append(')');
            case THESAURUS -> builder.append("FORMSOF(THESAURUS, ").append(node.term()).append(')');
            case LITERAL -> builder.append('"').append(node.term()).append('"');
        }
    }

    private static void appendInternal(final StringBuilder builder, final InternalNode node) {
        if (node.grouped()) {
            builder.append('(');
        }
        appendNode(builder, node.left());
        builder.append(' ').append(node.conjunction().keyword()).append(' ');
        appendNode(builder, node.right());
        if (node.grouped()) {
            builder.append(')');
        }
    }
}
