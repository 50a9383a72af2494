package org.tricoteuses.amendment.tree;

/**
 * Top-level result of parsing an amendment sentence.
 *
 * <p>Nodes are immutable and created fresh for every parse.
 */
public sealed interface AmendmentNode permits ReferenceNode, ActionNode, ReferenceAndAction {

    /**
     * The source span this node was parsed from.
     */
    SourceSpan span();

    <R> R accept(AmendmentVisitor<R> visitor);
}
