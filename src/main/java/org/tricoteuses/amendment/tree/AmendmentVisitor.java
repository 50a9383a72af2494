package org.tricoteuses.amendment.tree;

/**
 * Exhaustive visitor over every {@link AmendmentNode}.
 */
public interface AmendmentVisitor<R> extends ReferenceVisitor<R> {

    R visitAction(ActionNode action);

    R visitReferenceAndAction(ReferenceAndAction referenceAndAction);
}
