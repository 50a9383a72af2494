package org.tricoteuses.amendment.tree;

import java.util.Objects;

/**
 * A reference clause immediately followed by its action clause.
 */
public record ReferenceAndAction(SourceSpan span, ReferenceNode reference, ActionNode action) implements AmendmentNode {

    public ReferenceAndAction {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(action, "action");
        if (!span.contains(reference.span()) || !span.contains(action.span())) {
            throw new IllegalArgumentException("Span " + span + " does not cover reference and action");
        }
    }

    public static ReferenceAndAction of(ReferenceNode reference, ActionNode action) {
        return new ReferenceAndAction(reference.span().merge(action.span()), reference, action);
    }

    @Override
    public <R> R accept(AmendmentVisitor<R> visitor) {
        return visitor.visitReferenceAndAction(this);
    }
}
