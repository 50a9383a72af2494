package org.tricoteuses.amendment.tree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Classified amendment verb with its quoted content.
 *
 * @param span               source span from the placement clause (if any) to the last consumed token
 * @param kind               what the amendment does
 * @param citations          quoted replacement or insertion content, possibly empty
 * @param placement          where created content goes, when the sentence says so
 * @param rewritesWholeTarget "est ainsi rédigé": the citation replaces the whole target node
 */
public record ActionNode(SourceSpan span,
                         ActionKind kind,
                         List<CitationNode> citations,
                         Optional<Placement> placement,
                         boolean rewritesWholeTarget) implements AmendmentNode {

    public ActionNode {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(placement, "placement");
        citations = List.copyOf(citations);
    }

    public boolean hasCitations() {
        return !citations.isEmpty();
    }

    /**
     * Copy with a placement clause parsed outside the action itself, widening the span to cover it.
     */
    public ActionNode withPlacement(Placement newPlacement, SourceSpan placementSpan) {
        return new ActionNode(span.merge(placementSpan), kind, citations, Optional.of(newPlacement), rewritesWholeTarget);
    }

    @Override
    public <R> R accept(AmendmentVisitor<R> visitor) {
        return visitor.visitAction(this);
    }
}
