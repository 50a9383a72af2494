package org.tricoteuses.amendment.extract;

import org.tricoteuses.amendment.compile.NavigationPath;
import org.tricoteuses.amendment.tree.ActionNode;
import org.tricoteuses.amendment.tree.AmendmentNode;
import org.tricoteuses.amendment.tree.ReferenceNode;

import java.util.Objects;
import java.util.Optional;

/**
 * A block that parsed into an amendment with an action.
 *
 * @param node       the parse result as produced by the grammar
 * @param action     the amendment action
 * @param reference  the addressed reference, empty when the target is implicit
 * @param targetPath compiled path of the target (the reference, or the placement anchor of an action alone)
 * @param remaining  input left after the parsed sentence
 */
public record ParsedModification(AmendmentNode node,
                                 ActionNode action,
                                 Optional<ReferenceNode> reference,
                                 Optional<NavigationPath> targetPath,
                                 String remaining) {

    public ParsedModification {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(targetPath, "targetPath");
        Objects.requireNonNull(remaining, "remaining");
    }

    public boolean isComplete() {
        return remaining.isBlank();
    }
}
