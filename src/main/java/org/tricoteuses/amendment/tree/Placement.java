package org.tricoteuses.amendment.tree;

import java.util.Objects;
import java.util.Optional;

/**
 * Where inserted content goes, optionally relative to an anchor ("Après le III, ...").
 */
public record Placement(Position position, Optional<ReferenceNode> anchor) {

    public enum Position {
        BEFORE,
        AFTER,
        BEGINNING,
        END
    }

    public Placement {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(anchor, "anchor");
    }

    public static Placement of(Position position, ReferenceNode anchor) {
        return new Placement(position, Optional.of(anchor));
    }

    public static Placement of(Position position) {
        return new Placement(position, Optional.empty());
    }
}
