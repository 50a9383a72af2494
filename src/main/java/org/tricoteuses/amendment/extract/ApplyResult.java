package org.tricoteuses.amendment.extract;

import org.tricoteuses.amendment.error.Diagnostic;
import org.tricoteuses.amendment.navigation.LocatedFragment;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link ModificationApplier#apply}.
 */
public sealed interface ApplyResult {

    boolean isApplied();

    /**
     * @param oldText  text of the affected fragment before the modification
     * @param newText  the same fragment after it, empty for a deletion of whole blocks
     * @param fragment where the modification landed
     * @param warnings carried over from navigation
     */
    record Applied(String oldText, String newText, LocatedFragment fragment, List<Diagnostic> warnings)
        implements ApplyResult {
        public Applied {
            Objects.requireNonNull(oldText, "oldText");
            Objects.requireNonNull(newText, "newText");
            Objects.requireNonNull(fragment, "fragment");
            warnings = List.copyOf(warnings);
        }

        @Override
        public boolean isApplied() {
            return true;
        }

        public String render(DiffRenderer renderer) {
            return renderer.render(oldText, newText);
        }
    }

    record Failed(String reason) implements ApplyResult {
        public Failed {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isApplied() {
            return false;
        }
    }
}
