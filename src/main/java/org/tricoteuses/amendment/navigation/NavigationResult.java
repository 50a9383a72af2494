package org.tricoteuses.amendment.navigation;

import org.tricoteuses.amendment.error.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link DocumentNavigator#locate}.
 */
public sealed interface NavigationResult {

    boolean isLocated();

    Optional<LocatedFragment> fragment();

    Optional<NavigationError> error();

    /**
     * @param warnings carried over from the path (partial resolution of enumerations and intervals)
     */
    record Located(LocatedFragment located, List<Diagnostic> warnings) implements NavigationResult {
        public Located {
            warnings = List.copyOf(warnings);
        }

        @Override
        public boolean isLocated() {
            return true;
        }

        @Override
        public Optional<LocatedFragment> fragment() {
            return Optional.of(located);
        }

        @Override
        public Optional<NavigationError> error() {
            return Optional.empty();
        }
    }

    record Failed(NavigationError cause) implements NavigationResult {
        @Override
        public boolean isLocated() {
            return false;
        }

        @Override
        public Optional<LocatedFragment> fragment() {
            return Optional.empty();
        }

        @Override
        public Optional<NavigationError> error() {
            return Optional.of(cause);
        }
    }
}
