package org.tricoteuses.amendment.navigation;

import org.tricoteuses.amendment.compile.NavigationStep;

/**
 * A step that found nothing in its scope. Navigation stops there; it never falls back to a wider scope.
 *
 * @param stepIndex        0-based index of the failing step in the path
 * @param step             the failing step
 * @param scopeDescription the scope the step was evaluated against
 * @param reason           what did not match ("no block starts with marker 'IV'")
 */
public record NavigationError(int stepIndex, NavigationStep step, String scopeDescription, String reason) {

    public String message() {
        return "Step " + (stepIndex + 1) + " (" + step.describe() + ") failed in " + scopeDescription + ": " + reason;
    }
}
