package org.tricoteuses.amendment.compile;

import org.tricoteuses.amendment.error.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered steps, coarse to fine. Warnings report shapes compiled only in part.
 */
public record NavigationPath(List<NavigationStep> steps, List<Diagnostic> warnings) {

    public NavigationPath {
        steps = List.copyOf(steps);
        warnings = List.copyOf(warnings);
    }

    public static NavigationPath of(List<NavigationStep> steps) {
        return new NavigationPath(steps, List.of());
    }

    /**
     * Whether only part of the reference was compiled (enumerations and intervals keep their first member).
     */
    public boolean isPartial() {
        return !warnings.isEmpty();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public int size() {
        return steps.size();
    }

    public String describe() {
        return steps.stream()
                    .map(NavigationStep::describe)
                    .collect(Collectors.joining(" > "));
    }
}
