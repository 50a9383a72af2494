package org.tricoteuses.amendment.compile;

import org.tricoteuses.amendment.tree.DivisionKind;
import org.tricoteuses.amendment.tree.PortionKind;
import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.Objects;
import java.util.Optional;

/**
 * One flattened locate instruction.
 *
 * @param kind       what the step narrows on
 * @param label      division tag, portion noun, "text", "article" or "words"
 * @param identifier marker to match ("II", "1°", "L. 123-4") or quoted words; empty for ordinal selection
 * @param index      signed 1-based index (-1 is the last) when selection is by position
 * @param origin     span of the reference node this step was compiled from
 */
public record NavigationStep(StepKind kind,
                             String label,
                             Optional<String> identifier,
                             Optional<Integer> index,
                             SourceSpan origin) {

    public NavigationStep {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(origin, "origin");
    }

    public static NavigationStep scope(String label, Optional<String> identifier, Optional<Integer> index, SourceSpan origin) {
        return new NavigationStep(StepKind.SCOPE, label, identifier, index, origin);
    }

    public static NavigationStep division(DivisionKind kind, Optional<String> marker, Optional<Integer> index, SourceSpan origin) {
        return new NavigationStep(StepKind.DIVISION, kind.tag(), marker, index, origin);
    }

    public static NavigationStep portion(PortionKind kind, int index, SourceSpan origin) {
        return new NavigationStep(StepKind.PORTION, kind.noun(), Optional.empty(), Optional.of(index), origin);
    }

    public static NavigationStep words(String text, SourceSpan origin) {
        return new NavigationStep(StepKind.WORDS, "words", Optional.of(text), Optional.empty(), origin);
    }

    public Optional<DivisionKind> divisionKind() {
        return kind == StepKind.DIVISION ? DivisionKind.fromTag(label) : Optional.empty();
    }

    public Optional<PortionKind> portionKind() {
        if (kind != StepKind.PORTION) {
            return Optional.empty();
        }
        return label.equals(PortionKind.SENTENCE_UNIT.noun())
               ? Optional.of(PortionKind.SENTENCE_UNIT)
               : Optional.of(PortionKind.PARAGRAPH_UNIT);
    }

    /**
     * Short form for logs and error messages: "item II", "alinéa -1", "words « à taux plein »".
     */
    public String describe() {
        var sb = new StringBuilder(label);
        identifier.ifPresent(id -> sb.append(kind == StepKind.WORDS ? " « " + id + " »" : " " + id));
        if (identifier.isEmpty()) {
            index.ifPresent(i -> sb.append(" #").append(i));
        }
        return sb.toString();
    }
}
