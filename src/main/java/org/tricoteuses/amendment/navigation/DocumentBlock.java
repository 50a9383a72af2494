package org.tricoteuses.amendment.navigation;

import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * One block of a structured document: its plain text and its child blocks. Produced by an external
 * markup simplification step; the navigator only reads it.
 */
public interface DocumentBlock {

    String text();

    List<DocumentBlock> children();

    /**
     * Where this block comes from in the original markup, when the producer keeps that mapping.
     */
    default Optional<SourceSpan> markupSpan() {
        return Optional.empty();
    }

    default boolean hasChildren() {
        return !children().isEmpty();
    }
}
