package org.tricoteuses.amendment.navigation;

import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.Objects;

/**
 * A span inside the text of one block: a sentence or quoted words.
 */
public record TextRange(DocumentBlock block, SourceSpan span) {

    public TextRange {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(span, "span");
        if (span.stop() > block.text().length()) {
            throw new IllegalArgumentException("Span " + span + " exceeds block text of length " + block.text().length());
        }
    }

    public String text() {
        return span.extract(block.text());
    }
}
