package org.tricoteuses.amendment.tree;

import java.util.Objects;

/**
 * A quoted span of replacement or insertion text.
 *
 * @param span source span including the opening and closing delimiters
 * @param text the quoted content, delimiters and surrounding blanks removed
 */
public record CitationNode(SourceSpan span, String text) {

    public CitationNode {
        Objects.requireNonNull(span, "span");
        Objects.requireNonNull(text, "text");
    }
}
