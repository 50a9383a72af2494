package org.tricoteuses.amendment.navigation;

import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Plain {@link DocumentBlock}.
 */
public record TextBlock(String text, List<DocumentBlock> children, Optional<SourceSpan> markupSpan)
    implements DocumentBlock {

    public TextBlock {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(markupSpan, "markupSpan");
        children = List.copyOf(children);
    }

    public static TextBlock of(String text) {
        return new TextBlock(text, List.of(), Optional.empty());
    }

    public static TextBlock of(String text, DocumentBlock... children) {
        return new TextBlock(text, Arrays.asList(children), Optional.empty());
    }
}
