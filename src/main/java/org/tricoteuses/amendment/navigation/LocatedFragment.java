package org.tricoteuses.amendment.navigation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * What a navigation path resolved to: a run of blocks, optionally narrowed to a span inside one of them.
 *
 * @param blocks      blocks of the final scope, in document order
 * @param range       sentence or words span when the last steps narrowed below block level
 * @param description readable trail of the scopes walked through
 */
public record LocatedFragment(List<DocumentBlock> blocks, Optional<TextRange> range, String description) {

    public LocatedFragment {
        blocks = List.copyOf(blocks);
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(description, "description");
    }

    /**
     * Text of the fragment: the range when present, otherwise every block (children included) one per line.
     */
    public String text() {
        if (range.isPresent()) {
            return range.get().text();
        }
        var lines = new ArrayList<String>();
        blocks.forEach(block -> collect(block, lines));
        return String.join("\n", lines);
    }

    public boolean isSingleBlock() {
        return blocks.size() == 1;
    }

    private static void collect(DocumentBlock block, List<String> lines) {
        lines.add(block.text());
        block.children().forEach(child -> collect(child, lines));
    }
}
