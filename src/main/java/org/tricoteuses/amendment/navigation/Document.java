package org.tricoteuses.amendment.navigation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered top-level blocks of the addressed article.
 */
public record Document(List<DocumentBlock> blocks) {

    public Document {
        blocks = List.copyOf(blocks);
    }

    public static Document of(DocumentBlock... blocks) {
        return new Document(Arrays.asList(blocks));
    }

    /**
     * One flat block per non-blank line.
     */
    public static Document ofLines(String text) {
        var blocks = new ArrayList<DocumentBlock>();
        for (var line : text.split("\\R")) {
            if (!line.isBlank()) {
                blocks.add(TextBlock.of(line.strip()));
            }
        }
        return new Document(blocks);
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }
}
