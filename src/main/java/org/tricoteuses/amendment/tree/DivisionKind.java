package org.tricoteuses.amendment.tree;

import java.util.Arrays;
import java.util.Optional;

/**
 * Structural subdivisions of a legal text. {@link #ITEM} is a bare marker ("II", "A", "1°", "a)").
 */
public enum DivisionKind {
    ITEM("item", ""),
    PART("part", "partie"),
    BOOK("book", "livre"),
    TITLE("title", "titre"),
    SUBTITLE("subtitle", "sous-titre"),
    CHAPTER("chapter", "chapitre"),
    SECTION("section", "section"),
    SUBSECTION("subsection", "sous-section"),
    PARAGRAPH("paragraph", "paragraphe"),
    SUBPARAGRAPH("sub-paragraph", "sous-paragraphe"),
    SUBSUBPARAGRAPH("sub-sub-paragraph", "sous-sous-paragraphe");

    private final String tag;
    private final String noun;

    DivisionKind(String tag, String noun) {
        this.tag = tag;
        this.noun = noun;
    }

    public String tag() {
        return tag;
    }

    /**
     * French noun introducing the division, empty for {@link #ITEM}.
     */
    public String noun() {
        return noun;
    }

    public static Optional<DivisionKind> fromTag(String tag) {
        return Arrays.stream(values())
                     .filter(kind -> kind.tag.equals(tag))
                     .findFirst();
    }

    public static Optional<DivisionKind> fromNoun(String noun) {
        return Arrays.stream(values())
                     .filter(kind -> !kind.noun.isEmpty() && kind.noun.equalsIgnoreCase(noun))
                     .findFirst();
    }
}
