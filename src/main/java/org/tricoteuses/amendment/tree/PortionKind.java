package org.tricoteuses.amendment.tree;

/**
 * Textual sub-units of a division's content.
 */
public enum PortionKind {
    PARAGRAPH_UNIT("alinéa"),
    SENTENCE_UNIT("phrase");

    private final String noun;

    PortionKind(String noun) {
        this.noun = noun;
    }

    public String noun() {
        return noun;
    }
}
