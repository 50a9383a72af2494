package org.tricoteuses.amendment.compile;

/**
 * What a navigation step narrows on.
 */
public enum StepKind {
    /**
     * Text or article: the whole navigated document, no narrowing.
     */
    SCOPE,
    DIVISION,
    PORTION,
    WORDS
}
