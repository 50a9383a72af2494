package org.tricoteuses.amendment.parser;

/**
 * Parser configuration options.
 *
 * @param caseInsensitive  literals match regardless of letter case
 * @param foldDiacritics   literals match regardless of accents ("remplacee" matches "remplacée")
 * @param skipWhitespace   token parsers skip leading whitespace before matching
 * @param skipLeadingLabel a leading enumeration label of the block ("1°", "a)", "II. –") is skipped
 */
public record ParserConfig(
    boolean caseInsensitive,
    boolean foldDiacritics,
    boolean skipWhitespace,
    boolean skipLeadingLabel
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        true,
        true,
        true
    );
}
