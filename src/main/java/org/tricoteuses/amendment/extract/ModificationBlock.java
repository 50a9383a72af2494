package org.tricoteuses.amendment.extract;

import org.tricoteuses.amendment.error.ParseError;

import java.util.Objects;
import java.util.Optional;

/**
 * Extraction result for one source block: exactly one of {@code parsed} and {@code error} is present.
 */
public record ModificationBlock(String id,
                                Optional<String> articleId,
                                String articleTitle,
                                String rawText,
                                Optional<ParsedModification> parsed,
                                Optional<ParseError> error) {

    public ModificationBlock {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(articleId, "articleId");
        Objects.requireNonNull(articleTitle, "articleTitle");
        Objects.requireNonNull(rawText, "rawText");
        Objects.requireNonNull(parsed, "parsed");
        Objects.requireNonNull(error, "error");
        if (parsed.isPresent() == error.isPresent()) {
            throw new IllegalArgumentException("Block " + id + " must be either parsed or unparsed");
        }
    }

    public static ModificationBlock parsed(SourceBlock source, ParsedModification modification) {
        return new ModificationBlock(source.id(), source.articleId(), source.articleTitle(), source.rawText(),
                                     Optional.of(modification), Optional.empty());
    }

    public static ModificationBlock unparsed(SourceBlock source, ParseError error) {
        return new ModificationBlock(source.id(), source.articleId(), source.articleTitle(), source.rawText(),
                                     Optional.empty(), Optional.of(error));
    }

    public boolean isParsed() {
        return parsed.isPresent();
    }
}
