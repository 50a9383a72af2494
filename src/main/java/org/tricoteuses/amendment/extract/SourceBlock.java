package org.tricoteuses.amendment.extract;

import java.util.Objects;
import java.util.Optional;

/**
 * One amendment paragraph scraped from a bill, with its provenance.
 *
 * @param id           stable id of the block in its source page
 * @param href         link to the amended article, may be empty
 * @param articleTitle title of the amended article as displayed
 * @param rawText      the amendment sentence
 */
public record SourceBlock(String id, String href, String articleTitle, String rawText) {

    public SourceBlock {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(href, "href");
        Objects.requireNonNull(articleTitle, "articleTitle");
        Objects.requireNonNull(rawText, "rawText");
    }

    public static SourceBlock of(String id, String rawText) {
        return new SourceBlock(id, "", "", rawText);
    }

    public Optional<String> articleId() {
        return ArticleIds.fromHref(href);
    }
}
