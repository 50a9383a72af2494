package org.tricoteuses.amendment.extract;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Légifrance article identifiers ("LEGIARTI000006308740") found in links.
 */
public final class ArticleIds {
    private ArticleIds() {}

    private static final Pattern ARTICLE_ID = Pattern.compile("LEGIARTI\\d+");

    public static Optional<String> fromHref(String href) {
        if (href == null) {
            return Optional.empty();
        }
        var matcher = ARTICLE_ID.matcher(href);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }
}
