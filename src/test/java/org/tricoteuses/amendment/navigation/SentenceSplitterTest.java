package org.tricoteuses.amendment.navigation;

import org.junit.jupiter.api.Test;
import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SentenceSplitterTest {

    private static List<String> sentences(String text) {
        return SentenceSplitter.split(text).stream().map(span -> span.extract(text)).toList();
    }

    @Test
    void split_onTerminalPunctuation() {
        assertThat(sentences("Première phrase. Deuxième phrase ! Troisième ?"))
            .containsExactly("Première phrase.", "Deuxième phrase !", "Troisième ?");
    }

    @Test
    void split_skipsLeadingLabel() {
        assertThat(sentences("II. – Première phrase. Deuxième phrase."))
            .containsExactly("Première phrase.", "Deuxième phrase.");
    }

    @Test
    void split_abbreviationBeforeNumber_doesNotEndSentence() {
        assertThat(sentences("Voir l'article L. 123 du code. Fin."))
            .containsExactly("Voir l'article L. 123 du code.", "Fin.");
    }

    @Test
    void split_insideQuotation_doesNotEndSentence() {
        assertThat(sentences("Les mots « foo. Bar » sont insérés. Ensuite."))
            .containsExactly("Les mots « foo. Bar » sont insérés.", "Ensuite.");
    }

    @Test
    void split_withoutTerminal_isSingleSentence() {
        assertThat(sentences("Texte sans point final")).containsExactly("Texte sans point final");
    }

    @Test
    void split_fromOffset_ignoresPrefix() {
        var spans = SentenceSplitter.split("abc. Def.", 5);

        assertThat(spans).containsExactly(SourceSpan.of(5, 9));
    }

    @Test
    void split_blankText_hasNoSentences() {
        assertThat(SentenceSplitter.split("   ")).isEmpty();
    }
}
