package org.tricoteuses.amendment.navigation;

import org.junit.jupiter.api.Test;
import org.tricoteuses.amendment.AmendmentParser;
import org.tricoteuses.amendment.compile.NavigationPath;
import org.tricoteuses.amendment.compile.PathCompiler;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentNavigatorTest {

    private static final AmendmentParser PARSER = AmendmentParser.create();
    private static final PathCompiler COMPILER = PathCompiler.create();
    private static final DocumentNavigator NAVIGATOR = DocumentNavigator.create();

    private static final Document FLAT = Document.of(
        TextBlock.of("I.- Le taux est fixé par décret."),
        TextBlock.of("Il est révisé chaque année."),
        TextBlock.of("II.- Première phrase du II. Seconde phrase du II."),
        TextBlock.of("Dernier alinéa du II, avec le mot taux."),
        TextBlock.of("III.- Disposition finale."));

    private static NavigationPath path(String reference) {
        return COMPILER.compile(PARSER.parseReference(reference).unwrap());
    }

    private static String locatedText(Document document, String reference) {
        var result = NAVIGATOR.locate(document, path(reference));
        assertThat(result.isLocated()).as("locate '%s': %s", reference, result.error()).isTrue();
        return result.fragment().orElseThrow().text();
    }

    // === Divisions ===

    @Test
    void locate_lastParagraphOfDivision_staysWithinDivision() {
        assertThat(locatedText(FLAT, "du dernier alinéa du II")).isEqualTo("Dernier alinéa du II, avec le mot taux.");
    }

    @Test
    void locate_firstParagraphOfDivision_isTheMarkedBlock() {
        assertThat(locatedText(FLAT, "le premier alinéa du II"))
            .isEqualTo("II.- Première phrase du II. Seconde phrase du II.");
    }

    @Test
    void locate_division_spansUntilNextSameFamilyMarker() {
        var fragment = NAVIGATOR.locate(FLAT, path("le I")).fragment().orElseThrow();

        assertThat(fragment.blocks()).hasSize(2);
        assertThat(fragment.range()).isEmpty();
    }

    @Test
    void locate_missingMarker_failsNamingIt() {
        var result = NAVIGATOR.locate(FLAT, path("du dernier alinéa du IV"));

        assertThat(result.isLocated()).isFalse();
        var error = result.error().orElseThrow();
        assertThat(error.stepIndex()).isZero();
        assertThat(error.reason()).contains("'IV'");
        assertThat(error.message()).contains("item IV");
    }

    @Test
    void locate_labelsGluedToText_stillCloseDivisions() {
        var document = Document.of(
            TextBlock.of("I.-Le taux est fixé."),
            TextBlock.of("Texte du I."),
            TextBlock.of("II.-Le second point."),
            TextBlock.of("Dernier du II."),
            TextBlock.of("III.-Autre."));

        assertThat(locatedText(document, "du dernier alinéa du II")).isEqualTo("Dernier du II.");
        assertThat(locatedText(document, "le I")).isEqualTo("I.-Le taux est fixé.\nTexte du I.");
        assertThat(locatedText(document, "la première phrase du II")).isEqualTo("Le second point.");
    }

    @Test
    void locate_nestedBlocks_narrowToChildren() {
        var document = Document.of(
            TextBlock.of("I.- Dispositions :",
                         TextBlock.of("1° Premier point ;"),
                         TextBlock.of("2° Second point.")),
            TextBlock.of("II.- Autre division."));

        assertThat(locatedText(document, "le 2° du I")).isEqualTo("2° Second point.");
    }

    @Test
    void locate_indexedTypedDivision_countsMarkedBlocksOfThatKind() {
        var document = Document.of(
            TextBlock.of("Section 1 Dispositions générales"),
            TextBlock.of("Texte de la section 1."),
            TextBlock.of("Section 2 Dispositions diverses"),
            TextBlock.of("Texte de la section 2."));

        assertThat(locatedText(document, "la deuxième section"))
            .isEqualTo("Section 2 Dispositions diverses\nTexte de la section 2.");
    }

    // === Portions and words ===

    @Test
    void locate_sentence_returnsRangeInsideBlock() {
        var fragment = NAVIGATOR.locate(FLAT, path("la seconde phrase du premier alinéa du II")).fragment().orElseThrow();

        assertThat(fragment.range()).isPresent();
        assertThat(fragment.text()).isEqualTo("Seconde phrase du II.");
        assertThat(fragment.isSingleBlock()).isTrue();
    }

    @Test
    void locate_words_searchedWithinScope() {
        var fragment = NAVIGATOR.locate(FLAT, path("le mot « taux » du dernier alinéa du II")).fragment().orElseThrow();

        assertThat(fragment.text()).isEqualTo("taux");
        assertThat(fragment.range().orElseThrow().block().text()).startsWith("Dernier alinéa du II");
    }

    @Test
    void locate_wordsAbsentFromScope_fails() {
        var result = NAVIGATOR.locate(FLAT, path("les mots « inconnus » du II"));

        assertThat(result.error()).hasValueSatisfying(error -> assertThat(error.reason()).contains("inconnus"));
    }

    @Test
    void locate_ordinalBeyondScope_fails() {
        var result = NAVIGATOR.locate(FLAT, path("le cinquième alinéa du II"));

        assertThat(result.error()).hasValueSatisfying(error -> {
            assertThat(error.stepIndex()).isEqualTo(1);
            assertThat(error.reason()).contains("out of range");
        });
    }

    // === Paths ===

    @Test
    void locate_partialPath_carriesWarnings() {
        var result = NAVIGATOR.locate(FLAT, path("le I et le II"));

        assertThat(result).isInstanceOfSatisfying(NavigationResult.Located.class,
                                                  located -> assertThat(located.warnings()).hasSize(1));
    }

    @Test
    void locate_scopeSteps_leaveBlocksUnchanged() {
        assertThat(locatedText(FLAT, "du dernier alinéa du II de l'article 3"))
            .isEqualTo("Dernier alinéa du II, avec le mot taux.");
    }

    @Test
    void locate_sameInput_sameResult() {
        var reference = path("la seconde phrase du premier alinéa du II");

        assertThat(NAVIGATOR.locate(FLAT, reference)).isEqualTo(NAVIGATOR.locate(FLAT, reference));
    }

    @Test
    void resolve_signedIndexes() {
        assertThat(DocumentNavigator.resolve(1, 4)).contains(0);
        assertThat(DocumentNavigator.resolve(-1, 4)).contains(3);
        assertThat(DocumentNavigator.resolve(-4, 4)).contains(0);
        assertThat(DocumentNavigator.resolve(0, 4)).isEmpty();
        assertThat(DocumentNavigator.resolve(5, 4)).isEmpty();
        assertThat(DocumentNavigator.resolve(-5, 4)).isEmpty();
    }

    @Test
    void ofLines_buildsOneBlockPerNonBlankLine() {
        var document = Document.ofLines("I.- a\n\n  b  \nII.- c");

        assertThat(document.blocks()).extracting(DocumentBlock::text).containsExactly("I.- a", "b", "II.- c");
    }
}
