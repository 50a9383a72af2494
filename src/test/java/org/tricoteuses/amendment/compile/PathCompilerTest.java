package org.tricoteuses.amendment.compile;

import org.junit.jupiter.api.Test;
import org.tricoteuses.amendment.AmendmentParser;
import org.tricoteuses.amendment.error.Diagnostic;
import org.tricoteuses.amendment.tree.DivisionKind;
import org.tricoteuses.amendment.tree.PortionKind;
import org.tricoteuses.amendment.tree.ReferenceNode;

import static org.assertj.core.api.Assertions.assertThat;

class PathCompilerTest {

    private static final AmendmentParser PARSER = AmendmentParser.create();
    private static final PathCompiler COMPILER = PathCompiler.create();

    private static ReferenceNode reference(String input) {
        return PARSER.parseReference(input).unwrap();
    }

    // === Flattening ===

    @Test
    void compile_chain_ordersStepsCoarseToFine() {
        var path = COMPILER.compile(reference("du dernier alinéa du II de l'article 224 du code général des impôts"));

        assertThat(path.steps()).extracting(NavigationStep::kind)
                                .containsExactly(StepKind.SCOPE, StepKind.SCOPE, StepKind.DIVISION, StepKind.PORTION);
        assertThat(path.describe()).isEqualTo("text LEGITEXT000006069577 > article 224 > item II > alinéa #-1");
        assertThat(path.isPartial()).isFalse();
    }

    @Test
    void compile_divisionAndPortionSteps_exposeTheirKinds() {
        var path = COMPILER.compile(reference("la seconde phrase du chapitre II"));

        var division = path.steps().get(0);
        var sentence = path.steps().get(1);
        assertThat(division.divisionKind()).contains(DivisionKind.CHAPTER);
        assertThat(division.identifier()).contains("II");
        assertThat(sentence.portionKind()).contains(PortionKind.SENTENCE_UNIT);
        assertThat(sentence.index()).contains(2);
        assertThat(sentence.divisionKind()).isEmpty();
    }

    @Test
    void compile_quotedWords_endWithWordsStep() {
        var path = COMPILER.compile(reference("les mots « à taux plein » du 1°"));

        assertThat(path.steps()).extracting(NavigationStep::kind).containsExactly(StepKind.DIVISION, StepKind.WORDS);
        assertThat(path.steps().get(1).identifier()).contains("à taux plein");
        assertThat(path.steps().get(1).describe()).isEqualTo("words « à taux plein »");
    }

    @Test
    void compile_stepOrigins_pointAtSourceNodes() {
        var input = "du dernier alinéa du II";
        var path = COMPILER.compile(reference(input));

        assertThat(path.steps().get(0).origin().extract(input)).isEqualTo("du II");
        assertThat(path.steps().get(1).origin().extract(input)).isEqualTo("du dernier alinéa");
    }

    // === Partial shapes ===

    @Test
    void compile_enumeration_keepsFirstMemberWithWarning() {
        var path = COMPILER.compile(reference("le I et le II"));

        assertThat(path.size()).isEqualTo(1);
        assertThat(path.steps().get(0).identifier()).contains("I");
        assertThat(path.isPartial()).isTrue();
        assertThat(path.warnings()).singleElement()
                                   .satisfies(warning -> assertThat(warning.severity()).isEqualTo(Diagnostic.Severity.WARNING));
    }

    @Test
    void compile_countedInterval_startsAtFirstCountedElement() {
        var path = COMPILER.compile(reference("les deux derniers alinéas"));

        assertThat(path.steps()).singleElement().satisfies(step -> assertThat(step.index()).contains(-2));
        assertThat(path.isPartial()).isTrue();
    }

    // === Targets ===

    @Test
    void compileTarget_referenceAndAction_usesReference() {
        var node = PARSER.parse("Le II est abrogé.").unwrap();

        assertThat(COMPILER.compileTarget(node)).hasValueSatisfying(path -> assertThat(path.describe()).isEqualTo("item II"));
    }

    @Test
    void compileTarget_placedAction_usesAnchor() {
        var node = PARSER.parse("Après le III, il est inséré un III bis ainsi rédigé : « III bis. – Texte. »").unwrap();

        assertThat(COMPILER.compileTarget(node)).hasValueSatisfying(path -> assertThat(path.describe()).isEqualTo("item III"));
    }

    @Test
    void compileTarget_anchoredReference_narrowsToAnchor() {
        var node = PARSER.parse("Au I, après le mot « décret », sont insérés les mots : « en Conseil d'État ».").unwrap();

        assertThat(COMPILER.compileTarget(node))
            .hasValueSatisfying(path -> assertThat(path.describe()).isEqualTo("item I > words « décret »"));
    }

    @Test
    void compileTarget_implicitTarget_isEmpty() {
        var node = PARSER.parse("Il est ajouté un alinéa ainsi rédigé : « Texte. »").unwrap();

        assertThat(COMPILER.compileTarget(node)).isEmpty();
    }
}
