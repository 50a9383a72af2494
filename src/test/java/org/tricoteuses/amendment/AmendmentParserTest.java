package org.tricoteuses.amendment;

import org.junit.jupiter.api.Test;
import org.tricoteuses.amendment.error.ParseError;
import org.tricoteuses.amendment.parser.ParseOutcome;
import org.tricoteuses.amendment.tree.ActionKind;
import org.tricoteuses.amendment.tree.ActionNode;
import org.tricoteuses.amendment.tree.AmendmentNode;
import org.tricoteuses.amendment.tree.Placement.Position;
import org.tricoteuses.amendment.tree.ReferenceAndAction;
import org.tricoteuses.amendment.tree.ReferenceNode.Division;
import org.tricoteuses.amendment.tree.ReferenceNode.ParentChild;
import org.tricoteuses.amendment.tree.ReferenceNode.Portion;

import static org.assertj.core.api.Assertions.assertThat;

class AmendmentParserTest {

    private static final AmendmentParser PARSER = AmendmentParser.create();

    private static ParseOutcome.Parsed<AmendmentNode> parsed(String input) {
        var outcome = PARSER.parse(input);
        assertThat(outcome.isParsed()).as("parse of '%s': %s", input, outcome.error()).isTrue();
        return (ParseOutcome.Parsed<AmendmentNode>) outcome;
    }

    // === Composition ===

    @Test
    void parse_referenceThenAction_buildsPair() {
        var outcome = parsed("Le dernier alinéa du II est supprimé.");

        assertThat(outcome.isComplete()).isTrue();
        assertThat(outcome.node()).isInstanceOfSatisfying(ReferenceAndAction.class, pair -> {
            assertThat(pair.action().kind()).isEqualTo(ActionKind.DELETE);
            assertThat(pair.reference()).isInstanceOfSatisfying(ParentChild.class, reference -> {
                assertThat(reference.parent()).isInstanceOf(Division.class);
                assertThat(reference.child()).isInstanceOf(Portion.class);
            });
        });
    }

    @Test
    void parse_leadingLabel_isSkipped() {
        var outcome = parsed("1° Le II est abrogé ;");

        assertThat(outcome.isComplete()).isTrue();
        assertThat(outcome.node()).isInstanceOfSatisfying(ReferenceAndAction.class,
                                                          pair -> assertThat(((Division) pair.reference()).num()).contains("II"));
    }

    @Test
    void parse_labelSkippingDisabled_readsLabelAsReference() {
        var parser = AmendmentParser.builder().skipLeadingLabel(false).build();

        var outcome = parser.parse("1° Le II est abrogé ;");

        assertThat(outcome).isInstanceOfSatisfying(ParseOutcome.Parsed.class,
                                                   result -> assertThat(result.isComplete()).isFalse());
        assertThat(outcome.value()).containsInstanceOf(Division.class);
    }

    @Test
    void parse_commaSeparatedClauses_nestReferences() {
        var outcome = parsed("Au I, le A est ainsi rédigé : « A. – Nouveau texte. »");

        assertThat(outcome.node()).isInstanceOfSatisfying(ReferenceAndAction.class, pair -> {
            var reference = (ParentChild) pair.reference();
            assertThat(((Division) reference.parent()).num()).contains("I");
            assertThat(((Division) reference.child()).num()).contains("A");
            assertThat(pair.action().rewritesWholeTarget()).isTrue();
        });
    }

    @Test
    void parse_placementBeforeAction_yieldsActionWithAnchor() {
        var outcome = parsed("Après le III, il est inséré un III bis ainsi rédigé : « III bis. – Texte. »");

        assertThat(outcome.node()).isInstanceOfSatisfying(ActionNode.class, action -> {
            assertThat(action.kind()).isEqualTo(ActionKind.CREATE);
            assertThat(action.placement()).hasValueSatisfying(placement -> {
                assertThat(placement.position()).isEqualTo(Position.AFTER);
                assertThat(placement.anchor()).containsInstanceOf(Division.class);
            });
        });
    }

    @Test
    void parse_placementThenReference_targetsReference() {
        var outcome = parsed("Après le 2°, au I, il est inséré un 2° bis ainsi rédigé : « 2° bis Texte ; »");

        assertThat(outcome.node()).isInstanceOfSatisfying(ReferenceAndAction.class, pair -> {
            assertThat(((Division) pair.reference()).num()).contains("I");
            assertThat(pair.action().placement()).hasValueSatisfying(
                placement -> assertThat(placement.position()).isEqualTo(Position.AFTER));
        });
    }

    @Test
    void parse_actionAlone_hasImplicitTarget() {
        var outcome = parsed("Il est ajouté un alinéa ainsi rédigé : « Texte nouveau. »");

        assertThat(outcome.node()).isInstanceOfSatisfying(ActionNode.class, action -> {
            assertThat(action.kind()).isEqualTo(ActionKind.CREATE);
            assertThat(action.placement()).isEmpty();
        });
    }

    @Test
    void parse_bareReference_isReturnedWithRemainingInput() {
        var outcome = parsed("Le II de l'article 3 est bidouillé.");

        assertThat(outcome.node()).isInstanceOf(ParentChild.class);
        assertThat(outcome.remaining()).isEqualTo(" est bidouillé.");
    }

    @Test
    void parseReference_andParseAction_runSingleClauses() {
        assertThat(PARSER.parseReference("du dernier alinéa du II").value()).containsInstanceOf(ParentChild.class);
        assertThat(PARSER.parseAction("est remplacé par les mots : « bar »").value())
            .hasValueSatisfying(action -> assertThat(action.citations()).hasSize(1));
    }

    // === Errors ===

    @Test
    void parse_blankInput_isUnexpectedEof() {
        var outcome = PARSER.parse("   ");

        assertThat(outcome.error()).containsInstanceOf(ParseError.UnexpectedEof.class);
    }

    @Test
    void parse_unrecognizedText_reportsOffsetAndToken() {
        var outcome = PARSER.parse("Bonjour le monde");

        assertThat(outcome.error()).hasValueSatisfying(error -> {
            assertThat(error).isInstanceOf(ParseError.UnexpectedInput.class);
            var unexpected = (ParseError.UnexpectedInput) error;
            assertThat(unexpected.offset()).isZero();
            assertThat(unexpected.found()).isEqualTo("Bonjour");
        });
    }

    @Test
    void parse_oversizedNumber_isUnparsedNotThrown() {
        var sentence = PARSER.parse("Le 99999999999e alinéa est supprimé.");
        var reference = PARSER.parseReference("l'alinéa 99999999999");

        assertThat(sentence.isUnparsed()).isTrue();
        assertThat(reference.isUnparsed()).isTrue();
    }

    @Test
    void parse_unclosedQuotation_failsWholeSentence() {
        var outcome = PARSER.parse("Le II est remplacé par les mots : « foo");

        assertThat(outcome.isUnparsed()).isTrue();
        assertThat(outcome.error()).containsInstanceOf(ParseError.UnexpectedEof.class);
    }

    @Test
    void diagnose_rendersPointerUnderSentence() {
        var input = "Bonjour le monde";
        var error = PARSER.parse(input).error().orElseThrow();

        var rendered = PARSER.diagnose(input, error);

        assertThat(rendered).startsWith("error: unrecognized amendment")
                            .contains("1 | Bonjour le monde")
                            .contains("^^^^^^^");
    }

    // === Configuration ===

    @Test
    void builder_strictCase_rejectsUppercaseVerb() {
        var strict = AmendmentParser.builder().caseInsensitive(false).build();

        assertThat(strict.config().caseInsensitive()).isFalse();
        assertThat(strict.parseAction("EST ABROGÉ").isUnparsed()).isTrue();
        assertThat(PARSER.parseAction("EST ABROGÉ").isParsed()).isTrue();
    }
}
