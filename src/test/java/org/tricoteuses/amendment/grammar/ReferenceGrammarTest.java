package org.tricoteuses.amendment.grammar;

import org.junit.jupiter.api.Test;
import org.tricoteuses.amendment.parser.ScanContext;
import org.tricoteuses.amendment.tree.DivisionKind;
import org.tricoteuses.amendment.tree.PortionKind;
import org.tricoteuses.amendment.tree.ReferenceNode;
import org.tricoteuses.amendment.tree.ReferenceNode.Article;
import org.tricoteuses.amendment.tree.ReferenceNode.BoundedInterval;
import org.tricoteuses.amendment.tree.ReferenceNode.CountedInterval;
import org.tricoteuses.amendment.tree.ReferenceNode.Division;
import org.tricoteuses.amendment.tree.ReferenceNode.Enumeration;
import org.tricoteuses.amendment.tree.ReferenceNode.ParentChild;
import org.tricoteuses.amendment.tree.ReferenceNode.Portion;
import org.tricoteuses.amendment.tree.ReferenceNode.Text;
import org.tricoteuses.amendment.tree.ReferenceNode.Words;
import org.tricoteuses.amendment.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceGrammarTest {

    private static final ReferenceGrammar GRAMMAR = ReferenceGrammar.create();

    private static ReferenceNode parse(String input) {
        var result = GRAMMAR.reference().parse(ScanContext.create(input));
        assertThat(result.isSuccess()).as("parse of '%s'", input).isTrue();
        return result.toOptional().orElseThrow();
    }

    // === Composition ===

    @Test
    void reference_portionOfDivision_wideScopeIsParent() {
        var node = parse("du dernier alinéa du II");

        assertThat(node).isInstanceOf(ParentChild.class);
        var pair = (ParentChild) node;
        assertThat(pair.parent()).isEqualTo(Division.marked(SourceSpan.of(18, 23), DivisionKind.ITEM, "II"));
        assertThat(pair.child()).isEqualTo(new Portion(SourceSpan.of(0, 17), PortionKind.PARAGRAPH_UNIT, -1));
        assertThat(pair.span()).isEqualTo(SourceSpan.of(0, 23));
    }

    @Test
    void reference_auConnector_attachesWiderScope() {
        var node = parse("le premier alinéa au II");

        assertThat(node).isInstanceOfSatisfying(ParentChild.class, pair -> {
            assertThat(pair.parent()).isEqualTo(Division.marked(SourceSpan.of(18, 23), DivisionKind.ITEM, "II"));
            assertThat(pair.child()).isEqualTo(new Portion(SourceSpan.of(0, 17), PortionKind.PARAGRAPH_UNIT, 1));
        });
    }

    @Test
    void reference_longChain_nestsFromWidestScope() {
        var node = parse("la seconde phrase du dernier alinéa du II de l'article 224 du code général des impôts");

        var sentence = (ParentChild) node;
        assertThat(sentence.child()).isInstanceOfSatisfying(Portion.class, portion -> {
            assertThat(portion.kind()).isEqualTo(PortionKind.SENTENCE_UNIT);
            assertThat(portion.index()).isEqualTo(2);
        });
        var paragraph = (ParentChild) sentence.parent();
        assertThat(paragraph.child()).isInstanceOfSatisfying(Portion.class,
                                                             portion -> assertThat(portion.index()).isEqualTo(-1));
        var item = (ParentChild) paragraph.parent();
        assertThat(item.child()).isInstanceOfSatisfying(Division.class,
                                                        division -> assertThat(division.num()).contains("II"));
        var article = (ParentChild) item.parent();
        assertThat(article.child()).isInstanceOfSatisfying(Article.class,
                                                           found -> assertThat(found.num()).contains("224"));
        assertThat(article.parent()).isInstanceOfSatisfying(Text.class, text -> {
            assertThat(text.title()).isEqualTo("code général des impôts");
            assertThat(text.id()).contains("LEGITEXT000006069577");
        });
    }

    @Test
    void reference_stopsBeforeVerb() {
        var ctx = ScanContext.create("le II est abrogé");

        var node = GRAMMAR.reference().parse(ctx).toOptional();

        assertThat(node).containsInstanceOf(Division.class);
        assertThat(ctx.pos()).isEqualTo(5);
    }

    @Test
    void reference_unknownWords_fail() {
        var ctx = ScanContext.create("Bonjour le monde");

        assertThat(GRAMMAR.reference().parse(ctx).isFailure()).isTrue();
        assertThat(ctx.pos()).isZero();
    }

    // === Enumerations and intervals ===

    @Test
    void reference_conjunction_buildsEnumeration() {
        var node = parse("le I et le II");

        assertThat(node).isInstanceOfSatisfying(Enumeration.class, enumeration -> {
            assertThat(enumeration.members()).hasSize(2);
            assertThat(enumeration.span()).isEqualTo(SourceSpan.of(0, 13));
        });
    }

    @Test
    void reference_commaList_endingWithConjunction_keepsEveryMember() {
        var node = parse("les A, B et C");

        assertThat(node).isInstanceOfSatisfying(Enumeration.class,
                                                enumeration -> assertThat(enumeration.members()).hasSize(3));
    }

    @Test
    void reference_commaWithoutConjunction_isNotEnumeration() {
        var ctx = ScanContext.create("Au I, le A");

        var node = GRAMMAR.reference().parse(ctx).toOptional().orElseThrow();

        assertThat(node).isInstanceOfSatisfying(Division.class, division -> assertThat(division.num()).contains("I"));
        assertThat(ctx.pos()).isEqualTo(4);
    }

    @Test
    void reference_markerRange_buildsBoundedInterval() {
        var node = parse("du I à III");

        assertThat(node).isInstanceOfSatisfying(BoundedInterval.class, interval -> {
            assertThat(((Division) interval.first()).num()).contains("I");
            assertThat(((Division) interval.last()).num()).contains("III");
        });
    }

    @Test
    void reference_countedFromEnd_startsBeforeLast() {
        var node = parse("les deux derniers alinéas");

        assertThat(node).isInstanceOfSatisfying(CountedInterval.class, interval -> {
            assertThat(interval.count()).isEqualTo(2);
            assertThat(((Portion) interval.first()).index()).isEqualTo(-2);
        });
    }

    @Test
    void reference_countedFromStart_startsAtFirst() {
        var node = parse("les trois premières phrases");

        assertThat(node).isInstanceOfSatisfying(CountedInterval.class, interval -> {
            assertThat(interval.count()).isEqualTo(3);
            assertThat(((Portion) interval.first()).kind()).isEqualTo(PortionKind.SENTENCE_UNIT);
            assertThat(((Portion) interval.first()).index()).isEqualTo(1);
        });
    }

    @Test
    void reference_ordinalList_buildsEnumerationOfPortions() {
        var node = parse("les premier et deuxième alinéas");

        assertThat(node).isInstanceOfSatisfying(Enumeration.class, enumeration -> {
            assertThat(enumeration.members()).hasSize(2);
            assertThat(((Portion) enumeration.members().get(1)).index()).isEqualTo(2);
        });
    }

    @Test
    void reference_ordinalRange_buildsIntervalOfPortions() {
        var node = parse("les premier à troisième alinéas");

        assertThat(node).isInstanceOfSatisfying(BoundedInterval.class,
                                                interval -> assertThat(((Portion) interval.last()).index()).isEqualTo(3));
    }

    // === Atoms ===

    @Test
    void reference_portionWithNumberAfterNoun() {
        var node = parse("l'alinéa 3");

        assertThat(node).isEqualTo(new Portion(SourceSpan.of(0, 10), PortionKind.PARAGRAPH_UNIT, 3));
    }

    @Test
    void reference_codifiedArticleNumber() {
        assertThat(parse("l'article L. 123-4")).isInstanceOfSatisfying(Article.class,
                                                                      article -> assertThat(article.num()).contains("L. 123-4"));
        assertThat(parse("l'article 3 bis")).isInstanceOfSatisfying(Article.class,
                                                                   article -> assertThat(article.num()).contains("3 bis"));
    }

    @Test
    void reference_articleList_enumerationAndRange() {
        assertThat(parse("les articles 3 et 4")).isInstanceOfSatisfying(Enumeration.class,
                                                                      list -> assertThat(list.members()).hasSize(2));
        assertThat(parse("les articles L. 1 à L. 5")).isInstanceOfSatisfying(BoundedInterval.class,
                                                                           range -> assertThat(((Article) range.last()).num())
                                                                               .contains("L. 5"));
    }

    @Test
    void reference_relativeArticles() {
        assertThat(parse("l'article précédent")).isInstanceOfSatisfying(Article.class,
                                                                       article -> assertThat(article.relative()).contains(-1));
        assertThat(parse("le présent article")).isInstanceOfSatisfying(Article.class,
                                                                      article -> assertThat(article.relative()).contains(0));
    }

    @Test
    void reference_currentText() {
        assertThat(parse("de la présente loi")).isInstanceOfSatisfying(Text.class, text -> {
            assertThat(text.title()).isEqualTo("présente loi");
            assertThat(text.id()).isEmpty();
        });
    }

    @Test
    void reference_typedDivisions() {
        assertThat(parse("le chapitre II")).isEqualTo(Division.marked(SourceSpan.of(0, 14), DivisionKind.CHAPTER, "II"));
        assertThat(parse("du titre Ier")).isInstanceOfSatisfying(Division.class, division -> {
            assertThat(division.kind()).isEqualTo(DivisionKind.TITLE);
            assertThat(division.num()).contains("I");
        });
        assertThat(parse("la première section")).isInstanceOfSatisfying(Division.class, division -> {
            assertThat(division.kind()).isEqualTo(DivisionKind.SECTION);
            assertThat(division.index()).contains(1);
        });
    }

    @Test
    void reference_bareMarkers() {
        assertThat(parse("le III bis")).isInstanceOfSatisfying(Division.class,
                                                              division -> assertThat(division.num()).contains("III bis"));
        assertThat(parse("au 1°")).isInstanceOfSatisfying(Division.class,
                                                         division -> assertThat(division.num()).contains("1"));
        assertThat(parse("le a)")).isInstanceOfSatisfying(Division.class,
                                                         division -> assertThat(division.num()).contains("a"));
        assertThat(parse("le b")).isInstanceOfSatisfying(Division.class,
                                                        division -> assertThat(division.num()).contains("b"));
    }

    @Test
    void reference_quotedWords() {
        assertThat(parse("les mots : « à taux plein »")).isInstanceOfSatisfying(Words.class,
                                                                               words -> assertThat(words.citation().text())
                                                                                   .isEqualTo("à taux plein"));
        assertThat(parse("les mots « foo » et « bar »")).isInstanceOfSatisfying(Enumeration.class,
                                                                               list -> assertThat(list.members())
                                                                                   .allMatch(Words.class::isInstance)
                                                                                   .hasSize(2));
    }
}
