package org.tricoteuses.amendment.tree;

import org.junit.jupiter.api.Test;
import org.tricoteuses.amendment.tree.ReferenceNode.Article;
import org.tricoteuses.amendment.tree.ReferenceNode.BoundedInterval;
import org.tricoteuses.amendment.tree.ReferenceNode.CountedInterval;
import org.tricoteuses.amendment.tree.ReferenceNode.Division;
import org.tricoteuses.amendment.tree.ReferenceNode.Enumeration;
import org.tricoteuses.amendment.tree.ReferenceNode.ParentChild;
import org.tricoteuses.amendment.tree.ReferenceNode.Portion;
import org.tricoteuses.amendment.tree.ReferenceNode.Text;
import org.tricoteuses.amendment.tree.ReferenceNode.Words;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceNodeTest {

    private static final Division ITEM_II = Division.marked(SourceSpan.of(20, 22), DivisionKind.ITEM, "II");
    private static final Portion LAST_PARAGRAPH = new Portion(SourceSpan.of(0, 15), PortionKind.PARAGRAPH_UNIT, -1);

    // === Invariants ===

    @Test
    void parentChild_of_mergesSpans() {
        var node = ParentChild.of(ITEM_II, LAST_PARAGRAPH);

        assertThat(node.span()).isEqualTo(SourceSpan.of(0, 22));
        assertThat(node.parent()).isSameAs(ITEM_II);
        assertThat(node.child()).isSameAs(LAST_PARAGRAPH);
    }

    @Test
    void parentChild_spanNotCoveringChildren_throws() {
        assertThatThrownBy(() -> new ParentChild(SourceSpan.of(0, 10), ITEM_II, LAST_PARAGRAPH))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void portion_zeroIndex_throws() {
        assertThatThrownBy(() -> new Portion(SourceSpan.of(0, 3), PortionKind.SENTENCE_UNIT, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void division_withoutMarkerOrIndex_throws() {
        assertThatThrownBy(() -> new Division(SourceSpan.of(0, 3), DivisionKind.CHAPTER, Optional.empty(), Optional.empty()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void enumeration_of_coversEveryMember() {
        var first = Division.marked(SourceSpan.of(3, 4), DivisionKind.ITEM, "I");
        var second = Division.marked(SourceSpan.of(11, 13), DivisionKind.ITEM, "II");

        var node = Enumeration.of(List.<ReferenceNode>of(first, second));

        assertThat(node.span()).isEqualTo(SourceSpan.of(3, 13));
        assertThat(node.members()).containsExactly(first, second);
    }

    @Test
    void enumeration_empty_throws() {
        assertThatThrownBy(() -> new Enumeration(SourceSpan.of(0, 1), List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void countedInterval_nonPositiveCount_throws() {
        assertThatThrownBy(() -> new CountedInterval(SourceSpan.of(0, 15), LAST_PARAGRAPH, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // === Visitors ===

    @Test
    void accept_dispatchesToMatchingVisit() {
        var visitor = new KindNamer();
        var citation = new CitationNode(SourceSpan.of(10, 20), "à taux plein");

        assertThat(new Text(SourceSpan.of(0, 5), "code civil", Optional.empty()).accept(visitor)).isEqualTo("text");
        assertThat(Article.numbered(SourceSpan.of(0, 5), "224").accept(visitor)).isEqualTo("article");
        assertThat(ITEM_II.accept(visitor)).isEqualTo("division");
        assertThat(LAST_PARAGRAPH.accept(visitor)).isEqualTo("portion");
        assertThat(new Words(SourceSpan.of(0, 20), citation).accept(visitor)).isEqualTo("words");
        assertThat(ParentChild.of(ITEM_II, LAST_PARAGRAPH).accept(visitor)).isEqualTo("parent-child");
        assertThat(Enumeration.of(List.<ReferenceNode>of(ITEM_II)).accept(visitor)).isEqualTo("enumeration");
        assertThat(new BoundedInterval(SourceSpan.of(0, 22), LAST_PARAGRAPH, ITEM_II).accept(visitor))
            .isEqualTo("bounded");
        assertThat(new CountedInterval(SourceSpan.of(0, 15), LAST_PARAGRAPH, 2).accept(visitor)).isEqualTo("counted");
    }

    @Test
    void article_relative_hasNoNumber() {
        var article = Article.relative(SourceSpan.of(0, 20), -1);

        assertThat(article.num()).isEmpty();
        assertThat(article.relative()).contains(-1);
    }

    @Test
    void divisionKind_lookupByNounAndTag() {
        assertThat(DivisionKind.fromNoun("Chapitre")).contains(DivisionKind.CHAPTER);
        assertThat(DivisionKind.fromNoun("")).isEmpty();
        assertThat(DivisionKind.fromTag("sub-paragraph")).contains(DivisionKind.SUBPARAGRAPH);
    }

    private static final class KindNamer implements ReferenceVisitor<String> {
        @Override
        public String visitText(Text text) {
            return "text";
        }

        @Override
        public String visitArticle(Article article) {
            return "article";
        }

        @Override
        public String visitDivision(Division division) {
            return "division";
        }

        @Override
        public String visitPortion(Portion portion) {
            return "portion";
        }

        @Override
        public String visitWords(Words words) {
            return "words";
        }

        @Override
        public String visitParentChild(ParentChild parentChild) {
            return "parent-child";
        }

        @Override
        public String visitEnumeration(Enumeration enumeration) {
            return "enumeration";
        }

        @Override
        public String visitBoundedInterval(BoundedInterval interval) {
            return "bounded";
        }

        @Override
        public String visitCountedInterval(CountedInterval interval) {
            return "counted";
        }
    }
}
