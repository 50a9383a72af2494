package org.tricoteuses.amendment.tree;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reference to a fragment of a legal text - the "which part" of an amendment.
 *
 * <p>For composite variants the span always covers the spans of every descendant.
 */
public sealed interface ReferenceNode extends AmendmentNode {

    <R> R accept(ReferenceVisitor<R> visitor);

    @Override
    default <R> R accept(AmendmentVisitor<R> visitor) {
        return accept((ReferenceVisitor<R>) visitor);
    }

    // === Atoms ===

    /**
     * Whole-document scope: "du code général des impôts", "de la présente loi".
     */
    record Text(SourceSpan span, String title, Optional<String> id) implements ReferenceNode {
        public Text {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(title, "title");
            Objects.requireNonNull(id, "id");
        }

        @Override
        public <R> R accept(ReferenceVisitor<R> visitor) {
            return visitor.visitText(this);
        }
    }

    /**
     * "l'article 224", or a relative article ("l'article précédent" is -1, "le présent article" is 0).
     */
    record Article(SourceSpan span, Optional<String> num, Optional<Integer> relative) implements ReferenceNode {
        public Article {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(num, "num");
            Objects.requireNonNull(relative, "relative");
        }

        public static Article numbered(SourceSpan span, String num) {
            return new Article(span, Optional.of(num), Optional.empty());
        }

        public static Article relative(SourceSpan span, int offset) {
            return new Article(span, Optional.empty(), Optional.of(offset));
        }

        @Override
        public <R> R accept(ReferenceVisitor<R> visitor) {
            return visitor.visitArticle(this);
        }
    }

    /**
     * Structural division: a marker ("II", "A", "1°") or a typed division ("chapitre II").
     * {@code index} is set instead of {@code num} for "la première section".
     */
    record Division(SourceSpan span, DivisionKind kind, Optional<String> num, Optional<Integer> index)
        implements ReferenceNode {
        public Division {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(num, "num");
            Objects.requireNonNull(index, "index");
            if (num.isEmpty() && index.isEmpty()) {
                throw new IllegalArgumentException("Division needs a marker or an index");
            }
        }

        public static Division marked(SourceSpan span, DivisionKind kind, String num) {
            return new Division(span, kind, Optional.of(num), Optional.empty());
        }

        public static Division indexed(SourceSpan span, DivisionKind kind, int index) {
            return new Division(span, kind, Optional.empty(), Optional.of(index));
        }

        @Override
        public <R> R accept(ReferenceVisitor<R> visitor) {
            return visitor.visitDivision(this);
        }
    }

    /**
     * "le dernier alinéa", "la seconde phrase". {@code index} is 1-based from the start when
     * positive, and counts from the end when negative ({@code -1} is the last one).
     */
    record Portion(SourceSpan span, PortionKind kind, int index) implements ReferenceNode {
        public Portion {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(kind, "kind");
            if (index == 0) {
                throw new IllegalArgumentException("Portion index is 1-based or negative, got 0");
            }
        }

        @Override
        public <R> R accept(ReferenceVisitor<R> visitor) {
            return visitor.visitPortion(this);
        }
    }

    /**
     * Quoted words inside the scope: "les mots : « à taux plein »".
     */
    record Words(SourceSpan span, CitationNode citation) implements ReferenceNode {
        public Words {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(citation, "citation");
        }

        @Override
        public <R> R accept(ReferenceVisitor<R> visitor) {
            return visitor.visitWords(this);
        }
    }

    // === Composites ===

    /**
     * "X du Y": {@code parent} is the wider scope (Y), {@code child} the narrower one (X),
     * whatever the surface order.
     */
    record ParentChild(SourceSpan span, ReferenceNode parent, ReferenceNode child) implements ReferenceNode {
        public ParentChild {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(parent, "parent");
            Objects.requireNonNull(child, "child");
            if (!span.contains(parent.span()) || !span.contains(child.span())) {
                throw new IllegalArgumentException("Span " + span + " does not cover parent "
                                                   + parent.span() + " and child " + child.span());
            }
        }

        public static ParentChild of(ReferenceNode parent, ReferenceNode child) {
            return new ParentChild(parent.span().merge(child.span()), parent, child);
        }

        @Override
        public <R> R accept(ReferenceVisitor<R> visitor) {
            return visitor.visitParentChild(this);
        }
    }

    /**
     * Siblings addressed together: "le I et le II".
     */
    record Enumeration(SourceSpan span, List<ReferenceNode> members) implements ReferenceNode {
        public Enumeration {
            Objects.requireNonNull(span, "span");
            members = List.copyOf(members);
            if (members.isEmpty()) {
                throw new IllegalArgumentException("Enumeration needs at least one member");
            }
            for (var member : members) {
                if (!span.contains(member.span())) {
                    throw new IllegalArgumentException("Span " + span + " does not cover member " + member.span());
                }
            }
        }

        public static Enumeration of(List<ReferenceNode> members) {
            var span = members.get(0).span();
            for (var member : members) {
                span = span.merge(member.span());
            }
            return new Enumeration(span, members);
        }

        @Override
        public <R> R accept(ReferenceVisitor<R> visitor) {
            return visitor.visitEnumeration(this);
        }
    }

    /**
     * "du I à III", "les premier à troisième alinéas".
     */
    record BoundedInterval(SourceSpan span, ReferenceNode first, ReferenceNode last) implements ReferenceNode {
        public BoundedInterval {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(last, "last");
            if (!span.contains(first.span()) || !span.contains(last.span())) {
                throw new IllegalArgumentException("Span " + span + " does not cover interval bounds");
            }
        }

        @Override
        public <R> R accept(ReferenceVisitor<R> visitor) {
            return visitor.visitBoundedInterval(this);
        }
    }

    /**
     * "les trois premières phrases": {@code count} elements starting at {@code first}.
     */
    record CountedInterval(SourceSpan span, ReferenceNode first, int count) implements ReferenceNode {
        public CountedInterval {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(first, "first");
            if (count < 1) {
                throw new IllegalArgumentException("Interval count must be positive, got " + count);
            }
            if (!span.contains(first.span())) {
                throw new IllegalArgumentException("Span " + span + " does not cover first element");
            }
        }

        @Override
        public <R> R accept(ReferenceVisitor<R> visitor) {
            return visitor.visitCountedInterval(this);
        }
    }
}
