package org.tricoteuses.amendment.compile;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tricoteuses.amendment.error.Diagnostic;
import org.tricoteuses.amendment.tree.ActionNode;
import org.tricoteuses.amendment.tree.AmendmentNode;
import org.tricoteuses.amendment.tree.AmendmentVisitor;
import org.tricoteuses.amendment.tree.Placement;
import org.tricoteuses.amendment.tree.ReferenceAndAction;
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
import org.tricoteuses.amendment.tree.ReferenceVisitor;
import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flattens a reference tree into navigation steps, parent before child.
 *
 * <p>Enumerations and intervals compile their first member only; the path then carries a warning
 * and reports {@link NavigationPath#isPartial()}.
 */
public final class PathCompiler {
    private static final Logger log = LoggerFactory.getLogger(PathCompiler.class);

    private PathCompiler() {}

    public static PathCompiler create() {
        return new PathCompiler();
    }

    public NavigationPath compile(ReferenceNode reference) {
        var collector = new StepCollector();
        reference.accept(collector);
        return collector.toPath(reference);
    }

    /**
     * Path of the fragment an amendment addresses: its reference (narrowed to the placement anchor
     * when there is one), or for an action alone the anchor of its placement. Empty when the
     * target is implicit.
     */
    public Optional<NavigationPath> compileTarget(AmendmentNode node) {
        return node.accept(new TargetFinder()).map(reference -> compile(reference));
    }

    private static final class StepCollector implements ReferenceVisitor<Void> {
        private final List<NavigationStep> steps = new ArrayList<>();
        private final List<Diagnostic> warnings = new ArrayList<>();

        NavigationPath toPath(ReferenceNode reference) {
            var path = new NavigationPath(steps, warnings);
            log.debug("Compiled reference at {} into [{}]{}", reference.span(), path.describe(),
                      path.isPartial() ? " (partial)" : "");
            return path;
        }

        @Override
        public Void visitText(Text text) {
            var identifier = text.id().or(() -> Optional.of(text.title()));
            steps.add(NavigationStep.scope("text", identifier, Optional.empty(), text.span()));
            return null;
        }

        @Override
        public Void visitArticle(Article article) {
            steps.add(NavigationStep.scope("article", article.num(), article.relative(), article.span()));
            return null;
        }

        @Override
        public Void visitDivision(Division division) {
            steps.add(NavigationStep.division(division.kind(), division.num(), division.index(), division.span()));
            return null;
        }

        @Override
        public Void visitPortion(Portion portion) {
            steps.add(NavigationStep.portion(portion.kind(), portion.index(), portion.span()));
            return null;
        }

        @Override
        public Void visitWords(Words words) {
            steps.add(NavigationStep.words(words.citation().text(), words.span()));
            return null;
        }

        @Override
        public Void visitParentChild(ParentChild parentChild) {
            parentChild.parent().accept(this);
            parentChild.child().accept(this);
            return null;
        }

        @Override
        public Void visitEnumeration(Enumeration enumeration) {
            warn(enumeration.span(), "enumeration of " + enumeration.members().size() + " references");
            return enumeration.members().get(0).accept(this);
        }

        @Override
        public Void visitBoundedInterval(BoundedInterval interval) {
            warn(interval.span(), "interval");
            return interval.first().accept(this);
        }

        @Override
        public Void visitCountedInterval(CountedInterval interval) {
            warn(interval.span(), "interval of " + interval.count() + " elements");
            return interval.first().accept(this);
        }

        private void warn(SourceSpan span, String shape) {
            warnings.add(Diagnostic.warning("only the first member of this " + shape + " is resolved", span)
                                   .withHelp("resolve the other members separately"));
        }
    }

    /**
     * Picks the reference to compile out of any parse result.
     */
    private static final class TargetFinder implements AmendmentVisitor<Optional<ReferenceNode>> {

        @Override
        public Optional<ReferenceNode> visitAction(ActionNode action) {
            return action.placement().flatMap(Placement::anchor);
        }

        /**
         * "Au I, après le mot « décret », ...": the anchor is looked up inside the reference.
         */
        @Override
        public Optional<ReferenceNode> visitReferenceAndAction(ReferenceAndAction referenceAndAction) {
            var reference = referenceAndAction.reference();
            var anchor = referenceAndAction.action().placement().flatMap(Placement::anchor);
            return Optional.of(anchor.<ReferenceNode>map(found -> ParentChild.of(reference, found)).orElse(reference));
        }

        @Override
        public Optional<ReferenceNode> visitText(Text text) {
            return Optional.of(text);
        }

        @Override
        public Optional<ReferenceNode> visitArticle(Article article) {
            return Optional.of(article);
        }

        @Override
        public Optional<ReferenceNode> visitDivision(Division division) {
            return Optional.of(division);
        }

        @Override
        public Optional<ReferenceNode> visitPortion(Portion portion) {
            return Optional.of(portion);
        }

        @Override
        public Optional<ReferenceNode> visitWords(Words words) {
            return Optional.of(words);
        }

        @Override
        public Optional<ReferenceNode> visitParentChild(ParentChild parentChild) {
            return Optional.of(parentChild);
        }

        @Override
        public Optional<ReferenceNode> visitEnumeration(Enumeration enumeration) {
            return Optional.of(enumeration);
        }

        @Override
        public Optional<ReferenceNode> visitBoundedInterval(BoundedInterval interval) {
            return Optional.of(interval);
        }

        @Override
        public Optional<ReferenceNode> visitCountedInterval(CountedInterval interval) {
            return Optional.of(interval);
        }
    }
}
