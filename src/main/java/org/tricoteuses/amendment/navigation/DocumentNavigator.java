package org.tricoteuses.amendment.navigation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tricoteuses.amendment.compile.NavigationPath;
import org.tricoteuses.amendment.compile.NavigationStep;
import org.tricoteuses.amendment.tree.DivisionKind;
import org.tricoteuses.amendment.tree.PortionKind;
import org.tricoteuses.amendment.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks a document along compiled steps, narrowing the scope from the whole article down to a
 * division, a paragraph, a sentence or quoted words.
 *
 * <p>Stateless: the same document and path always give the same result. Ordinals are 1-based
 * and negative ones count from the end ({@code -1} is the last element).
 */
public final class DocumentNavigator {
    private static final Logger log = LoggerFactory.getLogger(DocumentNavigator.class);

    private DocumentNavigator() {}

    public static DocumentNavigator create() {
        return new DocumentNavigator();
    }

    public NavigationResult locate(Document document, NavigationPath path) {
        var result = locate(document, path.steps());
        if (result instanceof NavigationResult.Located located && path.isPartial()) {
            return new NavigationResult.Located(located.located(), path.warnings());
        }
        return result;
    }

    public NavigationResult locate(Document document, List<NavigationStep> steps) {
        var scope = Scope.initial(document);
        for (int i = 0; i < steps.size(); i++) {
            var step = steps.get(i);
            var next = narrow(scope, step);
            if (next instanceof Narrowed.Failure failure) {
                var error = new NavigationError(i, step, scope.description(), failure.reason());
                log.debug("Navigation failed: {}", error.message());
                return new NavigationResult.Failed(error);
            }
            scope = ((Narrowed.Success) next).scope();
            log.trace("Step {} ({}) narrowed scope to {}", i + 1, step.describe(), scope.description());
        }
        return new NavigationResult.Located(new LocatedFragment(scope.blocks(), scope.range(), scope.description()),
                                            List.of());
    }

    // === Steps ===

    private static Narrowed narrow(Scope scope, NavigationStep step) {
        return switch (step.kind()) {
            case SCOPE -> new Narrowed.Success(scope);
            case DIVISION -> division(scope, step);
            case PORTION -> step.portionKind().orElseThrow() == PortionKind.SENTENCE_UNIT
                            ? sentence(scope, step)
                            : paragraph(scope, step);
            case WORDS -> words(scope, step);
        };
    }

    private static Narrowed division(Scope scope, NavigationStep step) {
        var kind = step.divisionKind().orElse(DivisionKind.ITEM);
        var blocks = scope.blocks();
        int matched = -1;
        if (step.identifier().isPresent()) {
            var marker = step.identifier().get();
            for (int i = 0; i < blocks.size() && matched < 0; i++) {
                if (MarkerPatterns.startsWithMarker(blocks.get(i).text(), marker, kind)) {
                    matched = i;
                }
            }
            if (matched < 0) {
                return new Narrowed.Failure("no block starts with marker '" + marker + "'");
            }
        } else {
            var marked = new ArrayList<Integer>();
            for (int i = 0; i < blocks.size(); i++) {
                var marker = MarkerPatterns.leadingMarker(blocks.get(i).text());
                if (marker.isPresent() && marker.get().kind() == kind) {
                    marked.add(i);
                }
            }
            var index = step.index().orElseThrow();
            var position = resolve(index, marked.size());
            if (position.isEmpty()) {
                return new Narrowed.Failure(outOfRange(index, marked.size(), kind.tag() + " division"));
            }
            matched = marked.get(position.get());
        }

        var block = blocks.get(matched);
        var label = step.describe();
        if (block.hasChildren()) {
            return new Narrowed.Success(scope.narrowTo(block.children(), label));
        }
        return new Narrowed.Success(scope.narrowTo(divisionRun(blocks, matched), label));
    }

    /**
     * In a flat document a division spans its opening block and the blocks after it, up to the
     * next marker of the same or a coarser family.
     */
    private static List<DocumentBlock> divisionRun(List<DocumentBlock> blocks, int opening) {
        var run = new ArrayList<DocumentBlock>();
        run.add(blocks.get(opening));
        var marker = MarkerPatterns.leadingMarker(blocks.get(opening).text());
        for (int i = opening + 1; i < blocks.size(); i++) {
            var next = MarkerPatterns.leadingMarker(blocks.get(i).text());
            if (marker.isPresent() && next.isPresent() && marker.get().isClosedBy(next.get())) {
                break;
            }
            run.add(blocks.get(i));
        }
        return run;
    }

    private static Narrowed paragraph(Scope scope, NavigationStep step) {
        var index = step.index().orElseThrow();
        var blocks = scope.blocks();
        var position = resolve(index, blocks.size());
        if (position.isEmpty()) {
            return new Narrowed.Failure(outOfRange(index, blocks.size(), "alinéas"));
        }
        return new Narrowed.Success(scope.narrowTo(List.of(blocks.get(position.get())), step.describe()));
    }

    private static Narrowed sentence(Scope scope, NavigationStep step) {
        var index = step.index().orElseThrow();
        var sentences = new ArrayList<TextRange>();
        for (var block : scope.blocks()) {
            if (scope.range().isPresent() && scope.range().get().block() != block) {
                continue;
            }
            for (var span : SentenceSplitter.split(block.text())) {
                sentences.add(new TextRange(block, span));
            }
        }
        var position = resolve(index, sentences.size());
        if (position.isEmpty()) {
            return new Narrowed.Failure(outOfRange(index, sentences.size(), "sentences"));
        }
        var selected = sentences.get(position.get());
        return new Narrowed.Success(scope.narrowTo(selected, step.describe()));
    }

    private static Narrowed words(Scope scope, NavigationStep step) {
        var quoted = step.identifier().orElseThrow();
        if (scope.range().isPresent()) {
            var range = scope.range().get();
            var found = range.block().text().indexOf(quoted, range.span().start());
            if (found >= 0 && found + quoted.length() <= range.span().stop()) {
                return new Narrowed.Success(scope.narrowTo(new TextRange(range.block(), SourceSpan.of(found, found + quoted.length())),
                                                           step.describe()));
            }
            return new Narrowed.Failure("words « " + quoted + " » not found");
        }
        for (var block : scope.blocks()) {
            var found = block.text().indexOf(quoted);
            if (found >= 0) {
                return new Narrowed.Success(scope.narrowTo(new TextRange(block, SourceSpan.of(found, found + quoted.length())),
                                                           step.describe()));
            }
        }
        return new Narrowed.Failure("words « " + quoted + " » not found");
    }

    // === Helpers ===

    /**
     * 0-based position of a signed 1-based index among {@code size} elements.
     */
    static Optional<Integer> resolve(int index, int size) {
        int position = index > 0 ? index - 1 : size + index;
        if (index == 0 || position < 0 || position >= size) {
            return Optional.empty();
        }
        return Optional.of(position);
    }

    private static String outOfRange(int index, int size, String what) {
        return "ordinal " + index + " out of range, scope has " + size + " " + what;
    }

    private record Scope(List<DocumentBlock> blocks, Optional<TextRange> range, String description) {

        static Scope initial(Document document) {
            return new Scope(document.blocks(), Optional.empty(), "document (" + document.blocks().size() + " blocks)");
        }

        Scope narrowTo(List<DocumentBlock> narrowed, String label) {
            return new Scope(narrowed, Optional.empty(), trail(label, narrowed.size() + " blocks"));
        }

        Scope narrowTo(TextRange narrowed, String label) {
            return new Scope(List.of(narrowed.block()), Optional.of(narrowed), trail(label, "span " + narrowed.span()));
        }

        private String trail(String label, String size) {
            return description + " > " + label + " (" + size + ")";
        }
    }

    private sealed interface Narrowed {
        record Success(Scope scope) implements Narrowed {}

        record Failure(String reason) implements Narrowed {}
    }
}
