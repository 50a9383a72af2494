package org.tricoteuses.amendment.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tricoteuses.amendment.navigation.Document;
import org.tricoteuses.amendment.navigation.DocumentNavigator;
import org.tricoteuses.amendment.navigation.LocatedFragment;
import org.tricoteuses.amendment.navigation.NavigationResult;
import org.tricoteuses.amendment.navigation.TextRange;
import org.tricoteuses.amendment.tree.ActionKind;
import org.tricoteuses.amendment.tree.ActionNode;
import org.tricoteuses.amendment.tree.CitationNode;
import org.tricoteuses.amendment.tree.Placement;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Computes the text of a fragment before and after a parsed modification, without touching the
 * document itself.
 *
 * <p>Inside a sentence or words span the change is made in place in the block text. On whole blocks
 * replaced content takes one line per citation; created content goes on new lines, except a single
 * lowercase citation completing a single block, which goes before the block's final period.
 */
public final class ModificationApplier {
    private static final Logger log = LoggerFactory.getLogger(ModificationApplier.class);

    private static final Pattern DOUBLE_SPACE = Pattern.compile(" {2,}");
    private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile(" +([,.;)])");

    private final DocumentNavigator navigator;

    private ModificationApplier(DocumentNavigator navigator) {
        this.navigator = navigator;
    }

    public static ModificationApplier create() {
        return new ModificationApplier(DocumentNavigator.create());
    }

    public ApplyResult apply(Document document, ParsedModification modification) {
        var located = modification.targetPath()
                                  .map(path -> navigator.locate(document, path))
                                  .orElseGet(() -> navigator.locate(document, List.of()));
        if (located instanceof NavigationResult.Failed failed) {
            log.debug("Cannot apply modification: {}", failed.cause().message());
            return new ApplyResult.Failed(failed.cause().message());
        }
        var result = (NavigationResult.Located) located;
        var fragment = result.located();
        var action = modification.action();
        if (action.kind() != ActionKind.DELETE && !action.hasCitations()) {
            return new ApplyResult.Failed(action.kind() + " action has no quoted content to apply");
        }
        var change = fragment.range().isPresent()
                     ? changeRange(fragment.range().get(), action)
                     : changeBlocks(fragment, action);
        return new ApplyResult.Applied(change.oldText(), change.newText(), fragment, result.warnings());
    }

    // === In-block changes ===

    private static Change changeRange(TextRange range, ActionNode action) {
        var text = range.block().text();
        var start = range.span().start();
        var stop = range.span().stop();
        return switch (action.kind()) {
            case REPLACE, CREATE_OR_REPLACE ->
                new Change(text, text.substring(0, start) + joined(action.citations(), " ") + text.substring(stop));
            case DELETE -> new Change(text, tidy(text.substring(0, start) + text.substring(stop)));
            case CREATE -> insertsBefore(action)
                           ? new Change(text, text.substring(0, start) + joined(action.citations(), " ") + " "
                                              + text.substring(start))
                           : new Change(text, text.substring(0, stop) + " " + joined(action.citations(), " ")
                                              + text.substring(stop));
        };
    }

    // === Block changes ===

    private static Change changeBlocks(LocatedFragment fragment, ActionNode action) {
        var text = fragment.text();
        return switch (action.kind()) {
            case REPLACE, CREATE_OR_REPLACE -> new Change(text, joined(action.citations(), "\n"));
            case DELETE -> new Change(text, "");
            case CREATE -> new Change(text, insertBlocks(fragment, action));
        };
    }

    private static String insertBlocks(LocatedFragment fragment, ActionNode action) {
        var text = fragment.text();
        var content = joined(action.citations(), "\n");
        if (insertsBefore(action)) {
            return content + "\n" + text;
        }
        if (fragment.isSingleBlock() && !fragment.blocks().get(0).hasChildren() && isInline(action)) {
            var trimmed = text.stripTrailing();
            var last = trimmed.isEmpty() ? ' ' : trimmed.charAt(trimmed.length() - 1);
            if (last == '.' || last == ';') {
                return trimmed.substring(0, trimmed.length() - 1) + " " + content + last;
            }
            return trimmed + " " + content;
        }
        return text.isEmpty() ? content : text + "\n" + content;
    }

    // === Helpers ===

    private static boolean insertsBefore(ActionNode action) {
        var position = action.placement().map(Placement::position).orElse(Placement.Position.END);
        return position == Placement.Position.BEFORE || position == Placement.Position.BEGINNING;
    }

    /**
     * Words completing a block: one citation opening with a lowercase letter or punctuation.
     */
    private static boolean isInline(ActionNode action) {
        if (action.citations().size() != 1) {
            return false;
        }
        var content = action.citations().get(0).text();
        return !content.isEmpty() && !Character.isUpperCase(content.charAt(0)) && !Character.isDigit(content.charAt(0));
    }

    private static String joined(List<CitationNode> citations, String separator) {
        return citations.stream().map(CitationNode::text).collect(Collectors.joining(separator));
    }

    private static String tidy(String text) {
        var collapsed = DOUBLE_SPACE.matcher(text).replaceAll(" ");
        return SPACE_BEFORE_PUNCTUATION.matcher(collapsed).replaceAll("$1").strip();
    }

    private record Change(String oldText, String newText) {}
}
