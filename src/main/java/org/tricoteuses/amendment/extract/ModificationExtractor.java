package org.tricoteuses.amendment.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tricoteuses.amendment.AmendmentParser;
import org.tricoteuses.amendment.compile.PathCompiler;
import org.tricoteuses.amendment.error.ParseError;
import org.tricoteuses.amendment.parser.ParseOutcome;
import org.tricoteuses.amendment.tree.ActionNode;
import org.tricoteuses.amendment.tree.AmendmentNode;
import org.tricoteuses.amendment.tree.ReferenceAndAction;
import org.tricoteuses.amendment.tree.ReferenceNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Parses every amendment block of a bill into a {@link ModificationBlock}.
 *
 * <p>Blocks are independent: one block failing, even with an unexpected exception, never affects
 * the others. Results always come back one per input block, in input order.
 */
public final class ModificationExtractor {
    private static final Logger log = LoggerFactory.getLogger(ModificationExtractor.class);
    private static final int LOG_PREVIEW = 100;

    private final AmendmentParser parser;
    private final PathCompiler compiler;
    private final ExtractionConfig config;

    private ModificationExtractor(AmendmentParser parser, PathCompiler compiler, ExtractionConfig config) {
        this.parser = parser;
        this.compiler = compiler;
        this.config = config;
    }

    public static ModificationExtractor create() {
        return create(AmendmentParser.create(), ExtractionConfig.DEFAULT);
    }

    public static ModificationExtractor create(AmendmentParser parser, ExtractionConfig config) {
        return new ModificationExtractor(parser, PathCompiler.create(), config);
    }

    /**
     * Parse one sentence into a modification. A reference that no action follows is a
     * {@link ParseError.MissingAction}.
     */
    public ParseOutcome<ParsedModification> parseModification(String text) {
        var outcome = parser.parse(text);
        if (outcome instanceof ParseOutcome.Parsed<AmendmentNode> parsed) {
            return toModification(parsed.node(), parsed.remaining());
        }
        return ParseOutcome.unparsed(outcome.error().orElseThrow());
    }

    public List<ModificationBlock> extract(List<SourceBlock> blocks) {
        if (config.parallelism() == 1 || blocks.size() <= 1) {
            var results = new ArrayList<ModificationBlock>(blocks.size());
            for (var block : blocks) {
                results.add(extractOne(block));
            }
            return results;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.parallelism(), blocks.size()));
        try {
            var futures = new ArrayList<Future<ModificationBlock>>(blocks.size());
            for (var block : blocks) {
                Callable<ModificationBlock> task = () -> extractOne(block);
                futures.add(executor.submit(task));
            }
            var results = new ArrayList<ModificationBlock>(blocks.size());
            for (int i = 0; i < blocks.size(); i++) {
                results.add(await(futures.get(i), blocks.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private ModificationBlock await(Future<ModificationBlock> future, SourceBlock block) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return fault(block, "extraction interrupted");
        } catch (ExecutionException e) {
            log.warn("Block {} failed unexpectedly", block.id(), e.getCause());
            return fault(block, String.valueOf(e.getCause()));
        }
    }

    private ModificationBlock extractOne(SourceBlock block) {
        ParseOutcome<ParsedModification> outcome;
        try {
            outcome = parseModification(block.rawText());
        } catch (RuntimeException e) {
            log.warn("Block {} failed unexpectedly", block.id(), e);
            return fault(block, e.toString());
        }
        return outcome.fold(error -> {
            log.warn("Block {} not parsed ({}): {}", block.id(), error.message(), preview(block.rawText()));
            return ModificationBlock.unparsed(block, error);
        }, modification -> ModificationBlock.parsed(block, modification));
    }

    private ParseOutcome<ParsedModification> toModification(AmendmentNode node, String remaining) {
        if (node instanceof ReferenceAndAction pair) {
            return ParseOutcome.parsed(new ParsedModification(node, pair.action(), Optional.of(pair.reference()),
                                                              compiler.compileTarget(node), remaining),
                                       remaining);
        }
        if (node instanceof ActionNode action) {
            return ParseOutcome.parsed(new ParsedModification(node, action, Optional.empty(),
                                                              compiler.compileTarget(node), remaining),
                                       remaining);
        }
        var reference = (ReferenceNode) node;
        return ParseOutcome.unparsed(new ParseError.MissingAction(reference.span().stop(), reference.span()));
    }

    private static ModificationBlock fault(SourceBlock block, String reason) {
        return ModificationBlock.unparsed(block, new ParseError.ParserFault(0, reason));
    }

    private static String preview(String text) {
        return text.length() <= LOG_PREVIEW ? text : text.substring(0, LOG_PREVIEW) + "...";
    }
}
