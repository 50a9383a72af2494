package org.tricoteuses.amendment.grammar;

import org.tricoteuses.amendment.parser.ParseResult;
import org.tricoteuses.amendment.parser.Parser;
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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

import static org.tricoteuses.amendment.parser.Parsers.alternative;
import static org.tricoteuses.amendment.parser.Parsers.keyword;
import static org.tricoteuses.amendment.parser.Parsers.keywords;
import static org.tricoteuses.amendment.parser.Parsers.literal;
import static org.tricoteuses.amendment.parser.Parsers.lookahead;
import static org.tricoteuses.amendment.parser.Parsers.optional;
import static org.tricoteuses.amendment.parser.Parsers.pattern;
import static org.tricoteuses.amendment.parser.Parsers.sequence;
import static org.tricoteuses.amendment.parser.Parsers.spanned;

/**
 * Recursive-descent grammar of legal citations ("la seconde phrase du dernier alinéa du II de
 * l'article 224 du code général des impôts").
 *
 * <p>Alternatives are ordered most specific first. Division markers are matched case-sensitively
 * and never overlap with portion nouns, so "II" can only be a division.
 */
public final class ReferenceGrammar {

    /**
     * Latin multiplicatives following a marker or an article number, as a regex alternation.
     */
    public static final String MULTIPLICATIVE = Lexicon.MULTIPLICATIVE;

    private static final String SUFFIX = "(?:\\s+(" + Lexicon.MULTIPLICATIVE + "))?";

    private static final Pattern UPPER_MARKER = Pattern.compile(
        "([IVXLCDM]+|[A-Z])" + SUFFIX + "(?![\\p{L}\\d])");
    private static final Pattern NUMBERED_MARKER = Pattern.compile(
        "(\\d+)\\s?°" + SUFFIX + "(?![\\p{L}\\d])");
    private static final Pattern LOWER_PAREN_MARKER = Pattern.compile(
        "([a-z])" + SUFFIX + "\\)");
    private static final Pattern LOWER_MARKER = Pattern.compile(
        "([a-z])" + SUFFIX + "(?![\\p{L}\\d'’)])");
    private static final Pattern TYPED_MARKER = Pattern.compile(
        "([IVXLCDM]+|\\d+|[A-Z])(?:er|re)?" + SUFFIX + "(?![\\p{L}\\d])");
    private static final Pattern ARTICLE_NUMBER = Pattern.compile(
        "((?:(?:LO|L|R|D|A)\\*?\\.?\\s?)?\\d+)(?:\\s?er)?((?:[-.]\\d+)*)" + SUFFIX
        + "(?:\\s+([A-HJ-UWYZ]))?(?![\\p{L}\\d])");
    private static final Pattern CARDINAL = Pattern.compile("(" + Ordinals.NUMBER + ")(?![\\p{L}\\d°])");
    private static final Pattern TITLE_WORD = Pattern.compile("n°|[\\p{L}\\d][\\p{L}\\d'’°-]*");

    private final Parser<String> determiner = keywords(Lexicon.DETERMINERS);
    private final Parser<Optional<String>> optionalDeterminer = optional(determiner);
    private final Parser<String> connector = keywords(Lexicon.PARENT_CONNECTORS);
    private final Parser<Integer> ordinal = alternative(
        keywords(Ordinals.words()).map(word -> Ordinals.normalize(word).orElseThrow()),
        pattern(Ordinals.NUMERIC, "ordinal").map(match -> Integer.parseInt(match.group(1))));
    private final Parser<PortionKind> portionNoun = keywords(List.copyOf(Lexicon.PORTION_NOUNS.keySet()))
        .map(noun -> Lexicon.portionKind(noun).orElseThrow());
    private final Parser<PortionKind> portionPlural = keywords(List.copyOf(Lexicon.PORTION_PLURALS.keySet()))
        .map(noun -> Lexicon.portionKind(noun).orElseThrow());
    private final Parser<DivisionKind> divisionNoun = keywords(Lexicon.DIVISION_NOUNS)
        .map(noun -> DivisionKind.fromNoun(noun).orElseThrow());
    private final Parser<Integer> count = alternative(
        keywords(Ordinals.countWords()).map(word -> Ordinals.count(word).orElseThrow()),
        pattern(CARDINAL, "count").map(match -> Integer.parseInt(match.group(1))));

    private final Parser<ReferenceNode> atom = atomParser();

    private ReferenceGrammar() {}

    public static ReferenceGrammar create() {
        return new ReferenceGrammar();
    }

    /**
     * Full reference: groups joined by "du"/"de la"/"de l'"/"des", the coarser scope becoming the parent.
     */
    public Parser<ReferenceNode> reference() {
        return this::chain;
    }

    /**
     * A single reference without composition.
     */
    public Parser<ReferenceNode> atom() {
        return atom;
    }

    private Parser<ReferenceNode> atomParser() {
        Parser<ReferenceNode> choice = alternative(
            this::words,
            this::portionList,
            portion(),
            this::relativeArticle,
            this::articleList,
            article(),
            this::text,
            typedDivision(),
            item());
        return choice.expecting("reference");
    }

    // === Composition ===

    private ParseResult<ReferenceNode> chain(ScanContext ctx) {
        var first = group(ctx);
        if (first.isFailure()) {
            return first;
        }
        var scopes = new ArrayList<ReferenceNode>();
        scopes.add(first.toOptional().orElseThrow());
        while (lookahead(connector).parse(ctx).isSuccess()) {
            var next = group(ctx);
            if (next.isFailure()) {
                break;
            }
            scopes.add(next.toOptional().orElseThrow());
        }
        // "X du Y du Z": Z is the widest scope, X the narrowest
        var result = scopes.get(scopes.size() - 1);
        for (int i = scopes.size() - 2; i >= 0; i--) {
            result = ParentChild.of(result, scopes.get(i));
        }
        return ParseResult.Success.of(result, ctx.pos());
    }

    /**
     * Atom, enumeration ("le I et le II", "les A, B et C") or interval ("du I à III").
     */
    private ParseResult<ReferenceNode> group(ScanContext ctx) {
        var checkpoint = ctx.save();
        var first = attempt(atom, ctx);
        if (first.isEmpty()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "reference");
        }
        var afterFirst = ctx.save();
        if (attempt(keyword("à"), ctx).isPresent()) {
            var last = attempt(atom, ctx);
            if (last.isPresent()) {
                var span = first.get().span().merge(last.get().span());
                return ParseResult.Success.of(new BoundedInterval(span, first.get(), last.get()), ctx.pos());
            }
            ctx.restore(afterFirst);
        }

        var members = new ArrayList<ReferenceNode>();
        members.add(first.get());
        // Commas alone do not make an enumeration: "Au I, le A ..." is two clauses.
        int kept = 1;
        int keptEnd = afterFirst;
        while (true) {
            var separator = attempt(keywords(", et", ", ou", ",", "et", "ou"), ctx);
            if (separator.isEmpty()) {
                break;
            }
            var member = attempt(atom, ctx);
            if (member.isEmpty()) {
                break;
            }
            members.add(member.get());
            if (!separator.get().equals(",")) {
                kept = members.size();
                keptEnd = ctx.pos();
            }
        }
        ctx.restore(keptEnd);
        if (kept == 1) {
            return ParseResult.Success.of(first.get(), ctx.pos());
        }
        return ParseResult.Success.of(Enumeration.of(members.subList(0, kept)), ctx.pos());
    }

    // === Portions ===

    private Parser<ReferenceNode> portion() {
        Parser<PortionShape> ordinalFirst = sequence(optionalDeterminer, ordinal, portionNoun,
                                                    (det, index, kind) -> new PortionShape(kind, index));
        Parser<Integer> number = alternative(ordinal, cardinal());
        Parser<PortionShape> nounFirst = sequence(optionalDeterminer, portionNoun, number,
                                                 (det, kind, index) -> new PortionShape(kind, index));
        Parser<PortionShape> either = alternative(ordinalFirst, nounFirst);
        return spanned(either, (shape, span) -> new Portion(span, shape.kind(), shape.index()));
    }

    /**
     * "les deux derniers alinéas", "les premier et deuxième alinéas", "les premier à troisième alinéas".
     */
    private ParseResult<ReferenceNode> portionList(ScanContext ctx) {
        var checkpoint = ctx.save();
        ctx.skipTrivia();
        var start = ctx.pos();
        attempt(optionalDeterminer, ctx);

        var counted = countedPortions(ctx, start);
        if (counted.isPresent()) {
            return ParseResult.Success.of(counted.get(), ctx.pos());
        }

        var indexes = new ArrayList<Integer>();
        var spans = new ArrayList<SourceSpan>();
        boolean range = false;
        while (true) {
            ctx.skipTrivia();
            var tokenStart = indexes.isEmpty() ? start : ctx.pos();
            var index = attempt(ordinal, ctx);
            if (index.isEmpty()) {
                break;
            }
            indexes.add(index.get());
            spans.add(ctx.spanFrom(tokenStart));
            if (range) {
                break;
            }
            var separator = attempt(keywords(", et", ",", "et", "à"), ctx);
            if (separator.isEmpty()) {
                break;
            }
            if (separator.get().equals("à")) {
                if (range || indexes.size() > 1) {
                    break;
                }
                range = true;
            }
        }
        var kind = attempt(portionPlural, ctx);
        if (indexes.size() < 2 || kind.isEmpty()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "portion list");
        }
        var span = ctx.spanFrom(start);
        var members = new ArrayList<ReferenceNode>();
        for (int i = 0; i < indexes.size(); i++) {
            members.add(new Portion(spans.get(i), kind.get(), indexes.get(i)));
        }
        if (range) {
            return ParseResult.Success.of(new BoundedInterval(span, members.get(0), members.get(1)), ctx.pos());
        }
        return ParseResult.Success.of(new Enumeration(span, members), ctx.pos());
    }

    private Optional<ReferenceNode> countedPortions(ScanContext ctx, int start) {
        var checkpoint = ctx.save();
        var size = attempt(count, ctx);
        var direction = size.flatMap(n -> attempt(keywords(Ordinals.pluralWords()), ctx));
        var kind = direction.flatMap(word -> attempt(portionPlural, ctx));
        if (kind.isEmpty()) {
            ctx.restore(checkpoint);
            return Optional.empty();
        }
        var span = ctx.spanFrom(start);
        var fromEnd = Ordinals.normalizePlural(direction.get()).orElseThrow() < 0;
        var firstIndex = fromEnd ? -size.get() : 1;
        return Optional.of(new CountedInterval(span, new Portion(span, kind.get(), firstIndex), size.get()));
    }

    // === Words ===

    /**
     * "les mots : « à taux plein »", "la référence « L. 123-4 » et « L. 123-5 »".
     */
    private ParseResult<ReferenceNode> words(ScanContext ctx) {
        var checkpoint = ctx.save();
        ctx.skipTrivia();
        var start = ctx.pos();
        attempt(optionalDeterminer, ctx);
        if (attempt(keywords(Lexicon.WORDS_NOUNS), ctx).isEmpty()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "words");
        }
        attempt(literal(":"), ctx);
        var citation = CitationGrammar.citation();
        var first = attempt(citation, ctx);
        if (first.isEmpty()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "quoted words");
        }
        var members = new ArrayList<ReferenceNode>();
        members.add(new Words(ctx.spanFrom(start), first.get()));
        while (true) {
            var beforeSeparator = ctx.save();
            if (attempt(keywords(", et", ",", "et", "ou"), ctx).isEmpty()) {
                break;
            }
            var next = attempt(citation, ctx);
            if (next.isEmpty()) {
                ctx.restore(beforeSeparator);
                break;
            }
            members.add(new Words(next.get().span(), next.get()));
        }
        if (members.size() == 1) {
            return ParseResult.Success.of(members.get(0), ctx.pos());
        }
        return ParseResult.Success.of(new Enumeration(ctx.spanFrom(start), members), ctx.pos());
    }

    // === Articles ===

    private Parser<ReferenceNode> article() {
        Parser<String> numbered = sequence(optionalDeterminer, keywords("article", "art."), articleNumber(),
                                           (det, noun, num) -> num);
        return spanned(numbered, (num, span) -> Article.numbered(span, num));
    }

    /**
     * "l'article précédent", "l'article suivant", "le présent article", "le même article".
     */
    private ParseResult<ReferenceNode> relativeArticle(ScanContext ctx) {
        Parser<Integer> following = sequence(keyword("article"), keywords("précédent", "suivant"),
                                             (noun, direction) -> direction.equals("suivant") ? 1 : -1);
        Parser<Integer> current = sequence(keywords("présent", "même"), keyword("article"), (adjective, noun) -> 0);
        Parser<Integer> offset = alternative(following, current);
        Parser<Integer> relative = sequence(optionalDeterminer, offset, (det, value) -> value);
        Parser<ReferenceNode> article = spanned(relative, (value, span) -> Article.relative(span, value));
        return article.parse(ctx);
    }

    /**
     * "les articles 3 et 4", "les articles L. 1 à L. 5".
     */
    private ParseResult<ReferenceNode> articleList(ScanContext ctx) {
        var checkpoint = ctx.save();
        ctx.skipTrivia();
        var start = ctx.pos();
        attempt(optionalDeterminer, ctx);
        if (attempt(keyword("articles"), ctx).isEmpty()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "articles");
        }
        var members = new ArrayList<ReferenceNode>();
        boolean range = false;
        int end = ctx.pos();
        while (true) {
            ctx.skipTrivia();
            var tokenStart = members.isEmpty() ? start : ctx.pos();
            var num = attempt(articleNumber(), ctx);
            if (num.isEmpty()) {
                break;
            }
            members.add(Article.numbered(ctx.spanFrom(tokenStart), num.get()));
            end = ctx.pos();
            if (range) {
                break;
            }
            var separator = attempt(keywords(", et", ",", "et", "à"), ctx);
            if (separator.isEmpty()) {
                break;
            }
            if (separator.get().equals("à")) {
                if (range || members.size() > 1) {
                    break;
                }
                range = true;
            }
        }
        ctx.restore(end);
        range = range && members.size() == 2;
        if (members.isEmpty()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "article number");
        }
        var span = ctx.spanFrom(start);
        if (range) {
            return ParseResult.Success.of(new BoundedInterval(span, members.get(0), members.get(1)), ctx.pos());
        }
        return ParseResult.Success.of(new Enumeration(span, members), ctx.pos());
    }

    private Parser<String> articleNumber() {
        return pattern(ARTICLE_NUMBER, "article number").map(ReferenceGrammar::articleNum);
    }

    private static String articleNum(MatchResult match) {
        var num = match.group(1).replaceAll("\\s+", " ") + match.group(2);
        if (match.group(3) != null) {
            num += " " + match.group(3);
        }
        if (match.group(4) != null) {
            num += " " + match.group(4);
        }
        return num;
    }

    // === Texts ===

    /**
     * "du code général des impôts", "de la loi n° 2020-1721 du 29 décembre 2020", "de la présente loi".
     */
    private ParseResult<ReferenceNode> text(ScanContext ctx) {
        var checkpoint = ctx.save();
        ctx.skipTrivia();
        var start = ctx.pos();
        attempt(optionalDeterminer, ctx);
        ctx.skipTrivia();
        var titleStart = ctx.pos();
        if (attempt(keywords(Lexicon.CURRENT_TEXTS), ctx).isPresent()) {
            var title = ctx.substring(titleStart, ctx.pos());
            return ParseResult.Success.of(new Text(ctx.spanFrom(start), title, Optional.empty()), ctx.pos());
        }
        if (attempt(keywords(Lexicon.TEXT_HEADS), ctx).isEmpty()) {
            ctx.restore(checkpoint);
            return ParseResult.Failure.at(checkpoint, "text");
        }
        var titleEnd = ctx.pos();
        while (true) {
            var word = attempt(pattern(TITLE_WORD, "title word"), ctx);
            if (word.isEmpty() || isStopWord(word.get().group())) {
                ctx.restore(titleEnd);
                break;
            }
            titleEnd = ctx.pos();
        }
        var title = ctx.substring(titleStart, titleEnd).replaceAll("\\s+", " ");
        return ParseResult.Success.of(new Text(ctx.spanFrom(start), title, Lexicon.knownTextId(title)), ctx.pos());
    }

    private static boolean isStopWord(String word) {
        var folded = Ordinals.fold(word);
        return Lexicon.TITLE_STOP_WORDS.stream().anyMatch(stop -> Ordinals.fold(stop).equals(folded));
    }

    // === Divisions ===

    /**
     * "le chapitre II", "du titre Ier", "la section 2", "la première section".
     */
    private Parser<ReferenceNode> typedDivision() {
        Parser<DivisionShape> markedShape = sequence(optionalDeterminer, divisionNoun, pattern(TYPED_MARKER, "division marker"),
                                                   (det, kind, match) -> new DivisionShape(kind, marker(match)));
        Parser<IndexedShape> indexedShape = sequence(optionalDeterminer, ordinal, divisionNoun,
                                                   (det, index, kind) -> new IndexedShape(kind, index));
        Parser<ReferenceNode> marked = spanned(markedShape, (shape, span) -> Division.marked(span, shape.kind(), shape.num()));
        Parser<ReferenceNode> indexed = spanned(indexedShape, (shape, span) -> Division.indexed(span, shape.kind(), shape.index()));
        return alternative(marked, indexed);
    }

    /**
     * Bare markers: "le II", "du A", "au 1°", "le a)", "le a du 1°".
     */
    private Parser<ReferenceNode> item() {
        Parser<MatchResult> standalone = alternative(pattern(UPPER_MARKER, "division marker"),
                                                     pattern(NUMBERED_MARKER, "numbered marker"),
                                                     pattern(LOWER_PAREN_MARKER, "lettered marker"));
        Parser<String> withOptionalDeterminer = sequence(optionalDeterminer, standalone, (det, match) -> marker(match));
        Parser<String> lowerAfterDeterminer = sequence(determiner, pattern(LOWER_MARKER, "lettered marker"),
                                                       (det, match) -> marker(match));
        Parser<String> num = alternative(withOptionalDeterminer, lowerAfterDeterminer);
        return spanned(num, (value, span) -> Division.marked(span, DivisionKind.ITEM, value));
    }

    private static String marker(MatchResult match) {
        return match.group(2) == null ? match.group(1) : match.group(1) + " " + match.group(2);
    }

    private static Parser<Integer> cardinal() {
        return pattern(CARDINAL, "number").map(match -> Integer.parseInt(match.group(1)));
    }

    // === Helpers ===

    private static <T> Optional<T> attempt(Parser<T> parser, ScanContext ctx) {
        return parser.parse(ctx).toOptional();
    }

    private record PortionShape(PortionKind kind, int index) {}

    private record DivisionShape(DivisionKind kind, String num) {}

    private record IndexedShape(DivisionKind kind, int index) {}
}
