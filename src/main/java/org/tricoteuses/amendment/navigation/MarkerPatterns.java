package org.tricoteuses.amendment.navigation;

import org.tricoteuses.amendment.grammar.ReferenceGrammar;
import org.tricoteuses.amendment.tree.DivisionKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * How division markers appear at the start of document blocks ("II. –", "A.-", "1°", "a)",
 * "Chapitre II").
 */
public final class MarkerPatterns {
    private MarkerPatterns() {}

    private static final List<String> ITEM_SUFFIXES = List.of(".-", ". -", ".–", ". –", " -", " –", ".", "°", ")");

    private static final String MULTIPLICATIVE = ReferenceGrammar.MULTIPLICATIVE;

    private static final Pattern MULTIPLICATIVE_NEXT = Pattern.compile("\\s+(?:" + MULTIPLICATIVE + ")(?![\\p{L}\\d])");

    private static final Pattern ITEM_LABEL = Pattern.compile(
        "^\\s*((?:[IVXLCDM]+|[A-Z]|\\d+|[a-z])(?:\\s(?:" + MULTIPLICATIVE + "))?)"
        + "(?:\\s?\\.\\s?[-–—]|\\s?°|(?:\\s[-–—]|\\.|\\))(?=\\s|$))");

    private static final Pattern NOUN_LABEL = Pattern.compile(
        "^\\s*((?iu:partie|livre|titre|sous-titre|chapitre|section|sous-section|paragraphe|sous-paragraphe"
        + "|sous-sous-paragraphe))\\s+([IVXLCDM]+|\\d+|[A-Z])(?:er|re)?(?:\\s(" + MULTIPLICATIVE + "))?(?![\\p{L}\\d])"
        + "\\s*(?:[.:]\\s?[-–—]?|[-–—])?\\s*");

    /**
     * Kinds of marker, coarsest first. A division ends at the next block whose marker is of the same
     * family or a coarser one.
     */
    public enum Family {
        NOUN,
        ROMAN,
        CAPITAL,
        NUMBER,
        LOWER
    }

    /**
     * Marker opening a block.
     *
     * @param family      marker family
     * @param kind        division noun for {@link Family#NOUN}, {@link DivisionKind#ITEM} otherwise
     * @param value       marker text without its punctuation ("II", "3 bis", "a")
     * @param labelLength chars of the block text taken by the label and the blanks after it
     */
    public record Marker(Family family, DivisionKind kind, String value, int labelLength) {

        /**
         * Whether a block opening with {@code next} closes the division this marker opened.
         */
        public boolean isClosedBy(Marker next) {
            if (family == Family.NOUN) {
                return next.family() == Family.NOUN && next.kind().ordinal() <= kind.ordinal();
            }
            return next.family().ordinal() <= family.ordinal();
        }
    }

    /**
     * Prefixes under which {@code marker} may open a block.
     */
    public static List<String> surfaceForms(String marker, DivisionKind kind) {
        var forms = new ArrayList<String>();
        if (kind == DivisionKind.ITEM) {
            for (var suffix : ITEM_SUFFIXES) {
                forms.add(marker + suffix);
            }
            // "1° bis": the degree sign sits between the number and its multiplicative
            var parts = marker.split(" ", 2);
            if (parts.length == 2 && parts[0].chars().allMatch(Character::isDigit)) {
                forms.add(parts[0] + "° " + parts[1]);
            }
            return forms;
        }
        forms.add(kind.noun() + " " + marker);
        if (marker.equals("I") || marker.equals("1")) {
            forms.add(kind.noun() + " " + marker + "er");
        }
        return forms;
    }

    /**
     * Whether {@code text} opens with one of the surface forms of {@code marker}.
     */
    public static boolean startsWithMarker(String text, String marker, DivisionKind kind) {
        var trimmed = text.stripLeading();
        for (var form : surfaceForms(marker, kind)) {
            if (regionMatches(trimmed, form, kind != DivisionKind.ITEM) && isBoundary(trimmed, form)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Label opening {@code text}, if any.
     */
    public static Optional<Marker> leadingMarker(String text) {
        var noun = NOUN_LABEL.matcher(text);
        if (noun.lookingAt()) {
            var kind = DivisionKind.fromNoun(noun.group(1).toLowerCase(Locale.ROOT));
            if (kind.isPresent()) {
                var value = noun.group(3) == null ? noun.group(2) : noun.group(2) + " " + noun.group(3);
                return Optional.of(new Marker(Family.NOUN, kind.get(), value, noun.end()));
            }
        }
        var item = ITEM_LABEL.matcher(text);
        if (!item.lookingAt()) {
            return Optional.empty();
        }
        var value = item.group(1);
        int end = item.end();
        while (end < text.length() && Character.isWhitespace(text.charAt(end))) {
            end++;
        }
        return Optional.of(new Marker(familyOf(value), DivisionKind.ITEM, value, end));
    }

    /**
     * Chars taken by the leading label of {@code text}, 0 when it has none.
     */
    public static int labelLength(String text) {
        return leadingMarker(text).map(Marker::labelLength).orElse(0);
    }

    /**
     * Family of a bare item marker. Single letters other than I, V and X count as capital letters.
     */
    public static Family familyOf(String marker) {
        var base = marker.split("\\s", 2)[0];
        if (base.chars().allMatch(Character::isDigit)) {
            return Family.NUMBER;
        }
        if (base.length() == 1 && Character.isLowerCase(base.charAt(0))) {
            return Family.LOWER;
        }
        if (base.length() == 1) {
            return "IVX".indexOf(base.charAt(0)) >= 0 ? Family.ROMAN : Family.CAPITAL;
        }
        return base.chars().allMatch(c -> "IVXLCDM".indexOf(c) >= 0) ? Family.ROMAN : Family.CAPITAL;
    }

    private static boolean regionMatches(String text, String form, boolean ignoreCase) {
        return text.regionMatches(ignoreCase, 0, form, 0, form.length());
    }

    /**
     * The form must not be the head of a longer marker: "Titre I" does not open "Titre II" and "1°"
     * does not open "1° bis". A form ending in punctuation may be glued to the text ("II.-Le taux").
     */
    private static boolean isBoundary(String text, String form) {
        int offset = form.length();
        if (offset >= text.length()) {
            return true;
        }
        var next = text.charAt(offset);
        var last = form.charAt(form.length() - 1);
        if (Character.isLetterOrDigit(last) && (Character.isLetterOrDigit(next) || next == '°')) {
            return false;
        }
        if (last == '.' && Character.isDigit(next)) {
            return false;
        }
        var rest = MULTIPLICATIVE_NEXT.matcher(text);
        rest.region(offset, text.length());
        return !rest.lookingAt();
    }
}
