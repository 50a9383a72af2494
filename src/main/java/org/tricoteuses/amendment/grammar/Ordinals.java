package org.tricoteuses.amendment.grammar;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Ordinal words and their signed indexes: positive values are 1-based from the start,
 * negative values count from the end ({@code -1} is "dernier").
 */
public final class Ordinals {
    private Ordinals() {}

    public static final int LAST = -1;

    private static final Map<String, Integer> SINGULAR = new LinkedHashMap<>();
    private static final Map<String, Integer> PLURAL = new LinkedHashMap<>();
    private static final Map<String, Integer> COUNTS = new LinkedHashMap<>();

    /**
     * "3e", "3ème", "1er", "1re", "2nd".
     */
    /**
     * Numerals the grammar accepts; longer digit runs are not ordinals or counts.
     */
    public static final String NUMBER = "[1-9]\\d{0,5}";

    public static final Pattern NUMERIC = Pattern.compile(
        "(" + NUMBER + ")\\s?(?:er|re|ère|ere|e|ème|eme|nd|nde)(?![\\p{L}\\d])");

    static {
        SINGULAR.put("premier", 1);
        SINGULAR.put("première", 1);
        SINGULAR.put("second", 2);
        SINGULAR.put("seconde", 2);
        SINGULAR.put("deuxième", 2);
        SINGULAR.put("troisième", 3);
        SINGULAR.put("quatrième", 4);
        SINGULAR.put("cinquième", 5);
        SINGULAR.put("sixième", 6);
        SINGULAR.put("septième", 7);
        SINGULAR.put("huitième", 8);
        SINGULAR.put("neuvième", 9);
        SINGULAR.put("dixième", 10);
        SINGULAR.put("onzième", 11);
        SINGULAR.put("douzième", 12);
        SINGULAR.put("treizième", 13);
        SINGULAR.put("quatorzième", 14);
        SINGULAR.put("quinzième", 15);
        SINGULAR.put("seizième", 16);
        SINGULAR.put("dix-septième", 17);
        SINGULAR.put("dix-huitième", 18);
        SINGULAR.put("dix-neuvième", 19);
        SINGULAR.put("vingtième", 20);
        SINGULAR.put("dernier", LAST);
        SINGULAR.put("dernière", LAST);
        SINGULAR.put("avant-dernier", -2);
        SINGULAR.put("avant-dernière", -2);
        SINGULAR.put("antépénultième", -3);

        PLURAL.put("premiers", 1);
        PLURAL.put("premières", 1);
        PLURAL.put("derniers", LAST);
        PLURAL.put("dernières", LAST);

        COUNTS.put("deux", 2);
        COUNTS.put("trois", 3);
        COUNTS.put("quatre", 4);
        COUNTS.put("cinq", 5);
        COUNTS.put("six", 6);
        COUNTS.put("sept", 7);
        COUNTS.put("huit", 8);
        COUNTS.put("neuf", 9);
        COUNTS.put("dix", 10);
    }

    /**
     * Singular ordinal words, as a lexicon for keyword matching.
     */
    public static List<String> words() {
        return List.copyOf(SINGULAR.keySet());
    }

    public static List<String> pluralWords() {
        return List.copyOf(PLURAL.keySet());
    }

    public static List<String> countWords() {
        return List.copyOf(COUNTS.keySet());
    }

    /**
     * Signed index of an ordinal word ("dernière" is -1), case and accent insensitive.
     * Numeric forms such as "3e" are accepted too.
     */
    public static Optional<Integer> normalize(String word) {
        var key = fold(word.trim());
        for (var entry : SINGULAR.entrySet()) {
            if (fold(entry.getKey()).equals(key)) {
                return Optional.of(entry.getValue());
            }
        }
        var numeric = NUMERIC.matcher(word.trim());
        if (numeric.matches()) {
            return Optional.of(Integer.parseInt(numeric.group(1)));
        }
        return Optional.empty();
    }

    public static Optional<Integer> normalizePlural(String word) {
        return lookup(PLURAL, word);
    }

    public static Optional<Integer> count(String word) {
        var trimmed = word.trim();
        if (trimmed.matches(NUMBER)) {
            return Optional.of(Integer.parseInt(trimmed));
        }
        return lookup(COUNTS, trimmed);
    }

    private static Optional<Integer> lookup(Map<String, Integer> table, String word) {
        var key = fold(word.trim());
        return table.entrySet()
                    .stream()
                    .filter(entry -> fold(entry.getKey()).equals(key))
                    .map(Map.Entry::getValue)
                    .findFirst();
    }

    static String fold(String text) {
        var decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
        return decomposed.replaceAll("\\p{M}", "").toLowerCase(Locale.ROOT);
    }
}
