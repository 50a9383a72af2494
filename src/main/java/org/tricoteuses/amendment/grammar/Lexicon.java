package org.tricoteuses.amendment.grammar;

import org.tricoteuses.amendment.tree.PortionKind;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Word lists of the reference grammar. Matching is case and accent insensitive, so entries are
 * written the way they appear in legislative texts.
 */
final class Lexicon {
    private Lexicon() {}

    static final List<String> DETERMINERS = List.of(
        "le", "la", "les", "l'",
        "du", "de la", "de l'", "des", "de", "d'",
        "au", "aux", "à la", "à l'",
        "ce", "cet", "cette", "ces");

    /**
     * Determiners that attach a wider scope to what precedes them ("X du Y").
     */
    static final List<String> PARENT_CONNECTORS = List.of("du", "de la", "de l'", "des", "de", "d'", "au", "aux");

    static final Map<String, PortionKind> PORTION_NOUNS = Map.of(
        "alinéa", PortionKind.PARAGRAPH_UNIT,
        "phrase", PortionKind.SENTENCE_UNIT);

    static final Map<String, PortionKind> PORTION_PLURALS = Map.of(
        "alinéas", PortionKind.PARAGRAPH_UNIT,
        "phrases", PortionKind.SENTENCE_UNIT);

    static final List<String> DIVISION_NOUNS = List.of(
        "partie", "livre", "titre", "sous-titre", "chapitre", "section", "sous-section",
        "paragraphe", "sous-paragraphe", "sous-sous-paragraphe");

    static final List<String> WORDS_NOUNS = List.of(
        "mot", "mots", "référence", "références", "chiffre", "chiffres", "nombre", "montant",
        "taux", "date", "année", "somme", "pourcentage", "expression");

    static final List<String> TEXT_HEADS = List.of(
        "code", "loi organique", "loi", "ordonnance", "décret", "constitution",
        "livre des procédures fiscales");

    static final List<String> CURRENT_TEXTS = List.of(
        "présente loi", "présente loi organique", "présente ordonnance", "présent code");

    /**
     * Words that end a text title: the title is over once the sentence continues with a verb or a clause.
     */
    static final List<String> TITLE_STOP_WORDS = List.of(
        "est", "sont", "il", "ils", "ainsi", "qui", "après", "avant", "par", "a", "ont", "dans", "selon",
        "ou", "le", "les", "au", "aux");

    /**
     * Latin multiplicatives appended to markers and article numbers ("III bis", "article 3 ter").
     */
    static final String MULTIPLICATIVE =
        "bis|ter|quater|quinquies|sexies|septies|octies|nonies|novies|decies|undecies|duodecies"
        + "|terdecies|quaterdecies|quindecies|sexdecies|septdecies|octodecies|novodecies|vicies";

    private static final Map<String, String> KNOWN_TEXTS = Map.of(
        "code general des impots", "LEGITEXT000006069577",
        "code civil", "LEGITEXT000006070721",
        "code de la securite sociale", "LEGITEXT000006073189",
        "code du travail", "LEGITEXT000006072050",
        "livre des procedures fiscales", "LEGITEXT000006069583");

    static Optional<String> knownTextId(String title) {
        return Optional.ofNullable(KNOWN_TEXTS.get(Ordinals.fold(title).replaceAll("\\s+", " ")));
    }

    static Optional<PortionKind> portionKind(String noun) {
        return lookup(PORTION_NOUNS, noun).or(() -> lookup(PORTION_PLURALS, noun));
    }

    private static <V> Optional<V> lookup(Map<String, V> table, String word) {
        var key = Ordinals.fold(word);
        return table.entrySet()
                    .stream()
                    .filter(entry -> Ordinals.fold(entry.getKey()).equals(key))
                    .map(Map.Entry::getValue)
                    .findFirst();
    }
}
