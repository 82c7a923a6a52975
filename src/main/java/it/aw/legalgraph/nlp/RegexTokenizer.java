package it.aw.legalgraph.nlp;

import java.util.List;
import java.util.Locale;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tokenizzatore leggero a confini di parola: sempre disponibile, lineare
 * nella lunghezza del testo, nessuna struttura ausiliaria oltre ai token.
 * I token sono in minuscolo; \w include cifre e underscore.
 */
public final class RegexTokenizer {

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private RegexTokenizer() {}

    /** Sequenza lazy: i token sono prodotti man mano che lo stream viene consumato. */
    public static Stream<String> tokens(String text) {
        if (text == null || text.isEmpty()) return Stream.empty();
        return WORD.matcher(text.toLowerCase(Locale.ROOT)).results().map(MatchResult::group);
    }

    public static List<String> tokenize(String text) {
        return tokens(text).collect(Collectors.toList());
    }
}
