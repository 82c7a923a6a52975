package it.aw.legalgraph.nlp;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.snowball.SnowballFilter;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;
import org.tartarus.snowball.ext.RussianStemmer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline basata sugli analyzer Lucene: StandardTokenizer (segmentazione
 * Unicode UAX#29), minuscole, stemming Snowball russo.
 * <p>
 * Lucene non fa POS tagging: i candidati termine sono approssimati con le parole
 * in Title Case che non aprono una frase (in un testo normativo le maiuscole
 * a metà frase marcano quasi sempre sostantivi definiti: "Заказчик", "Оператор").
 */
public class LuceneLanguagePipeline implements LanguagePipeline {

    private static final String FIELD = "text";

    private final Analyzer tokenAnalyzer = new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
            Tokenizer source = new StandardTokenizer();
            return new TokenStreamComponents(source, new LowerCaseFilter(source));
        }
    };

    private final Analyzer lemmaAnalyzer = new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
            Tokenizer source = new StandardTokenizer();
            TokenStream result = new LowerCaseFilter(source);
            result = new SnowballFilter(result, new RussianStemmer());
            return new TokenStreamComponents(source, result);
        }
    };

    private final Analyzer surfaceAnalyzer = new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
            return new TokenStreamComponents(new StandardTokenizer());
        }
    };

    @Override
    public String name() {
        return "lucene";
    }

    @Override
    public List<String> tokenize(String text) throws IOException {
        return terms(tokenAnalyzer, text);
    }

    @Override
    public List<String> lemmatize(String text) throws IOException {
        return terms(lemmaAnalyzer, text);
    }

    @Override
    public List<String> candidateTerms(String text) throws IOException {
        List<String> candidates = new ArrayList<>();
        if (text == null || text.isEmpty()) return candidates;
        try (TokenStream ts = surfaceAnalyzer.tokenStream(FIELD, text)) {
            CharTermAttribute term = ts.addAttribute(CharTermAttribute.class);
            OffsetAttribute offset = ts.addAttribute(OffsetAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                String surface = term.toString();
                if (isTitleCase(surface) && !opensSentence(text, offset.startOffset())) {
                    candidates.add(surface);
                }
            }
            ts.end();
        }
        return candidates;
    }

    private static List<String> terms(Analyzer analyzer, String text) throws IOException {
        List<String> out = new ArrayList<>();
        if (text == null || text.isEmpty()) return out;
        try (TokenStream ts = analyzer.tokenStream(FIELD, text)) {
            CharTermAttribute term = ts.addAttribute(CharTermAttribute.class);
            ts.reset();
            while (ts.incrementToken()) {
                out.add(term.toString());
            }
            ts.end();
        }
        return out;
    }

    static boolean isTitleCase(String token) {
        if (token.length() < 2 || !Character.isUpperCase(token.charAt(0))) return false;
        for (int i = 1; i < token.length(); i++) {
            if (!Character.isLowerCase(token.charAt(i))) return false;
        }
        return true;
    }

    /** Vero se prima del token (saltando gli spazi) c'è l'inizio del testo o un terminatore di frase. */
    static boolean opensSentence(String text, int start) {
        int i = start - 1;
        while (i >= 0 && Character.isWhitespace(text.charAt(i))) i--;
        if (i < 0) return true;
        char c = text.charAt(i);
        return c == '.' || c == '!' || c == '?' || c == '…';
    }
}
