package it.aw.legalgraph.nlp;

import org.tartarus.snowball.ext.RussianStemmer;

import java.util.Locale;

/**
 * Normalizzazione morfologica con lo stemmer Snowball russo di Lucene.
 * La "lettura migliore" è lo stem: "договора", "договором" → "договор".
 * Lo stemmer ha stato interno, quindi ne usiamo uno per thread.
 */
public class SnowballMorphologicalAnalyzer implements MorphologicalAnalyzer {

    private final ThreadLocal<RussianStemmer> stemmer = ThreadLocal.withInitial(RussianStemmer::new);

    @Override
    public String name() {
        return "snowball-ru";
    }

    @Override
    public ItemResult<String> normalForm(String token) {
        if (token == null || token.isBlank()) {
            return ItemResult.skipped("token vuoto");
        }
        try {
            RussianStemmer s = stemmer.get();
            s.setCurrent(token.toLowerCase(Locale.ROOT).replace('ё', 'е'));
            s.stem();
            String stem = s.getCurrent();
            return stem.isEmpty() ? ItemResult.skipped("stem vuoto per '" + token + "'") : ItemResult.ok(stem);
        } catch (RuntimeException e) {
            return ItemResult.skipped("stemming fallito per '" + token + "': " + e.getMessage());
        }
    }
}
