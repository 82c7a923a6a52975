package it.aw.legalgraph.nlp;

import it.aw.legalgraph.model.ExtractedEntities;
import it.aw.legalgraph.model.KeyTerm;
import it.aw.legalgraph.model.ReferenceMatch;
import it.aw.legalgraph.model.ReferenceType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class LinguisticAnalyzerTest {

    private static final String LAW_TEXT = """
            Статья 1. Заказчик обязан заключить договор поставки. Договор поставки заключается
            в письменной форме. Поставщик исполняет договор в срок, если иное не установлено.
            Статья 2. Заказчик вправе расторгнуть договор согласно статье 1, а поставщик вправе
            требовать оплаты. Код и для как что это.
            """;

    private final LinguisticAnalyzer regexOnly = new LinguisticAnalyzer(
            AnalysisLimits.defaults(), Optional.empty(), Optional.empty(), true);

    private final LinguisticAnalyzer full = new LinguisticAnalyzer(
            AnalysisLimits.defaults(),
            Optional.of(new LuceneLanguagePipeline()),
            Optional.of(new SnowballMorphologicalAnalyzer()),
            true);

    @Test
    void emptyTextHasNoLemmas() {
        assertTrue(regexOnly.lemmatize("").isEmpty());
        assertTrue(full.lemmatize("").isEmpty());
        assertTrue(full.tokenize("").isEmpty());
    }

    @Test
    void tokenizationIsIdempotent() {
        String text = "Договор поставки 44 заключен Заказчиком";
        for (LinguisticAnalyzer analyzer : List.of(regexOnly, full)) {
            List<String> tokens = analyzer.tokenize(text);
            assertEquals(List.of("договор", "поставки", "44", "заключен", "заказчиком"), tokens);
            assertEquals(tokens, analyzer.tokenize(String.join(" ", tokens)));
        }
    }

    @Test
    void morphologyNormalizesInflectedForms() {
        List<String> lemmas = full.lemmatize("договора договором договор");

        assertEquals(3, lemmas.size());
        assertEquals(1, lemmas.stream().distinct().count());
    }

    @Test
    void keyTermsAreLongNotStopListedAndRanked() {
        for (LinguisticAnalyzer analyzer : List.of(regexOnly, full)) {
            List<KeyTerm> terms = analyzer.findKeyTerms(LAW_TEXT, 20);

            assertFalse(terms.isEmpty());
            for (int i = 0; i < terms.size(); i++) {
                KeyTerm t = terms.get(i);
                assertTrue(t.term().length() > 3, t.term());
                assertFalse(LinguisticAnalyzer.STOP_WORDS.contains(t.term()), t.term());
                if (i > 0) assertTrue(terms.get(i - 1).frequency() >= t.frequency());
            }
        }
    }

    @Test
    void keyTermTiesKeepFirstSeenOrder() {
        List<KeyTerm> terms = regexOnly.findKeyTerms("поставка договор договор поставка код код код и и и", 5);

        assertEquals(List.of(new KeyTerm("поставка", 2), new KeyTerm("договор", 2)), terms);
    }

    @Test
    void keyTermCountingIsCappedByBulkThreshold() {
        LinguisticAnalyzer capped = new LinguisticAnalyzer(
                new AnalysisLimits(400_000, 20), Optional.empty(), Optional.empty(), false);

        List<KeyTerm> terms = capped.findKeyTerms("договор ".repeat(1000), 5);

        assertEquals("договор", terms.get(0).term());
        assertEquals(2, terms.get(0).frequency());
    }

    @Test
    void fourReferenceConnectives() {
        String text = "Действует в соответствии с Законом № 5; согласно статье 7. "
                + "Применяется в силу пункта 3, на основании статьи 9";

        List<ReferenceMatch> refs = regexOnly.extractReferences(text);

        assertEquals(4, refs.size());
        assertEquals(ReferenceType.ACCORDANCE, refs.get(0).type());
        assertEquals("Законом № 5", refs.get(0).text());
        assertEquals(10, refs.get(0).position());
        assertEquals("статье 7", refs.get(1).text());
        assertEquals(ReferenceType.BY_VIRTUE_OF, refs.get(2).type());
        assertEquals("пункта 3", refs.get(2).text());
        assertEquals("статьи 9", refs.get(3).text());
        assertEquals("основание", refs.get(3).type().label());
    }

    @Test
    void entityFamilies() {
        String text = "Федеральный закон от 05.04.2013 № 44-ФЗ и ГК РФ, статья 5, ст. 7, пункт 2. Дата 05.04.2013.";

        ExtractedEntities entities = regexOnly.extractEntities(text);

        assertEquals(2, entities.laws().size());
        assertTrue(entities.laws().get(0).endsWith("№ 44-ФЗ"));
        assertEquals("ГК РФ", entities.laws().get(1));
        assertEquals(List.of("5", "7", "2"), entities.articles());
        assertEquals(List.of("05.04.2013"), entities.dates());
        assertTrue(entities.terms().isEmpty());
    }

    @Test
    void candidateTermsComeFromThePipeline() {
        ExtractedEntities entities = full.extractEntities("Стороны назначают Оператора. Стороны уведомляют Оператора и Заказчика.");

        assertEquals(List.of("Оператора", "Заказчика"), entities.terms());
    }

    @Test
    void textOverSafeThresholdNeverReachesThePipeline() {
        CountingPipeline pipeline = new CountingPipeline(false);
        LinguisticAnalyzer analyzer = new LinguisticAnalyzer(
                new AnalysisLimits(10, 1_000), Optional.of(pipeline), Optional.empty(), true);

        List<String> tokens = analyzer.tokenize("Договор поставки заключен");

        assertEquals(List.of("договор", "поставки", "заключен"), tokens);
        assertEquals(0, pipeline.calls.get());
    }

    @Test
    void failingPipelineDegradesToRegex() {
        CountingPipeline pipeline = new CountingPipeline(true);
        LinguisticAnalyzer analyzer = new LinguisticAnalyzer(
                AnalysisLimits.defaults(), Optional.of(pipeline), Optional.empty(), true);

        assertEquals(List.of("договор", "поставки"), analyzer.tokenize("Договор поставки"));
        assertEquals(List.of("договор", "поставки"), analyzer.lemmatize("Договор поставки"));
        assertTrue(analyzer.extractEntities("Договор с Заказчиком").terms().isEmpty());
        assertEquals(4, pipeline.calls.get());
    }

    private static final class CountingPipeline implements LanguagePipeline {

        final AtomicInteger calls = new AtomicInteger();
        private final boolean failing;

        CountingPipeline(boolean failing) {
            this.failing = failing;
        }

        @Override
        public String name() {
            return "counting";
        }

        @Override
        public List<String> tokenize(String text) throws IOException {
            return answer();
        }

        @Override
        public List<String> lemmatize(String text) throws IOException {
            return answer();
        }

        @Override
        public List<String> candidateTerms(String text) throws IOException {
            return answer();
        }

        private List<String> answer() throws IOException {
            calls.incrementAndGet();
            if (failing) throw new IOException("pipeline non disponibile");
            return List.of("pipeline");
        }
    }
}
