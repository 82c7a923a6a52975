package it.aw.legalgraph.service;

import it.aw.legalgraph.graph.KnowledgeStore;
import it.aw.legalgraph.graph.LawVocabulary;
import it.aw.legalgraph.model.Identifiers;
import it.aw.legalgraph.model.IngestionSummary;
import it.aw.legalgraph.model.ReferenceType;
import it.aw.legalgraph.nlp.AnalysisLimits;
import it.aw.legalgraph.nlp.LinguisticAnalyzer;
import it.aw.legalgraph.nlp.SnowballMorphologicalAnalyzer;
import it.aw.legalgraph.parser.MarkupDocumentParser;
import it.aw.legalgraph.parser.PlainTextDocumentParser;
import it.aw.legalgraph.parser.StructuralParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IngestionServiceTest {

    @TempDir
    Path tmp;

    private KnowledgeStore store;
    private StructuralParser parser;
    private LinguisticAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        store = KnowledgeStore.open(tmp.resolve("graph/legal_ontology.owl"), LawVocabulary.DEFAULT_NAMESPACE, 50);
        parser = new StructuralParser(List.of(new PlainTextDocumentParser(), new MarkupDocumentParser()));
        analyzer = new LinguisticAnalyzer(AnalysisLimits.defaults(), Optional.empty(),
                Optional.of(new SnowballMorphologicalAnalyzer()), false);
    }

    private IngestionService service(int keyTerms) {
        return new IngestionService(parser, analyzer, store, keyTerms);
    }

    @Test
    void plainTextDocumentEndToEnd() throws Exception {
        Path file = Files.writeString(tmp.resolve("Zakon o teste.txt"), "Статья 1. Текст один. Статья 2. Текст два.");

        IngestionSummary summary = service(20).ingest(file);

        assertEquals("Zakon_o_teste", summary.lawId());
        assertEquals(LawVocabulary.DEFAULT_NAMESPACE + "Zakon_o_teste", summary.lawUri());
        assertEquals(2, summary.articlesCount());
        assertEquals(0, summary.chaptersCount());

        Map<String, String> first = store.findArticle(Identifiers.articleId(summary.lawId(), "1")).orElseThrow();
        assertEquals("Текст один.", first.get("text"));
        Map<String, String> second = store.findArticle(Identifiers.articleId(summary.lawId(), "2")).orElseThrow();
        assertEquals("Текст два.", second.get("text"));
        assertTrue(Files.exists(store.graphFile()));
    }

    @Test
    void bodyOnlyWordIsFoundByTextFallback() throws Exception {
        Path file = Files.writeString(tmp.resolve("kodeks.txt"), "Статья 1. Текст один. Статья 2. Текст два.");
        service(1).ingest(file);

        assertEquals(1, store.statistics().terms());
        List<Map<String, String>> rows = store.searchArticlesByTerm("один");

        assertEquals(1, rows.size());
        assertEquals("1", rows.get(0).get("article_number"));
    }

    @Test
    void chaptersTermsAndReferences() throws Exception {
        Path file = Files.writeString(tmp.resolve("postavka.txt"), """
                Глава 1. Общие положения
                Статья 1. Поставщик передает товар покупателю.
                Статья 2. Покупатель оплачивает товар согласно статье 1. Поставщик вправе требовать оплаты.
                """);

        IngestionSummary summary = service(20).ingest(file);

        assertEquals(1, summary.chaptersCount());
        assertEquals(2, summary.articlesCount());
        assertTrue(summary.termsCount() > 0);
        assertEquals(1, summary.references().size());
        assertEquals(ReferenceType.ACCORDING_TO, summary.references().get(0).type());

        String a1 = store.getArticleByNumber("postavka", "1").orElseThrow();
        String a2 = store.getArticleByNumber("postavka", "2").orElseThrow();
        assertEquals(List.of(a1), store.getReferencedArticles(a2));
        assertEquals(List.of(a1), store.getReferencedArticles(a1));

        List<Map<String, String>> contained = store.query(store.vocabulary().sparqlPrefix() + """
                SELECT ?article WHERE {
                    law:postavka_chapter_1 law:containsArticle ?article .
                }
                """);
        assertEquals(2, contained.size());

        List<Map<String, String>> byTerm = store.searchArticlesByTerm("поставщик");
        assertFalse(byTerm.isEmpty());
    }

    @Test
    void termsAreLinkedAsUsageOnly() throws Exception {
        Path file = Files.writeString(tmp.resolve("d.txt"), "Статья 1. Поставщик передает товар покупателю.");

        IngestionSummary summary = service(20).ingest(file);

        assertTrue(summary.termsCount() > 0);
        String prefix = store.vocabulary().sparqlPrefix();
        assertTrue(store.query(prefix + """
                SELECT ?a ?t WHERE { ?a law:definesTerm ?t . }
                """).isEmpty());
        List<Map<String, String>> uses = store.query(prefix + """
                SELECT ?t WHERE { law:d_article_1 law:usesTerm ?t . }
                """);
        String supplier = store.vocabulary().uri(Identifiers.termId("поставщик"));
        assertTrue(uses.stream().anyMatch(row -> supplier.equals(row.get("t"))));
    }

    @Test
    void reingestionIsAdditiveWithStableIds() throws Exception {
        Path file = Files.writeString(tmp.resolve("kodeks.txt"), "Статья 1. Текст один. Статья 2. Текст два.");
        IngestionService service = service(5);

        service.ingest(file);
        long triples = store.size();
        service.ingest(file);

        assertEquals(triples, store.size());
        assertEquals(2, store.statistics().articles());
    }

    @Test
    void lawDateIsFirstValidDateInTitle() {
        assertEquals(LocalDate.of(2013, 4, 5), IngestionService.lawDate("ФЗ от 31.02.2020 и 05.04.2013"));
        assertNull(IngestionService.lawDate("Кодекс без даты"));
        assertNull(IngestionService.lawDate(null));
    }
}
