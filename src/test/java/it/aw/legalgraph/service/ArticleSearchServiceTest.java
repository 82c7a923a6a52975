package it.aw.legalgraph.service;

import it.aw.legalgraph.graph.KnowledgeStore;
import it.aw.legalgraph.graph.LawVocabulary;
import it.aw.legalgraph.model.ArticleHit;
import it.aw.legalgraph.pages.PageIndexCache;
import it.aw.legalgraph.pages.PageLocator;
import org.apache.jena.rdf.model.Resource;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ArticleSearchServiceTest {

    @TempDir
    Path tmp;

    private KnowledgeStore store;
    private Resource law;

    @BeforeEach
    void setUp() {
        store = KnowledgeStore.open(tmp.resolve("legal_ontology.owl"), LawVocabulary.DEFAULT_NAMESPACE, 50);
        law = store.addLaw("act", "Civil act", null);
    }

    @Test
    void pagesComeFromTheSourcePdf() throws Exception {
        Path pdf = writePdf(tmp.resolve("act.pdf"), "Contents", "Article 1 General rules", "Article 2 Scope of the act");
        store.addArticle("act_article_1", null, "1", "General rules\nThe act applies to contracts.", law, null);
        store.addArticle("act_article_2", null, "2", "Scope of the act\nContracts of supply.", law, null);
        ArticleSearchService service = new ArticleSearchService(store, new PageLocator(new PageIndexCache()),
                lawId -> "act".equals(lawId) ? Optional.of(pdf) : Optional.empty());

        List<ArticleHit> hits = service.search("contracts");

        assertEquals(2, hits.size());
        for (ArticleHit hit : hits) {
            assertEquals("act", hit.lawId());
            assertEquals("Civil act", hit.lawTitle());
            assertEquals("act.pdf", hit.sourceFilename());
            assertEquals("1".equals(hit.articleNumber()) ? 2 : 3, hit.page());
        }

        ArticleHit single = service.article("act", "2").orElseThrow();
        assertEquals(3, single.page());
        assertEquals("Scope of the act", single.articleTitle());
        assertEquals(LawVocabulary.DEFAULT_NAMESPACE + "act_article_2", single.articleUri());
    }

    @Test
    void graphPageWinsAndMissingSourceLeavesPageEmpty() {
        store.addArticle("act_article_1", null, "1", "Supply of goods", law, 7);
        store.addArticle("act_article_2", null, "2", "Supply of services", law, null);
        ArticleSearchService service = new ArticleSearchService(store, new PageLocator(new PageIndexCache()),
                lawId -> Optional.empty());

        List<ArticleHit> hits = service.search("  supply ");

        assertEquals(2, hits.size());
        ArticleHit first = hits.stream().filter(h -> "1".equals(h.articleNumber())).findFirst().orElseThrow();
        ArticleHit second = hits.stream().filter(h -> "2".equals(h.articleNumber())).findFirst().orElseThrow();
        assertEquals(7, first.page());
        assertNull(second.page());
        assertNull(second.sourceFilename());
        assertTrue(service.search(" ").isEmpty());
        assertTrue(service.article("act", "99").isEmpty());
    }

    @Test
    void eachLawIsResolvedOnceEvenWithoutSource() {
        store.addArticle("act_article_1", null, "1", "Supply of goods", law, null);
        store.addArticle("act_article_2", null, "2", "Supply of services", law, null);
        store.addArticle("act_article_3", null, "3", "Supply of works", law, 4);
        AtomicInteger lookups = new AtomicInteger();
        ArticleSearchService service = new ArticleSearchService(store, new PageLocator(new PageIndexCache()),
                lawId -> {
                    lookups.incrementAndGet();
                    return Optional.empty();
                });

        List<ArticleHit> hits = service.search("supply");

        assertEquals(3, hits.size());
        assertEquals(1, lookups.get());
    }

    @Test
    void articleTitleSkipsBoilerplateLines() {
        String text = "\n  www.Consultant.ru  \n(в ред. Федерального закона от 01.01.2020)\nПредмет регулирования\nТекст";

        assertEquals("Предмет регулирования", ArticleSearchService.articleTitle(text));
        assertNull(ArticleSearchService.articleTitle("x".repeat(141)));
        assertNull(ArticleSearchService.articleTitle(""));
        assertNull(ArticleSearchService.articleTitle(null));
    }

    @Test
    void lawIdIsTheUriFragment() {
        assertEquals("zakon_1", ArticleSearchService.fragment("http://law.ontology.ru/#zakon_1"));
        assertEquals("zakon_2", ArticleSearchService.fragment("http://law.ontology.ru/zakon_2"));
        assertNull(ArticleSearchService.fragment(null));
    }

    private static Path writePdf(Path file, String... pageLines) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            for (String line : pageLines) {
                PDPage page = new PDPage();
                doc.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(doc, page)) {
                    content.beginText();
                    content.setFont(PDType1Font.HELVETICA, 12);
                    content.newLineAtOffset(50, 700);
                    content.showText(line);
                    content.endText();
                }
            }
            doc.save(file.toFile());
        }
        return file;
    }
}
