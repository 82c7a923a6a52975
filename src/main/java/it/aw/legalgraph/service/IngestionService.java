package it.aw.legalgraph.service;

import it.aw.legalgraph.graph.KnowledgeStore;
import it.aw.legalgraph.model.ExtractedEntities;
import it.aw.legalgraph.model.Identifiers;
import it.aw.legalgraph.model.IngestionSummary;
import it.aw.legalgraph.model.KeyTerm;
import it.aw.legalgraph.model.ParsedArticle;
import it.aw.legalgraph.model.ParsedChapter;
import it.aw.legalgraph.model.ParsedDocument;
import it.aw.legalgraph.model.ReferenceMatch;
import it.aw.legalgraph.nlp.LinguisticAnalyzer;
import it.aw.legalgraph.parser.StructuralParser;
import org.apache.jena.rdf.model.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ingestione di un atto normativo nel grafo di conoscenza.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Parse: StructuralParser produce titolo, capi, articoli e testo completo</li>
 *   <li>Struttura: Law, Chapter e Article con id derivati dal nome file</li>
 *   <li>Analisi: entità, rinvii e termini chiave sul testo completo</li>
 *   <li>Termini: i primi N termini chiave diventano Term e sono collegati agli articoli
 *       il cui testo lemmatizzato li contiene</li>
 *   <li>Rinvii: il primo numero di ogni rinvio, se è un articolo dello stesso documento,
 *       diventa un arco references da ogni articolo del documento</li>
 *   <li>Salvataggio del grafo</li>
 * </ol>
 * L'ingestione non è transazionale: un errore a metà lascia il grafo in memoria
 * modificato ma non salvato, e va ripetuta da capo.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private static final Pattern FIRST_NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final Pattern TITLE_DATE = Pattern.compile("\\b(\\d{1,2})\\.(\\d{1,2})\\.(\\d{4})\\b");

    private final StructuralParser parser;
    private final LinguisticAnalyzer analyzer;
    private final KnowledgeStore store;
    private final int keyTermsCount;

    public IngestionService(StructuralParser parser,
                            LinguisticAnalyzer analyzer,
                            KnowledgeStore store,
                            @Value("${legalgraph.ingest.key-terms:20}") int keyTermsCount) {
        this.parser = parser;
        this.analyzer = analyzer;
        this.store = store;
        this.keyTermsCount = keyTermsCount;
    }

    public IngestionSummary ingest(Path file) {
        log.info("Inizio ingestione: {}", file);

        // [1] Parse
        ParsedDocument doc = parser.parse(file);
        String lawId = Identifiers.lawId(file);

        // [2] Struttura
        Resource law = store.addLaw(lawId, doc.title(), lawDate(doc.title()));

        Map<String, Resource> chapters = new LinkedHashMap<>();
        Resource lastChapter = null;
        for (ParsedChapter c : doc.chapters()) {
            lastChapter = store.addChapter(Identifiers.chapterId(lawId, c.number()), law, c.number(), c.title());
            chapters.put(c.number(), lastChapter);
        }

        // Euristica: con capi presenti, ogni articolo va all'ultimo capo aggiunto.
        Map<String, Resource> articles = new LinkedHashMap<>();
        Map<String, String> articleTexts = new LinkedHashMap<>();
        for (ParsedArticle a : doc.articles()) {
            Resource node = store.addArticle(Identifiers.articleId(lawId, a.number()),
                    lastChapter, a.number(), a.text(), law, a.page());
            articles.put(a.number(), node);
            articleTexts.putIfAbsent(a.number(), a.text());
        }
        log.debug("Struttura {}: {} capi, {} articoli", lawId, chapters.size(), articles.size());

        // [3] Analisi
        ExtractedEntities entities = analyzer.extractEntities(doc.fullText());
        List<ReferenceMatch> references = analyzer.extractReferences(doc.fullText());
        List<KeyTerm> keyTerms = analyzer.findKeyTerms(doc.fullText(), keyTermsCount);

        // [4] Termini
        Map<String, Resource> terms = new LinkedHashMap<>();
        for (KeyTerm kt : keyTerms) {
            terms.put(kt.term(), store.addTerm(Identifiers.termId(kt.term()), kt.term()));
        }
        int links = 0;
        for (Map.Entry<String, Resource> article : articles.entrySet()) {
            List<String> lemmas = analyzer.lemmatize(articleTexts.get(article.getKey()));
            if (lemmas.isEmpty()) continue;
            for (Map.Entry<String, Resource> term : terms.entrySet()) {
                // collegamento sempre come uso: l'ingestione non distingue le definizioni
                if (lemmas.contains(term.getKey())) {
                    store.linkTermToArticle(article.getValue(), term.getValue(), false);
                    links++;
                }
            }
        }
        log.debug("Termini {}: {} registrati, {} collegamenti ad articoli", lawId, terms.size(), links);

        // [5] Rinvii interni
        int edges = 0;
        for (ReferenceMatch ref : references) {
            Matcher m = FIRST_NUMBER.matcher(ref.text());
            if (!m.find()) continue;
            Resource target = articles.get(m.group());
            if (target == null) continue;
            for (Resource from : articles.values()) {
                store.addReference(from, target, null);
                edges++;
            }
        }
        log.debug("Analisi {}: {} entità, {} rinvii trovati, {} archi aggiunti",
                lawId, entities.total(), references.size(), edges);

        // [6] Salvataggio
        store.save();

        log.info("Ingestione completata: {} ({} articoli, {} capi, {} termini)",
                lawId, articles.size(), chapters.size(), terms.size());
        return new IngestionSummary(lawId, law.getURI(), articles.size(), chapters.size(), terms.size(),
                entities, references, keyTerms);
    }

    /** Prima data G.M.AAAA valida nel titolo, null se assente. */
    static LocalDate lawDate(String title) {
        if (title == null) return null;
        Matcher m = TITLE_DATE.matcher(title);
        while (m.find()) {
            try {
                return LocalDate.of(Integer.parseInt(m.group(3)), Integer.parseInt(m.group(2)),
                        Integer.parseInt(m.group(1)));
            } catch (DateTimeException e) {
                log.debug("Data non valida nel titolo: {}", m.group());
            }
        }
        return null;
    }
}
