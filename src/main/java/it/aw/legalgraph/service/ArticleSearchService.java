package it.aw.legalgraph.service;

import it.aw.legalgraph.graph.KnowledgeStore;
import it.aw.legalgraph.model.ArticleHit;
import it.aw.legalgraph.model.Identifiers;
import it.aw.legalgraph.pages.PageLocator;
import it.aw.legalgraph.pages.PdfPagedSource;
import it.aw.legalgraph.parser.DocumentFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ricerca di articoli per termine, arricchita con titolo dell'articolo e pagina.
 * <p>
 * La pagina viene dal grafo quando l'articolo ne ha una; altrimenti, per le sorgenti
 * PDF, dal {@link PageLocator}. I numeri mancanti sono raggruppati per documento,
 * così ogni PDF viene scansionato una sola volta per ricerca.
 */
@Service
public class ArticleSearchService {

    private static final Logger log = LoggerFactory.getLogger(ArticleSearchService.class);

    private static final int TITLE_MAX_LENGTH = 140;
    private static final Pattern EDITION_LINE = Pattern.compile("^\\(.*ред\\..*\\)$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private final KnowledgeStore store;
    private final PageLocator pageLocator;
    private final SourceDocumentResolver sources;

    public ArticleSearchService(KnowledgeStore store, PageLocator pageLocator, SourceDocumentResolver sources) {
        this.store = store;
        this.pageLocator = pageLocator;
        this.sources = sources;
    }

    /**
     * @param query testo cercato tra i termini del grafo e nel testo degli articoli
     * @return risultati nell'ordine restituito dal grafo
     */
    public List<ArticleHit> search(String query) {
        if (query == null || query.isBlank()) return List.of();
        List<Map<String, String>> rows = store.searchArticlesByTerm(query.strip());

        Map<String, Set<String>> missingPages = new LinkedHashMap<>();
        for (Map<String, String> row : rows) {
            String lawId = fragment(row.get("law"));
            String number = row.get("article_number");
            if (row.get("page") == null && lawId != null && number != null) {
                missingPages.computeIfAbsent(lawId, k -> new LinkedHashSet<>()).add(number);
            }
        }

        // ogni legge è risolta una sola volta, anche quando il file manca
        Map<String, Optional<Path>> sourceFiles = new LinkedHashMap<>();
        for (Map<String, String> row : rows) {
            String lawId = fragment(row.get("law"));
            if (lawId != null) sourceFiles.computeIfAbsent(lawId, sources::resolve);
        }

        Map<String, Map<String, Integer>> located = new LinkedHashMap<>();
        for (Map.Entry<String, Set<String>> e : missingPages.entrySet()) {
            located.put(e.getKey(), locatePages(sourceFiles.get(e.getKey()), e.getValue()));
        }

        List<ArticleHit> hits = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            String lawId = fragment(row.get("law"));
            String number = row.get("article_number");
            Integer page = parsePage(row.get("page"));
            if (page == null && lawId != null) {
                page = located.getOrDefault(lawId, Map.of()).get(number);
            }
            Path source = lawId != null ? sourceFiles.get(lawId).orElse(null) : null;
            hits.add(new ArticleHit(
                    row.get("article"),
                    number,
                    row.get("article_text"),
                    articleTitle(row.get("article_text")),
                    row.get("law"),
                    lawId,
                    row.get("law_title"),
                    page,
                    source != null ? source.getFileName().toString() : null));
        }
        log.info("Ricerca '{}': {} risultati, pagine cercate in {} documenti", query, hits.size(), missingPages.size());
        return hits;
    }

    /** Un singolo articolo dato lawId e numero. */
    public Optional<ArticleHit> article(String lawId, String number) {
        String articleId = Identifiers.articleId(lawId, number);
        Optional<Map<String, String>> found = store.findArticle(articleId);
        if (found.isEmpty()) return Optional.empty();
        Map<String, String> row = found.get();

        Optional<Path> source = sources.resolve(lawId);
        Integer page = parsePage(row.get("page"));
        if (page == null) {
            page = locatePages(source, Set.of(row.get("number"))).get(row.get("number"));
        }
        return Optional.of(new ArticleHit(
                store.vocabulary().uri(articleId),
                row.get("number"),
                row.get("text"),
                articleTitle(row.get("text")),
                store.vocabulary().uri(lawId),
                lawId,
                store.lawTitle(lawId).orElse(null),
                page,
                source.map(p -> p.getFileName().toString()).orElse(null)));
    }

    private Map<String, Integer> locatePages(Optional<Path> source, Set<String> numbers) {
        if (source.isEmpty() || !DocumentFormat.PDF.extension().equals(Identifiers.extension(source.get()))) {
            return Map.of();
        }
        return pageLocator.locate(new PdfPagedSource(source.get()), numbers);
    }

    /**
     * Prima riga non vuota del testo, saltando le righe di servizio (link consultant,
     * "(ред. ...)"). Null se la riga è troppo lunga per essere un titolo.
     */
    static String articleTitle(String text) {
        if (text == null || text.isEmpty()) return null;
        for (String raw : text.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty()) continue;
            if (line.toLowerCase(Locale.ROOT).contains("www.consultant")) continue;
            if (EDITION_LINE.matcher(line).find()) continue;
            return line.length() > TITLE_MAX_LENGTH ? null : line;
        }
        return null;
    }

    /** "http://law.ontology.ru/#legge_1" → "legge_1" */
    static String fragment(String uri) {
        if (uri == null) return null;
        int hash = uri.lastIndexOf('#');
        if (hash >= 0) return uri.substring(hash + 1);
        int slash = uri.lastIndexOf('/');
        return slash >= 0 ? uri.substring(slash + 1) : uri;
    }

    private static Integer parsePage(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Integer.valueOf(value.strip());
        } catch (NumberFormatException e) {
            log.debug("Pagina non numerica nel grafo: {}", value);
            return null;
        }
    }
}
