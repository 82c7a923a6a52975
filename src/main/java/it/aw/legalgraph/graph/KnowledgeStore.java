package it.aw.legalgraph.graph;

import it.aw.legalgraph.exception.MalformedPersistedGraphException;
import it.aw.legalgraph.exception.QueryExecutionException;
import it.aw.legalgraph.model.GraphStats;
import org.apache.jena.datatypes.xsd.XSDDatatype;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RDFFormat;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.shared.JenaException;
import org.apache.jena.vocabulary.OWL;
import org.apache.jena.vocabulary.RDF;
import org.apache.jena.vocabulary.RDFS;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Grafo di conoscenza a triple (Jena in memoria) persistito su un unico file RDF/XML.
 * <p>
 * Il file è letto una volta all'avvio e riscritto per intero a ogni {@link #save()}.
 * Un solo scrittore per processo: l'accesso al modello è sincronizzato, ma due
 * save concorrenti da processi diversi non sono arbitrati (vince l'ultimo).
 * <p>
 * Caricamento tollerante: se il file non è XML ben formato viene creata una
 * copia sanificata ({@link GraphFileSanitizer}) e si lavora su quella. Se anche
 * la copia non si parsa l'avvio fallisce con {@link MalformedPersistedGraphException}.
 */
public class KnowledgeStore {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeStore.class);

    private static final String SEARCH_VARS = "?article ?article_number ?article_text ?law ?law_title ?page";
    private static final String SEARCH_OPTIONALS = """
                OPTIONAL { ?article law:belongsToLaw ?law . }
                OPTIONAL { ?law law:hasTitle ?law_title . }
                OPTIONAL { ?article law:hasPage ?page . }
            """;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String REGEX_META = "\\.^$|?*+()[]{}-";

    private final Path graphFile;
    private final LawVocabulary vocab;
    private final Model model;
    private final int textFallbackLimit;

    KnowledgeStore(Path graphFile, LawVocabulary vocab, Model model, int textFallbackLimit) {
        this.graphFile = graphFile;
        this.vocab = vocab;
        this.model = model;
        this.textFallbackLimit = textFallbackLimit;
    }

    /**
     * Apre il grafo persistito in graphFile (se esiste), altrimenti parte da un grafo vuoto.
     */
    public static KnowledgeStore open(Path graphFile, String namespace, int textFallbackLimit) {
        LawVocabulary vocab = new LawVocabulary(namespace);
        return new KnowledgeStore(graphFile, vocab, load(graphFile, vocab), textFallbackLimit);
    }

    static Model load(Path graphFile, LawVocabulary vocab) {
        Model model = newModel(vocab);
        if (!Files.exists(graphFile)) {
            log.info("KnowledgeStore: file {} non trovato, partenza da grafo vuoto.", graphFile.toAbsolutePath());
            return model;
        }
        try {
            read(model, graphFile);
            log.info("KnowledgeStore: grafo caricato da {} ({} triple)", graphFile.toAbsolutePath(), model.size());
            return model;
        } catch (MalformedPersistedGraphException e) {
            Path sanitized = GraphFileSanitizer.sanitizedPathFor(graphFile);
            log.warn("KnowledgeStore: RDF/XML non parsabile ({}). Creo la copia sanificata {}",
                    e.getCause().getMessage(), sanitized.toAbsolutePath());
            try {
                GraphFileSanitizer.sanitize(graphFile, sanitized);
            } catch (IOException io) {
                throw new UncheckedIOException("Impossibile scrivere la copia sanificata " + sanitized, io);
            }
            Model clean = newModel(vocab);
            read(clean, sanitized);
            log.info("KnowledgeStore: grafo caricato dalla copia sanificata {} ({} triple)",
                    sanitized.toAbsolutePath(), clean.size());
            return clean;
        }
    }

    private static Model newModel(LawVocabulary vocab) {
        Model model = ModelFactory.createDefaultModel();
        model.setNsPrefix("law", vocab.namespace());
        model.setNsPrefix("rdf", RDF.getURI());
        model.setNsPrefix("rdfs", RDFS.getURI());
        model.setNsPrefix("owl", OWL.getURI());
        return model;
    }

    private static void read(Model model, Path file) {
        try {
            RDFParser.source(file).lang(Lang.RDFXML).parse(model.getGraph());
        } catch (JenaException e) {
            throw new MalformedPersistedGraphException(file, e);
        }
    }

    // -------------------------------------------------------------------------
    // Scrittura
    // -------------------------------------------------------------------------

    public synchronized Resource addLaw(String lawId, String title, LocalDate date) {
        Resource law = model.createResource(vocab.uri(lawId));
        law.addProperty(RDF.type, vocab.law);
        law.addProperty(vocab.hasTitle, title, "ru");
        if (date != null) {
            law.addProperty(vocab.hasDate, model.createTypedLiteral(date.toString(), XSDDatatype.XSDdate));
        }
        return law;
    }

    public synchronized Resource addChapter(String chapterId, Resource law, String number, String title) {
        Resource chapter = model.createResource(vocab.uri(chapterId));
        chapter.addProperty(RDF.type, vocab.chapter);
        chapter.addProperty(vocab.hasNumber, number);
        if (title != null && !title.isEmpty()) {
            chapter.addProperty(vocab.hasTitle, title, "ru");
        }
        model.add(law, vocab.containsChapter, chapter);
        return chapter;
    }

    /**
     * @param chapter capo contenitore, null se il documento non ha capi
     * @param text    corpo, omesso se vuoto
     * @param law     legge di appartenenza, null solo per articoli "sciolti"
     * @param page    pagina di inizio (PDF), null se non nota
     */
    public synchronized Resource addArticle(String articleId, Resource chapter, String number,
                                            String text, Resource law, Integer page) {
        Resource article = model.createResource(vocab.uri(articleId));
        article.addProperty(RDF.type, vocab.article);
        article.addProperty(vocab.hasNumber, number);
        if (text != null && !text.isEmpty()) {
            article.addProperty(vocab.hasText, text, "ru");
        }
        if (page != null) {
            article.addProperty(vocab.hasPage, String.valueOf(page));
        }
        if (chapter != null) {
            model.add(chapter, vocab.containsArticle, article);
        }
        if (law != null) {
            article.addProperty(vocab.belongsToLaw, law);
        }
        return article;
    }

    public synchronized Resource addTerm(String termId, String termText) {
        Resource term = model.createResource(vocab.uri(termId));
        term.addProperty(RDF.type, vocab.term);
        term.addProperty(vocab.hasTitle, termText, "ru");
        return term;
    }

    public synchronized void addReference(Resource fromArticle, Resource toArticle, Resource toLaw) {
        if (toArticle != null) model.add(fromArticle, vocab.references, toArticle);
        if (toLaw != null) model.add(fromArticle, vocab.referencesLaw, toLaw);
    }

    public synchronized void addSynonym(Resource term1, Resource term2) {
        model.add(term1, vocab.hasSynonym, term2);
    }

    public synchronized void linkTermToArticle(Resource article, Resource term, boolean isDefinition) {
        model.add(article, isDefinition ? vocab.definesTerm : vocab.usesTerm, term);
    }

    public void save() {
        save(graphFile);
    }

    /** Riscrive il file per intero. */
    public synchronized void save(Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(target)) {
                RDFDataMgr.write(out, model, RDFFormat.RDFXML_PLAIN);
            }
            log.info("KnowledgeStore: grafo salvato in {} ({} triple)", target.toAbsolutePath(), model.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Impossibile salvare il grafo su " + target, e);
        }
    }

    // -------------------------------------------------------------------------
    // Lettura
    // -------------------------------------------------------------------------

    /**
     * Esegue una SELECT SPARQL. Ogni riga contiene tutte le variabili proiettate,
     * anche quelle non legate (valore null); URI e letterali sono restituiti come stringhe.
     */
    public synchronized List<Map<String, String>> query(String sparql) {
        List<Map<String, String>> rows = new ArrayList<>();
        try (QueryExecution qexec = QueryExecutionFactory.create(sparql, model)) {
            ResultSet rs = qexec.execSelect();
            List<String> vars = rs.getResultVars();
            while (rs.hasNext()) {
                QuerySolution solution = rs.next();
                Map<String, String> row = new LinkedHashMap<>();
                for (String var : vars) {
                    row.put(var, display(solution.get(var)));
                }
                rows.add(row);
            }
        } catch (JenaException e) {
            log.error("Errore esecuzione SPARQL: {}\nQuery: {}", e.getMessage(), sparql);
            throw new QueryExecutionException(sparql, e);
        }
        return rows;
    }

    private static String display(RDFNode node) {
        if (node == null) return null;
        if (node.isURIResource()) return node.asResource().getURI();
        if (node.isLiteral()) return node.asLiteral().getLexicalForm();
        return node.toString();
    }

    public Optional<String> getArticleByNumber(String lawId, String articleNumber) {
        String q = vocab.sparqlPrefix() + """
                SELECT ?article WHERE {
                    ?article a law:Article ;
                             law:hasNumber "%s" ;
                             law:belongsToLaw <%s> .
                }
                """.formatted(escapeLiteral(articleNumber), vocab.uri(lawId));
        return query(q).stream().map(r -> r.get("article")).findFirst();
    }

    public List<String> getReferencedArticles(String articleUri) {
        String q = vocab.sparqlPrefix() + """
                SELECT ?ref_article WHERE {
                    <%s> law:references ?ref_article .
                }
                """.formatted(articleUri);
        return query(q).stream()
                .map(r -> r.get("ref_article"))
                .filter(v -> v != null)
                .collect(Collectors.toList());
    }

    /** Numero, testo, titolo e pagina di un articolo dato il suo id locale. */
    public Optional<Map<String, String>> findArticle(String articleId) {
        String uri = vocab.uri(articleId);
        String q = vocab.sparqlPrefix() + """
                SELECT ?number ?text ?title ?page WHERE {
                    <%1$s> law:hasNumber ?number .
                    OPTIONAL { <%1$s> law:hasText ?text . }
                    OPTIONAL { <%1$s> law:hasTitle ?title . }
                    OPTIONAL { <%1$s> law:hasPage ?page . }
                }
                """.formatted(uri);
        return query(q).stream().findFirst();
    }

    public Optional<String> lawTitle(String lawId) {
        String q = vocab.sparqlPrefix() + """
                SELECT ?title WHERE {
                    <%s> law:hasTitle ?title .
                }
                """.formatted(vocab.uri(lawId));
        return query(q).stream().map(r -> r.get("title")).filter(t -> t != null).findFirst();
    }

    public List<Map<String, String>> listLaws() {
        return query(vocab.sparqlPrefix() + """
                SELECT ?law_id ?title ?date WHERE {
                    ?law_id a law:Law ;
                            law:hasTitle ?title .
                    OPTIONAL { ?law_id law:hasDate ?date . }
                }
                """);
    }

    /**
     * Articoli che contengono o definiscono un termine, con fallback a tre livelli:
     * <ol>
     *   <li>termini del grafo la cui etichetta contiene la query (definesTerm / usesTerm);</li>
     *   <li>se vuoto, sottostringa case-insensitive nel testo degli articoli;</li>
     *   <li>se ancora vuoto e la query ha spazi, regex che tollera a-capo e spazi multipli.</li>
     * </ol>
     * Ogni livello è tentato solo se il precedente non ha righe; i risultati non si sommano.
     */
    public List<Map<String, String>> searchArticlesByTerm(String termText) {
        String escaped = escapeLiteral(termText);

        List<Map<String, String>> results = query(vocab.sparqlPrefix() + """
                SELECT %s WHERE {
                    ?term a law:Term ;
                          law:hasTitle ?term_title .
                    FILTER(CONTAINS(LCASE(STR(?term_title)), LCASE("%s")))
                    { ?article law:definesTerm ?term . } UNION { ?article law:usesTerm ?term . }
                    ?article law:hasNumber ?article_number .
                    OPTIONAL { ?article law:hasText ?article_text . }
                %s}
                """.formatted(SEARCH_VARS, escaped, SEARCH_OPTIONALS));
        log.info("Ricerca per termini del grafo '{}': {} risultati", termText, results.size());
        if (!results.isEmpty()) return results;

        results = query(vocab.sparqlPrefix() + """
                SELECT %s WHERE {
                    ?article a law:Article ;
                             law:hasNumber ?article_number ;
                             law:hasText ?article_text .
                    FILTER(CONTAINS(LCASE(STR(?article_text)), LCASE("%s")))
                %s}
                LIMIT %d
                """.formatted(SEARCH_VARS, escaped, SEARCH_OPTIONALS, textFallbackLimit));
        log.info("Ricerca nel testo degli articoli '{}': {} risultati", termText, results.size());
        if (!results.isEmpty() || !WHITESPACE.matcher(termText.strip()).find()) return results;

        String regex = whitespaceTolerantRegex(termText);
        results = query(vocab.sparqlPrefix() + """
                SELECT %s WHERE {
                    ?article a law:Article ;
                             law:hasNumber ?article_number ;
                             law:hasText ?article_text .
                    FILTER(REGEX(LCASE(STR(?article_text)), "%s"))
                %s}
                LIMIT %d
                """.formatted(SEARCH_VARS, escapeLiteral(regex), SEARCH_OPTIONALS, textFallbackLimit));
        log.info("Ricerca nel testo (regex) '{}': {} risultati", termText, results.size());
        return results;
    }

    public synchronized GraphStats statistics() {
        return new GraphStats(
                countOfType(vocab.law),
                countOfType(vocab.chapter),
                countOfType(vocab.article),
                countOfType(vocab.term),
                model.size());
    }

    private int countOfType(Resource type) {
        return model.listResourcesWithProperty(RDF.type, type).toList().size();
    }

    public synchronized long size() {
        return model.size();
    }

    public LawVocabulary vocabulary() {
        return vocab;
    }

    public Path graphFile() {
        return graphFile;
    }

    // -------------------------------------------------------------------------

    /** Escape per un letterale stringa SPARQL tra doppi apici. */
    static String escapeLiteral(String value) {
        return value.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r");
    }

    /** "договор  поставки" → "договор\s+поставки", metacaratteri regex escapati. */
    static String whitespaceTolerantRegex(String query) {
        String[] words = WHITESPACE.split(query.strip().toLowerCase(Locale.ROOT));
        List<String> parts = new ArrayList<>(words.length);
        for (String word : words) {
            StringBuilder sb = new StringBuilder(word.length());
            for (char c : word.toCharArray()) {
                if (REGEX_META.indexOf(c) >= 0) sb.append('\\');
                sb.append(c);
            }
            parts.add(sb.toString());
        }
        return String.join("\\s+", parts);
    }
}
