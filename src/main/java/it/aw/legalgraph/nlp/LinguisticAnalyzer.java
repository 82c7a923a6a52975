package it.aw.legalgraph.nlp;

import it.aw.legalgraph.model.ExtractedEntities;
import it.aw.legalgraph.model.KeyTerm;
import it.aw.legalgraph.model.ReferenceMatch;
import it.aw.legalgraph.model.ReferenceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Analisi linguistica di testi normativi, sicura anche su documenti di più megabyte.
 * <p>
 * Strategie scelte alla costruzione:
 * <ul>
 *   <li>pipeline pesante ({@link LanguagePipeline}) opzionale: usata solo su testi
 *       entro {@link AnalysisLimits#pipelineSafeMaxChars()}, altrimenti tokenizzatore regex;</li>
 *   <li>analizzatore morfologico opzionale: se presente lemmatizza token per token,
 *       altrimenti la pipeline lemmatizza un campione troncato, altrimenti i token
 *       restano come sono.</li>
 * </ul>
 * Il conteggio dei termini chiave ha un tetto indipendente
 * ({@link AnalysisLimits#keyTermsMaxChars()}): oltre, il testo è troncato.
 */
public class LinguisticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(LinguisticAnalyzer.class);

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> LAW_PATTERNS = List.of(
            Pattern.compile("(?:Федеральный\\s+)?закон\\s+(?:от\\s+)?(?:\\d+\\.\\d+\\.\\d+)?\\s*№\\s*(\\d+[-ФЗфз]*)", FLAGS),
            Pattern.compile("(?:ГК|УК|ТК|НК)\\s+РФ", FLAGS),
            Pattern.compile("Конституция\\s+РФ", FLAGS));

    private static final List<Pattern> ARTICLE_PATTERNS = List.of(
            Pattern.compile("статья\\s+(\\d+(?:\\.\\d+)?)", FLAGS),
            Pattern.compile("ст\\.\\s*(\\d+(?:\\.\\d+)?)", FLAGS),
            Pattern.compile("пункт\\s+(\\d+)", FLAGS));

    private static final Pattern DATE = Pattern.compile("\\d{1,2}\\.\\d{1,2}\\.\\d{4}");

    /** L'oggetto del rinvio arriva fino alla prima punteggiatura di fine proposizione. */
    private static final Map<ReferenceType, Pattern> REFERENCE_PATTERNS = new LinkedHashMap<>();
    static {
        REFERENCE_PATTERNS.put(ReferenceType.ACCORDANCE,
                Pattern.compile("в\\s+соответствии\\s+с\\s+(.+?)(?:\\.|,|;|$)", FLAGS));
        REFERENCE_PATTERNS.put(ReferenceType.ACCORDING_TO,
                Pattern.compile("согласно\\s+(.+?)(?:\\.|,|;|$)", FLAGS));
        REFERENCE_PATTERNS.put(ReferenceType.BY_VIRTUE_OF,
                Pattern.compile("в\\s+силу\\s+(.+?)(?:\\.|,|;|$)", FLAGS));
        REFERENCE_PATTERNS.put(ReferenceType.ON_THE_BASIS_OF,
                Pattern.compile("на\\s+основании\\s+(.+?)(?:\\.|,|;|$)", FLAGS));
    }

    static final Set<String> STOP_WORDS = Set.of(
            "и", "в", "на", "с", "по", "для", "от", "к", "из", "о", "а", "как", "что", "это",
            "если", "либо", "также", "иные", "иных", "который", "которые", "которых", "более",
            "менее", "может", "могут", "быть", "после", "этом", "этого", "других");

    private static final int MIN_TERM_LENGTH = 4;

    private final AnalysisLimits limits;
    private final Optional<LanguagePipeline> pipeline;
    private final Optional<MorphologicalAnalyzer> morphology;
    private final boolean termCandidatesEnabled;

    public LinguisticAnalyzer(AnalysisLimits limits,
                              Optional<LanguagePipeline> pipeline,
                              Optional<MorphologicalAnalyzer> morphology,
                              boolean termCandidatesEnabled) {
        this.limits = limits;
        this.pipeline = pipeline;
        this.morphology = morphology;
        this.termCandidatesEnabled = termCandidatesEnabled;
        log.info("LinguisticAnalyzer: pipeline={}, morfologia={}, soglia pipeline={} caratteri, soglia termini={} caratteri",
                pipeline.map(LanguagePipeline::name).orElse("regex"),
                morphology.map(MorphologicalAnalyzer::name).orElse("nessuna"),
                limits.pipelineSafeMaxChars(), limits.keyTermsMaxChars());
    }

    public AnalysisLimits limits() {
        return limits;
    }

    // -------------------------------------------------------------------------
    // Token e lemmi
    // -------------------------------------------------------------------------

    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();
        if (pipeline.isEmpty() || text.length() > limits.pipelineSafeMaxChars()) {
            return RegexTokenizer.tokenize(text);
        }
        return withPipeline("tokenizzazione", p -> p.tokenize(text))
                .orElseGet(() -> RegexTokenizer.tokenize(text));
    }

    public List<String> lemmatize(String text) {
        if (text == null || text.isEmpty()) return List.of();
        if (morphology.isPresent()) {
            MorphologicalAnalyzer morph = morphology.get();
            List<String> tokens = tokenize(text);
            List<String> lemmas = new ArrayList<>(tokens.size());
            for (String token : tokens) {
                lemmas.add(morph.normalForm(token).orElse(token));
            }
            return lemmas;
        }
        if (pipeline.isPresent()) {
            String sample = limits.safeSample(text);
            return withPipeline("lemmatizzazione", p -> p.lemmatize(sample))
                    .orElseGet(() -> tokenize(text));
        }
        return tokenize(text);
    }

    // -------------------------------------------------------------------------
    // Entità e rinvii
    // -------------------------------------------------------------------------

    public ExtractedEntities extractEntities(String text) {
        if (text == null || text.isEmpty()) {
            return new ExtractedEntities(List.of(), List.of(), List.of(), List.of());
        }
        List<String> laws = new ArrayList<>();
        for (Pattern p : LAW_PATTERNS) {
            Matcher m = p.matcher(text);
            while (m.find()) laws.add(m.group(0));
        }

        List<String> articles = new ArrayList<>();
        for (Pattern p : ARTICLE_PATTERNS) {
            Matcher m = p.matcher(text);
            while (m.find()) articles.add(m.group(1));
        }

        Set<String> dates = new LinkedHashSet<>();
        Matcher dm = DATE.matcher(text);
        while (dm.find()) dates.add(dm.group());

        return new ExtractedEntities(laws, articles, new ArrayList<>(dates), candidateTerms(text));
    }

    /**
     * Candidati termine sul solo campione "sicuro". Se l'estrazione fallisce
     * la lista è vuota: il resto delle entità non ne risente.
     */
    private List<String> candidateTerms(String text) {
        if (!termCandidatesEnabled || pipeline.isEmpty()) return List.of();
        String sample = limits.safeSample(text);
        ItemResult<List<String>> result = withPipeline("estrazione termini", p -> p.candidateTerms(sample));
        if (!result.isOk()) return List.of();
        return new ArrayList<>(new LinkedHashSet<>(result.value()));
    }

    public List<ReferenceMatch> extractReferences(String text) {
        List<ReferenceMatch> references = new ArrayList<>();
        if (text == null || text.isEmpty()) return references;
        for (Map.Entry<ReferenceType, Pattern> e : REFERENCE_PATTERNS.entrySet()) {
            Matcher m = e.getValue().matcher(text);
            while (m.find()) {
                references.add(new ReferenceMatch(e.getKey(), m.group(1).strip(), m.start()));
            }
        }
        return references;
    }

    // -------------------------------------------------------------------------
    // Termini chiave
    // -------------------------------------------------------------------------

    /**
     * I topN lemmi più frequenti, in ordine di frequenza decrescente; a parità
     * vince il lemma incontrato per primo. Token e lemmi corti (≤ 3) o nella
     * lista di stop-word sono scartati.
     */
    public List<KeyTerm> findKeyTerms(String text, int topN) {
        if (text == null || text.isEmpty() || topN <= 0) return List.of();
        String sample = limits.keyTermsSample(text);

        Map<String, Integer> frequencies = new LinkedHashMap<>();
        RegexTokenizer.tokens(sample)
                .filter(LinguisticAnalyzer::isCountable)
                .map(this::keyTermLemma)
                .filter(LinguisticAnalyzer::isCountable)
                .forEach(lemma -> frequencies.merge(lemma, 1, Integer::sum));

        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(frequencies.entrySet());
        ranked.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        return ranked.stream()
                .limit(topN)
                .map(e -> new KeyTerm(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    private String keyTermLemma(String token) {
        return morphology.map(m -> m.normalForm(token).orElse(token)).orElse(token);
    }

    private static boolean isCountable(String token) {
        return token.length() >= MIN_TERM_LENGTH && !STOP_WORDS.contains(token);
    }

    // -------------------------------------------------------------------------

    @FunctionalInterface
    private interface PipelineCall<T> {
        T apply(LanguagePipeline pipeline) throws IOException;
    }

    private <T> ItemResult<T> withPipeline(String operation, PipelineCall<T> call) {
        LanguagePipeline p = pipeline.orElseThrow();
        try {
            return ItemResult.ok(call.apply(p));
        } catch (IOException | RuntimeException e) {
            log.warn("Pipeline {}: {} fallita, uso il fallback ({})", p.name(), operation, e.getMessage());
            return ItemResult.skipped(operation + ": " + e.getMessage());
        }
    }
}
