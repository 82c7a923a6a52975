package it.aw.legalgraph.config;

import it.aw.legalgraph.graph.KnowledgeStore;
import it.aw.legalgraph.nlp.AnalysisLimits;
import it.aw.legalgraph.nlp.LanguagePipeline;
import it.aw.legalgraph.nlp.LinguisticAnalyzer;
import it.aw.legalgraph.nlp.LuceneLanguagePipeline;
import it.aw.legalgraph.nlp.MorphologicalAnalyzer;
import it.aw.legalgraph.nlp.SnowballMorphologicalAnalyzer;
import it.aw.legalgraph.parser.MarkupDocumentParser;
import it.aw.legalgraph.parser.PdfDocumentParser;
import it.aw.legalgraph.parser.PlainTextDocumentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Configura grafo, analisi linguistica e parser dei formati.
 *
 * KnowledgeStore:     grafo Jena in memoria, caricato all'avvio dal file RDF/XML
 *                     (se esiste) e riscritto a ogni ingestione.
 * LinguisticAnalyzer: soglie da configurazione; pipeline e morfologia sono bean
 *                     opzionali, selezionati da legalgraph.nlp.pipeline / .morphology.
 * Parser:             TXT sempre; XML/HTML e PDF solo se jsoup / PDFBox sono nel classpath.
 */
@Configuration
public class LegalGraphConfig {

    private static final Logger log = LoggerFactory.getLogger(LegalGraphConfig.class);

    @Value("${legalgraph.graph.file:data/ontology/legal_ontology.owl}")
    private String graphFile;

    @Value("${legalgraph.graph.namespace:http://law.ontology.ru/#}")
    private String namespace;

    @Value("${legalgraph.search.text-fallback-limit:50}")
    private int textFallbackLimit;

    @Value("${legalgraph.nlp.pipeline-safe-max-chars:400000}")
    private int pipelineSafeMaxChars;

    @Value("${legalgraph.nlp.key-terms-max-chars:1500000}")
    private int keyTermsMaxChars;

    @Value("${legalgraph.nlp.term-candidates.enabled:true}")
    private boolean termCandidatesEnabled;

    @Bean
    public KnowledgeStore knowledgeStore() {
        Path path = Paths.get(graphFile);
        log.info("KnowledgeStore: file {}, namespace {}", path.toAbsolutePath(), namespace);
        return KnowledgeStore.open(path, namespace, textFallbackLimit);
    }

    @Bean
    public AnalysisLimits analysisLimits() {
        return new AnalysisLimits(pipelineSafeMaxChars, keyTermsMaxChars);
    }

    @Bean
    public LinguisticAnalyzer linguisticAnalyzer(AnalysisLimits limits,
                                                 Optional<LanguagePipeline> pipeline,
                                                 Optional<MorphologicalAnalyzer> morphology) {
        return new LinguisticAnalyzer(limits, pipeline, morphology, termCandidatesEnabled);
    }

    @Bean
    public PlainTextDocumentParser plainTextDocumentParser() {
        return new PlainTextDocumentParser();
    }

    @Configuration
    @ConditionalOnClass(name = "org.jsoup.Jsoup")
    static class MarkupParserConfig {

        @Bean
        public MarkupDocumentParser markupDocumentParser() {
            return new MarkupDocumentParser();
        }
    }

    @Configuration
    @ConditionalOnClass(name = "org.apache.pdfbox.pdmodel.PDDocument")
    static class PdfParserConfig {

        @Bean
        public PdfDocumentParser pdfDocumentParser() {
            return new PdfDocumentParser();
        }
    }

    @Configuration
    @ConditionalOnClass(name = "org.apache.lucene.analysis.Analyzer")
    static class NlpConfig {

        @Bean
        @ConditionalOnProperty(name = "legalgraph.nlp.pipeline", havingValue = "lucene", matchIfMissing = true)
        public LanguagePipeline luceneLanguagePipeline() {
            return new LuceneLanguagePipeline();
        }

        @Bean
        @ConditionalOnProperty(name = "legalgraph.nlp.morphology", havingValue = "snowball", matchIfMissing = true)
        public MorphologicalAnalyzer snowballMorphologicalAnalyzer() {
            return new SnowballMorphologicalAnalyzer();
        }
    }
}
