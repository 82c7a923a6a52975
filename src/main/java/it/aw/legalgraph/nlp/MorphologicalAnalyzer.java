package it.aw.legalgraph.nlp;

/**
 * Analizzatore morfologico token per token: restituisce la prima (migliore)
 * lettura normalizzata. Un fallimento riguarda solo quel token.
 */
public interface MorphologicalAnalyzer {

    String name();

    ItemResult<String> normalForm(String token);
}
