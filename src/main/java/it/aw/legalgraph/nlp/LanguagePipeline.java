package it.aw.legalgraph.nlp;

import java.io.IOException;
import java.util.List;

/**
 * Pipeline linguistica "pesante". È opzionale: il {@link LinguisticAnalyzer}
 * la usa solo entro la soglia di sicurezza e degrada al tokenizzatore regex
 * quando manca.
 */
public interface LanguagePipeline {

    String name();

    /** Token in minuscolo, senza punteggiatura. */
    List<String> tokenize(String text) throws IOException;

    /** Forma normalizzata di ogni token, nello stesso ordine. */
    List<String> lemmatize(String text) throws IOException;

    /**
     * Candidati termine di dominio: sostantivi con iniziale maiuscola
     * che non aprono una frase, nell'ordine del testo (possono ripetersi).
     */
    List<String> candidateTerms(String text) throws IOException;
}
