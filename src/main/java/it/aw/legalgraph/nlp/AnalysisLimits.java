package it.aw.legalgraph.nlp;

/**
 * Soglie di sicurezza dell'analisi linguistica, in caratteri.
 * <p>
 * Non c'è cancellazione delle analisi lunghe: limitare la dimensione dell'input
 * è l'unica protezione da latenza e memoria illimitate.
 *
 * @param pipelineSafeMaxChars oltre questa lunghezza la pipeline pesante non viene usata
 *                             (tokenizzazione regex) o riceve solo un campione troncato
 * @param keyTermsMaxChars     i testi più lunghi sono troncati prima del conteggio delle frequenze
 */
public record AnalysisLimits(int pipelineSafeMaxChars, int keyTermsMaxChars) {

    public static final int DEFAULT_PIPELINE_SAFE_MAX_CHARS = 400_000;
    public static final int DEFAULT_KEY_TERMS_MAX_CHARS     = 1_500_000;

    public AnalysisLimits {
        if (pipelineSafeMaxChars <= 0) {
            throw new IllegalArgumentException("pipelineSafeMaxChars deve essere > 0 (ricevuto: " + pipelineSafeMaxChars + ")");
        }
        if (keyTermsMaxChars <= 0) {
            throw new IllegalArgumentException("keyTermsMaxChars deve essere > 0 (ricevuto: " + keyTermsMaxChars + ")");
        }
    }

    public static AnalysisLimits defaults() {
        return new AnalysisLimits(DEFAULT_PIPELINE_SAFE_MAX_CHARS, DEFAULT_KEY_TERMS_MAX_CHARS);
    }

    String safeSample(String text) {
        return text.length() <= pipelineSafeMaxChars ? text : text.substring(0, pipelineSafeMaxChars);
    }

    String keyTermsSample(String text) {
        return text.length() <= keyTermsMaxChars ? text : text.substring(0, keyTermsMaxChars);
    }
}
