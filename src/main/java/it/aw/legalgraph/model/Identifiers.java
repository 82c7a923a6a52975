package it.aw.legalgraph.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derivazione deterministica degli identificatori del grafo.
 * <p>
 * Gli id dipendono solo da (nome file, numero strutturale): re-ingestire lo
 * stesso file produce gli stessi id, quindi le triple si sommano a quelle
 * esistenti invece di creare nodi duplicati.
 */
public final class Identifiers {

    private static final Pattern NON_ID_CHARS = Pattern.compile("[^\\p{L}\\p{N}_.]");
    private static final Pattern TERM_SEPARATORS = Pattern.compile("[\\s\\-]+");

    private Identifiers() {}

    /** Nome file senza estensione. */
    public static String fileStem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /** Estensione minuscola senza punto, stringa vuota se assente. */
    public static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /** "Закон о связи-2003.pdf" → "Закон_о_связи_2003" */
    public static String lawId(Path sourceFile) {
        return NON_ID_CHARS.matcher(fileStem(sourceFile)).replaceAll("_");
    }

    public static String chapterId(String lawId, String chapterNumber) {
        return lawId + "_chapter_" + NON_ID_CHARS.matcher(chapterNumber).replaceAll("_");
    }

    public static String articleId(String lawId, String articleNumber) {
        return lawId + "_article_" + NON_ID_CHARS.matcher(articleNumber).replaceAll("_");
    }

    /**
     * Id di un termine: due stringhe che normalizzano allo stesso modo
     * (maiuscole, spazi, trattini) producono lo stesso id.
     */
    public static String termId(String termText) {
        String normalized = TERM_SEPARATORS.matcher(termText.strip().toLowerCase(Locale.ROOT)).replaceAll("_");
        return "term_" + NON_ID_CHARS.matcher(normalized).replaceAll("_");
    }
}
