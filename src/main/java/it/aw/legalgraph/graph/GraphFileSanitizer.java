package it.aw.legalgraph.graph;

import it.aw.legalgraph.model.Identifiers;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * "Ripara" un file RDF/XML che non si riesce a parsare. I casi tipici arrivano
 * dall'estrazione automatica da PDF: byte NUL e altri caratteri di controllo,
 * sequenze UTF-8 troncate, '&amp;' non escapati nei letterali.
 * <p>
 * Non è una riparazione dell'ontologia: serve solo a non bloccare l'avvio.
 */
public final class GraphFileSanitizer {

    /** '&' che non apre un'entità XML valida. */
    private static final Pattern BARE_AMPERSAND =
            Pattern.compile("&(?!amp;|lt;|gt;|quot;|apos;|#\\d+;|#x[0-9A-Fa-f]+;)");

    private GraphFileSanitizer() {}

    /** legal_ontology.owl → legal_ontology.sanitized.owl, nella stessa cartella. */
    public static Path sanitizedPathFor(Path graphFile) {
        String ext = Identifiers.extension(graphFile);
        String name = Identifiers.fileStem(graphFile) + ".sanitized" + (ext.isEmpty() ? "" : "." + ext);
        return graphFile.resolveSibling(name);
    }

    public static void sanitize(Path source, Path target) throws IOException {
        Files.writeString(target, sanitize(Files.readAllBytes(source)), StandardCharsets.UTF_8);
    }

    static String sanitize(byte[] raw) {
        // 1) caratteri di controllo non ammessi in XML 1.0 (tranne \t \n \r)
        ByteArrayOutputStream cleaned = new ByteArrayOutputStream(raw.length);
        for (byte b : raw) {
            int v = b & 0xFF;
            if (v >= 32 || v == '\t' || v == '\n' || v == '\r') cleaned.write(v);
        }
        // 2) decodifica con sostituzione delle sequenze non valide
        String text = cleaned.toString(StandardCharsets.UTF_8);
        // 3) escape degli '&' nudi
        return BARE_AMPERSAND.matcher(text).replaceAll("&amp;");
    }
}
