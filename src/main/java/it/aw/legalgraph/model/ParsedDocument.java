package it.aw.legalgraph.model;

import java.util.List;

/**
 * Record normalizzato prodotto dallo StructuralParser, indipendente dal formato.
 * Capi e articoli sono nell'ordine in cui compaiono nella sorgente.
 */
public record ParsedDocument(
        String              title,
        List<ParsedChapter> chapters,
        List<ParsedArticle> articles,
        String              fullText
) {

    public ParsedDocument {
        chapters = List.copyOf(chapters);
        articles = List.copyOf(articles);
        fullText = fullText != null ? fullText : "";
    }

    /** Documento senza struttura: risultato valido, non un errore. */
    public static ParsedDocument empty(String title) {
        return new ParsedDocument(title, List.of(), List.of(), "");
    }
}
