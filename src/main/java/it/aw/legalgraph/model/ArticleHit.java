package it.aw.legalgraph.model;

/**
 * Risultato di una ricerca di articoli per termine.
 * Contiene il testo dell'articolo, la legge di appartenenza e i metadati
 * di posizione (titolo derivato e pagina) per contestualizzare il risultato.
 */
public record ArticleHit(
        String  articleUri,
        String  articleNumber,
        String  articleText,
        String  articleTitle,     // prima riga utile del testo (null se assente o troppo lunga)
        String  lawUri,
        String  lawId,            // frammento dell'URI della legge
        String  lawTitle,
        Integer page,             // dal grafo o dal PageLocator (null se non noto)
        String  sourceFilename    // file sorgente risolto per lawId (null se non trovato)
) {}
