package it.aw.legalgraph.model;

/**
 * Articolo (статья / article) recuperato dal documento sorgente.
 * <p>
 * page è valorizzato solo per sorgenti paginate (PDF): è la prima pagina
 * in cui compare l'intestazione dell'articolo a inizio riga.
 */
public record ParsedArticle(
        String  number,   // es. "12" oppure "12.1"
        String  text,     // corpo dell'articolo, già trim-mato
        Integer page      // 1-based, null se non noto
) {

    public ParsedArticle(String number, String text) {
        this(number, text, null);
    }

    public ParsedArticle withPage(Integer page) {
        return new ParsedArticle(number, text, page);
    }
}
