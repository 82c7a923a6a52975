package it.aw.legalgraph.exception;

/**
 * Errore di esecuzione SPARQL. Conserva il testo della query per la diagnostica.
 */
public class QueryExecutionException extends LegalGraphException {

    private final String query;

    public QueryExecutionException(final String query, final Throwable cause) {
        super("Errore esecuzione query SPARQL: " + cause.getMessage(), cause);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
