package it.aw.legalgraph.exception;

/**
 * Radice delle eccezioni applicative della pipeline di ingestione.
 * Tutte unchecked: i chiamanti (route, runner) decidono se e dove intercettarle.
 */
public class LegalGraphException extends RuntimeException {

    public LegalGraphException(final String message) {
        super(message);
    }

    public LegalGraphException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
