package it.aw.legalgraph.exception;

public class DocumentParsingException extends LegalGraphException {

    public DocumentParsingException(final String message) {
        super(message);
    }

    public DocumentParsingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
