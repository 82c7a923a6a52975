package it.aw.legalgraph.exception;

public class UnsupportedFormatException extends LegalGraphException {

    private final String extension;

    public UnsupportedFormatException(final String extension) {
        super("Formato non supportato: " + extension);
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
