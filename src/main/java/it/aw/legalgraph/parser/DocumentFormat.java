package it.aw.legalgraph.parser;

import it.aw.legalgraph.exception.UnsupportedFormatException;
import it.aw.legalgraph.model.Identifiers;

import java.nio.file.Path;

/**
 * Formati sorgente supportati. Il formato è scelto solo dall'estensione del
 * file: il contenuto non viene mai ispezionato per indovinarlo.
 */
public enum DocumentFormat {

    XML("xml"),
    HTML("html"),
    PDF("pdf"),
    TXT("txt");

    private final String extension;

    DocumentFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static DocumentFormat of(Path file) {
        String ext = Identifiers.extension(file);
        for (DocumentFormat format : values()) {
            if (format.extension.equals(ext)) return format;
        }
        throw new UnsupportedFormatException(ext);
    }
}
