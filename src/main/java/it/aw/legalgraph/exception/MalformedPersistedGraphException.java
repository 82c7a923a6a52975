package it.aw.legalgraph.exception;

import java.nio.file.Path;

public class MalformedPersistedGraphException extends LegalGraphException {

    private final Path graphFile;

    public MalformedPersistedGraphException(final Path graphFile, final Throwable cause) {
        super("Grafo RDF/XML non valido: " + graphFile + " (" + cause.getMessage() + ")", cause);
        this.graphFile = graphFile;
    }

    public Path getGraphFile() {
        return graphFile;
    }
}
