package it.aw.legalgraph.service;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Risale dal lawId al documento sorgente da cui è stato ingestito.
 */
public interface SourceDocumentResolver {

    Optional<Path> resolve(String lawId);
}
