package it.aw.legalgraph.service;

import it.aw.legalgraph.model.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Cerca nella directory dei documenti sorgente un file il cui nome normalizzato
 * coincide con il lawId. La directory è letta a ogni chiamata.
 */
@Component
public class InputDirectorySourceResolver implements SourceDocumentResolver {

    private static final Logger log = LoggerFactory.getLogger(InputDirectorySourceResolver.class);

    private final Path inputDir;

    public InputDirectorySourceResolver(@Value("${legalgraph.data.input-dir:data/raw}") String inputDir) {
        this.inputDir = Paths.get(inputDir);
    }

    @Override
    public Optional<Path> resolve(String lawId) {
        if (lawId == null || !Files.isDirectory(inputDir)) return Optional.empty();
        try (Stream<Path> files = Files.list(inputDir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(f -> lawId.equals(Identifiers.lawId(f)))
                    .sorted()
                    .findFirst();
        } catch (IOException e) {
            log.warn("Impossibile leggere {}: {}", inputDir.toAbsolutePath(), e.getMessage());
            return Optional.empty();
        }
    }
}
