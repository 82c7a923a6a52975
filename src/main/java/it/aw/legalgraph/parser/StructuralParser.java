package it.aw.legalgraph.parser;

import it.aw.legalgraph.exception.DependencyUnavailableException;
import it.aw.legalgraph.exception.DocumentParsingException;
import it.aw.legalgraph.model.Identifiers;
import it.aw.legalgraph.model.ParsedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Converte un documento sorgente nel record normalizzato
 * {title, chapters, articles, fullText}, scegliendo il parser in base all'estensione.
 * <p>
 * I parser dei singoli formati sono bean opzionali: se la libreria di un formato
 * supportato manca, l'errore arriva alla chiamata ({@link DependencyUnavailableException}),
 * non all'avvio.
 */
@Service
public class StructuralParser {

    private static final Logger log = LoggerFactory.getLogger(StructuralParser.class);

    private final Map<DocumentFormat, DocumentFormatParser> parsers = new EnumMap<>(DocumentFormat.class);

    public StructuralParser(List<DocumentFormatParser> formatParsers) {
        for (DocumentFormatParser p : formatParsers) {
            for (DocumentFormat f : p.formats()) parsers.putIfAbsent(f, p);
        }
        log.info("StructuralParser: formati disponibili {}", parsers.keySet());
    }

    public ParsedDocument parse(Path file) {
        DocumentFormat format = DocumentFormat.of(file);
        DocumentFormatParser parser = parsers.get(format);
        if (parser == null) {
            throw new DependencyUnavailableException(format.extension(),
                    "Parser per il formato " + format.extension() + " non disponibile: libreria assente o disabilitata");
        }
        try {
            if (Files.size(file) == 0) {
                log.debug("File vuoto {}: nessuna struttura", file.getFileName());
                return ParsedDocument.empty(Identifiers.fileStem(file));
            }
            return parser.parse(file, format);
        } catch (IOException e) {
            throw new DocumentParsingException("Errore lettura documento " + file, e);
        }
    }

    public boolean supports(DocumentFormat format) {
        return parsers.containsKey(format);
    }
}
