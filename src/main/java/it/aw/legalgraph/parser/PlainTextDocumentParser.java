package it.aw.legalgraph.parser;

import it.aw.legalgraph.model.Identifiers;
import it.aw.legalgraph.model.ParsedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;

/**
 * Testo piano UTF-8: la struttura è recuperata solo per pattern.
 * Le sequenze UTF-8 non valide vengono sostituite, non fanno fallire il parsing.
 */
public class PlainTextDocumentParser implements DocumentFormatParser {

    private static final Logger log = LoggerFactory.getLogger(PlainTextDocumentParser.class);

    @Override
    public Set<DocumentFormat> formats() {
        return EnumSet.of(DocumentFormat.TXT);
    }

    @Override
    public ParsedDocument parse(Path file, DocumentFormat format) throws IOException {
        String fullText = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        ParsedDocument parsed = fromText(Identifiers.fileStem(file), fullText);
        log.debug("Testo {}: {} capi, {} articoli", file.getFileName(),
                parsed.chapters().size(), parsed.articles().size());
        return parsed;
    }

    static ParsedDocument fromText(String title, String fullText) {
        return new ParsedDocument(title,
                StructureDetector.chapters(fullText),
                StructureDetector.articles(fullText),
                fullText);
    }
}
