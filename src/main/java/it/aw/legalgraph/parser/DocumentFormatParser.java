package it.aw.legalgraph.parser;

import it.aw.legalgraph.model.ParsedDocument;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Parser specifico per uno o più formati. Le implementazioni sono registrate
 * come bean solo se la libreria che usano è presente.
 */
public interface DocumentFormatParser {

    Set<DocumentFormat> formats();

    ParsedDocument parse(Path file, DocumentFormat format) throws IOException;
}
