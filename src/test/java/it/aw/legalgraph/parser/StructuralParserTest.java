package it.aw.legalgraph.parser;

import it.aw.legalgraph.exception.DependencyUnavailableException;
import it.aw.legalgraph.exception.UnsupportedFormatException;
import it.aw.legalgraph.model.ParsedDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructuralParserTest {

    private final StructuralParser parser = new StructuralParser(List.of(
            new PlainTextDocumentParser(), new MarkupDocumentParser(), new PdfDocumentParser()));

    @Test
    void unknownExtensionIsRejected(@TempDir Path tmp) throws Exception {
        Path file = Files.writeString(tmp.resolve("zakon.docx"), "Статья 1. Текст.");

        UnsupportedFormatException e = assertThrows(UnsupportedFormatException.class, () -> parser.parse(file));
        assertEquals("docx", e.getExtension());
    }

    @Test
    void missingFormatParserFailsAtCallTime(@TempDir Path tmp) throws Exception {
        StructuralParser textOnly = new StructuralParser(List.of(new PlainTextDocumentParser()));
        Path file = Files.write(tmp.resolve("zakon.pdf"), new byte[]{1, 2, 3});

        assertFalse(textOnly.supports(DocumentFormat.PDF));
        DependencyUnavailableException e = assertThrows(DependencyUnavailableException.class, () -> textOnly.parse(file));
        assertEquals("pdf", e.getCapability());
    }

    @Test
    void zeroByteDocumentIsEmptyNotAnError(@TempDir Path tmp) throws Exception {
        Path file = Files.createFile(tmp.resolve("pustoy.pdf"));

        ParsedDocument doc = parser.parse(file);

        assertEquals("pustoy", doc.title());
        assertTrue(doc.chapters().isEmpty());
        assertTrue(doc.articles().isEmpty());
        assertEquals("", doc.fullText());
    }

    @Test
    void plainTextDocument(@TempDir Path tmp) throws Exception {
        Path file = Files.writeString(tmp.resolve("Zakon o svyazi.txt"),
                "Глава 1. Общие положения\nСтатья 1. Текст один.\nСтатья 2. Текст два.");

        ParsedDocument doc = parser.parse(file);

        assertEquals("Zakon o svyazi", doc.title());
        assertEquals(1, doc.chapters().size());
        assertEquals(2, doc.articles().size());
        assertEquals("Текст два.", doc.articles().get(1).text());
        assertTrue(doc.fullText().startsWith("Глава 1."));
    }

    @Test
    void pagesAreJoinedAndAttachedToArticles() {
        ParsedDocument doc = PdfDocumentParser.fromPages("кодекс", List.of(
                "Кодекс\nСтатья 1. Первая статья",
                "продолжение, см. ст. 2\nСтатья 2. Вторая статья",
                "Статья 3. Третья"));

        assertEquals(3, doc.articles().size());
        assertEquals(1, doc.articles().get(0).page());
        assertEquals(2, doc.articles().get(1).page());
        assertEquals(3, doc.articles().get(2).page());
        assertTrue(doc.fullText().contains("статья\nпродолжение"));
    }
}
