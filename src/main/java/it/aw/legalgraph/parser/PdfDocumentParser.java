package it.aw.legalgraph.parser;

import it.aw.legalgraph.model.Identifiers;
import it.aw.legalgraph.model.ParsedArticle;
import it.aw.legalgraph.model.ParsedDocument;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsatore PDF pagina per pagina via PDFBox.
 * <p>
 * Il testo delle pagine è concatenato con un '\n' di separazione per formare il
 * fullText su cui si recuperano capi e articoli. In parallelo ogni pagina è
 * riscansionata da sola cercando intestazioni "Статья N" a inizio riga: la prima
 * pagina in cui compare l'intestazione diventa la pagina dell'articolo.
 */
public class PdfDocumentParser implements DocumentFormatParser {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentParser.class);

    @Override
    public Set<DocumentFormat> formats() {
        return EnumSet.of(DocumentFormat.PDF);
    }

    @Override
    public ParsedDocument parse(Path file, DocumentFormat format) throws IOException {
        List<String> pageTexts = extractPages(file);
        return fromPages(Identifiers.fileStem(file), pageTexts);
    }

    /**
     * Testo estratto di ogni pagina, indice 0 = pagina 1.
     * Le pagine senza layer testuale producono stringa vuota.
     */
    public static List<String> extractPages(Path file) throws IOException {
        try (PDDocument doc = PDDocument.load(file.toFile())) {
            int totalPages = doc.getNumberOfPages();
            log.debug("PdfDocumentParser: {} pagine trovate in {}", totalPages, file.getFileName());

            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>(totalPages);
            for (int p = 1; p <= totalPages; p++) {
                stripper.setStartPage(p);
                stripper.setEndPage(p);
                String text = stripper.getText(doc);
                pages.add(text != null ? text : "");
            }
            return pages;
        }
    }

    static ParsedDocument fromPages(String title, List<String> pageTexts) {
        String fullText = String.join("\n", pageTexts);
        List<ParsedArticle> articles = StructureDetector.articles(fullText);

        Map<String, Integer> pageMap = StructureDetector.articlePageMap(pageTexts);
        List<ParsedArticle> withPages = new ArrayList<>(articles.size());
        for (ParsedArticle a : articles) {
            withPages.add(a.withPage(pageMap.get(a.number())));
        }
        log.debug("PDF {}: {} articoli, {} intestazioni a inizio riga", title, withPages.size(), pageMap.size());

        return new ParsedDocument(title, StructureDetector.chapters(fullText), withPages, fullText);
    }
}
