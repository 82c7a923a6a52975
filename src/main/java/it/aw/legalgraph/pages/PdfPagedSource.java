package it.aw.legalgraph.pages;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * PDF su disco letto con PDFBox; l'impronta è la data di ultima modifica.
 */
public class PdfPagedSource implements PagedSource {

    private final Path file;

    public PdfPagedSource(Path file) {
        this.file = file;
    }

    @Override
    public String identity() {
        return file.toAbsolutePath().normalize().toString();
    }

    @Override
    public long fingerprint() throws IOException {
        return Files.getLastModifiedTime(file).toMillis();
    }

    @Override
    public PageReader open() throws IOException {
        PDDocument doc = PDDocument.load(file.toFile());
        PDFTextStripper stripper = new PDFTextStripper();
        return new PageReader() {
            @Override
            public int pageCount() {
                return doc.getNumberOfPages();
            }

            @Override
            public String pageText(int index) throws IOException {
                stripper.setStartPage(index + 1);
                stripper.setEndPage(index + 1);
                String text = stripper.getText(doc);
                return text != null ? text : "";
            }

            @Override
            public void close() throws IOException {
                doc.close();
            }
        };
    }

    @Override
    public String toString() {
        return file.getFileName().toString();
    }
}
