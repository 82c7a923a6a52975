package it.aw.legalgraph.pages;

import java.io.IOException;

/**
 * Sorgente il cui testo si estrae pagina per pagina.
 */
public interface PagedSource {

    /** Identità stabile della sorgente (es. percorso assoluto). */
    String identity();

    /** Cambia quando cambia il contenuto. */
    long fingerprint() throws IOException;

    PageReader open() throws IOException;

    interface PageReader extends AutoCloseable {

        int pageCount();

        /** Testo della pagina, indice 0-based; stringa vuota se la pagina non ha testo. */
        String pageText(int index) throws IOException;

        @Override
        void close() throws IOException;
    }
}
