package it.aw.legalgraph.pages;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stato di scansione di una sorgente paginata. Cresce in modo monotono:
 * pageMap acquisisce solo nuove voci, scannedPages non diminuisce mai.
 * <p>
 * Non thread-safe: {@link PageLocator} sincronizza sull'istanza.
 */
public class PageIndexState {

    private final Map<String, Integer> pageMap = new LinkedHashMap<>();
    private int scannedPages;
    private Integer totalPages;
    private boolean complete;

    Map<String, Integer> pageMap() {
        return pageMap;
    }

    public synchronized int scannedPages() {
        return scannedPages;
    }

    /** Null finché la sorgente non è stata aperta almeno una volta. */
    public synchronized Integer totalPages() {
        return totalPages;
    }

    public synchronized boolean isComplete() {
        return complete;
    }

    void advanceTo(int pages) {
        if (pages > scannedPages) scannedPages = pages;
    }

    void totalPages(int total) {
        this.totalPages = total;
    }

    void markComplete() {
        this.complete = true;
    }
}
