package it.aw.legalgraph.model;

/**
 * Statistiche aggregate sullo stato del grafo di conoscenza.
 */
public record GraphStats(
        int  laws,
        int  chapters,
        int  articles,
        int  terms,
        long triples
) {}
