package it.aw.legalgraph.pages;

/**
 * Chiave della cache: identità della sorgente + impronta del contenuto.
 * Una sorgente modificata cambia impronta e riparte da uno stato vuoto.
 */
public record PageIndexKey(
        String sourceId,
        long   fingerprint   // es. lastModified in millisecondi
) {}
