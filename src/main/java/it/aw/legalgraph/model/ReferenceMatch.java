package it.aw.legalgraph.model;

/**
 * Un rinvio trovato nel testo: connettivo, oggetto catturato fino alla
 * punteggiatura successiva e offset (0-based) dell'inizio del match.
 */
public record ReferenceMatch(
        ReferenceType type,
        String        text,
        int           position
) {}
