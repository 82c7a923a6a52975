package it.aw.legalgraph.model;

/**
 * Capo (глава / chapter) recuperato dal documento sorgente.
 * Il numero è una stringa: può essere non numerico o composito ("IV", "2.1").
 */
public record ParsedChapter(
        String number,
        String title,   // può essere vuoto; per testo piano è troncato a 100 caratteri
        String text
) {}
