package it.aw.legalgraph.model;

import java.util.List;

/**
 * Entità estratte euristicamente da un testo normativo.
 */
public record ExtractedEntities(
        List<String> laws,      // citazioni di leggi: "Федеральный закон № 44-ФЗ", "ГК РФ"
        List<String> articles,  // numeri di articolo / punto citati, nell'ordine del testo
        List<String> dates,     // date D.M.YYYY senza duplicati
        List<String> terms      // sostantivi capitalizzati candidati a termine di dominio
) {

    public ExtractedEntities {
        laws = List.copyOf(laws);
        articles = List.copyOf(articles);
        dates = List.copyOf(dates);
        terms = List.copyOf(terms);
    }

    public int total() {
        return laws.size() + articles.size() + dates.size() + terms.size();
    }
}
