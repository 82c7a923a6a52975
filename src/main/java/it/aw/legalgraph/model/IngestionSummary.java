package it.aw.legalgraph.model;

import java.util.List;

/**
 * Riepilogo di una ingestione. È tutto ciò che il chiamante riceve:
 * la persistenza nello storico upload è responsabilità sua.
 */
public record IngestionSummary(
        String               lawId,
        String               lawUri,
        int                  articlesCount,
        int                  chaptersCount,
        int                  termsCount,
        ExtractedEntities    entities,
        List<ReferenceMatch> references,
        List<KeyTerm>        keyTerms
) {}
