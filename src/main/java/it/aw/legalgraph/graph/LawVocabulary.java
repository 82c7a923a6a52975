package it.aw.legalgraph.graph;

import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.ResourceFactory;

/**
 * Vocabolario dell'ontologia: classi Law / Chapter / Article / Term e relazioni
 * di contenimento, rinvio e uso dei termini. Il namespace viene dalla configurazione.
 */
public final class LawVocabulary {

    public static final String DEFAULT_NAMESPACE = "http://law.ontology.ru/#";

    private final String namespace;

    public final Resource law;
    public final Resource chapter;
    public final Resource article;
    public final Resource term;

    public final Property hasTitle;
    public final Property hasDate;
    public final Property hasNumber;
    public final Property hasText;
    public final Property hasPage;
    public final Property containsChapter;
    public final Property containsArticle;
    public final Property belongsToLaw;
    public final Property references;
    public final Property referencesLaw;
    public final Property hasSynonym;
    public final Property definesTerm;
    public final Property usesTerm;

    public LawVocabulary(String namespace) {
        this.namespace = namespace;
        law = ResourceFactory.createResource(namespace + "Law");
        chapter = ResourceFactory.createResource(namespace + "Chapter");
        article = ResourceFactory.createResource(namespace + "Article");
        term = ResourceFactory.createResource(namespace + "Term");
        hasTitle = property("hasTitle");
        hasDate = property("hasDate");
        hasNumber = property("hasNumber");
        hasText = property("hasText");
        hasPage = property("hasPage");
        containsChapter = property("containsChapter");
        containsArticle = property("containsArticle");
        belongsToLaw = property("belongsToLaw");
        references = property("references");
        referencesLaw = property("referencesLaw");
        hasSynonym = property("hasSynonym");
        definesTerm = property("definesTerm");
        usesTerm = property("usesTerm");
    }

    private Property property(String localName) {
        return ResourceFactory.createProperty(namespace, localName);
    }

    public String namespace() {
        return namespace;
    }

    public String uri(String localId) {
        return namespace + localId;
    }

    /** Dichiarazione PREFIX per le query SPARQL. */
    public String sparqlPrefix() {
        return "PREFIX law: <" + namespace + ">\n";
    }
}
