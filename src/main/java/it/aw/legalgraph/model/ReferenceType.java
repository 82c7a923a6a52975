package it.aw.legalgraph.model;

/**
 * Connettivo che ha introdotto un rinvio normativo.
 * La label è il tag semantico storico, conservato così com'è nei riepiloghi.
 */
public enum ReferenceType {

    ACCORDANCE("соответствие"),   // "в соответствии с ..."
    ACCORDING_TO("согласно"),     // "согласно ..."
    BY_VIRTUE_OF("сила"),         // "в силу ..."
    ON_THE_BASIS_OF("основание"); // "на основании ..."

    private final String label;

    ReferenceType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
