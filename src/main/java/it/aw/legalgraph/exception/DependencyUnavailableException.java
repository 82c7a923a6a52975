package it.aw.legalgraph.exception;

/**
 * Una capacità di parsing o analisi richiesta non è disponibile
 * (libreria assente dal classpath o disabilitata da configurazione).
 */
public class DependencyUnavailableException extends LegalGraphException {

    private final String capability;

    public DependencyUnavailableException(final String capability, final String message) {
        super(message);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
