package it.aw.legalgraph.pages;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache in memoria, per la durata del processo, degli stati di scansione.
 * Nessuna eviction: le voci di impronte superate restano ma non sono più raggiunte.
 */
@Component
public class PageIndexCache {

    private final Map<PageIndexKey, PageIndexState> states = new ConcurrentHashMap<>();

    PageIndexState stateFor(PageIndexKey key) {
        return states.computeIfAbsent(key, k -> new PageIndexState());
    }

    public Optional<PageIndexState> find(PageIndexKey key) {
        return Optional.ofNullable(states.get(key));
    }

    public int size() {
        return states.size();
    }
}
