package it.aw.legalgraph.pages;

import it.aw.legalgraph.parser.StructureDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Numero articolo → pagina di inizio per sorgenti paginate, con scansione
 * incrementale e riprendibile.
 * <p>
 * Ogni chiamata scansiona solo le pagine necessarie a trovare i numeri richiesti,
 * ripartendo da dove si era fermata la precedente. Le pagine già viste non vengono
 * mai riscansionate; la sorgente è "completa" solo quando l'ultima pagina è stata letta.
 */
@Component
public class PageLocator {

    private static final Logger log = LoggerFactory.getLogger(PageLocator.class);

    private final PageIndexCache cache;

    public PageLocator(PageIndexCache cache) {
        this.cache = cache;
    }

    /**
     * @param needed numeri di articolo richiesti
     * @return la mappa nota (può non contenere tutti i numeri richiesti)
     */
    public Map<String, Integer> locate(PagedSource source, Collection<String> needed) {
        PageIndexKey key;
        try {
            key = new PageIndexKey(source.identity(), source.fingerprint());
        } catch (IOException e) {
            log.warn("PageLocator: impronta di {} non leggibile ({})", source, e.getMessage());
            return Map.of();
        }
        PageIndexState state = cache.stateFor(key);

        synchronized (state) {
            Map<String, Integer> pageMap = state.pageMap();
            if (needed.isEmpty() || pageMap.keySet().containsAll(needed) || state.isComplete()) {
                return Map.copyOf(pageMap);
            }

            Set<String> remaining = new HashSet<>(needed);
            remaining.removeAll(pageMap.keySet());
            int from = state.scannedPages();

            try (PagedSource.PageReader reader = source.open()) {
                int total = reader.pageCount();
                state.totalPages(total);

                for (int i = from; i < total && !remaining.isEmpty(); i++) {
                    remaining.removeAll(StructureDetector.recordArticleHeaders(reader.pageText(i), i + 1, pageMap));
                    state.advanceTo(i + 1);
                }
                if (state.scannedPages() >= total) {
                    state.markComplete();
                }
            } catch (IOException e) {
                log.warn("PageLocator: scansione di {} interrotta a pagina {} ({})",
                        source, state.scannedPages() + 1, e.getMessage());
            }

            log.debug("PageLocator: {} pagine {}..{} scansionate, {} articoli noti, completo={}",
                    source, from + 1, state.scannedPages(), pageMap.size(), state.isComplete());
            return Map.copyOf(pageMap);
        }
    }
}
