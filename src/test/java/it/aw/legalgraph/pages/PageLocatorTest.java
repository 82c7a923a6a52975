package it.aw.legalgraph.pages;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PageLocatorTest {

    private PageIndexCache cache;
    private PageLocator locator;

    @BeforeEach
    void setUp() {
        cache = new PageIndexCache();
        locator = new PageLocator(cache);
    }

    @Test
    void scanResumesWhereItStopped() {
        FakeSource source = tenPages(1L);

        assertEquals(Map.of("5", 3), locator.locate(source, Set.of("5")));
        PageIndexState state = cache.find(source.key()).orElseThrow();
        assertEquals(3, state.scannedPages());
        assertEquals(10, state.totalPages());
        assertFalse(state.isComplete());
        assertEquals(List.of(0, 1, 2), source.reads);

        Map<String, Integer> map = locator.locate(source, Set.of("9"));
        assertEquals(8, map.get("9"));
        assertEquals(3, map.get("5"));
        assertEquals(8, state.scannedPages());
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7), source.reads);
    }

    @Test
    void knownNumbersNeedNoScan() {
        FakeSource source = tenPages(1L);
        locator.locate(source, Set.of("9"));
        int reads = source.reads.size();
        int opens = source.opens;

        assertEquals(Map.of("5", 3, "9", 8), locator.locate(source, Set.of("5", "9")));
        assertEquals(reads, source.reads.size());
        assertEquals(opens, source.opens);
    }

    @Test
    void completeSourceIsNeverRescanned() {
        FakeSource source = tenPages(1L);

        Map<String, Integer> map = locator.locate(source, Set.of("42"));
        PageIndexState state = cache.find(source.key()).orElseThrow();
        assertTrue(state.isComplete());
        assertEquals(10, state.scannedPages());
        assertEquals(Map.of("5", 3, "9", 8), map);

        int reads = source.reads.size();
        assertEquals(map, locator.locate(source, Set.of("43")));
        assertEquals(reads, source.reads.size());
    }

    @Test
    void changedFingerprintStartsOver() {
        FakeSource first = tenPages(1L);
        locator.locate(first, Set.of("42"));

        FakeSource modified = tenPages(2L);
        assertEquals(Map.of("5", 3), locator.locate(modified, Set.of("5")));
        assertEquals(List.of(0, 1, 2), modified.reads);
        assertEquals(2, cache.size());
    }

    @Test
    void readFailureKeepsBestKnownMap() {
        FakeSource source = tenPages(1L);
        source.failAt = 5;

        assertEquals(Map.of("5", 3), locator.locate(source, Set.of("9")));
        PageIndexState state = cache.find(source.key()).orElseThrow();
        assertEquals(5, state.scannedPages());
        assertFalse(state.isComplete());

        source.failAt = -1;
        assertEquals(8, locator.locate(source, Set.of("9")).get("9"));
    }

    private static FakeSource tenPages(long fingerprint) {
        List<String> pages = new ArrayList<>();
        for (int i = 1; i <= 10; i++) pages.add("Страница " + i + "\nсогласно статье 9");
        pages.set(2, "Глава 1\nСтатья 5. Предмет регулирования");
        pages.set(7, "окончание\n Статья 9. Заключительные положения");
        return new FakeSource("memory://закон.pdf", fingerprint, pages);
    }

    private static final class FakeSource implements PagedSource {

        private final String id;
        private final long fingerprint;
        private final List<String> pages;
        final List<Integer> reads = new ArrayList<>();
        int opens;
        int failAt = -1;

        FakeSource(String id, long fingerprint, List<String> pages) {
            this.id = id;
            this.fingerprint = fingerprint;
            this.pages = pages;
        }

        PageIndexKey key() {
            return new PageIndexKey(id, fingerprint);
        }

        @Override
        public String identity() {
            return id;
        }

        @Override
        public long fingerprint() {
            return fingerprint;
        }

        @Override
        public PageReader open() {
            opens++;
            return new PageReader() {
                @Override
                public int pageCount() {
                    return pages.size();
                }

                @Override
                public String pageText(int index) throws IOException {
                    if (index == failAt) throw new IOException("pagina illeggibile");
                    reads.add(index);
                    return pages.get(index);
                }

                @Override
                public void close() {
                }
            };
        }
    }
}
