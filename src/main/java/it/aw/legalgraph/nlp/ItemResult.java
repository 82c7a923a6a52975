package it.aw.legalgraph.nlp;

import java.util.function.Supplier;

/**
 * Esito di un'operazione su un singolo elemento di un ciclo (un token, un campione):
 * valore oppure motivo dello scarto. Il ciclo esterno decide il fallback e va
 * sempre fino in fondo.
 */
public record ItemResult<T>(T value, String skipReason) {

    public static <T> ItemResult<T> ok(T value) {
        return new ItemResult<>(value, null);
    }

    public static <T> ItemResult<T> skipped(String reason) {
        return new ItemResult<>(null, reason);
    }

    public boolean isOk() {
        return skipReason == null;
    }

    public T orElse(T fallback) {
        return isOk() ? value : fallback;
    }

    public T orElseGet(Supplier<T> fallback) {
        return isOk() ? value : fallback.get();
    }
}
