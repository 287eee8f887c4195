package confetti.lang;

import java.util.function.Supplier;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;

/**
 * A value computed on first use. Nested record mappings are resolved through
 * it so that a record type may refer to itself.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
final class Lazy<T> implements Supplier<T> {

    static <T> Lazy<T> lazy(@NonNull Supplier<T> supplier) {
        return new Lazy<>(supplier, null);
    }

    private Supplier<T> supplier;
    private T value;

    @Override
    public synchronized T get() {
        if (supplier != null) {
            value = supplier.get();
            supplier = null;
        }
        return value;
    }
}
