package io.github.flameyossnowy.datamapper.api.query;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A closed range, or a half-open one when {@code excludeEnd} is set.
 *
 * @param <C> bound type
 */
public record Range<C extends Comparable<? super C>>(@NotNull C min, @NotNull C max, boolean excludeEnd) {
    public Range {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
    }

    @Contract("_, _ -> new")
    public static <C extends Comparable<? super C>> @NotNull Range<C> inclusive(@NotNull C min, @NotNull C max) {
        return new Range<>(min, max, false);
    }

    @Contract("_, _ -> new")
    public static <C extends Comparable<? super C>> @NotNull Range<C> exclusive(@NotNull C min, @NotNull C max) {
        return new Range<>(min, max, true);
    }

    public boolean contains(@NotNull C value) {
        if (value.compareTo(min) < 0) return false;
        int upper = value.compareTo(max);
        return excludeEnd ? upper < 0 : upper <= 0;
    }

    @Override
    public String toString() {
        return min + (excludeEnd ? "..." : "..") + max;
    }
}
