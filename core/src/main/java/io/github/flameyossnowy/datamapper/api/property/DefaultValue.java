package io.github.flameyossnowy.datamapper.api.property;

import io.github.flameyossnowy.datamapper.api.resource.Resource;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * The value a property takes on a new resource when nothing was assigned.
 *
 * @param <R> resource type
 * @param <V> value type
 */
public sealed interface DefaultValue<R extends Resource, V> {

    V resolve(@NotNull R resource, @NotNull Property<R, V> property);

    static <R extends Resource, V> DefaultValue<R, V> of(@NotNull V value) {
        return new Static<>(value);
    }

    static <R extends Resource, V> DefaultValue<R, V> computed(@NotNull BiFunction<? super R, ? super Property<R, V>, ? extends V> provider) {
        return new Computed<>(provider);
    }

    /**
     * A fixed value. Mutable collections, maps and arrays are copied on every
     * resolution so resources never share them.
     */
    record Static<R extends Resource, V>(@NotNull V value) implements DefaultValue<R, V> {
        public Static {
            Objects.requireNonNull(value, "value");
        }

        @Override
        @SuppressWarnings("unchecked")
        public V resolve(@NotNull R resource, @NotNull Property<R, V> property) {
            return (V) copyOf(value);
        }

        private static Object copyOf(Object value) {
            if (value instanceof List<?> list) return new ArrayList<>(list);
            if (value instanceof Set<?> set) return new LinkedHashSet<>(set);
            if (value instanceof Collection<?> collection) return new ArrayList<>(collection);
            if (value instanceof Map<?, ?> map) return new LinkedHashMap<>(map);
            if (value.getClass().isArray()) {
                int length = Array.getLength(value);
                Object copy = Array.newInstance(value.getClass().getComponentType(), length);
                System.arraycopy(value, 0, copy, 0, length);
                return copy;
            }
            return value;
        }
    }

    record Computed<R extends Resource, V>(
        @NotNull BiFunction<? super R, ? super Property<R, V>, ? extends V> provider
    ) implements DefaultValue<R, V> {
        public Computed {
            Objects.requireNonNull(provider, "provider");
        }

        @Override
        public V resolve(@NotNull R resource, @NotNull Property<R, V> property) {
            return provider.apply(resource, property);
        }
    }
}
