package io.github.flameyossnowy.datamapper.api.types;

import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps Java value classes to the {@link FieldType} used when a property is declared by class.
 */
public final class FieldTypeRegistry {
    private static final FieldTypeRegistry BUILT_IN;

    static {
        FieldTypeRegistry registry = new FieldTypeRegistry(new LinkedHashMap<>(16), false);
        registry.types.put(String.class, FieldType.STRING);
        registry.types.put(Integer.class, FieldType.INTEGER);
        registry.types.put(Long.class, FieldType.LONG);
        registry.types.put(Boolean.class, FieldType.BOOLEAN);
        registry.types.put(BigDecimal.class, FieldType.DECIMAL);
        registry.types.put(Double.class, FieldType.FLOAT);
        registry.types.put(LocalDateTime.class, FieldType.TIMESTAMP);
        registry.types.put(LocalDate.class, FieldType.DATE);
        BUILT_IN = registry;
    }

    private final Map<Class<?>, FieldType<?>> types;
    private final boolean mutable;

    private FieldTypeRegistry(Map<Class<?>, FieldType<?>> types, boolean mutable) {
        this.types = types;
        this.mutable = mutable;
    }

    /** A registry pre-populated with the built-in mappings that accepts custom types. */
    public FieldTypeRegistry() {
        this(new LinkedHashMap<>(BUILT_IN.types), true);
    }

    /** The shared, read-only registry of built-in mappings. */
    public static FieldTypeRegistry builtIn() {
        return BUILT_IN;
    }

    public <V> FieldTypeRegistry register(@NotNull Class<V> valueType, @NotNull FieldType<V> type) {
        if (!mutable) {
            throw new UnsupportedOperationException("The built-in registry cannot be modified, create a new FieldTypeRegistry instead");
        }
        Objects.requireNonNull(valueType, "valueType");
        Objects.requireNonNull(type, "type");
        types.put(valueType, type);
        return this;
    }

    public boolean isRegistered(@NotNull Class<?> valueType) {
        return types.containsKey(valueType);
    }

    @SuppressWarnings("unchecked")
    public <V> @NotNull FieldType<V> forClass(@NotNull Class<V> valueType) {
        FieldType<?> type = types.get(valueType);
        if (type == null) {
            throw new IllegalArgumentException("No field type registered for " + valueType.getName());
        }
        return (FieldType<V>) type;
    }

    public Map<Class<?>, FieldType<?>> types() {
        return Collections.unmodifiableMap(types);
    }
}
