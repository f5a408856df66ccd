package io.github.flameyossnowy.datamapper.api.types;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.Nullable;

/**
 * Storage options a {@link FieldType} contributes to every property declared with it.
 * A {@code null} component means the type has no opinion and the property default applies.
 */
public record TypeOptions(
    @Nullable Integer length,
    @Nullable Integer precision,
    @Nullable Integer scale,
    @Nullable Boolean unique,
    @Nullable Boolean lazy,
    @Nullable Boolean serial,
    @Nullable Boolean nullable
) {
    public static final TypeOptions NONE = new TypeOptions(null, null, null, null, null, null, null);

    @Contract(pure = true)
    public TypeOptions withLength(int length) {
        return new TypeOptions(length, precision, scale, unique, lazy, serial, nullable);
    }

    @Contract(pure = true)
    public TypeOptions withPrecision(int precision, @Nullable Integer scale) {
        return new TypeOptions(length, precision, scale, unique, lazy, serial, nullable);
    }

    @Contract(pure = true)
    public TypeOptions withUnique(boolean unique) {
        return new TypeOptions(length, precision, scale, unique, lazy, serial, nullable);
    }

    @Contract(pure = true)
    public TypeOptions withLazy(boolean lazy) {
        return new TypeOptions(length, precision, scale, unique, lazy, serial, nullable);
    }

    @Contract(pure = true)
    public TypeOptions withSerial(boolean serial) {
        return new TypeOptions(length, precision, scale, unique, lazy, serial, nullable);
    }

    @Contract(pure = true)
    public TypeOptions withNullable(boolean nullable) {
        return new TypeOptions(length, precision, scale, unique, lazy, serial, nullable);
    }
}
