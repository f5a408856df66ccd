package io.github.flameyossnowy.datamapper.api.types;

import io.github.flameyossnowy.datamapper.api.property.Property;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Describes how values of one Java class are stored: their {@link FieldKind}, the
 * primitive handed to the driver, whether the column is size-bounded, and the
 * storage options every property of this type starts from.
 *
 * <p>Built-in types store their values unchanged and only coerce what the driver
 * hands back (a SQLite {@code INTEGER} column comes back as {@link Integer} even
 * for a {@code Long} property, booleans come back as {@code 0}/{@code 1}, and so on).
 * Types that need a real conversion in both directions extend {@link CustomType}.</p>
 *
 * @param <V> the Java value class
 */
public class FieldType<V> {
    public static final int DEFAULT_LENGTH = 50;
    public static final int DEFAULT_TEXT_LENGTH = 65535;
    public static final int DEFAULT_PRECISION = 10;
    public static final int DEFAULT_DECIMAL_SCALE = 0;

    public static final FieldType<String> STRING = new FieldType<>(
        "String", FieldKind.TEXT, String.class, String.class, true,
        TypeOptions.NONE.withLength(DEFAULT_LENGTH));

    public static final FieldType<String> TEXT = new FieldType<>(
        "Text", FieldKind.TEXT, String.class, String.class, true,
        TypeOptions.NONE.withLength(DEFAULT_TEXT_LENGTH).withLazy(true));

    public static final FieldType<Integer> INTEGER = new FieldType<>(
        "Integer", FieldKind.INTEGER, Integer.class, Integer.class, false, TypeOptions.NONE);

    public static final FieldType<Long> LONG = new FieldType<>(
        "Long", FieldKind.INTEGER, Long.class, Long.class, false, TypeOptions.NONE);

    public static final FieldType<Long> SERIAL = new FieldType<>(
        "Serial", FieldKind.INTEGER, Long.class, Long.class, false,
        TypeOptions.NONE.withSerial(true));

    public static final FieldType<Boolean> BOOLEAN = new FieldType<>(
        "Boolean", FieldKind.BOOLEAN, Boolean.class, Boolean.class, false, TypeOptions.NONE);

    public static final FieldType<BigDecimal> DECIMAL = new FieldType<>(
        "Decimal", FieldKind.DECIMAL, BigDecimal.class, BigDecimal.class, false,
        TypeOptions.NONE.withPrecision(DEFAULT_PRECISION, DEFAULT_DECIMAL_SCALE));

    public static final FieldType<Double> FLOAT = new FieldType<>(
        "Float", FieldKind.FLOAT, Double.class, Double.class, false,
        TypeOptions.NONE.withPrecision(DEFAULT_PRECISION, null));

    public static final FieldType<LocalDateTime> TIMESTAMP = new FieldType<>(
        "Timestamp", FieldKind.TIMESTAMP, LocalDateTime.class, LocalDateTime.class, false, TypeOptions.NONE);

    public static final FieldType<LocalDate> DATE = new FieldType<>(
        "Date", FieldKind.DATE, LocalDate.class, LocalDate.class, false, TypeOptions.NONE);

    private final String name;
    private final FieldKind kind;
    private final Class<V> valueType;
    private final Class<?> primitive;
    private final boolean bounded;
    private final TypeOptions defaultOptions;

    protected FieldType(
        @NotNull String name,
        @NotNull FieldKind kind,
        @NotNull Class<V> valueType,
        @NotNull Class<?> primitive,
        boolean bounded,
        @NotNull TypeOptions defaultOptions
    ) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.valueType = Objects.requireNonNull(valueType, "valueType");
        this.primitive = Objects.requireNonNull(primitive, "primitive");
        this.bounded = bounded;
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions");
    }

    public String name() {
        return name;
    }

    public FieldKind kind() {
        return kind;
    }

    public Class<V> valueType() {
        return valueType;
    }

    /** The class of the value actually handed to, and read back from, the driver. */
    public Class<?> primitive() {
        return primitive;
    }

    /** Whether a {@code length} option is meaningful for this type. */
    public boolean isBounded() {
        return bounded;
    }

    public TypeOptions defaultOptions() {
        return defaultOptions;
    }

    public boolean isCustom() {
        return false;
    }

    public boolean isBoolean() {
        return kind == FieldKind.BOOLEAN;
    }

    /**
     * Converts a value into the primitive stored in the repository.
     * Built-in types store values unchanged.
     */
    public @Nullable Object dump(@Nullable V value, @NotNull Property<?, V> property) {
        return value;
    }

    /**
     * Converts a primitive read from the repository back into a value of this type.
     */
    public @Nullable V load(@Nullable Object primitive, @NotNull Property<?, V> property) {
        if (primitive == null) return null;
        if (valueType.isInstance(primitive)) return valueType.cast(primitive);
        return valueType.cast(coerce(primitive));
    }

    private Object coerce(Object primitive) {
        if (valueType == Integer.class && primitive instanceof Number number) return number.intValue();
        if (valueType == Long.class && primitive instanceof Number number) return number.longValue();
        if (valueType == Double.class && primitive instanceof Number number) return number.doubleValue();
        if (valueType == BigDecimal.class) return new BigDecimal(primitive.toString());
        if (valueType == Boolean.class) {
            if (primitive instanceof Number number) return number.intValue() != 0;
            return Boolean.parseBoolean(primitive.toString()) || "t".equalsIgnoreCase(primitive.toString());
        }
        if (valueType == String.class) return primitive.toString();
        if (valueType == LocalDateTime.class) return toDateTime(primitive);
        if (valueType == LocalDate.class) return toDate(primitive);
        if (valueType == Integer.class) return Integer.valueOf(primitive.toString());
        if (valueType == Long.class) return Long.valueOf(primitive.toString());
        if (valueType == Double.class) return Double.valueOf(primitive.toString());
        throw new IllegalArgumentException("Cannot load " + primitive.getClass().getName() + " as " + name);
    }

    private static LocalDateTime toDateTime(Object primitive) {
        if (primitive instanceof Timestamp timestamp) return timestamp.toLocalDateTime();
        if (primitive instanceof java.util.Date date) return LocalDateTime.ofInstant(date.toInstant(), ZoneId.systemDefault());
        if (primitive instanceof Number millis) return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis.longValue()), ZoneId.systemDefault());
        return LocalDateTime.parse(primitive.toString().replace(' ', 'T'));
    }

    private static LocalDate toDate(Object primitive) {
        if (primitive instanceof java.sql.Date date) return date.toLocalDate();
        if (primitive instanceof Timestamp timestamp) return timestamp.toLocalDateTime().toLocalDate();
        if (primitive instanceof Number millis) return LocalDate.ofInstant(Instant.ofEpochMilli(millis.longValue()), ZoneId.systemDefault());
        String text = primitive.toString();
        return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    }

    @Override
    public String toString() {
        return "FieldType[" + name + ']';
    }
}
