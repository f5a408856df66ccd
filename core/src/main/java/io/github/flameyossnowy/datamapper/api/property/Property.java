package io.github.flameyossnowy.datamapper.api.property;

import io.github.flameyossnowy.datamapper.api.exceptions.PropertyDefinitionException;
import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.query.QueryTarget;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import io.github.flameyossnowy.datamapper.api.types.FieldKind;
import io.github.flameyossnowy.datamapper.api.types.FieldType;
import io.github.flameyossnowy.datamapper.api.types.TypeOptions;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A typed attribute of a {@link Model}. Properties own the field-level behaviour of a
 * resource: storage field name, defaulting, dirty tracking and lazy loading.
 * <p>
 * Two properties are equal when they belong to the same model class and share a name.
 *
 * @param <R> the resource class
 * @param <V> the value class
 */
public final class Property<R extends Resource, V> implements QueryTarget {
    public static final String DEFAULT_LAZY_CONTEXT = "default";

    private final Model<R> model;
    private final String name;
    private final FieldType<V> type;
    private final String repositoryName;
    private final int slot;

    private final @Nullable String explicitField;
    private volatile String field;

    private final boolean key;
    private final boolean serial;
    private final boolean nullable;
    private final boolean unique;
    private final boolean lazy;
    private final List<String> lazyContexts;
    private final PropertyIndex index;
    private final PropertyIndex uniqueIndex;
    private final @Nullable Integer length;
    private final @Nullable Integer precision;
    private final @Nullable Integer scale;
    private final @Nullable DefaultValue<R, V> defaultValue;
    private final Visibility readerVisibility;
    private final Visibility writerVisibility;

    /**
     * Creates a property. Declarations go through {@link Model#property}, which assigns the slot.
     *
     * @throws PropertyDefinitionException when the options are inconsistent with each other or with the type
     */
    @ApiStatus.Internal
    public Property(
        @NotNull Model<R> model,
        @NotNull String name,
        @NotNull FieldType<V> type,
        @NotNull PropertyOptions<R, V> options,
        int slot,
        @NotNull String repositoryName
    ) {
        this.model = Objects.requireNonNull(model, "model");
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
        this.repositoryName = Objects.requireNonNull(repositoryName, "repositoryName");
        this.slot = slot;

        List<String> problems = new ArrayList<>(options.getProblems());
        if (name.isBlank()) problems.add("name must not be blank");

        TypeOptions typeOptions = type.defaultOptions();

        this.explicitField = options.getField();
        this.key = Boolean.TRUE.equals(options.getKey());
        this.serial = firstNonNull(options.getSerial(), typeOptions.serial(), false);
        this.unique = firstNonNull(options.getUnique(), typeOptions.unique(), key || serial);
        this.nullable = firstNonNull(options.getNullable(), typeOptions.nullable(), !key);
        this.lazy = !key && firstNonNull(options.getLazy(), typeOptions.lazy(), false);

        if (lazy) {
            List<String> contexts = options.getLazyContexts();
            this.lazyContexts = contexts.isEmpty() ? List.of(DEFAULT_LAZY_CONTEXT) : List.copyOf(contexts);
        } else {
            this.lazyContexts = List.of();
        }

        this.index = options.getIndex();
        this.uniqueIndex = options.getUniqueIndex();
        this.defaultValue = options.getDefaultValue();

        if (serial && type.kind() != FieldKind.INTEGER) {
            problems.add("serial requires an integer type, got " + type.name());
        }

        if (options.getLength() != null && !type.isBounded()) {
            problems.add("length is only valid for bounded types, got " + type.name());
        }
        this.length = type.isBounded() ? firstNonNull(options.getLength(), typeOptions.length(), null) : null;

        boolean explicitPrecision = options.getPrecision() != null || options.getScale() != null;
        if (explicitPrecision && !type.kind().isFixedPoint()) {
            problems.add("precision and scale are only valid for decimal and float types, got " + type.name());
        }
        if (type.kind().isFixedPoint()) {
            this.precision = firstNonNull(options.getPrecision(), typeOptions.precision(), null);
            this.scale = firstNonNull(options.getScale(), typeOptions.scale(), null);
            if (precision != null && precision <= 0) {
                problems.add("precision must be greater than 0, got " + precision);
            }
            if (scale != null && scale < 0) {
                problems.add("scale must be greater than or equal to 0, got " + scale);
            }
            if (precision != null && scale != null && precision < scale) {
                problems.add("precision must be equal to or greater than scale, got " + precision + " and " + scale);
            }
        } else {
            this.precision = null;
            this.scale = null;
        }

        this.readerVisibility = firstNonNull(options.getReader(), null, Visibility.PUBLIC);
        this.writerVisibility = firstNonNull(options.getWriter(), null, Visibility.PUBLIC);

        if (!problems.isEmpty()) {
            throw new PropertyDefinitionException(model.name(), name, String.join(", ", problems));
        }
    }

    private static <T> T firstNonNull(@Nullable T explicit, @Nullable T fromType, T fallback) {
        if (explicit != null) return explicit;
        if (fromType != null) return fromType;
        return fallback;
    }

    @Override
    public @NotNull Property<R, V> property() {
        return this;
    }

    public Model<R> model() {
        return model;
    }

    public String name() {
        return name;
    }

    public FieldType<V> type() {
        return type;
    }

    public Class<V> valueType() {
        return type.valueType();
    }

    public Class<?> primitive() {
        return type.primitive();
    }

    public String repositoryName() {
        return repositoryName;
    }

    /** Position of this property's value inside a resource. Stable across redefinition. */
    public int slot() {
        return slot;
    }

    /**
     * The storage field name, resolved through the model's naming convention on first use.
     */
    public String field() {
        String resolved = field;
        if (resolved == null) {
            resolved = explicitField != null ? explicitField : model.fieldNamingConvention().apply(name);
            field = resolved;
        }
        return resolved;
    }

    public String field(@NotNull String repositoryName) {
        if (!this.repositoryName.equals(repositoryName)) {
            throw new IllegalArgumentException(
                "Property " + model.name() + '#' + name + " belongs to repository '" + this.repositoryName
                    + "', not '" + repositoryName + '\'');
        }
        return field();
    }

    public boolean isKey() {
        return key;
    }

    public boolean isSerial() {
        return serial;
    }

    public boolean isNullable() {
        return nullable;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isLazy() {
        return lazy;
    }

    public List<String> lazyContexts() {
        return lazyContexts;
    }

    public PropertyIndex index() {
        return index;
    }

    public PropertyIndex uniqueIndex() {
        return uniqueIndex;
    }

    public @Nullable Integer length() {
        return length;
    }

    public @Nullable Integer precision() {
        return precision;
    }

    public @Nullable Integer scale() {
        return scale;
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    public @Nullable DefaultValue<R, V> defaultValue() {
        return defaultValue;
    }

    public Visibility readerVisibility() {
        return readerVisibility;
    }

    public Visibility writerVisibility() {
        return writerVisibility;
    }

    public boolean isBoolean() {
        return type.isBoolean();
    }

    public boolean isCustom() {
        return type.isCustom();
    }

    /**
     * Reads the value, computing the default for a new resource or lazily loading it
     * for a persisted one.
     */
    public @Nullable V get(@Nullable R resource) {
        if (resource == null) return null;

        if (isLoaded(resource)) return getRaw(resource);

        if (resource.isNew()) {
            if (defaultValue == null) return null;
            return set(resource, defaultValue.resolve(resource, this));
        }

        lazyLoad(resource);
        return getRaw(resource);
    }

    /**
     * Assigns a value and tracks the change.
     *
     * @return the value now held by the resource
     */
    public @Nullable V set(@NotNull R resource, @Nullable V value) {
        boolean loaded = isLoaded(resource);
        V current = loaded ? getRaw(resource) : null;
        if (loaded && Objects.equals(current, value)) return current;

        resource.trackChange(this, loaded ? current : Resource.UNSET, value);
        setRaw(resource, value);
        return value;
    }

    @SuppressWarnings("unchecked")
    public @Nullable V getRaw(@NotNull R resource) {
        return (V) resource.readSlot(slot);
    }

    public void setRaw(@NotNull R resource, @Nullable V value) {
        resource.writeSlot(slot, value);
    }

    public boolean isLoaded(@NotNull Resource resource) {
        return resource.isSlotLoaded(slot);
    }

    /**
     * Loads this property and everything that shares its loading context.
     */
    public void lazyLoad(@NotNull R resource) {
        List<String> names;
        if (lazy) {
            names = List.of(name);
        } else {
            List<Property<R, ?>> defaults = model.properties(resource.repositoryName()).defaults();
            names = new ArrayList<>(defaults.size());
            for (Property<R, ?> property : defaults) names.add(property.name());
        }
        model.lazyLoad(resource, names);
    }

    /** The primitive stored for {@code value}. */
    public @Nullable Object value(@Nullable V value) {
        return type.dump(value, this);
    }

    /** The stored primitive of whatever the resource currently holds for this property. */
    @SuppressWarnings("unchecked")
    public @Nullable Object dumpFrom(@NotNull Resource resource) {
        return value((V) resource.readSlot(slot));
    }

    /**
     * Dumps an arbitrary condition operand, leaving anything that is not a value of this type as is.
     */
    public @Nullable Object dumpOperand(@Nullable Object operand) {
        if (operand == null || !type.isCustom() || !type.valueType().isInstance(operand)) return operand;
        return value(type.valueType().cast(operand));
    }

    /** Decodes a primitive read from the repository. */
    public @Nullable V load(@Nullable Object primitive) {
        return type.load(primitive, this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Property<?, ?> other)) return false;
        return model.type() == other.model.type() && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return 31 * model.type().hashCode() + name.hashCode();
    }

    @Override
    public String toString() {
        return "Property[" + model.name() + '#' + name + ", " + type.name() + ']';
    }
}
