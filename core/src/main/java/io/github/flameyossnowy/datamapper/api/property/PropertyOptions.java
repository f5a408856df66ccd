package io.github.flameyossnowy.datamapper.api.property;

import io.github.flameyossnowy.datamapper.api.resource.Resource;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Fluent configuration for a property declaration.
 * <pre>{@code
 * Property<Heffalump, String> color = MODEL.property("color", FieldType.STRING,
 *     PropertyOptions.<Heffalump, String>options().length(20).index());
 * }</pre>
 * Values are validated when the property is created; a {@code null} component means
 * "not given", in which case the field type's options and then the built-in rules apply.
 */
public final class PropertyOptions<R extends Resource, V> {
    private String field;
    private Integer length;
    private Integer precision;
    private Integer scale;
    private Boolean key;
    private Boolean serial;
    private Boolean nullable;
    private Boolean unique;
    private Boolean lazy;
    private final List<String> lazyContexts = new ArrayList<>(2);
    private PropertyIndex index = PropertyIndex.NONE;
    private PropertyIndex uniqueIndex = PropertyIndex.NONE;
    private DefaultValue<R, V> defaultValue;
    private Visibility reader;
    private Visibility writer;
    private final List<String> problems = new ArrayList<>(1);

    @Contract(value = " -> new", pure = true)
    public static <R extends Resource, V> @NotNull PropertyOptions<R, V> options() {
        return new PropertyOptions<>();
    }

    public PropertyOptions<R, V> field(@NotNull String field) {
        if (field.isBlank()) problems.add("field name must not be blank");
        this.field = field;
        return this;
    }

    public PropertyOptions<R, V> length(int length) {
        if (length <= 0) problems.add("length must be positive, got " + length);
        this.length = length;
        return this;
    }

    public PropertyOptions<R, V> precision(int precision) {
        this.precision = precision;
        return this;
    }

    public PropertyOptions<R, V> precision(int precision, int scale) {
        this.precision = precision;
        this.scale = scale;
        return this;
    }

    public PropertyOptions<R, V> scale(int scale) {
        this.scale = scale;
        return this;
    }

    public PropertyOptions<R, V> key() {
        return key(true);
    }

    public PropertyOptions<R, V> key(boolean key) {
        this.key = key;
        return this;
    }

    public PropertyOptions<R, V> serial() {
        this.serial = true;
        return this;
    }

    public PropertyOptions<R, V> nullable(boolean nullable) {
        this.nullable = nullable;
        return this;
    }

    public PropertyOptions<R, V> required() {
        return nullable(false);
    }

    public PropertyOptions<R, V> unique() {
        return unique(true);
    }

    public PropertyOptions<R, V> unique(boolean unique) {
        this.unique = unique;
        return this;
    }

    public PropertyOptions<R, V> lazy(boolean lazy) {
        this.lazy = lazy;
        if (!lazy) lazyContexts.clear();
        return this;
    }

    /** Lazy, loaded together with every other property registered in the given contexts. */
    public PropertyOptions<R, V> lazy(@NotNull String... contexts) {
        if (contexts.length == 0) problems.add("lazy contexts must not be empty");
        this.lazy = true;
        for (String context : contexts) {
            if (!lazyContexts.contains(context)) lazyContexts.add(context);
        }
        return this;
    }

    /** An index over this property alone. */
    public PropertyOptions<R, V> index() {
        this.index = index.withAnonymous();
        return this;
    }

    /** Participate in the given named composite indexes. */
    public PropertyOptions<R, V> index(@NotNull String... names) {
        this.index = index.withNamed(names);
        return this;
    }

    public PropertyOptions<R, V> uniqueIndex() {
        this.uniqueIndex = uniqueIndex.withAnonymous();
        return this;
    }

    public PropertyOptions<R, V> uniqueIndex(@NotNull String... names) {
        this.uniqueIndex = uniqueIndex.withNamed(names);
        return this;
    }

    public PropertyOptions<R, V> defaultValue(@Nullable V value) {
        if (value == null) {
            problems.add("default value must not be null, leave it unset instead");
            return this;
        }
        this.defaultValue = DefaultValue.of(value);
        return this;
    }

    public PropertyOptions<R, V> defaultValue(@NotNull BiFunction<? super R, ? super Property<R, V>, ? extends V> provider) {
        this.defaultValue = DefaultValue.computed(provider);
        return this;
    }

    public PropertyOptions<R, V> defaultValue(@NotNull DefaultValue<R, V> defaultValue) {
        this.defaultValue = defaultValue;
        return this;
    }

    public PropertyOptions<R, V> accessor(@NotNull Visibility visibility) {
        this.reader = visibility;
        this.writer = visibility;
        return this;
    }

    public PropertyOptions<R, V> reader(@NotNull Visibility visibility) {
        this.reader = visibility;
        return this;
    }

    public PropertyOptions<R, V> writer(@NotNull Visibility visibility) {
        this.writer = visibility;
        return this;
    }

    @Nullable String getField() { return field; }
    @Nullable Integer getLength() { return length; }
    @Nullable Integer getPrecision() { return precision; }
    @Nullable Integer getScale() { return scale; }
    @Nullable Boolean getKey() { return key; }
    @Nullable Boolean getSerial() { return serial; }
    @Nullable Boolean getNullable() { return nullable; }
    @Nullable Boolean getUnique() { return unique; }
    @Nullable Boolean getLazy() { return lazy; }
    List<String> getLazyContexts() { return Collections.unmodifiableList(lazyContexts); }
    PropertyIndex getIndex() { return index; }
    PropertyIndex getUniqueIndex() { return uniqueIndex; }
    @Nullable DefaultValue<R, V> getDefaultValue() { return defaultValue; }
    @Nullable Visibility getReader() { return reader; }
    @Nullable Visibility getWriter() { return writer; }
    List<String> getProblems() { return problems; }
}
