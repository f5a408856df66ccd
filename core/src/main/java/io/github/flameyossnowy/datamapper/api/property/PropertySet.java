package io.github.flameyossnowy.datamapper.api.property;

import io.github.flameyossnowy.datamapper.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered collection of a model's properties for one repository, with constant time
 * lookup by name and cached derived views.
 *
 * @param <R> the resource class
 */
public final class PropertySet<R extends Resource> implements Iterable<Property<R, ?>> {
    private final List<Property<R, ?>> properties;
    private final Map<String, Property<R, ?>> byName;
    private final Map<String, List<String>> lazyContexts;

    private volatile List<Property<R, ?>> key;
    private volatile List<Property<R, ?>> defaults;
    private volatile Map<String, List<Property<R, ?>>> indexes;
    private volatile Map<String, List<Property<R, ?>>> uniqueIndexes;

    public PropertySet() {
        this.properties = new ArrayList<>(8);
        this.byName = new HashMap<>(16);
        this.lazyContexts = new LinkedHashMap<>(4);
    }

    private PropertySet(PropertySet<R> source) {
        this.properties = new ArrayList<>(source.properties);
        this.byName = new HashMap<>(source.byName);
        this.lazyContexts = new LinkedHashMap<>(source.lazyContexts.size());
        source.lazyContexts.forEach((context, names) -> lazyContexts.put(context, new ArrayList<>(names)));
    }

    public synchronized PropertySet<R> copy() {
        return new PropertySet<>(this);
    }

    public @Nullable Property<R, ?> get(@NotNull String name) {
        return byName.get(name);
    }

    public boolean contains(@NotNull String name) {
        return byName.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException when no property has that name
     */
    public @NotNull Property<R, ?> named(@NotNull String name) {
        Property<R, ?> property = byName.get(name);
        if (property == null) {
            throw new IllegalArgumentException("Unknown property '" + name + '\'');
        }
        return property;
    }

    public List<Property<R, ?>> valuesAt(@NotNull String... names) {
        List<Property<R, ?>> result = new ArrayList<>(names.length);
        for (String name : names) result.add(byName.get(name));
        return result;
    }

    /**
     * Appends a property, or replaces the one with the same name at its original position.
     */
    public synchronized PropertySet<R> add(@NotNull Property<R, ?> property) {
        Property<R, ?> previous = byName.get(property.name());
        if (previous != null) {
            properties.set(properties.indexOf(previous), property);
            for (List<String> names : lazyContexts.values()) names.remove(previous.name());
        } else {
            properties.add(property);
        }
        byName.put(property.name(), property);

        if (property.isLazy()) {
            for (String context : property.lazyContexts()) {
                List<String> names = lazyContext(context);
                if (!names.contains(property.name())) names.add(property.name());
            }
        }

        invalidate();
        return this;
    }

    public List<Property<R, ?>> key() {
        List<Property<R, ?>> cached = key;
        if (cached != null) return cached;

        List<Property<R, ?>> result = new ArrayList<>(1);
        for (Property<R, ?> property : properties) {
            if (property.isKey()) result.add(property);
        }
        cached = Collections.unmodifiableList(result);
        key = cached;
        return cached;
    }

    /** Key properties plus every eagerly loaded property, in declaration order. */
    public List<Property<R, ?>> defaults() {
        List<Property<R, ?>> cached = defaults;
        if (cached != null) return cached;

        Set<Property<R, ?>> result = new LinkedHashSet<>(key());
        for (Property<R, ?> property : properties) {
            if (!property.isLazy()) result.add(property);
        }
        List<Property<R, ?>> ordered = new ArrayList<>(result.size());
        for (Property<R, ?> property : properties) {
            if (result.contains(property)) ordered.add(property);
        }
        cached = Collections.unmodifiableList(ordered);
        defaults = cached;
        return cached;
    }

    public Map<String, List<Property<R, ?>>> indexes() {
        Map<String, List<Property<R, ?>>> cached = indexes;
        if (cached != null) return cached;
        cached = foldIndexes(false);
        indexes = cached;
        return cached;
    }

    public Map<String, List<Property<R, ?>>> uniqueIndexes() {
        Map<String, List<Property<R, ?>>> cached = uniqueIndexes;
        if (cached != null) return cached;
        cached = foldIndexes(true);
        uniqueIndexes = cached;
        return cached;
    }

    private Map<String, List<Property<R, ?>>> foldIndexes(boolean unique) {
        Map<String, List<Property<R, ?>>> result = new LinkedHashMap<>();
        for (Property<R, ?> property : properties) {
            PropertyIndex declaration = unique ? property.uniqueIndex() : property.index();
            if (declaration.anonymous()) {
                result.computeIfAbsent(property.field(), k -> new ArrayList<>(1)).add(property);
            }
            for (String name : declaration.named()) {
                result.computeIfAbsent(name, k -> new ArrayList<>(2)).add(property);
            }
        }
        result.replaceAll((name, columns) -> Collections.unmodifiableList(columns));
        return Collections.unmodifiableMap(result);
    }

    /**
     * The mutable list of property names loaded together under {@code context}.
     */
    public synchronized List<String> lazyContext(@NotNull String context) {
        return lazyContexts.computeIfAbsent(context, k -> new ArrayList<>(2));
    }

    /** The lazy contexts {@code name} belongs to. */
    public synchronized List<String> propertyContexts(@NotNull String name) {
        List<String> contexts = new ArrayList<>(1);
        lazyContexts.forEach((context, names) -> {
            if (names.contains(name)) contexts.add(context);
        });
        return contexts;
    }

    public boolean isInLazyContext(@NotNull String name) {
        return !propertyContexts(name).isEmpty();
    }

    /**
     * Expands names belonging to a lazy context to every name of those contexts.
     * Names outside any context pass through unchanged.
     *
     * @throws IllegalArgumentException when {@code names} is empty
     */
    public synchronized List<String> lazyLoadContext(@NotNull Collection<String> names) {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("The list of names to load must not be empty");
        }

        Set<String> result = new LinkedHashSet<>();
        for (String name : names) {
            List<String> contexts = propertyContexts(name);
            if (contexts.isEmpty()) {
                result.add(name);
                continue;
            }
            for (String context : contexts) result.addAll(lazyContexts.get(context));
        }
        return new ArrayList<>(result);
    }

    public List<String> lazyLoadContext(@NotNull String... names) {
        return lazyLoadContext(List.of(names));
    }

    /** Current values of every property, in order. Lazy properties are loaded as needed. */
    public List<Object> get(@NotNull R resource) {
        List<Object> values = new ArrayList<>(properties.size());
        for (Property<R, ?> property : properties) values.add(property.get(resource));
        return values;
    }

    /**
     * Assigns values positionally.
     *
     * @throws IllegalArgumentException when the number of values differs from the number of properties
     */
    public void set(@NotNull R resource, @NotNull List<?> values) {
        if (values.size() != properties.size()) {
            throw new IllegalArgumentException("Expected " + properties.size() + " values, got " + values.size());
        }
        for (int i = 0; i < values.size(); i++) {
            assign(properties.get(i), resource, values.get(i));
        }
    }

    private static <R extends Resource, V> void assign(Property<R, V> property, R resource, Object value) {
        property.set(resource, property.valueType().cast(value));
    }

    public int size() {
        return properties.size();
    }

    public boolean isEmpty() {
        return properties.isEmpty();
    }

    public List<Property<R, ?>> asList() {
        return Collections.unmodifiableList(properties);
    }

    @Override
    public @NotNull Iterator<Property<R, ?>> iterator() {
        return asList().iterator();
    }

    private void invalidate() {
        key = null;
        defaults = null;
        indexes = null;
        uniqueIndexes = null;
    }
}
