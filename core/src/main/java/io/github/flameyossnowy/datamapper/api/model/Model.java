package io.github.flameyossnowy.datamapper.api.model;

import io.github.flameyossnowy.datamapper.api.CloseableIterator;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.property.PropertyOptions;
import io.github.flameyossnowy.datamapper.api.property.PropertySet;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.repository.Repository;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import io.github.flameyossnowy.datamapper.api.types.FieldType;
import io.github.flameyossnowy.datamapper.api.types.FieldTypeRegistry;
import io.github.flameyossnowy.datamapper.api.utils.Logging;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Metadata for one resource class: its properties per repository, its storage names,
 * and how rows become resources.
 *
 * <pre>{@code
 * public static final Model<Heffalump> MODEL = Model.define(Heffalump.class, Heffalump::new);
 * public static final Property<Heffalump, Long> ID = MODEL.property("id", FieldType.SERIAL);
 * }</pre>
 *
 * @param <R> the resource class
 */
public final class Model<R extends Resource> {
    public static final String DEFAULT_REPOSITORY = "default";

    private final Class<R> type;
    private final Supplier<R> factory;
    private final String name;
    private final String defaultRepositoryName;
    private final @Nullable String storageName;
    private final NamingConvention storageNamingConvention;
    private final NamingConvention fieldNamingConvention;
    private final FieldTypeRegistry fieldTypes;

    private final Map<String, PropertySet<R>> propertySets = new ConcurrentHashMap<>(2);
    private final Map<String, String> storageNames = new ConcurrentHashMap<>(2);
    private int nextSlot;

    private Model(Builder<R> builder) {
        this.type = builder.type;
        this.factory = builder.factory;
        this.name = builder.name != null ? builder.name : builder.type.getSimpleName();
        this.defaultRepositoryName = builder.repositoryName;
        this.storageName = builder.storageName;
        this.storageNamingConvention = builder.storageNamingConvention;
        this.fieldNamingConvention = builder.fieldNamingConvention;
        this.fieldTypes = builder.fieldTypes;
        this.propertySets.put(defaultRepositoryName, new PropertySet<>());
    }

    public static <R extends Resource> @NotNull Model<R> define(@NotNull Class<R> type, @NotNull Supplier<R> factory) {
        return builder(type, factory).build();
    }

    public static <R extends Resource> @NotNull Builder<R> builder(@NotNull Class<R> type, @NotNull Supplier<R> factory) {
        return new Builder<>(type, factory);
    }

    public Class<R> type() {
        return type;
    }

    public String name() {
        return name;
    }

    public String defaultRepositoryName() {
        return defaultRepositoryName;
    }

    public NamingConvention fieldNamingConvention() {
        return fieldNamingConvention;
    }

    public FieldTypeRegistry fieldTypes() {
        return fieldTypes;
    }

    public R newInstance() {
        return factory.get();
    }

    public <V> Property<R, V> property(@NotNull String name, @NotNull FieldType<V> type) {
        return property(name, type, PropertyOptions.options());
    }

    /**
     * Declares a property, replacing any earlier declaration with the same name. The
     * property is added to the set of every repository this model already knows.
     */
    public synchronized <V> Property<R, V> property(
        @NotNull String name,
        @NotNull FieldType<V> type,
        @NotNull PropertyOptions<R, V> options
    ) {
        PropertySet<R> defaults = propertySets.get(defaultRepositoryName);
        Property<R, ?> existing = defaults.get(name);
        int slot = existing != null ? existing.slot() : nextSlot++;

        Property<R, V> property = new Property<>(this, name, type, options, slot, defaultRepositoryName);
        for (PropertySet<R> set : propertySets.values()) set.add(property);

        Logging.deepInfo(() -> "Declared " + property);
        return property;
    }

    /** Declares a property whose field type is looked up in this model's registry. */
    public <V> Property<R, V> property(
        @NotNull String name,
        @NotNull Class<V> valueType,
        @NotNull PropertyOptions<R, V> options
    ) {
        return property(name, fieldTypes.forClass(valueType), options);
    }

    public <V> Property<R, V> property(@NotNull String name, @NotNull Class<V> valueType) {
        return property(name, valueType, PropertyOptions.options());
    }

    public PropertySet<R> properties() {
        return properties(defaultRepositoryName);
    }

    /**
     * The properties used against {@code repositoryName}. A repository seen for the
     * first time starts from a copy of the default repository's set.
     */
    public PropertySet<R> properties(@NotNull String repositoryName) {
        PropertySet<R> set = propertySets.get(repositoryName);
        if (set != null) return set;

        synchronized (this) {
            PropertySet<R> defaults = propertySets.get(defaultRepositoryName);
            return propertySets.computeIfAbsent(repositoryName, k -> defaults.copy());
        }
    }

    public String storageName() {
        return storageName(defaultRepositoryName);
    }

    public String storageName(@NotNull String repositoryName) {
        return storageNames.computeIfAbsent(repositoryName,
            k -> storageName != null ? storageName : storageNamingConvention.apply(name));
    }

    /** Overrides the storage name used against one repository. */
    public Model<R> storageName(@NotNull String repositoryName, @NotNull String storageName) {
        storageNames.put(repositoryName, storageName);
        return this;
    }

    public List<Property<R, ?>> key(@NotNull String repositoryName) {
        return properties(repositoryName).key();
    }

    public List<Property<R, ?>> key() {
        return key(defaultRepositoryName);
    }

    /** The serial property, the one the repository assigns on create, if any. */
    public @Nullable Property<R, ?> identityField(@NotNull String repositoryName) {
        for (Property<R, ?> property : properties(repositoryName)) {
            if (property.isSerial()) return property;
        }
        return null;
    }

    public R cast(@NotNull Resource resource) {
        return type.cast(resource);
    }

    /**
     * Builds a persisted resource from a decoded row whose values line up with the query's fields.
     */
    public R load(@NotNull Object[] values, @NotNull Query<R> query) {
        return load(query.fields(), values, query.repository());
    }

    public R load(@NotNull List<Property<R, ?>> fields, @NotNull Object[] values, @NotNull Repository repository) {
        if (fields.size() != values.length) {
            throw new IllegalArgumentException("Expected " + fields.size() + " values, got " + values.length);
        }
        R resource = factory.get();
        resource.attach(repository);
        for (int i = 0; i < values.length; i++) {
            resource.writeSlot(fields.get(i).slot(), values[i]);
        }
        resource.markSaved();
        return resource;
    }

    /**
     * A query matching exactly {@code resource} by key. Key values that were changed
     * since the last save match on their original value.
     */
    public Query<R> keyQuery(@NotNull Repository repository, @NotNull R resource) {
        List<Property<R, ?>> key = key(repository.name());
        if (key.isEmpty()) {
            throw new IllegalStateException("Model " + name + " has no key property");
        }
        Query.Builder<R> builder = Query.builder(repository, this);
        for (Property<R, ?> property : key) {
            Object value = resource.hasOriginalValue(property)
                ? resource.originalValue(property)
                : property.getRaw(resource);
            if (value == Resource.UNSET) value = property.getRaw(resource);
            builder.where(property).eql(value);
        }
        return builder.build();
    }

    /**
     * Fetches the unloaded properties among {@code names}, expanded to their lazy
     * contexts, in one round trip and copies them into {@code resource}.
     */
    public void lazyLoad(@NotNull R resource, @NotNull Collection<String> names) {
        Repository repository = resource.repository();
        if (repository == null) {
            throw new IllegalStateException("Cannot lazily load " + name + ": resource is not attached to a repository");
        }

        PropertySet<R> properties = properties(repository.name());
        List<Property<R, ?>> missing = new ArrayList<>(names.size());
        for (String propertyName : properties.lazyLoadContext(names)) {
            Property<R, ?> property = properties.get(propertyName);
            if (property != null && !property.isLoaded(resource)) missing.add(property);
        }
        if (missing.isEmpty()) return;

        Set<Property<R, ?>> fields = new LinkedHashSet<>(properties.key());
        fields.addAll(missing);

        Query<R> query = keyQuery(repository, resource).toBuilder().fields(new ArrayList<>(fields)).build();
        Logging.info(() -> "Lazily loading " + missing.size() + " properties of " + name);

        R fetched = null;
        try (CloseableIterator<R> iterator = repository.read(query)) {
            if (iterator.hasNext()) fetched = iterator.next();
        }

        for (Property<R, ?> property : missing) {
            resource.writeSlot(property.slot(), fetched == null ? null : fetched.readSlot(property.slot()));
        }
    }

    @Override
    public String toString() {
        return "Model[" + name + ']';
    }

    public static final class Builder<R extends Resource> {
        private final Class<R> type;
        private final Supplier<R> factory;
        private String name;
        private String repositoryName = DEFAULT_REPOSITORY;
        private String storageName;
        private NamingConvention storageNamingConvention = NamingConvention.UNDERSCORED_AND_PLURALIZED;
        private NamingConvention fieldNamingConvention = NamingConvention.IDENTITY;
        private FieldTypeRegistry fieldTypes = FieldTypeRegistry.builtIn();

        private Builder(Class<R> type, Supplier<R> factory) {
            this.type = Objects.requireNonNull(type, "type");
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        public Builder<R> name(@NotNull String name) {
            this.name = name;
            return this;
        }

        public Builder<R> repository(@NotNull String repositoryName) {
            this.repositoryName = repositoryName;
            return this;
        }

        public Builder<R> storageName(@NotNull String storageName) {
            this.storageName = storageName;
            return this;
        }

        public Builder<R> storageNamingConvention(@NotNull NamingConvention convention) {
            this.storageNamingConvention = convention;
            return this;
        }

        public Builder<R> fieldNamingConvention(@NotNull NamingConvention convention) {
            this.fieldNamingConvention = convention;
            return this;
        }

        public Builder<R> fieldTypes(@NotNull FieldTypeRegistry fieldTypes) {
            this.fieldTypes = fieldTypes;
            return this;
        }

        public Model<R> build() {
            return new Model<>(this);
        }
    }
}
