package io.github.flameyossnowy.datamapper.api.resource;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.repository.Repository;
import org.jetbrains.annotations.ApiStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class of every mapped entity. Values live in slots indexed by
 * {@link Property#slot()}; a slot is either loaded or not, independently of its value
 * being {@code null}.
 * <p>
 * Subclasses are normally generated from a {@code @Model} schema and only implement
 * {@link #model()}.
 */
public abstract class Resource {
    /** Original value recorded for a property that had never been assigned. */
    public static final Object UNSET = new Object() {
        @Override
        public String toString() {
            return "UNSET";
        }
    };

    private static final Object[] EMPTY = {};

    private Object[] slots = EMPTY;
    private final BitSet loaded = new BitSet();
    private final Map<Property<?, ?>, Object> originalValues = new LinkedHashMap<>(4);
    private @Nullable Repository repository;
    private boolean persisted;
    private boolean destroyed;

    public abstract Model<? extends Resource> model();

    public @Nullable Repository repository() {
        return repository;
    }

    public String repositoryName() {
        return repository != null ? repository.name() : model().defaultRepositoryName();
    }

    public boolean isNew() {
        return !persisted && !destroyed;
    }

    public boolean isSaved() {
        return persisted;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    public boolean isDirty() {
        return !dirtyAttributes().isEmpty();
    }

    /**
     * Changed properties mapped to the primitive that would be written, in declaration order.
     * A property is dirty when its original was never assigned or differs from the current value.
     */
    public Map<Property<?, ?>, Object> dirtyAttributes() {
        Map<Property<?, ?>, Object> dirty = new LinkedHashMap<>(originalValues.size());
        if (originalValues.isEmpty()) return dirty;

        for (Property<?, ?> property : model().properties(repositoryName())) {
            if (!originalValues.containsKey(property) || !property.isLoaded(this)) continue;

            Object original = originalValues.get(property);
            Object current = readSlot(property.slot());
            if (original == UNSET || !Objects.equals(original, current)) {
                dirty.put(property, property.dumpFrom(this));
            }
        }
        return dirty;
    }

    public boolean hasOriginalValue(@NotNull Property<?, ?> property) {
        return originalValues.containsKey(property);
    }

    /**
     * The value {@code property} had before its first unsaved change, {@link #UNSET} if it was never
     * assigned, or {@code null} when it is not tracked.
     */
    public @Nullable Object originalValue(@NotNull Property<?, ?> property) {
        return originalValues.get(property);
    }

    public Map<Property<?, ?>, Object> originalValues() {
        return Collections.unmodifiableMap(originalValues);
    }

    /** Current key values in key order. */
    public List<Object> key() {
        List<? extends Property<?, ?>> key = model().key(repositoryName());
        List<Object> values = new ArrayList<>(key.size());
        for (Property<?, ?> property : key) values.add(readSlot(property.slot()));
        return values;
    }

    /**
     * Saves to the repository this resource is attached to.
     *
     * @throws IllegalStateException when the resource is not attached to any repository
     */
    public boolean save() {
        if (repository == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " is not attached to a repository, use save(Repository)");
        }
        return save(repository);
    }

    /**
     * Creates the resource when it is new, updates its dirty attributes otherwise.
     *
     * @return whether the repository accepted the write
     */
    public boolean save(@NotNull Repository repository) {
        if (destroyed) {
            throw new IllegalStateException("Cannot save a destroyed " + getClass().getSimpleName());
        }
        attach(repository);

        if (isNew()) {
            applyDefaults(model());
            return repository.create(List.of(this)) == 1;
        }

        Map<Property<?, ?>, Object> dirty = dirtyAttributes();
        if (dirty.isEmpty()) return true;

        boolean updated = repository.update(dirty, keyQuery(model())) > 0;
        if (updated) originalValues.clear();
        return updated;
    }

    public boolean destroy() {
        if (destroyed) return false;
        if (!persisted) {
            destroyed = true;
            return true;
        }

        boolean deleted = Objects.requireNonNull(repository).delete(keyQuery(model())) > 0;
        if (deleted) {
            destroyed = true;
            persisted = false;
        }
        return deleted;
    }

    /**
     * Loads the named properties, together with everything in their lazy contexts.
     */
    public void lazyLoad(@NotNull String... names) {
        lazyLoad(model(), Arrays.asList(names));
    }

    private <R extends Resource> void lazyLoad(Model<R> model, List<String> names) {
        model.lazyLoad(model.cast(this), names);
    }

    private <R extends Resource> void applyDefaults(Model<R> model) {
        R self = model.cast(this);
        for (Property<R, ?> property : model.properties(repositoryName())) {
            if (property.hasDefault() && !property.isLoaded(self)) property.get(self);
        }
    }

    private <R extends Resource> Query<R> keyQuery(Model<R> model) {
        return model.keyQuery(Objects.requireNonNull(repository), model.cast(this));
    }

    @ApiStatus.Internal
    public void attach(@NotNull Repository repository) {
        if (this.repository != null && persisted && !this.repository.name().equals(repository.name())) {
            throw new IllegalStateException(getClass().getSimpleName() + " already belongs to repository '"
                + this.repository.name() + '\'');
        }
        this.repository = repository;
    }

    @ApiStatus.Internal
    public void markSaved() {
        persisted = true;
        originalValues.clear();
    }

    @ApiStatus.Internal
    public @Nullable Object readSlot(int slot) {
        return slot < slots.length ? slots[slot] : null;
    }

    @ApiStatus.Internal
    public void writeSlot(int slot, @Nullable Object value) {
        if (slot >= slots.length) {
            slots = Arrays.copyOf(slots, Math.max(slot + 1, slots.length * 2));
        }
        slots[slot] = value;
        loaded.set(slot);
    }

    @ApiStatus.Internal
    public boolean isSlotLoaded(int slot) {
        return loaded.get(slot);
    }

    /**
     * Records the first original value of {@code property}. Tracking stops when a persisted
     * resource is set back to that original.
     */
    @ApiStatus.Internal
    public void trackChange(@NotNull Property<?, ?> property, @Nullable Object previous, @Nullable Object replacement) {
        if (!originalValues.containsKey(property)) {
            originalValues.put(property, previous);
            return;
        }
        if (persisted && Objects.equals(originalValues.get(property), replacement)) {
            originalValues.remove(property);
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(getClass().getSimpleName()).append('{');
        boolean first = true;
        for (Property<?, ?> property : model().properties(repositoryName())) {
            if (!property.isLoaded(this)) continue;
            if (!first) builder.append(", ");
            builder.append(property.name()).append('=').append(readSlot(property.slot()));
            first = false;
        }
        return builder.append('}').toString();
    }
}
