package io.github.flameyossnowy.datamapper.api.property;

import java.util.ArrayList;
import java.util.List;

/**
 * An index declaration on a single property: anonymous (an index over just this
 * property, named after its field), any number of named composite indexes, or both.
 */
public record PropertyIndex(boolean anonymous, List<String> named) {
    public static final PropertyIndex NONE = new PropertyIndex(false, List.of());

    public PropertyIndex {
        named = List.copyOf(named);
    }

    public boolean isDeclared() {
        return anonymous || !named.isEmpty();
    }

    PropertyIndex withAnonymous() {
        return new PropertyIndex(true, named);
    }

    PropertyIndex withNamed(String... names) {
        List<String> merged = new ArrayList<>(named);
        for (String name : names) {
            if (!merged.contains(name)) merged.add(name);
        }
        return new PropertyIndex(anonymous, merged);
    }
}
