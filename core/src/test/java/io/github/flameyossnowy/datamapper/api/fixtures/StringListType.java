package io.github.flameyossnowy.datamapper.api.fixtures;

import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.types.CustomType;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Comma separated list of strings.
 */
public final class StringListType extends CustomType<List<String>, String> {
    @SuppressWarnings("unchecked")
    private static final Class<List<String>> LIST = (Class<List<String>>) (Class<?>) List.class;

    public StringListType() {
        super("StringList", LIST, String.class);
    }

    @Override
    protected String dumpValue(@NotNull List<String> value, @NotNull Property<?, List<String>> property) {
        return String.join(",", value);
    }

    @Override
    protected List<String> loadValue(@NotNull String primitive, @NotNull Property<?, List<String>> property) {
        return primitive.isEmpty() ? new ArrayList<>() : new ArrayList<>(Arrays.asList(primitive.split(",")));
    }
}
