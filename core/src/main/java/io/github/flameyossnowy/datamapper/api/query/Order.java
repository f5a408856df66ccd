package io.github.flameyossnowy.datamapper.api.query;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

public record Order(@NotNull QueryTarget target, @NotNull Direction direction) {
    public Order {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(direction, "direction");
    }

    @Contract("_ -> new")
    public static @NotNull Order asc(@NotNull QueryTarget target) {
        return new Order(target, Direction.ASC);
    }

    @Contract("_ -> new")
    public static @NotNull Order desc(@NotNull QueryTarget target) {
        return new Order(target, Direction.DESC);
    }
}
