package io.github.flameyossnowy.datamapper.api.query;

import io.github.flameyossnowy.datamapper.api.property.Property;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One predicate of a query: an operator applied to a subject and an operand.
 * <p>
 * Operands are normalized on construction: collections and arrays become unmodifiable
 * lists, and an equality against a {@link Pattern} becomes a {@link Operator#LIKE}.
 */
public final class Condition {
    /**
     * The runtime shape of an operand, which together with the operator selects the comparator.
     */
    public enum Shape {
        NULL,
        LIST,
        INCLUSIVE_RANGE,
        EXCLUSIVE_RANGE,
        PATTERN,
        TARGET,
        SCALAR
    }

    private final Operator operator;
    private final @Nullable QueryTarget subject;
    private final @Nullable Object operand;
    private final Shape shape;
    private final @Nullable String sql;
    private final List<Object> bindValues;

    private Condition(Operator operator, @Nullable QueryTarget subject, @Nullable Object operand, @Nullable String sql, List<Object> bindValues) {
        this.operator = operator;
        this.subject = subject;
        this.operand = operand;
        this.shape = shapeOf(operand);
        this.sql = sql;
        this.bindValues = bindValues;
    }

    /**
     * @throws IllegalArgumentException when the operand cannot be used with the operator
     */
    public static @NotNull Condition of(@NotNull Operator operator, @NotNull QueryTarget subject, @Nullable Object operand) {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(subject, "subject");
        if (operator == Operator.RAW) {
            throw new IllegalArgumentException("Raw conditions are created with Condition.raw(sql, binds...)");
        }

        Object normalized = normalize(operand);
        Operator effective = operator;
        if (operator == Operator.EQL && normalized instanceof Pattern) effective = Operator.LIKE;

        Shape shape = shapeOf(normalized);
        if (effective.isComparison() && (shape == Shape.NULL || shape == Shape.LIST
            || shape == Shape.INCLUSIVE_RANGE || shape == Shape.EXCLUSIVE_RANGE || shape == Shape.PATTERN)) {
            throw new IllegalArgumentException(effective + " on " + subject.property().name()
                + " needs a single value, got " + describe(shape));
        }
        if (effective == Operator.LIKE && (shape == Shape.LIST || shape == Shape.INCLUSIVE_RANGE
            || shape == Shape.EXCLUSIVE_RANGE || shape == Shape.NULL)) {
            throw new IllegalArgumentException("LIKE on " + subject.property().name()
                + " needs a string or a pattern, got " + describe(shape));
        }
        return new Condition(effective, subject, normalized, null, List.of());
    }

    @Contract("_, _ -> new")
    public static @NotNull Condition eql(@NotNull QueryTarget subject, @Nullable Object operand) {
        return of(Operator.EQL, subject, operand);
    }

    @Contract("_, _ -> new")
    public static @NotNull Condition not(@NotNull QueryTarget subject, @Nullable Object operand) {
        return of(Operator.NOT, subject, operand);
    }

    @Contract("_, _ -> new")
    public static @NotNull Condition in(@NotNull QueryTarget subject, @NotNull Collection<?> operand) {
        return of(Operator.IN, subject, operand);
    }

    @Contract("_, _ -> new")
    public static @NotNull Condition like(@NotNull QueryTarget subject, @NotNull Object operand) {
        return of(Operator.LIKE, subject, operand);
    }

    /**
     * SQL text used verbatim, its binds appended positionally.
     */
    @Contract("_, _ -> new")
    public static @NotNull Condition raw(@NotNull String sql, @Nullable Object... bindValues) {
        Objects.requireNonNull(sql, "sql");
        List<Object> binds = bindValues == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(Arrays.asList(bindValues)));
        return new Condition(Operator.RAW, null, null, sql, binds);
    }

    private static Object normalize(Object operand) {
        if (operand instanceof Collection<?> collection) {
            return Collections.unmodifiableList(new ArrayList<>(collection));
        }
        if (operand != null && operand.getClass().isArray() && !(operand instanceof byte[])) {
            int length = Array.getLength(operand);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) list.add(Array.get(operand, i));
            return Collections.unmodifiableList(list);
        }
        return operand;
    }

    private static Shape shapeOf(Object operand) {
        if (operand == null) return Shape.NULL;
        if (operand instanceof List<?>) return Shape.LIST;
        if (operand instanceof Range<?> range) return range.excludeEnd() ? Shape.EXCLUSIVE_RANGE : Shape.INCLUSIVE_RANGE;
        if (operand instanceof Pattern) return Shape.PATTERN;
        if (operand instanceof QueryTarget) return Shape.TARGET;
        return Shape.SCALAR;
    }

    private static String describe(Shape shape) {
        return switch (shape) {
            case NULL -> "null";
            case LIST -> "a list";
            case INCLUSIVE_RANGE, EXCLUSIVE_RANGE -> "a range";
            case PATTERN -> "a pattern";
            case TARGET -> "a property";
            case SCALAR -> "a value";
        };
    }

    public Operator operator() {
        return operator;
    }

    /** The subject, {@code null} for raw conditions. */
    public @Nullable QueryTarget subject() {
        return subject;
    }

    public @Nullable Property<?, ?> property() {
        return subject == null ? null : subject.property();
    }

    public @Nullable Object operand() {
        return operand;
    }

    public Shape shape() {
        return shape;
    }

    public boolean isRaw() {
        return operator == Operator.RAW;
    }

    public @Nullable String sql() {
        return sql;
    }

    public List<Object> bindValues() {
        return bindValues;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Condition other)) return false;
        return operator == other.operator
            && Objects.equals(subject, other.subject)
            && Objects.equals(operand, other.operand)
            && Objects.equals(sql, other.sql)
            && bindValues.equals(other.bindValues);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, subject, operand, sql, bindValues);
    }

    @Override
    public String toString() {
        if (isRaw()) return "Condition[RAW " + sql + ' ' + bindValues + ']';
        return "Condition[" + Objects.requireNonNull(subject).property().name() + ' ' + operator + ' ' + operand + ']';
    }
}
