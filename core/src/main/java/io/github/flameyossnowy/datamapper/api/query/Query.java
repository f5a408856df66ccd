package io.github.flameyossnowy.datamapper.api.query;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.repository.Repository;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable description of a read against one repository and model.
 *
 * <p>Instances are built through {@link Builder}:</p>
 * <pre>{@code
 * Query<Heffalump> query = Query.builder(repository, Heffalump.MODEL)
 *     .where(Heffalump.COLOR).eql("pink")
 *     .where(Heffalump.NUM_SPOTS).gte(5)
 *     .limit(2)
 *     .build();
 * }</pre>
 *
 * @param <R> the resource class
 */
public final class Query<R extends Resource> {
    private final Repository repository;
    private final Model<R> model;
    private final List<Property<R, ?>> fields;
    private final List<Condition> conditions;
    private final List<Order> order;
    private final @Nullable Integer limit;
    private final int offset;
    private final List<Link> links;
    private final boolean unique;

    private Query(Builder<R> builder, List<Property<R, ?>> fields, List<Order> order) {
        this.repository = builder.repository;
        this.model = builder.model;
        this.fields = List.copyOf(fields);
        this.conditions = List.copyOf(builder.conditions);
        this.order = List.copyOf(order);
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.links = List.copyOf(builder.links);
        this.unique = builder.unique;
    }

    @Contract("_, _ -> new")
    public static <R extends Resource> @NotNull Builder<R> builder(@NotNull Repository repository, @NotNull Model<R> model) {
        return new Builder<>(repository, model);
    }

    public Repository repository() {
        return repository;
    }

    public Model<R> model() {
        return model;
    }

    public List<Property<R, ?>> fields() {
        return fields;
    }

    public List<Condition> conditions() {
        return conditions;
    }

    public List<Order> order() {
        return order;
    }

    public @Nullable Integer limit() {
        return limit;
    }

    public int offset() {
        return offset;
    }

    public List<Link> links() {
        return links;
    }

    public boolean hasLinks() {
        return !links.isEmpty();
    }

    /** Whether rows are de-duplicated on the selected fields. */
    public boolean isUnique() {
        return unique;
    }

    public Builder<R> toBuilder() {
        Builder<R> builder = new Builder<>(repository, model);
        builder.fields = new ArrayList<>(fields);
        builder.conditions.addAll(conditions);
        builder.order = new ArrayList<>(order);
        builder.limit = limit;
        builder.offset = offset;
        builder.links.addAll(links);
        builder.unique = unique;
        return builder;
    }

    @Override
    public String toString() {
        return "Query[" + model.name() + "@" + repository.name()
            + ", fields=" + fields.size()
            + ", conditions=" + conditions
            + ", order=" + order
            + ", limit=" + limit
            + ", offset=" + offset
            + ", links=" + links.size()
            + ", unique=" + unique + ']';
    }

    /**
     * Fluent builder for {@link Query}. Unless given, fields default to the model's
     * default property set and ordering to the key ascending.
     */
    public static final class Builder<R extends Resource> {
        private final Repository repository;
        private final Model<R> model;
        private final List<Condition> conditions = new ArrayList<>(4);
        private final List<Link> links = new ArrayList<>(1);
        private List<Property<R, ?>> fields;
        private List<Order> order;
        private Integer limit;
        private int offset;
        private boolean unique;

        private Builder(Repository repository, Model<R> model) {
            this.repository = Objects.requireNonNull(repository, "repository");
            this.model = Objects.requireNonNull(model, "model");
        }

        @SafeVarargs
        public final Builder<R> fields(@NotNull Property<R, ?>... fields) {
            return fields(Arrays.asList(fields));
        }

        public Builder<R> fields(@NotNull List<Property<R, ?>> fields) {
            this.fields = new ArrayList<>(fields);
            return this;
        }

        /**
         * Begins a condition on {@code target}.
         */
        public Where<R> where(@NotNull QueryTarget target) {
            return new Where<>(this, target);
        }

        public Builder<R> where(@NotNull Condition condition) {
            conditions.add(condition);
            return this;
        }

        public Builder<R> raw(@NotNull String sql, @Nullable Object... bindValues) {
            conditions.add(Condition.raw(sql, bindValues));
            return this;
        }

        public Builder<R> order(@NotNull Order... order) {
            this.order = new ArrayList<>(Arrays.asList(order));
            return this;
        }

        public Builder<R> orderBy(@NotNull QueryTarget target, @NotNull Direction direction) {
            if (order == null) order = new ArrayList<>(2);
            order.add(new Order(target, direction));
            return this;
        }

        public Builder<R> limit(int limit) {
            this.limit = limit;
            return this;
        }

        public Builder<R> offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder<R> link(@NotNull Link link) {
            links.add(link);
            return this;
        }

        public Builder<R> unique(boolean unique) {
            this.unique = unique;
            return this;
        }

        /**
         * @throws IllegalArgumentException when limit or offset is negative, or an offset is given without a limit
         */
        public Query<R> build() {
            if (offset < 0) {
                throw new IllegalArgumentException("offset must be >= 0, got " + offset);
            }
            if (limit != null && limit < 0) {
                throw new IllegalArgumentException("limit must be >= 0, got " + limit);
            }
            if (offset > 0 && limit == null) {
                throw new IllegalArgumentException("offset " + offset + " requires a limit");
            }

            List<Property<R, ?>> selected = fields != null
                ? fields
                : model.properties(repository.name()).defaults();

            List<Order> ordering = order;
            if (ordering == null) {
                ordering = new ArrayList<>(1);
                for (Property<R, ?> key : model.key(repository.name())) ordering.add(Order.asc(key));
            }
            return new Query<>(this, selected, ordering);
        }

        void add(Condition condition) {
            conditions.add(condition);
        }
    }

    /**
     * Operator step of {@link Builder#where(QueryTarget)}.
     */
    public static final class Where<R extends Resource> {
        private final Builder<R> builder;
        private final QueryTarget target;

        private Where(Builder<R> builder, QueryTarget target) {
            this.builder = builder;
            this.target = Objects.requireNonNull(target, "target");
        }

        private Builder<R> add(Operator operator, Object operand) {
            builder.add(Condition.of(operator, target, operand));
            return builder;
        }

        /** Equality; a list means membership, a range means inclusion, {@code null} means absent. */
        public Builder<R> eql(@Nullable Object value) {
            return add(Operator.EQL, value);
        }

        public Builder<R> in(@NotNull Collection<?> values) {
            return add(Operator.IN, values);
        }

        public Builder<R> not(@Nullable Object value) {
            return add(Operator.NOT, value);
        }

        public Builder<R> like(@NotNull Object pattern) {
            return add(Operator.LIKE, pattern);
        }

        public Builder<R> gt(@NotNull Object value) {
            return add(Operator.GT, value);
        }

        public Builder<R> gte(@NotNull Object value) {
            return add(Operator.GTE, value);
        }

        public Builder<R> lt(@NotNull Object value) {
            return add(Operator.LT, value);
        }

        public Builder<R> lte(@NotNull Object value) {
            return add(Operator.LTE, value);
        }
    }
}
