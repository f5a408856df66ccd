package io.github.flameyossnowy.datamapper.api.adapter;

import io.github.flameyossnowy.datamapper.api.CloseableIterator;
import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.query.Condition;
import io.github.flameyossnowy.datamapper.api.query.Direction;
import io.github.flameyossnowy.datamapper.api.query.Order;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.query.Range;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import io.github.flameyossnowy.datamapper.api.utils.Logging;
import org.jetbrains.annotations.NotNull;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Keeps records in memory, evaluating conditions in Java. Joins and raw SQL are not supported.
 */
public final class InMemoryAdapter implements Adapter {
    private final String name;
    private final Map<String, List<Map<String, Object>>> tables = new HashMap<>(4);
    private final Map<String, AtomicLong> sequences = new HashMap<>(4);

    public InMemoryAdapter(@NotNull String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized int create(@NotNull Collection<? extends Resource> resources) {
        int created = 0;
        for (Resource resource : resources) {
            Model<? extends Resource> model = resource.model();
            String table = model.storageName(name);
            Map<String, Object> record = new LinkedHashMap<>();

            for (Property<?, ?> property : model.properties(name)) {
                if (property.isLoaded(resource)) record.put(property.field(), property.dumpFrom(resource));
            }

            Property<?, ?> identity = model.identityField(name);
            if (identity != null && record.get(identity.field()) == null) {
                long id = sequences.computeIfAbsent(table, k -> new AtomicLong()).incrementAndGet();
                record.put(identity.field(), id);
                resource.writeSlot(identity.slot(), identity.load(id));
            }

            tables.computeIfAbsent(table, k -> new ArrayList<>()).add(record);
            resource.markSaved();
            created++;
        }
        Logging.info(() -> "Created " + resources.size() + " records in memory");
        return created;
    }

    @Override
    public synchronized <R extends Resource> CloseableIterator<R> read(@NotNull Query<R> query) {
        checkRepository(query);
        List<Map<String, Object>> matches = matching(query);
        matches.sort(comparator(query.order()));

        int from = Math.min(query.offset(), matches.size());
        int to = query.limit() == null ? matches.size() : Math.min(matches.size(), from + query.limit());

        List<R> resources = new ArrayList<>(to - from);
        List<Property<R, ?>> fields = query.fields();
        for (Map<String, Object> record : matches.subList(from, to)) {
            Object[] values = new Object[fields.size()];
            for (int i = 0; i < values.length; i++) {
                Property<R, ?> field = fields.get(i);
                values[i] = field.load(record.get(field.field()));
            }
            resources.add(query.model().load(values, query));
        }
        return CloseableIterator.of(resources.iterator());
    }

    @Override
    public synchronized int update(@NotNull Map<Property<?, ?>, Object> attributes, @NotNull Query<?> query) {
        checkRepository(query);
        List<Map<String, Object>> matches = matching(query);
        for (Map<String, Object> record : matches) {
            attributes.forEach((property, value) -> record.put(property.field(), value));
        }
        return matches.size();
    }

    @Override
    public synchronized int delete(@NotNull Query<?> query) {
        checkRepository(query);
        List<Map<String, Object>> matches = matching(query);
        List<Map<String, Object>> table = tables.get(query.model().storageName(name));
        if (table == null) return 0;

        int deleted = 0;
        for (Iterator<Map<String, Object>> iterator = table.iterator(); iterator.hasNext(); ) {
            Map<String, Object> record = iterator.next();
            for (Map<String, Object> match : matches) {
                if (match == record) {
                    iterator.remove();
                    deleted++;
                    break;
                }
            }
        }
        return deleted;
    }

    @Override
    public synchronized void close() {
        tables.clear();
        sequences.clear();
    }

    private void checkRepository(Query<?> query) {
        if (!query.repository().name().equals(name)) {
            throw new IllegalArgumentException("Query targets repository '" + query.repository().name()
                + "' but this adapter serves '" + name + '\'');
        }
        if (query.hasLinks()) {
            throw new UnsupportedOperationException("The in-memory adapter does not support links");
        }
    }

    private List<Map<String, Object>> matching(Query<?> query) {
        List<Map<String, Object>> table = tables.getOrDefault(query.model().storageName(name), List.of());
        List<Map<String, Object>> matches = new ArrayList<>();
        for (Map<String, Object> record : table) {
            if (matches(record, query.conditions())) matches.add(record);
        }
        return matches;
    }

    private static boolean matches(Map<String, Object> record, List<Condition> conditions) {
        for (Condition condition : conditions) {
            if (!matches(record, condition)) return false;
        }
        return true;
    }

    private static boolean matches(Map<String, Object> record, Condition condition) {
        if (condition.isRaw()) {
            throw new UnsupportedOperationException("The in-memory adapter does not evaluate raw SQL");
        }
        Property<?, ?> property = Objects.requireNonNull(condition.property());
        Object value = record.get(property.field());
        Object operand = condition.operand();

        return switch (condition.operator()) {
            case EQL, IN -> equalTo(property, value, condition);
            case NOT -> !equalTo(property, value, condition);
            case LIKE -> value != null && (operand instanceof Pattern pattern
                ? pattern.matcher(value.toString()).find()
                : likePattern(String.valueOf(operand)).matcher(value.toString()).matches());
            case GT -> value != null && compare(value, property.dumpOperand(operand)) > 0;
            case GTE -> value != null && compare(value, property.dumpOperand(operand)) >= 0;
            case LT -> value != null && compare(value, property.dumpOperand(operand)) < 0;
            case LTE -> value != null && compare(value, property.dumpOperand(operand)) <= 0;
            case RAW -> throw new UnsupportedOperationException("The in-memory adapter does not evaluate raw SQL");
        };
    }

    private static boolean equalTo(Property<?, ?> property, Object value, Condition condition) {
        Object operand = condition.operand();
        switch (condition.shape()) {
            case NULL:
                return value == null;
            case LIST:
                for (Object element : (List<?>) operand) {
                    if (same(value, property.dumpOperand(element))) return true;
                }
                return false;
            case INCLUSIVE_RANGE:
            case EXCLUSIVE_RANGE:
                Range<?> range = (Range<?>) operand;
                if (value == null) return false;
                int lower = compare(value, range.min());
                int upper = compare(value, range.max());
                return lower >= 0 && (range.excludeEnd() ? upper < 0 : upper <= 0);
            case TARGET:
                throw new UnsupportedOperationException("The in-memory adapter does not compare properties");
            default:
                return same(value, property.dumpOperand(operand));
        }
    }

    private static boolean same(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) return compare(left, right) == 0;
        return Objects.equals(left, right);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Object left, Object right) {
        if (left instanceof Number a && right instanceof Number b) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        }
        return ((Comparable) left).compareTo(right);
    }

    private static Pattern likePattern(String like) {
        StringBuilder regex = new StringBuilder(like.length() + 8);
        for (char c : like.toCharArray()) {
            if (c == '%') regex.append(".*");
            else if (c == '_') regex.append('.');
            else regex.append(Pattern.quote(String.valueOf(c)));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static Comparator<Map<String, Object>> comparator(List<Order> order) {
        Comparator<Map<String, Object>> comparator = (a, b) -> 0;
        for (Order o : order) {
            String field = o.target().property().field();
            Comparator<Map<String, Object>> next = (a, b) -> {
                Object left = a.get(field);
                Object right = b.get(field);
                if (left == null || right == null) return left == right ? 0 : (left == null ? -1 : 1);
                return compare(left, right);
            };
            comparator = comparator.thenComparing(o.direction() == Direction.DESC ? next.reversed() : next);
        }
        return comparator;
    }
}
