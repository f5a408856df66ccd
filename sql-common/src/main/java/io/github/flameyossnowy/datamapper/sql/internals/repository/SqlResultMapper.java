package io.github.flameyossnowy.datamapper.sql.internals.repository;

import io.github.flameyossnowy.datamapper.api.model.Model;
import io.github.flameyossnowy.datamapper.api.property.Property;
import io.github.flameyossnowy.datamapper.api.property.PropertySet;
import io.github.flameyossnowy.datamapper.api.query.Query;
import io.github.flameyossnowy.datamapper.api.repository.Repository;
import io.github.flameyossnowy.datamapper.api.resource.Resource;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes result rows into resources. Each column is read with the JDBC getter matching
 * the property's primitive type and then loaded through the property.
 */
public final class SqlResultMapper {
    /**
     * Maps the current row of a result set produced by {@code query}, whose columns are the query's fields in order.
     */
    public <R extends Resource> R map(@NotNull ResultSet resultSet, @NotNull Query<R> query) throws SQLException {
        return query.model().load(decode(resultSet, query.fields()), query);
    }

    public Object[] decode(@NotNull ResultSet resultSet, @NotNull List<? extends Property<?, ?>> fields) throws SQLException {
        Object[] values = new Object[fields.size()];
        for (int i = 0; i < values.length; i++) {
            Property<?, ?> field = fields.get(i);
            values[i] = field.load(readColumn(resultSet, i + 1, field.primitive()));
        }
        return values;
    }

    /**
     * Resolves result columns to properties by field name, ignoring case.
     *
     * @throws IllegalArgumentException when a column matches no property
     */
    public <R extends Resource> List<Property<R, ?>> fieldsFor(@NotNull ResultSetMetaData metaData, @NotNull Model<R> model, @NotNull String repositoryName) throws SQLException {
        PropertySet<R> properties = model.properties(repositoryName);
        int count = metaData.getColumnCount();
        List<Property<R, ?>> fields = new ArrayList<>(count);
        for (int column = 1; column <= count; column++) {
            String label = metaData.getColumnLabel(column);
            fields.add(propertyForColumn(properties, label, model));
        }
        return fields;
    }

    public <R extends Resource> List<R> loadAll(@NotNull ResultSet resultSet, @NotNull Model<R> model, @NotNull Repository repository) throws SQLException {
        List<Property<R, ?>> fields = fieldsFor(resultSet.getMetaData(), model, repository.name());
        List<R> resources = new ArrayList<>();
        while (resultSet.next()) {
            resources.add(model.load(fields, decode(resultSet, fields), repository));
        }
        return resources;
    }

    public @Nullable Object readColumn(@NotNull ResultSet resultSet, int column, @NotNull Class<?> primitive) throws SQLException {
        Object value;
        if (primitive == String.class) {
            value = resultSet.getString(column);
        } else if (primitive == Integer.class) {
            value = resultSet.getInt(column);
        } else if (primitive == Long.class) {
            value = resultSet.getLong(column);
        } else if (primitive == Boolean.class) {
            value = resultSet.getBoolean(column);
        } else if (primitive == Double.class) {
            value = resultSet.getDouble(column);
        } else if (primitive == BigDecimal.class) {
            value = resultSet.getBigDecimal(column);
        } else if (primitive == LocalDateTime.class) {
            Timestamp timestamp = resultSet.getTimestamp(column);
            value = timestamp == null ? null : timestamp.toLocalDateTime();
        } else if (primitive == LocalDate.class) {
            Date date = resultSet.getDate(column);
            value = date == null ? null : date.toLocalDate();
        } else if (primitive == byte[].class) {
            value = resultSet.getBytes(column);
        } else {
            value = resultSet.getObject(column);
        }
        return resultSet.wasNull() ? null : value;
    }

    private static <R extends Resource> Property<R, ?> propertyForColumn(PropertySet<R> properties, String label, Model<R> model) {
        for (Property<R, ?> property : properties) {
            if (property.field().equalsIgnoreCase(label)) return property;
        }
        throw new IllegalArgumentException("Column '" + label + "' does not match any property of " + model.name());
    }
}
