package io.github.flameyossnowy.datamapper.sql.internals.repository;

import io.github.flameyossnowy.datamapper.api.utils.Logging;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Binds dumped values to statement placeholders, choosing the JDBC setter from the value's class.
 */
public final class SqlParameterBinder {
    public void bind(@NotNull PreparedStatement statement, @NotNull List<Object> values) throws SQLException {
        int index = 1;
        for (Object value : values) {
            bindValue(statement, index++, value);
        }
        Logging.deepInfo(() -> "Bound " + values.size() + " parameters");
    }

    public void bind(@NotNull PreparedStatement statement, @Nullable Object... values) throws SQLException {
        if (values == null) return;
        int index = 1;
        for (Object value : values) {
            bindValue(statement, index++, value);
        }
    }

    public void bindValue(@NotNull PreparedStatement statement, int index, @Nullable Object value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.NULL);
        } else if (value instanceof String string) {
            statement.setString(index, string);
        } else if (value instanceof Integer integer) {
            statement.setInt(index, integer);
        } else if (value instanceof Long number) {
            statement.setLong(index, number);
        } else if (value instanceof Boolean bool) {
            statement.setBoolean(index, bool);
        } else if (value instanceof Double number) {
            statement.setDouble(index, number);
        } else if (value instanceof Float number) {
            statement.setFloat(index, number);
        } else if (value instanceof Short number) {
            statement.setShort(index, number);
        } else if (value instanceof BigDecimal decimal) {
            statement.setBigDecimal(index, decimal);
        } else if (value instanceof LocalDateTime dateTime) {
            statement.setTimestamp(index, Timestamp.valueOf(dateTime));
        } else if (value instanceof LocalDate date) {
            statement.setDate(index, Date.valueOf(date));
        } else if (value instanceof Instant instant) {
            statement.setTimestamp(index, Timestamp.from(instant));
        } else if (value instanceof Enum<?> constant) {
            statement.setString(index, constant.name());
        } else if (value instanceof Character || value instanceof UUID) {
            statement.setString(index, value.toString());
        } else if (value instanceof Pattern pattern) {
            statement.setString(index, pattern.pattern());
        } else if (value instanceof byte[] bytes) {
            statement.setBytes(index, bytes);
        } else {
            statement.setObject(index, value);
        }
    }
}
