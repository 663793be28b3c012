package com.whereq.tessera.normalizer;

import com.whereq.tessera.engine.RawColumn;
import com.whereq.tessera.engine.RawResult;
import com.whereq.tessera.model.Column;
import com.whereq.tessera.model.ColumnType;
import com.whereq.tessera.model.ExecutionStats;
import com.whereq.tessera.model.QueryResult;
import org.springframework.stereotype.Component;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.SQLException;
import java.sql.Struct;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts engine-native results into the canonical tabular shape.
 *
 * <p>Values are normalized by canonical column type so that the same
 * logical result reads the same whichever engine produced it: integers
 * become {@code Long}, floating and decimal values {@code Double} (NaN and
 * infinities become null), temporal values ISO-8601 strings (zoned values in
 * UTC), binary values Base64, and nested values lists and maps.
 *
 * @author WhereQ Inc.
 */
@Component
public class ResultNormalizer {

    public QueryResult normalize(RawResult raw) {
        List<Column> columns = new ArrayList<>(raw.getColumns().size());
        for (RawColumn rawColumn : raw.getColumns()) {
            columns.add(new Column(rawColumn.getName(), NativeTypeMapper.map(rawColumn)));
        }

        List<List<Object>> rows = new ArrayList<>(raw.getRows().size());
        for (List<Object> rawRow : raw.getRows()) {
            List<Object> row = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                row.add(convert(rawRow.get(i), columns.get(i).getType()));
            }
            rows.add(row);
        }

        ExecutionStats stats = ExecutionStats.builder()
            .wallTimeMs(raw.getWallTimeMs())
            .rowsReturned(rows.size())
            .rowsScanned(raw.getRowsScanned())
            .planText(raw.getPlanText())
            .build();

        return QueryResult.builder()
            .columns(columns)
            .rows(rows)
            .stats(stats)
            .build();
    }

    Object convert(Object value, ColumnType type) {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case INTEGER -> value instanceof Number n ? integer(n) : value(value);
            case FLOAT -> value instanceof Number n ? floating(n) : value(value);
            case BOOLEAN -> bool(value);
            case STRING -> value instanceof String s ? s : String.valueOf(value(value));
            case TIMESTAMP, STRUCT -> value(value);
        };
    }

    /**
     * Type-independent conversion, also applied to nested members
     */
    Object value(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer
            || value instanceof Long || value instanceof BigInteger) {
            return integer((Number) value);
        }
        if (value instanceof Number n) {
            return floating(n);
        }
        if (value instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (value instanceof Struct struct) {
            return list(attributes(struct));
        }
        if (value instanceof java.sql.Array array) {
            return list(elements(array));
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), value(v)));
            return out;
        }
        if (value instanceof Collection<?> collection) {
            return list(collection.toArray());
        }
        if (value.getClass().isArray()) {
            return list(boxed(value));
        }
        String temporal = temporal(value);
        return temporal != null ? temporal : value.toString();
    }

    private static Object integer(Number n) {
        if (n instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : big;
        }
        if (n instanceof BigDecimal decimal) {
            return decimal.longValue();
        }
        return n.longValue();
    }

    private static Double floating(Number n) {
        double d = n.doubleValue();
        return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
    }

    private static Object bool(Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number n) {
            return n.longValue() != 0;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private static String temporal(Object value) {
        if (value instanceof java.sql.Timestamp ts) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(ts.toLocalDateTime());
        }
        if (value instanceof java.sql.Date date) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(date.toLocalDate());
        }
        if (value instanceof java.sql.Time time) {
            return DateTimeFormatter.ISO_LOCAL_TIME.format(time.toLocalTime());
        }
        if (value instanceof LocalDateTime ldt) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(ldt);
        }
        if (value instanceof LocalDate ld) {
            return DateTimeFormatter.ISO_LOCAL_DATE.format(ld);
        }
        if (value instanceof LocalTime lt) {
            return DateTimeFormatter.ISO_LOCAL_TIME.format(lt);
        }
        if (value instanceof OffsetDateTime odt) {
            return DateTimeFormatter.ISO_INSTANT.format(odt.toInstant());
        }
        if (value instanceof ZonedDateTime zdt) {
            return DateTimeFormatter.ISO_INSTANT.format(zdt.toInstant());
        }
        if (value instanceof Instant instant) {
            return DateTimeFormatter.ISO_INSTANT.format(instant.atOffset(ZoneOffset.UTC));
        }
        return null;
    }

    private List<Object> list(Object[] items) {
        List<Object> out = new ArrayList<>(items.length);
        for (Object item : items) {
            out.add(value(item));
        }
        return out;
    }

    private static Object[] attributes(Struct struct) {
        try {
            return struct.getAttributes();
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot read struct value: " + e.getMessage(), e);
        }
    }

    private static Object[] elements(java.sql.Array array) {
        try {
            return boxed(array.getArray());
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot read array value: " + e.getMessage(), e);
        }
    }

    private static Object[] boxed(Object array) {
        if (array instanceof Object[] objects) {
            return objects;
        }
        int length = Array.getLength(array);
        Object[] out = new Object[length];
        for (int i = 0; i < length; i++) {
            out[i] = Array.get(array, i);
        }
        return out;
    }
}
