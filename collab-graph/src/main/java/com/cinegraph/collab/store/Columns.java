package com.cinegraph.collab.store;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Comma-joined list columns; commas and backslashes inside a value are
 * backslash-escaped. Keeps the DDL portable across PostgreSQL and the
 * H2 database the tests run on.
 */
final class Columns {

    private Columns() {
    }

    static String join(Collection<?> values) {
        if (values == null || values.isEmpty()) return null;
        return values.stream().map(v -> escape(String.valueOf(v))).collect(Collectors.joining(","));
    }

    /** Inverse of {@link #join}: splits on unescaped commas only. */
    static <T> List<T> split(String value, Function<String, T> parser) {
        if (value == null || value.isBlank()) return List.of();
        List<T> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                current.append(value.charAt(++i));
            } else if (c == ',') {
                add(out, current, parser);
            } else {
                current.append(c);
            }
        }
        add(out, current, parser);
        return out;
    }

    private static <T> void add(List<T> out, StringBuilder current, Function<String, T> parser) {
        String item = current.toString().trim();
        current.setLength(0);
        if (!item.isEmpty()) {
            out.add(parser.apply(item));
        }
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace(",", "\\,");
    }

    static Integer intOrNull(ResultSet rs, String column) throws SQLException {
        int v = rs.getInt(column);
        return rs.wasNull() ? null : v;
    }

    static Long longOrNull(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }
}
