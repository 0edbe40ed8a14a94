package com.catdb.util;

import java.io.Reader;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Converts JDBC driver values into plain values that serialize cleanly to JSON.
 *
 * <p>Large objects are read up to a fixed size. Values that cannot be read become a placeholder
 * instead of failing the whole row.
 */
public final class JdbcValues {
    private static final int MAX_CHARS = 100_000;
    private static final int MAX_BYTES = 100_000;
    private static final int MAX_DEPTH = 3;
    static final String UNREADABLE = "[unreadable]";

    private JdbcValues() {
    }

    /**
     * Read one column of the current row.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @return plain value
     * @throws SQLException when the driver fails to deliver the column at all
     */
    public static Object read(ResultSet rs, int columnIndex) throws SQLException {
        Object raw = rs.getObject(columnIndex);
        try {
            return toPlain(raw, 0);
        } catch (SQLException | RuntimeException e) {
            return UNREADABLE;
        }
    }

    /**
     * Convert an arbitrary driver object.
     *
     * @param value value
     * @return plain value
     */
    public static Object toPlain(Object value) {
        try {
            return toPlain(value, 0);
        } catch (SQLException | RuntimeException e) {
            return UNREADABLE;
        }
    }

    private static Object toPlain(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_DEPTH) {
            return UNREADABLE;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return clip(s);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            long len = Math.min(blob.length(), MAX_BYTES);
            return len <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, (int) len));
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof SQLXML xml) {
            return clip(xml.getString());
        }
        if (v instanceof java.util.Date || v instanceof java.time.temporal.Temporal || v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof Array arr) {
            Object elements = arr.getArray();
            if (elements instanceof Object[] objects) {
                List<Object> out = new ArrayList<>(objects.length);
                for (Object o : objects) {
                    out.add(toPlain(o, depth + 1));
                }
                return out;
            }
            return clip(String.valueOf(elements));
        }
        // PGobject (json, jsonb, interval, ...) and other driver types render through toString
        return clip(String.valueOf(v));
    }

    private static String readClob(Clob clob) throws SQLException {
        long len = Math.min(clob.length(), MAX_CHARS);
        if (len <= 0) {
            return "";
        }
        try (Reader reader = clob.getCharacterStream()) {
            StringBuilder sb = new StringBuilder((int) len);
            char[] buf = new char[8192];
            int read;
            while (sb.length() < len && (read = reader.read(buf, 0, (int) Math.min(buf.length, len - sb.length()))) > 0) {
                sb.append(buf, 0, read);
            }
            return sb.toString();
        } catch (java.io.IOException e) {
            throw new SQLException("Failed to read CLOB", e);
        }
    }

    private static String clip(String s) {
        if (s == null || s.length() <= MAX_CHARS) {
            return s;
        }
        return s.substring(0, MAX_CHARS);
    }
}
