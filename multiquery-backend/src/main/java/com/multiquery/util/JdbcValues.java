package com.multiquery.util;

import java.io.Reader;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Ref;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Converts JDBC driver values into JSON-safe values so that driver-specific objects never reach
 * row records.
 *
 * <p>Numbers and booleans pass through; temporal values, UUIDs and unknown objects become strings;
 * LOBs are read up to a size cap (BLOBs base64 encoded); arrays and structs become lists.
 */
public final class JdbcValues {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcValues() {
    }

    /**
     * Read one column of the current row.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @return JSON-safe value, or a placeholder when the driver cannot produce one
     */
    public static Object read(ResultSet rs, int columnIndex) {
        try {
            return toJsonSafe(rs.getObject(columnIndex), 0);
        } catch (Exception e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    /**
     * Convert an arbitrary driver value.
     *
     * @param value driver value
     * @return JSON-safe value
     */
    public static Object convert(Object value) {
        try {
            return toJsonSafe(value, 0);
        } catch (Exception e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    private static Object toJsonSafe(Object v, int depth) throws Exception {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof Character c) {
            return String.valueOf(c);
        }
        if (v instanceof java.util.Date || v instanceof TemporalAccessor || v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            return readBlob(blob);
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof Array array) {
            Object elements = array.getArray();
            if (elements instanceof Object[] objects) {
                return toList(objects, depth);
            }
            return truncate(String.valueOf(elements));
        }
        if (v instanceof Struct struct) {
            Object[] attributes = struct.getAttributes();
            return toList(attributes != null ? attributes : new Object[0], depth);
        }
        if (v instanceof Ref ref) {
            return truncate(ref.getBaseTypeName());
        }
        // Driver wrappers such as PGobject expose the textual value through toString().
        return truncate(String.valueOf(v));
    }

    private static List<Object> toList(Object[] values, int depth) throws Exception {
        List<Object> out = new ArrayList<>(values.length);
        for (Object value : values) {
            out.add(toJsonSafe(value, depth + 1));
        }
        return out;
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        long length = clob.length();
        if (length <= 0) {
            return "";
        }
        int toRead = (int) Math.min(length, MAX_LOB_CHARS);
        try {
            return clob.getSubString(1, toRead);
        } catch (SQLException e) {
            return readClobStream(clob);
        }
    }

    private static String readClobStream(Clob clob) {
        try (Reader reader = clob.getCharacterStream()) {
            if (reader == null) {
                return "";
            }
            char[] buf = new char[8192];
            StringBuilder sb = new StringBuilder();
            int n;
            while (sb.length() < MAX_LOB_CHARS && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (Exception e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    private static String readBlob(Blob blob) throws SQLException {
        long length = blob.length();
        if (length <= 0) {
            return "";
        }
        int toRead = (int) Math.min(length, MAX_BLOB_BYTES);
        return Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
    }
}
