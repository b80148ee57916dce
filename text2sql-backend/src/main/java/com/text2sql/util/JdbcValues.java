package com.text2sql.util;

import java.io.IOException;
import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Base64;

/**
 * Converts JDBC column values into JSON-safe primitives so driver objects never reach the
 * serializer.
 */
public final class JdbcValues {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;

    private JdbcValues() {
    }

    /**
     * Reads a column of the current row.
     *
     * @param rs result set positioned on a row
     * @param columnIndex 1-based column index
     * @return number, boolean, string or {@code null}
     * @throws SQLException on JDBC errors
     */
    public static Object read(ResultSet rs, int columnIndex) throws SQLException {
        return toJsonSafe(rs.getObject(columnIndex));
    }

    /**
     * Converts a single JDBC value.
     *
     * @param v value from the driver
     * @return json-safe value
     * @throws SQLException when reading a LOB fails
     */
    public static Object toJsonSafe(Object v) throws SQLException {
        if (v == null) {
            return null;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            int toRead = (int) Math.min(blob.length(), MAX_BLOB_BYTES);
            return toRead <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
        }
        // java.sql.Date/Time/Timestamp and anything driver specific
        return truncate(String.valueOf(v));
    }

    private static String readClob(Clob clob) throws SQLException {
        StringBuilder sb = new StringBuilder();
        try (Reader reader = clob.getCharacterStream()) {
            if (reader == null) {
                return "";
            }
            char[] buf = new char[8192];
            int n;
            while (sb.length() < MAX_LOB_CHARS
                    && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                sb.append(buf, 0, n);
            }
        } catch (IOException e) {
            throw new SQLException("Failed to read CLOB value: " + e.getMessage(), e);
        }
        return sb.toString();
    }

    private static String truncate(String s) {
        return s.length() <= MAX_STRING_CHARS ? s : s.substring(0, MAX_STRING_CHARS);
    }
}
