package com.text2sql.service;

import com.text2sql.model.SchemaDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the SQLite catalog and serializes it into the text block embedded in generation prompts.
 */
@Slf4j
@Service
public class SchemaIntrospector {

    private static final String LIST_TABLES_SQL =
            "SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%'";
    private static final String TABLE_INFO_SQL =
            "SELECT name, type FROM pragma_table_info(?)";
    private static final String FOREIGN_KEY_LIST_SQL =
            "SELECT \"from\", \"table\", \"to\" FROM pragma_foreign_key_list(?)";

    /**
     * Describe all user tables reachable through the connection.
     *
     * @param conn open connection; not closed by this method
     * @return schema descriptor in catalog order
     * @throws ConnectionException if the connection is unusable or a catalog query fails
     */
    public SchemaDescriptor describe(Connection conn) {
        ensureOpen(conn);
        try {
            List<SchemaDescriptor.TableDescriptor> tables = new ArrayList<>();
            for (String tableName : listTables(conn)) {
                tables.add(SchemaDescriptor.TableDescriptor.builder()
                        .name(tableName)
                        .columns(listColumns(conn, tableName))
                        .foreignKeys(listForeignKeys(conn, tableName))
                        .build());
            }
            log.debug("Schema introspected (tables={})", tables.size());
            return SchemaDescriptor.builder().tables(tables).build();
        } catch (SQLException e) {
            throw new ConnectionException("Failed to read database catalog: " + e.getMessage(), e);
        }
    }

    /**
     * Serialize a descriptor to the prompt text format.
     *
     * @param schema schema descriptor
     * @return deterministic text block, one paragraph per table
     */
    public String serialize(SchemaDescriptor schema) {
        StringBuilder sb = new StringBuilder();
        if (schema == null || schema.getTables() == null) {
            return "";
        }
        for (SchemaDescriptor.TableDescriptor table : schema.getTables()) {
            sb.append("Table: ").append(table.getName()).append("\n");
            for (SchemaDescriptor.ColumnDescriptor column : table.getColumns()) {
                sb.append("  - ").append(column.getName())
                        .append(" (").append(column.getType()).append(")\n");
            }
            for (SchemaDescriptor.ForeignKeyDescriptor fk : table.getForeignKeys()) {
                sb.append("  - Foreign Key: ").append(fk.getFromColumn())
                        .append(" references ").append(fk.getReferencedTable())
                        .append("(").append(fk.getReferencedColumn()).append(")\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    private void ensureOpen(Connection conn) {
        if (conn == null) {
            throw new ConnectionException("Database connection is not available");
        }
        try {
            if (conn.isClosed()) {
                throw new ConnectionException("Database connection is closed");
            }
        } catch (SQLException e) {
            throw new ConnectionException("Failed to check database connection: " + e.getMessage(), e);
        }
    }

    private List<String> listTables(Connection conn) throws SQLException {
        List<String> names = new ArrayList<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(LIST_TABLES_SQL)) {
            while (rs.next()) {
                names.add(rs.getString(1));
            }
        }
        return names;
    }

    private List<SchemaDescriptor.ColumnDescriptor> listColumns(Connection conn, String tableName) throws SQLException {
        List<SchemaDescriptor.ColumnDescriptor> columns = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(TABLE_INFO_SQL)) {
            ps.setString(1, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    columns.add(SchemaDescriptor.ColumnDescriptor.builder()
                            .name(rs.getString(1))
                            .type(nullToEmpty(rs.getString(2)))
                            .build());
                }
            }
        }
        return columns;
    }

    private List<SchemaDescriptor.ForeignKeyDescriptor> listForeignKeys(Connection conn, String tableName) throws SQLException {
        List<SchemaDescriptor.ForeignKeyDescriptor> keys = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(FOREIGN_KEY_LIST_SQL)) {
            ps.setString(1, tableName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    keys.add(SchemaDescriptor.ForeignKeyDescriptor.builder()
                            .fromColumn(rs.getString(1))
                            .referencedTable(rs.getString(2))
                            // NULL when the key references the parent's primary key implicitly
                            .referencedColumn(nullToEmpty(rs.getString(3)))
                            .build());
                }
            }
        }
        return keys;
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
