package com.text2sql.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Snapshot of the user tables of a database, in catalog order.
 *
 * <p>Built fresh for every request and never cached; the connection it was read from stays the
 * owner of the live schema.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SchemaDescriptor {
    private List<TableDescriptor> tables;

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TableDescriptor {
        private String name;
        private List<ColumnDescriptor> columns;
        private List<ForeignKeyDescriptor> foreignKeys;
    }

    @Data
    @Builder
    public static class ColumnDescriptor {
        private String name;
        private String type;
    }

    @Data
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ForeignKeyDescriptor {
        private String fromColumn;
        private String referencedTable;
        private String referencedColumn;
    }
}
