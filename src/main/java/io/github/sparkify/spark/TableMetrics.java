package io.github.sparkify.spark;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * What was written for one table.
 */
public class TableMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    private final LakeTable table;
    private final String path;
    private final long rows;

    public TableMetrics(LakeTable table, String path, long rows) {
        this.table = table;
        this.path = path;
        this.rows = rows;
    }

    @JsonProperty("table")
    public String getTableName() { return table.tableName(); }

    @JsonProperty("path")
    public String getPath() { return path; }

    @JsonProperty("rows")
    public long getRows() { return rows; }

    @JsonProperty("partitionedBy")
    public List<String> getPartitionColumns() { return table.getPartitionColumns(); }

    public LakeTable table() { return table; }

    @Override
    public String toString() {
        return String.format("TableMetrics[%s, rows=%d, path=%s]", table.tableName(), rows, path);
    }
}
