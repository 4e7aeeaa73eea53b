package io.github.sparkify.spark;

import io.github.sparkify.LakeWriteException;
import org.apache.spark.sql.DataFrameWriter;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SaveMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The five tables of the lake, their directory under the output root and their partition columns.
 */
public enum LakeTable {

    SONGS("songs.parquet", "year", "artist_id"),
    ARTISTS("artists.parquet"),
    USERS("users.parquet"),
    TIME("time.parquet", "year", "month"),
    SONGPLAYS("songplays.parquet", "year", "month");

    private static final Logger LOG = LoggerFactory.getLogger(LakeTable.class);

    private final String directory;
    private final List<String> partitionColumns;

    LakeTable(String directory, String... partitionColumns) {
        this.directory = directory;
        this.partitionColumns = Collections.unmodifiableList(Arrays.asList(partitionColumns));
    }

    public String getDirectory() {
        return directory;
    }

    public List<String> getPartitionColumns() {
        return partitionColumns;
    }

    public String tableName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String pathUnder(String outputRoot) {
        return join(outputRoot, directory);
    }

    /**
     * Write the table as Parquet under the output root, replacing whatever was there.
     *
     * @return the path written to
     * @throws LakeWriteException if Spark fails to write the table
     */
    public String write(Dataset<Row> table, String outputRoot) {
        String path = pathUnder(outputRoot);
        LOG.info("Writing {} table to {} partitioned by {}", tableName(), path, partitionColumns);
        try {
            DataFrameWriter<Row> writer = table.write().mode(SaveMode.Overwrite);
            if (!partitionColumns.isEmpty()) {
                writer = writer.partitionBy(partitionColumns.toArray(new String[0]));
            }
            writer.parquet(path);
        } catch (Exception e) {
            LOG.error("Failed to write {} table to {}", tableName(), path, e);
            throw new LakeWriteException(tableName(), path, "write failed", e);
        }
        return path;
    }

    /**
     * Write the table and count what landed in storage.
     *
     * The row count is taken from the written files rather than the in-memory plan, so it
     * reflects what readers of the lake will see.
     */
    public TableMetrics persist(Dataset<Row> table, String outputRoot) {
        String path = write(table, outputRoot);
        long rows;
        try {
            rows = table.sparkSession().read().schema(table.schema()).parquet(path).count();
        } catch (Exception e) {
            throw new LakeWriteException(tableName(), path, "written table cannot be read back", e);
        }
        LOG.info("Done writing {} table: {} rows", tableName(), rows);
        return new TableMetrics(this, path, rows);
    }

    /**
     * Join a root and a relative path with exactly one separator between them.
     */
    public static String join(String root, String relative) {
        if (root == null || root.isEmpty()) {
            return relative;
        }
        String trimmedRelative = relative.startsWith("/") ? relative.substring(1) : relative;
        return root.endsWith("/") ? root + trimmedRelative : root + "/" + trimmedRelative;
    }
}
