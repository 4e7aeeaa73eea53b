package io.github.sparkify.spark;

import io.github.sparkify.LakeReadException;
import io.github.sparkify.SchemaViolationException;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads line-delimited JSON against a declared schema and rejects the whole input on the first
 * record that does not conform.
 *
 * The loaded dataset is cached and counted before it is returned. Counting alone is not enough:
 * Spark prunes every column for a bare count and would never parse the fields. Caching forces
 * each declared column to be parsed, so a type violation surfaces here, before any table of the
 * phase has been written. Callers own the cache and should {@code unpersist()} when done.
 */
public class JsonSourceReader {

    private static final Logger LOG = LoggerFactory.getLogger(JsonSourceReader.class);

    private static final String MALFORMED_RECORD = "MALFORMED_RECORD_IN_PARSING";

    private final SparkSession spark;

    public JsonSourceReader(SparkSession spark) {
        this.spark = spark;
    }

    /**
     * Load and validate a JSON input.
     *
     * @param dataset logical name used in log lines and errors, e.g. {@code song_data}
     * @param path file, directory or glob to read
     * @param schema declared schema of each record
     * @return the cached, fully parsed dataset
     * @throws SchemaViolationException if any record does not conform to the schema
     * @throws LakeReadException if the input is missing or storage cannot be read
     */
    public Dataset<Row> load(String dataset, String path, StructType schema) {
        LOG.info("Getting {} from \"{}\"", dataset, path);
        Dataset<Row> records = null;
        try {
            records = spark.read()
                    .schema(schema)
                    .option("mode", "FAILFAST")
                    .json(path)
                    .cache();
            long count = records.count();
            LOG.info("Loaded {} {} records", count, dataset);
            return records;
        } catch (Exception e) {
            if (records != null) {
                records.unpersist();
            }
            if (isMalformedRecord(e)) {
                LOG.error("{} at {} does not conform to its schema", dataset, path, e);
                throw new SchemaViolationException(dataset, path, e);
            }
            LOG.error("Failed to read {} from {}", dataset, path, e);
            throw new LakeReadException(dataset, path,
                    String.format("Input '%s' at %s cannot be read: %s", dataset, path, e.getMessage()), e);
        }
    }

    /**
     * True when the failure comes from FAILFAST parsing of a record, anywhere in the cause chain.
     * Spark reports it as {@code MALFORMED_RECORD_IN_PARSING} wrapping a {@code BadRecordException}.
     */
    static boolean isMalformedRecord(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if ("BadRecordException".equals(t.getClass().getSimpleName())) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && (message.contains(MALFORMED_RECORD) || message.contains("Malformed records are detected"))) {
                return true;
            }
        }
        return false;
    }
}
