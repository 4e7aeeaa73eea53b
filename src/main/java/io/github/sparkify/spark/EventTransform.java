package io.github.sparkify.spark;

import io.github.sparkify.schema.LakeSchemas;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

import static org.apache.spark.sql.functions.col;

/**
 * Event phase, dimension part: filters session logs to song plays and extracts the users and time dimensions.
 *
 * Only {@code page == "NextSong"} events are plays; every other page event is dropped before
 * any table is derived. A user whose level changed between plays keeps one users row per level,
 * there is no latest-wins resolution.
 */
public class EventTransform {

    private static final Logger LOG = LoggerFactory.getLogger(EventTransform.class);

    public static final String DATASET = "log_data";
    public static final String NEXT_SONG = "NextSong";
    public static final String TIMESTAMP = "ts";

    public static final String[] USER_COLUMNS = {"userId", "firstName", "lastName", "gender", "level"};

    private final JsonSourceReader reader;
    private final ZoneId zone;

    public EventTransform(SparkSession spark, ZoneId zone) {
        this.reader = new JsonSourceReader(spark);
        this.zone = zone;
    }

    public Dataset<Row> load(String logDataPath) {
        return reader.load(DATASET, logDataPath, LakeSchemas.logEvent());
    }

    public static Dataset<Row> plays(Dataset<Row> events) {
        return events.filter(col("page").equalTo(NEXT_SONG));
    }

    public static Dataset<Row> users(Dataset<Row> plays) {
        return plays
                .selectExpr(USER_COLUMNS)
                .dropDuplicates();
    }

    /**
     * One row per distinct start_time among the plays. Plays without a timestamp have no time row.
     */
    public Dataset<Row> time(Dataset<Row> plays) {
        Dataset<Row> timestamps = plays
                .select(TIMESTAMP)
                .filter(col(TIMESTAMP).isNotNull());
        return SparkifyFunctions.withTimeParts(timestamps, TIMESTAMP, zone)
                .selectExpr(SparkifyFunctions.TIME_COLUMNS)
                .dropDuplicates();
    }

    /**
     * Write the users and time tables derived from already filtered plays.
     *
     * @return metrics of the users table followed by the time table
     */
    public List<TableMetrics> writeDimensions(Dataset<Row> plays, String outputRoot) {
        List<TableMetrics> written = new ArrayList<>();

        LOG.info("Dumping users table");
        written.add(LakeTable.USERS.persist(users(plays), outputRoot));

        LOG.info("Extracting time columns from ts in zone {}", zone);
        written.add(LakeTable.TIME.persist(time(plays), outputRoot));

        return written;
    }

    public ZoneId getZone() {
        return zone;
    }
}
