package io.github.sparkify.spark;

import io.github.sparkify.schema.LakeSchemas;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;

import static org.apache.spark.sql.functions.monotonically_increasing_id;

/**
 * Event phase, fact part: joins plays against the committed songs table to build songplays.
 *
 * A play matches a song when its {@code song} equals the song {@code title} and its
 * {@code length} matches the song {@code duration} under the configured {@link JoinPredicate}.
 * Plays without a match are dropped; a play that matches several songs produces one row per
 * match. {@code month} is the month of the play; {@code year} is the matched song's release year,
 * so songplays are partitioned by release year and play month.
 */
public class SongplayJoin {

    private static final Logger LOG = LoggerFactory.getLogger(SongplayJoin.class);

    public static final String SONGPLAY_ID = "songplay_id";

    public static final String[] SONGPLAY_COLUMNS = {
            SONGPLAY_ID, "start_time", "user_id", "level", "song_id", "artist_id",
            "session_id", "location", "user_agent", "year", "month"
    };

    private final SparkSession spark;
    private final ZoneId zone;
    private final JoinPredicate predicate;

    public SongplayJoin(SparkSession spark, ZoneId zone, JoinPredicate predicate) {
        this.spark = spark;
        this.zone = zone;
        this.predicate = predicate;
    }

    /**
     * Read the songs table back from storage, with its declared schema so partition columns keep their types.
     */
    public Dataset<Row> readSongs(String outputRoot) {
        String path = LakeTable.SONGS.pathUnder(outputRoot);
        LOG.info("Reading the songs table from {}", path);
        return spark.read()
                .schema(LakeSchemas.songsTable())
                .parquet(path);
    }

    public Dataset<Row> songplays(Dataset<Row> plays, Dataset<Row> songs) {
        Dataset<Row> log = SparkifyFunctions.withTimeParts(plays, EventTransform.TIMESTAMP, zone)
                .withColumn(SONGPLAY_ID, monotonically_increasing_id())
                .select(SONGPLAY_ID, "start_time", "userId", "sessionId", "userAgent",
                        "length", "location", "song", "level", "month");

        Dataset<Row> catalog = songs.select("song_id", "artist_id", "title", "year", "duration");

        Column condition = log.col("song").equalTo(catalog.col("title"))
                .and(predicate.matches(log.col("length"), catalog.col("duration")));

        return log.join(catalog, condition, "inner")
                .select(
                        log.col(SONGPLAY_ID),
                        log.col("start_time"),
                        log.col("userId").as("user_id"),
                        log.col("level"),
                        catalog.col("song_id"),
                        catalog.col("artist_id"),
                        log.col("sessionId").as("session_id"),
                        log.col("location"),
                        log.col("userAgent").as("user_agent"),
                        catalog.col("year"),
                        log.col("month")
                );
    }

    /**
     * Join plays with the committed songs table and write the songplays table.
     */
    public TableMetrics run(Dataset<Row> plays, String outputRoot) {
        LOG.info("Joining plays and songs with {} duration match", predicate);
        Dataset<Row> songplays = songplays(plays, readSongs(outputRoot));

        TableMetrics written = LakeTable.SONGPLAYS.persist(songplays, outputRoot);
        if (written.getRows() == 0) {
            LOG.warn("Songplays table is empty: no play matched a song on title and {} duration", predicate);
        }
        return written;
    }

    public JoinPredicate getPredicate() {
        return predicate;
    }
}
