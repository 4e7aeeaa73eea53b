package io.github.sparkify.spark;

import io.github.sparkify.schema.LakeSchemas;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.apache.spark.sql.functions.monotonically_increasing_id;

/**
 * Catalog phase: turns song catalog records into the songs and artists dimensions.
 *
 * <p>The songs table is
 * {@code (song_id, artist_id, title, year, duration)}, deduplicated on everything but
 * {@code song_id}, which is generated afterwards. Its values are unique within a run but
 * depend on how Spark partitions the input, so they are not stable across runs.
 *
 * <p>The artists table is
 * {@code (artist_id, artist_name, artist_location, artist_latitude, artist_longitude)},
 * deduplicated on the full tuple. An artist whose location differs between two songs
 * keeps one row per variant.
 */
public class CatalogTransform {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogTransform.class);

    public static final String DATASET = "song_data";
    public static final String SONG_ID = "song_id";

    public static final String[] SONG_COLUMNS = {"artist_id", "title", "year", "duration"};
    public static final String[] ARTIST_COLUMNS =
            {"artist_id", "artist_name", "artist_location", "artist_latitude", "artist_longitude"};

    private final JsonSourceReader reader;

    public CatalogTransform(SparkSession spark) {
        this.reader = new JsonSourceReader(spark);
    }

    /**
     * Read song records against the declared schema; see {@link JsonSourceReader#load}.
     */
    public Dataset<Row> load(String songDataPath) {
        return reader.load(DATASET, songDataPath, LakeSchemas.songRecord());
    }

    public static Dataset<Row> songs(Dataset<Row> records) {
        return records
                .selectExpr(SONG_COLUMNS)
                .dropDuplicates()
                .withColumn(SONG_ID, monotonically_increasing_id());
    }

    public static Dataset<Row> artists(Dataset<Row> records) {
        return records
                .selectExpr(ARTIST_COLUMNS)
                .dropDuplicates();
    }

    /**
     * Load the catalog and write the songs and artists tables under the output root.
     *
     * @return metrics of the songs table followed by the artists table
     */
    public List<TableMetrics> run(String songDataPath, String outputRoot) {
        Dataset<Row> records = load(songDataPath);
        try {
            List<TableMetrics> written = new ArrayList<>();

            LOG.info("Dumping the songs table");
            written.add(LakeTable.SONGS.persist(songs(records), outputRoot));

            LOG.info("Dumping the artists table");
            written.add(LakeTable.ARTISTS.persist(artists(records), outputRoot));

            return written;
        } finally {
            records.unpersist();
        }
    }
}
