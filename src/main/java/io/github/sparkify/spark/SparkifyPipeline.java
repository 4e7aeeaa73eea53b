package io.github.sparkify.spark;

import io.github.sparkify.LakeException;
import io.github.sparkify.config.LakeConfig;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the lake ETL in two phases separated by a commit barrier.
 *
 * <ol>
 *   <li>Catalog phase: song_data to the songs and artists tables.</li>
 *   <li>Barrier: the songs table must be committed in storage.</li>
 *   <li>Event phase: log_data to the users and time tables, then the songplays table,
 *       joined against the songs table read back from storage.</li>
 * </ol>
 *
 * Example usage:
 * <pre>
 * PipelineResult result = SparkifyPipeline.forBatch(spark)
 *     .withInputRoot("s3a://udacity-dend/")
 *     .withOutputRoot("s3a://my-bucket/lake")
 *     .withTimezone(ZoneId.of("UTC"))
 *     .run();
 * </pre>
 *
 * Every table is overwritten, so a failed run is repaired by running again.
 */
public class SparkifyPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(SparkifyPipeline.class);

    private final SparkSession spark;
    private final LakeConfig.Builder config;

    private SparkifyPipeline(SparkSession spark, LakeConfig.Builder config) {
        this.spark = spark;
        this.config = config;
    }

    /**
     * Create a pipeline with default settings.
     */
    public static SparkifyPipeline forBatch(SparkSession spark) {
        return new SparkifyPipeline(spark, LakeConfig.builder());
    }

    /**
     * Create a pipeline from a loaded configuration.
     */
    public static SparkifyPipeline fromConfig(SparkSession spark, LakeConfig config) {
        return forBatch(spark)
                .withInputRoot(config.getInputRoot())
                .withOutputRoot(config.getOutputRoot())
                .withSongDataGlob(config.getSongDataGlob())
                .withLogDataGlob(config.getLogDataGlob())
                .withTimezone(config.getTimezone())
                .withJoinTolerance(config.getJoinTolerance());
    }

    public SparkifyPipeline withInputRoot(String inputRoot) {
        config.inputRoot(inputRoot);
        return this;
    }

    public SparkifyPipeline withOutputRoot(String outputRoot) {
        config.outputRoot(outputRoot);
        return this;
    }

    public SparkifyPipeline withSongDataGlob(String glob) {
        config.songDataGlob(glob);
        return this;
    }

    public SparkifyPipeline withLogDataGlob(String glob) {
        config.logDataGlob(glob);
        return this;
    }

    public SparkifyPipeline withTimezone(ZoneId zone) {
        config.timezone(zone);
        return this;
    }

    /**
     * Match play length against song duration within epsilon seconds; null restores exact matching.
     */
    public SparkifyPipeline withJoinTolerance(Double epsilon) {
        config.joinTolerance(epsilon);
        return this;
    }

    /**
     * Run both phases.
     *
     * @throws LakeException on the first failure; nothing after the failing step runs
     */
    public PipelineResult run() {
        LakeConfig settings = config.build();
        LOG.info("Starting lake ETL: {}", settings);
        PipelineResult result = new PipelineResult();

        runCatalogPhase(settings, result);
        runEventPhase(settings, result);

        LOG.info("Lake ETL finished: {}", result);
        return result;
    }

    /**
     * Run only the catalog phase.
     */
    public PipelineResult runCatalogPhase() {
        PipelineResult result = new PipelineResult();
        runCatalogPhase(config.build(), result);
        return result;
    }

    /**
     * Run only the event phase. The songs table of an earlier catalog phase must already be committed.
     */
    public PipelineResult runEventPhase() {
        PipelineResult result = new PipelineResult();
        runEventPhase(config.build(), result);
        return result;
    }

    private void runCatalogPhase(LakeConfig settings, PipelineResult result) {
        long start = System.currentTimeMillis();
        try {
            List<TableMetrics> written = new CatalogTransform(spark)
                    .run(settings.songDataPath(), settings.getOutputRoot());
            result.addCatalogPhase(written, System.currentTimeMillis() - start);
        } catch (LakeException e) {
            LOG.error("Catalog phase failed", e);
            throw e;
        }
    }

    private void runEventPhase(LakeConfig settings, PipelineResult result) {
        awaitSongsCommitted(settings);

        long start = System.currentTimeMillis();
        EventTransform events = new EventTransform(spark, settings.getTimezone());
        SongplayJoin join = new SongplayJoin(spark, settings.getTimezone(), settings.joinPredicate());

        Dataset<Row> logEvents = events.load(settings.logDataPath());
        try {
            Dataset<Row> plays = EventTransform.plays(logEvents);

            List<TableMetrics> written = new ArrayList<>(events.writeDimensions(plays, settings.getOutputRoot()));
            written.add(join.run(plays, settings.getOutputRoot()));

            result.addEventPhase(written, System.currentTimeMillis() - start);
        } catch (LakeException e) {
            LOG.error("Event phase failed", e);
            throw e;
        } finally {
            logEvents.unpersist();
        }
    }

    /**
     * Phase barrier: nothing of the event phase starts until the songs table is confirmed committed.
     */
    private void awaitSongsCommitted(LakeConfig settings) {
        new CommitVerifier(spark.sparkContext().hadoopConfiguration())
                .verify(LakeTable.SONGS, settings.getOutputRoot());
    }
}
