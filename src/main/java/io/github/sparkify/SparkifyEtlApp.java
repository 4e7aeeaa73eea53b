package io.github.sparkify;

import io.github.sparkify.config.LakeConfig;
import io.github.sparkify.config.LakeConfigLoader;
import io.github.sparkify.spark.PipelineResult;
import io.github.sparkify.spark.SparkifyPipeline;
import io.github.sparkify.spark.SparkifySessionFactory;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point of the lake ETL.
 *
 * <pre>
 * spark-submit --class io.github.sparkify.SparkifyEtlApp sparkify-lake.jar \
 *     --config dl.cfg --output s3a://my-bucket/lake --timezone UTC
 * </pre>
 *
 * Options: {@code --config}, {@code --input}, {@code --output}, {@code --song-glob},
 * {@code --log-glob}, {@code --timezone}, {@code --join-tolerance}, {@code --master}.
 * Exits 0 when all five tables are written and 1 otherwise.
 */
public class SparkifyEtlApp {

    private static final Logger LOG = LoggerFactory.getLogger(SparkifyEtlApp.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        LakeConfig config;
        try {
            config = LakeConfigLoader.load(args, System.getenv());
        } catch (LakeConfigException e) {
            LOG.error("Invalid configuration: {}", e.getMessage(), e);
            return 1;
        }

        SparkSession spark = SparkifySessionFactory.create(config);
        try {
            PipelineResult result = SparkifyPipeline.fromConfig(spark, config).run();
            LOG.info("Run report:\n{}", result.toJson());
            return 0;
        } catch (LakeException e) {
            LOG.error("Lake ETL failed: {}", e.getMessage(), e);
            return 1;
        } finally {
            spark.stop();
        }
    }
}
