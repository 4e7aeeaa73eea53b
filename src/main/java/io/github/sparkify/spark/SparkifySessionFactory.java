package io.github.sparkify.spark;

import io.github.sparkify.config.LakeConfig;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates the Spark session of a run and wires object-storage credentials into its Hadoop configuration.
 */
public class SparkifySessionFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SparkifySessionFactory.class);

    public static final String HADOOP_AWS_PACKAGE = "org.apache.hadoop:hadoop-aws:3.3.4";
    private static final String S3A_FILE_SYSTEM = "org.apache.hadoop.fs.s3a.S3AFileSystem";

    private SparkifySessionFactory() {
    }

    /**
     * @throws io.github.sparkify.LakeConfigException if the configuration is not usable, before any session starts
     */
    public static SparkSession create(LakeConfig config) {
        config.validate();
        SparkSession.Builder builder = SparkSession.builder().appName(config.getAppName());
        if (config.getSparkMaster() != null && !config.getSparkMaster().isEmpty()) {
            builder.master(config.getSparkMaster());
        }
        settingsFor(config).forEach(builder::config);

        SparkSession spark = builder.getOrCreate();
        LOG.info("Spark session {} started (master={})", spark.sparkContext().appName(), spark.sparkContext().master());
        return spark;
    }

    /**
     * Session settings needed for the configured roots. Empty when both roots are local or no credentials are set.
     */
    static Map<String, String> settingsFor(LakeConfig config) {
        Map<String, String> settings = new LinkedHashMap<>();
        if (!config.requiresCredentials() || !config.hasCredentials()) {
            return settings;
        }
        settings.put("spark.jars.packages", HADOOP_AWS_PACKAGE);
        settings.put("spark.hadoop.fs.s3a.access.key", config.getAwsAccessKeyId());
        settings.put("spark.hadoop.fs.s3a.secret.key", config.getAwsSecretAccessKey());
        settings.put("spark.hadoop.fs.s3a.aws.credentials.provider",
                "org.apache.hadoop.fs.s3a.SimpleAWSCredentialsProvider");
        settings.put("spark.hadoop.fs.s3.impl", S3A_FILE_SYSTEM);
        settings.put("spark.hadoop.fs.s3n.impl", S3A_FILE_SYSTEM);
        return settings;
    }
}
