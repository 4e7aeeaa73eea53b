package io.github.sparkify.config;

import io.github.sparkify.LakeConfigException;
import io.github.sparkify.spark.JoinPredicate;
import io.github.sparkify.spark.LakeTable;

import java.io.Serializable;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Settings of one ETL run: where to read, where to write, credentials for object storage,
 * the timezone used to decompose event timestamps and the songplays join predicate.
 *
 * Instances are built with {@link Builder} or loaded with {@link LakeConfigLoader}.
 */
public final class LakeConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_INPUT_ROOT = "s3a://udacity-dend/";
    public static final String DEFAULT_OUTPUT_ROOT = "s3a://for-data-engineering-nanodegree/dend_project_4";
    public static final String DEFAULT_SONG_DATA_GLOB = "song_data/*/*/*/*.json";
    public static final String DEFAULT_LOG_DATA_GLOB = "log_data/*/*/*.json";
    public static final String DEFAULT_APP_NAME = "sparkify-lake";

    private final String inputRoot;
    private final String outputRoot;
    private final String songDataGlob;
    private final String logDataGlob;
    private final ZoneId timezone;
    private final Double joinTolerance;
    private final String awsAccessKeyId;
    private final String awsSecretAccessKey;
    private final String sparkMaster;
    private final String appName;

    private LakeConfig(Builder builder) {
        this.inputRoot = builder.inputRoot;
        this.outputRoot = builder.outputRoot;
        this.songDataGlob = builder.songDataGlob;
        this.logDataGlob = builder.logDataGlob;
        this.timezone = builder.timezone;
        this.joinTolerance = builder.joinTolerance;
        this.awsAccessKeyId = builder.awsAccessKeyId;
        this.awsSecretAccessKey = builder.awsSecretAccessKey;
        this.sparkMaster = builder.sparkMaster;
        this.appName = builder.appName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getInputRoot() { return inputRoot; }
    public String getOutputRoot() { return outputRoot; }
    public String getSongDataGlob() { return songDataGlob; }
    public String getLogDataGlob() { return logDataGlob; }
    public ZoneId getTimezone() { return timezone; }
    public Double getJoinTolerance() { return joinTolerance; }
    public String getAwsAccessKeyId() { return awsAccessKeyId; }
    public String getAwsSecretAccessKey() { return awsSecretAccessKey; }
    public String getSparkMaster() { return sparkMaster; }
    public String getAppName() { return appName; }

    /** Full glob of the song catalog files. */
    public String songDataPath() {
        return LakeTable.join(inputRoot, songDataGlob);
    }

    /** Full glob of the session log files. */
    public String logDataPath() {
        return LakeTable.join(inputRoot, logDataGlob);
    }

    public JoinPredicate joinPredicate() {
        return joinTolerance == null ? JoinPredicate.exact() : JoinPredicate.tolerant(joinTolerance);
    }

    /**
     * True when either root lives on object storage and the run therefore needs credentials.
     */
    public boolean requiresCredentials() {
        return isObjectStorage(inputRoot) || isObjectStorage(outputRoot);
    }

    public boolean hasCredentials() {
        return !isBlank(awsAccessKeyId) && !isBlank(awsSecretAccessKey);
    }

    public static boolean isObjectStorage(String root) {
        if (root == null) {
            return false;
        }
        String lower = root.toLowerCase(Locale.ROOT);
        return lower.startsWith("s3a://") || lower.startsWith("s3://") || lower.startsWith("s3n://");
    }

    /**
     * Checks the settings a run cannot start without.
     *
     * @throws LakeConfigException if a root is missing or object storage is used without credentials
     */
    public LakeConfig validate() {
        if (isBlank(inputRoot)) {
            throw new LakeConfigException("Input root is not configured");
        }
        if (isBlank(outputRoot)) {
            throw new LakeConfigException("Output root is not configured");
        }
        if (requiresCredentials() && !hasCredentials()) {
            throw new LakeConfigException(
                    "AWS_ACCESS_KEY_ID and AWS_SECRET_ACCESS_KEY are required to access " + describeRemoteRoots());
        }
        return this;
    }

    private String describeRemoteRoots() {
        if (isObjectStorage(inputRoot) && isObjectStorage(outputRoot)) {
            return inputRoot + " and " + outputRoot;
        }
        return isObjectStorage(inputRoot) ? inputRoot : outputRoot;
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    @Override
    public String toString() {
        return String.format(
                "LakeConfig[input=%s, output=%s, songs=%s, logs=%s, timezone=%s, join=%s, master=%s, credentials=%s]",
                inputRoot, outputRoot, songDataGlob, logDataGlob, timezone, joinPredicate(), sparkMaster,
                hasCredentials() ? "set" : "unset");
    }

    /**
     * Builder for {@link LakeConfig}. Every setting starts at its default.
     */
    public static final class Builder {

        private String inputRoot = DEFAULT_INPUT_ROOT;
        private String outputRoot = DEFAULT_OUTPUT_ROOT;
        private String songDataGlob = DEFAULT_SONG_DATA_GLOB;
        private String logDataGlob = DEFAULT_LOG_DATA_GLOB;
        private ZoneId timezone = ZoneId.of("UTC");
        private Double joinTolerance;
        private String awsAccessKeyId;
        private String awsSecretAccessKey;
        private String sparkMaster;
        private String appName = DEFAULT_APP_NAME;

        private Builder() {
        }

        public Builder inputRoot(String inputRoot) {
            this.inputRoot = inputRoot;
            return this;
        }

        public Builder outputRoot(String outputRoot) {
            this.outputRoot = outputRoot;
            return this;
        }

        public Builder songDataGlob(String songDataGlob) {
            this.songDataGlob = songDataGlob;
            return this;
        }

        public Builder logDataGlob(String logDataGlob) {
            this.logDataGlob = logDataGlob;
            return this;
        }

        public Builder timezone(ZoneId timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder timezone(String zoneId) {
            try {
                this.timezone = ZoneId.of(zoneId);
            } catch (java.time.DateTimeException e) {
                throw new LakeConfigException("Unknown timezone: " + zoneId, e);
            }
            return this;
        }

        /**
         * Absolute tolerance for matching play length against song duration; null means exact equality.
         */
        public Builder joinTolerance(Double joinTolerance) {
            if (joinTolerance != null && (joinTolerance.isNaN() || joinTolerance < 0)) {
                throw new LakeConfigException("Join tolerance must be a non-negative number: " + joinTolerance);
            }
            this.joinTolerance = joinTolerance;
            return this;
        }

        public Builder awsCredentials(String accessKeyId, String secretAccessKey) {
            this.awsAccessKeyId = accessKeyId;
            this.awsSecretAccessKey = secretAccessKey;
            return this;
        }

        public Builder sparkMaster(String sparkMaster) {
            this.sparkMaster = sparkMaster;
            return this;
        }

        public Builder appName(String appName) {
            this.appName = appName;
            return this;
        }

        public LakeConfig build() {
            return new LakeConfig(this);
        }
    }
}
