package io.github.sparkify.config;

import io.github.sparkify.LakeConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Builds a {@link LakeConfig} from a config file, environment variables and command-line flags.
 *
 * Later sources win: defaults, then the config file, then the environment, then the command line.
 * The config file is a {@code .cfg}/{@code .properties} file (INI section headers such as
 * {@code [AWS]} are ignored) or a {@code .yaml}/{@code .yml} file whose nested keys are joined with dots.
 *
 * <pre>
 * AWS_ACCESS_KEY_ID=...
 * AWS_SECRET_ACCESS_KEY=...
 * output.root=s3a://my-bucket/lake
 * timezone=UTC
 * </pre>
 */
public class LakeConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(LakeConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "dl.cfg";

    public static final String AWS_ACCESS_KEY_ID = "AWS_ACCESS_KEY_ID";
    public static final String AWS_SECRET_ACCESS_KEY = "AWS_SECRET_ACCESS_KEY";
    public static final String INPUT_ROOT = "input.root";
    public static final String OUTPUT_ROOT = "output.root";
    public static final String SONG_DATA_GLOB = "song.data.glob";
    public static final String LOG_DATA_GLOB = "log.data.glob";
    public static final String TIMEZONE = "timezone";
    public static final String JOIN_TOLERANCE = "join.tolerance";
    public static final String SPARK_MASTER = "spark.master";

    static final String CONFIG_FILE_ENV = "SPARKIFY_CONFIG";

    private static final Map<String, String> ENVIRONMENT_KEYS = new LinkedHashMap<>();
    private static final Map<String, String> COMMAND_LINE_FLAGS = new LinkedHashMap<>();
    private static final Map<String, String> KEY_ALIASES = new LinkedHashMap<>();

    static {
        ENVIRONMENT_KEYS.put(AWS_ACCESS_KEY_ID, AWS_ACCESS_KEY_ID);
        ENVIRONMENT_KEYS.put(AWS_SECRET_ACCESS_KEY, AWS_SECRET_ACCESS_KEY);
        ENVIRONMENT_KEYS.put("SPARKIFY_INPUT_ROOT", INPUT_ROOT);
        ENVIRONMENT_KEYS.put("SPARKIFY_OUTPUT_ROOT", OUTPUT_ROOT);
        ENVIRONMENT_KEYS.put("SPARKIFY_SONG_DATA_GLOB", SONG_DATA_GLOB);
        ENVIRONMENT_KEYS.put("SPARKIFY_LOG_DATA_GLOB", LOG_DATA_GLOB);
        ENVIRONMENT_KEYS.put("SPARKIFY_TIMEZONE", TIMEZONE);
        ENVIRONMENT_KEYS.put("SPARKIFY_JOIN_TOLERANCE", JOIN_TOLERANCE);
        ENVIRONMENT_KEYS.put("SPARKIFY_SPARK_MASTER", SPARK_MASTER);

        COMMAND_LINE_FLAGS.put("--input", INPUT_ROOT);
        COMMAND_LINE_FLAGS.put("--output", OUTPUT_ROOT);
        COMMAND_LINE_FLAGS.put("--song-glob", SONG_DATA_GLOB);
        COMMAND_LINE_FLAGS.put("--log-glob", LOG_DATA_GLOB);
        COMMAND_LINE_FLAGS.put("--timezone", TIMEZONE);
        COMMAND_LINE_FLAGS.put("--join-tolerance", JOIN_TOLERANCE);
        COMMAND_LINE_FLAGS.put("--master", SPARK_MASTER);

        KEY_ALIASES.put("aws.access_key_id", AWS_ACCESS_KEY_ID);
        KEY_ALIASES.put("aws.secret_access_key", AWS_SECRET_ACCESS_KEY);
        KEY_ALIASES.put("aws.aws_access_key_id", AWS_ACCESS_KEY_ID);
        KEY_ALIASES.put("aws.aws_secret_access_key", AWS_SECRET_ACCESS_KEY);
    }

    private LakeConfigLoader() {
    }

    /**
     * Load and validate the configuration of a run.
     *
     * @param args command-line arguments; {@code --config <file>} names the config file
     * @param environment environment variables, usually {@code System.getenv()}
     * @throws LakeConfigException if a flag is unknown, a named config file is unreadable,
     *                             or the resulting configuration is not usable
     */
    public static LakeConfig load(String[] args, Map<String, String> environment) {
        Map<String, String> settings = resolveSettings(args, environment);
        LakeConfig config = fromSettings(settings).validate();
        LOG.info("Loaded {}", config);
        return config;
    }

    /**
     * Merge every source into a single map of canonical keys.
     */
    static Map<String, String> resolveSettings(String[] args, Map<String, String> environment) {
        Map<String, String> cli = parseCommandLine(args);

        String explicitFile = cli.remove("config");
        if (explicitFile == null) {
            explicitFile = environment.get(CONFIG_FILE_ENV);
        }

        Map<String, String> settings = new LinkedHashMap<>();
        if (explicitFile != null) {
            settings.putAll(readFile(Paths.get(explicitFile)));
        } else if (Files.isRegularFile(Paths.get(DEFAULT_CONFIG_FILE))) {
            settings.putAll(readFile(Paths.get(DEFAULT_CONFIG_FILE)));
        } else {
            LOG.debug("No {} in working directory, using environment and flags only", DEFAULT_CONFIG_FILE);
        }

        for (Map.Entry<String, String> entry : ENVIRONMENT_KEYS.entrySet()) {
            String value = environment.get(entry.getKey());
            if (value != null && !value.isEmpty()) {
                settings.put(entry.getValue(), value);
            }
        }

        settings.putAll(cli);
        return settings;
    }

    static LakeConfig fromSettings(Map<String, String> settings) {
        LakeConfig.Builder builder = LakeConfig.builder();

        if (settings.containsKey(INPUT_ROOT)) {
            builder.inputRoot(settings.get(INPUT_ROOT));
        }
        if (settings.containsKey(OUTPUT_ROOT)) {
            builder.outputRoot(settings.get(OUTPUT_ROOT));
        }
        if (settings.containsKey(SONG_DATA_GLOB)) {
            builder.songDataGlob(settings.get(SONG_DATA_GLOB));
        }
        if (settings.containsKey(LOG_DATA_GLOB)) {
            builder.logDataGlob(settings.get(LOG_DATA_GLOB));
        }
        if (settings.containsKey(TIMEZONE)) {
            builder.timezone(settings.get(TIMEZONE));
        }
        if (settings.containsKey(JOIN_TOLERANCE)) {
            builder.joinTolerance(parseTolerance(settings.get(JOIN_TOLERANCE)));
        }
        if (settings.containsKey(SPARK_MASTER)) {
            builder.sparkMaster(settings.get(SPARK_MASTER));
        }
        builder.awsCredentials(settings.get(AWS_ACCESS_KEY_ID), settings.get(AWS_SECRET_ACCESS_KEY));

        return builder.build();
    }

    private static Double parseTolerance(String value) {
        if (value == null || value.trim().isEmpty() || "exact".equalsIgnoreCase(value.trim())) {
            return null;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new LakeConfigException("Join tolerance is not a number: " + value, e);
        }
    }

    static Map<String, String> parseCommandLine(String[] args) {
        Map<String, String> values = new LinkedHashMap<>();
        if (args == null) {
            return values;
        }
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            String value;
            int eq = flag.indexOf('=');
            if (flag.startsWith("--") && eq > 0) {
                value = flag.substring(eq + 1);
                flag = flag.substring(0, eq);
            } else {
                if (i + 1 >= args.length) {
                    throw new LakeConfigException("Missing value for " + flag);
                }
                value = args[++i];
            }

            if ("--config".equals(flag)) {
                values.put("config", value);
            } else if (COMMAND_LINE_FLAGS.containsKey(flag)) {
                values.put(COMMAND_LINE_FLAGS.get(flag), value);
            } else {
                throw new LakeConfigException("Unknown option: " + flag + " (known: --config, "
                        + String.join(", ", COMMAND_LINE_FLAGS.keySet()) + ")");
            }
        }
        return values;
    }

    /**
     * Read a config file into canonical keys.
     */
    static Map<String, String> readFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new LakeConfigException("Config file not found: " + file.toAbsolutePath());
        }
        LOG.info("Reading configuration from {}", file);

        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        Map<String, String> raw = new LinkedHashMap<>();
        try {
            if (name.endsWith(".yaml") || name.endsWith(".yml")) {
                try (InputStream is = Files.newInputStream(file)) {
                    Object loaded = new Yaml().load(is);
                    if (loaded instanceof Map) {
                        flatten("", (Map<?, ?>) loaded, raw);
                    } else if (loaded != null) {
                        throw new LakeConfigException("Config file " + file + " is not a YAML mapping");
                    }
                }
            } else {
                Properties props = new Properties();
                try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                    props.load(reader);
                }
                for (String key : props.stringPropertyNames()) {
                    if (key.startsWith("[")) {
                        continue;
                    }
                    raw.put(key, unquote(props.getProperty(key)));
                }
            }
        } catch (IOException e) {
            throw new LakeConfigException("Cannot read config file " + file, e);
        }

        Map<String, String> settings = new LinkedHashMap<>();
        raw.forEach((key, value) -> settings.put(canonicalKey(key), value));
        return settings;
    }

    private static void flatten(String prefix, Map<?, ?> map, Map<String, String> out) {
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map) {
                flatten(key, (Map<?, ?>) value, out);
            } else if (value != null) {
                out.put(key, String.valueOf(value));
            }
        }
    }

    static String canonicalKey(String key) {
        String trimmed = key.trim();
        if (trimmed.equalsIgnoreCase(AWS_ACCESS_KEY_ID)) {
            return AWS_ACCESS_KEY_ID;
        }
        if (trimmed.equalsIgnoreCase(AWS_SECRET_ACCESS_KEY)) {
            return AWS_SECRET_ACCESS_KEY;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        return KEY_ALIASES.getOrDefault(lower, lower);
    }

    private static String unquote(String value) {
        String v = value.trim();
        if (v.length() >= 2 && ((v.startsWith("\"") && v.endsWith("\"")) || (v.startsWith("'") && v.endsWith("'")))) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }
}
