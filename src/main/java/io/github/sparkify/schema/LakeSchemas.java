package io.github.sparkify.schema;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.apache.avro.Schema;
import org.apache.spark.sql.types.StructType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Declared schemas of the lake, loaded from the Avro schema files on the classpath.
 *
 * <pre>
 * StructType songs = LakeSchemas.songRecord();
 * Dataset&lt;Row&gt; df = spark.read().schema(songs).json(path);
 * </pre>
 */
public final class LakeSchemas {

    private static final Logger LOG = LoggerFactory.getLogger(LakeSchemas.class);

    public static final String SONG_RECORD = "schemas/song_record.avsc";
    public static final String LOG_EVENT = "schemas/log_event.avsc";
    public static final String SONGS_TABLE = "schemas/songs_table.avsc";

    private static final LoadingCache<String, StructType> CACHE = CacheBuilder.newBuilder()
            .maximumSize(16)
            .build(new CacheLoader<>() {
                @Override
                public StructType load(String resource) throws IOException {
                    return AvroSparkSchemaConverter.toStructType(loadAvro(resource));
                }
            });

    private LakeSchemas() {
    }

    /** Raw song catalog record. */
    public static StructType songRecord() {
        return get(SONG_RECORD);
    }

    /** Raw session log event. */
    public static StructType logEvent() {
        return get(LOG_EVENT);
    }

    /** The songs dimension as persisted, used to read it back for the join. */
    public static StructType songsTable() {
        return get(SONGS_TABLE);
    }

    /**
     * Load and convert a schema resource, cached by resource name.
     *
     * @throws IllegalArgumentException if the resource is missing or is not a flat record
     */
    public static StructType get(String resource) {
        try {
            return CACHE.getUnchecked(resource);
        } catch (UncheckedExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IllegalArgumentException) {
                throw (IllegalArgumentException) cause;
            }
            if (cause instanceof IOException) {
                throw new UncheckedIOException((IOException) cause);
            }
            throw e;
        }
    }

    static Schema loadAvro(String resource) throws IOException {
        LOG.debug("Loading schema resource {}", resource);
        try (InputStream is = LakeSchemas.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Schema resource not found on classpath: " + resource);
            }
            return new Schema.Parser().parse(is);
        }
    }

    static void clearCache() {
        CACHE.invalidateAll();
    }
}
