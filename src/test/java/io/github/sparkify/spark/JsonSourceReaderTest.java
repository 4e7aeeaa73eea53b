package io.github.sparkify.spark;

import io.github.sparkify.LakeReadException;
import io.github.sparkify.SchemaViolationException;
import io.github.sparkify.SparkTestBase;
import io.github.sparkify.schema.LakeSchemas;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static io.github.sparkify.LakeFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSourceReaderTest extends SparkTestBase {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Conforming JSON lines load with the declared column types")
    void loadsConformingInput() throws IOException {
        writeSongData(tempDir, "songs.json",
                songJson("A1", "X", 2000, 180.0),
                songJson("A2", "Y", 2001, 200.0));

        Dataset<Row> records = new JsonSourceReader(spark)
                .load("song_data", tempDir.resolve("song_data/*/*/*/*.json").toString(), LakeSchemas.songRecord());
        try {
            assertThat(records.count()).isEqualTo(2);
            assertThat(records.schema().fieldNames()).containsExactly(LakeSchemas.songRecord().fieldNames());
            Row first = records.orderBy("artist_id").first();
            assertThat(first.<Integer>getAs("year")).isEqualTo(2000);
            assertThat(first.<Double>getAs("duration")).isEqualTo(180.0);
        } finally {
            records.unpersist();
        }
    }

    @Test
    @DisplayName("A missing input path is a read failure, not a schema violation")
    void missingPathIsAReadFailure() {
        String missing = tempDir.resolve("nowhere/*.json").toString();

        assertThatThrownBy(() -> new JsonSourceReader(spark).load("log_data", missing, LakeSchemas.logEvent()))
                .isInstanceOf(LakeReadException.class)
                .isNotInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("log_data")
                .satisfies(e -> assertThat(((LakeReadException) e).getInputPath()).isEqualTo(missing));
    }

    @Test
    void wronglyTypedFieldIsASchemaViolation() throws IOException {
        writeSongData(tempDir, "songs.json",
                "{\"artist_id\": \"A1\", \"title\": \"X\", \"year\": \"MMXVIII\", \"duration\": 180.0}");

        assertThatThrownBy(() -> new JsonSourceReader(spark)
                .load("song_data", tempDir.resolve("song_data/*/*/*/*.json").toString(), LakeSchemas.songRecord()))
                .isInstanceOf(SchemaViolationException.class)
                .satisfies(e -> assertThat(((SchemaViolationException) e).getDataset()).isEqualTo("song_data"));
    }

    @Test
    void classifiesParseFailuresByCauseChain() {
        Exception parse = new RuntimeException("Job aborted",
                new IllegalStateException("[MALFORMED_RECORD_IN_PARSING.WITHOUT_SUGGESTION] Malformed records are detected"));
        Exception io = new RuntimeException("Job aborted", new IOException("Permission denied"));

        assertThat(JsonSourceReader.isMalformedRecord(parse)).isTrue();
        assertThat(JsonSourceReader.isMalformedRecord(io)).isFalse();
    }
}
