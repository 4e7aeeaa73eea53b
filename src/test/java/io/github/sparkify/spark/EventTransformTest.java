package io.github.sparkify.spark;

import io.github.sparkify.SchemaViolationException;
import io.github.sparkify.SparkTestBase;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;

import static io.github.sparkify.LakeFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventTransformTest extends SparkTestBase {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Only NextSong events survive the play filter")
    void filtersToNextSong() {
        Dataset<Row> events = logEvents(spark,
                play("7", "free", "X", 180.0, TS_2018_11_12),
                event("Home", "8", "Ann", "Lee", "free", null, null, TS_2018_11_04),
                event("Logout", "9", "Bob", "Ray", "paid", null, null, TS_2018_11_04),
                play("10", "paid", "Y", 200.0, TS_2018_12_31));

        List<Row> plays = EventTransform.plays(events).collectAsList();

        assertThat(plays).hasSize(2);
        assertThat(plays).allSatisfy(row -> assertThat(row.<String>getAs("page")).isEqualTo("NextSong"));
        assertThat(EventTransform.users(EventTransform.plays(events)).collectAsList())
                .extracting(row -> row.<String>getAs("userId"))
                .containsExactlyInAnyOrder("7", "10");
    }

    @Test
    @DisplayName("A user seen at two levels keeps one row per level")
    void levelChangeKeepsBothRows() {
        Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                play("7", "free", "X", 180.0, TS_2018_11_04),
                play("7", "free", "X", 180.0, TS_2018_11_04 + 1000),
                play("7", "paid", "Y", 200.0, TS_2018_11_12)));

        List<Row> users = EventTransform.users(plays).collectAsList();

        assertThat(users).hasSize(2);
        assertThat(users).extracting(row -> row.<String>getAs("level"))
                .containsExactlyInAnyOrder("free", "paid");
        assertThat(users.get(0).schema().fieldNames()).containsExactly(EventTransform.USER_COLUMNS);
    }

    @Test
    @DisplayName("Time row carries every calendar part of the play timestamp")
    void timeRowValues() {
        Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                play("7", "free", "X", 180.0, TS_2018_11_12)));

        List<Row> time = new EventTransform(spark, UTC).time(plays).collectAsList();

        assertThat(time).hasSize(1);
        Row row = time.get(0);
        assertThat(row.schema().fieldNames()).containsExactly(SparkifyFunctions.TIME_COLUMNS);
        assertThat(row.<String>getAs("start_time")).isEqualTo("2018-11-12T02:37:38.796");
        assertThat(row.<Integer>getAs("hour")).isEqualTo(2);
        assertThat(row.<Integer>getAs("day")).isEqualTo(12);
        assertThat(row.<Integer>getAs("week")).isEqualTo(46);
        assertThat(row.<Integer>getAs("month")).isEqualTo(11);
        assertThat(row.<Integer>getAs("year")).isEqualTo(2018);
        assertThat(row.<Integer>getAs("weekday")).isEqualTo(1);
    }

    @Test
    void timeFollowsTheConfiguredZone() {
        Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                play("7", "free", "X", 180.0, TS_2018_11_12)));

        Row row = new EventTransform(spark, ZoneId.of("America/New_York")).time(plays).first();

        assertThat(row.<String>getAs("start_time")).isEqualTo("2018-11-11T21:37:38.796");
        assertThat(row.<Integer>getAs("weekday")).isEqualTo(0);
        assertThat(row.<Integer>getAs("week")).isEqualTo(45);
    }

    @Test
    @DisplayName("Plays sharing a timestamp give one time row; plays without one give none")
    void timeIsDeduplicatedAndSkipsNulls() {
        Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                play("7", "free", "X", 180.0, TS_2018_11_12),
                play("8", "paid", "Y", 200.0, TS_2018_11_12),
                event("NextSong", "9", "Cy", "Doe", "free", "Z", 150.0, null),
                play("9", "free", "Z", 150.0, TS_2018_12_31)));

        List<Row> time = new EventTransform(spark, UTC).time(plays).collectAsList();

        assertThat(time).extracting(row -> row.<String>getAs("start_time"))
                .containsExactlyInAnyOrder("2018-11-12T02:37:38.796", "2018-12-31T23:59:59.999");
    }

    @Test
    void yearEndKeepsCalendarYearWithIsoWeek() {
        Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                play("7", "free", "X", 180.0, TS_2018_12_31)));

        Row row = new EventTransform(spark, UTC).time(plays).first();

        assertThat(row.<Integer>getAs("year")).isEqualTo(2018);
        assertThat(row.<Integer>getAs("week")).isEqualTo(1);
    }

    @Test
    @DisplayName("Writes users unpartitioned and time partitioned by year and month")
    void writeDimensions() throws IOException {
        Path input = tempDir.resolve("in");
        writeLogData(input, "events.json",
                eventJson("NextSong", "7", "free", "X", 180.0, TS_2018_11_12),
                eventJson("Home", "8", "free", null, null, TS_2018_11_04),
                eventJson("NextSong", "9", "paid", "Y", 200.0, TS_2018_12_31));
        Path output = tempDir.resolve("out");

        EventTransform transform = new EventTransform(spark, UTC);
        Dataset<Row> events = transform.load(input.resolve("log_data/*/*/*.json").toString());
        List<TableMetrics> written = transform.writeDimensions(EventTransform.plays(events), output.toString());

        assertThat(written).extracting(TableMetrics::table).containsExactly(LakeTable.USERS, LakeTable.TIME);
        assertThat(written.get(0).getRows()).isEqualTo(2);
        assertThat(written.get(1).getRows()).isEqualTo(2);
        assertThat(output.resolve("time.parquet/year=2018/month=11")).isDirectory();
        assertThat(output.resolve("time.parquet/year=2018/month=12")).isDirectory();
        assertThat(output.resolve("users.parquet/_SUCCESS")).exists();
    }

    @Test
    void wronglyTypedTimestampIsASchemaViolation() throws IOException {
        Path input = tempDir.resolve("in");
        writeLogData(input, "events.json",
                "{\"page\": \"NextSong\", \"userId\": \"7\", \"ts\": \"yesterday\"}");

        EventTransform transform = new EventTransform(spark, UTC);

        assertThatThrownBy(() -> transform.load(input.resolve("log_data/*/*/*.json").toString()))
                .isInstanceOf(SchemaViolationException.class)
                .hasMessageContaining("log_data");
    }
}
