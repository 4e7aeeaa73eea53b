package io.github.sparkify.spark;

import io.github.sparkify.SparkTestBase;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;

import static io.github.sparkify.LakeFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class SongplayJoinTest extends SparkTestBase {

    private static final ZoneId UTC = ZoneId.of("UTC");

    @TempDir
    Path tempDir;

    private SongplayJoin exactJoin() {
        return new SongplayJoin(spark, UTC, JoinPredicate.exact());
    }

    private Dataset<Row> catalog(Row... songs) {
        return CatalogTransform.songs(songRecords(spark, songs));
    }

    @Nested
    @DisplayName("Exact matching")
    class ExactMatching {

        @Test
        @DisplayName("A play matching no song produces no songplay")
        void missIsDropped() {
            Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                    play("7", "free", "Unknown Track", 999.9, TS_2018_11_12)));

            long rows = exactJoin().songplays(plays, catalog(song("A1", "X", 2000, 180.0))).count();

            assertThat(rows).isZero();
        }

        @Test
        @DisplayName("A play matching two songs produces two songplays")
        void fanOut() {
            Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                    play("7", "free", "Y", 200.0, TS_2018_11_12)));
            Dataset<Row> songs = catalog(
                    song("A1", "Y", 2000, 200.0),
                    song("A2", "Y", 2005, 200.0));

            List<Row> songplays = exactJoin().songplays(plays, songs).collectAsList();

            assertThat(songplays).hasSize(2);
            assertThat(songplays).extracting(row -> row.<String>getAs("artist_id"))
                    .containsExactlyInAnyOrder("A1", "A2");
            assertThat(songplays).extracting(row -> row.<Long>getAs("songplay_id")).containsOnly(
                    songplays.get(0).<Long>getAs("songplay_id"));
        }

        @Test
        @DisplayName("Same title with a different duration does not match")
        void durationMustAgree() {
            Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                    play("7", "free", "X", 180.01, TS_2018_11_12)));

            assertThat(exactJoin().songplays(plays, catalog(song("A1", "X", 2000, 180.0))).count()).isZero();
        }

        @Test
        @DisplayName("Songplays carry renamed log fields, the song's year and the play's month")
        void columnsAndValues() {
            Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                    play("7", "paid", "X", 180.0, TS_2018_11_12)));
            Dataset<Row> songs = catalog(song("A1", "X", 1995, 180.0));
            long songId = songs.first().<Long>getAs("song_id");

            Row row = exactJoin().songplays(plays, songs).first();

            assertThat(row.schema().fieldNames()).containsExactly(SongplayJoin.SONGPLAY_COLUMNS);
            assertThat(row.<String>getAs("start_time")).isEqualTo("2018-11-12T02:37:38.796");
            assertThat(row.<String>getAs("user_id")).isEqualTo("7");
            assertThat(row.<String>getAs("level")).isEqualTo("paid");
            assertThat(row.<Long>getAs("song_id")).isEqualTo(songId);
            assertThat(row.<String>getAs("artist_id")).isEqualTo("A1");
            assertThat(row.<Long>getAs("session_id")).isEqualTo(100L);
            assertThat(row.<String>getAs("location")).isEqualTo("Austin, TX");
            assertThat(row.<String>getAs("user_agent")).isEqualTo("Mozilla/5.0");
            assertThat(row.<Integer>getAs("year")).isEqualTo(1995);
            assertThat(row.<Integer>getAs("month")).isEqualTo(11);
        }

        @Test
        @DisplayName("Every songplay points at a song whose title and duration equal the play's")
        void everyRowIsSound() {
            Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                    play("1", "free", "X", 180.0, TS_2018_11_04),
                    play("2", "free", "Y", 200.0, TS_2018_11_12),
                    play("3", "paid", "Z", 1.0, TS_2018_12_31),
                    play("4", "paid", "X", 181.0, TS_2018_12_31)));
            Dataset<Row> songs = catalog(
                    song("A1", "X", 2000, 180.0),
                    song("A2", "Y", 2001, 200.0),
                    song("A3", "Z", 2002, 2.0));

            List<Row> songplays = exactJoin().songplays(plays, songs).collectAsList();
            List<Row> catalog = songs.collectAsList();

            assertThat(songplays).extracting(row -> row.<String>getAs("user_id"))
                    .containsExactlyInAnyOrder("1", "2");
            for (Row songplay : songplays) {
                Row song = catalog.stream()
                        .filter(s -> s.<Long>getAs("song_id").equals(songplay.<Long>getAs("song_id")))
                        .findFirst()
                        .orElseThrow();
                assertThat(song.<String>getAs("artist_id")).isEqualTo(songplay.<String>getAs("artist_id"));
            }
        }
    }

    @Test
    @DisplayName("Distinct plays get pairwise distinct songplay ids")
    void songplayIdsAreUnique() {
        Row[] events = new Row[300];
        for (int i = 0; i < events.length; i++) {
            events[i] = play(String.valueOf(i % 11), i % 2 == 0 ? "free" : "paid", "X", 180.0, TS_2018_11_04 + i * 1000L);
        }
        Dataset<Row> plays = EventTransform.plays(logEvents(spark, events).repartition(4));

        Dataset<Row> songplays = exactJoin().songplays(plays, catalog(song("A1", "X", 2000, 180.0)));

        assertThat(songplays.count()).isEqualTo(300);
        assertThat(songplays.select(SongplayJoin.SONGPLAY_ID).distinct().count()).isEqualTo(300);
    }

    @Test
    @DisplayName("Tolerant matching accepts durations within epsilon")
    void tolerantPredicate() {
        Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                play("7", "free", "X", 180.4, TS_2018_11_12),
                play("8", "free", "X", 181.0, TS_2018_11_12)));
        Dataset<Row> songs = catalog(song("A1", "X", 2000, 180.0));

        SongplayJoin tolerant = new SongplayJoin(spark, UTC, JoinPredicate.tolerant(0.5));

        assertThat(tolerant.songplays(plays, songs).collectAsList())
                .extracting(row -> row.<String>getAs("user_id"))
                .containsExactly("7");
        assertThat(exactJoin().songplays(plays, songs).count()).isZero();
    }

    @Test
    @DisplayName("An empty songplays table is written and committed")
    void emptyResultIsWritten() {
        Path output = tempDir.resolve("out");
        LakeTable.SONGS.persist(catalog(song("A1", "X", 2000, 180.0)), output.toString());
        Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                play("7", "free", "Unknown Track", 999.9, TS_2018_11_12)));

        TableMetrics written = exactJoin().run(plays, output.toString());

        assertThat(written.table()).isEqualTo(LakeTable.SONGPLAYS);
        assertThat(written.getRows()).isZero();
        assertThat(output.resolve("songplays.parquet/_SUCCESS")).exists();
    }

    @Test
    @DisplayName("Songs read back from storage keep their declared column types")
    void readsCommittedSongs() {
        Path output = tempDir.resolve("out");
        LakeTable.SONGS.persist(catalog(song("A1", "X", 2000, 180.0)), output.toString());
        Dataset<Row> plays = EventTransform.plays(logEvents(spark,
                play("7", "free", "X", 180.0, TS_2018_11_12)));

        TableMetrics written = exactJoin().run(plays, output.toString());

        assertThat(written.getRows()).isEqualTo(1);
        assertThat(output.resolve("songplays.parquet/year=2000/month=11")).isDirectory();
        Row song = exactJoin().readSongs(output.toString()).first();
        assertThat(song.<Integer>getAs("year")).isEqualTo(2000);
        assertThat(song.<String>getAs("artist_id")).isEqualTo("A1");
    }
}
