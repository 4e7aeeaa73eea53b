package io.github.sparkify.spark;

import io.github.sparkify.time.TimeParts;
import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.RowFactory;
import org.apache.spark.sql.expressions.UserDefinedFunction;
import org.apache.spark.sql.types.DataTypes;
import org.apache.spark.sql.types.StructType;

import java.time.ZoneId;

import static org.apache.spark.sql.functions.col;
import static org.apache.spark.sql.functions.udf;

/**
 * SparkifyFunctions - Spark SQL functions shared by the event and songplays transforms.
 *
 * Usage:
 * <pre>
 * Dataset&lt;Row&gt; withTime = SparkifyFunctions.withTimeParts(plays, "ts", ZoneId.of("UTC"));
 * </pre>
 */
public class SparkifyFunctions {

    public static final String START_TIME = "start_time";
    public static final String HOUR = "hour";
    public static final String DAY = "day";
    public static final String WEEK = "week";
    public static final String MONTH = "month";
    public static final String YEAR = "year";
    public static final String WEEKDAY = "weekday";

    /** Time table columns, in table order. */
    public static final String[] TIME_COLUMNS = {START_TIME, HOUR, DAY, WEEK, MONTH, YEAR, WEEKDAY};

    public static final StructType TIME_PARTS_TYPE = new StructType()
            .add(START_TIME, DataTypes.StringType, true)
            .add(HOUR, DataTypes.IntegerType, true)
            .add(DAY, DataTypes.IntegerType, true)
            .add(WEEK, DataTypes.IntegerType, true)
            .add(MONTH, DataTypes.IntegerType, true)
            .add(YEAR, DataTypes.IntegerType, true)
            .add(WEEKDAY, DataTypes.IntegerType, true);

    private static final String TIME_STRUCT = "_time_parts";

    private SparkifyFunctions() {
    }

    /**
     * UDF from epoch milliseconds to a struct of {@link #TIME_PARTS_TYPE}, evaluated in the given zone.
     * A null timestamp gives a null struct.
     */
    public static UserDefinedFunction timeParts(ZoneId zone) {
        return udf(
                (Long ts) -> {
                    if (ts == null) {
                        return null;
                    }
                    TimeParts parts = TimeParts.of(ts, zone);
                    return RowFactory.create(
                            parts.getStartTime(),
                            parts.getHour(),
                            parts.getDay(),
                            parts.getWeek(),
                            parts.getMonth(),
                            parts.getYear(),
                            parts.getWeekday()
                    );
                },
                TIME_PARTS_TYPE
        ).withName("time_parts");
    }

    /**
     * Append start_time, hour, day, week, month, year and weekday derived from a millisecond timestamp column.
     */
    public static Dataset<Row> withTimeParts(Dataset<Row> df, String timestampColumn, ZoneId zone) {
        Dataset<Row> withStruct = df.withColumn(TIME_STRUCT, timeParts(zone).apply(col(timestampColumn)));
        for (String name : TIME_COLUMNS) {
            withStruct = withStruct.withColumn(name, timePart(name));
        }
        return withStruct.drop(TIME_STRUCT);
    }

    private static Column timePart(String name) {
        return col(TIME_STRUCT).getField(name);
    }
}
