package com.sparkify.datalake;

import org.apache.spark.sql.Column;
import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SaveMode;
import org.apache.spark.sql.SparkSession;
import org.apache.spark.sql.expressions.UserDefinedFunction;
import org.apache.spark.sql.types.DataTypes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

import static org.apache.spark.sql.functions.*;

/**
 * Activity-log stage: builds the {@code users} and {@code time} dimensions and the
 * {@code songplays} fact table from user activity logs.
 */
public class LogDataProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(LogDataProcessor.class);

    static final String DATETIME_PATTERN = "yyyy-MM-dd HH:mm:ss.SSS";

    static final String LOG_VIEW = "log_events";
    static final String SONGS_VIEW = "songs";
    static final String SONG_NAMES_VIEW = "song_names";

    // Exact string equality on title and artist name; unmatched events are dropped by the inner join.
    // Names come from every song record, so each spelling filed under one artist_id can match.
    static final String SONGPLAYS_QUERY =
        "SELECT timestamp_millis(l.ts) AS start_time"
            + ", month(timestamp_millis(l.ts)) AS month"
            + ", year(timestamp_millis(l.ts)) AS year"
            + ", l.userId AS user_id"
            + ", l.level AS level"
            + ", s.song_id AS song_id"
            + ", s.artist_id AS artist_id"
            + ", l.sessionId AS session_id"
            + ", l.location AS location"
            + ", l.userAgent AS user_agent"
            + " FROM " + LOG_VIEW + " l"
            + " JOIN " + SONG_NAMES_VIEW + " n ON l.song = n.title AND l.artist = n.artist_name"
            + " JOIN " + SONGS_VIEW + " s ON n.song_id = s.song_id";

    private final SparkSession spark;

    public LogDataProcessor(SparkSession spark) {
        this.spark = spark;
    }

    /**
     * Read log data and write the users, time and songplays tables. The songplays join reads the
     * songs table back from {@code outputRoot}, so the song stage must have run first.
     */
    public void process(String inputRoot, String outputRoot) {
        String logDataPath = DataLakePaths.logData(inputRoot);
        LOG.info("Reading log data from {}", logDataPath);
        Dataset<Row> logData = readLogData(logDataPath);
        try {
            Dataset<Row> users = usersTable(logData);
            String usersPath = DataLakePaths.resolve(outputRoot, DataLakePaths.USERS_TABLE);
            users.write()
                .mode(SaveMode.Overwrite)
                .parquet(usersPath);
            LOG.info("Wrote {} rows to users table at {}", users.count(), usersPath);

            Dataset<Row> events = withTimestampColumns(logData);

            Dataset<Row> time = timeTable(events);
            String timePath = DataLakePaths.resolve(outputRoot, DataLakePaths.TIME_TABLE);
            time.write()
                .mode(SaveMode.Overwrite)
                .partitionBy("year", "month")
                .parquet(timePath);
            LOG.info("Wrote {} rows to time table at {}", time.count(), timePath);

            Dataset<Row> songs = spark.read().parquet(DataLakePaths.resolve(outputRoot, DataLakePaths.SONGS_TABLE));
            Dataset<Row> songNames = songNames(spark.read()
                .option("mode", "FAILFAST")
                .json(DataLakePaths.songData(inputRoot)));

            Dataset<Row> songplays = songplaysTable(logData, songs, songNames);
            String songplaysPath = DataLakePaths.resolve(outputRoot, DataLakePaths.SONGPLAYS_TABLE);
            songplays.write()
                .mode(SaveMode.Overwrite)
                .partitionBy("year", "month")
                .parquet(songplaysPath);
            LOG.info("Wrote {} rows to songplays table at {}", songplays.count(), songplaysPath);
        } finally {
            logData.unpersist();
        }
    }

    public Dataset<Row> readLogData(String path) {
        Dataset<Row> df = spark.read()
            .option("mode", "FAILFAST")
            .json(path);

        df.cache();
        return df;
    }

    public Dataset<Row> usersTable(Dataset<Row> logData) {
        return logData
            .select(
                col("userId"),
                col("firstName"),
                col("lastName"),
                col("gender"),
                col("level")
            )
            .dropDuplicates("userId");
    }

    /**
     * Add {@code timestamp} (whole seconds since epoch) and {@code datetime} (readable string in the
     * session time zone) derived from the epoch-millisecond {@code ts} column.
     */
    public Dataset<Row> withTimestampColumns(Dataset<Row> logData) {
        String sessionZone = spark.conf().get("spark.sql.session.timeZone");

        UserDefinedFunction toEpochSeconds = udf(
            (Long ts) -> {
                if (ts == null) {
                    return null;
                }
                return ts / 1000;
            },
            DataTypes.LongType
        );

        UserDefinedFunction toDatetime = udf(
            (Long ts) -> {
                if (ts == null) {
                    return null;
                }
                return DateTimeFormatter.ofPattern(DATETIME_PATTERN)
                    .withZone(ZoneId.of(sessionZone))
                    .format(Instant.ofEpochMilli(ts));
            },
            DataTypes.StringType
        );

        Column tsMillis = col("ts").cast(DataTypes.LongType);
        return logData
            .withColumn("timestamp", toEpochSeconds.apply(tsMillis))
            .withColumn("datetime", toDatetime.apply(tsMillis));
    }

    public Dataset<Row> timeTable(Dataset<Row> events) {
        return events
            .select(
                col("datetime").cast(DataTypes.TimestampType).alias("start_time"),
                hour(col("datetime")).alias("hour"),
                dayofmonth(col("datetime")).alias("day"),
                weekofyear(col("datetime")).alias("week"),
                month(col("datetime")).alias("month"),
                year(col("datetime")).alias("year"),
                dayofweek(col("datetime")).alias("weekday")
            )
            .filter(col("start_time").isNotNull())
            .dropDuplicates("start_time");
    }

    /**
     * Every (song_id, title, artist_name) spelling found in the raw song records, before the songs
     * and artists dimensions collapse them to one row per key.
     */
    public Dataset<Row> songNames(Dataset<Row> songData) {
        return songData
            .select(
                col("song_id"),
                col("title"),
                col("artist_name")
            )
            .distinct();
    }

    /**
     * Join log events to the song catalogue on exact (artist name, song title) and project the fact table.
     *
     * @param songs     songs dimension: song_id, title, artist_id
     * @param songNames name lookup from {@link #songNames}
     */
    public Dataset<Row> songplaysTable(Dataset<Row> logData, Dataset<Row> songs, Dataset<Row> songNames) {
        logData.createOrReplaceTempView(LOG_VIEW);
        songs.createOrReplaceTempView(SONGS_VIEW);
        songNames.createOrReplaceTempView(SONG_NAMES_VIEW);

        return spark.sql(SONGPLAYS_QUERY)
            .select(
                col("start_time"),
                col("user_id"),
                col("level"),
                col("song_id"),
                col("artist_id"),
                col("session_id"),
                col("location"),
                col("user_agent"),
                col("year"),
                col("month")
            );
    }
}
