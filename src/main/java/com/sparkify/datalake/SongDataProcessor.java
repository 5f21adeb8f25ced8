package com.sparkify.datalake;

import org.apache.spark.sql.Dataset;
import org.apache.spark.sql.Row;
import org.apache.spark.sql.SaveMode;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.apache.spark.sql.functions.col;

/**
 * Song-catalog stage: builds the {@code songs} and {@code artists} dimensions from song metadata JSON.
 */
public class SongDataProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(SongDataProcessor.class);

    private final SparkSession spark;

    public SongDataProcessor(SparkSession spark) {
        this.spark = spark;
    }

    /**
     * Read song data, then write the songs table (partitioned by year and artist) and the artists table.
     */
    public void process(String inputRoot, String outputRoot) {
        String songDataPath = DataLakePaths.songData(inputRoot);
        LOG.info("Reading song data from {}", songDataPath);
        Dataset<Row> songData = readSongData(songDataPath);
        try {
            Dataset<Row> songs = songsTable(songData);
            String songsPath = DataLakePaths.resolve(outputRoot, DataLakePaths.SONGS_TABLE);
            songs.write()
                .mode(SaveMode.Overwrite)
                .partitionBy("year", "artist_id")
                .parquet(songsPath);
            LOG.info("Wrote {} rows to songs table at {}", songs.count(), songsPath);

            Dataset<Row> artists = artistsTable(songData);
            String artistsPath = DataLakePaths.resolve(outputRoot, DataLakePaths.ARTISTS_TABLE);
            artists.write()
                .mode(SaveMode.Overwrite)
                .parquet(artistsPath);
            LOG.info("Wrote {} rows to artists table at {}", artists.count(), artistsPath);
        } finally {
            songData.unpersist();
        }
    }

    /**
     * Load every matching JSON file. Malformed input fails the read; nothing is skipped.
     */
    public Dataset<Row> readSongData(String path) {
        Dataset<Row> df = spark.read()
            .option("mode", "FAILFAST")
            .json(path);

        // Both dimensions are projected from the same scan
        df.cache();
        return df;
    }

    public Dataset<Row> songsTable(Dataset<Row> songData) {
        return songData
            .select(
                col("song_id"),
                col("title"),
                col("artist_id"),
                col("year"),
                col("duration")
            )
            .dropDuplicates("song_id");
    }

    public Dataset<Row> artistsTable(Dataset<Row> songData) {
        return songData
            .select(
                col("artist_id"),
                col("artist_name").alias("name"),
                col("artist_location").alias("location"),
                col("artist_latitude").alias("latitude"),
                col("artist_longitude").alias("longitude")
            )
            .dropDuplicates("artist_id");
    }
}
