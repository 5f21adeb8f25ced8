package com.sparkify.datalake;

import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Loads Sparkify song metadata and activity logs into a star schema:
 * songs, artists, users and time dimensions plus the songplays fact table.
 */
public class SparkifyEtlPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(SparkifyEtlPipeline.class);

    private final SongDataProcessor songDataProcessor;
    private final LogDataProcessor logDataProcessor;

    public SparkifyEtlPipeline(SparkSession spark) {
        this.songDataProcessor = new SongDataProcessor(spark);
        this.logDataProcessor = new LogDataProcessor(spark);
    }

    /**
     * Run both stages in order. Every output table under {@code outputRoot} is overwritten.
     */
    public void execute(String inputRoot, String outputRoot) {
        LOG.info("Starting Sparkify ETL: {} -> {}", inputRoot, outputRoot);
        long start = System.nanoTime();

        // Step 1: song catalogue
        LOG.info("Step 1: processing song data");
        songDataProcessor.process(inputRoot, outputRoot);

        // Step 2: activity logs, joined against the songs written in step 1
        LOG.info("Step 2: processing log data");
        logDataProcessor.process(inputRoot, outputRoot);

        LOG.info("Sparkify ETL completed in {} ms", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
}
