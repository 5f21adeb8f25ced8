package com.sparkify.datalake;

import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the Sparkify data lake ETL.
 *
 * Usage:
 *   spark-submit --class com.sparkify.datalake.Main sparkify-datalake-etl.jar
 *
 * Credentials are read from {@code dl.cfg} in the working directory.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    static final String INPUT_DATA = "s3a://udacity-dend/";
    static final String OUTPUT_DATA = "s3a://sparkify-datalake/output/";

    public static void main(String[] args) {
        DataLakeConfig config;
        try {
            config = DataLakeConfig.load();
        } catch (IllegalStateException e) {
            LOG.error("Cannot start ETL: {}", e.getMessage());
            System.exit(1);
            return;
        }

        SparkSession spark = SparkSessionFactory.createSparkSession(config);
        boolean succeeded = false;
        try {
            new SparkifyEtlPipeline(spark).execute(INPUT_DATA, OUTPUT_DATA);
            succeeded = true;
            LOG.info("ETL completed successfully");
        } catch (Exception e) {
            LOG.error("Error executing ETL", e);
        } finally {
            spark.stop();
        }

        if (!succeeded) {
            System.exit(1);
        }
    }
}
