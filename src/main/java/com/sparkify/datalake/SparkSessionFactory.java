package com.sparkify.datalake;

import org.apache.spark.SparkConf;
import org.apache.spark.sql.SparkSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the Spark session shared by both ETL stages, wired to S3 through the s3a connector.
 */
public final class SparkSessionFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SparkSessionFactory.class);

    public static final String APP_NAME = "SparkifyDataLakeEtl";
    public static final String S3_CONNECTOR_PACKAGE = "org.apache.hadoop:hadoop-aws:3.3.4";
    static final String DEFAULT_MASTER = "local[*]";

    private SparkSessionFactory() {
    }

    /**
     * Create (or reuse) the session. Fails if the connector package cannot be resolved.
     */
    public static SparkSession createSparkSession(DataLakeConfig config) {
        config.exportToSystemProperties();
        SparkConf conf = sparkConf(config);
        LOG.info("Initializing Spark session {} on {}", APP_NAME, conf.get("spark.master"));
        return SparkSession.builder()
            .config(conf)
            .getOrCreate();
    }

    static SparkConf sparkConf(DataLakeConfig config) {
        // KryoSerializer left off: needs extra --add-opens on JDK 17
        return new SparkConf()
            .setAppName(APP_NAME)
            .setMaster(System.getProperty("spark.master", DEFAULT_MASTER))
            .set("spark.jars.packages", S3_CONNECTOR_PACKAGE)
            .set("spark.hadoop.fs.s3a.impl", "org.apache.hadoop.fs.s3a.S3AFileSystem")
            .set("spark.hadoop.fs.s3a.access.key", config.getAccessKeyId())
            .set("spark.hadoop.fs.s3a.secret.key", config.getSecretAccessKey())
            .set("spark.sql.session.timeZone", "UTC")
            .set("spark.sql.adaptive.enabled", "true")
            .set("spark.sql.adaptive.coalescePartitions.enabled", "true");
    }
}
