package com.sparkify.datalake;

import org.apache.spark.SparkConf;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SparkSessionFactory. Only the configuration is checked; building a session with the
 * connector package would download it.
 */
public class SparkSessionFactoryTest {

    private final DataLakeConfig config = new DataLakeConfig("AKIAEXAMPLE", "s3cr3t");

    @Test
    public void testSparkConf_ConfiguresS3Connector() {
        SparkConf conf = SparkSessionFactory.sparkConf(config);

        assertEquals(SparkSessionFactory.S3_CONNECTOR_PACKAGE, conf.get("spark.jars.packages"));
        assertEquals("org.apache.hadoop.fs.s3a.S3AFileSystem", conf.get("spark.hadoop.fs.s3a.impl"));
        assertEquals("AKIAEXAMPLE", conf.get("spark.hadoop.fs.s3a.access.key"));
        assertEquals("s3cr3t", conf.get("spark.hadoop.fs.s3a.secret.key"));
    }

    @Test
    public void testSparkConf_PinsUtcAndEnablesAdaptiveExecution() {
        SparkConf conf = SparkSessionFactory.sparkConf(config);

        assertEquals(SparkSessionFactory.APP_NAME, conf.get("spark.app.name"));
        assertEquals("UTC", conf.get("spark.sql.session.timeZone"));
        assertEquals("true", conf.get("spark.sql.adaptive.enabled"));
    }

    @Test
    public void testSparkConf_MasterDefaultsToLocal() {
        String previous = System.getProperty("spark.master");
        System.clearProperty("spark.master");
        try {
            assertEquals(SparkSessionFactory.DEFAULT_MASTER, SparkSessionFactory.sparkConf(config).get("spark.master"));
        } finally {
            if (previous != null) {
                System.setProperty("spark.master", previous);
            }
        }
    }
}
