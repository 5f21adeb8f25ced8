package com.sparkify.datalake;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Credentials for the object store, read once from a key/value file.
 *
 * The file is the classic {@code dl.cfg}:
 * <pre>
 * [AWS]
 * AWS_ACCESS_KEY_ID=...
 * AWS_SECRET_ACCESS_KEY=...
 * </pre>
 * Section headers and comments are tolerated, values may be quoted.
 */
public class DataLakeConfig {

    private static final Logger LOG = LoggerFactory.getLogger(DataLakeConfig.class);

    public static final String DEFAULT_CONFIG_FILE = "dl.cfg";
    public static final String ACCESS_KEY_ID = "AWS_ACCESS_KEY_ID";
    public static final String SECRET_ACCESS_KEY = "AWS_SECRET_ACCESS_KEY";

    // Read by the AWS SDK's system-property credentials provider
    static final String ACCESS_KEY_PROPERTY = "aws.accessKeyId";
    static final String SECRET_KEY_PROPERTY = "aws.secretKey";

    private final String accessKeyId;
    private final String secretAccessKey;

    public DataLakeConfig(String accessKeyId, String secretAccessKey) {
        this.accessKeyId = require(ACCESS_KEY_ID, accessKeyId);
        this.secretAccessKey = require(SECRET_ACCESS_KEY, secretAccessKey);
    }

    /**
     * Load {@code dl.cfg} from the working directory.
     */
    public static DataLakeConfig load() {
        return load(Paths.get(DEFAULT_CONFIG_FILE));
    }

    public static DataLakeConfig load(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            throw new IllegalStateException("Configuration file not found: " + configFile.toAbsolutePath());
        }

        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read configuration file " + configFile, e);
        }

        LOG.info("Loaded data lake configuration from {}", configFile);
        return new DataLakeConfig(
            unquote(properties.getProperty(ACCESS_KEY_ID)),
            unquote(properties.getProperty(SECRET_ACCESS_KEY))
        );
    }

    /**
     * Publish the credentials as JVM-wide system properties for the lifetime of the run.
     */
    public void exportToSystemProperties() {
        System.setProperty(ACCESS_KEY_PROPERTY, accessKeyId);
        System.setProperty(SECRET_KEY_PROPERTY, secretAccessKey);
    }

    public String getAccessKeyId() {
        return accessKeyId;
    }

    public String getSecretAccessKey() {
        return secretAccessKey;
    }

    @Override
    public String toString() {
        return "DataLakeConfig{accessKeyId='" + accessKeyId + "', secretAccessKey='****'}";
    }

    private static String require(String key, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalStateException("Missing required configuration value: " + key);
        }
        return value.trim();
    }

    private static String unquote(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '\'' || first == '"') && first == last) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }
}
