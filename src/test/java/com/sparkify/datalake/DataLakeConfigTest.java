package com.sparkify.datalake;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DataLakeConfig
 */
public class DataLakeConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    public void tearDown() {
        System.clearProperty(DataLakeConfig.ACCESS_KEY_PROPERTY);
        System.clearProperty(DataLakeConfig.SECRET_KEY_PROPERTY);
    }

    private Path writeConfig(String content) throws Exception {
        Path file = tempDir.resolve("dl.cfg");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testLoad_ReadsCredentialsUnderSectionHeader() throws Exception {
        Path file = writeConfig("[AWS]\nAWS_ACCESS_KEY_ID=AKIAEXAMPLE\nAWS_SECRET_ACCESS_KEY=s3cr3t\n");

        DataLakeConfig config = DataLakeConfig.load(file);

        assertEquals("AKIAEXAMPLE", config.getAccessKeyId());
        assertEquals("s3cr3t", config.getSecretAccessKey());
    }

    @Test
    public void testLoad_StripsQuotesAndWhitespace() throws Exception {
        Path file = writeConfig("# credentials\nAWS_ACCESS_KEY_ID = 'AKIAEXAMPLE'  \nAWS_SECRET_ACCESS_KEY=\"s3cr3t\"\n");

        DataLakeConfig config = DataLakeConfig.load(file);

        assertEquals("AKIAEXAMPLE", config.getAccessKeyId());
        assertEquals("s3cr3t", config.getSecretAccessKey());
    }

    @Test
    public void testLoad_MissingSecretKeyFails() throws Exception {
        Path file = writeConfig("AWS_ACCESS_KEY_ID=AKIAEXAMPLE\n");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> DataLakeConfig.load(file));
        assertTrue(e.getMessage().contains(DataLakeConfig.SECRET_ACCESS_KEY));
    }

    @Test
    public void testLoad_BlankAccessKeyFails() throws Exception {
        Path file = writeConfig("AWS_ACCESS_KEY_ID=\nAWS_SECRET_ACCESS_KEY=s3cr3t\n");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> DataLakeConfig.load(file));
        assertTrue(e.getMessage().contains(DataLakeConfig.ACCESS_KEY_ID));
    }

    @Test
    public void testLoad_MissingFileFails() {
        Path missing = tempDir.resolve("absent.cfg");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> DataLakeConfig.load(missing));
        assertTrue(e.getMessage().contains("absent.cfg"));
    }

    @Test
    public void testExportToSystemProperties() {
        new DataLakeConfig("AKIAEXAMPLE", "s3cr3t").exportToSystemProperties();

        assertEquals("AKIAEXAMPLE", System.getProperty(DataLakeConfig.ACCESS_KEY_PROPERTY));
        assertEquals("s3cr3t", System.getProperty(DataLakeConfig.SECRET_KEY_PROPERTY));
    }

    @Test
    public void testToString_HidesSecret() {
        String rendered = new DataLakeConfig("AKIAEXAMPLE", "s3cr3t").toString();

        assertTrue(rendered.contains("AKIAEXAMPLE"));
        assertFalse(rendered.contains("s3cr3t"));
    }
}
