package com.sparkify.datalake;

/**
 * Input globs and output table locations under a storage root.
 */
public final class DataLakePaths {

    public static final String SONG_DATA_GLOB = "song_data/*/*/*/*.json";
    public static final String LOG_DATA_GLOB = "log_data/*/*/*.json";

    public static final String SONGS_TABLE = "songs_table/";
    public static final String ARTISTS_TABLE = "artists_table/";
    public static final String USERS_TABLE = "users_table/";
    public static final String TIME_TABLE = "time_table/";
    public static final String SONGPLAYS_TABLE = "songplays_table/";

    private DataLakePaths() {
    }

    public static String songData(String inputRoot) {
        return resolve(inputRoot, SONG_DATA_GLOB);
    }

    public static String logData(String inputRoot) {
        return resolve(inputRoot, LOG_DATA_GLOB);
    }

    /**
     * Join a root ("s3a://bucket/prefix" or a local directory) with a relative location.
     */
    public static String resolve(String root, String relative) {
        if (root == null || root.isEmpty()) {
            throw new IllegalArgumentException("Storage root must not be empty");
        }
        return root.endsWith("/") ? root + relative : root + "/" + relative;
    }
}
