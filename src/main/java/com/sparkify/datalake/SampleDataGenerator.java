package com.sparkify.datalake;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Writes a local input tree shaped like the Sparkify bucket:
 * {@code song_data/A/B/C/*.json} and {@code log_data/2018/11/*.json}.
 *
 * The catalogue contains repeated song and artist records, and the logs contain events for
 * unknown songs and non-play pages, so the output exercises deduplication and the inner join.
 */
public class SampleDataGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(SampleDataGenerator.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final int SONGS_PER_FILE = 50;
    private static final long FIRST_EVENT_MILLIS = 1541030400000L; // 2018-11-01T00:00:00Z

    private static final String[] ARTISTS = {
        "Des'ree", "Muse", "Radiohead", "The Killers", "Florence + The Machine",
        "Kings Of Leon", "Coldplay", "Arctic Monkeys", "Daft Punk", "Björk"
    };

    private static final String[] LOCATIONS = {
        "Houston-The Woodlands-Sugar Land, TX", "San Francisco-Oakland-Hayward, CA",
        "Chicago-Naperville-Elgin, IL-IN-WI", "New York-Newark-Jersey City, NY-NJ-PA",
        "Atlanta-Sandy Springs-Roswell, GA"
    };

    private static final String[] FIRST_NAMES = {"Kaylee", "Lily", "Jacob", "Chloe", "Ryan", "Aleena", "Tegan"};
    private static final String[] LAST_NAMES = {"Summers", "Koch", "Klein", "Cuevas", "Smith", "Kirby", "Levine"};

    private static final String USER_AGENT =
        "\"Mozilla/5.0 (Macintosh; Intel Mac OS X 10_9_4) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/36.0.1985.143 Safari/537.36\"";

    public static void main(String[] args) throws IOException {
        int numSongs = args.length > 0 ? Integer.parseInt(args[0]) : 1_000;
        int numEvents = args.length > 1 ? Integer.parseInt(args[1]) : 10_000;
        Path root = Paths.get(args.length > 2 ? args[2] : "data/");

        generate(root, numSongs, numEvents, 42L);
        LOG.info("Sample data generated under {}", root.toAbsolutePath());
    }

    /**
     * Generate {@code numSongs} catalogue entries and {@code numEvents} log events under {@code root}.
     * The same seed always produces the same files.
     */
    public static void generate(Path root, int numSongs, int numEvents, long seed) throws IOException {
        Random random = new Random(seed);
        List<Map<String, Object>> songs = generateSongs(numSongs, random);
        writeSongData(root, songs);
        writeLogData(root, songs, numEvents, random);
    }

    private static List<Map<String, Object>> generateSongs(int numSongs, Random random) {
        List<Map<String, Object>> songs = new ArrayList<>(numSongs);
        for (int i = 0; i < numSongs; i++) {
            // ~5% repeats of an earlier catalogue entry
            if (i > 10 && random.nextDouble() < 0.05) {
                songs.add(songs.get(random.nextInt(i)));
                continue;
            }

            int artistIndex = random.nextInt(ARTISTS.length);
            Map<String, Object> song = new LinkedHashMap<>();
            song.put("num_songs", 1);
            song.put("artist_id", String.format("AR%016d", artistIndex));
            song.put("artist_latitude", random.nextBoolean() ? 29.76 + artistIndex : null);
            song.put("artist_longitude", random.nextBoolean() ? -95.36 - artistIndex : null);
            song.put("artist_location", LOCATIONS[artistIndex % LOCATIONS.length]);
            song.put("artist_name", ARTISTS[artistIndex]);
            song.put("song_id", String.format("SO%016d", i));
            song.put("title", "Song " + i);
            song.put("duration", 120.0 + random.nextInt(24_000) / 100.0);
            song.put("year", random.nextDouble() < 0.2 ? 0 : 1970 + random.nextInt(50));
            songs.add(song);
        }
        return songs;
    }

    private static void writeSongData(Path root, List<Map<String, Object>> songs) throws IOException {
        for (int start = 0; start < songs.size(); start += SONGS_PER_FILE) {
            int fileIndex = start / SONGS_PER_FILE;
            Path dir = root.resolve("song_data")
                .resolve("A")
                .resolve(String.valueOf((char) ('A' + fileIndex % 26)))
                .resolve(String.valueOf((char) ('A' + (fileIndex / 26) % 26)));
            Files.createDirectories(dir);

            Path file = dir.resolve(String.format("TRAAA%05d.json", fileIndex));
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                for (Map<String, Object> song : songs.subList(start, Math.min(start + SONGS_PER_FILE, songs.size()))) {
                    writer.write(MAPPER.writeValueAsString(song));
                    writer.newLine();
                }
            }
        }
    }

    private static void writeLogData(Path root, List<Map<String, Object>> songs, int numEvents, Random random)
            throws IOException {
        Path dir = root.resolve("log_data").resolve("2018").resolve("11");
        Files.createDirectories(dir);

        long ts = FIRST_EVENT_MILLIS;
        BufferedWriter writer = null;
        int currentDay = -1;
        Set<Integer> openedDays = new HashSet<>();
        try {
            for (int i = 0; i < numEvents; i++) {
                ts += 1 + random.nextInt(60_000);
                ZonedDateTime time = Instant.ofEpochMilli(ts).atZone(ZoneOffset.UTC);
                if (time.getMonthValue() != 11) {
                    // Keep everything inside the 2018/11 directory
                    ts = FIRST_EVENT_MILLIS + random.nextInt(1_000_000);
                    time = Instant.ofEpochMilli(ts).atZone(ZoneOffset.UTC);
                }
                if (time.getDayOfMonth() != currentDay) {
                    if (writer != null) {
                        writer.close();
                    }
                    currentDay = time.getDayOfMonth();
                    Path file = dir.resolve(String.format("2018-11-%02d-events.json", currentDay));
                    // Truncate on first use in this run, append when a later event returns to the day
                    StandardOpenOption mode = openedDays.add(currentDay)
                        ? StandardOpenOption.TRUNCATE_EXISTING
                        : StandardOpenOption.APPEND;
                    writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode);
                }
                writer.write(MAPPER.writeValueAsString(generateEvent(i, ts, songs, random)));
                writer.newLine();
            }
        } finally {
            if (writer != null) {
                writer.close();
            }
        }
    }

    private static Map<String, Object> generateEvent(int index, long ts, List<Map<String, Object>> songs,
                                                     Random random) {
        int userIndex = random.nextInt(FIRST_NAMES.length * 4);
        double roll = random.nextDouble();

        String artist = null;
        String song = null;
        Double length = null;
        String page = "NextSong";
        if (roll < 0.1) {
            page = "Home";
        } else if (roll < 0.2) {
            artist = ARTISTS[random.nextInt(ARTISTS.length)];
            song = "Unreleased Track " + index;
            length = 200.0;
        } else {
            Map<String, Object> played = songs.get(random.nextInt(songs.size()));
            artist = (String) played.get("artist_name");
            song = (String) played.get("title");
            length = (Double) played.get("duration");
        }

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("artist", artist);
        event.put("auth", "Logged In");
        event.put("firstName", FIRST_NAMES[userIndex % FIRST_NAMES.length]);
        event.put("gender", userIndex % 2 == 0 ? "F" : "M");
        event.put("itemInSession", index % 50);
        event.put("lastName", LAST_NAMES[userIndex % LAST_NAMES.length]);
        event.put("length", length);
        event.put("level", random.nextDouble() < 0.3 ? "paid" : "free");
        event.put("location", LOCATIONS[userIndex % LOCATIONS.length]);
        event.put("method", "PUT");
        event.put("page", page);
        event.put("registration", 1540344794796L);
        event.put("sessionId", 100 + userIndex * 7 + index / 200);
        event.put("song", song);
        event.put("status", 200);
        event.put("ts", ts);
        event.put("userAgent", USER_AGENT);
        event.put("userId", String.valueOf(userIndex + 1));
        return event;
    }
}
