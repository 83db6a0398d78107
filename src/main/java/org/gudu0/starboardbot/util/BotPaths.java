package org.gudu0.starboardbot.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * On-disk layout:
 * <pre>
 * data/global/config.json       process-wide settings
 * data/global/starboard.json    every guild's starboards, messages, links, reactions, members
 * data/guilds/&lt;guildId&gt;/config.json   per-guild log settings
 * </pre>
 * The root can be moved with STARBOARD_DATA_DIR.
 */
public final class BotPaths {
    private BotPaths() {}

    public static final Path DATA = dataRoot();

    public static final Path GLOBAL_DIR = DATA.resolve("global");
    public static final Path GUILDS_DIR = DATA.resolve("guilds");

    public static final Path GLOBAL_CONFIG = GLOBAL_DIR.resolve("config.json");
    public static final Path STARBOARD_DB = GLOBAL_DIR.resolve("starboard.json");

    public static Path guildDir(long guildId) {
        return GUILDS_DIR.resolve(Long.toString(guildId));
    }

    public static void ensureBaseDirs() {
        for (Path dir : new Path[]{GLOBAL_DIR, GUILDS_DIR}) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                ConsoleLog.error("BotPaths", "Failed to create " + dir.toAbsolutePath() + ": " + e.getMessage(), e);
            }
        }
        ConsoleLog.info("BotPaths", "Data root: " + DATA.toAbsolutePath());
    }

    private static Path dataRoot() {
        String override = System.getenv("STARBOARD_DATA_DIR");
        return (override == null || override.isBlank()) ? Path.of("data") : Path.of(override);
    }
}
