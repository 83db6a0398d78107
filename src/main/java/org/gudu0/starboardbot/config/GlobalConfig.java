package org.gudu0.starboardbot.config;

/**
 * Global bot config (one per bot process).
 * Stored at: data/global/config.json
 */
public class GlobalConfig {
    /** Wall-clock bound for a single starboard regex match. */
    public long regexTimeoutMillis = 250;

    /** Threads processing starboard events. Reconciles of one (message, starboard) pair never overlap. */
    public int workerThreads = 1;

    /** Messages kept per guild in the short-term message cache. */
    public int cacheSizePerGuild = 500;

    /** How long a cached message is trusted before it is fetched again. */
    public long cacheTtlSeconds = 300;

    /** Drop every starboard row of a guild when the bot is removed from it. */
    public boolean purgeOnGuildLeave = false;

    /** How often data/global/starboard.json is written when dirty. */
    public long flushPeriodSeconds = 10;
}
