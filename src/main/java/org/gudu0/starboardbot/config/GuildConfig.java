package org.gudu0.starboardbot.config;

/**
 * Per-guild config.
 * <p>
 * Stored at: data/guilds/<guildId>/config.json
 * Starboards themselves live in the starboard store, not here.
 */
public class GuildConfig {
    /** Channel (or thread) that receives operator notices for this guild. */
    public String logChannelId = "";

    /** Whether notices are posted to {@link #logChannelId} at all. */
    public boolean enableLogs = false;
}
