package org.gudu0.starboardbot.guild;

import org.gudu0.starboardbot.config.GuildConfig;
import org.gudu0.starboardbot.config.TypedConfigStore;
import org.gudu0.starboardbot.util.BotPaths;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Per-guild settings that are not part of the starboard store (currently the log channel).
 */
public final class GuildContext {

    public final long guildId;

    public final TypedConfigStore<GuildConfig> configStore;
    public final GuildConfig cfg;

    public GuildContext(long guildId, Path dir) {
        this.guildId = guildId;

        this.configStore = new TypedConfigStore<>(dir.resolve("config.json"), GuildConfig.class, GuildConfig::new);
        this.cfg = configStore.cfg();

        ConsoleLog.info(
                "GuildContext",
                "Loaded guild cfg guildId=" + guildId
                        + " enableLogs=" + cfg.enableLogs
                        + " logChannelId=" + cfg.logChannelId
        );
    }

    public GuildContext(long guildId) {
        this(guildId, BotPaths.guildDir(guildId));
    }

    /** Log channel id, or 0 when logging is off or not configured. */
    public long logChannelIdOrZero() {
        if (!cfg.enableLogs) return 0;
        if (cfg.logChannelId == null || cfg.logChannelId.isBlank()) return 0;
        try {
            return Long.parseLong(cfg.logChannelId);
        } catch (NumberFormatException e) {
            ConsoleLog.warn("GuildContext", "guildId=" + guildId + " invalid logChannelId=" + cfg.logChannelId);
            return 0;
        }
    }

    public synchronized void save(String action) throws IOException {
        configStore.save();
        ConsoleLog.info("GuildContext", "Saved guild config: guildId=" + guildId + " action=" + action);
    }
}
