package org.gudu0.starboardbot.guild;

import org.gudu0.starboardbot.util.BotPaths;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongFunction;

/**
 * Caches and serves {@link GuildContext} objects, loading each guild's config on first use.
 */
public final class GuildManager {

    private final ConcurrentHashMap<Long, GuildContext> contexts = new ConcurrentHashMap<>();
    private final LongFunction<Path> dirForGuild;

    public GuildManager() {
        this(BotPaths::guildDir);
    }

    public GuildManager(LongFunction<Path> dirForGuild) {
        this.dirForGuild = dirForGuild;
    }

    public GuildContext get(long guildId) {
        GuildContext existing = contexts.get(guildId);
        if (existing != null) {
            ConsoleLog.debug("GuildManager", "Cache hit guildId=" + guildId);
            return existing;
        }

        ConsoleLog.info("GuildManager", "Cache miss guildId=" + guildId + " (creating context)");
        GuildContext created = new GuildContext(guildId, dirForGuild.apply(guildId));

        GuildContext raced = contexts.putIfAbsent(guildId, created);
        if (raced != null) {
            ConsoleLog.warn("GuildManager", "Race: another thread created context first guildId=" + guildId);
            return raced;
        }
        return created;
    }

    /** Forgets the cached context (the config file on disk stays). */
    public void evict(long guildId) {
        if (contexts.remove(guildId) != null) {
            ConsoleLog.info("GuildManager", "Evicted guildId=" + guildId);
        }
    }

    public int cachedCount() {
        return contexts.size();
    }
}
