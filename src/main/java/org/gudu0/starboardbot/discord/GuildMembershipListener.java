package org.gudu0.starboardbot.discord;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.guild.GuildJoinEvent;
import net.dv8tion.jda.api.events.guild.GuildLeaveEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.starboardbot.SafetyChecks;
import org.gudu0.starboardbot.guild.GuildManager;
import org.gudu0.starboardbot.store.StarboardStore;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.util.function.BiConsumer;

/**
 * Joining a guild: create its row, check permissions, register commands.
 * Leaving a guild: optionally purge everything stored for it.
 */
public class GuildMembershipListener extends ListenerAdapter {

    private final GuildManager guilds;
    private final StarboardStore store;
    private final SafetyChecks safety;
    private final boolean purgeOnLeave;

    /** Registers slash commands for exactly one guild. */
    private final BiConsumer<JDA, Guild> registerCommandsForGuild;

    public GuildMembershipListener(GuildManager guilds,
                                   StarboardStore store,
                                   SafetyChecks safety,
                                   boolean purgeOnLeave,
                                   BiConsumer<JDA, Guild> registerCommandsForGuild) {
        this.guilds = guilds;
        this.store = store;
        this.safety = safety;
        this.purgeOnLeave = purgeOnLeave;
        this.registerCommandsForGuild = registerCommandsForGuild;
    }

    @Override
    public void onGuildJoin(GuildJoinEvent event) {
        Guild g = event.getGuild();
        long guildId = g.getIdLong();

        ConsoleLog.warn("GuildJoin", "Joined new guild: " + g.getName() + " (" + guildId + ")");

        store.createGuild(guildId);
        guilds.get(guildId);
        safety.runForGuild(event.getJDA(), guildId);
        registerCommandsForGuild.accept(event.getJDA(), g);

        ConsoleLog.info("GuildJoin", "Handled join for guildId=" + guildId);
    }

    @Override
    public void onGuildLeave(GuildLeaveEvent event) {
        long guildId = event.getGuild().getIdLong();
        ConsoleLog.warn("GuildLeave", "Left guild: " + event.getGuild().getName() + " (" + guildId + ")");

        guilds.evict(guildId);
        if (purgeOnLeave) {
            store.deleteGuild(guildId);
            ConsoleLog.warn("GuildLeave", "Purged starboard data for guildId=" + guildId);
        }
    }
}
