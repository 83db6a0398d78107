package org.gudu0.starboardbot;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import org.gudu0.starboardbot.remote.GuildNotifier;
import org.gudu0.starboardbot.remote.Severity;
import org.gudu0.starboardbot.store.StarboardConfig;
import org.gudu0.starboardbot.store.StarboardStore;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Permission checks for every starboard channel of a guild. Problems are reported to the
 * guild log; nothing is disabled, since each failing action reports again when it happens.
 */
public final class SafetyChecks {

    private final StarboardStore store;
    private final GuildNotifier notifier;

    public SafetyChecks(StarboardStore store, GuildNotifier notifier) {
        this.store = store;
        this.notifier = notifier;
    }

    public void runForGuild(JDA jda, long guildId) {
        Guild guild = jda.getGuildById(guildId);
        if (guild == null) {
            ConsoleLog.warn("Safety", "guildId=" + guildId + " missing in JDA cache (bot not in guild?)");
            return;
        }

        for (StarboardConfig sb : store.getStarboards(guildId)) {
            check(jda, guild, sb);
        }
    }

    /** @return the permissions missing in the starboard's channel (empty if all good) */
    public Set<Permission> check(JDA jda, Guild guild, StarboardConfig sb) {
        GuildMessageChannel channel = jda.getChannelById(GuildMessageChannel.class, sb.id);
        if (channel == null) {
            notifier.notify(guild.getIdLong(), Severity.ERROR,
                    "The starboard channel `" + sb.id + "` no longer exists or I can't see it. "
                            + "Remove it with `/starboard remove`.");
            return EnumSet.of(Permission.VIEW_CHANNEL);
        }

        Member self = guild.getSelfMember();
        EnumSet<Permission> needed = EnumSet.of(
                Permission.VIEW_CHANNEL,
                Permission.MESSAGE_SEND,
                Permission.MESSAGE_EMBED_LINKS,
                Permission.MESSAGE_HISTORY
        );
        if (sb.autoreact) needed.add(Permission.MESSAGE_ADD_REACTION);

        EnumSet<Permission> missing = EnumSet.noneOf(Permission.class);
        for (Permission p : needed) {
            if (!self.hasPermission(channel, p)) missing.add(p);
        }

        if (missing.isEmpty()) {
            ConsoleLog.info("Safety", "Starboard OK: guildId=" + guild.getId() + " guild=" + guild.getName()
                    + " channel=#" + channel.getName());
            return missing;
        }

        String names = missing.stream().map(Permission::getName).collect(Collectors.joining(", "));
        notifier.notify(guild.getIdLong(), Severity.ERROR,
                "I'm missing permissions in " + channel.getAsMention() + ": **" + names + "**");
        return missing;
    }
}
