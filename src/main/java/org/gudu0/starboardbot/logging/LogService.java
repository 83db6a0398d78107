package org.gudu0.starboardbot.logging;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import org.gudu0.starboardbot.guild.GuildContext;
import org.gudu0.starboardbot.guild.GuildManager;
import org.gudu0.starboardbot.remote.GuildNotifier;
import org.gudu0.starboardbot.remote.Severity;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Operator notices. Always printed to the console; also posted to the guild's log channel
 * when that guild enabled logs and JDA is attached.
 */
public class LogService implements GuildNotifier {

    public static final int THEME_COLOR = 0xFFE19C;
    public static final int ERROR_COLOR = 0xFF6961;

    // Discord embed description limit
    private static final int MAX_DESCRIPTION = 4096;

    private final GuildManager guilds;
    private final AtomicBoolean ready = new AtomicBoolean(false);
    private volatile JDA jda;

    public LogService(GuildManager guilds) {
        this.guilds = guilds;
    }

    public void attach(JDA jda) {
        this.jda = jda;
        this.ready.set(true);
    }

    @Override
    public void notify(long guildId, Severity severity, String message) {
        if (severity == Severity.ERROR) {
            ConsoleLog.warn("GuildLog", "guildId=" + guildId + " " + message);
        } else {
            ConsoleLog.info("GuildLog", "guildId=" + guildId + " " + message);
        }

        try {
            post(guildId, severity, message);
        } catch (RuntimeException e) {
            ConsoleLog.error("GuildLog", "guildId=" + guildId + " failed to post notice: " + e.getMessage(), e);
        }
    }

    private void post(long guildId, Severity severity, String message) {
        GuildContext ctx = guilds.get(guildId);
        long channelId = ctx.logChannelIdOrZero();
        if (channelId == 0) {
            ConsoleLog.debug("GuildLog", "guildId=" + guildId + " discord logging disabled or not configured");
            return;
        }
        if (!ready.get() || jda == null) {
            ConsoleLog.debug("GuildLog", "Discord logging skipped (JDA not ready yet)");
            return;
        }

        MessageChannel ch = jda.getChannelById(MessageChannel.class, channelId);
        if (ch == null) {
            ConsoleLog.warn("GuildLog", "guildId=" + guildId + " logChannelId not found: " + channelId);
            return;
        }

        String description = message.length() > MAX_DESCRIPTION
                ? message.substring(0, MAX_DESCRIPTION - 3) + "..."
                : message;

        EmbedBuilder eb = new EmbedBuilder()
                .setTitle(severity.title())
                .setDescription(description)
                .setColor(severity == Severity.ERROR ? ERROR_COLOR : THEME_COLOR)
                .setTimestamp(Instant.now());

        ch.sendMessageEmbeds(eb.build()).queue(
                ok -> ConsoleLog.debug("GuildLog", "Sent discord log guildId=" + guildId),
                err -> ConsoleLog.error("GuildLog", "Log send failed guildId=" + guildId + ": " + err.getMessage(), err)
        );
    }
}
