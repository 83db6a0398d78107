package org.gudu0.starboardbot.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.channel.Channel;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.starboardbot.guild.GuildContext;
import org.gudu0.starboardbot.guild.GuildManager;
import org.gudu0.starboardbot.store.StarboardStore;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.util.Objects;

/**
 * /setup ...
 * <p>
 * Edits data/guilds/<guildId>/config.json (log channel) and shows a summary of the guild's starboards.
 */
public class SetupListener extends ListenerAdapter implements CommandGuards {

    private final GuildManager guilds;
    private final StarboardStore store;

    public SetupListener(GuildManager guilds, StarboardStore store) {
        this.guilds = guilds;
        this.store = store;
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        if (!event.getName().equals("setup")) return;

        logCommand(event);

        Guild guild = requireGuild(event);
        if (guild == null) return;
        if (!requireAdmin(event)) return;

        GuildContext ctx = guilds.get(guild.getIdLong());

        String sub = event.getSubcommandName();
        if (sub == null) {
            event.reply("Missing subcommand. Use /setup status or /setup setlogchannel ...")
                    .setEphemeral(true).queue();
            return;
        }

        switch (sub) {
            case "status" -> event.reply(buildStatus(guild, ctx)).setEphemeral(true).queue();

            case "setlogchannel" -> {
                Channel ch = Objects.requireNonNull(event.getOption("channel")).getAsChannel();
                if (!(ch instanceof MessageChannel)) {
                    event.reply("Please choose a thread or a text channel.")
                            .setEphemeral(true).queue();
                    return;
                }

                ctx.cfg.logChannelId = ch.getId();
                saveGuildConfig(ctx, "setlogchannel");

                event.reply("Log channel/thread set to <#" + ctx.cfg.logChannelId + ">."
                                + (ctx.cfg.enableLogs ? "" : "\nLogs are off; turn them on with `/setup setenablelogs true`."))
                        .setEphemeral(true).queue();
            }

            case "setenablelogs" -> {
                ctx.cfg.enableLogs = Objects.requireNonNull(event.getOption("enabled")).getAsBoolean();
                saveGuildConfig(ctx, "setenablelogs");

                event.reply("enableLogs set to " + ctx.cfg.enableLogs + ".")
                        .setEphemeral(true).queue();
            }

            default -> event.reply("Unknown subcommand: " + sub).setEphemeral(true).queue();
        }
    }

    private static void saveGuildConfig(GuildContext ctx, String action) {
        try {
            ctx.save(action);
        } catch (Exception e) {
            ConsoleLog.error("Setup", "Failed saving guild config guildId=" + ctx.guildId + ": " + e.getMessage(), e);
        }
    }

    private String buildStatus(Guild g, GuildContext ctx) {
        String logCh = (ctx.cfg.logChannelId == null || ctx.cfg.logChannelId.isBlank())
                ? "_not set_"
                : "<#" + ctx.cfg.logChannelId + ">";

        int starboards = store.getStarboards(g.getIdLong()).size();

        return "**Setup Status: " + g.getName() + "**\n"
                + "- starboards: " + starboards + "\n"
                + "- enableLogs: " + ctx.cfg.enableLogs + "\n"
                + "- logChannel/thread: " + logCh + "\n"
                + "\n"
                + "_Tip: add a starboard with `/starboard add`, then point logs somewhere with `/setup setlogchannel`._";
    }
}
