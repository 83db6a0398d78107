package org.gudu0.starboardbot.commands;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import org.gudu0.starboardbot.util.ConsoleLog;

public interface CommandGuards {

    default void logCommand(SlashCommandInteractionEvent event) {
        ConsoleLog.info("Command - " + getClass().getSimpleName(),
                "/" + event.getName()
                        + (event.getSubcommandName() != null ? " " + event.getSubcommandName() : "")
                        + " by userId=" + event.getUser().getId()
                        + " name=" + event.getUser().getName()
                        + " guildId=" + (event.getGuild() != null ? event.getGuild().getId() : "DM")
                        + " channelId=" + event.getChannel().getId());
    }

    default Guild requireGuild(SlashCommandInteractionEvent event) {
        Guild g = event.getGuild();
        if (g == null) {
            event.reply("This command can only be used in a server.")
                    .setEphemeral(true).queue();
            return null;
        }
        return g;
    }

    default boolean requireMemberPerms(SlashCommandInteractionEvent event, Permission... perms) {
        Member m = event.getMember();
        if (m == null || !m.hasPermission(perms)) {
            event.reply("You don't have permission to use this.")
                    .setEphemeral(true).queue();
            ConsoleLog.warn("Command", "Denied (missing permission) userId=" + event.getUser().getId());
            return false;
        }
        return true;
    }

    default boolean requireAdmin(SlashCommandInteractionEvent event) {
        return requireMemberPerms(event, Permission.MANAGE_SERVER);
    }
}
