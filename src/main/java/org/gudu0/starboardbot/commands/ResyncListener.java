package org.gudu0.starboardbot.commands;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.starboardbot.starboard.StarboardEngine;
import org.gudu0.starboardbot.starboard.StarboardWorker;
import org.gudu0.starboardbot.starboard.event.StarboardEvent;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

public class ResyncListener extends ListenerAdapter implements CommandGuards {
    private final StarboardEngine engine;
    private final StarboardWorker worker;

    public ResyncListener(StarboardEngine engine, StarboardWorker worker) {
        this.engine = engine;
        this.worker = worker;
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        if (!event.getName().equals("resync")) return;
        logCommand(event);

        Guild guild = requireGuild(event);
        if (guild == null) return;
        if (!requireMemberPerms(event, Permission.MESSAGE_MANAGE)) return;

        long messageId = parseId(Objects.requireNonNull(event.getOption("message_id")).getAsString());
        if (messageId <= 0) {
            event.reply("That doesn't look like a message id.").setEphemeral(true).queue();
            return;
        }

        event.deferReply(true).queue(); // ephemeral

        long guildId = guild.getIdLong();
        worker.submit(new StarboardEvent.ExplicitResync(guildId, messageId))
                .whenComplete((ok, err) -> {
                    if (err != null) {
                        event.getHook().editOriginal("Resync of `" + messageId + "` failed. Check the log channel.").queue();
                        return;
                    }
                    List<Long> mirrors = engine.mirrorsOf(guildId, messageId);
                    String where = mirrors.isEmpty()
                            ? "It is not on any starboard."
                            : "Mirrors: " + mirrors.stream().map(id -> "`" + id + "`").collect(Collectors.joining(", "));
                    event.getHook().editOriginal("Resynced `" + messageId + "`.\n" + where).queue();
                    ConsoleLog.info("Resync", "guildId=" + guildId + " msg=" + messageId + " mirrors=" + mirrors);
                });
    }

    static long parseId(String raw) {
        String s = raw.trim();
        // accept a message link too: take the last path segment
        int slash = s.lastIndexOf('/');
        if (slash >= 0) s = s.substring(slash + 1);
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
