package org.gudu0.starboardbot.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.starboardbot.discord.JdaMirrorChannel;
import org.gudu0.starboardbot.remote.PermissionDeniedException;
import org.gudu0.starboardbot.starboard.StarboardExplorer;
import org.gudu0.starboardbot.starboard.StarboardExplorer.RandomFilter;
import org.gudu0.starboardbot.starboard.StarboardWorker;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * /random and /save: open to every member.
 */
public class ExploreCommandListener extends ListenerAdapter implements CommandGuards {

    private final StarboardExplorer explorer;
    private final StarboardWorker worker;

    public ExploreCommandListener(StarboardExplorer explorer, StarboardWorker worker) {
        this.explorer = explorer;
        this.worker = worker;
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        switch (event.getName()) {
            case "random" -> onRandom(event);
            case "save" -> onSave(event);
            default -> {
            }
        }
    }

    private void onRandom(SlashCommandInteractionEvent event) {
        logCommand(event);
        Guild guild = requireGuild(event);
        if (guild == null) return;

        OptionMapping by = event.getOption("by");
        OptionMapping in = event.getOption("in");
        OptionMapping sb = event.getOption("starboard");
        OptionMapping points = event.getOption("points");
        RandomFilter filter = new RandomFilter(
                by == null ? null : by.getAsUser().getIdLong(),
                in == null ? null : in.getAsChannel().getIdLong(),
                sb == null ? null : sb.getAsChannel().getIdLong(),
                points == null ? 0 : points.getAsInt()
        );

        event.deferReply().queue();

        long guildId = guild.getIdLong();
        worker.supply(() -> explorer.randomMessage(guildId, filter))
                .whenComplete((pick, err) -> {
                    if (err != null) {
                        ConsoleLog.error("Explore", "guildId=" + guildId + " /random failed: " + err.getMessage(), err);
                        event.getHook().editOriginal("Something went wrong. Please try again.").queue();
                        return;
                    }
                    if (pick.isEmpty()) {
                        event.getHook().editOriginal("No messages were found that matched those requirements.").queue();
                        return;
                    }
                    event.getHook().editOriginal(pick.get().text())
                            .setEmbeds(JdaMirrorChannel.toEmbed(pick.get().content()))
                            .queue();
                });
    }

    private void onSave(SlashCommandInteractionEvent event) {
        logCommand(event);
        Guild guild = requireGuild(event);
        if (guild == null) return;

        String raw = Objects.requireNonNull(event.getOption("message_id")).getAsString();
        long messageId = ResyncListener.parseId(raw);
        if (messageId <= 0) {
            event.reply("That doesn't look like a message id.").setEphemeral(true).queue();
            return;
        }
        OptionMapping channelOpt = event.getOption("channel");
        long channelId = channelOf(raw,
                channelOpt != null ? channelOpt.getAsChannel().getIdLong() : event.getChannel().getIdLong());

        event.deferReply(true).queue();

        long guildId = guild.getIdLong();
        worker.supply(() -> explorer.save(guildId, channelId, messageId))
                .whenComplete((result, err) -> {
                    if (err != null) {
                        Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                        if (cause instanceof PermissionDeniedException denied) {
                            event.getHook().editOriginal("I can't read that message (missing `"
                                    + denied.getPermission() + "`).").queue();
                        } else {
                            ConsoleLog.error("Explore", "guildId=" + guildId + " /save failed: " + cause.getMessage(), cause);
                            event.getHook().editOriginal("Something went wrong. Please try again.").queue();
                        }
                        return;
                    }
                    switch (result.status()) {
                        case TRASHED -> event.getHook().editOriginal("You cannot save a trashed message.").queue();
                        case DELETED -> event.getHook().editOriginal("That message was deleted, so you can't save it.").queue();
                        case SAVED -> dm(event, JdaMirrorChannel.toEmbed(result.content()));
                    }
                });
    }

    private static void dm(SlashCommandInteractionEvent event, MessageEmbed embed) {
        event.getUser().openPrivateChannel()
                .flatMap(ch -> ch.sendMessageEmbeds(embed))
                .queue(
                        ok -> event.getHook().editOriginal("Saved to your DMs.").queue(),
                        err -> {
                            ConsoleLog.debug("Explore", "DM to userId=" + event.getUser().getId() + " failed: " + err.getMessage());
                            event.getHook().editOriginal("I can't DM you, so you can't save that message.").queue();
                        }
                );
    }

    /** Channel id from a message link (.../guild/channel/message), or the fallback for a bare id. */
    static long channelOf(String raw, long fallback) {
        String[] parts = raw.trim().split("/");
        if (parts.length < 3) return fallback;
        try {
            return Long.parseLong(parts[parts.length - 2]);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
