package org.gudu0.starboardbot.commands;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.gudu0.starboardbot.starboard.StarboardEngine;
import org.gudu0.starboardbot.starboard.StarboardWorker;
import org.gudu0.starboardbot.starboard.event.StarboardEvent;
import org.gudu0.starboardbot.store.MessageRecord;
import org.gudu0.starboardbot.store.StarboardStore;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * /utils force|unforce|trash|untrash|freeze|unfreeze
 * <p>
 * Flips a message override, then re-syncs the message so its mirrors follow.
 */
public class UtilsListener extends ListenerAdapter implements CommandGuards {

    private final StarboardStore store;
    private final StarboardEngine engine;
    private final StarboardWorker worker;

    public UtilsListener(StarboardStore store, StarboardEngine engine, StarboardWorker worker) {
        this.store = store;
        this.engine = engine;
        this.worker = worker;
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        if (!event.getName().equals("utils")) return;
        logCommand(event);

        Guild guild = requireGuild(event);
        if (guild == null) return;
        if (!requireMemberPerms(event, Permission.MESSAGE_MANAGE)) return;

        String sub = event.getSubcommandName();
        if (sub == null) {
            event.reply("Missing subcommand.").setEphemeral(true).queue();
            return;
        }

        long messageId = ResyncListener.parseId(Objects.requireNonNull(event.getOption("message_id")).getAsString());
        if (messageId <= 0) {
            event.reply("That doesn't look like a message id.").setEphemeral(true).queue();
            return;
        }

        OptionMapping channelOpt = event.getOption("channel");
        long channelId = channelOpt != null ? channelOpt.getAsChannel().getIdLong() : event.getChannel().getIdLong();

        OptionMapping starboardOpt = event.getOption("starboard");
        Long starboardId = starboardOpt != null ? starboardOpt.getAsChannel().getIdLong() : null;
        long guildId = guild.getIdLong();

        if (starboardId != null && store.getStarboard(starboardId).filter(s -> s.guildId == guildId).isEmpty()) {
            event.reply("<#" + starboardId + "> is not a starboard.").setEphemeral(true).queue();
            return;
        }

        event.deferReply(true).queue();

        // the first lookup may fetch the message, so it runs on the worker pool
        worker.supply(() -> engine.trackMessage(guildId, channelId, messageId))
                .thenCompose(found -> applyAndResync(event, sub, found, guildId, starboardId))
                .exceptionally(err -> {
                    ConsoleLog.error("Utils", "guildId=" + guildId + " /utils " + sub + " failed: " + err.getMessage(), err);
                    event.getHook().editOriginal("Something went wrong. Check the log channel.").queue();
                    return null;
                });
    }

    private CompletableFuture<Void> applyAndResync(SlashCommandInteractionEvent event, String sub,
                                                   Optional<MessageRecord> found, long guildId, Long starboardId) {
        if (found.isEmpty()) {
            event.getHook().editOriginal("I couldn't find that message. If it's in another channel, pass `channel`.").queue();
            return CompletableFuture.completedFuture(null);
        }
        MessageRecord m = found.get();
        String done = apply(sub, m, guildId, starboardId);
        ConsoleLog.info("Utils", "guildId=" + guildId + " msg=" + m.id + " " + done);
        return worker.submit(new StarboardEvent.ExplicitResync(guildId, m.id))
                .thenRun(() -> event.getHook().editOriginal(done).queue());
    }

    private String apply(String sub, MessageRecord m, long guildId, Long starboardId) {
        switch (sub) {
            case "force", "unforce" -> {
                boolean on = sub.equals("force");
                List<Long> targets = starboardId != null
                        ? List.of(starboardId)
                        : store.getStarboards(guildId).stream().map(s -> s.id).toList();
                for (long sbId : targets) store.setForced(m.id, sbId, on);
                return (on ? "Forced" : "Unforced") + " message `" + m.id + "` on "
                        + (starboardId != null ? "<#" + starboardId + ">" : targets.size() + " starboard(s)") + ".";
            }
            case "trash", "untrash" -> {
                store.setTrashed(m.id, sub.equals("trash"));
                return (sub.equals("trash") ? "Trashed" : "Untrashed") + " message `" + m.id + "`.";
            }
            case "freeze", "unfreeze" -> {
                store.setFrozen(m.id, sub.equals("freeze"));
                Optional<MessageRecord> now = store.getMessage(m.id);
                return (sub.equals("freeze") ? "Froze" : "Unfroze") + " message `" + m.id + "`"
                        + now.map(r -> r.points == null ? "" : " at " + r.points + " points").orElse("") + ".";
            }
            default -> throw new IllegalArgumentException("Unknown subcommand: " + sub);
        }
    }
}
