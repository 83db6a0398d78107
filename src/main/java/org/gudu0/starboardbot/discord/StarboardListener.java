package org.gudu0.starboardbot.discord;

import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.emoji.CustomEmoji;
import net.dv8tion.jda.api.entities.emoji.Emoji;
import net.dv8tion.jda.api.events.message.MessageBulkDeleteEvent;
import net.dv8tion.jda.api.events.message.MessageDeleteEvent;
import net.dv8tion.jda.api.events.message.MessageUpdateEvent;
import net.dv8tion.jda.api.events.message.react.GenericMessageReactionEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionAddEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionRemoveAllEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionRemoveEmojiEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionRemoveEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.starboardbot.starboard.StarboardWorker;
import org.gudu0.starboardbot.starboard.event.StarboardEvent;
import org.gudu0.starboardbot.util.ConsoleLog;

/**
 * Turns gateway events into {@link StarboardEvent}s and hands them to the worker.
 * Nothing here blocks the gateway thread.
 */
public class StarboardListener extends ListenerAdapter {

    private final StarboardWorker worker;

    public StarboardListener(StarboardWorker worker) {
        this.worker = worker;
    }

    @Override
    public void onMessageReactionAdd(MessageReactionAddEvent event) {
        if (!event.isFromGuild()) return;
        worker.submit(new StarboardEvent.ReactionAdded(
                event.getGuild().getIdLong(),
                event.getChannel().getIdLong(),
                event.getMessageIdLong(),
                event.getUserIdLong(),
                isBot(event),
                tokenOf(event.getEmoji())
        ));
    }

    @Override
    public void onMessageReactionRemove(MessageReactionRemoveEvent event) {
        if (!event.isFromGuild()) return;
        worker.submit(new StarboardEvent.ReactionRemoved(
                event.getGuild().getIdLong(),
                event.getChannel().getIdLong(),
                event.getMessageIdLong(),
                event.getUserIdLong(),
                isBot(event),
                tokenOf(event.getEmoji())
        ));
    }

    @Override
    public void onMessageReactionRemoveAll(MessageReactionRemoveAllEvent event) {
        if (!event.isFromGuild()) return;
        worker.submit(new StarboardEvent.ReactionsCleared(
                event.getGuild().getIdLong(),
                event.getChannel().getIdLong(),
                event.getMessageIdLong(),
                null
        ));
    }

    @Override
    public void onMessageReactionRemoveEmoji(MessageReactionRemoveEmojiEvent event) {
        if (!event.isFromGuild()) return;
        worker.submit(new StarboardEvent.ReactionsCleared(
                event.getGuild().getIdLong(),
                event.getChannel().getIdLong(),
                event.getMessageIdLong(),
                tokenOf(event.getEmoji())
        ));
    }

    @Override
    public void onMessageUpdate(MessageUpdateEvent event) {
        if (!event.isFromGuild()) return;
        worker.submit(new StarboardEvent.MessageEdited(
                event.getGuild().getIdLong(),
                event.getChannel().getIdLong(),
                event.getMessageIdLong()
        ));
    }

    @Override
    public void onMessageDelete(MessageDeleteEvent event) {
        if (!event.isFromGuild()) return;
        worker.submit(new StarboardEvent.MessageDeleted(
                event.getGuild().getIdLong(),
                event.getChannel().getIdLong(),
                event.getMessageIdLong()
        ));
    }

    @Override
    public void onMessageBulkDelete(MessageBulkDeleteEvent event) {
        long guildId = event.getGuild().getIdLong();
        long channelId = event.getChannel().getIdLong();
        ConsoleLog.info("StarboardListener", "guildId=" + guildId + " bulk delete of " + event.getMessageIds().size()
                + " messages in " + channelId);
        for (String id : event.getMessageIds()) {
            worker.submit(new StarboardEvent.MessageDeleted(guildId, channelId, Long.parseLong(id)));
        }
    }

    /** Custom emoji are identified by id (names can change); unicode emoji by the character itself. */
    static String tokenOf(Emoji emoji) {
        if (emoji.getType() == Emoji.Type.CUSTOM) return ((CustomEmoji) emoji).getId();
        return emoji.getName();
    }

    private static boolean isBot(GenericMessageReactionEvent event) {
        if (event.getUserIdLong() == event.getJDA().getSelfUser().getIdLong()) return true;
        User user = event.getUser();
        if (user != null) return user.isBot();
        return event.getMember() != null && event.getMember().getUser().isBot();
    }
}
