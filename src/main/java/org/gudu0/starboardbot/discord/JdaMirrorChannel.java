package org.gudu0.starboardbot.discord;

import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.entities.emoji.Emoji;
import net.dv8tion.jda.api.entities.emoji.RichCustomEmoji;
import org.gudu0.starboardbot.remote.MirrorChannel;
import org.gudu0.starboardbot.remote.MirrorContent;
import org.gudu0.starboardbot.remote.RemoteNotFoundException;
import org.gudu0.starboardbot.util.ConsoleLog;

/**
 * {@link MirrorChannel} over JDA. Calls block with {@code complete()}, so this must only
 * be used from the starboard worker, never from the gateway thread.
 */
public class JdaMirrorChannel implements MirrorChannel {

    static final String ZERO_WIDTH_SPACE = "\u200B";

    private final JDA jda;

    public JdaMirrorChannel(JDA jda) {
        this.jda = jda;
    }

    @Override
    public long send(long channelId, String text, MirrorContent content) {
        GuildMessageChannel ch = channel(channelId);
        Message m = JdaErrors.call("send to " + channelId, Permission.MESSAGE_SEND,
                () -> ch.sendMessage(text).setEmbeds(toEmbed(content)).complete());
        return m.getIdLong();
    }

    @Override
    public void edit(long channelId, long messageId, String text, MirrorContent content) {
        GuildMessageChannel ch = channel(channelId);
        JdaErrors.run("edit " + messageId, Permission.MESSAGE_SEND, () -> {
            var action = ch.editMessageById(messageId, text);
            if (content != null) action = action.setEmbeds(toEmbed(content));
            action.complete();
        });
    }

    @Override
    public void delete(long channelId, long messageId) {
        GuildMessageChannel ch = channel(channelId);
        JdaErrors.run("delete " + messageId, Permission.MESSAGE_MANAGE,
                () -> ch.deleteMessageById(messageId).complete());
    }

    @Override
    public void react(long channelId, long messageId, String emoji) {
        GuildMessageChannel ch = channel(channelId);
        Emoji e = toEmoji(emoji);
        if (e == null) {
            ConsoleLog.warn("MirrorChannel", "Custom emoji " + emoji + " is not visible to the bot; skipping autoreact");
            return;
        }
        JdaErrors.run("react " + emoji + " on " + messageId, Permission.MESSAGE_ADD_REACTION,
                () -> ch.addReactionById(messageId, e).complete());
    }

    private GuildMessageChannel channel(long channelId) {
        GuildMessageChannel ch = jda.getChannelById(GuildMessageChannel.class, channelId);
        if (ch == null) throw new RemoteNotFoundException("Starboard channel " + channelId + " not found / not visible");
        return ch;
    }

    private Emoji toEmoji(String token) {
        long id = customEmojiId(token);
        if (id == 0) return Emoji.fromUnicode(token);
        RichCustomEmoji custom = jda.getEmojiById(id);
        return custom; // null when the emoji's guild is not visible
    }

    /** Numeric tokens are custom emoji ids; anything else is a unicode emoji. */
    static long customEmojiId(String token) {
        if (token == null || token.isEmpty()) return 0;
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) return 0;
        }
        try {
            return Long.parseLong(token);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public static MessageEmbed toEmbed(MirrorContent c) {
        EmbedBuilder eb = new EmbedBuilder()
                .setDescription(c.description())
                .setAuthor(c.authorName(), null, c.authorAvatarUrl())
                .setColor(c.color())
                .setTimestamp(c.timestamp());

        if (c.imageUrl() != null) eb.setImage(c.imageUrl());

        eb.addField(ZERO_WIDTH_SPACE, "**[Jump to Message](" + c.jumpUrl() + ")**", false);
        if (!c.links().isEmpty()) {
            String links = String.join("\n", c.links());
            if (links.length() > MessageEmbed.VALUE_MAX_LENGTH) {
                links = links.substring(0, MessageEmbed.VALUE_MAX_LENGTH - 3) + "...";
            }
            eb.addField(ZERO_WIDTH_SPACE, links, false);
        }
        return eb.build();
    }
}
