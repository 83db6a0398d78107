package org.gudu0.starboardbot.discord;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.emoji.RichCustomEmoji;
import org.gudu0.starboardbot.logging.LogService;
import org.gudu0.starboardbot.remote.LiveMessage;
import org.gudu0.starboardbot.remote.MirrorContent;
import org.gudu0.starboardbot.remote.MirrorRenderer;
import org.gudu0.starboardbot.store.StarboardConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Minimal mirror rendering: text, author, first safe image, and links to every attachment.
 * Images are never inlined for NSFW sources or spoilered files.
 */
public class EmbedRenderer implements MirrorRenderer {

    static final int MAX_DESCRIPTION = 2048;
    private static final String ELLIPSIS = " ...";

    private volatile JDA jda;

    public void attach(JDA jda) {
        this.jda = jda;
    }

    @Override
    public MirrorContent render(LiveMessage message, StarboardConfig starboard) {
        String description = message.content();
        if (description.length() > MAX_DESCRIPTION) {
            description = description.substring(0, MAX_DESCRIPTION - ELLIPSIS.length()) + ELLIPSIS;
        }

        String image = null;
        List<String> links = new ArrayList<>();
        for (LiveMessage.Attachment a : message.attachments()) {
            if (image == null && a.image() && !a.spoiler() && !message.nsfw()) {
                image = a.url();
            }
            links.add("**[" + a.fileName() + "](" + a.url() + ")**");
        }

        int color = starboard.color != null ? starboard.color : LogService.THEME_COLOR;

        return new MirrorContent(
                description,
                message.authorName(),
                message.authorAvatarUrl(),
                color,
                image,
                message.jumpUrl(),
                links,
                message.createdAt()
        );
    }

    @Override
    public String displayEmoji(long guildId, String token) {
        long id = JdaMirrorChannel.customEmojiId(token);
        if (id == 0) return token;

        JDA j = this.jda;
        RichCustomEmoji emoji = j == null ? null : j.getEmojiById(id);
        return emoji == null ? "⭐" : emoji.getAsMention();
    }
}
