package org.gudu0.starboardbot.remote;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Snapshot of a message as it currently exists on Discord.
 *
 * @param nsfw whether the channel was age-restricted when the snapshot was taken
 */
public record LiveMessage(
        long id,
        long guildId,
        long channelId,
        long authorId,
        boolean authorBot,
        String authorName,
        String authorAvatarUrl,
        String content,
        String jumpUrl,
        boolean nsfw,
        List<Attachment> attachments,
        OffsetDateTime createdAt
) {
    public LiveMessage {
        content = content == null ? "" : content;
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public record Attachment(String fileName, String url, boolean image, boolean spoiler) {}
}
