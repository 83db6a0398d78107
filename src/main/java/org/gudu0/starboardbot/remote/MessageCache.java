package org.gudu0.starboardbot.remote;

import java.util.Optional;

/**
 * Lookup of recently seen messages. An empty result means the message (or its channel) is gone.
 */
public interface MessageCache {

    /**
     * @throws PermissionDeniedException when the bot may not read the channel; this says
     *         nothing about whether the message still exists
     */
    Optional<LiveMessage> fetchMessage(long guildId, long channelId, long messageId);

    /** Forget a message so the next fetch sees its current state. */
    void invalidate(long guildId, long messageId);
}
