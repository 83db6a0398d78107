package org.gudu0.starboardbot.starboard.event;

/**
 * Inbound events the starboard engine reacts to. Each variant carries only what it needs.
 */
public sealed interface StarboardEvent {

    long guildId();

    /**
     * @param emoji unicode character, or the numeric id of a custom emoji
     */
    record ReactionAdded(long guildId, long channelId, long messageId, long userId, boolean userBot, String emoji)
            implements StarboardEvent {}

    record ReactionRemoved(long guildId, long channelId, long messageId, long userId, boolean userBot, String emoji)
            implements StarboardEvent {}

    /**
     * A moderator removed reactions in bulk.
     *
     * @param emoji the one emoji cleared, or null when every reaction was cleared
     */
    record ReactionsCleared(long guildId, long channelId, long messageId, String emoji) implements StarboardEvent {}

    record MessageEdited(long guildId, long channelId, long messageId) implements StarboardEvent {}

    record MessageDeleted(long guildId, long channelId, long messageId) implements StarboardEvent {}

    /** Re-sync a message (or the original of a mirror) on every starboard of the guild. */
    record ExplicitResync(long guildId, long messageId) implements StarboardEvent {}
}
