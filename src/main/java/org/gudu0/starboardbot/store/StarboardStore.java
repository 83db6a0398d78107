package org.gudu0.starboardbot.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable storage for starboard state.
 * <p>
 * Every method is atomic on its own. Reads return copies; mutate through the store only.
 */
public interface StarboardStore {

    // --- guilds / users / members ---

    GuildRecord createGuild(long guildId);

    /** Removes the guild with its starboards, members and messages. */
    void deleteGuild(long guildId);

    UserRecord createUser(long userId, boolean bot);

    Optional<UserRecord> getUser(long userId);

    /** Removes the user and its members; authored messages and reactions keep a null user. */
    void deleteUser(long userId);

    MemberRecord createMember(long userId, long guildId);

    Optional<MemberRecord> getMember(long userId, long guildId);

    void updateMember(long userId, long guildId, Consumer<MemberRecord> change);

    // --- starboards ---

    StarboardConfig createStarboard(long guildId, long channelId);

    Optional<StarboardConfig> getStarboard(long starboardId);

    List<StarboardConfig> getStarboards(long guildId);

    void updateStarboard(long starboardId, Consumer<StarboardConfig> change);

    /** Removes the starboard and every link to its mirrors. */
    void deleteStarboard(long starboardId);

    // --- messages ---

    MessageRecord createMessage(long messageId, long guildId, long channelId, Long authorId, boolean nsfw);

    Optional<MessageRecord> getMessage(long messageId);

    /** Removes the message with its links and reactions. */
    void deleteMessage(long messageId);

    void setForced(long messageId, long starboardId, boolean forced);

    void setTrashed(long messageId, boolean trashed);

    void setFrozen(long messageId, boolean frozen);

    void setMessagePoints(long messageId, int points);

    // --- starboard messages (mirror links) ---

    Optional<StarboardMessageRecord> getStarboardMessage(long origId, long starboardId);

    Optional<StarboardMessageRecord> getStarboardMessageById(long mirrorId);

    /** @throws StoreException when a link for (origId, starboardId) already exists */
    StarboardMessageRecord createStarboardMessage(long mirrorId, long origId, long starboardId);

    void deleteStarboardMessage(long mirrorId);

    void setPoints(long mirrorId, int points);

    /** Every link on one starboard, in mirror id order. */
    List<StarboardMessageRecord> getStarboardMessages(long starboardId);

    // --- reactions ---

    /** @return false if the user had already reacted with this emoji */
    boolean addReaction(long messageId, String emoji, long userId);

    /** @return false if the user had not reacted with this emoji */
    boolean removeReaction(long messageId, String emoji, long userId);

    List<ReactionRecord> getReactions(long messageId);

    /**
     * Drops the message's reactions with one emoji, or all of them when {@code emoji} is null.
     *
     * @return the removed reactions as they were
     */
    List<ReactionRecord> clearReactions(long messageId, String emoji);
}
