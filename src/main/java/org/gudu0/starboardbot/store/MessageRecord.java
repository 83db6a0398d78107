package org.gudu0.starboardbot.store;

import java.util.HashSet;
import java.util.Set;

/** A source message that has received at least one star reaction. */
public class MessageRecord {
    public long id;
    public long guildId;
    public long channelId;

    /** Null once the author's user row is deleted. */
    public Long authorId;

    /** Channel NSFW state when the message was first seen. */
    public boolean nsfw;

    /** Starboards that mirror this message regardless of score. */
    @SuppressWarnings("CanBeFinal")
    public Set<Long> forced = new HashSet<>();

    /** Suppressed from every starboard by a moderator. */
    public boolean trashed = false;

    /** Score and mirrors locked against automatic changes. */
    public boolean frozen = false;

    /** Last score computed while not frozen. */
    public Integer points = null;

    public MessageRecord() {}

    public MessageRecord(long id, long guildId, long channelId, Long authorId, boolean nsfw) {
        this.id = id;
        this.guildId = guildId;
        this.channelId = channelId;
        this.authorId = authorId;
        this.nsfw = nsfw;
    }

    public boolean isForcedOn(long starboardId) {
        return forced.contains(starboardId);
    }

    public MessageRecord copy() {
        MessageRecord m = new MessageRecord(id, guildId, channelId, authorId, nsfw);
        m.forced = new HashSet<>(forced);
        m.trashed = trashed;
        m.frozen = frozen;
        m.points = points;
        return m;
    }
}
