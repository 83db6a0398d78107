package org.gudu0.starboardbot.store;

import java.util.ArrayList;
import java.util.List;

/**
 * One emoji on one message, with everyone who reacted with it.
 * A user id becomes null when that user's row is deleted.
 */
public class ReactionRecord {
    public long id;
    public long messageId;
    public String emoji;

    @SuppressWarnings("CanBeFinal")
    public List<Long> userIds = new ArrayList<>();

    public ReactionRecord() {}

    public ReactionRecord(long id, long messageId, String emoji) {
        this.id = id;
        this.messageId = messageId;
        this.emoji = emoji;
    }

    public ReactionRecord copy() {
        ReactionRecord r = new ReactionRecord(id, messageId, emoji);
        r.userIds = new ArrayList<>(userIds);
        return r;
    }
}
