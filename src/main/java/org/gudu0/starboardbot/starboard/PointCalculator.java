package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.store.MessageRecord;
import org.gudu0.starboardbot.store.ReactionRecord;
import org.gudu0.starboardbot.store.StarboardConfig;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores a message for one starboard: one point per distinct user who reacted with
 * any of the starboard's emoji. The author only counts when self-starring is allowed.
 */
public class PointCalculator {

    public int calculate(MessageRecord message, List<ReactionRecord> reactions, StarboardConfig starboard) {
        Set<Long> counted = new HashSet<>();

        for (ReactionRecord r : reactions) {
            if (!starboard.isStarEmoji(r.emoji)) continue;

            for (Long userId : r.userIds) {
                if (userId == null) continue; // deleted account
                if (!starboard.selfStar && userId.equals(message.authorId)) continue;
                counted.add(userId);
            }
        }

        return counted.size();
    }
}
