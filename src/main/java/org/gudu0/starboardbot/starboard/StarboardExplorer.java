package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.remote.LiveMessage;
import org.gudu0.starboardbot.remote.MessageCache;
import org.gudu0.starboardbot.remote.MirrorContent;
import org.gudu0.starboardbot.remote.MirrorRenderer;
import org.gudu0.starboardbot.remote.PermissionDeniedException;
import org.gudu0.starboardbot.store.MessageRecord;
import org.gudu0.starboardbot.store.StarboardConfig;
import org.gudu0.starboardbot.store.StarboardMessageRecord;
import org.gudu0.starboardbot.store.StarboardStore;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Read-only views over starred messages: a random pick from the starboards and a rendered
 * copy of one message for a member to keep. Both fetch live messages, so run them on the worker.
 */
public class StarboardExplorer {

    private static final String TAG = "Explore";

    /** Live fetches tried before giving up on a random pick. */
    static final int RANDOM_ATTEMPTS = 3;

    private final StarboardStore store;
    private final MessageCache cache;
    private final MirrorRenderer renderer;
    private final MirrorReconciler reconciler;
    private final Random random;

    public StarboardExplorer(StarboardStore store, MessageCache cache, MirrorRenderer renderer,
                             MirrorReconciler reconciler, Random random) {
        this.store = store;
        this.cache = cache;
        this.renderer = renderer;
        this.reconciler = reconciler;
        this.random = random;
    }

    /** Null fields match anything. */
    public record RandomFilter(Long authorId, Long channelId, Long starboardId, int minPoints) {}

    /** A message ready to post: the usual header line plus its rendered body. */
    public record Rendered(String text, MirrorContent content) {}

    public enum SaveStatus { SAVED, TRASHED, DELETED }

    public record SaveResult(SaveStatus status, MirrorContent content) {}

    /**
     * Picks a random mirrored message of the guild. Only starboards with {@code explore} on
     * take part; trashed messages never do.
     */
    public Optional<Rendered> randomMessage(long guildId, RandomFilter filter) {
        List<Candidate> candidates = new ArrayList<>();
        for (StarboardConfig sb : store.getStarboards(guildId)) {
            if (!sb.explore) continue;
            if (filter.starboardId() != null && filter.starboardId() != sb.id) continue;

            for (StarboardMessageRecord link : store.getStarboardMessages(sb.id)) {
                int points = link.points == null ? 0 : link.points;
                if (points < filter.minPoints()) continue;

                MessageRecord m = store.getMessage(link.origId).orElse(null);
                if (m == null || m.trashed) continue;
                if (filter.authorId() != null && !Objects.equals(m.authorId, filter.authorId())) continue;
                if (filter.channelId() != null && m.channelId != filter.channelId()) continue;

                candidates.add(new Candidate(m, sb, points));
            }
        }
        ConsoleLog.debug(TAG, "guildId=" + guildId + " random " + filter + " candidates=" + candidates.size());

        Collections.shuffle(candidates, random);
        for (Candidate c : candidates.subList(0, Math.min(RANDOM_ATTEMPTS, candidates.size()))) {
            LiveMessage live = fetchOrNull(guildId, c.message().channelId, c.message().id);
            if (live == null) continue;

            String text = reconciler.plainText(guildId, c.message().channelId, c.starboard(), c.points(),
                    c.message().isForcedOn(c.starboard().id), c.message().frozen);
            return Optional.of(new Rendered(text, renderer.render(live, c.starboard())));
        }
        return Optional.empty();
    }

    /**
     * Renders a message (or the original of a mirror) for a member to keep.
     *
     * @param channelId where to look when the message was never starred
     * @throws PermissionDeniedException when the source channel cannot be read
     */
    public SaveResult save(long guildId, long channelId, long messageId) {
        long origId = store.getStarboardMessageById(messageId).map(l -> l.origId).orElse(messageId);
        Optional<MessageRecord> known = store.getMessage(origId);

        if (known.isPresent() && known.get().trashed) return new SaveResult(SaveStatus.TRASHED, null);

        long sourceChannel = known.map(m -> m.channelId).orElse(channelId);
        Optional<LiveMessage> live = cache.fetchMessage(guildId, sourceChannel, origId);
        if (live.isEmpty()) return new SaveResult(SaveStatus.DELETED, null);

        // no starboard involved: default look
        StarboardConfig plain = new StarboardConfig(0, guildId);
        return new SaveResult(SaveStatus.SAVED, renderer.render(live.get(), plain));
    }

    private LiveMessage fetchOrNull(long guildId, long channelId, long messageId) {
        try {
            return cache.fetchMessage(guildId, channelId, messageId).orElse(null);
        } catch (PermissionDeniedException e) {
            ConsoleLog.debug(TAG, "guildId=" + guildId + " skipping unreadable msg=" + messageId
                    + " (missing " + e.getPermission() + ")");
            return null;
        }
    }

    private record Candidate(MessageRecord message, StarboardConfig starboard, int points) {}
}
