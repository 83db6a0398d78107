package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.remote.LiveMessage;
import org.gudu0.starboardbot.remote.MessageCache;
import org.gudu0.starboardbot.remote.PermissionDeniedException;
import org.gudu0.starboardbot.starboard.event.StarboardEvent;
import org.gudu0.starboardbot.starboard.event.StarboardEvent.*;
import org.gudu0.starboardbot.store.MessageRecord;
import org.gudu0.starboardbot.store.ReactionRecord;
import org.gudu0.starboardbot.store.StarboardConfig;
import org.gudu0.starboardbot.store.StarboardMessageRecord;
import org.gudu0.starboardbot.store.StarboardStore;
import org.gudu0.starboardbot.util.ConsoleLog;
import org.gudu0.starboardbot.util.KeyedLocks;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for starboard events. Every variant ends in {@link #updateMessage}, which
 * reconciles the message on each starboard of its guild under a per-pair lock.
 */
public class StarboardEngine {

    private static final String TAG = "Starboard";

    private final StarboardStore store;
    private final MessageCache cache;
    private final MirrorReconciler reconciler;
    private final KeyedLocks<String> pairLocks = new KeyedLocks<>();

    public StarboardEngine(StarboardStore store, MessageCache cache, MirrorReconciler reconciler) {
        this.store = store;
        this.cache = cache;
        this.reconciler = reconciler;
    }

    public void handle(StarboardEvent event) {
        if (event instanceof ReactionAdded e) {
            onReactionAdded(e);
        } else if (event instanceof ReactionRemoved e) {
            onReactionRemoved(e);
        } else if (event instanceof ReactionsCleared e) {
            onReactionsCleared(e);
        } else if (event instanceof MessageEdited e) {
            onMessageEdited(e);
        } else if (event instanceof MessageDeleted e) {
            onMessageDeleted(e);
        } else if (event instanceof ExplicitResync e) {
            onExplicitResync(e);
        } else {
            throw new IllegalArgumentException("Unknown event " + event);
        }
    }

    public void onReactionAdded(ReactionAdded e) {
        if (e.userBot()) return;
        if (!isStarEmoji(e.guildId(), e.emoji())) return;

        long origId = originalOf(e.messageId());
        MessageRecord message;
        try {
            message = store.getMessage(origId)
                    .or(() -> recordMessage(e.guildId(), e.channelId(), origId))
                    .orElse(null);
        } catch (PermissionDeniedException ex) {
            ConsoleLog.warn(TAG, "guildId=" + e.guildId() + " cannot read msg=" + origId + " in " + e.channelId()
                    + " (missing " + ex.getPermission() + "); dropping reaction");
            return;
        }
        if (message == null) {
            ConsoleLog.debug(TAG, "guildId=" + e.guildId() + " msg=" + origId + " not resolvable; dropping reaction");
            return;
        }

        store.createUser(e.userId(), false);
        store.createMember(e.userId(), e.guildId());

        if (store.addReaction(origId, e.emoji(), e.userId())) {
            adjustMemberStars(message, e.userId(), e.emoji(), 1);
        }

        updateMessage(e.guildId(), origId);
    }

    public void onReactionRemoved(ReactionRemoved e) {
        if (e.userBot()) return;
        if (!isStarEmoji(e.guildId(), e.emoji())) return;

        long origId = originalOf(e.messageId());
        Optional<MessageRecord> message = store.getMessage(origId);
        if (message.isEmpty()) return;

        if (store.removeReaction(origId, e.emoji(), e.userId())) {
            adjustMemberStars(message.get(), e.userId(), e.emoji(), -1);
        }

        updateMessage(e.guildId(), origId);
    }

    /**
     * Reactions cleared on a source message are dropped from the store along with the stars
     * they gave. Reactions on a mirror are stored against the original without saying where
     * they were added, so a clear on a mirror only re-syncs.
     */
    public void onReactionsCleared(ReactionsCleared e) {
        Optional<StarboardMessageRecord> mirror = store.getStarboardMessageById(e.messageId());
        if (mirror.isPresent()) {
            ConsoleLog.debug(TAG, "guildId=" + e.guildId() + " reactions cleared on mirror " + e.messageId());
            updateMessage(e.guildId(), mirror.get().origId);
            return;
        }

        Optional<MessageRecord> message = store.getMessage(e.messageId());
        if (message.isEmpty()) return;

        List<ReactionRecord> removed = store.clearReactions(e.messageId(), e.emoji());
        for (ReactionRecord r : removed) {
            for (Long userId : r.userIds) {
                if (userId != null) adjustMemberStars(message.get(), userId, r.emoji, -1);
            }
        }
        ConsoleLog.info(TAG, "guildId=" + e.guildId() + " msg=" + e.messageId() + " cleared "
                + (e.emoji() == null ? "all reactions" : e.emoji()) + " (" + removed.size() + " emoji)");

        updateMessage(e.guildId(), e.messageId());
    }

    public void onMessageEdited(MessageEdited e) {
        cache.invalidate(e.guildId(), e.messageId());
        if (store.getMessage(e.messageId()).isEmpty()) return;
        updateMessage(e.guildId(), e.messageId());
    }

    public void onMessageDeleted(MessageDeleted e) {
        cache.invalidate(e.guildId(), e.messageId());

        Optional<StarboardMessageRecord> mirror = store.getStarboardMessageById(e.messageId());
        if (mirror.isPresent()) {
            ConsoleLog.info(TAG, "guildId=" + e.guildId() + " mirror " + e.messageId() + " deleted; re-syncing msg=" + mirror.get().origId);
            updateMessage(e.guildId(), mirror.get().origId);
            return;
        }

        if (store.getMessage(e.messageId()).isEmpty()) return;
        updateMessage(e.guildId(), e.messageId());
    }

    public void onExplicitResync(ExplicitResync e) {
        updateMessage(e.guildId(), originalOf(e.messageId()));
    }

    /**
     * Reconciles the message on every starboard of the guild. Starboards are independent:
     * one failing does not stop the others, and the first failure is rethrown afterwards.
     */
    public void updateMessage(long guildId, long messageId) {
        if (store.getMessage(messageId).isEmpty()) return;

        RuntimeException failure = null;
        for (StarboardConfig starboard : store.getStarboards(guildId)) {
            try {
                pairLocks.run(messageId + ":" + starboard.id, () -> {
                    // re-read under the lock so overrides set meanwhile are seen
                    MessageRecord message = store.getMessage(messageId).orElse(null);
                    if (message == null) return;
                    if (message.trashed) {
                        reconciler.removeTrashed(guildId, message, starboard);
                    } else {
                        reconciler.reconcile(guildId, message, starboard);
                    }
                });
            } catch (RuntimeException ex) {
                ConsoleLog.error(TAG, "guildId=" + guildId + " msg=" + messageId + " starboard=" + starboard.id
                        + " reconcile failed: " + ex.getMessage(), ex);
                if (failure == null) failure = ex;
                else failure.addSuppressed(ex);
            }
        }
        if (failure != null) throw failure;
    }

    /**
     * Returns the stored message, recording it from the live message first if it was never seen.
     * Mirrors resolve to their original.
     */
    public Optional<MessageRecord> trackMessage(long guildId, long channelId, long messageId) {
        long origId = originalOf(messageId);
        return store.getMessage(origId).or(() -> recordMessage(guildId, channelId, origId));
    }

    /** Ids of every mirror currently linked to the message. */
    public List<Long> mirrorsOf(long guildId, long messageId) {
        return store.getStarboards(guildId).stream()
                .map(s -> store.getStarboardMessage(messageId, s.id))
                .flatMap(Optional::stream)
                .map(l -> l.id)
                .toList();
    }

    // ----------------------------
    // Helpers
    // ----------------------------

    /** A reaction on a mirror counts toward the message it mirrors. */
    private long originalOf(long messageId) {
        return store.getStarboardMessageById(messageId).map(l -> l.origId).orElse(messageId);
    }

    private boolean isStarEmoji(long guildId, String emoji) {
        for (StarboardConfig s : store.getStarboards(guildId)) {
            if (s.isStarEmoji(emoji)) return true;
        }
        return false;
    }

    private Optional<MessageRecord> recordMessage(long guildId, long channelId, long messageId) {
        Optional<LiveMessage> live = cache.fetchMessage(guildId, channelId, messageId);
        if (live.isEmpty()) return Optional.empty();

        LiveMessage m = live.get();
        store.createGuild(guildId);
        store.createUser(m.authorId(), m.authorBot());
        store.createMember(m.authorId(), guildId);
        ConsoleLog.debug(TAG, "guildId=" + guildId + " first star on msg=" + messageId + " author=" + m.authorId());
        return Optional.of(store.createMessage(m.id(), guildId, m.channelId(), m.authorId(), m.nsfw()));
    }

    /**
     * Moves the reactor's stars given and the author's stars received and xp by {@code delta}.
     * Each counter only moves if some starboard using this emoji counts it; a removal only
     * counts on starboards that allow unstarring.
     */
    private void adjustMemberStars(MessageRecord message, long reactorId, String emoji, int delta) {
        if (message.authorId == null || message.authorId == reactorId) return;

        long guildId = message.guildId;
        List<StarboardConfig> counting = store.getStarboards(guildId).stream()
                .filter(s -> s.isStarEmoji(emoji))
                .filter(s -> delta > 0 || s.unstar)
                .toList();
        boolean given = counting.stream().anyMatch(s -> s.star);
        boolean received = counting.stream().anyMatch(s -> s.recvStar);
        boolean xp = counting.stream().anyMatch(s -> s.xp);

        if (given && store.getMember(reactorId, guildId).isPresent()) {
            store.updateMember(reactorId, guildId, m -> m.onStarsGiven(delta));
        }
        if ((received || xp) && store.getMember(message.authorId, guildId).isPresent()) {
            store.updateMember(message.authorId, guildId, m -> {
                if (received) m.onStarsReceived(delta);
                if (xp) m.onXp(delta);
            });
        }
    }
}
