package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.remote.*;
import org.gudu0.starboardbot.store.MessageRecord;
import org.gudu0.starboardbot.store.StarboardConfig;
import org.gudu0.starboardbot.store.StarboardMessageRecord;
import org.gudu0.starboardbot.store.StarboardStore;
import org.gudu0.starboardbot.store.UserRecord;
import org.gudu0.starboardbot.util.ConsoleLog;

import java.util.Optional;

/**
 * Brings the mirror of one (message, starboard) pair in line with its score.
 * <p>
 * Safe to call redundantly: every call re-reads the link and both remote messages.
 * Callers must not run two reconciles of the same pair at once.
 * <p>
 * Failure handling: missing permissions are reported to the guild log and leave the
 * link as it was before the call. A mirror that is already gone is not an error.
 * Any other remote failure propagates.
 */
public class MirrorReconciler {

    private static final String TAG = "Reconcile";

    private final StarboardStore store;
    private final MessageCache cache;
    private final MirrorChannel channel;
    private final MirrorRenderer renderer;
    private final GuildNotifier notifier;
    private final PointCalculator calculator;
    private final EligibilityEvaluator evaluator;

    public MirrorReconciler(StarboardStore store,
                            MessageCache cache,
                            MirrorChannel channel,
                            MirrorRenderer renderer,
                            GuildNotifier notifier,
                            PointCalculator calculator,
                            EligibilityEvaluator evaluator) {
        this.store = store;
        this.cache = cache;
        this.channel = channel;
        this.renderer = renderer;
        this.notifier = notifier;
        this.calculator = calculator;
        this.evaluator = evaluator;
    }

    public void reconcile(long guildId, MessageRecord message, StarboardConfig starboard) {
        StarboardMessageRecord link;
        LiveMessage live;
        try {
            // 1) existing link, dropped if its mirror vanished out of band
            link = resolveLink(guildId, message, starboard);

            // 2) source message as it is now
            live = cache.fetchMessage(guildId, message.channelId, message.id).orElse(null);
        } catch (PermissionDeniedException e) {
            // unreadable is not deleted: leave the link and the mirror alone
            ConsoleLog.warn(TAG, "guildId=" + guildId + " msg=" + message.id + " starboard=" + starboard.id
                    + " skipped, cannot read: " + e.getMessage());
            notifier.notify(guildId, Severity.ERROR,
                    "I couldn't update <#" + starboard.id + "> for a message in <#" + message.channelId
                            + "> because I'm missing the `" + e.getPermission() + "` permission. "
                            + "The starboard message was left as it is.");
            return;
        }

        // 3) score + decision
        int points;
        if (message.frozen && link != null && link.points != null) {
            points = link.points;
        } else {
            points = calculator.calculate(message, store.getReactions(message.id), starboard);
        }

        UserRecord author = message.authorId == null ? null : store.getUser(message.authorId).orElse(null);
        Eligibility decision = evaluator.evaluate(message, author, starboard, points, live);
        reportRegexFailures(guildId, starboard, live, decision);

        // 4) keep points visible even if the remote step below fails
        if (link != null) store.setPoints(link.id, points);
        if (!message.frozen) store.setMessagePoints(message.id, points);

        ConsoleLog.debug(TAG, () -> "guildId=" + guildId + " msg=" + message.id + " starboard=" + starboard.id
                + " points=" + points + " add=" + decision.add() + " delete=" + decision.delete()
                + " forced=" + decision.forced() + " frozen=" + decision.frozen()
                + " link=" + (link == null ? "none" : link.id) + " live=" + (live != null));

        // 5) transition
        if (decision.delete()) {
            if (link != null) removeMirror(guildId, starboard, link, points);
            return;
        }

        String text = plainText(guildId, message, starboard, points, decision);

        if (link == null) {
            if (decision.add() && live != null) createMirror(guildId, message, starboard, live, text, points);
            return;
        }

        MirrorContent content = (live != null && starboard.linkEdits) ? renderer.render(live, starboard) : null;
        try {
            channel.edit(starboard.id, link.id, text, content);
        } catch (RemoteNotFoundException e) {
            // next pass drops the link in step 1
            ConsoleLog.debug(TAG, "Mirror " + link.id + " vanished during edit: " + e.getMessage());
        } catch (PermissionDeniedException e) {
            notifier.notify(guildId, Severity.ERROR,
                    "I tried to update a starboard message in <#" + starboard.id + ">, but I'm missing the `"
                            + e.getPermission() + "` permission.");
        }
    }

    /** Trashed messages are suppressed everywhere: their mirrors are removed whatever the score. */
    public void removeTrashed(long guildId, MessageRecord message, StarboardConfig starboard) {
        Optional<StarboardMessageRecord> link = store.getStarboardMessage(message.id, starboard.id);
        if (link.isEmpty()) return;

        StarboardMessageRecord l = link.get();
        ConsoleLog.info(TAG, "guildId=" + guildId + " msg=" + message.id + " is trashed; removing mirror " + l.id);
        removeMirror(guildId, starboard, l, l.points == null ? 0 : l.points);
    }

    /** The text line above the mirrored embed: emoji, score, source channel and override markers. */
    public String plainText(long guildId, MessageRecord message, StarboardConfig starboard, int points, Eligibility decision) {
        return plainText(guildId, message.channelId, starboard, points, decision.forced(), decision.frozen());
    }

    public String plainText(long guildId, long sourceChannelId, StarboardConfig starboard, int points,
                            boolean forced, boolean frozen) {
        String emoji = renderer.displayEmoji(guildId, starboard.displayEmoji);
        return "**" + emoji + " " + points + " | <#" + sourceChannelId + ">**"
                + (forced ? " 🔒" : "")
                + (frozen ? " ❄️" : "");
    }

    // ----------------------------
    // Steps
    // ----------------------------

    private StarboardMessageRecord resolveLink(long guildId, MessageRecord message, StarboardConfig starboard) {
        StarboardMessageRecord link = store.getStarboardMessage(message.id, starboard.id).orElse(null);
        if (link == null) return null;

        if (cache.fetchMessage(guildId, starboard.id, link.id).isPresent()) return link;

        ConsoleLog.info(TAG, "guildId=" + guildId + " mirror " + link.id + " of msg=" + message.id
                + " is gone from <#" + starboard.id + ">; dropping link");
        store.deleteStarboardMessage(link.id);
        return null;
    }

    private void removeMirror(long guildId, StarboardConfig starboard, StarboardMessageRecord link, int points) {
        store.deleteStarboardMessage(link.id);
        try {
            channel.delete(starboard.id, link.id);
            ConsoleLog.info(TAG, "guildId=" + guildId + " removed mirror " + link.id + " of msg=" + link.origId);
        } catch (RemoteNotFoundException e) {
            ConsoleLog.debug(TAG, "Mirror " + link.id + " was already deleted");
        } catch (PermissionDeniedException e) {
            // put the link back so the mirror is not orphaned
            store.createStarboardMessage(link.id, link.origId, link.starboardId);
            store.setPoints(link.id, points);
            notifier.notify(guildId, Severity.ERROR,
                    "I tried to remove a message from <#" + starboard.id + ">, but I'm missing the `"
                            + e.getPermission() + "` permission.");
        }
    }

    private void createMirror(long guildId, MessageRecord message, StarboardConfig starboard,
                              LiveMessage live, String text, int points) {
        MirrorContent content = renderer.render(live, starboard);

        long mirrorId;
        try {
            mirrorId = channel.send(starboard.id, text, content);
        } catch (PermissionDeniedException e) {
            notifier.notify(guildId, Severity.ERROR,
                    "I tried to send a starboard message to <#" + starboard.id + ">, but I'm missing the `"
                            + e.getPermission() + "` permission. Please make sure I have the "
                            + "`Send Messages` and `Embed Links` permissions.");
            return;
        }

        store.createStarboardMessage(mirrorId, message.id, starboard.id);
        store.setPoints(mirrorId, points);
        ConsoleLog.info(TAG, "guildId=" + guildId + " mirrored msg=" + message.id + " -> " + mirrorId
                + " on starboard=" + starboard.id + " points=" + points);

        if (!starboard.autoreact) return;

        for (String emoji : starboard.starEmojis) {
            try {
                channel.react(starboard.id, mirrorId, emoji);
            } catch (PermissionDeniedException e) {
                notifier.notify(guildId, Severity.ERROR,
                        "I tried to autoreact to a message on <#" + starboard.id + ">, but I'm missing the `"
                                + e.getPermission() + "` permission. If you don't want me to autoreact, "
                                + "run `/starboard set` with `autoreact` set to `false`.");
            } catch (RemoteNotFoundException e) {
                ConsoleLog.warn(TAG, "Mirror " + mirrorId + " vanished while autoreacting; stopping");
                return;
            }
        }
    }

    private void reportRegexFailures(long guildId, StarboardConfig starboard, LiveMessage live, Eligibility decision) {
        for (Eligibility.RegexFailure f : decision.regexFailures()) {
            String where = live == null ? "a message" : "[a message](" + live.jumpUrl() + ")";
            String which = f.exclude() ? "exclude regex" : "regex";
            String msg = f.outcome() == RegexOutcome.TIMED_OUT
                    ? "I tried to match the " + which + " `" + f.pattern() + "` of <#" + starboard.id + "> to "
                    + where + ", but it took too long. Try improving the efficiency of your regex."
                    : "The " + which + " `" + f.pattern() + "` of <#" + starboard.id + "> is not a valid pattern, "
                    + "so " + where + " was kept off the starboard.";
            notifier.notify(guildId, Severity.ERROR, msg);
        }
    }
}
