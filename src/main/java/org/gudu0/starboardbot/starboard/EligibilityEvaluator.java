package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.remote.LiveMessage;
import org.gudu0.starboardbot.store.MessageRecord;
import org.gudu0.starboardbot.store.StarboardConfig;
import org.gudu0.starboardbot.store.UserRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides add/delete for a (message, starboard) pair. No I/O.
 * <p>
 * Rules run in order and later rules win:
 * threshold, bot author, deleted source, NSFW, include regex, exclude regex, frozen, forced.
 * When both thresholds hold, removal wins. A regex that times out or does not compile
 * rejects the message whichever filter it belongs to.
 */
public class EligibilityEvaluator {

    private final RegexGuard regexGuard;

    public EligibilityEvaluator(RegexGuard regexGuard) {
        this.regexGuard = regexGuard;
    }

    /**
     * @param author the message author, or null when unknown (treated as not a bot)
     * @param live   the source message as it exists now, or null if it cannot be resolved
     */
    public Eligibility evaluate(MessageRecord message, UserRecord author, StarboardConfig starboard, int points, LiveMessage live) {
        List<Eligibility.RegexFailure> failures = new ArrayList<>();

        boolean delete = points <= starboard.requiredRemove;
        boolean add = !delete && points >= starboard.required;
        boolean forced = false;
        boolean frozen = false;

        if (!starboard.allowBots && author != null && author.bot) {
            delete = true;
            add = false;
        }

        if (starboard.linkDeletes && live == null) {
            delete = true;
            add = false;
        }

        if (message.nsfw && !starboard.allowNsfw) {
            add = false;
            delete = true;
        }

        if (live != null) {
            if (!isBlank(starboard.regex)) {
                RegexOutcome outcome = regexGuard.matches(live.content(), starboard.regex);
                if (outcome != RegexOutcome.MATCHED) {
                    add = false;
                    delete = true;
                }
                if (isFailure(outcome)) failures.add(new Eligibility.RegexFailure(starboard.regex, outcome, false));
            }
            if (!isBlank(starboard.excludeRegex)) {
                RegexOutcome outcome = regexGuard.matches(live.content(), starboard.excludeRegex);
                if (outcome != RegexOutcome.NOT_MATCHED) {
                    add = false;
                    delete = true;
                }
                if (isFailure(outcome)) failures.add(new Eligibility.RegexFailure(starboard.excludeRegex, outcome, true));
            }
        }

        if (message.frozen) {
            add = false;
            delete = false;
            frozen = true;
        }

        if (message.isForcedOn(starboard.id)) {
            add = true;
            delete = false;
            forced = true;
        }

        return new Eligibility(add, delete, forced, frozen, failures);
    }

    private static boolean isFailure(RegexOutcome outcome) {
        return outcome == RegexOutcome.TIMED_OUT || outcome == RegexOutcome.INVALID;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
