package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.store.MessageRecord;
import org.gudu0.starboardbot.store.ReactionRecord;
import org.gudu0.starboardbot.store.StarboardConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PointCalculatorTest {

    private static final long AUTHOR = 10;

    private final PointCalculator calculator = new PointCalculator();

    private static MessageRecord message() {
        return new MessageRecord(1, 100, 200, AUTHOR, false);
    }

    private static StarboardConfig starboard(String... emojis) {
        StarboardConfig s = new StarboardConfig(300, 100);
        s.starEmojis = new ArrayList<>(List.of(emojis));
        return s;
    }

    private static ReactionRecord reaction(long id, String emoji, Long... users) {
        ReactionRecord r = new ReactionRecord(id, 1, emoji);
        r.userIds.addAll(Arrays.asList(users));
        return r;
    }

    @Test
    void userReactingWithSeveralStarEmojiShouldCountOnce() {
        StarboardConfig sb = starboard("⭐", "🌟");
        List<ReactionRecord> reactions = List.of(
                reaction(1, "⭐", 20L, 21L),
                reaction(2, "🌟", 20L, 22L)
        );

        assertEquals(3, calculator.calculate(message(), reactions, sb));
    }

    @Test
    void reactionsWithOtherEmojiShouldNotCount() {
        StarboardConfig sb = starboard("⭐");
        List<ReactionRecord> reactions = List.of(
                reaction(1, "⭐", 20L),
                reaction(2, "👍", 21L, 22L, 23L)
        );

        assertEquals(1, calculator.calculate(message(), reactions, sb));
    }

    @Test
    void authorShouldOnlyCountWhenSelfStarIsAllowed() {
        StarboardConfig sb = starboard("⭐");
        List<ReactionRecord> reactions = List.of(reaction(1, "⭐", AUTHOR, 20L));

        assertEquals(1, calculator.calculate(message(), reactions, sb));

        sb.selfStar = true;
        assertEquals(2, calculator.calculate(message(), reactions, sb));
    }

    @Test
    void deletedUsersShouldNeverCount() {
        StarboardConfig sb = starboard("⭐");
        List<ReactionRecord> reactions = List.of(reaction(1, "⭐", null, 20L, null));

        assertEquals(1, calculator.calculate(message(), reactions, sb));
    }

    @Test
    void reactionOrderShouldNotMatter() {
        StarboardConfig sb = starboard("⭐", "🌟", "1234567890");
        List<ReactionRecord> reactions = new ArrayList<>(List.of(
                reaction(1, "⭐", 20L, 21L),
                reaction(2, "🌟", 21L, 22L),
                reaction(3, "1234567890", 22L, 23L, AUTHOR)
        ));
        int before = calculator.calculate(message(), reactions, sb);

        Collections.reverse(reactions);
        assertEquals(before, calculator.calculate(message(), reactions, sb));
        assertEquals(4, before);
    }

    @Test
    void unknownAuthorShouldLetEveryReactorCount() {
        MessageRecord m = message();
        m.authorId = null;

        assertEquals(2, calculator.calculate(m, List.of(reaction(1, "⭐", AUTHOR, 20L)), starboard("⭐")));
    }

    @Test
    void noReactionsShouldScoreZero() {
        assertEquals(0, calculator.calculate(message(), List.of(), starboard("⭐")));
    }
}
