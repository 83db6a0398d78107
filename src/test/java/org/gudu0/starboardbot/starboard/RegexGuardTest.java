package org.gudu0.starboardbot.starboard;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.regex.PatternSyntaxException;

import static org.junit.jupiter.api.Assertions.*;

class RegexGuardTest {

    // O(n^4) on input without "=", far past any sane timeout at n=5000
    private static final String SLOW = ".*.*.*.*=";

    private final RegexGuard guard = new RegexGuard(Duration.ofMillis(250));

    @Test
    void matchesShouldFindPatternAnywhereInText() {
        assertEquals(RegexOutcome.MATCHED, guard.matches("look at my cat!", "cat"));
        assertEquals(RegexOutcome.NOT_MATCHED, guard.matches("look at my dog!", "cat"));
        assertEquals(RegexOutcome.NOT_MATCHED, guard.matches("look at my cat!", "^cat"));
    }

    @Test
    void nullTextShouldBehaveLikeEmpty() {
        assertEquals(RegexOutcome.MATCHED, guard.matches(null, "^$"));
        assertEquals(RegexOutcome.NOT_MATCHED, guard.matches(null, "x"));
    }

    @Test
    void invalidPatternShouldReturnInvalid() {
        assertEquals(RegexOutcome.INVALID, guard.matches("text", "(unclosed"));
    }

    @Test
    void polynomialBacktrackingShouldTimeOut() {
        RegexGuard fast = new RegexGuard(Duration.ofMillis(20));
        String evil = "a".repeat(5000);

        long start = System.nanoTime();
        assertEquals(RegexOutcome.TIMED_OUT, fast.matches(evil, SLOW));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toSeconds() < 5, "guard did not stop the match");
    }

    @Test
    void tinyTimeoutShouldTimeOutOnLargeInput() {
        RegexGuard tiny = new RegexGuard(Duration.ofNanos(1));
        assertEquals(RegexOutcome.TIMED_OUT, tiny.matches("x".repeat(1_000_000), "y"));
    }

    @Test
    void guardShouldStillWorkAfterATimeout() {
        RegexGuard fast = new RegexGuard(Duration.ofMillis(20));
        assertEquals(RegexOutcome.TIMED_OUT, fast.matches("a".repeat(5000), SLOW));
        assertEquals(RegexOutcome.MATCHED, fast.matches("aaa=", SLOW));
    }

    @Test
    void validateShouldThrowForBadPatterns() {
        assertDoesNotThrow(() -> RegexGuard.validate("(?i)star(board)?"));
        assertThrows(PatternSyntaxException.class, () -> RegexGuard.validate("[a-"));
    }

    @Test
    void nonPositiveTimeoutShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RegexGuard(Duration.ZERO));
    }
}
