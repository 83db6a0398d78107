package org.gudu0.starboardbot.starboard;

import org.gudu0.starboardbot.util.ConsoleLog;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Runs user supplied patterns with a hard time bound.
 * <p>
 * The matcher reads its input through a {@link CharSequence} that checks the deadline on
 * every character access, so catastrophic backtracking aborts on the calling thread
 * instead of pinning it.
 */
public class RegexGuard {

    private static final int MAX_CACHED_PATTERNS = 256;

    private final long timeoutNanos;
    private final long timeoutMillis;
    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    public RegexGuard(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.timeoutNanos = timeout.toNanos();
        this.timeoutMillis = timeout.toMillis();
    }

    /** Finds {@code pattern} anywhere in {@code text}. */
    public RegexOutcome matches(String text, String pattern) {
        Pattern p;
        try {
            p = compile(pattern);
        } catch (PatternSyntaxException e) {
            ConsoleLog.debug("RegexGuard", "Invalid pattern " + pattern + ": " + e.getDescription());
            return RegexOutcome.INVALID;
        }

        CharSequence input = new DeadlineCharSequence(text == null ? "" : text, System.nanoTime() + timeoutNanos, pattern);
        try {
            return p.matcher(input).find() ? RegexOutcome.MATCHED : RegexOutcome.NOT_MATCHED;
        } catch (PatternTimeoutException e) {
            ConsoleLog.warn("RegexGuard", e.getMessage());
            return RegexOutcome.TIMED_OUT;
        } catch (StackOverflowError e) {
            // deep recursion in the regex engine is the same failure as running too long
            ConsoleLog.warn("RegexGuard", "Pattern overflowed the stack: " + pattern);
            return RegexOutcome.TIMED_OUT;
        }
    }

    /** Throws {@link PatternSyntaxException} for an unusable pattern. */
    public static void validate(String pattern) {
        Pattern.compile(pattern);
    }

    private Pattern compile(String pattern) {
        Pattern p = compiled.get(pattern);
        if (p != null) return p;

        p = Pattern.compile(pattern);
        if (compiled.size() >= MAX_CACHED_PATTERNS) compiled.clear();
        compiled.put(pattern, p);
        return p;
    }

    private final class DeadlineCharSequence implements CharSequence {
        private final CharSequence inner;
        private final long deadline;
        private final String pattern;

        DeadlineCharSequence(CharSequence inner, long deadline, String pattern) {
            this.inner = inner;
            this.deadline = deadline;
            this.pattern = pattern;
        }

        @Override
        public char charAt(int index) {
            if (System.nanoTime() - deadline > 0) {
                throw new PatternTimeoutException(pattern, timeoutMillis);
            }
            return inner.charAt(index);
        }

        @Override
        public int length() {
            return inner.length();
        }

        @Override
        public CharSequence subSequence(int start, int end) {
            return new DeadlineCharSequence(inner.subSequence(start, end), deadline, pattern);
        }

        @Override
        public String toString() {
            return inner.toString();
        }
    }
}
