package org.gudu0.starboardbot.starboard;

/** Thrown from inside a running match once its deadline passes. Never escapes {@link RegexGuard}. */
class PatternTimeoutException extends RuntimeException {
    PatternTimeoutException(String pattern, long timeoutMillis) {
        super("Pattern exceeded " + timeoutMillis + "ms: " + pattern, null, false, false);
    }
}
