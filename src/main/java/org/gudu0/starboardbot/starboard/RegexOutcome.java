package org.gudu0.starboardbot.starboard;

public enum RegexOutcome {
    MATCHED,
    NOT_MATCHED,
    /** The match ran past the time bound and was aborted. */
    TIMED_OUT,
    /** The pattern does not compile. */
    INVALID
}
