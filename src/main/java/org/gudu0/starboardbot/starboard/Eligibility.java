package org.gudu0.starboardbot.starboard;

import java.util.List;

/**
 * What should happen to a message's mirror on one starboard.
 *
 * @param regexFailures patterns that timed out or failed to compile, to be reported
 */
public record Eligibility(boolean add, boolean delete, boolean forced, boolean frozen, List<RegexFailure> regexFailures) {

    public Eligibility {
        regexFailures = List.copyOf(regexFailures);
    }

    public record RegexFailure(String pattern, RegexOutcome outcome, boolean exclude) {}
}
