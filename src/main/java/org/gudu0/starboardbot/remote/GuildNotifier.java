package org.gudu0.starboardbot.remote;

/** Operator-facing notices for a guild. Fire and forget: never throws into the caller. */
@FunctionalInterface
public interface GuildNotifier {
    void notify(long guildId, Severity severity, String message);
}
