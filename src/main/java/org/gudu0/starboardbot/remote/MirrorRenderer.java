package org.gudu0.starboardbot.remote;

import org.gudu0.starboardbot.store.StarboardConfig;

public interface MirrorRenderer {

    MirrorContent render(LiveMessage message, StarboardConfig starboard);

    /** Turns a stored emoji token into something that displays in a message (custom emoji become mentions). */
    String displayEmoji(long guildId, String token);
}
