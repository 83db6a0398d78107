package org.gudu0.starboardbot.store;

import java.util.HashMap;
import java.util.Map;

/** Root of data/global/starboard.json. Only {@link JsonStarboardStore} touches this. */
@SuppressWarnings("CanBeFinal")
public class StarboardData {
    public Map<Long, GuildRecord> guilds = new HashMap<>();
    public Map<Long, UserRecord> users = new HashMap<>();

    // "guildId:userId" -> member
    public Map<String, MemberRecord> members = new HashMap<>();

    // starboard channel id -> config
    public Map<Long, StarboardConfig> starboards = new HashMap<>();

    public Map<Long, MessageRecord> messages = new HashMap<>();

    // mirror message id -> link
    public Map<Long, StarboardMessageRecord> starboardMessages = new HashMap<>();

    public Map<Long, ReactionRecord> reactions = new HashMap<>();

    public long nextReactionId = 1;
}
