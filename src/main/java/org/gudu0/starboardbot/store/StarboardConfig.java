package org.gudu0.starboardbot.store;

import java.util.ArrayList;
import java.util.List;

/**
 * One starboard, keyed by the id of the channel mirrors are posted to.
 * <p>
 * {@code requiredRemove < required} is expected but not enforced; when it does not hold,
 * removal wins (see {@code EligibilityEvaluator}).
 */
public class StarboardConfig {
    public long id;
    public long guildId;

    /** Points needed before a message is mirrored. */
    public int required = 3;

    /** At or below this many points an existing mirror is removed. May be zero or negative. */
    public int requiredRemove = 0;

    public boolean selfStar = false;
    public boolean allowBots = true;
    public boolean allowNsfw = false;

    /** Re-render the mirror when the source message is edited. */
    public boolean linkEdits = true;

    /** Remove the mirror when the source message is deleted. */
    public boolean linkDeletes = false;

    /** Unicode emoji as the character, custom emoji as their numeric id. Treated as a set. */
    @SuppressWarnings("CanBeFinal")
    public List<String> starEmojis = new ArrayList<>(List.of("⭐"));

    public String displayEmoji = "⭐";

    /** RGB embed color; null means the bot's theme color. */
    public Integer color = null;

    /** Only mirror messages matching this pattern. Empty disables the filter. */
    public String regex = "";

    /** Never mirror messages matching this pattern. Empty disables the filter. */
    public String excludeRegex = "";

    /** React to new mirrors with every star emoji. */
    public boolean autoreact = true;

    /** Stars here count toward the reactor's stars given. */
    public boolean star = true;

    /** Stars here count toward the author's stars received. */
    public boolean recvStar = true;

    /** Stars here earn the author xp. */
    public boolean xp = true;

    /** Removing a star takes the member counters back. */
    public boolean unstar = true;

    /** Mirrors here can be picked by /random. */
    public boolean explore = true;

    public StarboardConfig() {}

    public StarboardConfig(long id, long guildId) {
        this.id = id;
        this.guildId = guildId;
    }

    public boolean isStarEmoji(String emoji) {
        return emoji != null && starEmojis.contains(emoji);
    }

    public StarboardConfig copy() {
        StarboardConfig c = new StarboardConfig(id, guildId);
        c.required = required;
        c.requiredRemove = requiredRemove;
        c.selfStar = selfStar;
        c.allowBots = allowBots;
        c.allowNsfw = allowNsfw;
        c.linkEdits = linkEdits;
        c.linkDeletes = linkDeletes;
        c.starEmojis = new ArrayList<>(starEmojis);
        c.displayEmoji = displayEmoji;
        c.color = color;
        c.regex = regex;
        c.excludeRegex = excludeRegex;
        c.autoreact = autoreact;
        c.star = star;
        c.recvStar = recvStar;
        c.xp = xp;
        c.unstar = unstar;
        c.explore = explore;
        return c;
    }
}
