package org.gudu0.starboardbot.store;

/** Per (user, guild) star counters. Updated as a side effect of reactions, never read by the engine. */
public class MemberRecord {
    public long userId;
    public long guildId;

    public long starsGiven = 0;
    public long starsReceived = 0;

    public long xp = 0;
    public int level = 0;

    public MemberRecord() {}

    public MemberRecord(long userId, long guildId) {
        this.userId = userId;
        this.guildId = guildId;
    }

    public static String key(long userId, long guildId) {
        return guildId + ":" + userId;
    }

    /** Adds (or with a negative delta, takes back) received stars. */
    public void onStarsReceived(int delta) {
        starsReceived = Math.max(0, starsReceived + delta);
    }

    /** One star is one xp; the level is recomputed from the total. */
    public void onXp(int delta) {
        xp = Math.max(0, xp + delta);
        level = (int) Math.floor(Math.sqrt(xp / 10.0));
    }

    public void onStarsGiven(int delta) {
        starsGiven = Math.max(0, starsGiven + delta);
    }

    public MemberRecord copy() {
        MemberRecord m = new MemberRecord(userId, guildId);
        m.starsGiven = starsGiven;
        m.starsReceived = starsReceived;
        m.xp = xp;
        m.level = level;
        return m;
    }
}
