package org.gudu0.starboardbot.store;

/** Link between a source message and its mirror on one starboard. Keyed by the mirror's message id. */
public class StarboardMessageRecord {
    public long id;
    public long origId;
    public long starboardId;

    public Integer points = null;

    public StarboardMessageRecord() {}

    public StarboardMessageRecord(long id, long origId, long starboardId) {
        this.id = id;
        this.origId = origId;
        this.starboardId = starboardId;
    }

    public StarboardMessageRecord copy() {
        StarboardMessageRecord r = new StarboardMessageRecord(id, origId, starboardId);
        r.points = points;
        return r;
    }
}
