package org.gudu0.starboardbot.store;

public class GuildRecord {
    public long id;

    public GuildRecord() {}

    public GuildRecord(long id) {
        this.id = id;
    }
}
