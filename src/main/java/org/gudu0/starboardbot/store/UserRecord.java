package org.gudu0.starboardbot.store;

public class UserRecord {
    public long id;
    public boolean bot;

    public UserRecord() {}

    public UserRecord(long id, boolean bot) {
        this.id = id;
        this.bot = bot;
    }

    public UserRecord copy() {
        return new UserRecord(id, bot);
    }
}
