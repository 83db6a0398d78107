package org.gudu0.starboardbot.remote;

public enum Severity {
    INFO("Info"),
    ERROR("Error");

    private final String title;

    Severity(String title) {
        this.title = title;
    }

    public String title() {
        return title;
    }
}
