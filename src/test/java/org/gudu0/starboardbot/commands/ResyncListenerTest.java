package org.gudu0.starboardbot.commands;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResyncListenerTest {

    @Test
    void parseIdShouldAcceptIdsAndMessageLinks() {
        assertEquals(123456789L, ResyncListener.parseId(" 123456789 "));
        assertEquals(333L, ResyncListener.parseId("https://discord.com/channels/111/222/333"));
        assertEquals(-1L, ResyncListener.parseId("not-an-id"));
    }
}
