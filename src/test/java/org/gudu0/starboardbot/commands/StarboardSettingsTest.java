package org.gudu0.starboardbot.commands;

import org.gudu0.starboardbot.store.StarboardConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StarboardSettingsTest {

    private final StarboardConfig cfg = new StarboardConfig(300, 100);

    @Test
    void numbersShouldBeParsedAndBounded() {
        assertEquals("required=5", StarboardSettings.apply(cfg, "required", " 5 "));
        assertEquals(5, cfg.required);

        StarboardSettings.apply(cfg, "required-remove", "-1");
        assertEquals(-1, cfg.requiredRemove);

        assertThrows(IllegalArgumentException.class, () -> StarboardSettings.apply(cfg, "required", "five"));
        assertThrows(IllegalArgumentException.class, () -> StarboardSettings.apply(cfg, "required", "501"));
    }

    @Test
    void booleansShouldAcceptCommonSpellings() {
        StarboardSettings.apply(cfg, "self-star", "yes");
        assertTrue(cfg.selfStar);
        StarboardSettings.apply(cfg, "allow-bots", "off");
        assertFalse(cfg.allowBots);
        StarboardSettings.apply(cfg, "link-deletes", "TRUE");
        assertTrue(cfg.linkDeletes);

        assertThrows(IllegalArgumentException.class, () -> StarboardSettings.apply(cfg, "autoreact", "maybe"));
    }

    @Test
    void customEmojiMentionsShouldBeStoredById() {
        StarboardSettings.apply(cfg, "emojis", "⭐ <:pog:123456789> <a:spin:987654321> ⭐");

        assertEquals(List.of("⭐", "123456789", "987654321"), cfg.starEmojis);
        assertTrue(cfg.isStarEmoji("123456789"));
    }

    @Test
    void displayEmojiShouldBeExactlyOne() {
        StarboardSettings.apply(cfg, "display-emoji", "<:pog:123456789>");
        assertEquals("123456789", cfg.displayEmoji);

        assertThrows(IllegalArgumentException.class, () -> StarboardSettings.apply(cfg, "display-emoji", "⭐ 🌟"));
        assertThrows(IllegalArgumentException.class, () -> StarboardSettings.apply(cfg, "emojis", "   "));
    }

    @Test
    void colorShouldBeHexOrDefault() {
        assertEquals("color=#FF0000", StarboardSettings.apply(cfg, "color", "#ff0000"));
        assertEquals(0xFF0000, cfg.color);

        StarboardSettings.apply(cfg, "color", "default");
        assertNull(cfg.color);

        assertThrows(IllegalArgumentException.class, () -> StarboardSettings.apply(cfg, "color", "red"));
    }

    @Test
    void regexShouldBeCompileChecked() {
        StarboardSettings.apply(cfg, "regex", "(?i)cat");
        assertEquals("(?i)cat", cfg.regex);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> StarboardSettings.apply(cfg, "exclude-regex", "([a-"));
        assertTrue(e.getMessage().startsWith("exclude-regex is not a valid pattern"));
        assertEquals("", cfg.excludeRegex);

        StarboardSettings.apply(cfg, "regex", "none");
        assertEquals("", cfg.regex);
    }

    @Test
    void memberCounterFlagsShouldParse() {
        assertEquals("recv-star=false", StarboardSettings.apply(cfg, "recv-star", "off"));
        StarboardSettings.apply(cfg, "unstar", "no");
        StarboardSettings.apply(cfg, "explore", "false");

        assertFalse(cfg.recvStar);
        assertFalse(cfg.unstar);
        assertFalse(cfg.explore);
        assertTrue(cfg.xp);
        assertTrue(cfg.copy().star);
        assertFalse(cfg.copy().unstar);
    }

    @Test
    void unknownKeyShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> StarboardSettings.apply(cfg, "nope", "1"));
    }

    @Test
    void everyKeyShouldDescribeItself() {
        for (String key : StarboardSettings.KEYS) {
            assertNotEquals("?", StarboardSettings.describe(cfg, key), key);
        }
    }
}
