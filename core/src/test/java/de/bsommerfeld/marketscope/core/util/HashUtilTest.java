package de.bsommerfeld.marketscope.core.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HashUtilTest {

    @Test
    void sha256_shouldMatchKnownDigestOfEmptyInput() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                HashUtil.sha256(new byte[0]));
    }

    @Test
    void sha256_shouldMatchKnownDigestOfAbc() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                HashUtil.sha256("abc"));
    }

    @Test
    void sha256_shouldTreatStringAsUtf8() {
        String text = "Übernahme";
        assertEquals(HashUtil.sha256(text.getBytes(StandardCharsets.UTF_8)), HashUtil.sha256(text));
    }

    @Test
    void sha256_shouldProduceLowercaseHex() {
        String digest = HashUtil.sha256("MarketScope");
        assertEquals(64, digest.length());
        assertTrue(digest.matches("[0-9a-f]+"));
    }
}
