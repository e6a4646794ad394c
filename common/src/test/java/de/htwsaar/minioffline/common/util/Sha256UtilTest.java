package de.htwsaar.minioffline.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class Sha256UtilTest {

    private static final String ABC = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    void hashesKnownVector() {
        assertEquals(ABC, Sha256Util.sha256Hex("abc".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void nullIsHashedAsEmpty() {
        assertEquals(Sha256Util.sha256Hex(new byte[0]), Sha256Util.sha256Hex(null));
    }

    @Test
    void matchesIgnoresCase() {
        byte[] abc = "abc".getBytes(StandardCharsets.UTF_8);
        assertTrue(Sha256Util.matches(abc, ABC.toUpperCase()));
        assertFalse(Sha256Util.matches(abc, null));
        assertFalse(Sha256Util.matches(abc, "00"));
    }
}
