package de.htwsaar.minioffline.common.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public final class Sha256Util {

    private Sha256Util() {}

    public static String sha256Hex(byte[] data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(data != null ? data : new byte[0]);
            return toHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute SHA-256", e);
        }
    }

    /**
     * Prüft, ob {@code data} zum erwarteten Hash passt (Groß-/Kleinschreibung egal).
     *
     * @param data     Daten
     * @param expected erwarteter Hex-Hash
     * @return {@code true} bei Übereinstimmung
     */
    public static boolean matches(byte[] data, String expected) {
        return expected != null && expected.equalsIgnoreCase(sha256Hex(data));
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
