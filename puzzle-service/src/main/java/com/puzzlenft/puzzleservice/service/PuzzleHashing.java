package com.puzzlenft.puzzleservice.service;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Hash helpers shared by the generators, the verifier and the authority derivation
 */
public final class PuzzleHashing {

    static final int ITERATED_ROUNDS = 3;
    static final int SEED_PREFIX_LENGTH = 4;

    private static final HexFormat HEX = HexFormat.of();

    private PuzzleHashing() {
    }

    /**
     * Three rounds of {@code x -> x * 31 + 17} with 64-bit wrap-around, as unsigned lowercase hex.
     */
    static String iteratedHash(long value) {
        long hash = value;
        for (int i = 0; i < ITERATED_ROUNDS; i++) {
            hash = hash * 31 + 17;
        }
        return Long.toHexString(hash);
    }

    public static byte[] sha256(byte[]... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (byte[] part : parts) {
                digest.update(part);
            }
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static byte[] bigEndian(long value) {
        return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    }

    static byte[] littleEndian(long value) {
        return ByteBuffer.allocate(Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(value).array();
    }

    static String toHex(byte[] bytes) {
        return HEX.formatHex(bytes);
    }

    static byte[] fromHex(String hex) {
        return HEX.parseHex(hex);
    }

    static boolean isLowerHex(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
                return false;
            }
        }
        return true;
    }
}
