package com.puzzlenft.puzzleservice.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Opaque fixed-width account reference. Only equality is meaningful.
 */
public final class Identity {

    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private Identity(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Identity of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Identity must be exactly " + LENGTH + " bytes");
        }
        return new Identity(bytes.clone());
    }

    /**
     * Parse the 64-character hex form used in attributes and tokens.
     */
    public static Identity fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Invalid identity: " + hex);
        }
        try {
            return new Identity(HEX.parseHex(hex.toLowerCase()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid identity: " + hex, e);
        }
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(bytes, ((Identity) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
