package com.tonindexer.domain;

import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

/**
 * TON account address. Canonical string form is the raw form {@code <workchain>:<HEX>} with upper-case hex,
 * which is what the action store and downstream queries key on.
 */
public record AccountId(int workchain, String hash) {

    private static final int HASH_HEX_LENGTH = 64;
    private static final int FRIENDLY_LENGTH = 48;

    public AccountId {
        if (hash == null || hash.length() != HASH_HEX_LENGTH) {
            throw new IllegalArgumentException("Account hash must be 64 hex chars: " + hash);
        }
        try {
            HexFormat.of().parseHex(hash);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Account hash is not hex: " + hash, e);
        }
        hash = hash.toUpperCase(Locale.ROOT);
    }

    /**
     * Parse raw ({@code 0:abc…}) or user-friendly (48 chars, base64/base64url) address.
     */
    public static AccountId of(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address must not be blank");
        }
        String trimmed = address.trim();
        int colon = trimmed.indexOf(':');
        if (colon > 0) {
            int workchain = Integer.parseInt(trimmed.substring(0, colon));
            return new AccountId(workchain, trimmed.substring(colon + 1));
        }
        if (trimmed.length() == FRIENDLY_LENGTH) {
            return fromFriendly(trimmed);
        }
        throw new IllegalArgumentException("Unrecognised address format: " + address);
    }

    private static AccountId fromFriendly(String friendly) {
        byte[] bytes = Base64.getDecoder().decode(friendly.replace('-', '+').replace('_', '/'));
        int expectedCrc = ((bytes[34] & 0xff) << 8) | (bytes[35] & 0xff);
        if (crc16(bytes, 34) != expectedCrc) {
            throw new IllegalArgumentException("Bad address checksum: " + friendly);
        }
        byte[] hash = new byte[32];
        System.arraycopy(bytes, 2, hash, 0, 32);
        return new AccountId(bytes[1], HexFormat.of().formatHex(hash));
    }

    /** CRC16/XMODEM over the first {@code length} bytes. */
    private static int crc16(byte[] data, int length) {
        int crc = 0;
        for (int i = 0; i < length; i++) {
            crc ^= (data[i] & 0xff) << 8;
            for (int bit = 0; bit < 8; bit++) {
                crc = (crc & 0x8000) != 0 ? (crc << 1) ^ 0x1021 : crc << 1;
            }
        }
        return crc & 0xffff;
    }

    public String asString() {
        return workchain + ":" + hash;
    }

    @Override
    public String toString() {
        return asString();
    }
}
