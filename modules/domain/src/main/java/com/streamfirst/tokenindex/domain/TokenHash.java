package com.streamfirst.tokenindex.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * SHA-256 digest of a token number, as 64 lower-case hex characters.
 *
 * <p>The digest input is the UTF-8 encoding of the number's decimal string (no padding, no sign),
 * so {@code of(1)} hashes the single byte {@code '1'}.
 *
 * @param hex the 64-character lower-case hex digest
 */
public record TokenHash(String hex) {

    /** Length of the hex digest. */
    public static final int HEX_LENGTH = 64;

    private static final HexFormat HEX = HexFormat.of();

    private static final ThreadLocal<MessageDigest> SHA256 =
            ThreadLocal.withInitial(TokenHash::newSha256);

    public TokenHash {
        Objects.requireNonNull(hex, "Token hash cannot be null");
        if (!isHex64(hex)) {
            throw new IllegalArgumentException("Token hash must be 64 hex characters: " + hex);
        }
        hex = hex.toLowerCase();
    }

    /** Derives the hash of a token number. */
    public static TokenHash of(long number) {
        MessageDigest digest = SHA256.get();
        byte[] out = digest.digest(Long.toString(number).getBytes(StandardCharsets.UTF_8));
        return new TokenHash(HEX.formatHex(out));
    }

    /** Parses a hex digest, accepting either case. */
    public static TokenHash parse(String hex) {
        return new TokenHash(hex);
    }

    /** True if {@code s} is exactly 64 hex characters (either case). */
    public static boolean isHex64(String s) {
        if (s == null || s.length() != HEX_LENGTH) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!isAsciiHex(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isAsciiHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /** The raw 32 digest bytes. */
    public byte[] bytes() {
        return HEX.parseHex(hex);
    }

    private static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return hex;
    }
}
