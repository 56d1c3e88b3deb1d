package com.streamfirst.tokenindex.domain;

import java.util.Objects;

/**
 * The string published on the storage network for one token: three ASCII digits holding the
 * zero-padded level code, followed by the 64 hex characters of {@link TokenHash#of(long)}.
 *
 * <p>Example for level 3, number 1423543:
 * {@code 003841d04a85612adb1ca95d86e08561eb1dcc9608899a57b59d57c565d796bb106}.
 *
 * <p>Decoding keeps the level code as read, even when it names no level (for example {@code
 * 007}); deciding whether the code is legal is the validator's job.
 *
 * @param levelCode the level code as read from the first three characters (0 to 999)
 * @param hash the token hash
 */
public record TokenContent(int levelCode, TokenHash hash) {

    /** Width of the zero-padded level prefix. */
    public static final int LEVEL_WIDTH = 3;

    /** Total encoded length. */
    public static final int LENGTH = LEVEL_WIDTH + TokenHash.HEX_LENGTH;

    public TokenContent {
        Objects.requireNonNull(hash, "Token hash cannot be null");
        if (levelCode < 0 || levelCode > 999) {
            throw new IllegalArgumentException("Level code must fit three digits: " + levelCode);
        }
    }

    /** Derives the canonical content of a token. */
    public static TokenContent of(TokenKey key) {
        return new TokenContent(key.level().code(), TokenHash.of(key.number()));
    }

    /**
     * Parses published content. Surrounding whitespace is ignored; hex digits of either case are
     * accepted.
     *
     * @throws DecodeException if the input is not three digits followed by 64 hex characters
     */
    public static TokenContent decode(String raw) {
        if (raw == null) {
            throw new DecodeException("Token content is null", null);
        }
        String content = raw.strip();
        if (content.length() != LENGTH) {
            throw new DecodeException(
                    "Token content must be " + LENGTH + " characters, got " + content.length(), raw);
        }
        int levelCode = 0;
        for (int i = 0; i < LEVEL_WIDTH; i++) {
            char c = content.charAt(i);
            if (c < '0' || c > '9') {
                throw new DecodeException("Level prefix must be three ASCII digits", raw);
            }
            levelCode = levelCode * 10 + (c - '0');
        }
        String hex = content.substring(LEVEL_WIDTH);
        if (!TokenHash.isHex64(hex)) {
            throw new DecodeException("Token hash must be 64 hex characters", raw);
        }
        return new TokenContent(levelCode, TokenHash.parse(hex));
    }

    /** True if the level code names one of the four levels. */
    public boolean hasValidLevel() {
        return TokenLevel.isValidCode(levelCode);
    }

    /**
     * The level named by the prefix.
     *
     * @throws IllegalArgumentException if the code names no level
     */
    public TokenLevel level() {
        return TokenLevel.of(levelCode);
    }

    /** The canonical 67-character encoding. */
    public String encoded() {
        return String.format("%03d%s", levelCode, hash.hex());
    }

    /** True if {@code raw} is exactly the canonical encoding of this content. */
    public boolean isCanonical(String raw) {
        return encoded().equals(raw);
    }

    @Override
    public String toString() {
        return encoded();
    }
}
