package com.streamfirst.tokenindex.domain;

import java.util.Arrays;
import java.util.Comparator;

/**
 * The four token issuance tiers. Each level admits token numbers in {@code [1, limit]}.
 *
 * <p>Ranges overlap: every number of level 4 is also a legal number of levels 1 to 3. Since the
 * token hash depends on the number only, one hash stands for the same number on every level that
 * contains it.
 */
public enum TokenLevel {
    LEVEL_1(1, 4_300_000L),
    LEVEL_2(2, 2_425_000L),
    LEVEL_3(3, 2_303_750L),
    LEVEL_4(4, 2_188_563L);

    private final int code;
    private final long limit;

    TokenLevel(int code, long limit) {
        this.code = code;
        this.limit = limit;
    }

    /** Numeric level code as it appears in token content (1 to 4). */
    public int code() {
        return code;
    }

    /** Highest legal token number on this level. */
    public long limit() {
        return limit;
    }

    /** True if {@code 1 <= number <= limit()}. */
    public boolean contains(long number) {
        return number >= 1 && number <= limit;
    }

    /**
     * Resolves a level code.
     *
     * @throws IllegalArgumentException if the code is not 1 to 4
     */
    public static TokenLevel of(int code) {
        for (TokenLevel level : values()) {
            if (level.code == code) {
                return level;
            }
        }
        throw new IllegalArgumentException("Invalid token level " + code + ", must be 1-4");
    }

    /** True if {@code code} names one of the four levels. */
    public static boolean isValidCode(int code) {
        return code >= 1 && code <= values().length;
    }

    /**
     * The level recorded in the hash index for a number: the highest level whose range still
     * contains it. Numbers up to level 4's limit map to level 4, numbers beyond level 2's limit map
     * to level 1.
     *
     * @throws IllegalArgumentException if no level contains the number
     */
    public static TokenLevel canonicalLevelOf(long number) {
        return Arrays.stream(values())
                .filter(level -> level.contains(number))
                .max(Comparator.comparingInt(TokenLevel::code))
                .orElseThrow(
                        () -> new IllegalArgumentException("Token number out of every level: " + number));
    }

    /** The largest limit over all levels. */
    public static long maxLimit() {
        return Arrays.stream(values()).mapToLong(TokenLevel::limit).max().orElse(0);
    }

    @Override
    public String toString() {
        return "L" + code;
    }
}
