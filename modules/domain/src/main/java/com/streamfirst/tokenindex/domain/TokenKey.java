package com.streamfirst.tokenindex.domain;

import java.util.Objects;

/**
 * Identifies one token: its issuance level and its number on that level.
 *
 * <p>A key is not required to be in range; callers that need a legal token check {@link
 * #isValid()}.
 *
 * @param level the issuance level
 * @param number the token number
 */
public record TokenKey(TokenLevel level, long number) {
    public TokenKey {
        Objects.requireNonNull(level, "Token level cannot be null");
    }

    /** Creates a key from a raw level code. */
    public static TokenKey of(int levelCode, long number) {
        return new TokenKey(TokenLevel.of(levelCode), number);
    }

    /** True if the number lies within the level's range. */
    public boolean isValid() {
        return level.contains(number);
    }

    @Override
    public String toString() {
        return level + "#" + number;
    }
}
