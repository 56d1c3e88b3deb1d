package com.streamfirst.tokenindex.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class TokenContentTest {

    private static final String HASH_1423543 =
            "841d04a85612adb1ca95d86e08561eb1dcc9608899a57b59d57c565d796bb106";

    @Test
    void encodes_level_and_hash_of_decimal_number() {
        var content = TokenContent.of(new TokenKey(TokenLevel.LEVEL_3, 1_423_543));

        assertThat(content.encoded()).isEqualTo("003" + HASH_1423543);
        assertThat(content.encoded()).hasSize(TokenContent.LENGTH);
    }

    @Test
    void decodes_level_and_exact_hash() {
        var decoded = TokenContent.decode("003" + HASH_1423543);

        assertThat(decoded.levelCode()).isEqualTo(3);
        assertThat(decoded.level()).isEqualTo(TokenLevel.LEVEL_3);
        assertThat(decoded.hash().hex()).isEqualTo(HASH_1423543);
    }

    @Test
    void strips_surrounding_whitespace_like_fetched_text() {
        var decoded = TokenContent.decode("  001" + HASH_1423543 + "\n");

        assertThat(decoded.levelCode()).isEqualTo(1);
        assertThat(decoded.isCanonical("001" + HASH_1423543)).isTrue();
    }

    @Test
    void upper_case_hex_decodes_but_is_not_canonical() {
        String raw = "002" + HASH_1423543.toUpperCase();

        var decoded = TokenContent.decode(raw);

        assertThat(decoded.hash().hex()).isEqualTo(HASH_1423543);
        assertThat(decoded.isCanonical(raw)).isFalse();
    }

    @Test
    void keeps_unknown_level_codes_for_the_caller_to_judge() {
        var decoded = TokenContent.decode("007" + HASH_1423543);

        assertThat(decoded.levelCode()).isEqualTo(7);
        assertThat(decoded.hasValidLevel()).isFalse();
    }

    @Test
    void rejects_wrong_length() {
        assertThatThrownBy(() -> TokenContent.decode("003" + HASH_1423543.substring(1)))
                .isInstanceOf(DecodeException.class)
                .hasMessageContaining("67");
        assertThatThrownBy(() -> TokenContent.decode("")).isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> TokenContent.decode(null)).isInstanceOf(DecodeException.class);
    }

    @Test
    void rejects_non_digit_level_prefix() {
        assertThatThrownBy(() -> TokenContent.decode("+03" + HASH_1423543))
                .isInstanceOf(DecodeException.class);
        assertThatThrownBy(() -> TokenContent.decode("0x3" + HASH_1423543))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    void rejects_non_hex_suffix() {
        String bad = "003" + HASH_1423543.substring(0, 63) + "g";

        assertThatThrownBy(() -> TokenContent.decode(bad))
                .isInstanceOf(DecodeException.class)
                .satisfies(e -> assertThat(((DecodeException) e).getContent()).isEqualTo(bad));
    }
}
