package com.crossfire.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextSecurityTest {

    @Test
    void hashesUtf8BytesWithSha256() {
        assertThat(TextSecurity.computeHashString("abc"))
                .isEqualTo("ungWv48Bz+pBQUDeXa4iI7ADYaOWF3qctBD/YfIAFa0=");
    }

    @Test
    void emptyContentHasNoHash() {
        assertThat(TextSecurity.computeHash("")).isNull();
        assertThatThrownBy(() -> TextSecurity.computeHashString(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
