package com.metagen.common.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SecretMaskerTest {

    @Test
    void keepsFirstAndLastFourCharacters() {
        assertThat(SecretMasker.mask("AIzaSyD-1234567890-x9Qk")).isEqualTo("AIza...x9Qk");
    }

    @Test
    void hidesShortOrMissingSecretsEntirely() {
        assertThat(SecretMasker.mask(null)).isEqualTo("***");
        assertThat(SecretMasker.mask("short")).isEqualTo("***");
        assertThat(SecretMasker.mask("12345678901")).isEqualTo("***");
    }
}
