package com.skindx.infrastructure.ai.provider;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderFlagsTest {

    @Test
    void json_booleans() {
        assertThat(ProviderFlags.read(true)).contains(true);
        assertThat(ProviderFlags.read(false)).contains(false);
    }

    @Test
    void words_in_any_case() {
        assertThat(ProviderFlags.read(" Yes ")).contains(true);
        assertThat(ProviderFlags.read("TRUE")).contains(true);
        assertThat(ProviderFlags.read("no")).contains(false);
        assertThat(ProviderFlags.read("False")).contains(false);
    }

    @Test
    void numbers() {
        assertThat(ProviderFlags.read(1)).contains(true);
        assertThat(ProviderFlags.read(0)).contains(false);
        assertThat(ProviderFlags.read("0")).contains(false);
    }

    @Test
    void unrecognised_values() {
        assertThat(ProviderFlags.read(null)).isEmpty();
        assertThat(ProviderFlags.read("maybe")).isEmpty();
        assertThat(ProviderFlags.read("")).isEmpty();
    }
}
