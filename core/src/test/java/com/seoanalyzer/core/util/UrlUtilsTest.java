package com.seoanalyzer.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UrlUtilsTest {

    @Test
    void bare_host_gets_https_prefix() {
        assertThat(UrlUtils.normalizeTarget("example.com")).isEqualTo("https://example.com");
        assertThat(UrlUtils.normalizeTarget("  example.com/path?q=1 ")).isEqualTo("https://example.com/path?q=1");
    }

    @Test
    void existing_scheme_is_kept_as_is() {
        assertThat(UrlUtils.normalizeTarget("http://example.com")).isEqualTo("http://example.com");
        assertThat(UrlUtils.normalizeTarget("HTTPS://Example.com/A")).isEqualTo("HTTPS://Example.com/A");
    }

    @Test
    void null_or_blank_is_rejected() {
        assertThatThrownBy(() -> UrlUtils.normalizeTarget(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> UrlUtils.normalizeTarget(" \t")).isInstanceOf(IllegalArgumentException.class);
    }
}
