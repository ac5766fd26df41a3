package com.accessgate.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class TokenExpiryParserTest {

    private static final Duration FALLBACK = Duration.ofMinutes(15);

    @Test
    void parsesPlainSeconds() {
        assertThat(TokenExpiryParser.parse("900", FALLBACK)).isEqualTo(Duration.ofSeconds(900));
    }

    @Test
    void parsesUnitSuffix() {
        assertThat(TokenExpiryParser.parse("30s", FALLBACK)).isEqualTo(Duration.ofSeconds(30));
        assertThat(TokenExpiryParser.parse("15m", FALLBACK)).isEqualTo(Duration.ofMinutes(15));
        assertThat(TokenExpiryParser.parse("12h", FALLBACK)).isEqualTo(Duration.ofHours(12));
        assertThat(TokenExpiryParser.parse(" 7d ", FALLBACK)).isEqualTo(Duration.ofDays(7));
    }

    @Test
    void parsesLongForm() {
        assertThat(TokenExpiryParser.parse("1 hour", FALLBACK)).isEqualTo(Duration.ofHours(1));
        assertThat(TokenExpiryParser.parse("15 Minutes", FALLBACK)).isEqualTo(Duration.ofMinutes(15));
        assertThat(TokenExpiryParser.parse("2 weeks", FALLBACK)).isEqualTo(Duration.ofDays(14));
        assertThat(TokenExpiryParser.parse("1 month", FALLBACK)).isEqualTo(Duration.ofDays(30));
        assertThat(TokenExpiryParser.parse("1 year", FALLBACK)).isEqualTo(Duration.ofDays(365));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"0", "0m", "15x", "abc", "-5m", "15 fortnights", "1.5h"})
    void unusableValuesFallBack(String value) {
        assertThat(TokenExpiryParser.parse(value, FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TokenExpiryParser.isValid(value)).isFalse();
    }

    @Test
    void overflowingValuesFallBack() {
        assertThat(TokenExpiryParser.parse("99999999999999999999", FALLBACK)).isEqualTo(FALLBACK);
        assertThat(TokenExpiryParser.parse("9223372036854775807 years", FALLBACK)).isEqualTo(FALLBACK);
    }
}
