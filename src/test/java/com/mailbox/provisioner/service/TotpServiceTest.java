package com.mailbox.provisioner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TotpServiceTest {

    // RFC 6238 附录 B 的 SHA1 种子 "12345678901234567890"
    private static final String RFC_SECRET = "GEZDGNBVGY3TQOJQGEZDGNBVGY3TQOJQ";

    private final TotpService totpService = new TotpService();

    @ParameterizedTest
    @CsvSource({
            "59, 287082",
            "1111111109, 081804",
            "1111111111, 050471",
            "1234567890, 005924",
            "2000000000, 279037"
    })
    void matchesPublishedVectors(long epochSecond, String expected) {
        assertThat(totpService.currentCode(RFC_SECRET, Instant.ofEpochSecond(epochSecond))).isEqualTo(expected);
    }

    @RepeatedTest(20)
    void generatedSecretVerifiesItsOwnCode() {
        String secret = totpService.generateSecret();
        Instant now = Instant.now();

        assertThat(secret).hasSize(32).matches("[A-Z2-7]+");
        assertThat(TotpService.decodeBase32(secret)).hasSize(20);
        assertThat(totpService.verify(secret, totpService.currentCode(secret, now), now)).isTrue();
    }

    @Test
    void acceptsOneStepOfSkewOnly() {
        Instant now = Instant.ofEpochSecond(1_700_000_010L);
        String code = totpService.currentCode(RFC_SECRET, now);

        assertThat(totpService.verify(RFC_SECRET, code, now.plusSeconds(30))).isTrue();
        assertThat(totpService.verify(RFC_SECRET, code, now.minusSeconds(30))).isTrue();
        assertThat(totpService.verify(RFC_SECRET, code, now.plusSeconds(60))).isFalse();
        assertThat(totpService.verify(RFC_SECRET, code, now.minusSeconds(60))).isFalse();
    }

    @Test
    void verifiesCodesBeforeTheEpoch() {
        Instant beforeEpoch = Instant.ofEpochSecond(-45);
        String code = totpService.currentCode(RFC_SECRET, beforeEpoch);

        assertThat(totpService.verify(RFC_SECRET, code, beforeEpoch)).isTrue();
        assertThat(totpService.verify(RFC_SECRET, code, Instant.ofEpochSecond(-15))).isTrue();
        assertThat(totpService.verify(RFC_SECRET, totpService.currentCode(RFC_SECRET, Instant.EPOCH),
                beforeEpoch)).isTrue();
    }

    @Test
    void rejectsMalformedCodes() {
        Instant now = Instant.ofEpochSecond(59);

        assertThat(totpService.verify(RFC_SECRET, null, now)).isFalse();
        assertThat(totpService.verify(RFC_SECRET, "28708", now)).isFalse();
        assertThat(totpService.verify(RFC_SECRET, "abcdef", now)).isFalse();
    }

    @Test
    void base32RoundTripsAsciiSeed() {
        byte[] seed = "12345678901234567890".getBytes(StandardCharsets.US_ASCII);

        assertThat(TotpService.encodeBase32(seed)).isEqualTo(RFC_SECRET);
        assertThat(TotpService.decodeBase32("gezd gnbvgy3tqojqgezdgnbvgy3tqojq")).isEqualTo(seed);
    }

    @Test
    void rejectsInvalidSecret() {
        assertThatThrownBy(() -> totpService.currentCode("NOT*BASE32", Instant.EPOCH))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reportsSecondsRemainingInWindow() {
        assertThat(totpService.secondsRemaining(Instant.ofEpochSecond(59))).isEqualTo(1);
        assertThat(totpService.secondsRemaining(Instant.ofEpochSecond(60))).isEqualTo(30);
    }
}
