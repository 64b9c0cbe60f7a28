package com.mailbox.provisioner.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class AccountRecordTest {

    private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2026, 1, 17);

    @Test
    void initiateStartsInInitiatedStatus() {
        AccountRecord record = AccountRecord.initiate(identity(LocalDate.of(1990, 5, 1)), NOW, TODAY);

        assertThat(record.getStatus()).isEqualTo(AccountStatus.INITIATED);
        assertThat(record.getCreatedAt()).isEqualTo(NOW);
        assertThat(record.hasTotpSecret()).isFalse();
        assertThat(record.displayName()).isEqualTo("Alex Smith");
    }

    @Test
    void initiateRejectsMinors() {
        // 差一天满 18 岁
        LocalDate seventeen = TODAY.minusYears(18).plusDays(1);

        assertThatThrownBy(() -> AccountRecord.initiate(identity(seventeen), NOW, TODAY))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(AccountRecord.initiate(identity(TODAY.minusYears(18)), NOW, TODAY).getStatus())
                .isEqualTo(AccountStatus.INITIATED);
    }

    @Test
    void advanceRejectsSkippedStates() {
        AccountRecord record = AccountRecord.initiate(identity(LocalDate.of(1990, 5, 1)), NOW, TODAY);

        assertThatThrownBy(() -> record.advanceTo(AccountStatus.VERIFIED, NOW))
                .isInstanceOf(IllegalStateException.class);
        assertThat(record.getStatus()).isEqualTo(AccountStatus.INITIATED);
    }

    @Test
    void totpBoundRequiresSecret() {
        AccountRecord record = AccountRecord.initiate(identity(LocalDate.of(1990, 5, 1)), NOW, TODAY);
        record.advanceTo(AccountStatus.FORM_SUBMITTED, NOW);
        record.advanceTo(AccountStatus.VERIFICATION_PENDING, NOW);
        record.advanceTo(AccountStatus.VERIFIED, NOW);

        assertThatThrownBy(() -> record.advanceTo(AccountStatus.TOTP_BOUND, NOW))
                .isInstanceOf(IllegalStateException.class);

        record.bindTotpSecret("JBSWY3DPEHPK3PXP", NOW);
        record.advanceTo(AccountStatus.TOTP_BOUND, NOW);
        assertThat(record.getStatus()).isEqualTo(AccountStatus.TOTP_BOUND);
    }

    @Test
    void boundSecretIsImmutableExceptThroughRebind() {
        AccountRecord record = AccountRecord.initiate(identity(LocalDate.of(1990, 5, 1)), NOW, TODAY);
        record.bindTotpSecret("JBSWY3DPEHPK3PXP", NOW);

        assertThatThrownBy(() -> record.bindTotpSecret("KRSXG5CTMVRXEZLU", NOW))
                .isInstanceOf(IllegalStateException.class);
        assertThat(record.getTotpSecret()).isEqualTo("JBSWY3DPEHPK3PXP");

        record.rebindTotpSecret("KRSXG5CTMVRXEZLU", NOW.plusSeconds(5));
        assertThat(record.getTotpSecret()).isEqualTo("KRSXG5CTMVRXEZLU");
        assertThat(record.getLastModifiedAt()).isEqualTo(NOW.plusSeconds(5));
    }

    @Test
    void copyIsIndependent() {
        AccountRecord record = AccountRecord.initiate(identity(LocalDate.of(1990, 5, 1)), NOW, TODAY);
        AccountRecord copy = record.copy();

        copy.advanceTo(AccountStatus.FORM_SUBMITTED, NOW);
        copy.changePassword("changed", NOW);

        assertThat(record.getStatus()).isEqualTo(AccountStatus.INITIATED);
        assertThat(record.getPassword()).isEqualTo("Secr3t!pass");
    }

    @Test
    void toStringHidesCredentials() {
        AccountRecord record = AccountRecord.initiate(identity(LocalDate.of(1990, 5, 1)), NOW, TODAY);
        record.bindTotpSecret("JBSWY3DPEHPK3PXP", NOW);

        assertThat(record.toString()).doesNotContain("Secr3t!pass").doesNotContain("JBSWY3DPEHPK3PXP");
    }

    private static Identity identity(LocalDate birthDate) {
        return new Identity("alex1234@outlook.com", "Secr3t!pass", "Alex", "Smith", birthDate);
    }
}
