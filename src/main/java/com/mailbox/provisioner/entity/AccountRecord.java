package com.mailbox.provisioner.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A provisioned mailbox together with its credentials and lifecycle status.
 * <p>
 * Instances are not thread-safe. The credential store hands out copies, so a
 * worker mutates its own instance and writes it back through {@code upsert}.
 */
@Getter
@ToString(exclude = {"password", "totpSecret"})
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountRecord {
    /**
     * 唯一标识
     */
    private final String email;
    private String password;
    private final String firstName;
    private final String lastName;
    private final LocalDate birthDate;
    /**
     * 2FA 密钥（base32）
     */
    private String totpSecret;
    private AccountStatus status;
    /**
     * 需要人工处理
     */
    private boolean flagged;
    /**
     * 最近一次使用的代理，仅作记录
     */
    private String proxyUsed;
    private final Instant createdAt;
    private Instant lastModifiedAt;

    public static AccountRecord initiate(Identity identity, Instant now, LocalDate today) {
        if (identity.email() == null || identity.email().isBlank()) {
            throw new IllegalArgumentException("email required");
        }
        if (identity.password() == null || identity.password().isEmpty()) {
            throw new IllegalArgumentException("password required");
        }
        if (identity.birthDate() == null || identity.ageOn(today) < Identity.MINIMUM_AGE) {
            throw new IllegalArgumentException("account holder must be at least " + Identity.MINIMUM_AGE
                    + " years old: " + identity.birthDate());
        }
        return AccountRecord.builder()
                .email(identity.email())
                .password(identity.password())
                .firstName(identity.firstName())
                .lastName(identity.lastName())
                .birthDate(identity.birthDate())
                .status(AccountStatus.INITIATED)
                .createdAt(now)
                .lastModifiedAt(now)
                .build();
    }

    public Identity identity() {
        return new Identity(email, password, firstName, lastName, birthDate);
    }

    public String displayName() {
        if (firstName == null && lastName == null) {
            return "";
        }
        return ((firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName)).trim();
    }

    public boolean hasTotpSecret() {
        return totpSecret != null && !totpSecret.isEmpty();
    }

    /**
     * Moves the record along one edge of the lifecycle state machine.
     *
     * @throws IllegalStateException if {@code next} is not a successor of the current status
     */
    public void advanceTo(AccountStatus next, Instant now) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal status transition " + status + " -> " + next + " for " + email);
        }
        if (next.requiresTotpSecret() && !hasTotpSecret()) {
            throw new IllegalStateException("Cannot enter " + next + " without a bound TOTP secret: " + email);
        }
        this.status = next;
        this.lastModifiedAt = now;
    }

    public void bindTotpSecret(String secret, Instant now) {
        if (hasTotpSecret()) {
            throw new IllegalStateException("TOTP secret already bound for " + email);
        }
        requireSecret(secret);
        this.totpSecret = secret;
        this.lastModifiedAt = now;
    }

    /**
     * 显式重新绑定，替换已有密钥。
     */
    public void rebindTotpSecret(String secret, Instant now) {
        requireSecret(secret);
        this.totpSecret = secret;
        this.lastModifiedAt = now;
    }

    public void changePassword(String newPassword, Instant now) {
        if (newPassword == null || newPassword.isEmpty()) {
            throw new IllegalArgumentException("new password required");
        }
        this.password = newPassword;
        this.lastModifiedAt = now;
    }

    public void markFlagged(Instant now) {
        this.flagged = true;
        this.lastModifiedAt = now;
    }

    public void clearFlag(Instant now) {
        this.flagged = false;
        this.lastModifiedAt = now;
    }

    public void useProxy(String address, Instant now) {
        this.proxyUsed = address;
        this.lastModifiedAt = now;
    }

    public AccountRecord copy() {
        return toBuilder().build();
    }

    private static void requireSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret empty");
        }
    }
}
