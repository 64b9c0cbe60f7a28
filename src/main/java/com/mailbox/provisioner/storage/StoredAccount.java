package com.mailbox.provisioner.storage;

import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.entity.AccountStatus;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Row of the accounts file. The TOTP secret itself lives in the secrets file;
 * {@code totpSecretRef} marks that one must exist for this email.
 */
public record StoredAccount(
        String email,
        String password,
        String firstName,
        String lastName,
        LocalDate birthDate,
        boolean totpSecretRef,
        AccountStatus status,
        boolean flagged,
        String proxyUsed,
        Instant createdAt,
        Instant lastModifiedAt
) {

    static StoredAccount from(AccountRecord record) {
        return new StoredAccount(
                record.getEmail(),
                record.getPassword(),
                record.getFirstName(),
                record.getLastName(),
                record.getBirthDate(),
                record.hasTotpSecret(),
                record.getStatus(),
                record.isFlagged(),
                record.getProxyUsed(),
                record.getCreatedAt(),
                record.getLastModifiedAt()
        );
    }

    AccountRecord toRecord(String totpSecret) {
        return AccountRecord.builder()
                .email(email)
                .password(password)
                .firstName(firstName)
                .lastName(lastName)
                .birthDate(birthDate)
                .totpSecret(totpSecretRef ? totpSecret : null)
                .status(status == null ? AccountStatus.INITIATED : status)
                .flagged(flagged)
                .proxyUsed(proxyUsed)
                .createdAt(createdAt)
                .lastModifiedAt(lastModifiedAt)
                .build();
    }
}
