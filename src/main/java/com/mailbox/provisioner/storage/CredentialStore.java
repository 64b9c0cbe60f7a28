package com.mailbox.provisioner.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbox.provisioner.config.ProvisionerProperties;
import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.service.RetryPolicy;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

@Component
public class CredentialStore {
    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    private final Map<String, AccountRecord> accounts = new TreeMap<>();
    /**
     * 已被创建任务占用、尚未写入的邮箱
     */
    private final Set<String> reserved = new HashSet<>();
    private final ObjectMapper objectMapper;
    private Path accountsPath;
    private Path secretsPath;
    private final RetryPolicy writeRetry;

    @Autowired
    public CredentialStore(ObjectMapper objectMapper, ProvisionerProperties properties) {
        this(
                objectMapper,
                Path.of(properties.getStorage().getAccountsPath()),
                Path.of(properties.getStorage().getSecretsPath()),
                RetryPolicy.exponential(
                        properties.getStorage().getWriteAttempts(),
                        properties.getStorage().getWriteBackoff(),
                        properties.getStorage().getWriteBackoff().multipliedBy(8))
        );
    }

    public CredentialStore(ObjectMapper objectMapper, Path accountsPath, Path secretsPath, RetryPolicy writeRetry) {
        this.objectMapper = objectMapper;
        this.accountsPath = accountsPath;
        this.secretsPath = secretsPath;
        this.writeRetry = writeRetry;
    }

    @PostConstruct
    public void init() {
        loadFromDisk();
    }

    /**
     * @throws IllegalStateException if either file is unreadable or an account references a missing secret
     */
    synchronized void loadFromDisk() {
        accounts.clear();
        Map<String, String> secrets = Map.of();
        List<StoredAccount> stored = List.of();
        try {
            if (Files.exists(secretsPath)) {
                Map<String, String> read = objectMapper.readValue(Files.readAllBytes(secretsPath), new TypeReference<>() {
                });
                secrets = read == null ? Map.of() : read;
            }
            if (Files.exists(accountsPath)) {
                List<StoredAccount> read = objectMapper.readValue(Files.readAllBytes(accountsPath), new TypeReference<>() {
                });
                stored = read == null ? List.of() : read;
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Credential store is unreadable: " + ex.getMessage(), ex);
        }
        for (StoredAccount row : stored) {
            if (row == null || row.email() == null || row.email().isBlank()) {
                continue;
            }
            String secret = secrets.get(row.email());
            if (row.totpSecretRef() && (secret == null || secret.isBlank())) {
                throw new IllegalStateException("Credential store corrupted: missing TOTP secret for " + row.email());
            }
            accounts.put(row.email(), row.toRecord(secret));
        }
        if (!stored.isEmpty()) {
            log.info("Loaded {} accounts from {}", accounts.size(), accountsPath.toAbsolutePath());
        }
    }

    /**
     * Points the store at another pair of files and loads them, dropping the current contents.
     */
    public synchronized void relocate(Path accounts, Path secrets) {
        this.accountsPath = accounts;
        this.secretsPath = secrets;
        reserved.clear();
        loadFromDisk();
    }

    /**
     * Claims an email for a new account until it is written by {@link #upsert} or released.
     *
     * @return {@code false} if the email is already stored or claimed
     */
    public synchronized boolean reserve(String email) {
        if (email == null || email.isBlank()) {
            return false;
        }
        String key = email.trim();
        if (accounts.containsKey(key)) {
            return false;
        }
        return reserved.add(key);
    }

    public synchronized void releaseReservation(String email) {
        if (email != null) {
            reserved.remove(email.trim());
        }
    }

    /**
     * Inserts or replaces the record with the same email and persists the store.
     *
     * @throws IllegalStateException if a different account with the same email is already stored
     * @throws StoreWriteException if the store could not be written; the previous state is kept
     */
    public synchronized void upsert(AccountRecord record) {
        if (record == null || record.getEmail() == null || record.getEmail().isBlank()) {
            throw new IllegalArgumentException("record with email required");
        }
        if (record.getStatus() != null && record.getStatus().requiresTotpSecret() && !record.hasTotpSecret()) {
            throw new IllegalArgumentException("record in status " + record.getStatus()
                    + " must carry a TOTP secret: " + record.getEmail());
        }
        AccountRecord previous = accounts.get(record.getEmail());
        if (previous != null && !Objects.equals(previous.getCreatedAt(), record.getCreatedAt())) {
            throw new IllegalStateException("email already belongs to another account: " + record.getEmail());
        }
        accounts.put(record.getEmail(), record.copy());
        reserved.remove(record.getEmail());
        boolean secretRemoved = previous != null && previous.hasTotpSecret() && !record.hasTotpSecret();
        try {
            persist(secretRemoved);
        } catch (StoreWriteException ex) {
            // 写盘失败时回滚内存状态
            if (previous == null) {
                accounts.remove(record.getEmail());
            } else {
                accounts.put(record.getEmail(), previous);
            }
            throw ex;
        }
    }

    public synchronized Optional<AccountRecord> get(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        AccountRecord record = accounts.get(email.trim());
        return record == null ? Optional.empty() : Optional.of(record.copy());
    }

    /**
     * All records ordered by email.
     */
    public synchronized List<AccountRecord> listAll() {
        List<AccountRecord> list = new ArrayList<>(accounts.size());
        for (AccountRecord record : accounts.values()) {
            list.add(record.copy());
        }
        return list;
    }

    public synchronized boolean delete(String email) {
        if (email == null || email.isBlank()) {
            return false;
        }
        AccountRecord removed = accounts.remove(email.trim());
        if (removed == null) {
            return false;
        }
        try {
            persist(removed.hasTotpSecret());
        } catch (StoreWriteException ex) {
            accounts.put(removed.getEmail(), removed);
            throw ex;
        }
        return true;
    }

    public synchronized boolean exists(String email) {
        return email != null && accounts.containsKey(email.trim());
    }

    public synchronized int size() {
        return accounts.size();
    }

    public synchronized Path getAccountsPath() {
        return accountsPath;
    }

    public synchronized Path getSecretsPath() {
        return secretsPath;
    }

    private void persist(boolean secretsShrink) {
        Map<String, String> secrets = new TreeMap<>();
        List<StoredAccount> rows = new ArrayList<>(accounts.size());
        for (AccountRecord record : accounts.values()) {
            if (record.hasTotpSecret()) {
                secrets.put(record.getEmail(), record.getTotpSecret());
            }
            rows.add(StoredAccount.from(record));
        }
        try {
            byte[] secretBytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(secrets);
            byte[] accountBytes = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(rows);
            writeRetry.execute("persist credential store", context -> {
                if (secretsShrink) {
                    writeAtomically(accountsPath, accountBytes);
                    writeAtomically(secretsPath, secretBytes);
                } else {
                    writeAtomically(secretsPath, secretBytes);
                    writeAtomically(accountsPath, accountBytes);
                }
                return null;
            });
        } catch (IOException ex) {
            log.error("Failed to persist credential store to {}: {}", accountsPath.toAbsolutePath(), ex.getMessage());
            throw new StoreWriteException("Failed to persist credential store to " + accountsPath.toAbsolutePath(), ex);
        }
    }

    static void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, bytes);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException atomicFail) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
