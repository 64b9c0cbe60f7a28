package com.mailbox.provisioner.entity;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Health bookkeeping for one pooled SOCKS5 proxy. Mutated only while the
 * owning pool holds its lock.
 */
@Getter
@Setter
@ToString
public class ProxyRecord {
    private final String address;
    private final ProxyProtocol protocol = ProxyProtocol.SOCKS5;
    private int consecutiveFailures;
    private Instant cooldownUntil;
    /**
     * 连续进入冷却的次数，决定下一次冷却时长
     */
    private int cooldownCycles;
    private Instant lastAcquiredAt;
    /**
     * 分配顺序号，越小越久未被使用
     */
    private long acquireSequence;
    private long acquireCount;
    private int activeSessions;

    public ProxyRecord(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("proxy address required");
        }
        this.address = address;
    }

    public boolean isCoolingDown(Instant now) {
        return cooldownUntil != null && now.isBefore(cooldownUntil);
    }

    public ProxyHandle toHandle() {
        return ProxyHandle.socks5(address);
    }

    public ProxyRecord copy() {
        ProxyRecord copy = new ProxyRecord(address);
        copy.consecutiveFailures = consecutiveFailures;
        copy.cooldownUntil = cooldownUntil;
        copy.cooldownCycles = cooldownCycles;
        copy.lastAcquiredAt = lastAcquiredAt;
        copy.acquireSequence = acquireSequence;
        copy.acquireCount = acquireCount;
        copy.activeSessions = activeSessions;
        return copy;
    }
}
