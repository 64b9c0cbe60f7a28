package com.mailbox.provisioner.service;

import com.mailbox.provisioner.config.ProvisionerProperties;
import com.mailbox.provisioner.entity.ProxyHandle;
import com.mailbox.provisioner.entity.ProxyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 代理池，按最近最少使用分配，连续失败超过阈值后指数退避隔离
 */
public class ProxyPoolService {
    private static final Logger log = LoggerFactory.getLogger(ProxyPoolService.class);

    private final Map<String, ProxyRecord> proxies = new LinkedHashMap<>();
    private final int failureThreshold;
    private final Duration baseBackoff;
    private final Duration maxBackoff;
    private final int maxSessionsPerProxy;
    private final Clock clock;
    private long sequence;

    public ProxyPoolService(Collection<String> addresses, ProvisionerProperties.Proxy settings, Clock clock) {
        if (settings.getFailureThreshold() < 0) {
            throw new IllegalArgumentException("failureThreshold must be >= 0");
        }
        for (String address : addresses) {
            proxies.putIfAbsent(address, new ProxyRecord(address));
        }
        this.failureThreshold = settings.getFailureThreshold();
        this.baseBackoff = settings.getBaseBackoff();
        this.maxBackoff = settings.getMaxBackoff();
        this.maxSessionsPerProxy = Math.max(0, settings.getMaxSessionsPerProxy());
        this.clock = clock;
        if (proxies.isEmpty()) {
            log.info("No proxies configured, sessions will connect directly");
        } else {
            log.info("Proxy pool initialised with {} SOCKS5 proxies", proxies.size());
        }
    }

    public synchronized boolean isDirect() {
        return proxies.isEmpty();
    }

    /**
     * @throws PoolExhaustedException if every proxy is cooling down or at its session limit
     */
    public synchronized ProxyHandle acquire() {
        if (proxies.isEmpty()) {
            return ProxyHandle.direct();
        }
        Instant now = clock.instant();
        ProxyRecord selected = null;
        for (ProxyRecord proxy : proxies.values()) {
            if (!isEligible(proxy, now)) {
                continue;
            }
            // 插入顺序遍历，序号相同时取先加载的
            if (selected == null || proxy.getAcquireSequence() < selected.getAcquireSequence()) {
                selected = proxy;
            }
        }
        if (selected == null) {
            throw new PoolExhaustedException("No healthy proxy available among " + proxies.size());
        }
        selected.setAcquireSequence(++sequence);
        selected.setLastAcquiredAt(now);
        selected.setAcquireCount(selected.getAcquireCount() + 1);
        selected.setActiveSessions(selected.getActiveSessions() + 1);
        log.debug("Acquired proxy {} ({} active sessions)", selected.getAddress(), selected.getActiveSessions());
        return selected.toHandle();
    }

    public synchronized void reportOutcome(ProxyHandle handle, boolean success) {
        if (handle == null || handle.isDirect()) {
            return;
        }
        ProxyRecord proxy = proxies.get(handle.address());
        if (proxy == null) {
            log.warn("Outcome reported for unknown proxy {}", handle.address());
            return;
        }
        if (success) {
            if (proxy.getConsecutiveFailures() > 0 || proxy.getCooldownCycles() > 0) {
                log.info("Proxy {} recovered after {} consecutive failures", proxy.getAddress(),
                        proxy.getConsecutiveFailures());
            }
            proxy.setConsecutiveFailures(0);
            proxy.setCooldownCycles(0);
            proxy.setCooldownUntil(null);
            return;
        }
        proxy.setConsecutiveFailures(proxy.getConsecutiveFailures() + 1);
        if (proxy.getConsecutiveFailures() > failureThreshold) {
            Duration cooldown = cooldownFor(proxy.getCooldownCycles());
            Instant until = clock.instant().plus(cooldown);
            proxy.setCooldownUntil(until);
            proxy.setCooldownCycles(proxy.getCooldownCycles() + 1);
            log.warn("Proxy {} quarantined until {} after {} consecutive failures (cycle {})",
                    proxy.getAddress(), until, proxy.getConsecutiveFailures(), proxy.getCooldownCycles());
        } else {
            log.warn("Proxy {} marked as failed ({} consecutive)", proxy.getAddress(),
                    proxy.getConsecutiveFailures());
        }
    }

    public synchronized void release(ProxyHandle handle) {
        if (handle == null || handle.isDirect()) {
            return;
        }
        ProxyRecord proxy = proxies.get(handle.address());
        if (proxy == null) {
            return;
        }
        proxy.setActiveSessions(Math.max(0, proxy.getActiveSessions() - 1));
    }

    public synchronized List<ProxyRecord> snapshot() {
        List<ProxyRecord> copy = new ArrayList<>(proxies.size());
        for (ProxyRecord proxy : proxies.values()) {
            copy.add(proxy.copy());
        }
        return copy;
    }

    public synchronized long healthyCount() {
        Instant now = clock.instant();
        return proxies.values().stream().filter(p -> !p.isCoolingDown(now)).count();
    }

    Duration cooldownFor(int cycle) {
        return RetryPolicy.exponentialBackoff(baseBackoff, maxBackoff, cycle + 1);
    }

    private boolean isEligible(ProxyRecord proxy, Instant now) {
        if (proxy.isCoolingDown(now)) {
            return false;
        }
        return maxSessionsPerProxy == 0 || proxy.getActiveSessions() < maxSessionsPerProxy;
    }
}
