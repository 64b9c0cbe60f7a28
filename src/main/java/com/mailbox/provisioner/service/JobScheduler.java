package com.mailbox.provisioner.service;

import com.mailbox.provisioner.driver.BrowserDriverFactory;
import com.mailbox.provisioner.driver.WorkerSession;
import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.entity.AccountStatus;
import com.mailbox.provisioner.entity.Identity;
import com.mailbox.provisioner.entity.Job;
import com.mailbox.provisioner.entity.JobKind;
import com.mailbox.provisioner.entity.JobOutcome;
import com.mailbox.provisioner.entity.ProxyHandle;
import com.mailbox.provisioner.storage.CredentialStore;
import com.mailbox.provisioner.storage.StoreWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
    private static final long POLL_MILLIS = 100;
    private static final int MAX_IDENTITY_ATTEMPTS = 5;

    private final BlockingQueue<Job> queue;
    private final int threadCount;
    private final boolean headless;
    private final AccountWorkflowEngine engine;
    private final CredentialStore store;
    private final ProxyPoolService proxyPool;
    private final BrowserDriverFactory driverFactory;
    private final IdentityGenerator identities;
    private final Clock clock;

    private final RunSummary summary = new RunSummary();
    private final List<Thread> workers = new ArrayList<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private volatile boolean accepting = true;

    public JobScheduler(int threadCount, int queueCapacity, boolean headless, AccountWorkflowEngine engine,
                        CredentialStore store, ProxyPoolService proxyPool, BrowserDriverFactory driverFactory,
                        IdentityGenerator identities, Clock clock) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be >= 1");
        }
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.threadCount = threadCount;
        this.headless = headless;
        this.engine = engine;
        this.store = store;
        this.proxyPool = proxyPool;
        this.driverFactory = driverFactory;
        this.identities = identities;
        this.clock = clock;
    }

    public synchronized void start() {
        if (!workers.isEmpty()) {
            throw new IllegalStateException("scheduler already started");
        }
        log.info("Starting {} workers (queue capacity {})", threadCount, queue.remainingCapacity());
        for (int i = 1; i <= threadCount; i++) {
            Thread worker = new Thread(this::workLoop, "provision-worker-" + i);
            workers.add(worker);
            worker.start();
        }
    }

    /**
     * Enqueues a job, blocking while the queue is full.
     *
     * @throws IllegalStateException if the scheduler no longer accepts jobs
     */
    public void submit(Job job) throws InterruptedException {
        while (true) {
            if (!accepting || stopRequested.get()) {
                throw new IllegalStateException("scheduler is not accepting jobs");
            }
            if (queue.offer(job, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                return;
            }
        }
    }

    public void shutdown() {
        if (stopRequested.compareAndSet(false, true)) {
            log.warn("Shutdown requested, {} queued jobs will not be started", queue.size());
        }
        accepting = false;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Stops accepting jobs, waits for the queue to drain (or for shutdown) and
     * for every worker to exit.
     */
    public RunSummary awaitCompletion() throws InterruptedException {
        accepting = false;
        for (Thread worker : workersSnapshot()) {
            worker.join();
        }
        drainAbandoned();
        return summary;
    }

    /**
     * @return {@code false} if some worker was still running when the timeout elapsed
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread worker : workersSnapshot()) {
            long remaining = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remaining <= 0) {
                return false;
            }
            worker.join(remaining);
            if (worker.isAlive()) {
                return false;
            }
        }
        return true;
    }

    public RunSummary getSummary() {
        return summary;
    }

    private synchronized List<Thread> workersSnapshot() {
        return new ArrayList<>(workers);
    }

    private void drainAbandoned() {
        List<Job> left = new ArrayList<>();
        queue.drainTo(left);
        if (!left.isEmpty()) {
            summary.recordAbandoned(left.size());
            log.warn("{} queued jobs were not started", left.size());
        }
    }

    private void workLoop() {
        while (!stopRequested.get()) {
            Job job;
            try {
                job = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
            if (job == null) {
                if (!accepting && queue.isEmpty()) {
                    return;
                }
                continue;
            }
            process(job);
        }
    }

    void process(Job job) {
        AccountRecord record = prepareRecord(job);
        if (record == null) {
            return;
        }
        try {
            dispatch(job, record);
        } finally {
            if (job.getKind() == JobKind.CREATE) {
                store.releaseReservation(record.getEmail());
            }
        }
    }

    private void dispatch(Job job, AccountRecord record) {
        long started = System.nanoTime();
        String email = record.getEmail();

        ProxyHandle proxy;
        try {
            proxy = proxyPool.acquire();
        } catch (PoolExhaustedException ex) {
            log.error("[{}] {} failed before dispatch: {}", job.getKind(), email, ex.getMessage());
            summary.record(JobOutcome.FAILED, email);
            return;
        }
        job.setAssignedProxy(proxy);

        WorkflowResult result;
        try (WorkerSession session = WorkerSession.open(driverFactory, headless)) {
            result = engine.run(job, record, session, stopRequested::get);
        } catch (RuntimeException ex) {
            log.error("[{}] {} aborted in status {} (attempt {}, proxy {}): {}", job.getKind(), email,
                    record.getStatus(), job.getAttempt(), job.getAssignedProxy(), ex.toString());
            if (job.getAttempt() == 0) {
                // 驱动未启动，远端没有任何变化
                summary.record(JobOutcome.FAILED, email);
                return;
            }
            if (!record.getStatus().isTerminal()) {
                record.advanceTo(AccountStatus.FAILED, clock.instant());
            }
            result = null;
        } finally {
            proxyPool.release(job.getAssignedProxy());
        }

        try {
            store.upsert(record);
        } catch (IllegalStateException ex) {
            log.error("[{}] {} not persisted: {}", job.getKind(), email, ex.getMessage());
            summary.record(JobOutcome.FAILED, email);
            return;
        } catch (StoreWriteException ex) {
            log.error("[{}] {} credentials NOT persisted (status {}, totp bound {}): {}", job.getKind(), email,
                    record.getStatus(), record.hasTotpSecret(), ex.getMessage());
            summary.record(JobOutcome.FAILED, email);
            summary.recordRunError("credential store write failed: " + ex.getMessage());
            shutdown();
            return;
        }

        JobOutcome outcome = result == null ? JobOutcome.FAILED : result.outcome();
        summary.record(outcome, email);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        log.info("[{}] {} finished {} in status {} after {} ms{}", job.getKind(), email, outcome,
                record.getStatus(), elapsedMillis,
                result == null || result.reason() == null ? "" : " (" + result.reason() + ")");
    }

    /**
     * Builds the record a job works on, or records a rejection and returns {@code null}.
     */
    private AccountRecord prepareRecord(Job job) {
        if (job.getKind() == JobKind.CREATE) {
            for (int i = 0; i < MAX_IDENTITY_ATTEMPTS; i++) {
                Identity identity = identities.next();
                if (!store.reserve(identity.email())) {
                    continue;
                }
                try {
                    return AccountRecord.initiate(identity, clock.instant(), LocalDate.now(clock));
                } catch (IllegalArgumentException ex) {
                    store.releaseReservation(identity.email());
                    log.error("[{}] invalid identity {}: {}", job.getKind(), identity.email(), ex.getMessage());
                    summary.record(JobOutcome.FAILED, identity.email());
                    return null;
                }
            }
            log.error("[{}] could not generate an unused email after {} attempts", job.getKind(),
                    MAX_IDENTITY_ATTEMPTS);
            summary.record(JobOutcome.FAILED, null);
            return null;
        }

        Optional<AccountRecord> existing = store.get(job.getTargetEmail());
        if (existing.isEmpty()) {
            log.error("[{}] {} rejected before dispatch: account not found", job.getKind(), job.getTargetEmail());
            summary.record(JobOutcome.FAILED, job.getTargetEmail());
            return null;
        }
        AccountRecord record = existing.get();
        if (record.getStatus() != AccountStatus.ACTIVE) {
            log.error("[{}] {} rejected before dispatch: status is {}, expected ACTIVE", job.getKind(),
                    job.getTargetEmail(), record.getStatus());
            summary.record(JobOutcome.FAILED, job.getTargetEmail());
            return null;
        }
        return record;
    }
}
