package com.mailbox.provisioner.service;

import com.mailbox.provisioner.driver.BrowserDriver;
import com.mailbox.provisioner.driver.BrowserDriverUnavailableException;
import com.mailbox.provisioner.driver.StepOutcome;
import com.mailbox.provisioner.driver.WorkerSession;
import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.entity.AccountStatus;
import com.mailbox.provisioner.entity.Identity;
import com.mailbox.provisioner.entity.Job;
import com.mailbox.provisioner.entity.JobKind;
import com.mailbox.provisioner.entity.JobOutcome;
import com.mailbox.provisioner.entity.ProxyHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

public class AccountWorkflowEngine {
    private static final Logger log = LoggerFactory.getLogger(AccountWorkflowEngine.class);

    private final TotpService totpService;
    private final ProxyPoolService proxyPool;
    private final RetryPolicy retryPolicy;
    private final Duration stepTimeout;
    private final Supplier<String> passwordGenerator;
    private final Clock clock;

    public AccountWorkflowEngine(TotpService totpService, ProxyPoolService proxyPool, RetryPolicy retryPolicy,
                                 Duration stepTimeout, Supplier<String> passwordGenerator, Clock clock) {
        this.totpService = totpService;
        this.proxyPool = proxyPool;
        this.retryPolicy = retryPolicy;
        this.stepTimeout = stepTimeout;
        this.passwordGenerator = passwordGenerator;
        this.clock = clock;
    }

    /**
     * Runs {@code job} against {@code record}, mutating the record in place.
     * The job must carry an assigned proxy; on rotation the engine releases the
     * old handle and stores the new one on the job, so the caller releases
     * whatever {@link Job#getAssignedProxy()} holds afterwards.
     */
    public WorkflowResult run(Job job, AccountRecord record, WorkerSession session, BooleanSupplier stopRequested) {
        Run run = new Run(job, record, session, stopRequested);
        job.setMaxAttempts(retryPolicy.maxAttempts());
        try {
            return job.getKind() == JobKind.CREATE ? runCreate(run) : runPasswordChange(run);
        } catch (PoolExhaustedException ex) {
            return fail(run, "proxy pool exhausted: " + ex.getMessage());
        } catch (BrowserDriverUnavailableException ex) {
            return fail(run, "browser session lost: " + ex.getMessage());
        } catch (BackOffInterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("[{}] {} interrupted in status {}", job.getKind(), record.getEmail(), record.getStatus());
            return run.result(JobOutcome.INTERRUPTED, "interrupted");
        }
    }

    private WorkflowResult runCreate(Run run) {
        AccountRecord record = run.record;
        while (record.getStatus() != AccountStatus.ACTIVE) {
            if (run.stopRequested.getAsBoolean()) {
                log.info("[{}] {} stopping in status {} on shutdown", run.job.getKind(), record.getEmail(),
                        record.getStatus());
                return run.result(JobOutcome.INTERRUPTED, "shutdown requested");
            }
            StepOutcome outcome;
            switch (record.getStatus()) {
                case INITIATED -> {
                    Identity identity = record.identity();
                    outcome = attempt(run, "submitSignupForm", (driver, proxy) -> driver.submitSignupForm(identity, proxy));
                    if (outcome != StepOutcome.SUCCESS) {
                        return settle(run, "submitSignupForm", outcome);
                    }
                    transition(run, AccountStatus.FORM_SUBMITTED);
                }
                case FORM_SUBMITTED -> transition(run, AccountStatus.VERIFICATION_PENDING);
                case VERIFICATION_PENDING -> {
                    String challengeResponse = record.getEmail();
                    outcome = attempt(run, "submitVerification",
                            (driver, proxy) -> driver.submitVerification(challengeResponse, proxy));
                    if (outcome != StepOutcome.SUCCESS) {
                        return settle(run, "submitVerification", outcome);
                    }
                    transition(run, AccountStatus.VERIFIED);
                }
                case VERIFIED -> {
                    // 驱动确认绑定成功后才写入密钥
                    String secret = totpService.generateSecret();
                    outcome = attempt(run, "bindTotp", (driver, proxy) -> driver.bindTotp(secret, proxy));
                    if (outcome != StepOutcome.SUCCESS) {
                        return settle(run, "bindTotp", outcome);
                    }
                    record.bindTotpSecret(secret, clock.instant());
                    transition(run, AccountStatus.TOTP_BOUND);
                }
                case TOTP_BOUND -> transition(run, AccountStatus.ACTIVE);
                default -> {
                    return fail(run, "cannot create from status " + record.getStatus());
                }
            }
        }
        return run.result(JobOutcome.SUCCEEDED, null);
    }

    private WorkflowResult runPasswordChange(Run run) {
        AccountRecord record = run.record;
        if (record.getStatus() != AccountStatus.ACTIVE) {
            log.error("[{}] {} rejected: status is {}, expected ACTIVE", run.job.getKind(), record.getEmail(),
                    record.getStatus());
            return run.result(JobOutcome.FAILED, "account not ACTIVE: " + record.getStatus());
        }
        String oldPassword = record.getPassword();
        String newPassword = run.job.getNewPassword() != null ? run.job.getNewPassword() : passwordGenerator.get();

        transition(run, AccountStatus.PASSWORD_CHANGE_REQUESTED);
        StepOutcome outcome = attempt(run, "submitPasswordChange",
                (driver, proxy) -> driver.submitPasswordChange(record.getEmail(), oldPassword, newPassword, proxy));
        if (outcome != StepOutcome.SUCCESS) {
            return settle(run, "submitPasswordChange", outcome);
        }
        record.changePassword(newPassword, clock.instant());
        transition(run, AccountStatus.PASSWORD_CHANGED);
        transition(run, AccountStatus.ACTIVE);
        return run.result(JobOutcome.SUCCEEDED, null);
    }

    /**
     * Invokes one driver step, retrying transient failures on a rotated proxy.
     * Returns the last outcome; {@code TRANSIENT_FAILURE} means the budget is spent.
     */
    private StepOutcome attempt(Run run, String stepName, DriverStep step) {
        Job job = run.job;
        try {
            return retryPolicy.retryTransient(context -> {
                int attempt = context.getRetryCount() + 1;
                if (attempt > 1) {
                    if (Thread.currentThread().isInterrupted()) {
                        throw new BackOffInterruptedException("interrupted before retrying " + stepName);
                    }
                    rotate(job);
                }
                job.setAttempt(attempt);
                ProxyHandle proxy = job.getAssignedProxy();
                run.record.useProxy(proxy.address(), clock.instant());
                StepOutcome outcome = run.session.execute(stepName, driver -> step.invoke(driver, proxy), stepTimeout);
                if (outcome == StepOutcome.SUCCESS) {
                    proxyPool.reportOutcome(proxy, true);
                    return outcome;
                }
                if (outcome != StepOutcome.TRANSIENT_FAILURE) {
                    return outcome;
                }
                proxyPool.reportOutcome(proxy, false);
                log.warn("[{}] {} step {} transient failure (attempt {}/{}, proxy {})", job.getKind(),
                        run.record.getEmail(), stepName, attempt, retryPolicy.maxAttempts(), proxy);
                throw new TransientStepException(stepName);
            });
        } catch (TransientStepException exhausted) {
            return StepOutcome.TRANSIENT_FAILURE;
        }
    }

    private void rotate(Job job) {
        ProxyHandle previous = job.getAssignedProxy();
        proxyPool.release(previous);
        job.setAssignedProxy(null);
        ProxyHandle next = proxyPool.acquire();
        job.setAssignedProxy(next);
        log.debug("[{}] rotated proxy {} -> {}", job.getKind(), previous, next);
    }

    private WorkflowResult settle(Run run, String stepName, StepOutcome outcome) {
        AccountRecord record = run.record;
        return switch (outcome) {
            case NEEDS_MANUAL_INTERVENTION -> {
                record.markFlagged(clock.instant());
                log.warn("[{}] {} flagged for manual review at step {} in status {} (attempt {}, proxy {})",
                        run.job.getKind(), record.getEmail(), stepName, record.getStatus(), run.job.getAttempt(),
                        run.job.getAssignedProxy());
                yield run.result(JobOutcome.FLAGGED, "manual intervention required at " + stepName);
            }
            case FATAL_FAILURE -> fail(run, "fatal failure at " + stepName);
            case TRANSIENT_FAILURE -> fail(run, "retries exhausted at " + stepName);
            case SUCCESS -> throw new IllegalArgumentException("success is not a settlement");
        };
    }

    private WorkflowResult fail(Run run, String reason) {
        AccountRecord record = run.record;
        if (!record.getStatus().isTerminal()) {
            transition(run, AccountStatus.FAILED);
        }
        log.error("[{}] {} failed: {} (attempt {}, proxy {})", run.job.getKind(), record.getEmail(), reason,
                run.job.getAttempt(), run.job.getAssignedProxy());
        return run.result(JobOutcome.FAILED, reason);
    }

    private void transition(Run run, AccountStatus next) {
        AccountStatus from = run.record.getStatus();
        run.record.advanceTo(next, clock.instant());
        run.path.add(next);
        log.info("[{}] {} {} -> {} (attempt {}, proxy {})", run.job.getKind(), run.record.getEmail(), from, next,
                run.job.getAttempt(), run.job.getAssignedProxy());
    }

    @FunctionalInterface
    private interface DriverStep {
        StepOutcome invoke(BrowserDriver driver, ProxyHandle proxy);
    }

    private static final class Run {
        private final Job job;
        private final AccountRecord record;
        private final WorkerSession session;
        private final BooleanSupplier stopRequested;
        private final List<AccountStatus> path = new ArrayList<>();

        private Run(Job job, AccountRecord record, WorkerSession session, BooleanSupplier stopRequested) {
            this.job = job;
            this.record = record;
            this.session = session;
            this.stopRequested = stopRequested;
            path.add(record.getStatus());
        }

        private WorkflowResult result(JobOutcome outcome, String reason) {
            return new WorkflowResult(outcome, record.getStatus(), path, reason);
        }
    }
}
