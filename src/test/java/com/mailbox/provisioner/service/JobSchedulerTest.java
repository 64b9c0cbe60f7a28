package com.mailbox.provisioner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.mailbox.provisioner.config.ProvisionerProperties;
import com.mailbox.provisioner.driver.BrowserDriverFactory;
import com.mailbox.provisioner.driver.BrowserDriverUnavailableException;
import com.mailbox.provisioner.driver.ScriptedBrowserDriver;
import com.mailbox.provisioner.driver.ScriptedBrowserDriver.Step;
import com.mailbox.provisioner.driver.StepOutcome;
import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.entity.AccountStatus;
import com.mailbox.provisioner.entity.Identity;
import com.mailbox.provisioner.entity.Job;
import com.mailbox.provisioner.entity.JobOutcome;
import com.mailbox.provisioner.entity.ProxyHandle;
import com.mailbox.provisioner.entity.TestAccounts;
import com.mailbox.provisioner.storage.CredentialStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(30)
class JobSchedulerTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private CredentialStore store;
    private IdentityGenerator identities;
    private final List<ScriptedBrowserDriver> opened = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-17T10:00:00Z"));
        store = new CredentialStore(JsonMapper.builder().findAndAddModules().build(),
                dir.resolve("accounts-state.json"), dir.resolve("totp-secrets.json"), RetryPolicy.noBackoff(2));
        identities = new IdentityGenerator(new Random(), clock, "outlook.com", 12);
    }

    @Test
    void createsAccountsAcrossWorkers() throws InterruptedException {
        JobScheduler scheduler = scheduler(4, proxyPool(List.of("10.0.0.1:1080", "10.0.0.2:1080")),
                factory(ScriptedBrowserDriver::new));

        RunSummary summary = runAll(scheduler, 10, Job::create);

        assertThat(summary.count(JobOutcome.SUCCEEDED)).isEqualTo(10);
        assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_OK);
        assertThat(store.listAll()).hasSize(10).allSatisfy(record -> {
            assertThat(record.getStatus()).isEqualTo(AccountStatus.ACTIVE);
            assertThat(record.hasTotpSecret()).isTrue();
        });
        assertThat(opened).hasSize(10).allSatisfy(driver -> assertThat(driver.isClosed()).isTrue());
    }

    @Test
    void flaggedAccountsArePersistedAndExitThree() throws InterruptedException {
        JobScheduler scheduler = scheduler(2, proxyPool(List.of()),
                factory(() -> new ScriptedBrowserDriver().script(Step.VERIFICATION, StepOutcome.NEEDS_MANUAL_INTERVENTION)));

        RunSummary summary = runAll(scheduler, 3, Job::create);

        assertThat(summary.count(JobOutcome.FLAGGED)).isEqualTo(3);
        assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_FLAGGED);
        assertThat(store.listAll()).hasSize(3).allSatisfy(record -> {
            assertThat(record.isFlagged()).isTrue();
            assertThat(record.getStatus()).isEqualTo(AccountStatus.VERIFICATION_PENDING);
            assertThat(record.getProxyUsed()).isEqualTo("direct");
        });
    }

    @Test
    void passwordChangeOnNonActiveAccountIsRejectedWithoutWrite() throws InterruptedException, IOException {
        store.upsert(TestAccounts.initiated("amy@outlook.com"));
        byte[] before = Files.readAllBytes(store.getAccountsPath());
        BrowserDriverFactory factory = mock(BrowserDriverFactory.class);
        JobScheduler scheduler = scheduler(1, proxyPool(List.of()), factory);

        RunSummary summary = runAll(scheduler, 1, () -> Job.changePassword("amy@outlook.com"));

        assertThat(summary.failedEmails()).containsExactly("amy@outlook.com");
        assertThat(Files.readAllBytes(store.getAccountsPath())).isEqualTo(before);
        assertThat(store.get("amy@outlook.com").orElseThrow().getStatus()).isEqualTo(AccountStatus.INITIATED);
        verifyNoInteractions(factory);
    }

    @Test
    void passwordChangeUpdatesStoredAccount() throws InterruptedException {
        store.upsert(TestAccounts.active("amy@outlook.com", "JBSWY3DPEHPK3PXPJBSWY3DPEHPK3PXP"));
        JobScheduler scheduler = scheduler(1, proxyPool(List.of("10.0.0.1:1080")), factory(ScriptedBrowserDriver::new));

        RunSummary summary = runAll(scheduler, 1,
                () -> Job.changePassword("amy@outlook.com", "Fr3sh!pass"));

        assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_OK);
        AccountRecord stored = store.get("amy@outlook.com").orElseThrow();
        assertThat(stored.getPassword()).isEqualTo("Fr3sh!pass");
        assertThat(stored.getStatus()).isEqualTo(AccountStatus.ACTIVE);
        assertThat(stored.getTotpSecret()).isEqualTo("JBSWY3DPEHPK3PXPJBSWY3DPEHPK3PXP");
    }

    @Test
    void exhaustedPoolFailsRemainingJobsWithoutCrashing() throws InterruptedException {
        ProvisionerProperties.Proxy strict = new ProvisionerProperties.Proxy();
        strict.setFailureThreshold(0);
        ProxyPoolService pool = new ProxyPoolService(List.of("10.0.0.1:1080"), strict, clock);
        JobScheduler scheduler = scheduler(1, pool,
                factory(() -> new ScriptedBrowserDriver().script(Step.SIGNUP, StepOutcome.TRANSIENT_FAILURE)),
                RetryPolicy.noBackoff(1));

        RunSummary summary = runAll(scheduler, 3, Job::create);

        assertThat(summary.count(JobOutcome.FAILED)).isEqualTo(3);
        assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_FAILED);
        assertThat(opened).hasSize(1);
        assertThat(store.listAll()).singleElement()
                .satisfies(record -> assertThat(record.getStatus()).isEqualTo(AccountStatus.FAILED));
    }

    @Test
    void concurrentCreatesNeverShareAnEmail() throws InterruptedException {
        identities = new IdentityGenerator(new Random() {
            @Override
            protected int next(int bits) {
                return 0;
            }
        }, clock, "outlook.com", 12);
        JobScheduler scheduler = scheduler(2, proxyPool(List.of()), factory(() -> new ScriptedBrowserDriver() {
            @Override
            public StepOutcome submitSignupForm(Identity identity, ProxyHandle proxy) {
                try {
                    Thread.sleep(300);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return super.submitSignupForm(identity, proxy);
            }
        }));

        RunSummary summary = runAll(scheduler, 2, Job::create);

        assertThat(summary.count(JobOutcome.SUCCEEDED)).isEqualTo(1);
        assertThat(summary.count(JobOutcome.FAILED)).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
        assertThat(opened).hasSize(1);
    }

    @Test
    void reservationIsReleasedWhenCreateFails() throws InterruptedException {
        identities = new IdentityGenerator(new Random() {
            @Override
            protected int next(int bits) {
                return 0;
            }
        }, clock, "outlook.com", 12);
        String email = identities.next().email();
        BrowserDriverFactory broken = headless -> {
            throw new BrowserDriverUnavailableException("no browser installed");
        };
        JobScheduler scheduler = scheduler(1, proxyPool(List.of()), broken);

        RunSummary summary = runAll(scheduler, 1, Job::create);

        assertThat(summary.count(JobOutcome.FAILED)).isEqualTo(1);
        assertThat(store.reserve(email)).isTrue();
    }

    @Test
    void unavailableDriverFailsJobWithoutWrite() throws InterruptedException {
        BrowserDriverFactory broken = headless -> {
            throw new BrowserDriverUnavailableException("no browser installed");
        };
        JobScheduler scheduler = scheduler(1, proxyPool(List.of("10.0.0.1:1080")), broken);

        RunSummary summary = runAll(scheduler, 2, Job::create);

        assertThat(summary.count(JobOutcome.FAILED)).isEqualTo(2);
        assertThat(store.size()).isZero();
    }

    @Test
    void storeWriteFailureStopsTheRun() throws InterruptedException, IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "file");
        store = new CredentialStore(JsonMapper.builder().findAndAddModules().build(),
                blocker.resolve("accounts.json"), dir.resolve("secrets.json"), RetryPolicy.noBackoff(1));
        JobScheduler scheduler = scheduler(1, proxyPool(List.of()), factory(ScriptedBrowserDriver::new));

        RunSummary summary = runAll(scheduler, 1, Job::create);

        assertThat(summary.runError()).contains("credential store write failed");
        assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_FAILED);
        assertThat(scheduler.isStopRequested()).isTrue();
    }

    @Test
    void shutdownAbandonsQueuedJobs() throws InterruptedException {
        JobScheduler scheduler = scheduler(2, proxyPool(List.of()), factory(ScriptedBrowserDriver::new));
        for (int i = 0; i < 3; i++) {
            scheduler.submit(Job.create());
        }

        scheduler.shutdown();
        scheduler.start();
        RunSummary summary = scheduler.awaitCompletion();

        assertThat(summary.abandoned()).isEqualTo(3);
        assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_FAILED);
        assertThat(opened).isEmpty();
        assertThatThrownBy(() -> scheduler.submit(Job.create())).isInstanceOf(IllegalStateException.class);
    }

    private RunSummary runAll(JobScheduler scheduler, int count, Supplier<Job> jobs)
            throws InterruptedException {
        scheduler.start();
        for (int i = 0; i < count; i++) {
            scheduler.submit(jobs.get());
        }
        return scheduler.awaitCompletion();
    }

    private ProxyPoolService proxyPool(List<String> addresses) {
        return new ProxyPoolService(addresses, new ProvisionerProperties.Proxy(), clock);
    }

    private BrowserDriverFactory factory(Supplier<ScriptedBrowserDriver> drivers) {
        return headless -> {
            ScriptedBrowserDriver driver = drivers.get();
            opened.add(driver);
            return driver;
        };
    }

    private JobScheduler scheduler(int threads, ProxyPoolService pool, BrowserDriverFactory factory) {
        return scheduler(threads, pool, factory, RetryPolicy.noBackoff(3));
    }

    private JobScheduler scheduler(int threads, ProxyPoolService pool, BrowserDriverFactory factory,
                                   RetryPolicy retryPolicy) {
        TotpService totpService = new TotpService();
        AccountWorkflowEngine engine = new AccountWorkflowEngine(totpService, pool, retryPolicy,
                Duration.ofSeconds(5), identities::randomPassword, clock);
        return new JobScheduler(threads, 4, true, engine, store, pool, factory, identities, clock);
    }
}
