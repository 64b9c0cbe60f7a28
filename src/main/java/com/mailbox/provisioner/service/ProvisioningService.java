package com.mailbox.provisioner.service;

import com.mailbox.provisioner.config.ProvisionerProperties;
import com.mailbox.provisioner.config.ProxySource;
import com.mailbox.provisioner.config.RunOptions;
import com.mailbox.provisioner.driver.BrowserDriverFactory;
import com.mailbox.provisioner.driver.BrowserDriverUnavailableException;
import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.entity.AccountStatus;
import com.mailbox.provisioner.entity.Job;
import com.mailbox.provisioner.storage.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Service
public class ProvisioningService {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningService.class);
    private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(2);

    private final TotpService totpService;
    private final IdentityGenerator identityGenerator;
    private final CredentialStore credentialStore;
    private final ProxyListLoader proxyListLoader;
    private final ProvisionerProperties properties;
    private final ObjectProvider<BrowserDriverFactory> driverFactories;
    private final Clock clock;

    public ProvisioningService(TotpService totpService, IdentityGenerator identityGenerator,
                               CredentialStore credentialStore, ProxyListLoader proxyListLoader,
                               ProvisionerProperties properties, ObjectProvider<BrowserDriverFactory> driverFactories,
                               Clock clock) {
        this.totpService = totpService;
        this.identityGenerator = identityGenerator;
        this.credentialStore = credentialStore;
        this.proxyListLoader = proxyListLoader;
        this.properties = properties;
        this.driverFactories = driverFactories;
        this.clock = clock;
    }

    public RunSummary createAccounts(RunOptions options, int count) throws IOException, InterruptedException {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1");
        }
        BrowserDriverFactory driverFactory = requireDriverFactory();
        List<Job> jobs = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            jobs.add(Job.create());
        }
        log.info("Creating {} accounts with {} threads", count, options.threadCount());
        return execute(newScheduler(options, driverFactory), jobs);
    }

    /**
     * Changes the password of {@code email}, or of every ACTIVE account when
     * {@code email} is {@code null}.
     */
    public RunSummary changePasswords(RunOptions options, String email) throws IOException, InterruptedException {
        List<String> targets = new ArrayList<>();
        if (email != null && !email.isBlank()) {
            targets.add(email.trim());
        } else {
            for (AccountRecord record : credentialStore.listAll()) {
                if (record.getStatus() == AccountStatus.ACTIVE) {
                    targets.add(record.getEmail());
                }
            }
        }
        if (targets.isEmpty()) {
            log.warn("No ACTIVE accounts to change");
            return new RunSummary();
        }
        BrowserDriverFactory driverFactory = requireDriverFactory();
        List<Job> jobs = new ArrayList<>(targets.size());
        for (String target : targets) {
            jobs.add(Job.changePassword(target));
        }
        log.info("Changing passwords of {} accounts with {} threads", targets.size(), options.threadCount());
        return execute(newScheduler(options, driverFactory), jobs);
    }

    JobScheduler newScheduler(RunOptions options, BrowserDriverFactory driverFactory) throws IOException {
        ProxyPoolService proxyPool = new ProxyPoolService(resolveProxies(options), properties.getProxy(), clock);
        RetryPolicy retryPolicy = RetryPolicy.exponential(
                options.retryLimit(), options.retryBackoffBase(), options.retryBackoffMax());
        AccountWorkflowEngine engine = new AccountWorkflowEngine(
                totpService, proxyPool, retryPolicy, options.stepTimeout(), identityGenerator::randomPassword, clock);
        return new JobScheduler(options.threadCount(), options.queueCapacity(), options.headless(), engine,
                credentialStore, proxyPool, driverFactory, identityGenerator, clock);
    }

    private List<String> resolveProxies(RunOptions options) throws IOException {
        if (options.proxySource() == ProxySource.NONE) {
            return List.of();
        }
        List<String> proxies = proxyListLoader.resolve(options.proxy(), options.proxyFile());
        if (proxies.isEmpty()) {
            throw new IllegalArgumentException("No valid proxies in " + (options.proxyFile() != null
                    ? options.proxyFile().toAbsolutePath() : options.proxy()));
        }
        return proxies;
    }

    private BrowserDriverFactory requireDriverFactory() {
        BrowserDriverFactory factory = driverFactories.getIfAvailable();
        if (factory == null) {
            throw new BrowserDriverUnavailableException(
                    "No BrowserDriverFactory bean registered; a browser driver must be configured to run jobs");
        }
        return factory;
    }

    private RunSummary execute(JobScheduler scheduler, List<Job> jobs) throws InterruptedException {
        Thread hook = new Thread(() -> {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(SHUTDOWN_GRACE)) {
                    log.warn("Workers still running after {}", SHUTDOWN_GRACE);
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }, "provision-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        scheduler.start();
        int submitted = 0;
        try {
            for (Job job : jobs) {
                scheduler.submit(job);
                submitted++;
            }
        } catch (IllegalStateException stopped) {
            log.warn("Stopped submitting after {} of {} jobs: {}", submitted, jobs.size(), stopped.getMessage());
        } catch (InterruptedException ex) {
            scheduler.shutdown();
            throw ex;
        }

        RunSummary summary = scheduler.awaitCompletion();
        if (submitted < jobs.size()) {
            summary.recordAbandoned(jobs.size() - submitted);
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shuttingDown) {
            log.debug("JVM shutting down, hook stays registered");
        }
        log.info("Run finished: {}", summary);
        return summary;
    }
}
