package com.mailbox.provisioner.driver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

public class WorkerSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerSession.class);
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final BrowserDriverFactory factory;
    private final boolean headless;
    /**
     * 超时后置空，下一步执行前重新打开
     */
    private BrowserDriver driver;
    private ExecutorService stepExecutor;

    private WorkerSession(BrowserDriverFactory factory, boolean headless) {
        this.factory = factory;
        this.headless = headless;
        this.driver = factory.open(headless);
        this.stepExecutor = newStepExecutor();
    }

    public static WorkerSession open(BrowserDriverFactory factory, boolean headless) {
        return new WorkerSession(factory, headless);
    }

    /**
     * Runs one driver step. A timeout, an exception from the driver, or a
     * {@code null} result is reported as {@link StepOutcome#TRANSIENT_FAILURE}.
     * A timed-out session is discarded and reopened before the next step.
     *
     * @throws BrowserDriverUnavailableException if a discarded session cannot be reopened
     */
    public StepOutcome execute(String stepName, Function<BrowserDriver, StepOutcome> step, Duration timeout) {
        if (driver == null) {
            reopen();
        }
        BrowserDriver current = driver;
        Future<StepOutcome> future = stepExecutor.submit(() -> step.apply(current));
        try {
            StepOutcome outcome = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (outcome == null) {
                log.warn("Driver step {} returned no outcome", stepName);
                return StepOutcome.TRANSIENT_FAILURE;
            }
            return outcome;
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Driver step {} timed out after {} ms, discarding browser session", stepName,
                    timeout.toMillis());
            retire();
            return StepOutcome.TRANSIENT_FAILURE;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("Driver step {} failed: {}", stepName, cause.toString());
            return StepOutcome.TRANSIENT_FAILURE;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for driver step {}", stepName);
            return StepOutcome.TRANSIENT_FAILURE;
        }
    }

    @Override
    public void close() {
        retire();
    }

    private void reopen() {
        try {
            driver = factory.open(headless);
        } catch (RuntimeException ex) {
            throw new BrowserDriverUnavailableException("Could not reopen browser session: " + ex.getMessage(), ex);
        }
        stepExecutor = newStepExecutor();
        log.info("Reopened browser session");
    }

    private void retire() {
        if (stepExecutor != null) {
            // 卡住的步骤线程是守护线程，不等待其结束
            stepExecutor.shutdownNow();
            stepExecutor = null;
        }
        if (driver != null) {
            try {
                driver.close();
            } catch (RuntimeException ex) {
                log.warn("Failed to close browser driver: {}", ex.getMessage());
            }
            driver = null;
        }
    }

    private static ExecutorService newStepExecutor() {
        int id = SEQUENCE.incrementAndGet();
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "driver-step-" + id);
            thread.setDaemon(true);
            return thread;
        });
    }
}
