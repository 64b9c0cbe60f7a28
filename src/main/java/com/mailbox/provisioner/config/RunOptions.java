package com.mailbox.provisioner.config;

import lombok.Builder;

import java.nio.file.Path;
import java.time.Duration;

@Builder(toBuilder = true)
public record RunOptions(
        int threadCount,
        int queueCapacity,
        ProxySource proxySource,
        String proxy,
        Path proxyFile,
        boolean headless,
        int retryLimit,
        Duration retryBackoffBase,
        Duration retryBackoffMax,
        Duration stepTimeout
) {

    public RunOptions {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be >= 1");
        }
        if (retryLimit < 1) {
            throw new IllegalArgumentException("retryLimit must be >= 1");
        }
        if (proxySource == null) {
            proxySource = ProxySource.NONE;
        }
    }

    public static RunOptions defaults(ProvisionerProperties properties) {
        return RunOptions.builder()
                .threadCount(properties.getThreadCount())
                .queueCapacity(properties.getQueueCapacity())
                .proxySource(ProxySource.NONE)
                .headless(properties.isHeadless())
                .retryLimit(properties.getRetryLimit())
                .retryBackoffBase(properties.getRetryBackoffBase())
                .retryBackoffMax(properties.getRetryBackoffMax())
                .stepTimeout(properties.getStepTimeout())
                .build();
    }

    /**
     * A proxy file takes precedence as the source; a single proxy given next to
     * it is merged into the file's list.
     */
    public RunOptions withProxies(String singleProxy, Path file) {
        ProxySource source = file != null ? ProxySource.FILE
                : singleProxy != null && !singleProxy.isBlank() ? ProxySource.SINGLE
                : ProxySource.NONE;
        return toBuilder().proxySource(source).proxy(singleProxy).proxyFile(file).build();
    }
}
