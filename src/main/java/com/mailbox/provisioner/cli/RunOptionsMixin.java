package com.mailbox.provisioner.cli;

import com.mailbox.provisioner.config.ProvisionerProperties;
import com.mailbox.provisioner.config.RunOptions;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by {@code create} and {@code change}.
 */
public class RunOptionsMixin {

    @Option(names = {"-t", "--threads"}, description = "Worker threads (default: provisioner.thread-count)")
    Integer threads;

    @Option(names = {"-p", "--proxy"}, description = "SOCKS5 proxy, host:port")
    String proxy;

    @Option(names = {"-P", "--proxy-file"}, description = "File with one SOCKS5 proxy (host:port) per line")
    Path proxyFile;

    @Option(names = "--no-headless", description = "Show the browser window")
    boolean noHeadless;

    RunOptions toRunOptions(ProvisionerProperties properties) {
        RunOptions.RunOptionsBuilder builder = RunOptions.defaults(properties).toBuilder();
        if (threads != null) {
            builder.threadCount(threads);
        }
        if (noHeadless) {
            builder.headless(false);
        }
        return builder.build().withProxies(proxy, proxyFile);
    }
}
