package com.mailbox.provisioner.cli;

import com.mailbox.provisioner.config.ProvisionerProperties;
import com.mailbox.provisioner.config.RunOptions;
import com.mailbox.provisioner.driver.BrowserDriverUnavailableException;
import com.mailbox.provisioner.service.ExportService;
import com.mailbox.provisioner.service.ProvisioningService;
import com.mailbox.provisioner.service.RunSummary;
import com.mailbox.provisioner.storage.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Clock;
import java.util.concurrent.Callable;

@Component
@Command(name = "create", mixinStandardHelpOptions = true, description = "Create new accounts")
public class CreateCommand extends AbstractRunCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(CreateCommand.class);

    @Option(names = {"-c", "--count"}, defaultValue = "1", description = "Number of accounts to create")
    int count;

    private final ProvisioningService provisioningService;

    public CreateCommand(ProvisioningService provisioningService, CredentialStore credentialStore,
                         ExportService exportService, ProvisionerProperties properties, Clock clock) {
        super(credentialStore, exportService, properties, clock);
        this.provisioningService = provisioningService;
    }

    @Override
    public Integer call() throws Exception {
        RunOptions options = runOptions.toRunOptions(properties);
        RunSummary summary;
        try {
            summary = provisioningService.createAccounts(options, count);
        } catch (BrowserDriverUnavailableException | IllegalArgumentException ex) {
            log.error(ex.getMessage());
            return RunSummary.EXIT_FAILED;
        }
        return finish(summary, "accounts_export");
    }
}
