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

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

@Component
@Command(name = "change", mixinStandardHelpOptions = true,
        description = "Change the password of one account, or of every ACTIVE account")
public class ChangeCommand extends AbstractRunCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ChangeCommand.class);
    static final String SECRETS_FILE = "totp-secrets.json";

    @Option(names = {"-e", "--email"}, description = "Only change this account")
    String email;

    @Option(names = {"-f", "--file"}, description = "Accounts file to use instead of provisioner.storage.accounts-path")
    Path accountsFile;

    private final ProvisioningService provisioningService;

    public ChangeCommand(ProvisioningService provisioningService, CredentialStore credentialStore,
                         ExportService exportService, ProvisionerProperties properties, Clock clock) {
        super(credentialStore, exportService, properties, clock);
        this.provisioningService = provisioningService;
    }

    @Override
    public Integer call() throws Exception {
        if (accountsFile != null) {
            try {
                credentialStore.relocate(accountsFile, accountsFile.toAbsolutePath().resolveSibling(SECRETS_FILE));
            } catch (IllegalStateException ex) {
                log.error("Cannot use accounts file {}: {}", accountsFile, ex.getMessage());
                return RunSummary.EXIT_FAILED;
            }
        }
        if (email != null && !credentialStore.exists(email)) {
            log.error("Account not found: {}", email);
            return RunSummary.EXIT_FAILED;
        }
        RunOptions options = runOptions.toRunOptions(properties);
        RunSummary summary;
        try {
            summary = provisioningService.changePasswords(options, email);
        } catch (BrowserDriverUnavailableException | IllegalArgumentException ex) {
            log.error(ex.getMessage());
            return RunSummary.EXIT_FAILED;
        }
        return finish(summary, "accounts_updated");
    }
}
