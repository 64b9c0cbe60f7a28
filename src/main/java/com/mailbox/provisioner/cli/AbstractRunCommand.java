package com.mailbox.provisioner.cli;

import com.mailbox.provisioner.config.ProvisionerProperties;
import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.entity.ExportFormat;
import com.mailbox.provisioner.service.ExportService;
import com.mailbox.provisioner.service.RunSummary;
import com.mailbox.provisioner.storage.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

abstract class AbstractRunCommand {
    private static final Logger log = LoggerFactory.getLogger(AbstractRunCommand.class);
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    @Mixin
    RunOptionsMixin runOptions;

    @Spec
    CommandSpec spec;

    protected final CredentialStore credentialStore;
    protected final ExportService exportService;
    protected final ProvisionerProperties properties;
    protected final Clock clock;

    protected AbstractRunCommand(CredentialStore credentialStore, ExportService exportService,
                                 ProvisionerProperties properties, Clock clock) {
        this.credentialStore = credentialStore;
        this.exportService = exportService;
        this.properties = properties;
        this.clock = clock;
    }

    protected int finish(RunSummary summary, String exportPrefix) {
        PrintWriter out = spec.commandLine().getOut();
        List<AccountRecord> snapshot = credentialStore.listAll();
        Path target = Path.of(properties.getExportDir(),
                exportPrefix + "_" + LocalDateTime.now(clock).format(FILE_STAMP) + ".txt");
        try {
            exportService.writeTo(target, exportService.export(snapshot, ExportFormat.TEXT));
            log.info("Accounts exported to {}", target.toAbsolutePath());
        } catch (IOException ex) {
            log.error("Failed to export accounts to {}: {}", target.toAbsolutePath(), ex.getMessage());
        }

        out.println();
        out.println("===== accounts =====");
        for (AccountRecord record : snapshot) {
            out.println(exportService.textLine(record));
        }
        out.println("====================");
        out.println(summary);
        if (!summary.flaggedEmails().isEmpty()) {
            out.println("Flagged for manual review: " + String.join(", ", summary.flaggedEmails()));
        }
        if (!summary.failedEmails().isEmpty()) {
            out.println("Failed: " + String.join(", ", summary.failedEmails()));
        }
        out.flush();
        return summary.exitCode();
    }
}
