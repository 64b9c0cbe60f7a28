package com.mailbox.provisioner.cli;

import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.service.ExportService;
import com.mailbox.provisioner.storage.CredentialStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Component
@Command(name = "list", mixinStandardHelpOptions = true, description = "List stored accounts with their status")
public class ListCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    private final CredentialStore credentialStore;
    private final ExportService exportService;

    public ListCommand(CredentialStore credentialStore, ExportService exportService) {
        this.credentialStore = credentialStore;
        this.exportService = exportService;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<AccountRecord> records = credentialStore.listAll();
        for (AccountRecord record : records) {
            out.printf("%-26s %-7s %s%n", record.getStatus(), record.isFlagged() ? "FLAGGED" : "",
                    exportService.textLine(record));
        }
        out.println(records.size() + " accounts");
        out.flush();
        return 0;
    }
}
