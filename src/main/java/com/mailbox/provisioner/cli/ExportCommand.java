package com.mailbox.provisioner.cli;

import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.entity.ExportFormat;
import com.mailbox.provisioner.service.ExportService;
import com.mailbox.provisioner.storage.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Component
@Command(name = "export", mixinStandardHelpOptions = true, description = "Export stored accounts")
public class ExportCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output)")
    Path output;

    @Option(names = "--format", defaultValue = "TEXT",
            description = "text (email—-password—-totp) or csv, default: ${DEFAULT-VALUE}")
    ExportFormat format;

    @Spec
    CommandSpec spec;

    private final CredentialStore credentialStore;
    private final ExportService exportService;

    public ExportCommand(CredentialStore credentialStore, ExportService exportService) {
        this.credentialStore = credentialStore;
        this.exportService = exportService;
    }

    @Override
    public Integer call() {
        List<AccountRecord> snapshot = credentialStore.listAll();
        byte[] content = exportService.export(snapshot, format);
        PrintWriter out = spec.commandLine().getOut();
        if (output == null) {
            out.print(new String(content, StandardCharsets.UTF_8));
            out.flush();
            return 0;
        }
        try {
            exportService.writeTo(output, content);
        } catch (IOException ex) {
            log.error("Failed to export accounts to {}: {}", output.toAbsolutePath(), ex.getMessage());
            return 1;
        }
        log.info("Exported {} accounts to {} ({})", snapshot.size(), output.toAbsolutePath(), format);
        out.println("Exported " + snapshot.size() + " accounts to " + output);
        out.flush();
        return 0;
    }
}
