package com.mailbox.provisioner.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.json.JsonMapper;
import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.entity.TestAccounts;
import com.mailbox.provisioner.service.ExportService;
import com.mailbox.provisioner.service.RetryPolicy;
import com.mailbox.provisioner.storage.CredentialStore;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class ExportCommandTest {

    private static final String SECRET = "JBSWY3DPEHPK3PXPJBSWY3DPEHPK3PXP";

    @TempDir
    Path dir;

    private CredentialStore store;
    private final ExportService exportService = new ExportService();
    private final StringWriter out = new StringWriter();

    @BeforeEach
    void setUp() {
        store = new CredentialStore(JsonMapper.builder().findAndAddModules().build(),
                dir.resolve("accounts-state.json"), dir.resolve("totp-secrets.json"), RetryPolicy.noBackoff(1));
        store.upsert(TestAccounts.active("zoe@outlook.com", SECRET));
        AccountRecord flagged = TestAccounts.initiated("amy@outlook.com");
        flagged.markFlagged(TestAccounts.NOW);
        store.upsert(flagged);
    }

    @Test
    void printsTextExportToStandardOutput() {
        int exitCode = command(new ExportCommand(store, exportService)).execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo(
                "amy@outlook.com—-Pa55!word—-\n"
                        + "zoe@outlook.com—-Pa55!word—-" + SECRET + "\n");
    }

    @Test
    void writesCsvToFile() throws IOException {
        Path target = dir.resolve("export.csv");

        int exitCode = command(new ExportCommand(store, exportService))
                .execute("--format", "csv", "-o", target.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readAllLines(target)).containsExactly(
                "email,password,totp_secret",
                "amy@outlook.com,Pa55!word,",
                "zoe@outlook.com,Pa55!word," + SECRET);
    }

    @Test
    void exportingTwiceGivesIdenticalBytes() throws IOException {
        Path first = dir.resolve("first.txt");
        Path second = dir.resolve("second.txt");

        command(new ExportCommand(store, exportService)).execute("-o", first.toString());
        command(new ExportCommand(store, exportService)).execute("-o", second.toString());

        assertThat(Files.readAllBytes(first)).isEqualTo(Files.readAllBytes(second));
    }

    @Test
    void listShowsStatusAndFlag() {
        int exitCode = command(new ListCommand(store, exportService)).execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("INITIATED")
                .contains("FLAGGED")
                .contains("ACTIVE")
                .contains("2 accounts");
    }

    private CommandLine command(Object command) {
        return new CommandLine(command)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setOut(new PrintWriter(out, true));
    }
}
