package com.mailbox.provisioner;

import com.mailbox.provisioner.cli.ProvisionerCommand;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

@SpringBootApplication
public class MailboxProvisionerApplication implements CommandLineRunner, ExitCodeGenerator {

    private final IFactory factory;
    private final ProvisionerCommand command;
    private int exitCode;

    public MailboxProvisionerApplication(IFactory factory, ProvisionerCommand command) {
        this.factory = factory;
        this.command = command;
    }

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MailboxProvisionerApplication.class, args)));
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(command, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
