package com.mailbox.provisioner.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

@Component
@Command(
        name = "mailbox-provisioner",
        mixinStandardHelpOptions = true,
        version = "mailbox-provisioner 1.0.0",
        description = "Bulk mailbox provisioning with TOTP binding and SOCKS5 proxy rotation",
        subcommands = {
                CreateCommand.class,
                ChangeCommand.class,
                ExportCommand.class,
                ListCommand.class
        }
)
public class ProvisionerCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
