package com.mailbox.provisioner;

import static org.assertj.core.api.Assertions.assertThat;

import com.mailbox.provisioner.driver.BrowserDriverFactory;
import com.mailbox.provisioner.storage.CredentialStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
        args = "list",
        properties = {
                "provisioner.storage.accounts-path=target/context-test/accounts-state.json",
                "provisioner.storage.secrets-path=target/context-test/totp-secrets.json"
        })
class MailboxProvisionerApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private MailboxProvisionerApplication application;

    @Test
    void listRunsAgainstEmptyStore() {
        assertThat(application.getExitCode()).isZero();
        assertThat(context.getBean(CredentialStore.class).size()).isZero();
        assertThat(context.getBeanProvider(BrowserDriverFactory.class).getIfAvailable()).isNull();
    }
}
