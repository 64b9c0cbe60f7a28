package com.mailbox.provisioner.driver;

@FunctionalInterface
public interface BrowserDriverFactory {

    BrowserDriver open(boolean headless);
}
