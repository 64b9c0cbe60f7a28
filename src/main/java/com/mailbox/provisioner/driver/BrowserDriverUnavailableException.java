package com.mailbox.provisioner.driver;

public class BrowserDriverUnavailableException extends RuntimeException {

    public BrowserDriverUnavailableException(String message) {
        super(message);
    }

    public BrowserDriverUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
