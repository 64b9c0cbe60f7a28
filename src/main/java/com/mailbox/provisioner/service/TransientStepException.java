package com.mailbox.provisioner.service;

public class TransientStepException extends RuntimeException {

    public TransientStepException(String message) {
        super(message);
    }
}
