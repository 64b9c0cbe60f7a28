package com.mailbox.provisioner.service;

/**
 * No proxy is currently eligible for assignment. Fatal for the affected job only.
 */
public class PoolExhaustedException extends RuntimeException {

    public PoolExhaustedException(String message) {
        super(message);
    }
}
