package com.mailbox.provisioner.config;

public enum ProxySource {
    /**
     * 直连
     */
    NONE,
    SINGLE,
    FILE
}
