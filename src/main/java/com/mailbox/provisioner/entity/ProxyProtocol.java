package com.mailbox.provisioner.entity;

public enum ProxyProtocol {
    SOCKS5
}
