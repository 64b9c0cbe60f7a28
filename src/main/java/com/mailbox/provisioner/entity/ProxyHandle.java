package com.mailbox.provisioner.entity;

/**
 * Reference to a pooled proxy handed to a worker. Holding a handle does not
 * grant exclusive use of the proxy.
 */
public record ProxyHandle(String address, ProxyProtocol protocol) {

    private static final ProxyHandle DIRECT = new ProxyHandle("direct", null);

    public ProxyHandle {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("proxy address required");
        }
    }

    public static ProxyHandle socks5(String address) {
        return new ProxyHandle(address, ProxyProtocol.SOCKS5);
    }

    /**
     * 未配置代理时使用的直连句柄。
     */
    public static ProxyHandle direct() {
        return DIRECT;
    }

    public boolean isDirect() {
        return protocol == null;
    }

    /**
     * e.g. {@code socks5://127.0.0.1:1080}
     */
    public String toUri() {
        return isDirect() ? address : "socks5://" + address;
    }

    @Override
    public String toString() {
        return address;
    }
}
