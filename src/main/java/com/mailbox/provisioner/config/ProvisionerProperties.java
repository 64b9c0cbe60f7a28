package com.mailbox.provisioner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "provisioner")
public class ProvisionerProperties {

    private int threadCount = 1;
    private int queueCapacity = 64;
    private boolean headless = true;
    /**
     * 每个步骤的最大尝试次数
     */
    private int retryLimit = 3;
    private Duration retryBackoffBase = Duration.ofSeconds(2);
    private Duration retryBackoffMax = Duration.ofSeconds(30);
    private Duration stepTimeout = Duration.ofSeconds(30);
    private String emailDomain = "outlook.com";
    private int passwordLength = 12;
    private String exportDir = ".";

    private Proxy proxy = new Proxy();
    private Storage storage = new Storage();

    @Data
    public static class Proxy {
        /**
         * 连续失败超过该值后进入冷却
         */
        private int failureThreshold = 3;
        private Duration baseBackoff = Duration.ofSeconds(30);
        private Duration maxBackoff = Duration.ofMinutes(10);
        /**
         * 单个代理同时服务的会话数上限，0 表示不限
         */
        private int maxSessionsPerProxy = 0;
    }

    @Data
    public static class Storage {
        private String accountsPath = "accounts-state.json";
        private String secretsPath = "totp-secrets.json";
        private int writeAttempts = 3;
        private Duration writeBackoff = Duration.ofMillis(200);
    }
}
