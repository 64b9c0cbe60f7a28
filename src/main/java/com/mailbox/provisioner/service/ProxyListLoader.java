package com.mailbox.provisioner.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class ProxyListLoader {
    private static final Logger log = LoggerFactory.getLogger(ProxyListLoader.class);
    private static final String SCHEME = "socks5://";

    /**
     * Merges an optional single proxy with an optional proxy file, dropping duplicates.
     */
    public List<String> resolve(String singleProxy, Path proxyFile) throws IOException {
        Set<String> merged = new LinkedHashSet<>();
        if (singleProxy != null && !singleProxy.isBlank()) {
            String normalized = normalize(singleProxy);
            if (normalized == null) {
                throw new IllegalArgumentException("Invalid proxy, expected host:port: " + singleProxy);
            }
            merged.add(normalized);
        }
        if (proxyFile != null) {
            merged.addAll(load(proxyFile));
        }
        return new ArrayList<>(merged);
    }

    public List<String> load(Path proxyFile) throws IOException {
        List<String> proxies = parse(Files.readAllLines(proxyFile, StandardCharsets.UTF_8));
        log.info("Loaded {} proxies from {}", proxies.size(), proxyFile.toAbsolutePath());
        return proxies;
    }

    public List<String> parse(List<String> lines) {
        Set<String> proxies = new LinkedHashSet<>();
        int lineNo = 0;
        for (String rawLine : lines) {
            lineNo++;
            if (rawLine == null) {
                continue;
            }
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String normalized = normalize(line);
            if (normalized == null) {
                log.warn("Skipping malformed proxy entry on line {}: {}", lineNo, line);
                continue;
            }
            proxies.add(normalized);
        }
        return new ArrayList<>(proxies);
    }

    static String normalize(String entry) {
        String value = entry.trim();
        if (value.toLowerCase(Locale.ROOT).startsWith(SCHEME)) {
            value = value.substring(SCHEME.length());
        }
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1) {
            return null;
        }
        String host = value.substring(0, colon);
        if (host.isBlank() || host.chars().anyMatch(Character::isWhitespace)) {
            return null;
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1));
        } catch (NumberFormatException ex) {
            return null;
        }
        if (port < 1 || port > 65535) {
            return null;
        }
        return host + ":" + port;
    }
}
