package com.mailbox.provisioner.service;

import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;

/**
 * RFC 6238 time-based one-time codes (HMAC-SHA1, 30 second step, 6 digits).
 * Every operation takes the instant explicitly.
 */
@Service
public class TotpService {
    private static final int CODE_DIGITS = 6;
    private static final int TIME_STEP_SECONDS = 30;
    private static final int SECRET_BYTES = 20;
    private static final int SKEW_WINDOWS = 1;
    private static final char[] BASE32_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ234567".toCharArray();

    private final SecureRandom random;

    public TotpService() {
        this(new SecureRandom());
    }

    TotpService(SecureRandom random) {
        this.random = random;
    }

    /**
     * 160 位随机密钥，base32 编码，无填充。
     */
    public String generateSecret() {
        byte[] key = new byte[SECRET_BYTES];
        random.nextBytes(key);
        return encodeBase32(key);
    }

    public String currentCode(String secret, Instant time) {
        return codeForCounter(decodeBase32(secret), counterAt(time));
    }

    /**
     * Accepts the code of the window containing {@code time} and of the windows
     * immediately before and after it.
     */
    public boolean verify(String secret, String code, Instant time) {
        if (code == null) {
            return false;
        }
        String normalized = code.trim();
        if (normalized.length() != CODE_DIGITS) {
            return false;
        }
        byte[] key = decodeBase32(secret);
        long counter = counterAt(time);
        for (long offset = -SKEW_WINDOWS; offset <= SKEW_WINDOWS; offset++) {
            if (codeForCounter(key, counter + offset).equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    public int secondsRemaining(Instant time) {
        return TIME_STEP_SECONDS - (int) Math.floorMod(time.getEpochSecond(), (long) TIME_STEP_SECONDS);
    }

    private long counterAt(Instant time) {
        return Math.floorDiv(time.getEpochSecond(), (long) TIME_STEP_SECONDS);
    }

    private String codeForCounter(byte[] key, long counter) {
        byte[] counterBytes = ByteBuffer.allocate(8).putLong(counter).array();
        byte[] hash;
        try {
            Mac mac = Mac.getInstance("HmacSHA1");
            mac.init(new SecretKeySpec(key, "HmacSHA1"));
            hash = mac.doFinal(counterBytes);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HmacSHA1 unavailable", ex);
        }

        int offset = hash[hash.length - 1] & 0x0f;
        int binary = ((hash[offset] & 0x7f) << 24)
                | ((hash[offset + 1] & 0xff) << 16)
                | ((hash[offset + 2] & 0xff) << 8)
                | (hash[offset + 3] & 0xff);
        int otp = binary % (int) Math.pow(10, CODE_DIGITS);
        return String.format("%0" + CODE_DIGITS + "d", otp);
    }

    static String encodeBase32(byte[] data) {
        StringBuilder out = new StringBuilder((data.length * 8 + 4) / 5);
        int buffer = 0;
        int bits = 0;
        for (byte b : data) {
            buffer = (buffer << 8) | (b & 0xff);
            bits += 8;
            while (bits >= 5) {
                out.append(BASE32_ALPHABET[(buffer >> (bits - 5)) & 0x1f]);
                bits -= 5;
            }
        }
        if (bits > 0) {
            out.append(BASE32_ALPHABET[(buffer << (5 - bits)) & 0x1f]);
        }
        return out.toString();
    }

    static byte[] decodeBase32(String input) {
        if (input == null) {
            throw new IllegalArgumentException("secret empty");
        }
        String normalized = input.trim().replace("=", "").replace(" ", "").toUpperCase();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("secret empty");
        }
        ByteBuffer buffer = ByteBuffer.allocate((normalized.length() * 5) / 8);
        int bits = 0;
        int value = 0;
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            int index = base32Index(c);
            value = (value << 5) | index;
            bits += 5;
            if (bits >= 8) {
                buffer.put((byte) ((value >> (bits - 8)) & 0xff));
                bits -= 8;
            }
        }
        buffer.flip();
        byte[] out = new byte[buffer.remaining()];
        buffer.get(out);
        if (out.length == 0) {
            throw new IllegalArgumentException("secret too short");
        }
        return out;
    }

    private static int base32Index(char c) {
        if (c >= 'A' && c <= 'Z') {
            return c - 'A';
        }
        if (c >= '2' && c <= '7') {
            return 26 + (c - '2');
        }
        throw new IllegalArgumentException("invalid base32 char");
    }
}
