package com.mailbox.provisioner.service;

import com.mailbox.provisioner.config.ProvisionerProperties;
import com.mailbox.provisioner.entity.Identity;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Random;

@Component
public class IdentityGenerator {
    private static final List<String> FIRST_NAMES = List.of(
            "Alex", "Jamie", "Jordan", "Taylor", "Casey", "Riley", "Avery",
            "Quinn", "Morgan", "Dakota", "Reese", "Emerson", "Finley", "Rowan",
            "Skyler", "Charlie", "Blake", "River", "Sage", "Phoenix");
    private static final List<String> LAST_NAMES = List.of(
            "Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller",
            "Davis", "Rodriguez", "Martinez", "Hernandez", "Lopez", "Gonzalez",
            "Wilson", "Anderson", "Thomas", "Taylor", "Moore", "Jackson", "Martin");
    private static final List<String> WORDS = List.of(
            "cool", "super", "awesome", "tech", "dev", "pro", "star", "net",
            "web", "code", "data", "info", "cyber", "digital", "smart");

    private static final String LOWERCASE = "abcdefghijklmnopqrstuvwxyz";
    private static final String UPPERCASE = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String DIGITS = "0123456789";
    private static final String SPECIAL = "!@#$%^&*()-_=+";
    private static final String ALL_CHARS = LOWERCASE + UPPERCASE + DIGITS + SPECIAL;

    static final int MAX_AGE = 50;
    private static final int MIN_PASSWORD_LENGTH = 8;

    private final Random random;
    private final Clock clock;
    private final String emailDomain;
    private final int passwordLength;

    @Autowired
    public IdentityGenerator(ProvisionerProperties properties, Clock clock) {
        this(new SecureRandom(), clock, properties.getEmailDomain(), properties.getPasswordLength());
    }

    IdentityGenerator(Random random, Clock clock, String emailDomain, int passwordLength) {
        this.random = random;
        this.clock = clock;
        this.emailDomain = emailDomain;
        this.passwordLength = Math.max(MIN_PASSWORD_LENGTH, passwordLength);
    }

    public Identity next() {
        String firstName = pick(FIRST_NAMES);
        String lastName = pick(LAST_NAMES);
        return new Identity(
                randomLocalPart() + "@" + emailDomain,
                randomPassword(),
                firstName,
                lastName,
                randomBirthDate()
        );
    }

    /**
     * 单词、名字、数字随机排列组合。
     */
    String randomLocalPart() {
        List<String> parts = new ArrayList<>(3);
        parts.add(pick(WORDS));
        parts.add(pick(FIRST_NAMES).toLowerCase(Locale.ROOT));
        parts.add(String.valueOf(100 + random.nextInt(9900)));
        Collections.shuffle(parts, random);
        return String.join("", parts);
    }

    /**
     * At least one lowercase, uppercase, digit and special character.
     */
    public String randomPassword() {
        List<Character> chars = new ArrayList<>(passwordLength);
        chars.add(pickChar(LOWERCASE));
        chars.add(pickChar(UPPERCASE));
        chars.add(pickChar(DIGITS));
        chars.add(pickChar(SPECIAL));
        while (chars.size() < passwordLength) {
            chars.add(pickChar(ALL_CHARS));
        }
        Collections.shuffle(chars, random);
        StringBuilder password = new StringBuilder(passwordLength);
        chars.forEach(password::append);
        return password.toString();
    }

    LocalDate randomBirthDate() {
        LocalDate today = LocalDate.now(clock);
        LocalDate latest = today.minusYears(Identity.MINIMUM_AGE);
        LocalDate earliest = today.minusYears(MAX_AGE).plusDays(1);
        long span = ChronoUnit.DAYS.between(earliest, latest);
        return earliest.plusDays((long) (random.nextDouble() * (span + 1)));
    }

    private String pick(List<String> values) {
        return values.get(random.nextInt(values.size()));
    }

    private char pickChar(String alphabet) {
        return alphabet.charAt(random.nextInt(alphabet.length()));
    }
}
