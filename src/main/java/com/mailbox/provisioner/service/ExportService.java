package com.mailbox.provisioner.service;

import com.mailbox.provisioner.entity.AccountRecord;
import com.mailbox.provisioner.entity.ExportFormat;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Service
public class ExportService {
    /**
     * 文本格式分隔符
     */
    public static final String TEXT_SEPARATOR = "—-";
    static final String CSV_HEADER = "email,password,totp_secret";

    public byte[] export(List<AccountRecord> records, ExportFormat format) {
        List<AccountRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(AccountRecord::getEmail));
        StringBuilder out = new StringBuilder();
        if (format == ExportFormat.CSV) {
            out.append(CSV_HEADER).append('\n');
            for (AccountRecord record : sorted) {
                out.append(csvField(record.getEmail())).append(',')
                        .append(csvField(record.getPassword())).append(',')
                        .append(csvField(record.getTotpSecret())).append('\n');
            }
        } else {
            for (AccountRecord record : sorted) {
                out.append(textLine(record)).append('\n');
            }
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    public String textLine(AccountRecord record) {
        return String.join(TEXT_SEPARATOR,
                nullToEmpty(record.getEmail()),
                nullToEmpty(record.getPassword()),
                nullToEmpty(record.getTotpSecret()));
    }

    /**
     * Reads back a text export.
     */
    public List<Credentials> parseText(byte[] content) {
        List<Credentials> result = new ArrayList<>();
        String[] lines = new String(content, StandardCharsets.UTF_8).split("\\r?\\n");
        for (String line : lines) {
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split(TEXT_SEPARATOR, 3);
            if (parts.length < 3) {
                throw new IllegalArgumentException("malformed export line: " + line);
            }
            result.add(new Credentials(parts[0], parts[1], parts[2]));
        }
        return result;
    }

    public void writeTo(Path target, byte[] content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, content);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException atomicFail) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String csvField(String value) {
        String v = nullToEmpty(value);
        if (v.contains(",") || v.contains("\"") || v.contains("\n") || v.contains("\r")) {
            return "\"" + v.replace("\"", "\"\"") + "\"";
        }
        return v;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    public record Credentials(String email, String password, String totpSecret) {
    }
}
