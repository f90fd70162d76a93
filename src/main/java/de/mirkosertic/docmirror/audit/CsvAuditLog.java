package de.mirkosertic.docmirror.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;

/**
 * Appends audit entries as CSV rows {@code timestamp,type,message,status} to a file.
 * A header row is written when the file is created.
 */
public class CsvAuditLog implements AuditSink {

    private static final Logger logger = LoggerFactory.getLogger(CsvAuditLog.class);

    static final String HEADER = "timestamp,type,message,status";

    private final Path auditFile;
    private final Clock clock;

    public CsvAuditLog(final Path auditFile) {
        this(auditFile, Clock.systemUTC());
    }

    public CsvAuditLog(final Path auditFile, final Clock clock) {
        this.auditFile = auditFile;
        this.clock = clock;
    }

    @Override
    public synchronized void record(final String type, final String message, final String status) {
        try {
            final Path parent = auditFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            final StringBuilder row = new StringBuilder();
            if (!Files.exists(auditFile)) {
                row.append(HEADER).append(System.lineSeparator());
            }
            row.append(escape(Instant.now(clock).toString())).append(',')
                    .append(escape(type)).append(',')
                    .append(escape(message)).append(',')
                    .append(escape(status))
                    .append(System.lineSeparator());
            Files.writeString(auditFile, row, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (final IOException | RuntimeException e) {
            logger.debug("Failed to write audit entry to {}: {}", auditFile, e.getMessage());
        }
    }

    public Path getAuditFile() {
        return auditFile;
    }

    static String escape(final String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
