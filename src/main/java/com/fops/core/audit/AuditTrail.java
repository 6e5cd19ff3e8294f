package com.fops.core.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fops.core.metrics.FopsMetrics;
import com.fops.core.util.Hashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only, day-partitioned JSONL audit log.
 *
 * <p>Each UTC day has its own {@code audit_<yyyyMMdd>.jsonl} file; the file for an
 * append is chosen from the entry's timestamp, so rotation needs no state. Every
 * line is one complete JSON object. Appends are serialized within the process and
 * synced to disk before {@link #append} returns.
 *
 * <p>Entries cannot be modified or removed through this class.
 */
@Service
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Path logDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final int defaultLookbackDays;
    private final FopsMetrics metrics;
    private final SecureRandom nonces = new SecureRandom();
    private final ReentrantLock writeLock = new ReentrantLock();

    @Autowired
    public AuditTrail(AuditProperties properties, ObjectMapper objectMapper, Clock clock,
                      @Autowired(required = false) FopsMetrics metrics) {
        this(Path.of(properties.getLogDir()), objectMapper, clock,
                properties.getDefaultLookbackDays(), metrics);
    }

    public AuditTrail(Path logDir, ObjectMapper objectMapper, Clock clock,
                      int defaultLookbackDays, FopsMetrics metrics) {
        this.logDir = logDir;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
        this.defaultLookbackDays = defaultLookbackDays;
        this.metrics = metrics;
    }

    /**
     * Writes one entry and returns its id once the line is on disk.
     *
     * @throws AuditWriteException if the entry could not be written
     */
    public String append(AuditEvent event) {
        writeLock.lock();
        try {
            Instant timestamp = clock.instant();
            String id = entryId(timestamp);
            var entry = new AuditEntry(id, timestamp, event.operationType(), event.agent(),
                    event.inputs(), event.outputs(), event.citations(), event.status());

            Path file = fileFor(timestamp);
            String line = objectMapper.writeValueAsString(entry) + "\n";
            Files.createDirectories(logDir);
            Files.write(file, line.getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE,
                    StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.DSYNC);

            recordAppend(true);
            log.info("Audit {} {} by {} ({})", id, event.operationType(), event.agent(), event.status());
            return id;
        } catch (IOException e) {
            recordAppend(false);
            log.error("Failed to write audit entry {} by {}", event.operationType(), event.agent(), e);
            throw new AuditWriteException("Failed to write audit entry " + event.operationType(), e);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns matching entries, newest first. Only the day files inside the
     * query's date range (default: the last {@code default-lookback-days} days)
     * are opened.
     */
    public List<AuditEntry> query(AuditQuery filters, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        AuditQuery q = filters == null ? AuditQuery.all() : filters;
        Instant to = q.to() != null ? q.to() : clock.instant();
        Instant from = q.from() != null ? q.from() : to.minus(defaultLookbackDays, ChronoUnit.DAYS);
        if (from.isAfter(to)) {
            return List.of();
        }

        AuditQuery effective = q.between(from, to);
        var matches = new ArrayList<Ordered>();
        int ordinal = 0;
        for (Path file : filesBetween(from, to)) {
            for (AuditEntry entry : readFile(file)) {
                if (effective.matches(entry)) {
                    matches.add(new Ordered(entry, ordinal));
                }
                ordinal++;
            }
        }

        matches.sort(Comparator.comparing((Ordered o) -> o.entry().timestamp())
                .thenComparingInt(Ordered::ordinal)
                .reversed());
        return matches.stream()
                .limit(limit)
                .map(Ordered::entry)
                .toList();
    }

    /**
     * Counts entries in a date range by operation type, agent, status and UTC day.
     */
    public AuditStatistics statistics(Instant from, Instant to) {
        List<AuditEntry> entries = query(AuditQuery.all().between(from, to), Integer.MAX_VALUE);
        var byType = new TreeMap<String, Integer>();
        var byAgent = new TreeMap<String, Integer>();
        var byStatus = new TreeMap<String, Integer>();
        var byDate = new TreeMap<String, Integer>();
        for (AuditEntry e : entries) {
            byType.merge(nullToUnknown(e.operationType()), 1, Integer::sum);
            byAgent.merge(nullToUnknown(e.agent()), 1, Integer::sum);
            byStatus.merge(nullToUnknown(e.status()), 1, Integer::sum);
            byDate.merge(e.timestamp().atZone(ZoneOffset.UTC).toLocalDate().toString(), 1, Integer::sum);
        }
        return new AuditStatistics(entries.size(), byType, byAgent, byStatus, byDate);
    }

    /**
     * Writes the entries of a date range to {@code target} as one JSON array.
     * The trail itself is only read.
     *
     * @return number of exported entries
     */
    public int export(Path target, Instant from, Instant to) {
        List<AuditEntry> entries = query(AuditQuery.all().between(from, to), Integer.MAX_VALUE);
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), entries);
            log.info("Exported {} audit entries to {}", entries.size(), target);
            return entries.size();
        } catch (IOException e) {
            throw new AuditWriteException("Failed to export audit trail to " + target, e);
        }
    }

    Path fileFor(Instant timestamp) {
        return logDir.resolve("audit_" + DAY.format(timestamp.atZone(ZoneOffset.UTC)) + ".jsonl");
    }

    private List<Path> filesBetween(Instant from, Instant to) {
        LocalDate first = from.atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate last = to.atZone(ZoneOffset.UTC).toLocalDate();
        var files = new ArrayList<Path>();
        for (LocalDate day = first; !day.isAfter(last); day = day.plusDays(1)) {
            Path file = logDir.resolve("audit_" + DAY.format(day) + ".jsonl");
            if (Files.isRegularFile(file)) {
                files.add(file);
            }
        }
        return files;
    }

    private List<AuditEntry> readFile(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Error reading audit log {}", file, e);
            return List.of();
        }
        var entries = new ArrayList<AuditEntry>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) continue;
            try {
                entries.add(objectMapper.readValue(line, AuditEntry.class));
            } catch (IOException e) {
                log.warn("Skipping unreadable audit line in {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return entries;
    }

    private String entryId(Instant timestamp) {
        String seed = timestamp.toString() + "_" + nonces.nextLong();
        return Hashes.sha256Hex(seed).substring(0, 12);
    }

    private void recordAppend(boolean success) {
        if (metrics != null) {
            metrics.recordAuditAppend(success);
        }
    }

    private static String nullToUnknown(String value) {
        return value == null ? "unknown" : value;
    }

    private record Ordered(AuditEntry entry, int ordinal) {}
}
