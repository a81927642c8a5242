package io.agentloom.core.policy.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import io.agentloom.core.policy.CapabilityInvocationRecord;
import io.agentloom.core.policy.InvocationStage;
import io.agentloom.core.policy.PolicyHook;
import io.agentloom.core.runtime.AgentContext;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.logging.Logger;

/// In-memory audit log of capability invocations.
///
/// Registered as a policy hook, it turns every {@link CapabilityInvocationRecord} into an
/// {@link AuditEntry}, blocked and failed attempts included. The log keeps the newest
/// `maxEntries` entries.
///
/// @implNote Thread-safe; agents of a parallel stage write concurrently.
public final class AuditLogHook implements PolicyHook {

    private static final Logger logger = Logger.getLogger(AuditLogHook.class.getName());

    /// Default number of retained entries.
    public static final int DEFAULT_MAX_ENTRIES = 10_000;

    private static final List<String> CSV_HEADERS = List.of(
            "id", "taskId", "agent", "capability", "outcome", "approval", "durationMillis", "loggedAt");

    private final Deque<AuditEntry> entries = new ArrayDeque<>();
    private final int maxEntries;
    private final Clock clock;
    private final ObjectMapper mapper;

    public AuditLogHook() {
        this(DEFAULT_MAX_ENTRIES, Clock.systemUTC());
    }

    /// Creates an audit log.
    ///
    /// @param maxEntries retained entries, positive
    /// @param clock source of entry timestamps, not null
    public AuditLogHook(int maxEntries, Clock clock) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .registerModule(new SimpleModule().addSerializer(Instant.class, ToStringSerializer.instance))
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void onRecord(CapabilityInvocationRecord record, AgentContext context) {
        AuditEntry entry = new AuditEntry(
                UUID.randomUUID().toString(),
                context.task().getTaskId(),
                context.agentId(),
                context.agent().getName(),
                record.name(),
                record.callId(),
                record.attempt(),
                AuditEntry.classify(record),
                AuditEntry.lastOutcome(record, InvocationStage.APPROVAL),
                record.error() != null ? String.valueOf(record.error().getMessage()) : null,
                record.stages(),
                record.duration().toMillis(),
                clock.instant());
        synchronized (entries) {
            entries.addLast(entry);
            while (entries.size() > maxEntries) {
                entries.removeFirst();
            }
        }
        logger.fine("Audited " + entry.capability() + " for agent " + entry.agentId() + ": " + entry.outcome());
    }

    /// Returns the entries matching a filter, newest first.
    ///
    /// @param filter the filter, not null
    /// @return at most `filter.limit()` entries, never null
    public List<AuditEntry> query(AuditFilter filter) {
        List<AuditEntry> matched = new ArrayList<>();
        for (AuditEntry entry : snapshot()) {
            if (filter.matches(entry)) {
                matched.add(entry);
            }
        }
        Collections.reverse(matched);
        return matched.size() > filter.limit() ? List.copyOf(matched.subList(0, filter.limit())) : matched;
    }

    /// Exports every entry, oldest first, as a JSON array.
    ///
    /// @return JSON text, never null
    /// @throws IllegalStateException if serialization fails
    public String exportJson() {
        try {
            return mapper.writeValueAsString(snapshot());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export audit log", e);
        }
    }

    /// Exports every entry, oldest first, as CSV with a header row. All values are quoted.
    ///
    /// @return CSV text, never null
    public String exportCsv() {
        StringBuilder csv = new StringBuilder(csvRow(CSV_HEADERS));
        for (AuditEntry entry : snapshot()) {
            csv.append('\n').append(csvRow(List.of(
                    entry.id(),
                    entry.taskId(),
                    entry.agentName(),
                    entry.capability(),
                    entry.outcome().name(),
                    entry.approval() != null ? entry.approval() : "",
                    String.valueOf(entry.durationMillis()),
                    entry.loggedAt().toString())));
        }
        return csv.toString();
    }

    /// Summarizes the retained entries.
    ///
    /// @return statistics, never null
    public Statistics statistics() {
        int[] counts = new int[AuditOutcome.values().length];
        int requested = 0;
        int approved = 0;
        List<AuditEntry> all = snapshot();
        for (AuditEntry entry : all) {
            counts[entry.outcome().ordinal()]++;
            if (entry.approvalRequested()) {
                requested++;
                if (entry.approved()) {
                    approved++;
                }
            }
        }
        return new Statistics(
                all.size(),
                counts[AuditOutcome.SUCCEEDED.ordinal()],
                counts[AuditOutcome.BLOCKED.ordinal()],
                counts[AuditOutcome.SKIPPED.ordinal()],
                counts[AuditOutcome.ESCALATED.ordinal()],
                counts[AuditOutcome.FAILED.ordinal()],
                requested == 0 ? 0.0 : approved * 100.0 / requested);
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public void clear() {
        synchronized (entries) {
            entries.clear();
        }
        logger.info("Audit log cleared");
    }

    private List<AuditEntry> snapshot() {
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    private static String csvRow(List<String> values) {
        StringBuilder row = new StringBuilder();
        for (String value : values) {
            if (row.length() > 0) {
                row.append(',');
            }
            row.append('"').append(value.replace("\"", "\"\"")).append('"');
        }
        return row.toString();
    }

    /// Counts over the retained entries.
    ///
    /// @param total retained entries
    /// @param succeeded entries with outcome {@link AuditOutcome#SUCCEEDED}
    /// @param blocked entries with outcome {@link AuditOutcome#BLOCKED}
    /// @param skipped entries with outcome {@link AuditOutcome#SKIPPED}
    /// @param escalated entries with outcome {@link AuditOutcome#ESCALATED}
    /// @param failed entries with outcome {@link AuditOutcome#FAILED}
    /// @param approvalRate percentage of approval requests that were granted, `0` without requests
    public record Statistics(
            int total, int succeeded, int blocked, int skipped, int escalated, int failed, double approvalRate) {}
}
