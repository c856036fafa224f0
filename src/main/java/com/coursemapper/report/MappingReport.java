package com.coursemapper.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.*;

/**
 * Audit trail of one mapping run. Every event is written to the SLF4J logger of its channel and
 * counted; the {@code channel} MDC key lets logback route every channel to its own file. Only the
 * first {@code retained} events are also kept in memory.
 */
public class MappingReport {
    public static final int DEFAULT_RETAINED = 1000;

    private static final Map<ReportChannel, Logger> LOGGERS = new EnumMap<>(ReportChannel.class);

    static {
        for (ReportChannel channel : ReportChannel.values()) {
            LOGGERS.put(channel, LoggerFactory.getLogger(channel.loggerName()));
        }
    }

    private final int retained;
    private final List<ReportEvent> events = new ArrayList<>();
    private final Map<ReportChannel, Long> counts = new EnumMap<>(ReportChannel.class);

    public MappingReport() {
        this(DEFAULT_RETAINED);
    }

    public MappingReport(int retained) {
        this.retained = Math.max(0, retained);
    }

    public void record(ReportChannel channel, String institution, String requirementId, String message) {
        counts.merge(channel, 1L, Long::sum);
        if (events.size() < retained) {
            events.add(new ReportEvent(channel, institution, requirementId, message));
        }
        Logger logger = LOGGERS.get(channel);
        try (MDC.MDCCloseable ignored = MDC.putCloseable("channel", channel.channelName())) {
            switch (channel) {
                case FAIL, ANOMALY -> logger.warn("{} {} {}", institution, requirementId, message);
                default -> logger.info("{} {} {}", institution, requirementId, message);
            }
        }
    }

    /** Retained events, oldest first. */
    public List<ReportEvent> events() {
        return List.copyOf(events);
    }

    public List<ReportEvent> events(ReportChannel channel) {
        return events.stream().filter(e -> e.channel() == channel).toList();
    }

    public boolean contains(ReportChannel channel, String fragment) {
        return events.stream().anyMatch(e -> e.channel() == channel && e.message().contains(fragment));
    }

    /** Events recorded on {@code channel}, retained or not. */
    public long count(ReportChannel channel) {
        return counts.getOrDefault(channel, 0L);
    }

    public long dropped() {
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return total - events.size();
    }

    public Map<String, Long> tally() {
        Map<String, Long> tally = new TreeMap<>();
        counts.forEach((channel, n) -> tally.put(channel.channelName(), n));
        return tally;
    }

    public record ReportEvent(ReportChannel channel, String institution, String requirementId, String message) {}
}
