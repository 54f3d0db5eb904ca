package io.github.hide212131.langchain4j.spindleflow.runtime.state;

import java.time.Instant;
import java.util.Objects;

/**
 * One completed agent invocation. Branch fields are set for fan-out turns, {@code iteration} for
 * turns that belong to a feedback loop.
 */
public record TimelineEntry(
        String agentId,
        String role,
        String output,
        Instant startedAt,
        Instant endedAt,
        String branchId,
        Integer branchIndex,
        boolean aggregator,
        Integer iteration) {

    public TimelineEntry {
        Objects.requireNonNull(agentId, "agentId");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(endedAt, "endedAt");
        output = output == null ? "" : output;
    }

    public static TimelineEntry of(String agentId, String role, String output, Instant startedAt, Instant endedAt) {
        return new TimelineEntry(agentId, role, output, startedAt, endedAt, null, null, false, null);
    }

    public TimelineEntry inBranch(String fanOutId, int index) {
        return new TimelineEntry(agentId, role, output, startedAt, endedAt, fanOutId, index, aggregator, iteration);
    }

    public TimelineEntry asAggregator() {
        return new TimelineEntry(agentId, role, output, startedAt, endedAt, branchId, branchIndex, true, iteration);
    }

    public TimelineEntry atIteration(int value) {
        return new TimelineEntry(agentId, role, output, startedAt, endedAt, branchId, branchIndex, aggregator, value);
    }

    public long durationMs() {
        return endedAt.toEpochMilli() - startedAt.toEpochMilli();
    }
}
