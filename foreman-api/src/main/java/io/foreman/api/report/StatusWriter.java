package io.foreman.api.report;

import io.foreman.api.metrics.WorkflowRecord;

/**
 * Sink for status snapshots and finished workflow records.
 */
public interface StatusWriter extends AutoCloseable {

    void writeStatus(StatusReport report);

    void writeRecord(WorkflowRecord record);

    @Override
    void close();
}
