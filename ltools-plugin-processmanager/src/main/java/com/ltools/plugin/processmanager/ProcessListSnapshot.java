package com.ltools.plugin.processmanager;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full process list published on {@link ProcessManagerTopics#PROCESSES} after each refresh.
 */
public final class ProcessListSnapshot {

    private final long timestamp;
    private final List<ProcessInfo> processes;

    @JsonCreator
    public ProcessListSnapshot(@JsonProperty("timestamp") long timestamp,
                               @JsonProperty("processes") List<ProcessInfo> processes) {
        this.timestamp = timestamp;
        this.processes = processes != null ? List.copyOf(processes) : List.of();
    }

    /** Epoch millis of the sample. */
    @JsonProperty("timestamp")
    public long getTimestamp() {
        return timestamp;
    }

    @JsonProperty("processes")
    public List<ProcessInfo> getProcesses() {
        return processes;
    }

    public int size() {
        return processes.size();
    }
}
