package com.ltools.plugin.processmanager;

import java.util.List;

/** Source of process samples and the way to stop a process. */
public interface ProcessSampler {

    List<ProcessInfo> sample() throws Exception;

    /**
     * Asks the process to terminate, forcibly if {@code force} or if the polite request is refused.
     *
     * @throws IllegalArgumentException if no such process exists
     * @throws IllegalStateException    if the process could not be terminated
     */
    void terminate(long pid, boolean force);
}
