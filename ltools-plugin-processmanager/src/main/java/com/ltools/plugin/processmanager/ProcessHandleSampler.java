package com.ltools.plugin.processmanager;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link ProcessSampler} backed by {@link ProcessHandle#allProcesses()}. Processes owned by
 * well-known service accounts or living under system directories are flagged as system processes.
 */
public final class ProcessHandleSampler implements ProcessSampler {

    private static final Set<String> SYSTEM_USERS = Set.of(
            "root", "SYSTEM", "LOCAL SERVICE", "NETWORK SERVICE", "daemon", "nobody", "_spotlight", "_mbsetupuser");

    private static final List<String> SYSTEM_PATHS = List.of(
            "/System/", "/usr/libexec/", "/usr/sbin/", "/sbin/", "C:\\Windows\\");

    @Override
    public List<ProcessInfo> sample() {
        return ProcessHandle.allProcesses()
                .map(ProcessHandleSampler::toInfo)
                .collect(Collectors.toList());
    }

    @Override
    public void terminate(long pid, boolean force) {
        ProcessHandle handle = ProcessHandle.of(pid)
                .orElseThrow(() -> new IllegalArgumentException("No such process: " + pid));
        if (handle.pid() == ProcessHandle.current().pid()) {
            throw new IllegalArgumentException("Refusing to terminate the host process");
        }
        boolean requested = !force && handle.destroy();
        if (!requested && !handle.destroyForcibly()) {
            throw new IllegalStateException("Could not terminate process " + pid);
        }
    }

    static ProcessInfo toInfo(ProcessHandle handle) {
        ProcessHandle.Info info = handle.info();
        String path = info.command().orElse("");
        String user = info.user().orElse("");
        String name = path.isEmpty() ? "" : path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1);
        return new ProcessInfo(
                handle.pid(),
                name,
                path,
                info.commandLine().orElse(""),
                user,
                info.startInstant().map(Instant::toEpochMilli).orElse(-1L),
                info.totalCpuDuration().map(Duration::toMillis).orElse(-1L),
                isSystem(user, path));
    }

    static boolean isSystem(String user, String path) {
        if (SYSTEM_USERS.contains(user)) return true;
        for (String p : SYSTEM_PATHS) {
            if (path.contains(p)) return true;
        }
        return false;
    }
}
