package com.ltools.plugin.processmanager;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One sampled OS process. Fields the platform does not expose are empty or -1.
 */
public final class ProcessInfo {

    private final long pid;
    private final String name;
    private final String executablePath;
    private final String cmdLine;
    private final String username;
    private final long startTimeMillis;
    private final long cpuTimeMillis;
    private final boolean system;

    @JsonCreator
    public ProcessInfo(@JsonProperty("pid") long pid,
                       @JsonProperty("name") String name,
                       @JsonProperty("executablePath") String executablePath,
                       @JsonProperty("cmdLine") String cmdLine,
                       @JsonProperty("username") String username,
                       @JsonProperty("startTime") long startTimeMillis,
                       @JsonProperty("cpuTimeMillis") long cpuTimeMillis,
                       @JsonProperty("isSystem") boolean system) {
        this.pid = pid;
        this.name = name != null ? name : "";
        this.executablePath = executablePath != null ? executablePath : "";
        this.cmdLine = cmdLine != null ? cmdLine : "";
        this.username = username != null ? username : "";
        this.startTimeMillis = startTimeMillis;
        this.cpuTimeMillis = cpuTimeMillis;
        this.system = system;
    }

    @JsonProperty("pid")
    public long getPid() {
        return pid;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("executablePath")
    public String getExecutablePath() {
        return executablePath;
    }

    @JsonProperty("cmdLine")
    public String getCmdLine() {
        return cmdLine;
    }

    @JsonProperty("username")
    public String getUsername() {
        return username;
    }

    /** Epoch millis; -1 if unknown. */
    @JsonProperty("startTime")
    public long getStartTimeMillis() {
        return startTimeMillis;
    }

    /** Total CPU time; -1 if unknown. */
    @JsonProperty("cpuTimeMillis")
    public long getCpuTimeMillis() {
        return cpuTimeMillis;
    }

    @JsonProperty("isSystem")
    public boolean isSystem() {
        return system;
    }

    /** Case-insensitive match on name, executable path, command line or pid. */
    boolean matches(String term) {
        String t = term.toLowerCase();
        return name.toLowerCase().contains(t)
                || executablePath.toLowerCase().contains(t)
                || cmdLine.toLowerCase().contains(t)
                || Long.toString(pid).contains(t);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProcessInfo that = (ProcessInfo) o;
        return pid == that.pid && startTimeMillis == that.startTimeMillis && cpuTimeMillis == that.cpuTimeMillis
                && system == that.system && name.equals(that.name) && executablePath.equals(that.executablePath)
                && cmdLine.equals(that.cmdLine) && username.equals(that.username);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pid, name, executablePath, cmdLine, username, startTimeMillis, cpuTimeMillis, system);
    }

    @Override
    public String toString() {
        return "ProcessInfo{" + pid + " " + name + "}";
    }
}
