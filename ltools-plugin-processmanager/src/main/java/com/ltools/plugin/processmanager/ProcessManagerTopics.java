package com.ltools.plugin.processmanager;

import com.ltools.events.Topic;

public final class ProcessManagerTopics {

    public static final Topic<ProcessListSnapshot> PROCESSES = Topic.of("processmanager:processes", ProcessListSnapshot.class);
    /** Pid of a process the plugin terminated. */
    public static final Topic<Long> KILLED = Topic.of("processmanager:killed", Long.class);
    public static final Topic<String> ERROR = Topic.of("processmanager:error", String.class);

    private ProcessManagerTopics() {
    }
}
