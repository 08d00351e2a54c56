package com.ltools.plugin.datetime;

import com.ltools.events.Topic;

/** Topics published by the date/time plugin on every tick. */
public final class DateTimeTopics {

    /** ISO-8601 offset date-time. */
    public static final Topic<String> CURRENT = Topic.of("datetime:current", String.class);
    /** {@code HH:mm:ss}. */
    public static final Topic<String> TIME = Topic.of("datetime:time", String.class);
    /** {@code yyyy-MM-dd}. */
    public static final Topic<String> DATE = Topic.of("datetime:date", String.class);
    /** {@code yyyy-MM-dd HH:mm:ss}. */
    public static final Topic<String> DATETIME = Topic.of("datetime:datetime", String.class);
    /** English day name, e.g. {@code Monday}. */
    public static final Topic<String> WEEKDAY = Topic.of("datetime:weekday", String.class);

    private DateTimeTopics() {
    }
}
