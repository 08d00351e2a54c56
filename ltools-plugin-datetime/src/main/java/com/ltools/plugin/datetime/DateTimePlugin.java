package com.ltools.plugin.datetime;

import com.ltools.annotations.HostPlugin;
import com.ltools.plugin.PeriodicTaskHandle;
import com.ltools.plugin.PluginCapability;
import com.ltools.plugin.PluginContext;
import com.ltools.plugin.PluginMetadata;
import com.ltools.plugin.PluginType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.TextStyle;
import java.util.Locale;
import java.util.Objects;

/**
 * Clock plugin: while enabled, publishes the current time on {@link DateTimeTopics} once per tick.
 * Also offers formatting and timestamp conversion helpers in the clock's zone.
 */
@HostPlugin(id = DateTimePlugin.ID, name = "Date & Time", author = "LTools",
        description = "Shows the current date and time", icon = "clock",
        keywords = {"time", "date", "clock"})
public final class DateTimePlugin implements PluginCapability {

    private static final Logger log = LoggerFactory.getLogger(DateTimePlugin.class);

    public static final String ID = "datetime.builtin";

    static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;
    private final Duration tick;
    private volatile PeriodicTaskHandle ticker;

    public DateTimePlugin(Clock clock, Duration tick) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.tick = tick != null && !tick.isZero() && !tick.isNegative() ? tick : Duration.ofSeconds(1);
    }

    public DateTimePlugin() {
        this(Clock.systemDefaultZone(), Duration.ofSeconds(1));
    }

    @Override
    public PluginMetadata metadata() {
        return PluginMetadata.fromAnnotation(DateTimePlugin.class, PluginType.BUILTIN);
    }

    @Override
    public void startup(PluginContext context) {
        ticker = context.schedulePeriodic("clock-tick", tick, () -> emit(context));
        log.debug("Clock ticking every {}", tick);
    }

    @Override
    public void shutdown() {
        PeriodicTaskHandle t = ticker;
        if (t != null) {
            t.cancel();
            ticker = null;
        }
    }

    void emit(PluginContext context) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        context.publish(DateTimeTopics.CURRENT, now.toOffsetDateTime().toString());
        context.publish(DateTimeTopics.TIME, now.format(TIME));
        context.publish(DateTimeTopics.DATE, now.format(DATE));
        context.publish(DateTimeTopics.DATETIME, now.format(DATETIME));
        context.publish(DateTimeTopics.WEEKDAY, now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
    }

    /** {@code yyyy-MM-dd HH:mm:ss}. */
    public String currentTime() {
        return ZonedDateTime.now(clock).format(DATETIME);
    }

    /** {@code yyyy-MM-dd}. */
    public String currentDate() {
        return ZonedDateTime.now(clock).format(DATE);
    }

    /** Unix seconds. */
    public long timestamp() {
        return clock.instant().getEpochSecond();
    }

    public String timestampToDateTime(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds).atZone(clock.getZone()).format(DATETIME);
    }

    /**
     * @throws IllegalArgumentException if the value is not {@code yyyy-MM-dd HH:mm:ss}
     */
    public long dateTimeToTimestamp(String dateTime) {
        if (dateTime == null) throw new IllegalArgumentException("Invalid datetime format: null");
        try {
            return LocalDateTime.parse(dateTime.trim(), DATETIME).atZone(clock.getZone()).toEpochSecond();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid datetime format: " + dateTime, e);
        }
    }

    /**
     * Re-formats an ISO-8601 offset date-time with the given pattern.
     *
     * @throws IllegalArgumentException on a bad pattern or value
     */
    public String formatTime(String pattern, String isoDateTime) {
        if (pattern == null || isoDateTime == null) {
            throw new IllegalArgumentException("Pattern and value are required");
        }
        try {
            return ZonedDateTime.parse(isoDateTime).format(DateTimeFormatter.ofPattern(pattern));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Cannot format " + isoDateTime + " with " + pattern, e);
        }
    }
}
