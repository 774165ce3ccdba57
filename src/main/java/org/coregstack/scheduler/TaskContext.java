package org.coregstack.scheduler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Immutable key/value context of a running task (stack id, task id, dates, polarisation, ...).
 * <p>
 * Passed explicitly into every task invocation and attached to each log event as SLF4J key/value
 * pairs, rendered by the {@code %kvp} conversion word of the logging pattern. Nothing is kept in
 * thread-local state, so concurrently running tasks never see each other's fields.
 */
public final class TaskContext {

    private static final TaskContext EMPTY = new TaskContext(Map.of());

    private final Map<String, Object> fields;

    private TaskContext(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static TaskContext empty() {
        return EMPTY;
    }

    /**
     * Returns a context with {@code key} set to {@code value}; this context is unchanged.
     */
    public TaskContext with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(key, value);
        return new TaskContext(Collections.unmodifiableMap(copy));
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public Object get(String key) {
        return fields.get(key);
    }

    /** Adds the context fields to a fluent logging event. */
    public LoggingEventBuilder apply(LoggingEventBuilder event) {
        fields.forEach(event::addKeyValue);
        return event;
    }

    public void debug(Logger log, String message, Object... arguments) {
        apply(log.atDebug()).log(message, arguments);
    }

    public void info(Logger log, String message, Object... arguments) {
        apply(log.atInfo()).log(message, arguments);
    }

    public void warn(Logger log, String message, Object... arguments) {
        apply(log.atWarn()).log(message, arguments);
    }

    public void error(Logger log, Throwable cause, String message, Object... arguments) {
        apply(log.atError()).setCause(cause).log(message, arguments);
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
