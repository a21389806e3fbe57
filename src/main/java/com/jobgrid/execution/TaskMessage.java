package com.jobgrid.execution;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Unit of work handed to a {@link TaskQueue}: which job to run, for which result row, with
 * which inputs. {@code options} holds {@code queue} and, only when set, {@code soft_time_limit}
 * and {@code time_limit} in seconds.
 */
public record TaskMessage(
        UUID jobResultId,
        String taskName,
        String queue,
        List<Object> args,
        Map<String, Object> kwargs,
        Map<String, Object> options) {

    public static final String QUEUE = "queue";
    public static final String SOFT_TIME_LIMIT = "soft_time_limit";
    public static final String TIME_LIMIT = "time_limit";

    public TaskMessage {
        args = args == null ? List.of() : args;
        kwargs = kwargs == null ? Map.of() : kwargs;
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public Optional<Integer> softTimeLimit() {
        return limit(SOFT_TIME_LIMIT);
    }

    public Optional<Integer> timeLimit() {
        return limit(TIME_LIMIT);
    }

    private Optional<Integer> limit(String key) {
        Object value = options.get(key);
        if (value instanceof Number number && number.intValue() > 0) {
            return Optional.of(number.intValue());
        }
        return Optional.empty();
    }
}
