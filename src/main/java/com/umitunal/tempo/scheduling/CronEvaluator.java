package com.umitunal.tempo.scheduling;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.umitunal.tempo.core.InvalidScheduleException;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes fire times of five-field UNIX cron expressions
 * (minute, hour, day-of-month, month, day-of-week), evaluated in UTC.
 *
 * Parsed expressions are cached, so evaluating the same definition on every
 * poller tick does not re-parse it.
 */
public class CronEvaluator {
    private static final int MAX_CACHED = 1024;

    private final CronParser parser;
    private final Map<String, ExecutionTime> cache = new ConcurrentHashMap<>();

    public CronEvaluator() {
        CronDefinition definition = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);
        this.parser = new CronParser(definition);
    }

    /**
     * Parses and validates an expression.
     *
     * @throws InvalidScheduleException if the expression is malformed or never fires
     */
    public void validate(String cronExpression) {
        ExecutionTime executionTime = executionTimeOf(cronExpression);
        ZonedDateTime now = ZonedDateTime.now(ZoneOffset.UTC);
        if (executionTime.nextExecution(now).isEmpty()) {
            throw new InvalidScheduleException(cronExpression, "expression never fires");
        }
    }

    /**
     * The first fire time strictly after {@code reference}.
     *
     * @throws InvalidScheduleException if the expression is malformed or has no
     *         further fire time
     */
    public Instant nextFireAfter(String cronExpression, Instant reference) {
        ExecutionTime executionTime = executionTimeOf(cronExpression);
        ZonedDateTime cursor = reference.atZone(ZoneOffset.UTC);
        // nextExecution is exclusive at second granularity; sub-second references
        // can still land on the same instant, hence the loop.
        for (int i = 0; i < 3; i++) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(cursor);
            if (next.isEmpty()) {
                break;
            }
            Instant candidate = next.get().toInstant();
            if (candidate.isAfter(reference)) {
                return candidate;
            }
            cursor = next.get().plusSeconds(1);
        }
        throw new InvalidScheduleException(cronExpression, "no fire time after " + reference);
    }

    private ExecutionTime executionTimeOf(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new InvalidScheduleException(String.valueOf(cronExpression), "expression is empty");
        }
        String normalized = cronExpression.trim().replaceAll("\\s+", " ");
        ExecutionTime cached = cache.get(normalized);
        if (cached != null) {
            return cached;
        }
        ExecutionTime parsed = parse(normalized);
        if (cache.size() >= MAX_CACHED) {
            cache.clear();
        }
        cache.put(normalized, parsed);
        return parsed;
    }

    private ExecutionTime parse(String expression) {
        try {
            Cron cron = parser.parse(expression);
            cron.validate();
            return ExecutionTime.forCron(cron);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expression, e);
        }
    }
}
