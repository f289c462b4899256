package com.anomalywatch.investigator;

import com.anomalywatch.producer.InvestigationNotifier;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base class of all investigators.
 *
 * LIFECYCLE:
 * ==========
 * An investigator is created for exactly one execution and bound to its context at
 * construction. run() may be called once:
 * 1. Started notification (when a notifier is bound)
 * 2. "{name} started." finding
 * 3. scan() - the variant specific work
 * 4. "{name} completed." finding
 *
 * If scan() throws, the exception propagates to the caller and no completed
 * finding is emitted. The caller decides the execution status.
 *
 * Every finding goes through the context's FindingChannel. Subclasses never touch
 * executions, results or counters directly.
 */
@Slf4j
public abstract class Investigator {

    private final String name;
    private final InvestigatorContext context;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean started = new AtomicBoolean(false);

    protected Investigator(String name, InvestigatorContext context, ObjectMapper objectMapper) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Investigator name cannot be null or empty");
        }
        if (context == null) {
            throw new IllegalArgumentException("Investigator context cannot be null");
        }
        this.name = name;
        this.context = context;
        this.objectMapper = objectMapper;
    }

    public final void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException(name + " has already been run for execution " + context.executionId());
        }

        InvestigationNotifier notifier = context.notifier();
        if (notifier != null) {
            notifier.investigationStarted(context.investigatorId(), context.executionId(), now());
        }

        log.info("{} started for execution {}", name, context.executionId());
        record(Finding.info(name + " started.", now()));

        scan();

        record(Finding.info(name + " completed.", now()));
        log.info("{} completed for execution {}", name, context.executionId());
    }

    /**
     * Variant specific work. Emit findings with {@link #record(Finding)}.
     */
    protected abstract void scan();

    protected final void record(Finding finding) {
        context.channel().publish(finding);
    }

    /**
     * Serialize a payload object to JSON.
     *
     * @return JSON text, or null when the object cannot be serialized
     */
    protected final String payload(Object value) {
        if (value == null || objectMapper == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize finding payload for execution {}: {}", context.executionId(), e.getMessage());
            return null;
        }
    }

    protected final Instant now() {
        return context.clock().instant();
    }

    protected final InvestigatorContext context() {
        return context;
    }

    public String getName() {
        return name;
    }

    public boolean hasRun() {
        return started.get();
    }
}
