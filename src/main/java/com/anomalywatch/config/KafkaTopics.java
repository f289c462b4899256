package com.anomalywatch.config;

/**
 * Centralized Kafka topic names for investigation notifications.
 *
 * Every message is keyed by investigator id, so all events of one investigator
 * land on the same partition and keep their order.
 */
public class KafkaTopics {

    // An execution was launched
    public static final String INVESTIGATION_STARTED = "investigation.started";

    // A finding was stored
    public static final String INVESTIGATION_RESULT_ADDED = "investigation.result-added";

    // An execution reached a terminal status
    public static final String INVESTIGATION_STATUS_CHANGED = "investigation.status-changed";

    // A successful execution finished, with its reconciled result count
    public static final String INVESTIGATION_COMPLETED = "investigation.completed";

    private KafkaTopics() {
    }
}
