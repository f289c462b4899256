package com.anomalywatch.service;

import com.anomalywatch.config.InvestigationProperties;
import com.anomalywatch.exception.InvestigationNotFoundException;
import com.anomalywatch.exception.InvestigationStorageException;
import com.anomalywatch.exception.InvestigationValidationException;
import com.anomalywatch.investigator.Finding;
import com.anomalywatch.investigator.Investigator;
import com.anomalywatch.investigator.InvestigatorContext;
import com.anomalywatch.investigator.InvestigatorRegistry;
import com.anomalywatch.investigator.RuleSettingsResolver;
import com.anomalywatch.model.CountVerification;
import com.anomalywatch.model.ExecutionOverview;
import com.anomalywatch.model.ExecutionStatus;
import com.anomalywatch.model.InvestigationExecution;
import com.anomalywatch.model.InvestigationResult;
import com.anomalywatch.model.InvestigationSummary;
import com.anomalywatch.model.InvestigatorInstance;
import com.anomalywatch.model.InvestigatorType;
import com.anomalywatch.model.ResultSeverity;
import com.anomalywatch.producer.InvestigationNotifier;
import com.anomalywatch.repository.InvestigationExecutionRepository;
import com.anomalywatch.repository.InvestigationResultRepository;
import com.anomalywatch.repository.InvestigatorInstanceRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Orchestrates investigators: create, start, delete, and the result accounting of
 * their executions.
 *
 * FLOW OF ONE RUN:
 * ================
 * 1. startInvestigator opens a RUNNING execution (counter = 0)
 * 2. The registry builds an investigator bound to a PersistingFindingChannel
 * 3. The run is submitted to investigationExecutor; startInvestigator returns true
 * 4. Every finding goes to saveResult on the result writer pool
 *    (insert result + atomic counter increment, one transaction per finding)
 * 5. After run() returns, the run waits until every save has settled
 * 6. closeExecution sets the terminal status and reconciles the counter
 * 7. StatusChanged, then Completed with the reconciled count
 *
 * EXPECTED CONDITIONS vs FAILURES:
 * ================================
 * Missing, inactive or unknown-type investigators are reported through return
 * values (false / Optional.empty()). Database failures are logged with the
 * execution or investigator id and thrown as InvestigationStorageException.
 */
@Service
@Slf4j
public class InvestigationManager {

    private static final int MAX_NAME_LENGTH = 200;
    private static final int MAX_RESULTS_LIMIT = 1000;
    private static final Set<ResultSeverity> ANOMALY_SEVERITIES = Set.of(ResultSeverity.ANOMALY, ResultSeverity.CRITICAL);
    private static final Set<ExecutionStatus> FINISHED_STATUSES = Set.of(ExecutionStatus.COMPLETED, ExecutionStatus.FAILED);

    private final InvestigatorCatalogService catalogService;
    private final InvestigatorInstanceRepository instanceRepository;
    private final InvestigationExecutionRepository executionRepository;
    private final InvestigationResultRepository resultRepository;
    private final ExecutionStore executionStore;
    private final InvestigatorRegistry registry;
    private final RuleSettingsResolver settingsResolver;
    private final InvestigationNotifier notifier;
    private final Executor investigationExecutor;
    private final Executor resultWriterExecutor;
    private final InvestigationProperties properties;
    private final Clock clock;

    // Channels of runs in progress, so an execution closed by the watchdog stops announcing results
    private final Map<Long, PersistingFindingChannel> activeChannels = new ConcurrentHashMap<>();

    public InvestigationManager(InvestigatorCatalogService catalogService,
                                InvestigatorInstanceRepository instanceRepository,
                                InvestigationExecutionRepository executionRepository,
                                InvestigationResultRepository resultRepository,
                                ExecutionStore executionStore,
                                InvestigatorRegistry registry,
                                RuleSettingsResolver settingsResolver,
                                InvestigationNotifier notifier,
                                @Qualifier("investigationExecutor") Executor investigationExecutor,
                                @Qualifier("resultWriterExecutor") Executor resultWriterExecutor,
                                InvestigationProperties properties,
                                Clock clock) {
        this.catalogService = catalogService;
        this.instanceRepository = instanceRepository;
        this.executionRepository = executionRepository;
        this.resultRepository = resultRepository;
        this.executionStore = executionStore;
        this.registry = registry;
        this.settingsResolver = settingsResolver;
        this.notifier = notifier;
        this.investigationExecutor = investigationExecutor;
        this.resultWriterExecutor = resultWriterExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== INVESTIGATORS ====================

    public String createInvestigator(String typeCode, String name) {
        return createInvestigator(typeCode, name, null);
    }

    /**
     * Create an active investigator of the given type.
     *
     * @param customConfiguration Optional JSON object overriding rule thresholds
     * @return Id of the new investigator
     * @throws InvestigationValidationException if the type is unknown, inactive or has
     *         no implementation, or the input is malformed
     */
    public String createInvestigator(String typeCode, String name, String customConfiguration) {
        if (typeCode == null || typeCode.isBlank()) {
            throw new InvestigationValidationException("Investigator type code is required");
        }
        String code = typeCode.trim().toLowerCase(Locale.ROOT);

        InvestigatorType type = catalogService.findByCode(code)
                .orElseThrow(() -> new InvestigationValidationException("Investigator type not found: " + code));
        if (!Boolean.TRUE.equals(type.getActive())) {
            throw new InvestigationValidationException("Investigator type is inactive: " + code);
        }
        if (!registry.isRegistered(code)) {
            throw new InvestigationValidationException("No investigator implementation registered for type: " + code);
        }
        String customName = validName(name == null || name.isBlank() ? type.getDisplayName() : name.trim());
        settingsResolver.requireJsonObject(customConfiguration);

        InvestigatorInstance instance = new InvestigatorInstance();
        instance.setId(UUID.randomUUID().toString());
        instance.setTypeCode(code);
        instance.setCustomName(customName);
        instance.setActive(true);
        instance.setCustomConfiguration(blankToNull(customConfiguration));
        instance.setCreatedAt(clock.instant());

        instanceRepository.save(instance);
        log.info("Created investigator {} of type {} named '{}'", instance.getId(), code, customName);
        return instance.getId();
    }

    /**
     * Change name, active flag and/or custom configuration. Null arguments are left unchanged;
     * an empty configuration string removes the custom configuration.
     */
    public Optional<InvestigatorInstance> updateInvestigator(String investigatorId, String name,
                                                             Boolean active, String customConfiguration) {
        Optional<InvestigatorInstance> found = instanceRepository.findById(investigatorId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        InvestigatorInstance instance = found.get();
        if (name != null) {
            instance.setCustomName(validName(name.trim()));
        }
        if (active != null) {
            instance.setActive(active);
        }
        if (customConfiguration != null) {
            settingsResolver.requireJsonObject(customConfiguration);
            instance.setCustomConfiguration(blankToNull(customConfiguration));
        }
        InvestigatorInstance saved = instanceRepository.save(instance);
        log.info("Updated investigator {} (active={})", investigatorId, saved.getActive());
        return Optional.of(saved);
    }

    public Optional<InvestigatorInstance> getInvestigator(String investigatorId) {
        return instanceRepository.findById(investigatorId);
    }

    public List<InvestigatorInstance> listInvestigators() {
        return instanceRepository.findAllByOrderByCreatedAtDesc();
    }

    public List<InvestigatorType> listTypes() {
        return catalogService.listTypes();
    }

    public InvestigationSummary getSummary() {
        return new InvestigationSummary(
                instanceRepository.count(),
                instanceRepository.countByActiveTrue(),
                executionRepository.countByStatus(ExecutionStatus.RUNNING),
                resultRepository.count(),
                clock.instant());
    }

    /**
     * Delete an investigator with all its executions and results, atomically.
     *
     * @return false if the investigator does not exist
     */
    public boolean deleteInvestigator(String investigatorId) {
        try {
            return executionStore.deleteInvestigatorCascade(investigatorId);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to delete investigator {}", investigatorId, e);
            throw new InvestigationStorageException("Failed to delete investigator " + investigatorId, e);
        }
    }

    // ==================== EXECUTIONS ====================

    /**
     * Launch a run of the investigator in the background.
     *
     * @return true once the run has been submitted; false if the investigator is
     *         missing, inactive, of an unregistered type, or the run could not be scheduled
     */
    public boolean startInvestigator(String investigatorId) {
        Optional<InvestigatorInstance> found = instanceRepository.findById(investigatorId);
        if (found.isEmpty()) {
            log.warn("Cannot start investigator {}: not found", investigatorId);
            return false;
        }
        InvestigatorInstance instance = found.get();
        if (!instance.isEnabled()) {
            log.warn("Cannot start investigator {}: inactive", investigatorId);
            return false;
        }
        if (!registry.isRegistered(instance.getTypeCode())) {
            log.warn("Cannot start investigator {}: no implementation for type {}", investigatorId, instance.getTypeCode());
            return false;
        }

        List<String> overlays = configurationOverlays(instance);
        Optional<InvestigationExecution> opened = openExecution(investigatorId);
        if (opened.isEmpty()) {
            log.warn("Cannot start investigator {}: deleted while starting", investigatorId);
            return false;
        }
        Long executionId = opened.get().getId();

        PersistingFindingChannel channel = new PersistingFindingChannel(
                investigatorId, executionId, finding -> saveResult(executionId, finding), notifier, resultWriterExecutor);

        Investigator investigator;
        try {
            investigator = registry.create(instance.getTypeCode(),
                    new InvestigatorContext(investigatorId, executionId, channel, notifier, clock, overlays));
        } catch (RuntimeException e) {
            log.error("Could not build investigator {} for execution {}", investigatorId, executionId, e);
            finishExecution(investigatorId, executionId, ExecutionStatus.FAILED,
                    "Investigator could not be created: " + e.getMessage());
            return false;
        }

        activeChannels.put(executionId, channel);
        try {
            investigationExecutor.execute(() -> runInvestigation(investigator, channel, investigatorId, executionId));
        } catch (RejectedExecutionException e) {
            activeChannels.remove(executionId);
            log.error("Could not schedule execution {} of investigator {}", executionId, investigatorId, e);
            finishExecution(investigatorId, executionId, ExecutionStatus.FAILED,
                    "Execution could not be scheduled: too many investigations in progress");
            return false;
        }

        log.info("Started investigator {} ({}) as execution {}", investigatorId, instance.getTypeCode(), executionId);
        return true;
    }

    /**
     * Store a finding of an execution and count it.
     *
     * @return The stored result
     * @throws InvestigationNotFoundException if the execution does not exist
     * @throws InvestigationStorageException  if the database fails
     */
    public InvestigationResult saveResult(Long executionId, Finding finding) {
        if (finding == null) {
            throw new IllegalArgumentException("Finding cannot be null");
        }
        try {
            InvestigationResult saved = executionStore.appendResult(executionId, finding);
            log.debug("Stored result {} ({}) for execution {}", saved.getId(), saved.getSeverity(), executionId);
            return saved;
        } catch (InvestigationNotFoundException e) {
            log.warn("Discarded result for execution {}: execution does not exist", executionId);
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to store result for execution {}", executionId, e);
            throw new InvestigationStorageException("Failed to store result for execution " + executionId, e);
        }
    }

    public Optional<List<InvestigationExecution>> getExecutions(String investigatorId) {
        if (!instanceRepository.existsById(investigatorId)) {
            return Optional.empty();
        }
        return Optional.of(executionRepository.findByInvestigatorIdOrderByStartedAtDesc(investigatorId));
    }

    public Optional<InvestigationExecution> getExecution(Long executionId) {
        return executionRepository.findById(executionId);
    }

    /**
     * Finished executions (COMPLETED or FAILED), most recent first, with their anomaly counts.
     */
    public List<ExecutionOverview> listFinishedExecutions() {
        List<InvestigationExecution> executions =
                executionRepository.findByStatusInOrderByStartedAtDesc(FINISHED_STATUSES);
        if (executions.isEmpty()) {
            return List.of();
        }
        List<Long> executionIds = executions.stream().map(InvestigationExecution::getId).toList();
        Map<Long, Long> anomalyCounts = resultRepository
                .countByExecutionIdsAndSeverityIn(executionIds, ANOMALY_SEVERITIES).stream()
                .collect(Collectors.toMap(
                        InvestigationResultRepository.ExecutionResultCount::getExecutionId,
                        InvestigationResultRepository.ExecutionResultCount::getResultCount));
        Map<String, String> names = investigatorNames(executions.stream()
                .map(InvestigationExecution::getInvestigatorId)
                .collect(Collectors.toSet()));

        return executions.stream()
                .map(execution -> ExecutionOverview.of(
                        execution,
                        names.getOrDefault(execution.getInvestigatorId(), execution.getInvestigatorId()),
                        anomalyCounts.getOrDefault(execution.getId(), 0L)))
                .toList();
    }

    public Optional<ExecutionOverview> getExecutionOverview(Long executionId) {
        return executionRepository.findById(executionId)
                .map(execution -> ExecutionOverview.of(
                        execution,
                        investigatorNames(Set.of(execution.getInvestigatorId()))
                                .getOrDefault(execution.getInvestigatorId(), execution.getInvestigatorId()),
                        resultRepository.countByExecutionIdAndSeverityIn(executionId, ANOMALY_SEVERITIES)));
    }

    /**
     * Delete one execution with its results, atomically.
     *
     * @return false if the execution does not exist
     */
    public boolean deleteExecution(Long executionId) {
        try {
            return executionStore.deleteExecution(executionId);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to delete execution {}", executionId, e);
            throw new InvestigationStorageException("Failed to delete execution " + executionId, e);
        }
    }

    /**
     * Most recent results of an execution.
     *
     * @param limit Maximum number of results, capped at 1000
     */
    public Optional<List<InvestigationResult>> getResults(Long executionId, int limit) {
        if (!executionRepository.existsById(executionId)) {
            return Optional.empty();
        }
        int pageSize = Math.max(1, Math.min(limit, MAX_RESULTS_LIMIT));
        return Optional.of(resultRepository.findByExecutionIdOrderByTimestampDescIdDesc(
                executionId, PageRequest.of(0, pageSize)));
    }

    // ==================== RESULT COUNT VERIFICATION ====================

    /**
     * Compare the stored counter with the real number of results. Read-only.
     */
    public Optional<CountVerification> verifyResultCount(Long executionId) {
        return executionStore.verify(executionId);
    }

    /**
     * @return true if the counter had drifted and was corrected; false if it was
     *         accurate or the execution does not exist
     */
    public boolean correctResultCount(Long executionId) {
        try {
            return executionStore.correct(executionId);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to correct result count of execution {}", executionId, e);
            throw new InvestigationStorageException("Failed to correct result count of execution " + executionId, e);
        }
    }

    /**
     * Correct every execution, each in its own transaction.
     *
     * @return Number of executions whose counter was corrected
     */
    public int correctAllResultCounts() {
        List<Long> executionIds = executionRepository.findAllIds();
        int corrected = 0;
        for (Long executionId : executionIds) {
            if (correctResultCount(executionId)) {
                corrected++;
            }
        }
        log.info("Result count sweep checked {} executions, corrected {}", executionIds.size(), corrected);
        return corrected;
    }

    /**
     * Fail executions that have been RUNNING longer than the configured timeout.
     *
     * @return Number of executions failed by this call
     */
    public int expireStaleExecutions() {
        Duration timeout = properties.getExecution().getTimeout();
        Instant cutoff = clock.instant().minus(timeout);
        List<InvestigationExecution> stale =
                executionRepository.findByStatusAndStartedAtBefore(ExecutionStatus.RUNNING, cutoff);

        int expired = 0;
        for (InvestigationExecution execution : stale) {
            log.warn("Execution {} of investigator {} has been running since {}, marking it failed",
                    execution.getId(), execution.getInvestigatorId(), execution.getStartedAt());
            if (finishExecution(execution.getInvestigatorId(), execution.getId(), ExecutionStatus.FAILED,
                    "Execution timed out after " + timeout)) {
                expired++;
            }
        }
        return expired;
    }

    // ==================== RUN LIFECYCLE ====================

    private Optional<InvestigationExecution> openExecution(String investigatorId) {
        try {
            return executionStore.openExecution(investigatorId, clock.instant());
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to open execution for investigator {}", investigatorId, e);
            throw new InvestigationStorageException("Failed to open execution for investigator " + investigatorId, e);
        }
    }

    private void runInvestigation(Investigator investigator, PersistingFindingChannel channel,
                                  String investigatorId, Long executionId) {
        String failure = null;
        try {
            investigator.run();
        } catch (RuntimeException e) {
            log.error("Investigator {} failed in execution {}", investigatorId, executionId, e);
            failure = "Investigation failed: " + e.getMessage();
        }

        int failedSaves = channel.awaitSettled();
        if (failure == null && failedSaves > 0) {
            failure = failedSaves + " findings could not be stored";
        }

        try {
            finishExecution(investigatorId, executionId,
                    failure == null ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED, failure);
        } finally {
            activeChannels.remove(executionId);
        }
    }

    /**
     * Close the execution, then notify. Notifications carry the reconciled count.
     *
     * @return true if this call moved the execution out of RUNNING
     */
    private boolean finishExecution(String investigatorId, Long executionId, ExecutionStatus status, String errorMessage) {
        Instant completedAt = clock.instant();
        Optional<Long> finalCount;
        try {
            finalCount = executionStore.closeExecution(executionId, status, errorMessage, completedAt);
        } catch (DataAccessException | TransactionException e) {
            // Left RUNNING; the watchdog retries once the timeout has passed
            log.error("Failed to close execution {} of investigator {} as {}", executionId, investigatorId, status, e);
            return false;
        }

        if (finalCount.isEmpty()) {
            log.info("Execution {} of investigator {} was already closed or deleted", executionId, investigatorId);
            return false;
        }

        // No-op for the run's own channel, which has settled by now
        PersistingFindingChannel channel = activeChannels.get(executionId);
        if (channel != null) {
            channel.silence();
        }

        notifier.statusChanged(investigatorId, executionId, status);
        if (status == ExecutionStatus.COMPLETED) {
            notifier.investigationCompleted(investigatorId, executionId, finalCount.get(), completedAt);
        }
        log.info("Execution {} of investigator {} finished as {} with {} results",
                executionId, investigatorId, status, finalCount.get());
        return true;
    }

    private List<String> configurationOverlays(InvestigatorInstance instance) {
        List<String> overlays = new ArrayList<>(2);
        catalogService.findByCode(instance.getTypeCode())
                .map(InvestigatorType::getDefaultConfiguration)
                .ifPresent(overlays::add);
        if (instance.getCustomConfiguration() != null) {
            overlays.add(instance.getCustomConfiguration());
        }
        return overlays;
    }

    private Map<String, String> investigatorNames(Collection<String> investigatorIds) {
        return instanceRepository.findAllById(investigatorIds).stream()
                .filter(instance -> instance.getCustomName() != null)
                .collect(Collectors.toMap(InvestigatorInstance::getId, InvestigatorInstance::getCustomName));
    }

    private static String validName(String name) {
        if (name.length() > MAX_NAME_LENGTH) {
            throw new InvestigationValidationException(
                    "Investigator name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return name;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
