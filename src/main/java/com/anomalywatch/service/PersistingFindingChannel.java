package com.anomalywatch.service;

import com.anomalywatch.investigator.Finding;
import com.anomalywatch.investigator.FindingChannel;
import com.anomalywatch.model.InvestigationResult;
import com.anomalywatch.producer.InvestigationNotifier;
import lombok.extern.slf4j.Slf4j;

import java.util.Queue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

/**
 * FindingChannel that stores every finding of one execution.
 *
 * publish() hands the finding to the result writer pool and returns. Each write is
 * its own transaction; once it commits, a ResultAdded notification is sent for the
 * stored row. awaitSettled() blocks until every write of this execution has
 * finished, which is what lets the manager reconcile and notify completion only
 * after the last result is in the database.
 */
@Slf4j
class PersistingFindingChannel implements FindingChannel {

    private final String investigatorId;
    private final Long executionId;
    private final Function<Finding, InvestigationResult> writer;
    private final InvestigationNotifier notifier;
    private final Executor writerExecutor;

    private final Queue<CompletableFuture<Void>> pending = new ConcurrentLinkedQueue<>();
    private final Object notifyLock = new Object();
    private volatile boolean closed;
    private boolean silenced;

    PersistingFindingChannel(String investigatorId,
                             Long executionId,
                             Function<Finding, InvestigationResult> writer,
                             InvestigationNotifier notifier,
                             Executor writerExecutor) {
        this.investigatorId = investigatorId;
        this.executionId = executionId;
        this.writer = writer;
        this.notifier = notifier;
        this.writerExecutor = writerExecutor;
    }

    @Override
    public void publish(Finding finding) {
        if (finding == null) {
            log.warn("Ignoring empty finding for execution {}", executionId);
            return;
        }
        if (closed) {
            throw new IllegalStateException("Execution " + executionId + " no longer accepts findings");
        }

        CompletableFuture<Void> write;
        try {
            write = CompletableFuture
                    .supplyAsync(() -> writer.apply(finding), writerExecutor)
                    .thenAccept(this::notifyStored);
        } catch (RejectedExecutionException e) {
            log.error("Result writer rejected a finding for execution {}", executionId, e);
            write = CompletableFuture.failedFuture(e);
        }
        pending.add(write);
    }

    /**
     * Wait for every write published so far and stop accepting new findings.
     *
     * @return Number of findings that could not be stored
     */
    int awaitSettled() {
        closed = true;
        int failed = 0;
        CompletableFuture<Void> write;
        while ((write = pending.poll()) != null) {
            try {
                write.join();
            } catch (CompletionException | CancellationException e) {
                failed++;
            }
        }
        if (failed > 0) {
            log.error("{} findings of execution {} could not be stored", failed, executionId);
        }
        return failed;
    }

    /**
     * Stop sending ResultAdded notifications. Findings are still stored.
     *
     * Called when the execution was closed by someone else (the watchdog) before
     * sending its StatusChanged event. Once this returns, every ResultAdded of this
     * channel has either been handed to the notifier already or is suppressed, so
     * none can follow the status change.
     */
    void silence() {
        synchronized (notifyLock) {
            silenced = true;
        }
    }

    private void notifyStored(InvestigationResult result) {
        synchronized (notifyLock) {
            if (silenced) {
                log.debug("Execution {} already closed, not announcing result {}", executionId, result.getId());
                return;
            }
            try {
                notifier.resultAdded(investigatorId, result);
            } catch (RuntimeException e) {
                log.warn("Result notification failed for execution {}: {}", executionId, e.getMessage());
            }
        }
    }
}
