package com.anomalywatch.service;

import com.anomalywatch.investigator.Finding;
import com.anomalywatch.model.ExecutionStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Concurrent saveResult calls against one execution must never lose an increment.
 */
class ResultCountConcurrencyTest extends AbstractIntegrationTest {

    @ParameterizedTest(name = "{0} concurrent saves")
    @ValueSource(ints = {50, 100})
    @DisplayName("Should count every concurrently stored result")
    void shouldCountConcurrentSaves(int saves) throws Exception {
        String investigatorId = investigationManager.createInvestigator("invoice", "Concurrency");
        Long executionId = executionStore.openExecution(investigatorId, Instant.now()).orElseThrow().getId();

        ExecutorService pool = Executors.newFixedThreadPool(16);
        CountDownLatch startSignal = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < saves; i++) {
                Finding finding = Finding.info("Concurrent finding " + i, Instant.now());
                futures.add(pool.submit(() -> {
                    startSignal.await();
                    return investigationManager.saveResult(executionId, finding);
                }));
            }
            startSignal.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(executionRepository.findResultCountById(executionId)).contains(saves);
        assertThat(resultRepository.countByExecutionId(executionId)).isEqualTo(saves);
        assertThat(investigationManager.verifyResultCount(executionId).orElseThrow().accurate()).isTrue();

        assertThat(executionStore.closeExecution(executionId, ExecutionStatus.COMPLETED, null, Instant.now()))
                .contains((long) saves);
    }
}
