package com.anomalywatch.service;

import com.anomalywatch.investigator.Finding;
import com.anomalywatch.model.InvestigationResult;
import com.anomalywatch.producer.InvestigationNotifier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PersistingFindingChannel}, with writes running on the
 * publishing thread.
 */
class PersistingFindingChannelTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    private final InvestigationNotifier notifier = mock(InvestigationNotifier.class);
    private final AtomicLong ids = new AtomicLong();

    @Test
    @DisplayName("Should store every finding and announce it after the write")
    void shouldStoreAndAnnounce() {
        PersistingFindingChannel channel = channel(this::store);

        channel.publish(Finding.info("First", NOW));
        channel.publish(Finding.info("Second", NOW));

        assertThat(channel.awaitSettled()).isZero();
        verify(notifier, times(2)).resultAdded(eq("investigator-1"), any(InvestigationResult.class));
    }

    @Test
    @DisplayName("Should keep storing but stop announcing once silenced")
    void shouldStopAnnouncingWhenSilenced() {
        AtomicLong stored = new AtomicLong();
        PersistingFindingChannel channel = channel(finding -> {
            stored.incrementAndGet();
            return store(finding);
        });

        channel.publish(Finding.info("Before", NOW));
        channel.silence();
        channel.publish(Finding.info("After", NOW));

        assertThat(channel.awaitSettled()).isZero();
        assertThat(stored).hasValue(2);
        verify(notifier).resultAdded(eq("investigator-1"), argThat(result -> "Before".equals(result.getMessage())));
        verifyNoMoreInteractions(notifier);
    }

    @Test
    @DisplayName("Should count failed writes and reject findings after settling")
    void shouldCountFailedWrites() {
        PersistingFindingChannel channel = channel(finding -> {
            throw new IllegalStateException("database down");
        });

        channel.publish(Finding.info("Lost", NOW));

        assertThat(channel.awaitSettled()).isEqualTo(1);
        verifyNoInteractions(notifier);
        assertThatThrownBy(() -> channel.publish(Finding.info("Late", NOW)))
                .isInstanceOf(IllegalStateException.class);
    }

    // ---- Helpers ----

    private PersistingFindingChannel channel(Function<Finding, InvestigationResult> writer) {
        return new PersistingFindingChannel("investigator-1", 7L, writer, notifier, Runnable::run);
    }

    private InvestigationResult store(Finding finding) {
        InvestigationResult result = new InvestigationResult();
        result.setId(ids.incrementAndGet());
        result.setExecutionId(7L);
        result.setMessage(finding.message());
        result.setSeverity(finding.severity());
        result.setTimestamp(finding.timestamp());
        return result;
    }
}
