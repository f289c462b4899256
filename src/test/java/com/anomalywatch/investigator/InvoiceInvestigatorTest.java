package com.anomalywatch.investigator;

import com.anomalywatch.model.Invoice;
import com.anomalywatch.model.ResultSeverity;
import com.anomalywatch.producer.InvestigationNotifier;
import com.anomalywatch.repository.InvoiceRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.LongStream;

import static com.anomalywatch.investigator.InvoiceAnomalyRulesTest.invoice;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link InvoiceInvestigator}.
 */
@ExtendWith(MockitoExtension.class)
class InvoiceInvestigatorTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    @Mock
    private InvoiceRepository invoiceRepository;

    @Mock
    private InvestigationNotifier notifier;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final List<Finding> findings = new ArrayList<>();

    @Test
    @DisplayName("Should emit 103 findings for 100 negative invoices")
    void shouldEmitOneFindingPerAnomalyPlusLifecycle() {
        when(invoiceRepository.findAll(any(Sort.class))).thenReturn(negativeInvoices(100));

        investigator().run();

        assertThat(findings).hasSize(103);
        assertThat(findings.get(0).message()).isEqualTo("Invoice Investigator started.");
        assertThat(findings.get(101).message()).isEqualTo("Investigation complete: 100/100 anomalies found (100.0%)");
        assertThat(findings.get(102).message()).isEqualTo("Invoice Investigator completed.");
        assertThat(findings.subList(1, 101))
                .allSatisfy(finding -> {
                    assertThat(finding.severity()).isEqualTo(ResultSeverity.ANOMALY);
                    assertThat(finding.entityType()).isEqualTo("Invoice");
                });
    }

    @Test
    @DisplayName("Should describe each anomalous invoice with its reasons and payload")
    void shouldDescribeAnomalies() throws Exception {
        when(invoiceRepository.findAll(any(Sort.class))).thenReturn(List.of(
                invoice(7L, "100", "80", NOW),
                invoice(8L, "100", "10", NOW)));

        investigator().run();

        Finding anomaly = findings.get(1);
        assertThat(anomaly.message())
                .isEqualTo("Anomalous invoice 7: Excessive tax ratio: 80.0% (max allowed: 50.0%)");
        assertThat(anomaly.entityId()).isEqualTo(7L);
        assertThat(objectMapper.readTree(anomaly.payload()).get("anomalyReasons").get(0).asText())
                .startsWith("Excessive tax ratio");
        assertThat(findings.get(2).message()).isEqualTo("Investigation complete: 1/2 anomalies found (50.0%)");
        assertThat(findings).hasSize(4);
    }

    @Test
    @DisplayName("Should skip the summary when there are no invoices")
    void shouldSkipSummaryWithoutInvoices() {
        when(invoiceRepository.findAll(any(Sort.class))).thenReturn(List.of());

        investigator().run();

        assertThat(findings).extracting(Finding::message)
                .containsExactly("Invoice Investigator started.", "Invoice Investigator completed.");
        verify(invoiceRepository, never()).markInvestigated(anyCollection(), anyBoolean(), any());
    }

    @Test
    @DisplayName("Should write investigation flags back in batches")
    @SuppressWarnings("unchecked")
    void shouldWriteFlagsInBatches() {
        List<Invoice> invoices = new ArrayList<>(negativeInvoices(600));
        invoices.add(invoice(1000L, "100", "10", NOW));
        when(invoiceRepository.findAll(any(Sort.class))).thenReturn(invoices);

        investigator().run();

        ArgumentCaptor<Collection<Long>> anomalous = ArgumentCaptor.forClass(Collection.class);
        verify(invoiceRepository, times(2)).markInvestigated(anomalous.capture(), eq(true), eq(NOW));
        assertThat(anomalous.getAllValues()).extracting(Collection::size).containsExactly(500, 100);
        verify(invoiceRepository).markInvestigated(List.of(1000L), false, NOW);
    }

    @Test
    @DisplayName("Should apply the configured tax ratio")
    void shouldApplyConfiguredSettings() {
        InvoiceRuleSettings settings = new InvoiceRuleSettings();
        settings.setMaxTaxRatio(new BigDecimal("0.9"));
        when(invoiceRepository.findAll(any(Sort.class))).thenReturn(List.of(invoice(7L, "100", "80", NOW)));

        new InvoiceInvestigator(context(), settings, invoiceRepository, objectMapper).run();

        assertThat(findings).extracting(Finding::message)
                .contains("Investigation complete: 0/1 anomalies found (0.0%)");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private InvoiceInvestigator investigator() {
        return new InvoiceInvestigator(context(), new InvoiceRuleSettings(), invoiceRepository, objectMapper);
    }

    private InvestigatorContext context() {
        return new InvestigatorContext("investigator-1", 1L, findings::add, notifier,
                Clock.fixed(NOW, ZoneOffset.UTC), List.of());
    }

    private static List<Invoice> negativeInvoices(int count) {
        return LongStream.rangeClosed(1, count)
                .mapToObj(id -> invoice(id, "-10", "0", NOW))
                .toList();
    }
}
