package com.anomalywatch.investigator;

import com.anomalywatch.model.ResultSeverity;
import com.anomalywatch.model.Waybill;
import com.anomalywatch.repository.WaybillRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.anomalywatch.investigator.WaybillDeliveryRulesTest.waybill;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link WaybillInvestigator}.
 */
@ExtendWith(MockitoExtension.class)
class WaybillInvestigatorTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    @Mock
    private WaybillRepository waybillRepository;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final List<Finding> findings = new ArrayList<>();

    @BeforeEach
    void setUp() {
        List<Waybill> waybills = List.of(
                waybill(1L, NOW.minus(Duration.ofDays(10)), NOW.minus(Duration.ofDays(2))),   // overdue
                waybill(2L, NOW.minus(Duration.ofDays(2)), NOW.plus(Duration.ofHours(6))),     // expiring soon
                waybill(3L, NOW.minus(Duration.ofDays(30)), null),                             // legacy overdue
                waybill(4L, NOW.minus(Duration.ofDays(1)), NOW.plus(Duration.ofDays(10))));    // fine
        when(waybillRepository.findByDeliveredAtIsNullOrderByIdAsc()).thenReturn(waybills);
    }

    @Test
    @DisplayName("Should emit problems, statistics and category summaries between lifecycle findings")
    void shouldEmitAllFindings() {
        investigator().run();

        assertThat(findings).extracting(Finding::message)
                .hasSize(9)
                .startsWith("Waybill Investigator started.")
                .endsWith("Waybill Investigator completed.")
                .contains(
                        "Investigation complete: 3/4 issues found (75.0%)",
                        "Overdue Summary: 1 waybills past due date",
                        "Expiring Soon Summary: 1 waybills due within 24h",
                        "Legacy Overdue Summary: 1 legacy waybills past 7d cutoff");
    }

    @Test
    @DisplayName("Should classify each waybill by its primary issue")
    void shouldClassifyProblems() {
        investigator().run();

        assertThat(findings.get(1).message()).startsWith("OVERDUE: Waybill 1 - Overdue delivery: 2d 0h");
        assertThat(findings.get(1).severity()).isEqualTo(ResultSeverity.CRITICAL);
        assertThat(findings.get(2).message()).startsWith("EXPIRINGSOON: Waybill 2 - Expiring soon: 6.0h");
        assertThat(findings.get(2).severity()).isEqualTo(ResultSeverity.ANOMALY);
        assertThat(findings.get(3).message()).startsWith("LEGACYLATE: Waybill 3 - Legacy waybill overdue");
        assertThat(findings.get(3).entityType()).isEqualTo("Waybill");
        assertThat(findings.get(3).entityId()).isEqualTo(3L);
    }

    @Test
    @DisplayName("Should list waybill ids in category summary payloads")
    void shouldListIdsInCategoryPayload() throws Exception {
        investigator().run();

        Finding overdueSummary = findings.stream()
                .filter(f -> f.message().startsWith("Overdue Summary"))
                .findFirst()
                .orElseThrow();
        JsonNode payload = objectMapper.readTree(overdueSummary.payload());
        assertThat(payload.get("type").asText()).isEqualTo("OverdueSummary");
        assertThat(payload.get("waybillIds").get(0).asLong()).isEqualTo(1L);
        assertThat(overdueSummary.severity()).isEqualTo(ResultSeverity.INFO);
    }

    @Test
    @DisplayName("Should write flags back for problematic and healthy waybills")
    void shouldWriteFlags() {
        investigator().run();

        verify(waybillRepository).markInvestigated(List.of(1L, 2L, 3L), true, NOW);
        verify(waybillRepository).markInvestigated(List.of(4L), false, NOW);
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    private WaybillInvestigator investigator() {
        InvestigatorContext context = new InvestigatorContext("investigator-2", 2L, findings::add, null,
                Clock.fixed(NOW, ZoneOffset.UTC), List.of());
        return new WaybillInvestigator(context, new WaybillRuleSettings(), waybillRepository, objectMapper);
    }
}
