package com.anomalywatch.investigator;

import com.anomalywatch.model.ResultSeverity;
import com.anomalywatch.model.Waybill;
import com.anomalywatch.repository.WaybillRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Scans undelivered waybills for late and soon-to-be-late deliveries.
 *
 * Findings per run:
 * - one finding per problematic waybill, CRITICAL when overdue, ANOMALY otherwise,
 *   prefixed with its primary issue type
 * - one INFO statistics summary when at least one waybill was scanned
 * - one INFO category summary per non-empty category (overdue, expiring soon, legacy overdue)
 */
@Slf4j
public class WaybillInvestigator extends Investigator {

    public static final String TYPE_CODE = "waybill";
    public static final String ENTITY_TYPE = "Waybill";

    static final int FLAG_BATCH_SIZE = 500;

    private final WaybillRepository waybillRepository;
    private final WaybillDeliveryRules rules;

    public WaybillInvestigator(InvestigatorContext context,
                               WaybillRuleSettings settings,
                               WaybillRepository waybillRepository,
                               ObjectMapper objectMapper) {
        super("Waybill Investigator", context, objectMapper);
        this.waybillRepository = waybillRepository;
        this.rules = new WaybillDeliveryRules(settings);
    }

    @Override
    protected void scan() {
        Instant now = now();
        List<Waybill> waybills = waybillRepository.findByDeliveredAtIsNullOrderByIdAsc();
        List<Evaluation<Waybill, WaybillRule>> evaluations = rules.evaluateAll(waybills, now);

        for (Evaluation<Waybill, WaybillRule> evaluation : evaluations) {
            if (!evaluation.isAnomaly()) {
                continue;
            }
            recordProblem(evaluation, now);
        }

        RuleStatistics<WaybillRule> stats = rules.statistics(evaluations);
        if (stats.getTotal() > 0) {
            long withDueDate = waybills.stream().filter(w -> w.getDueDate() != null).count();
            String message = String.format(Locale.ROOT, "Investigation complete: %d/%d issues found (%.1f%%)",
                    stats.getAnomalous(), stats.getTotal(), stats.getAnomalyRate());
            SummaryPayload payload = new SummaryPayload(
                    stats.getTotal(),
                    stats.getAnomalous(),
                    stats.getAnomalyRate(),
                    stats.count(WaybillRule.OVERDUE),
                    stats.count(WaybillRule.EXPIRING_SOON),
                    stats.count(WaybillRule.LEGACY_OVERDUE),
                    withDueDate,
                    waybills.size() - withDueDate,
                    now());
            record(Finding.info(message, payload(payload), now()));
        }

        recordCategorySummaries(evaluations);
        markInvestigated(evaluations, now);
    }

    private void recordProblem(Evaluation<Waybill, WaybillRule> evaluation, Instant evaluatedAt) {
        Waybill waybill = evaluation.entity();
        WaybillRule primary = WaybillDeliveryRules.primaryIssue(evaluation).orElseThrow();
        String message = primary.getIssueType().toUpperCase(Locale.ROOT) + ": Waybill " + waybill.getId()
                + " - " + String.join(", ", evaluation.reasons());
        ProblemPayload payload = new ProblemPayload(
                waybill.getId(),
                waybill.getRecipientName(),
                waybill.getGoodsIssueDate(),
                waybill.getDueDate(),
                primary.getIssueType(),
                evaluation.reasons(),
                evaluatedAt,
                rules.getSettings());
        ResultSeverity severity = primary == WaybillRule.OVERDUE ? ResultSeverity.CRITICAL : ResultSeverity.ANOMALY;
        record(new Finding(severity, message, payload(payload), ENTITY_TYPE, waybill.getId(), now()));
    }

    private void recordCategorySummaries(List<Evaluation<Waybill, WaybillRule>> evaluations) {
        WaybillRuleSettings settings = rules.getSettings();

        List<Long> overdue = idsViolating(evaluations, WaybillRule.OVERDUE);
        if (!overdue.isEmpty()) {
            record(Finding.info("Overdue Summary: " + overdue.size() + " waybills past due date",
                    payload(new CategoryPayload("OverdueSummary", overdue.size(), null, null, overdue)), now()));
        }

        List<Long> expiringSoon = idsViolating(evaluations, WaybillRule.EXPIRING_SOON);
        if (!expiringSoon.isEmpty()) {
            record(Finding.info("Expiring Soon Summary: " + expiringSoon.size() + " waybills due within "
                            + settings.getExpiringSoonHours() + "h",
                    payload(new CategoryPayload("ExpiringSoonSummary", expiringSoon.size(),
                            settings.getExpiringSoonHours(), null, expiringSoon)), now()));
        }

        List<Long> legacy = idsViolating(evaluations, WaybillRule.LEGACY_OVERDUE);
        if (!legacy.isEmpty()) {
            record(Finding.info("Legacy Overdue Summary: " + legacy.size() + " legacy waybills past "
                            + settings.getLegacyCutoffDays() + "d cutoff",
                    payload(new CategoryPayload("LegacyOverdueSummary", legacy.size(),
                            null, settings.getLegacyCutoffDays(), legacy)), now()));
        }
    }

    private static List<Long> idsViolating(List<Evaluation<Waybill, WaybillRule>> evaluations, WaybillRule rule) {
        return evaluations.stream()
                .filter(e -> e.violates(rule))
                .map(e -> e.entity().getId())
                .toList();
    }

    private void markInvestigated(List<Evaluation<Waybill, WaybillRule>> evaluations, Instant investigatedAt) {
        Map<Boolean, List<Long>> idsByOutcome = evaluations.stream()
                .collect(Collectors.partitioningBy(Evaluation::isAnomaly,
                        Collectors.mapping(e -> e.entity().getId(), Collectors.toList())));

        idsByOutcome.forEach((hasAnomalies, ids) -> {
            for (int from = 0; from < ids.size(); from += FLAG_BATCH_SIZE) {
                List<Long> batch = ids.subList(from, Math.min(from + FLAG_BATCH_SIZE, ids.size()));
                waybillRepository.markInvestigated(batch, hasAnomalies, investigatedAt);
            }
        });
        log.debug("Updated investigation flags of {} waybills for execution {}",
                evaluations.size(), context().executionId());
    }

    record ProblemPayload(
        Long id,
        String recipientName,
        Instant goodsIssueDate,
        Instant dueDate,
        String issueType,
        List<String> deliveryReasons,
        Instant evaluatedAt,
        WaybillRuleSettings configuration
    ) {
    }

    record SummaryPayload(
        int totalWaybills,
        int totalProblematic,
        double problematicRate,
        int overdueCount,
        int expiringSoonCount,
        int legacyOverdueCount,
        long withDueDateCount,
        long legacyWaybillCount,
        Instant completedAt
    ) {
    }

    record CategoryPayload(
        String type,
        int count,
        Integer thresholdHours,
        Integer cutoffDays,
        List<Long> waybillIds
    ) {
    }
}
