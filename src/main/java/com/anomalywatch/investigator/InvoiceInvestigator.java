package com.anomalywatch.investigator;

import com.anomalywatch.model.Invoice;
import com.anomalywatch.repository.InvoiceRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Scans all invoices for amount, tax and date anomalies.
 *
 * Findings per run:
 * - one ANOMALY finding per anomalous invoice, listing every reason
 * - one INFO summary when at least one invoice was scanned
 *
 * Afterwards every scanned invoice gets hasAnomalies and lastInvestigatedAt written back.
 */
@Slf4j
public class InvoiceInvestigator extends Investigator {

    public static final String TYPE_CODE = "invoice";
    public static final String ENTITY_TYPE = "Invoice";

    static final int FLAG_BATCH_SIZE = 500;

    private final InvoiceRepository invoiceRepository;
    private final InvoiceAnomalyRules rules;

    public InvoiceInvestigator(InvestigatorContext context,
                               InvoiceRuleSettings settings,
                               InvoiceRepository invoiceRepository,
                               ObjectMapper objectMapper) {
        super("Invoice Investigator", context, objectMapper);
        this.invoiceRepository = invoiceRepository;
        this.rules = new InvoiceAnomalyRules(settings);
    }

    @Override
    protected void scan() {
        Instant now = now();
        List<Invoice> invoices = invoiceRepository.findAll(Sort.by("id"));
        List<Evaluation<Invoice, InvoiceRule>> evaluations = rules.evaluateAll(invoices, now);

        for (Evaluation<Invoice, InvoiceRule> evaluation : evaluations) {
            if (!evaluation.isAnomaly()) {
                continue;
            }
            Invoice invoice = evaluation.entity();
            String message = "Anomalous invoice " + invoice.getId() + ": " + String.join(", ", evaluation.reasons());
            AnomalyPayload payload = new AnomalyPayload(
                    invoice.getId(),
                    invoice.getTotalAmount(),
                    invoice.getTotalTax(),
                    invoice.getIssueDate(),
                    invoice.getRecipientName(),
                    evaluation.reasons(),
                    now,
                    rules.getSettings());
            record(Finding.anomaly(message, payload(payload), ENTITY_TYPE, invoice.getId(), now()));
        }

        RuleStatistics<InvoiceRule> stats = rules.statistics(evaluations);
        if (stats.getTotal() > 0) {
            String message = String.format(Locale.ROOT, "Investigation complete: %d/%d anomalies found (%.1f%%)",
                    stats.getAnomalous(), stats.getTotal(), stats.getAnomalyRate());
            SummaryPayload payload = new SummaryPayload(
                    stats.getTotal(),
                    stats.getAnomalous(),
                    stats.getAnomalyRate(),
                    stats.count(InvoiceRule.NEGATIVE_AMOUNT),
                    stats.count(InvoiceRule.EXCESSIVE_TAX_RATIO),
                    stats.count(InvoiceRule.FUTURE_ISSUE_DATE),
                    now());
            record(Finding.info(message, payload(payload), now()));
        }

        markInvestigated(evaluations, now);
    }

    private void markInvestigated(List<Evaluation<Invoice, InvoiceRule>> evaluations, Instant investigatedAt) {
        Map<Boolean, List<Long>> idsByOutcome = evaluations.stream()
                .collect(Collectors.partitioningBy(Evaluation::isAnomaly,
                        Collectors.mapping(e -> e.entity().getId(), Collectors.toList())));

        idsByOutcome.forEach((hasAnomalies, ids) -> {
            for (int from = 0; from < ids.size(); from += FLAG_BATCH_SIZE) {
                List<Long> batch = ids.subList(from, Math.min(from + FLAG_BATCH_SIZE, ids.size()));
                invoiceRepository.markInvestigated(batch, hasAnomalies, investigatedAt);
            }
        });
        log.debug("Updated investigation flags of {} invoices for execution {}",
                evaluations.size(), context().executionId());
    }

    record AnomalyPayload(
        Long id,
        BigDecimal totalAmount,
        BigDecimal totalTax,
        Instant issueDate,
        String recipientName,
        List<String> anomalyReasons,
        Instant evaluatedAt,
        InvoiceRuleSettings configuration
    ) {
    }

    record SummaryPayload(
        int totalInvoices,
        int totalAnomalies,
        double anomalyRate,
        int negativeAmountCount,
        int excessiveTaxCount,
        int futureDateCount,
        Instant completedAt
    ) {
    }
}
