package com.anomalywatch.investigator;

import com.anomalywatch.model.Invoice;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Invoice anomaly rules.
 *
 * Pure: the outcome depends only on the invoice, the settings and the given
 * instant. No persistence and no clock access.
 *
 * RULES:
 * ======
 * - Negative amount: totalAmount < 0 (when checkNegativeAmounts)
 * - Excessive tax: totalAmount > 0 and totalTax > totalAmount * maxTaxRatio (always checked)
 * - Future issue date: issueDate > now + maxFutureDays (when checkFutureDates)
 */
public class InvoiceAnomalyRules {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final InvoiceRuleSettings settings;

    public InvoiceAnomalyRules(InvoiceRuleSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Invoice rule settings cannot be null");
        }
        this.settings = settings;
    }

    public Evaluation<Invoice, InvoiceRule> evaluate(Invoice invoice, Instant now) {
        List<RuleViolation<InvoiceRule>> violations = new ArrayList<>();
        BigDecimal amount = invoice.getTotalAmount();
        BigDecimal tax = invoice.getTotalTax();

        if (settings.isCheckNegativeAmounts() && amount != null && amount.signum() < 0) {
            violations.add(new RuleViolation<>(InvoiceRule.NEGATIVE_AMOUNT,
                    "Negative total amount: " + amount.setScale(2, RoundingMode.HALF_UP).toPlainString()));
        }

        if (amount != null && tax != null && amount.signum() > 0
                && tax.compareTo(amount.multiply(settings.getMaxTaxRatio())) > 0) {
            BigDecimal actualPercent = tax.multiply(HUNDRED).divide(amount, 1, RoundingMode.HALF_UP);
            BigDecimal maxPercent = settings.getMaxTaxRatio().multiply(HUNDRED).setScale(1, RoundingMode.HALF_UP);
            violations.add(new RuleViolation<>(InvoiceRule.EXCESSIVE_TAX_RATIO,
                    "Excessive tax ratio: " + actualPercent.toPlainString()
                            + "% (max allowed: " + maxPercent.toPlainString() + "%)"));
        }

        if (settings.isCheckFutureDates() && invoice.getIssueDate() != null) {
            Instant maxAllowed = now.plus(Duration.ofDays(settings.getMaxFutureDays()));
            if (invoice.getIssueDate().isAfter(maxAllowed)) {
                long futureDays = Duration.between(now, invoice.getIssueDate()).toDays();
                violations.add(new RuleViolation<>(InvoiceRule.FUTURE_ISSUE_DATE,
                        String.format(Locale.ROOT, "Future issue date: %s (%d days in future, max allowed: %d)",
                                DATE.format(invoice.getIssueDate()), futureDays, settings.getMaxFutureDays())));
            }
        }

        return new Evaluation<>(invoice, violations);
    }

    public boolean isAnomaly(Invoice invoice, Instant now) {
        return evaluate(invoice, now).isAnomaly();
    }

    public List<Evaluation<Invoice, InvoiceRule>> evaluateAll(List<Invoice> invoices, Instant now) {
        return invoices.stream().map(invoice -> evaluate(invoice, now)).toList();
    }

    public RuleStatistics<InvoiceRule> statistics(List<Evaluation<Invoice, InvoiceRule>> evaluations) {
        return RuleStatistics.of(InvoiceRule.class, evaluations);
    }

    public InvoiceRuleSettings getSettings() {
        return settings;
    }
}
