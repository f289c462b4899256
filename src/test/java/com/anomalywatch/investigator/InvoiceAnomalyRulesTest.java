package com.anomalywatch.investigator;

import com.anomalywatch.model.Invoice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link InvoiceAnomalyRules}.
 */
class InvoiceAnomalyRulesTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    private final InvoiceAnomalyRules rules = new InvoiceAnomalyRules(new InvoiceRuleSettings());

    @Test
    @DisplayName("Should flag a negative total amount")
    void shouldFlagNegativeAmount() {
        Evaluation<Invoice, InvoiceRule> evaluation = rules.evaluate(invoice(1L, "-50", "0", NOW), NOW);

        assertThat(evaluation.isAnomaly()).isTrue();
        assertThat(evaluation.violates(InvoiceRule.NEGATIVE_AMOUNT)).isTrue();
        assertThat(evaluation.reasons()).containsExactly("Negative total amount: -50.00");
    }

    @Test
    @DisplayName("Should not flag negative amounts when the check is disabled")
    void shouldSkipNegativeAmountWhenDisabled() {
        InvoiceRuleSettings settings = new InvoiceRuleSettings();
        settings.setCheckNegativeAmounts(false);

        assertThat(new InvoiceAnomalyRules(settings).isAnomaly(invoice(1L, "-50", "0", NOW), NOW)).isFalse();
    }

    @Test
    @DisplayName("Should flag tax above the maximum ratio")
    void shouldFlagExcessiveTax() {
        Evaluation<Invoice, InvoiceRule> evaluation = rules.evaluate(invoice(2L, "100", "60", NOW), NOW);

        assertThat(evaluation.reasons()).containsExactly("Excessive tax ratio: 60.0% (max allowed: 50.0%)");
    }

    @Test
    @DisplayName("Should accept tax exactly at the maximum ratio")
    void shouldAcceptTaxAtRatio() {
        assertThat(rules.isAnomaly(invoice(3L, "100", "50", NOW), NOW)).isFalse();
    }

    @Test
    @DisplayName("Should only check the tax ratio for positive amounts")
    void shouldIgnoreTaxRatioForNonPositiveAmounts() {
        Evaluation<Invoice, InvoiceRule> negative = rules.evaluate(invoice(4L, "-100", "500", NOW), NOW);
        Evaluation<Invoice, InvoiceRule> zero = rules.evaluate(invoice(5L, "0", "10", NOW), NOW);

        assertThat(negative.violations()).extracting(RuleViolation::rule)
                .containsExactly(InvoiceRule.NEGATIVE_AMOUNT);
        assertThat(zero.isAnomaly()).isFalse();
    }

    @Test
    @DisplayName("Should flag issue dates in the future")
    void shouldFlagFutureIssueDate() {
        Instant issueDate = NOW.plus(Duration.ofDays(2));

        Evaluation<Invoice, InvoiceRule> evaluation = rules.evaluate(invoice(6L, "100", "10", issueDate), NOW);

        assertThat(evaluation.reasons())
                .containsExactly("Future issue date: 2025-06-17 (2 days in future, max allowed: 0)");
    }

    @Test
    @DisplayName("Should allow issue dates within maxFutureDays")
    void shouldAllowConfiguredFutureSkew() {
        InvoiceRuleSettings settings = new InvoiceRuleSettings();
        settings.setMaxFutureDays(3);

        Invoice invoice = invoice(7L, "100", "10", NOW.plus(Duration.ofDays(2)));

        assertThat(new InvoiceAnomalyRules(settings).isAnomaly(invoice, NOW)).isFalse();
    }

    @Test
    @DisplayName("Should list every violated rule in rule order")
    void shouldListAllReasons() {
        Invoice invoice = invoice(8L, "-10", "0", NOW.plus(Duration.ofDays(5)));

        Evaluation<Invoice, InvoiceRule> evaluation = rules.evaluate(invoice, NOW);

        assertThat(evaluation.violations()).extracting(RuleViolation::rule)
                .containsExactly(InvoiceRule.NEGATIVE_AMOUNT, InvoiceRule.FUTURE_ISSUE_DATE);
    }

    @Test
    @DisplayName("Should aggregate statistics per rule")
    void shouldComputeStatistics() {
        List<Invoice> invoices = List.of(
                invoice(1L, "-10", "0", NOW),
                invoice(2L, "100", "90", NOW),
                invoice(3L, "100", "10", NOW),
                invoice(4L, "-5", "0", NOW.plus(Duration.ofDays(1))));

        RuleStatistics<InvoiceRule> stats = rules.statistics(rules.evaluateAll(invoices, NOW));

        assertThat(stats.getTotal()).isEqualTo(4);
        assertThat(stats.getAnomalous()).isEqualTo(3);
        assertThat(stats.count(InvoiceRule.NEGATIVE_AMOUNT)).isEqualTo(2);
        assertThat(stats.count(InvoiceRule.EXCESSIVE_TAX_RATIO)).isEqualTo(1);
        assertThat(stats.count(InvoiceRule.FUTURE_ISSUE_DATE)).isEqualTo(1);
        assertThat(stats.getAnomalyRate()).isEqualTo(75.0);
    }

    @Test
    @DisplayName("Should report a zero anomaly rate for no invoices")
    void shouldHandleEmptyBatch() {
        RuleStatistics<InvoiceRule> stats = rules.statistics(rules.evaluateAll(List.of(), NOW));

        assertThat(stats.getTotal()).isZero();
        assertThat(stats.getAnomalyRate()).isZero();
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    static Invoice invoice(Long id, String amount, String tax, Instant issueDate) {
        Invoice invoice = new Invoice();
        invoice.setId(id);
        invoice.setRecipientName("Recipient " + id);
        invoice.setTotalAmount(new BigDecimal(amount));
        invoice.setTotalTax(new BigDecimal(tax));
        invoice.setIssueDate(issueDate);
        return invoice;
    }
}
