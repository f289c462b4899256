package com.anomalywatch.investigator;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Thresholds for the invoice anomaly rules.
 *
 * Defaults come from investigation.invoice.* and may be overridden per type and
 * per instance with a JSON object using the same field names.
 */
@Data
@NoArgsConstructor
public class InvoiceRuleSettings {

    /** Tax above totalAmount * maxTaxRatio is anomalous. Only checked for positive amounts. */
    @NotNull
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal maxTaxRatio = new BigDecimal("0.5");

    private boolean checkNegativeAmounts = true;

    private boolean checkFutureDates = true;

    /** Days into the future an issue date may lie before it is flagged. */
    @Min(0)
    @Max(3650)
    private int maxFutureDays = 0;
}
