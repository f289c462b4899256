package com.anomalywatch.investigator;

public enum InvoiceRule {
    NEGATIVE_AMOUNT,
    EXCESSIVE_TAX_RATIO,
    FUTURE_ISSUE_DATE
}
