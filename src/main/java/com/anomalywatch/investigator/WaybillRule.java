package com.anomalywatch.investigator;

/**
 * Waybill delivery rules, most severe first.
 * The first rule a waybill violates is its primary issue type.
 */
public enum WaybillRule {
    OVERDUE("Overdue"),
    EXPIRING_SOON("ExpiringSoon"),
    LEGACY_OVERDUE("LegacyLate");

    private final String issueType;

    WaybillRule(String issueType) {
        this.issueType = issueType;
    }

    public String getIssueType() {
        return issueType;
    }
}
