package com.anomalywatch.investigator;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Thresholds for the waybill delivery rules.
 */
@Data
@NoArgsConstructor
public class WaybillRuleSettings {

    /** A due date within this many hours from now counts as expiring soon. */
    @Min(1)
    @Max(168)
    private int expiringSoonHours = 24;

    /** Waybills without a due date are late once their goods issue date is older than this. */
    @Min(1)
    @Max(365)
    private int legacyCutoffDays = 7;

    private boolean checkOverdueDeliveries = true;

    private boolean checkExpiringSoon = true;

    private boolean checkLegacyWaybills = true;
}
