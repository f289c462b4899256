package com.anomalywatch.investigator;

import com.anomalywatch.model.Waybill;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Waybill delivery rules.
 *
 * Pure: the outcome depends only on the waybill, the settings and the given instant.
 * Delivered waybills never violate a rule.
 *
 * RULES:
 * ======
 * - Overdue: dueDate < now
 * - Expiring soon: now <= dueDate <= now + expiringSoonHours
 * - Legacy overdue: no dueDate and goodsIssueDate < now - legacyCutoffDays
 */
public class WaybillDeliveryRules {

    private static final DateTimeFormatter DATE_TIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final WaybillRuleSettings settings;

    public WaybillDeliveryRules(WaybillRuleSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Waybill rule settings cannot be null");
        }
        this.settings = settings;
    }

    public Evaluation<Waybill, WaybillRule> evaluate(Waybill waybill, Instant now) {
        List<RuleViolation<WaybillRule>> violations = new ArrayList<>();
        if (waybill.isDelivered()) {
            return new Evaluation<>(waybill, violations);
        }
        Instant dueDate = waybill.getDueDate();

        if (settings.isCheckOverdueDeliveries() && isOverdue(waybill, now)) {
            Duration overdue = Duration.between(dueDate, now);
            violations.add(new RuleViolation<>(WaybillRule.OVERDUE,
                    String.format(Locale.ROOT, "Overdue delivery: %dd %dh past due date (%s)",
                            overdue.toDays(), overdue.toHoursPart(), DATE_TIME.format(dueDate))));
        }

        if (settings.isCheckExpiringSoon() && isExpiringSoon(waybill, now)) {
            double remainingHours = Duration.between(now, dueDate).toMinutes() / 60.0;
            violations.add(new RuleViolation<>(WaybillRule.EXPIRING_SOON,
                    String.format(Locale.ROOT, "Expiring soon: %.1fh remaining (threshold: %dh)",
                            remainingHours, settings.getExpiringSoonHours())));
        }

        if (settings.isCheckLegacyWaybills() && isLegacyOverdue(waybill, now)) {
            long daysSinceIssue = Duration.between(waybill.getGoodsIssueDate(), now).toDays();
            violations.add(new RuleViolation<>(WaybillRule.LEGACY_OVERDUE,
                    String.format(Locale.ROOT, "Legacy waybill overdue: %d days since goods issue (cutoff: %d days)",
                            daysSinceIssue, settings.getLegacyCutoffDays())));
        }

        return new Evaluation<>(waybill, violations);
    }

    public List<Evaluation<Waybill, WaybillRule>> evaluateAll(List<Waybill> waybills, Instant now) {
        return waybills.stream().map(waybill -> evaluate(waybill, now)).toList();
    }

    public RuleStatistics<WaybillRule> statistics(List<Evaluation<Waybill, WaybillRule>> evaluations) {
        return RuleStatistics.of(WaybillRule.class, evaluations);
    }

    /**
     * Most severe rule the waybill violates.
     */
    public static Optional<WaybillRule> primaryIssue(Evaluation<Waybill, WaybillRule> evaluation) {
        for (WaybillRule rule : WaybillRule.values()) {
            if (evaluation.violates(rule)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public WaybillRuleSettings getSettings() {
        return settings;
    }

    private boolean isOverdue(Waybill waybill, Instant now) {
        return waybill.getDueDate() != null && waybill.getDueDate().isBefore(now);
    }

    private boolean isExpiringSoon(Waybill waybill, Instant now) {
        Instant dueDate = waybill.getDueDate();
        if (dueDate == null) {
            return false;
        }
        Instant threshold = now.plus(Duration.ofHours(settings.getExpiringSoonHours()));
        return !dueDate.isBefore(now) && !dueDate.isAfter(threshold);
    }

    private boolean isLegacyOverdue(Waybill waybill, Instant now) {
        if (waybill.getDueDate() != null || waybill.getGoodsIssueDate() == null) {
            return false;
        }
        Instant cutoff = now.minus(Duration.ofDays(settings.getLegacyCutoffDays()));
        return waybill.getGoodsIssueDate().isBefore(cutoff);
    }
}
