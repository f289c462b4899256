package com.anomalywatch.investigator;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate counts over a batch of evaluations.
 *
 * A record violating several rules counts once in anomalous and once per rule
 * in ruleCounts.
 */
public final class RuleStatistics<R extends Enum<R>> {

    private final int total;
    private final int anomalous;
    private final Map<R, Integer> ruleCounts;

    private RuleStatistics(int total, int anomalous, Map<R, Integer> ruleCounts) {
        this.total = total;
        this.anomalous = anomalous;
        this.ruleCounts = ruleCounts;
    }

    public static <E, R extends Enum<R>> RuleStatistics<R> of(Class<R> ruleType, Collection<Evaluation<E, R>> evaluations) {
        Map<R, Integer> counts = new EnumMap<>(ruleType);
        for (R rule : ruleType.getEnumConstants()) {
            counts.put(rule, 0);
        }
        int anomalous = 0;
        for (Evaluation<E, R> evaluation : evaluations) {
            if (!evaluation.isAnomaly()) {
                continue;
            }
            anomalous++;
            for (RuleViolation<R> violation : evaluation.violations()) {
                counts.merge(violation.rule(), 1, Integer::sum);
            }
        }
        return new RuleStatistics<>(evaluations.size(), anomalous, counts);
    }

    public int getTotal() {
        return total;
    }

    public int getAnomalous() {
        return anomalous;
    }

    public int count(R rule) {
        return ruleCounts.getOrDefault(rule, 0);
    }

    public Map<R, Integer> getRuleCounts() {
        return Map.copyOf(ruleCounts);
    }

    /**
     * Percentage of anomalous records, 0 when nothing was evaluated.
     */
    public double getAnomalyRate() {
        return total > 0 ? (double) anomalous / total * 100 : 0;
    }
}
