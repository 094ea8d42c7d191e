package com.earningsbot.core;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregated per-item outcomes of one scan phase.
 */
public final class PhaseReport {
    private final String phase;
    private final List<ItemOutcome> outcomes = new ArrayList<>();
    private final Map<OutcomeStatus, Integer> counts = new EnumMap<>(OutcomeStatus.class);

    public PhaseReport(String phase) {
        this.phase = phase == null ? "" : phase;
        for (OutcomeStatus status : OutcomeStatus.values()) {
            counts.put(status, 0);
        }
    }

    public void add(ItemOutcome outcome) {
        if (outcome == null) {
            return;
        }
        outcomes.add(outcome);
        counts.merge(outcome.status(), 1, Integer::sum);
    }

    public String phase() {
        return phase;
    }

    public int newAlerts() {
        return count(OutcomeStatus.NEW_ALERT);
    }

    public int count(OutcomeStatus status) {
        return counts.getOrDefault(status, 0);
    }

    public int processed() {
        return outcomes.size();
    }

    public List<ItemOutcome> failures() {
        List<ItemOutcome> out = new ArrayList<>();
        for (ItemOutcome outcome : outcomes) {
            if (outcome.status().isFailure()) {
                out.add(outcome);
            }
        }
        return out;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("phase=").append(phase).append(", processed=").append(processed());
        for (OutcomeStatus status : OutcomeStatus.values()) {
            sb.append(", ").append(status.label()).append('=').append(count(status));
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
