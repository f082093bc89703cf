package io.hivemesh.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What an agent submits when voting: a single choice, a full ranking, or a token
 * allocation for quadratic sessions.
 */
public record Ballot(
        String choice,
        List<String> rankings,
        Map<String, Double> allocation,
        Double confidence,
        Integer agentLevel
) {
    /**
     * Rankings and allocation are copied so the caller cannot change a cast ballot
     * afterwards. Null entries survive the copy and are left to ballot validation.
     */
    public Ballot {
        rankings = rankings == null ? null : Collections.unmodifiableList(new ArrayList<>(rankings));
        allocation = allocation == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(allocation));
    }

    public static Ballot choice(String choice, double confidence, int agentLevel) {
        return new Ballot(choice, null, null, confidence, agentLevel);
    }

    public static Ballot ranked(List<String> rankings, double confidence, int agentLevel) {
        return new Ballot(null, rankings, null, confidence, agentLevel);
    }

    public static Ballot allocation(Map<String, Double> allocation, double confidence, int agentLevel) {
        return new Ballot(null, null, allocation, confidence, agentLevel);
    }

    public double effectiveConfidence() {
        return confidence == null ? 1.0 : confidence;
    }

    public int effectiveLevel() {
        return agentLevel == null ? 0 : agentLevel;
    }

    /**
     * First preference: the explicit choice, or the head of the ranking.
     */
    public String primaryChoice() {
        if (choice != null) {
            return choice;
        }
        if (rankings != null && !rankings.isEmpty()) {
            return rankings.get(0);
        }
        return null;
    }

    public List<String> preferenceOrder() {
        if (rankings != null && !rankings.isEmpty()) {
            return rankings;
        }
        return choice == null ? List.of() : List.of(choice);
    }
}
