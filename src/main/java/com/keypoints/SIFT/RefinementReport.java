package com.keypoints.SIFT;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Getter
public class RefinementReport {
    private final List<RefinedKeypoint> keypoints;
    private final Map<RefinementState, Integer> stateCounts;

    public RefinementReport(List<RefinedKeypoint> keypoints, Map<RefinementState, Integer> stateCounts) {
        this.keypoints = Collections.unmodifiableList(keypoints);
        EnumMap<RefinementState, Integer> counts = new EnumMap<>(RefinementState.class);
        for (RefinementState state : RefinementState.values()) {
            counts.put(state, stateCounts.getOrDefault(state, 0));
        }
        this.stateCounts = Collections.unmodifiableMap(counts);
    }

    public int count(RefinementState state) {
        return stateCounts.get(state);
    }

    public int totalCandidates() {
        int total = 0;
        for (int c : stateCounts.values()) total += c;
        return total;
    }
}
