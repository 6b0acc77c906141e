package org.dubbl.runtime.model;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Running line score for one team.
 *
 * @param runs       Total runs.
 * @param hits       Total hits.
 * @param errors     Errors committed while fielding.
 * @param inningRuns Runs per inning number; sums to {@code runs}.
 */
public record TeamScore(int runs, int hits, int errors, SortedMap<Integer, Integer> inningRuns) {

    public static final TeamScore ZERO = new TeamScore(0, 0, 0, new TreeMap<>());

    public TeamScore {
        inningRuns = Collections.unmodifiableSortedMap(new TreeMap<>(inningRuns));
    }

    /**
     * Credits runs scored in an inning.
     */
    public TeamScore plusRuns(int inning, int scored) {
        SortedMap<Integer, Integer> next = new TreeMap<>(inningRuns);
        next.merge(inning, scored, Integer::sum);
        return new TeamScore(runs + scored, hits, errors, next);
    }

    public TeamScore plusHit() {
        return new TeamScore(runs, hits + 1, errors, inningRuns);
    }

    public TeamScore plusError() {
        return new TeamScore(runs, hits, errors + 1, inningRuns);
    }

    public int runsIn(int inning) {
        return inningRuns.getOrDefault(inning, 0);
    }
}
