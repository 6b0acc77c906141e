package org.dubbl.stats;

import java.util.List;

/**
 * Leaderboard rows together with the references skipped while building them.
 *
 * @param rows       Rows sorted by the requested key, descending.
 * @param unresolved Skipped references, in event order.
 */
public record AggregationReport(List<PlayerStatsRow> rows, List<UnresolvedReference> unresolved) {

    public AggregationReport {
        rows = List.copyOf(rows);
        unresolved = List.copyOf(unresolved);
    }
}
