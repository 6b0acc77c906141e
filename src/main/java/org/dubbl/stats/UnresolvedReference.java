package org.dubbl.stats;

/**
 * An event reference that could not be resolved during aggregation. The
 * affected event (or credit) is skipped instead of failing the whole run.
 *
 * @param eventId   Event carrying the reference.
 * @param kind      What kind of record was missing.
 * @param reference The id that could not be found.
 */
public record UnresolvedReference(String eventId, Kind kind, String reference) {

    public enum Kind {
        GAME,
        PLAYER
    }
}
