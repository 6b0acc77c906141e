package org.dubbl.stats;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.dubbl.runtime.model.EventType;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.GameMode;
import org.dubbl.runtime.model.PlayerIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds event logs into per-player statistics.
 * <p>
 * Works on any slice of events: the game in progress, a calendar year or a
 * league. Aggregation is side-effect free and can run at any time.
 * <p>
 * <strong>Folding rules:</strong>
 * <ul>
 *   <li>Hits: at-bat, hit, hit-type count, total bases (1 to 4) and the event's RBI for the batter.</li>
 *   <li>Strikeouts: at-bat and strikeout for the batter. Caught-outs: at-bat for the batter, catch for the defender.</li>
 *   <li>Errors: error for the defender; no at-bat.</li>
 *   <li>Steals: attempt and win or loss for the runner (bases stolen and RBI on success);
 *       base defended for the defender, successful on a failed steal.</li>
 *   <li>Strikes: nothing beyond game participation of the batter.</li>
 * </ul>
 * <p>
 * <strong>Identity:</strong> records of the same person are merged on their
 * identity key, or on the lower-cased display name when they have none. Guests
 * are never merged and only appear when the scope is a single game.
 * <p>
 * Events pointing at unknown games, and credits for unknown players, are
 * skipped and reported as {@link UnresolvedReference}s.
 */
public class StatsAggregator {

    private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

    private final ZoneId zone;

    /**
     * @param zone Time zone used to find the calendar year of a game.
     */
    public StatsAggregator(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public StatsAggregator() {
        this(ZoneId.of("UTC"));
    }

    /**
     * Builds a player leaderboard and discards the skipped-reference report.
     */
    public List<PlayerStatsRow> leaderboard(List<GameEvent> events, List<GameRecord> games,
                                            PlayerDirectory players, StatScope scope, StatKey sortKey) {
        return aggregate(events, games, players, scope, sortKey).rows();
    }

    /**
     * Builds a player leaderboard.
     *
     * @param events  Events of any number of games, in log order per game.
     * @param games   Games the events belong to.
     * @param players Identities of the players referenced by the events.
     * @param scope   Which games to include.
     * @param sortKey Stat to sort by, descending.
     * @return Sorted rows and the references that were skipped.
     */
    public AggregationReport aggregate(List<GameEvent> events, List<GameRecord> games,
                                       PlayerDirectory players, StatScope scope, StatKey sortKey) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(sortKey, "sortKey");
        List<UnresolvedReference> unresolved = new ArrayList<>();
        List<GameEvent> scoped = filter(events, games, scope, unresolved);

        Map<String, PlayerTotals> totals = new LinkedHashMap<>();
        fold(scoped, new KeyResolver(players, scope, totals, unresolved));

        List<PlayerStatsRow> rows = new ArrayList<>(totals.size());
        for (PlayerTotals playerTotals : totals.values()) {
            rows.add(playerTotals.toRow());
        }
        rows.sort(Comparator.comparingDouble((PlayerStatsRow row) -> row.value(sortKey)).reversed());

        if (!unresolved.isEmpty()) {
            log.warn("Skipped {} unresolved references while aggregating {} events", unresolved.size(), events.size());
        }
        return new AggregationReport(rows, unresolved);
    }

    /**
     * Selects the events that belong to the scope. Events of unknown games are
     * dropped and reported.
     *
     * @param events     All candidate events.
     * @param games      Known games.
     * @param scope      The scope.
     * @param unresolved Receives a reference for every event of an unknown game.
     * @return Events in scope, in input order.
     */
    public List<GameEvent> filter(List<GameEvent> events, List<GameRecord> games, StatScope scope,
                                  List<UnresolvedReference> unresolved) {
        Map<String, GameRecord> lookup = new HashMap<>();
        for (GameRecord game : games) {
            lookup.put(game.id(), game);
        }
        Integer year = resolveYear(games, scope);

        List<GameEvent> scoped = new ArrayList<>();
        for (GameEvent event : events) {
            GameRecord game = lookup.get(event.gameId());
            if (game == null) {
                unresolved.add(new UnresolvedReference(event.id(), UnresolvedReference.Kind.GAME, event.gameId()));
                log.debug("Event {} references unknown game {}", event.id(), event.gameId());
                continue;
            }
            if (matches(game, scope, year)) {
                scoped.add(event);
            }
        }
        return scoped;
    }

    boolean matches(GameRecord game, StatScope scope, Integer year) {
        return switch (scope.kind()) {
            case OVERALL -> true;
            case GAME -> game.id().equals(scope.gameId());
            case YEAR -> year != null && yearOf(game) == year;
            case LEAGUE -> scope.leagueId() != null
                    ? scope.leagueId().equals(game.leagueId())
                    : game.mode() == GameMode.LEAGUE;
        };
    }

    int yearOf(GameRecord game) {
        return Instant.ofEpochMilli(game.startTime()).atZone(zone).getYear();
    }

    /**
     * Returns the year a scope selects; a year scope without a year selects the
     * latest year any known game started in.
     */
    Integer resolveYear(List<GameRecord> games, StatScope scope) {
        if (scope.kind() != StatScope.Kind.YEAR || scope.year() != null) {
            return scope.year();
        }
        Integer latest = null;
        for (GameRecord game : games) {
            int year = yearOf(game);
            if (latest == null || year > latest) {
                latest = year;
            }
        }
        return latest;
    }

    /**
     * Applies the folding rules to every event, crediting whatever accumulator
     * the resolver returns for a player id.
     */
    static void fold(List<GameEvent> events, TotalsResolver resolver) {
        for (GameEvent event : events) {
            fold(event, resolver);
        }
    }

    private static void fold(GameEvent event, TotalsResolver resolver) {
        Optional<PlayerTotals> batter = resolver.resolve(event, event.batterId());
        batter.ifPresent(totals -> totals.games.add(event.gameId()));

        switch (event.eventType()) {
            case SINGLE, DOUBLE, TRIPLE, HOMERUN -> batter.ifPresent(totals -> {
                totals.atBats++;
                totals.hits++;
                totals.totalBases += event.eventType().basesAdvanced();
                totals.rbi += event.rbi();
                switch (event.eventType()) {
                    case SINGLE -> totals.singles++;
                    case DOUBLE -> totals.doubles++;
                    case TRIPLE -> totals.triples++;
                    case HOMERUN -> totals.homeruns++;
                    default -> throw new IllegalStateException("Not a hit: " + event.eventType());
                }
            });
            case STRIKEOUT -> batter.ifPresent(totals -> {
                totals.atBats++;
                totals.strikeouts++;
            });
            case CAUGHT_OUT -> {
                batter.ifPresent(totals -> totals.atBats++);
                resolver.resolve(event, event.defenderId()).ifPresent(totals -> {
                    totals.games.add(event.gameId());
                    totals.catches++;
                });
            }
            case ERROR -> resolver.resolve(event, event.defenderId()).ifPresent(totals -> {
                totals.games.add(event.gameId());
                totals.errors++;
            });
            case STEAL_SUCCESS, STEAL_FAIL -> {
                boolean success = event.eventType() == EventType.STEAL_SUCCESS;
                resolver.resolve(event, event.runnerId()).ifPresent(totals -> {
                    totals.games.add(event.gameId());
                    totals.stealsAttempted++;
                    if (success) {
                        totals.stealsWon++;
                        totals.basesStolen++;
                        totals.rbi += event.rbi();
                    } else {
                        totals.stealsLost++;
                    }
                });
                resolver.resolve(event, event.defenderId()).ifPresent(totals -> {
                    totals.games.add(event.gameId());
                    totals.basesDefended++;
                    if (!success) {
                        totals.basesDefendedSuccessful++;
                    }
                });
            }
            case STRIKE -> {
                // counted only towards games played
            }
        }
    }

    /**
     * Picks the accumulator credited for a player id referenced by an event.
     */
    @FunctionalInterface
    interface TotalsResolver {
        Optional<PlayerTotals> resolve(GameEvent event, String playerId);
    }

    /**
     * Maps per-game player ids to merged leaderboard keys.
     */
    private static final class KeyResolver implements TotalsResolver {

        private final PlayerDirectory players;
        private final StatScope scope;
        private final Map<String, PlayerTotals> totals;
        private final List<UnresolvedReference> unresolved;

        KeyResolver(PlayerDirectory players, StatScope scope, Map<String, PlayerTotals> totals,
                    List<UnresolvedReference> unresolved) {
            this.players = players;
            this.scope = scope;
            this.totals = totals;
            this.unresolved = unresolved;
        }

        @Override
        public Optional<PlayerTotals> resolve(GameEvent event, String playerId) {
            if (playerId == null) {
                return Optional.empty();
            }
            Optional<PlayerIdentity> found = players.find(event.gameId(), playerId);
            if (found.isEmpty()) {
                unresolved.add(new UnresolvedReference(event.id(), UnresolvedReference.Kind.PLAYER, playerId));
                log.debug("Event {} references unknown player {}", event.id(), playerId);
                return Optional.empty();
            }
            PlayerIdentity identity = found.get();
            String key;
            if (identity.guest()) {
                if (scope.kind() != StatScope.Kind.GAME) {
                    return Optional.empty();
                }
                key = "guest:" + event.gameId() + ":" + identity.id();
            } else if (identity.identityKey() != null) {
                key = identity.identityKey();
            } else {
                key = identity.displayName().toLowerCase(Locale.ROOT);
            }
            return Optional.of(totals.computeIfAbsent(key, k -> new PlayerTotals(k, identity)));
        }
    }
}
