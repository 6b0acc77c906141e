package org.dubbl.stats;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.dubbl.fixtures.TestGames;
import org.dubbl.runtime.CompletedGame;
import org.dubbl.runtime.GameEngine;
import org.dubbl.runtime.model.EventType;
import org.dubbl.runtime.model.GameEvent;
import org.dubbl.runtime.model.GameSetup;
import org.dubbl.runtime.model.LineupSlot;
import org.dubbl.runtime.model.PlayerIdentity;
import org.dubbl.runtime.model.TeamSetup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * Two archived games: a 2026 friendly between Reds and Blues and a 2025 league
 * game in which Ana and Cai play under different per-game ids.
 */
@Tag("unit")
class StatsAggregatorTest {

    private final StatsAggregator aggregator = new StatsAggregator(ZoneId.of("UTC"));

    private CompletedGame friendly;
    private CompletedGame league;
    private List<GameEvent> events;
    private List<GameRecord> games;
    private PlayerDirectory players;

    @BeforeEach
    void playGames() {
        GameEngine a = TestGames.start(TestGames.friendly(), "gA", TestGames.JAN_2026);
        a.applyHit(EventType.SINGLE);        // Ana
        a.applyHit(EventType.HOMERUN);       // Ben, 2 RBI
        a.applyStrike();                     // Cai
        a.applyStrike();
        a.applyStrike();
        a.applyCaughtOut("b1");              // Ana caught by Cleo
        a.applyHit(EventType.DOUBLE);        // Ben
        a.applySteal("r2", "b3", false);     // Ben thrown out by Eli, side retired
        a.applyHit(EventType.SINGLE);        // Cleo
        a.applyHit(EventType.TRIPLE);        // Dev (guest) drives in Cleo
        a.applySteal("b2", "r1", true);      // Dev steals home
        a.applyError("r3");                  // Cai errs while Eli bats
        a.applyCaughtOut("r2");              // Eli
        a.applyCaughtOut("r2");              // Cleo
        a.applyCaughtOut("r2");              // Dev
        friendly = a.completeGame();

        GameSetup leagueSetup = GameSetup.league("spring",
                new TeamSetup("reds", "Reds", List.of(
                        PlayerIdentity.member("x1", "Ana B.", "m-17"),
                        PlayerIdentity.member("x2", "CAI", null))),
                new TeamSetup("greens", "Greens", List.of(PlayerIdentity.member("g1", "Gil", null))),
                3);
        GameEngine b = TestGames.start(leagueSetup, "gB", TestGames.JAN_2025);
        b.applyHit(EventType.HOMERUN);       // Ana as x1
        b.applyHit(EventType.SINGLE);        // Cai as x2
        league = b.completeGame();

        events = new ArrayList<>(friendly.events());
        events.addAll(league.events());
        games = List.of(GameRecord.of(friendly), GameRecord.of(league));
        players = PlayerDirectory.of(identities(friendly, league));
    }

    private static List<GamePlayer> identities(CompletedGame... completed) {
        List<GamePlayer> all = new ArrayList<>();
        for (CompletedGame game : completed) {
            for (String teamId : game.finalState().teamOrder()) {
                for (LineupSlot slot : game.finalState().lineups().get(teamId).slots()) {
                    all.add(new GamePlayer(game.gameId(), slot.player()));
                }
            }
        }
        return all;
    }

    private static Optional<PlayerStatsRow> row(List<PlayerStatsRow> rows, String displayName) {
        return rows.stream().filter(r -> r.displayName().equals(displayName)).findFirst();
    }

    @Test
    void foldsBattingForTheGame() {
        List<PlayerStatsRow> rows = aggregator.leaderboard(events, games, players, StatScope.game("gA"), StatKey.HITS);

        PlayerStatsRow ben = row(rows, "Ben").orElseThrow();
        assertThat(ben.atBats()).isEqualTo(2);
        assertThat(ben.hits()).isEqualTo(2);
        assertThat(ben.homeruns()).isEqualTo(1);
        assertThat(ben.doubles()).isEqualTo(1);
        assertThat(ben.totalBases()).isEqualTo(6);
        assertThat(ben.rbi()).isEqualTo(2);
        assertThat(ben.battingAverage()).isEqualTo(1.0);
        assertThat(ben.slugging()).isEqualTo(3.0);
        assertThat(ben.catches()).isEqualTo(3);
        assertThat(ben.stealsAttempted()).isEqualTo(1);
        assertThat(ben.stealsLost()).isEqualTo(1);
        assertThat(ben.stealSuccessRate()).isZero();

        PlayerStatsRow cai = row(rows, "Cai").orElseThrow();
        assertThat(cai.atBats()).isEqualTo(1);
        assertThat(cai.strikeouts()).isEqualTo(1);
        assertThat(cai.errors()).isEqualTo(1);
        assertThat(cai.battingAverage()).isZero();
    }

    @Test
    void stealsCreditRunnerAndDefender() {
        List<PlayerStatsRow> rows = aggregator.leaderboard(events, games, players, StatScope.game("gA"), StatKey.RBI);

        PlayerStatsRow dev = row(rows, "Dev").orElseThrow();
        assertThat(dev.guest()).isTrue();
        assertThat(dev.stealsWon()).isEqualTo(1);
        assertThat(dev.basesStolen()).isEqualTo(1);
        assertThat(dev.stealSuccessRate()).isEqualTo(1.0);
        assertThat(dev.rbi()).isEqualTo(2);
        assertThat(dev.atBats()).isEqualTo(2);

        PlayerStatsRow eli = row(rows, "Eli").orElseThrow();
        assertThat(eli.basesDefended()).isEqualTo(1);
        assertThat(eli.basesDefendedSuccessful()).isEqualTo(1);
        assertThat(eli.atBats()).isEqualTo(1);

        PlayerStatsRow ana = row(rows, "Ana").orElseThrow();
        assertThat(ana.basesDefended()).isEqualTo(1);
        assertThat(ana.basesDefendedSuccessful()).isZero();
    }

    @Test
    void errorsDoNotCountAsAtBats() {
        List<PlayerStatsRow> rows = aggregator.leaderboard(events, games, players, StatScope.game("gA"), StatKey.HITS);

        // Eli batted during the error and was then caught: one at-bat only.
        assertThat(row(rows, "Eli").orElseThrow().atBats()).isEqualTo(1);
    }

    @Test
    void mergesTheSamePersonAcrossGames() {
        List<PlayerStatsRow> rows = aggregator.leaderboard(events, games, players, StatScope.overall(), StatKey.HITS);

        PlayerStatsRow ana = rows.stream().filter(r -> "m-17".equals(r.playerKey())).findFirst().orElseThrow();
        assertThat(ana.gamesPlayed()).isEqualTo(2);
        assertThat(ana.atBats()).isEqualTo(3);
        assertThat(ana.hits()).isEqualTo(2);
        assertThat(ana.homeruns()).isEqualTo(1);
        assertThat(ana.totalBases()).isEqualTo(5);

        PlayerStatsRow cai = rows.stream().filter(r -> "cai".equals(r.playerKey())).findFirst().orElseThrow();
        assertThat(cai.gamesPlayed()).isEqualTo(2);
        assertThat(cai.atBats()).isEqualTo(2);
        assertThat(cai.hits()).isEqualTo(1);
    }

    @Test
    void guestsOnlyAppearInTheirGame() {
        List<PlayerStatsRow> overall = aggregator.leaderboard(events, games, players, StatScope.overall(), StatKey.HITS);
        List<PlayerStatsRow> game = aggregator.leaderboard(events, games, players, StatScope.game("gA"), StatKey.HITS);

        assertThat(overall).noneMatch(PlayerStatsRow::guest);
        assertThat(game).anyMatch(r -> r.playerKey().equals("guest:gA:b2"));
    }

    @Test
    void yearScopeUsesTheGameStartYear() {
        List<PlayerStatsRow> y2025 = aggregator.leaderboard(events, games, players, StatScope.year(2025), StatKey.HITS);
        List<PlayerStatsRow> latest = aggregator.leaderboard(events, games, players, StatScope.latestYear(), StatKey.HITS);

        assertThat(y2025).extracting(PlayerStatsRow::displayName).containsExactlyInAnyOrder("Ana B.", "CAI");
        assertThat(latest).extracting(PlayerStatsRow::displayName).contains("Ben", "Cleo").doesNotContain("Ana B.");
    }

    @Test
    void leagueScopeSelectsLeagueGames() {
        List<PlayerStatsRow> anyLeague = aggregator.leaderboard(events, games, players, StatScope.league(null),
                StatKey.HITS);
        List<PlayerStatsRow> otherLeague = aggregator.leaderboard(events, games, players, StatScope.league("autumn"),
                StatKey.HITS);

        assertThat(anyLeague).hasSize(2);
        assertThat(otherLeague).isEmpty();
    }

    @Test
    void unresolvedReferencesAreSkippedAndReported() {
        List<GameEvent> withOrphan = new ArrayList<>(events);
        GameEvent template = friendly.events().get(0);
        withOrphan.add(new GameEvent("orphan", "ghost", EventType.SINGLE, 1, template.half(), "r1", null, null,
                template.baseStateBefore(), template.baseStateAfter(), 0, 0, 0L, null));
        List<GamePlayer> withoutEli = new ArrayList<>(identities(friendly, league));
        withoutEli.removeIf(p -> p.identity().id().equals("b3"));

        AggregationReport report = aggregator.aggregate(withOrphan, games, PlayerDirectory.of(withoutEli),
                StatScope.overall(), StatKey.HITS);

        assertThat(report.unresolved())
                .anyMatch(u -> u.kind() == UnresolvedReference.Kind.GAME && u.reference().equals("ghost"))
                .anyMatch(u -> u.kind() == UnresolvedReference.Kind.PLAYER && u.reference().equals("b3"));
        assertThat(report.rows()).noneMatch(r -> r.displayName().equals("Eli"));
        assertThat(report.rows()).isNotEmpty();
    }

    @Test
    void reusedPlayerIdsStayWithTheirOwnGame() {
        GameSetup rematch = GameSetup.friendly(
                new TeamSetup("reds", "Reds", List.of(
                        PlayerIdentity.member("r1", "Zoe", "m-99"),
                        PlayerIdentity.guest("r2", "Ben"))),
                TestGames.blues(), 3);
        GameEngine c = TestGames.start(rematch, "gC", TestGames.JAN_2026 + 86_400_000L);
        c.applyStrike();                     // Zoe as r1
        c.applyStrike();
        c.applyStrike();
        c.applyHit(EventType.TRIPLE);        // guest as r2
        CompletedGame third = c.completeGame();

        List<GameEvent> all = new ArrayList<>(events);
        all.addAll(third.events());
        List<GameRecord> allGames = List.of(GameRecord.of(friendly), GameRecord.of(league), GameRecord.of(third));
        PlayerDirectory directory = PlayerDirectory.of(identities(friendly, league, third));

        List<PlayerStatsRow> rows = aggregator.leaderboard(all, allGames, directory, StatScope.overall(),
                StatKey.HITS);

        PlayerStatsRow zoe = row(rows, "Zoe").orElseThrow();
        assertThat(zoe.gamesPlayed()).isEqualTo(1);
        assertThat(zoe.atBats()).isEqualTo(1);
        assertThat(zoe.strikeouts()).isEqualTo(1);
        assertThat(zoe.homeruns()).isZero();

        // Ana still owns her friendly and league games under r1 and x1.
        PlayerStatsRow ana = rows.stream().filter(r -> "m-17".equals(r.playerKey())).findFirst().orElseThrow();
        assertThat(ana.gamesPlayed()).isEqualTo(2);
        assertThat(ana.strikeouts()).isZero();

        // The guest reusing r2 neither takes over nor hides Ben's member stats.
        PlayerStatsRow ben = row(rows, "Ben").orElseThrow();
        assertThat(ben.gamesPlayed()).isEqualTo(1);
        assertThat(ben.triples()).isZero();
        assertThat(ben.homeruns()).isEqualTo(1);
    }

    @Test
    void rowsAreSortedDescendingAndRatesAreBounded() {
        List<PlayerStatsRow> rows = aggregator.leaderboard(events, games, players, StatScope.overall(),
                StatKey.SLUGGING);

        assertThat(rows.get(0).displayName()).isEqualTo("Ben");
        assertThat(rows).extracting(PlayerStatsRow::slugging).isSortedAccordingTo((x, y) -> Double.compare(y, x));
        assertThat(rows).allSatisfy(r -> {
            assertThat(r.battingAverage()).isBetween(0.0, 1.0);
            assertThat(r.slugging()).isBetween(0.0, 4.0);
            if (r.atBats() == 0) {
                assertThat(r.battingAverage()).isZero();
                assertThat(r.slugging()).isZero();
            }
        });
    }

    @Test
    void aggregatesAGameInProgress() {
        GameEngine live = TestGames.start("live");
        live.applyHit(EventType.DOUBLE);
        GameRecord record = GameRecord.of(live.state(), live.startedAt());

        List<PlayerStatsRow> rows = aggregator.leaderboard(live.events(), List.of(record),
                PlayerDirectory.of(live.state()), StatScope.game("live"), StatKey.TOTAL_BASES);

        assertThat(rows).singleElement().satisfies(r -> {
            assertThat(r.displayName()).isEqualTo("Ana");
            assertThat(r.totalBases()).isEqualTo(2);
        });
        assertThat(record.complete()).isFalse();
    }
}
