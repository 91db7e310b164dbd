package com.nationrank.engine.leaderboard;

import com.nationrank.engine.EngineSettings;
import com.nationrank.engine.aggregate.ModeAggregate;
import com.nationrank.engine.aggregate.NationAggregate;
import com.nationrank.engine.aggregate.PlayerContribution;
import com.nationrank.engine.confidence.ConfidenceCorrector;
import com.nationrank.engine.confidence.ConfidenceFactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Filters, ranks and decorates nation and player leaderboards.
 *
 * <p>Nation order: adjusted score desc, then total games desc, then country code asc.
 * Player order: rating desc, then decided games desc, then player id asc.
 * Top contributors are players with positive net wins only, so a nation may show fewer than three.
 * Ranks are always the contiguous sequence 1..N.
 */
public class LeaderboardBuilder {

    private static final Logger log = LoggerFactory.getLogger(LeaderboardBuilder.class);

    static final Comparator<NationScore> NATION_ORDER = Comparator
            .comparingDouble(NationScore::adjustedScore).reversed()
            .thenComparing(Comparator.comparingInt(NationScore::totalGames).reversed())
            .thenComparing(NationScore::countryCode);

    private final EngineSettings settings;
    private final ConfidenceCorrector corrector;

    public LeaderboardBuilder(EngineSettings settings, ConfidenceCorrector corrector) {
        this.settings = settings;
        this.corrector = corrector;
    }

    // ============ NATIONS ============

    public NationLeaderboard buildNationLeaderboard(ModeAggregate aggregate, ConfidenceFactor factor) {
        List<NationScore> unranked = new ArrayList<>();
        int belowGate = 0;

        for (NationAggregate nation : aggregate.getNations().values()) {
            if (!factor.admits(nation.totalGames())) {
                belowGate++;
                log.debug("Game mode {}: {} below activity gate ({} < {})", aggregate.getGameMode(),
                        nation.countryCode(), nation.totalGames(), factor.minimumGames());
                continue;
            }
            unranked.add(score(aggregate, nation, factor, 0));
        }

        unranked.sort(NATION_ORDER);

        List<NationScore> ranked = new ArrayList<>(unranked.size());
        for (int i = 0; i < unranked.size(); i++) {
            NationScore s = unranked.get(i);
            ranked.add(new NationScore(i + 1, s.countryCode(), s.gameMode(), s.wins(), s.losses(),
                    s.totalGames(), s.playerCount(), s.rawScore(), s.adjustedScore(),
                    s.uncorrectedScore(), s.topContributors()));
        }

        log.info("Game mode {}: ranked {} nations ({} below activity gate)",
                aggregate.getGameMode(), ranked.size(), belowGate);
        return new NationLeaderboard(aggregate.getGameMode(), aggregate.getWindow(), factor, ranked, belowGate);
    }

    public Optional<NationScoreExplanation> explain(ModeAggregate aggregate, ConfidenceFactor factor,
                                                    String countryCode) {
        Optional<NationAggregate> found = aggregate.nation(countryCode);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        NationAggregate nation = found.get();
        boolean qualified = factor.admits(nation.totalGames());
        Integer rank = null;
        if (qualified) {
            rank = buildNationLeaderboard(aggregate, factor)
                    .nation(countryCode)
                    .map(NationScore::rank)
                    .orElse(null);
        }
        List<Contributor> distribution = aggregate.playersOf(countryCode).stream()
                .map(Contributor::from)
                .collect(Collectors.toList());

        return Optional.of(new NationScoreExplanation(
                nation.countryCode(),
                nation.gameMode(),
                nation.wins(),
                nation.losses(),
                nation.totalGames(),
                nation.netWins(),
                corrector.adjustedScore(nation, factor),
                ConfidenceCorrector.uncorrectedScore(nation.wins(), nation.losses(), nation.totalGames()),
                factor.k(),
                factor.cf(),
                factor.minimumGames(),
                qualified,
                rank,
                distribution
        ));
    }

    private NationScore score(ModeAggregate aggregate, NationAggregate nation, ConfidenceFactor factor, int rank) {
        List<Contributor> top = aggregate.playersOf(nation.countryCode()).stream()
                .filter(p -> p.netWins() > 0)
                .limit(settings.getTopContributors())
                .map(Contributor::from)
                .collect(Collectors.toList());

        return new NationScore(
                rank,
                nation.countryCode(),
                nation.gameMode(),
                nation.wins(),
                nation.losses(),
                nation.totalGames(),
                nation.playerCount(),
                nation.netWins(),
                corrector.adjustedScore(nation, factor),
                ConfidenceCorrector.uncorrectedScore(nation.wins(), nation.losses(), nation.totalGames()),
                top
        );
    }

    // ============ PLAYERS ============

    /**
     * Player leaderboard without confidence correction.
     *
     * @param countryCode nation scope, or null for the global board
     */
    public PlayerLeaderboard buildPlayerLeaderboard(ModeAggregate aggregate, String countryCode) {
        List<PlayerContribution> qualified = aggregate.getPlayers().values().stream()
                .filter(p -> p.decidedGames() >= settings.getPlayerMinGames())
                .filter(p -> countryCode == null || countryCode.equals(p.countryCode()))
                .collect(Collectors.toList());

        ToDoubleFunction<PlayerContribution> rating = ratingFor(qualified);
        Map<String, Double> ratings = qualified.stream()
                .collect(Collectors.toMap(PlayerContribution::playerId, rating::applyAsDouble));

        Comparator<PlayerContribution> order = Comparator
                .comparingDouble((PlayerContribution p) -> ratings.get(p.playerId())).reversed()
                .thenComparing(Comparator.comparingInt(PlayerContribution::decidedGames).reversed())
                .thenComparing(PlayerContribution::playerId);

        List<PlayerContribution> sorted = qualified.stream().sorted(order).collect(Collectors.toList());

        List<PlayerStanding> standings = new ArrayList<>();
        int limit = Math.min(settings.getPlayerLeaderboardSize(), sorted.size());
        for (int i = 0; i < limit; i++) {
            PlayerContribution p = sorted.get(i);
            standings.add(new PlayerStanding(i + 1, p.playerId(), p.playerName(), p.countryCode(),
                    p.wins(), p.losses(), p.decidedGames(), p.winRate(), ratings.get(p.playerId())));
        }

        log.debug("Game mode {}{}: {} qualified players, showing {}", aggregate.getGameMode(),
                countryCode != null ? "/" + countryCode : "", qualified.size(), standings.size());
        return new PlayerLeaderboard(aggregate.getGameMode(), countryCode, standings, qualified.size());
    }

    /**
     * Skill minus uncertainty when every qualified player carries skill data,
     * otherwise {@code wins * 10 + winRate * 1000} for everyone on the board.
     */
    static ToDoubleFunction<PlayerContribution> ratingFor(List<PlayerContribution> players) {
        boolean skillBased = !players.isEmpty() && players.stream().allMatch(PlayerContribution::hasSkill);
        if (skillBased) {
            return p -> p.latestSkill() - p.latestUncertainty();
        }
        return p -> p.wins() * 10.0 + p.winRate() * 1000.0;
    }
}
