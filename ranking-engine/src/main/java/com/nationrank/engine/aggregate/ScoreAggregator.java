package com.nationrank.engine.aggregate;

import com.nationrank.engine.model.MatchRecord;
import com.nationrank.engine.model.MatchSnapshot;
import com.nationrank.engine.model.PlayerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Tallies wins and losses per nation and per player for one game mode.
 *
 * <p>Every run recomputes from the snapshot; nothing carries over between runs.
 */
public class ScoreAggregator {

    private static final Logger log = LoggerFactory.getLogger(ScoreAggregator.class);

    private final NationCodePolicy nationCodes;

    public ScoreAggregator(NationCodePolicy nationCodes) {
        this.nationCodes = nationCodes;
    }

    public ModeAggregate aggregate(MatchSnapshot snapshot, String gameMode) {
        List<MatchRecord> matches = snapshot.forGameMode(gameMode);

        Map<String, NationTally> nationTallies = new TreeMap<>();
        Map<String, PlayerTally> playerTallies = new TreeMap<>();
        int unresolvedRows = 0;

        for (MatchRecord match : matches) {
            for (PlayerResult result : match.players()) {
                PlayerTally player = playerTallies.computeIfAbsent(result.playerId(), id -> new PlayerTally(result));
                player.record(result, match.startTime());

                Optional<String> nation = nationCodes.resolve(result.countryCode());
                if (nation.isEmpty()) {
                    unresolvedRows++;
                    continue;
                }
                player.countryCode = nation.get();
                if (result.outcome().isDecided()) {
                    nationTallies.computeIfAbsent(nation.get(), NationTally::new).record(result);
                }
            }
        }

        if (unresolvedRows > 0) {
            log.debug("Game mode {}: {} player rows without a resolvable nation", gameMode, unresolvedRows);
        }

        Map<String, NationAggregate> nations = new TreeMap<>();
        nationTallies.forEach((code, tally) -> nations.put(code, tally.toAggregate(gameMode)));

        Map<String, PlayerContribution> players = new TreeMap<>();
        playerTallies.forEach((id, tally) -> players.put(id, tally.toContribution(gameMode)));

        log.debug("Game mode {}: aggregated {} matches into {} nations and {} players",
                gameMode, matches.size(), nations.size(), players.size());

        return new ModeAggregate(gameMode, snapshot.getWindow(), matches.size(),
                Collections.unmodifiableMap(nations), Collections.unmodifiableMap(players));
    }

    private static final class NationTally {
        private final String code;
        private final Set<String> players = new HashSet<>();
        private int wins;
        private int losses;

        private NationTally(String code) {
            this.code = code;
        }

        private void record(PlayerResult result) {
            players.add(result.playerId());
            if (result.isWin()) {
                wins++;
            } else {
                losses++;
            }
        }

        private NationAggregate toAggregate(String gameMode) {
            return new NationAggregate(code, gameMode, wins, losses, players.size());
        }
    }

    private static final class PlayerTally {
        private final String playerId;
        private String playerName;
        private String countryCode;
        private int wins;
        private int losses;
        private int draws;
        private Instant lastPlayed;
        private Double latestSkill;
        private Double latestUncertainty;

        private PlayerTally(PlayerResult first) {
            this.playerId = first.playerId();
            this.playerName = first.playerName();
        }

        // matches arrive in chronological order, so later values overwrite earlier ones
        private void record(PlayerResult result, Instant startTime) {
            switch (result.outcome()) {
                case WIN -> wins++;
                case LOSS -> losses++;
                case DRAW -> draws++;
            }
            if (result.playerName() != null) {
                playerName = result.playerName();
            }
            lastPlayed = startTime;
            if (result.hasSkill()) {
                latestSkill = result.skill();
                latestUncertainty = result.skillUncertainty();
            }
        }

        private PlayerContribution toContribution(String gameMode) {
            return new PlayerContribution(playerId, playerName, countryCode, gameMode,
                    wins, losses, draws, lastPlayed, latestSkill, latestUncertainty);
        }
    }
}
