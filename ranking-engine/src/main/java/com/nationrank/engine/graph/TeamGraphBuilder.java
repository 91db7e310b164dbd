package com.nationrank.engine.graph;

import com.nationrank.engine.model.MatchRecord;
import com.nationrank.engine.model.PlayerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the player co-occurrence graph from match rosters.
 *
 * <p>An edge gains one unit of weight per match in which both players fought on the
 * same side. With {@code partyOnly} set, only teammates who also queued in the same
 * party count.
 */
public class TeamGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(TeamGraphBuilder.class);

    private final boolean partyOnly;

    public TeamGraphBuilder(boolean partyOnly) {
        this.partyOnly = partyOnly;
    }

    public CoOccurrenceGraph build(Collection<MatchRecord> matches) {
        Map<PlayerPair, PairStats> edges = new HashMap<>();
        Map<String, SoloTally> solo = new HashMap<>();

        for (MatchRecord match : matches) {
            Map<String, PlayerResult> roster = distinctPlayers(match);
            for (PlayerResult result : roster.values()) {
                solo.computeIfAbsent(result.playerId(), SoloTally::new).record(result);
            }
            for (List<PlayerResult> side : sides(roster.values())) {
                addSide(side, edges);
            }
        }

        Map<String, SoloRecord> soloRecords = new HashMap<>();
        solo.forEach((id, tally) -> soloRecords.put(id, tally.toRecord()));

        CoOccurrenceGraph graph = new CoOccurrenceGraph(edges, soloRecords);
        log.info("Co-occurrence graph built from {} matches: {} players, {} connections{}",
                matches.size(), graph.nodeCount(), graph.edgeCount(), partyOnly ? " (party only)" : "");
        return graph;
    }

    // a player listed twice in one match only counts once
    private static Map<String, PlayerResult> distinctPlayers(MatchRecord match) {
        Map<String, PlayerResult> roster = new LinkedHashMap<>();
        for (PlayerResult result : match.players()) {
            roster.putIfAbsent(result.playerId(), result);
        }
        return roster;
    }

    private List<List<PlayerResult>> sides(Collection<PlayerResult> roster) {
        Map<String, List<PlayerResult>> groups = new LinkedHashMap<>();
        for (PlayerResult result : roster) {
            String key;
            if (partyOnly) {
                if (!result.hasParty()) {
                    continue;
                }
                key = result.teamSide() + "/" + result.partyId();
            } else {
                key = String.valueOf(result.teamSide());
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(result);
        }
        return new ArrayList<>(groups.values());
    }

    private static void addSide(List<PlayerResult> side, Map<PlayerPair, PairStats> edges) {
        for (int i = 0; i < side.size(); i++) {
            for (int j = i + 1; j < side.size(); j++) {
                PlayerResult a = side.get(i);
                PlayerResult b = side.get(j);
                int win = a.isWin() && b.isWin() ? 1 : 0;
                int loss = a.isLoss() && b.isLoss() ? 1 : 0;
                edges.merge(PlayerPair.of(a.playerId(), b.playerId()), new PairStats(1, win, loss), PairStats::plus);
            }
        }
    }

    private static final class SoloTally {
        private final String playerId;
        private String playerName;
        private int wins;
        private int losses;

        private SoloTally(String playerId) {
            this.playerId = playerId;
        }

        private void record(PlayerResult result) {
            if (result.isWin()) wins++;
            if (result.isLoss()) losses++;
            playerName = Objects.requireNonNullElse(result.playerName(), playerName);
        }

        private SoloRecord toRecord() {
            return new SoloRecord(playerId, playerName, wins, losses);
        }
    }
}
