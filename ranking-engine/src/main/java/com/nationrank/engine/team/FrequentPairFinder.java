package com.nationrank.engine.team;

import com.nationrank.engine.graph.CoOccurrenceGraph;
import com.nationrank.engine.graph.PairStats;
import com.nationrank.engine.graph.PlayerPair;
import com.nationrank.engine.graph.PlayerPairEdge;
import com.nationrank.engine.graph.SoloRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Reports every pair that played together at least {@code minWeight} times, with synergy.
 * Order: weight desc, synergy desc, pair key asc.
 */
public class FrequentPairFinder {

    static final Comparator<PlayerPairEdge> ORDER = Comparator
            .comparingInt(PlayerPairEdge::weight).reversed()
            .thenComparing(Comparator.comparingDouble(PlayerPairEdge::synergy).reversed())
            .thenComparing(PlayerPairEdge::pairKey);

    private final int minWeight;

    public FrequentPairFinder(int minWeight) {
        this.minWeight = minWeight;
    }

    public List<PlayerPairEdge> find(CoOccurrenceGraph graph) {
        List<PlayerPairEdge> pairs = new ArrayList<>();
        for (Map.Entry<PlayerPair, PairStats> entry : graph.edges().entrySet()) {
            PairStats stats = entry.getValue();
            if (stats.weight() < minWeight) {
                continue;
            }
            PlayerPair pair = entry.getKey();
            double rateA = graph.soloRecord(pair.first()).map(SoloRecord::winRate).orElse(0.0);
            double rateB = graph.soloRecord(pair.second()).map(SoloRecord::winRate).orElse(0.0);
            pairs.add(new PlayerPairEdge(
                    pair.first(), graph.nameOf(pair.first()),
                    pair.second(), graph.nameOf(pair.second()),
                    stats.weight(), stats.jointWins(), stats.jointLosses(), stats.jointWinRate(),
                    rateA, rateB,
                    PlayerPairEdge.synergyOf(stats.jointWinRate(), rateA, rateB)));
        }
        pairs.sort(ORDER);
        return pairs;
    }
}
