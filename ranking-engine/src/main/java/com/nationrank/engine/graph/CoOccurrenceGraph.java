package com.nationrank.engine.graph;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Undirected weighted graph of players who shared a team side.
 *
 * <p>Immutable. Nodes are exactly the endpoints of the edges, so isolated players
 * never appear. Iteration order of nodes and edges is the natural id order.
 */
public final class CoOccurrenceGraph {

    private final Map<PlayerPair, PairStats> edges;
    private final Map<String, Set<String>> adjacency;
    private final Map<String, SoloRecord> soloRecords;

    CoOccurrenceGraph(Map<PlayerPair, PairStats> edges, Map<String, SoloRecord> soloRecords) {
        this.edges = Collections.unmodifiableMap(new TreeMap<>(edges));
        this.soloRecords = Collections.unmodifiableMap(new TreeMap<>(soloRecords));

        Map<String, Set<String>> adj = new TreeMap<>();
        for (PlayerPair pair : this.edges.keySet()) {
            adj.computeIfAbsent(pair.first(), id -> new TreeSet<>()).add(pair.second());
            adj.computeIfAbsent(pair.second(), id -> new TreeSet<>()).add(pair.first());
        }
        adj.replaceAll((id, neighbours) -> Collections.unmodifiableSet(neighbours));
        this.adjacency = Collections.unmodifiableMap(adj);
    }

    public static CoOccurrenceGraph empty() {
        return new CoOccurrenceGraph(Map.of(), Map.of());
    }

    public Set<String> nodes() {
        return adjacency.keySet();
    }

    public int nodeCount() {
        return adjacency.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Map<PlayerPair, PairStats> edges() {
        return edges;
    }

    public int weight(String a, String b) {
        if (a.equals(b)) {
            return 0;
        }
        return stats(PlayerPair.of(a, b)).weight();
    }

    public PairStats stats(PlayerPair pair) {
        return edges.getOrDefault(pair, PairStats.NONE);
    }

    public Set<String> neighbours(String playerId) {
        return adjacency.getOrDefault(playerId, Set.of());
    }

    public Optional<SoloRecord> soloRecord(String playerId) {
        return Optional.ofNullable(soloRecords.get(playerId));
    }

    /**
     * Display name of a player, {@code Player_<id>} when the window never named them.
     */
    public String nameOf(String playerId) {
        SoloRecord record = soloRecords.get(playerId);
        return record != null && record.playerName() != null ? record.playerName() : "Player_" + playerId;
    }

    /**
     * Copy without the edges lighter than {@code minWeight}; nodes left without edges drop out.
     */
    public CoOccurrenceGraph withMinimumWeight(int minWeight) {
        Map<PlayerPair, PairStats> kept = new TreeMap<>();
        edges.forEach((pair, stats) -> {
            if (stats.weight() >= minWeight) {
                kept.put(pair, stats);
            }
        });
        return new CoOccurrenceGraph(kept, soloRecords);
    }

    /**
     * Edges whose both endpoints are in {@code members}.
     */
    public List<PairStats> edgesWithin(Set<String> members) {
        return edges.entrySet().stream()
                .filter(e -> members.contains(e.getKey().first()) && members.contains(e.getKey().second()))
                .map(Map.Entry::getValue)
                .collect(Collectors.toList());
    }
}
