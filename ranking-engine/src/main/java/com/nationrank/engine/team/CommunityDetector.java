package com.nationrank.engine.team;

import com.nationrank.engine.EngineSettings;
import com.nationrank.engine.graph.CoOccurrenceGraph;
import com.nationrank.engine.graph.PairStats;
import com.nationrank.engine.model.MatchRecord;
import com.nationrank.engine.model.PlayerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Partitions the co-occurrence graph into communities by threshold connected components.
 *
 * <ol>
 *   <li>drop every edge lighter than {@code communityMinEdgeWeight};</li>
 *   <li>take connected components, visiting start nodes in ascending id order;</li>
 *   <li>optionally drop members who are not cohesive with the rest (see {@link #cohesive});</li>
 *   <li>keep components of {@code minRosterSize..communityMaxSize} members.</li>
 * </ol>
 */
public class CommunityDetector {

    private static final Logger log = LoggerFactory.getLogger(CommunityDetector.class);

    private final EngineSettings settings;

    public CommunityDetector(EngineSettings settings) {
        this.settings = settings;
    }

    /**
     * All qualifying communities, most matches first.
     */
    public List<CommunityCluster> detect(Collection<MatchRecord> matches, CoOccurrenceGraph graph) {
        CoOccurrenceGraph strong = graph.withMinimumWeight(settings.getCommunityMinEdgeWeight());
        List<Set<String>> components = components(strong);

        List<CommunityCluster> clusters = new ArrayList<>();
        int rejectedBySize = 0;
        int rejectedByMatches = 0;
        for (Set<String> component : components) {
            Set<String> members = cohesive(component, graph);
            if (members.size() < settings.getMinRosterSize() || members.size() > settings.getCommunityMaxSize()) {
                rejectedBySize++;
                continue;
            }
            CommunityCluster cluster = toCluster(members, matches, strong);
            if (cluster.statsOverall().matches() < settings.getMinTeamMatches()) {
                rejectedByMatches++;
                continue;
            }
            clusters.add(cluster);
        }

        clusters.sort(Comparator.comparingInt((CommunityCluster c) -> c.statsOverall().matches()).reversed()
                .thenComparing(Comparator.comparingInt(CommunityCluster::size).reversed())
                .thenComparing(CommunityCluster::teamId));

        log.info("Community detection: {} components at weight >= {}, {} communities ({} rejected by size, {} by matches)",
                components.size(), settings.getCommunityMinEdgeWeight(), clusters.size(),
                rejectedBySize, rejectedByMatches);
        return clusters;
    }

    static List<Set<String>> components(CoOccurrenceGraph graph) {
        List<Set<String>> components = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String start : graph.nodes()) {
            if (!visited.add(start)) {
                continue;
            }
            Set<String> component = new TreeSet<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(start);
            while (!queue.isEmpty()) {
                String node = queue.poll();
                component.add(node);
                for (String next : graph.neighbours(node)) {
                    if (visited.add(next)) {
                        queue.add(next);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    /**
     * Keeps members who played at least {@code cohesionMinGames} same-side games with at least
     * {@code max(1, floor(size * cohesionMinFraction))} other members. A fraction of 0 disables
     * the filter.
     */
    Set<String> cohesive(Set<String> component, CoOccurrenceGraph graph) {
        double fraction = settings.getCohesionMinFraction();
        if (fraction <= 0.0 || component.size() < 2) {
            return component;
        }
        int required = Math.max(1, (int) (component.size() * fraction));
        Set<String> kept = new TreeSet<>();
        for (String player : component) {
            long partners = component.stream()
                    .filter(other -> !other.equals(player))
                    .filter(other -> graph.weight(player, other) >= settings.getCohesionMinGames())
                    .count();
            if (partners >= required) {
                kept.add(player);
            }
        }
        if (kept.size() < component.size()) {
            log.debug("Cohesion filter reduced a community from {} to {} members", component.size(), kept.size());
        }
        return kept;
    }

    private CommunityCluster toCluster(Set<String> members, Collection<MatchRecord> matches, CoOccurrenceGraph graph) {
        List<PairStats> edges = graph.edgesWithin(members);
        long possible = (long) members.size() * (members.size() - 1) / 2;
        double density = possible > 0 ? (double) edges.size() / possible : 0.0;
        double avgStrength = edges.isEmpty() ? 0.0
                : edges.stream().mapToInt(PairStats::weight).average().orElse(0.0);

        List<TeamAppearance> appearances = appearances(members, matches);
        List<TeamMember> roster = TeamProfile.members(members, appearances, graph::nameOf);

        return new CommunityCluster(
                String.join("+", members),
                TeamProfile.squadName(roster),
                roster,
                edges.size(),
                density,
                avgStrength,
                TeamStats.of(appearances),
                TeamProfile.statsByMode(appearances),
                roster.isEmpty() ? List.of() : TeamProfile.commonLineups(appearances, graph::nameOf)
        );
    }

    /**
     * One appearance per match in which at least two members shared a side. The side holding
     * the most members decides the outcome; equal counts go to the lower side number.
     */
    static List<TeamAppearance> appearances(Set<String> members, Collection<MatchRecord> matches) {
        List<TeamAppearance> appearances = new ArrayList<>();
        for (MatchRecord match : matches) {
            List<PlayerResult> bestSide = null;
            for (List<PlayerResult> side : match.playersBySide().values()) {
                Map<String, PlayerResult> inSide = new TreeMap<>();
                side.stream()
                        .filter(p -> members.contains(p.playerId()))
                        .forEach(p -> inSide.putIfAbsent(p.playerId(), p));
                if (inSide.size() >= 2 && (bestSide == null || inSide.size() > bestSide.size())) {
                    bestSide = new ArrayList<>(inSide.values());
                }
            }
            if (bestSide != null) {
                List<String> lineup = bestSide.stream().map(PlayerResult::playerId).collect(Collectors.toList());
                appearances.add(new TeamAppearance(match.matchId(), match.gameMode(), lineup, bestSide.get(0).outcome()));
            }
        }
        return appearances;
    }
}
