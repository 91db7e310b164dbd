package com.nationrank.engine.team;

import com.nationrank.engine.EngineSettings;
import com.nationrank.engine.graph.CoOccurrenceGraph;
import com.nationrank.engine.graph.PlayerPairEdge;
import com.nationrank.engine.graph.TeamGraphBuilder;
import com.nationrank.engine.model.MatchSnapshot;

import java.util.ArrayList;
import java.util.List;

/**
 * Party teams, communities and frequent pairs over every match of a snapshot.
 * Pure function of the snapshot and the settings.
 */
public class TeamDetector {

    private final EngineSettings settings;
    private final TeamGraphBuilder graphBuilder;
    private final PartyTeamDetector parties;
    private final CommunityDetector communities;
    private final FrequentPairFinder pairs;

    public TeamDetector(EngineSettings settings) {
        this.settings = settings;
        this.graphBuilder = new TeamGraphBuilder(settings.isPartyOnlyGraph());
        this.parties = new PartyTeamDetector(settings);
        this.communities = new CommunityDetector(settings);
        this.pairs = new FrequentPairFinder(settings.getPairMinWeight());
    }

    public CoOccurrenceGraph graph(MatchSnapshot snapshot) {
        return graphBuilder.build(snapshot.getMatches());
    }

    public TeamDetectionResult detect(TeamType type, MatchSnapshot snapshot) {
        return detect(type, snapshot, graph(snapshot));
    }

    public TeamDetectionResult detect(TeamType type, MatchSnapshot snapshot, CoOccurrenceGraph graph) {
        return detect(type, snapshot, graph, settings.getTeamResultLimit());
    }

    public TeamDetectionResult detect(TeamType type, MatchSnapshot snapshot, CoOccurrenceGraph graph, int limit) {
        List<DetectedTeam> all = new ArrayList<>();
        if (type == TeamType.PARTY) {
            all.addAll(parties.detect(snapshot.getMatches(), graph));
        } else {
            all.addAll(communities.detect(snapshot.getMatches(), graph));
        }
        List<DetectedTeam> shown = all.size() > limit ? all.subList(0, limit) : all;
        return new TeamDetectionResult(type, snapshot.getWindow(), shown, all.size());
    }

    public List<PlayerPairEdge> frequentPairs(MatchSnapshot snapshot) {
        return frequentPairs(graph(snapshot));
    }

    public List<PlayerPairEdge> frequentPairs(CoOccurrenceGraph graph) {
        List<PlayerPairEdge> found = pairs.find(graph);
        return found.size() > settings.getTeamResultLimit()
                ? List.copyOf(found.subList(0, settings.getTeamResultLimit()))
                : found;
    }
}
